package io.github.flameyossnowy.kvmodels.api.query;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.kvmodels.api.field.DeserializationContext;
import io.github.flameyossnowy.kvmodels.api.field.FieldSpec;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelRegistry;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.FilterOption;
import io.github.flameyossnowy.kvmodels.api.options.SelectQuery;
import io.github.flameyossnowy.kvmodels.api.options.SortOption;
import io.github.flameyossnowy.kvmodels.api.options.SortOrder;
import io.github.flameyossnowy.kvmodels.api.relationship.RelationResolver;
import io.github.flameyossnowy.kvmodels.api.store.KeyEnumeration;
import io.github.flameyossnowy.kvmodels.api.store.KeyLayout;
import io.github.flameyossnowy.kvmodels.api.store.KeyValueStore;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads records of a model from the store, deserializes them and keeps those matching every predicate.
 * <p>
 * There is no index: every query enumerates the keys under {@code <prefix>:<model>:*}, fetches their
 * bodies in one batch, and evaluates predicates in memory. Fields are deserialized in schema order and a
 * record is dropped as soon as one predicate on an already-deserialized field fails, so references of
 * later fields are never resolved for rejected records.
 */
public final class QueryEngine {
    private final KeyValueStore store;
    private final KeyLayout layout;
    private final ModelRegistry registry;
    private final JsonCodec codec;
    private final boolean lenient;
    private final KeyEnumeration keyEnumeration;

    public QueryEngine(@NotNull KeyValueStore store,
                       @NotNull KeyLayout layout,
                       @NotNull ModelRegistry registry,
                       @NotNull JsonCodec codec,
                       boolean lenient,
                       @NotNull KeyEnumeration keyEnumeration) {
        this.store = store;
        this.layout = layout;
        this.registry = registry;
        this.codec = codec;
        this.lenient = lenient;
        this.keyEnumeration = keyEnumeration;
    }

    public boolean isLenient() {
        return lenient;
    }

    public @NotNull ModelRegistry registry() {
        return registry;
    }

    /**
     * A resolver that fetches referenced instances by key. Each call of a returned resolver shares one cache.
     */
    public @NotNull RelationResolver relations() {
        return new ReadSession(this);
    }

    /**
     * A fresh context for deserializing stored values outside a query, e.g. when a saved record is read back.
     */
    public @NotNull DeserializationContext readContext() {
        return new ReadSession(this);
    }

    // ==================== Queries ====================

    /**
     * Queries a model by name. A name that is not registered is read with a pass-through schema in lenient
     * mode and rejected otherwise.
     */
    public @NotNull QueryResult find(@NotNull String modelName, @NotNull SelectQuery query) {
        ModelSchema schema = registry.get(modelName);
        if (schema == null) {
            schema = unresolvedModel(modelName);
        }
        return find(schema, query);
    }

    public @NotNull QueryResult find(@NotNull ModelSchema schema, @NotNull SelectQuery query) {
        validate(schema, query);

        Map<String, List<FilterOption>> filtersByField = new HashMap<>();
        for (FilterOption filter : query.filters()) {
            filtersByField.computeIfAbsent(filter.fieldName(), k -> new ArrayList<>(2)).add(filter);
        }

        List<String> keys = recordKeys(schema.name());
        Logging.deepInfo(() -> "Querying " + schema.name() + " over " + keys.size() + " keys with " + query);

        List<ModelInstance> results = new ArrayList<>();
        if (keys.isEmpty()) {
            return new QueryResult(schema, results);
        }

        ReadSession session = new ReadSession(this);
        List<String> bodies = store.multiGet(keys);
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            String body = bodies.get(i);
            if (body == null) {
                // removed between enumeration and fetch
                continue;
            }

            Long id = recordId(key);
            if (id == null) {
                continue;
            }
            Map<String, Object> raw = decode(key, body);
            if (raw == null) {
                continue;
            }

            ModelSchema recordSchema = schema.isOpaque() ? ModelSchema.opaque(schema.name(), raw.keySet()) : schema;
            ModelInstance instance = materialize(recordSchema, id, raw, filtersByField, session, false);
            if (instance != null) {
                results.add(instance);
            }
        }

        if (!query.sortOptions().isEmpty()) {
            results.sort(comparator(schema, query.sortOptions()));
        }
        if (query.hasLimit() && results.size() > query.limit()) {
            results = new ArrayList<>(results.subList(0, query.limit()));
        }
        return new QueryResult(schema, results);
    }

    public long count(@NotNull ModelSchema schema, @NotNull SelectQuery query) {
        if (query.filters().isEmpty() && !query.hasLimit()) {
            return recordKeys(schema.name()).size();
        }
        return find(schema, query).count();
    }

    /**
     * Fetches instances by id. Missing ids are skipped, so the result may be shorter than {@code ids}.
     */
    public @NotNull List<ModelInstance> fetch(@NotNull ModelSchema schema, @NotNull Collection<Long> ids) {
        return fetch(schema, ids, new ReadSession(this));
    }

    List<ModelInstance> fetch(ModelSchema schema, Collection<Long> ids, ReadSession session) {
        List<Long> unique = new ArrayList<>(new LinkedHashSet<>(ids));
        List<String> keys = new ArrayList<>(unique.size());
        for (Long id : unique) {
            keys.add(layout.recordKey(schema.name(), id));
        }

        List<String> bodies = store.multiGet(keys);
        List<ModelInstance> instances = new ArrayList<>(unique.size());
        for (int i = 0; i < keys.size(); i++) {
            String body = bodies.get(i);
            if (body == null) {
                continue;
            }
            Map<String, Object> raw = decode(keys.get(i), body);
            if (raw == null) {
                continue;
            }
            instances.add(materialize(schema, unique.get(i), raw, Map.of(), session, true));
        }
        return instances;
    }

    /**
     * Reads the stored primitives of one record without deserializing them.
     *
     * @return {@code null} if the record does not exist or could not be decoded in lenient mode
     */
    public @Nullable Map<String, Object> readRaw(@NotNull String modelName, long id) {
        String key = layout.recordKey(modelName, id);
        String body = store.get(key);
        return body == null ? null : decode(key, body);
    }

    /**
     * Enumerates the record keys of a model with the configured {@link KeyEnumeration}, without duplicates.
     */
    public @NotNull List<String> recordKeys(@NotNull String modelName) {
        String pattern = layout.recordPattern(modelName);
        if (keyEnumeration == KeyEnumeration.KEYS) {
            return new ArrayList<>(new LinkedHashSet<>(store.listKeys(pattern)));
        }

        Set<String> keys = new LinkedHashSet<>();
        Iterator<String> iterator = store.scanKeys(pattern);
        while (iterator.hasNext()) {
            keys.add(iterator.next());
        }
        return new ArrayList<>(keys);
    }

    /**
     * Checks every filter path and sort field against the schema and the referenced schemas.
     *
     * @throws ValidationException on the first unknown field or on a path that continues past a non-reference
     */
    public void validate(@NotNull ModelSchema schema, @NotNull SelectQuery query) {
        if (schema.isOpaque()) {
            return;
        }

        for (FilterOption filter : query.filters()) {
            ModelSchema current = schema;
            List<String> path = filter.path();
            for (int i = 0; i < path.size(); i++) {
                String segment = path.get(i);
                FieldSpec<?> spec = current.field(segment);
                if (spec == null) {
                    throw new ValidationException(i == 0
                        ? "model " + current.name() + " does not have a field " + segment
                        : "Filter " + filter + " not supported: " + current.name() + " has no field " + segment);
                }
                if (i < path.size() - 1) {
                    if (!spec.isReference()) {
                        throw new ValidationException("Filter " + path.get(i + 1) + " not supported on "
                            + current.name() + "." + segment + ", which is not a reference");
                    }
                    current = registry.require(spec.targetModel());
                }
            }
        }

        for (SortOption sort : query.sortOptions()) {
            schema.requireField(sort.field());
        }
    }

    static Comparator<ModelInstance> comparator(ModelSchema schema, List<SortOption> sortOptions) {
        Comparator<ModelInstance> comparator = null;
        for (SortOption sort : sortOptions) {
            if (!schema.isOpaque()) {
                schema.requireField(sort.field());
            }
            String field = sort.field();
            Comparator<ModelInstance> next = Comparator.comparing(instance -> instance.get(field), ValueComparisons.NULLS_FIRST);
            if (sort.order() == SortOrder.DESCENDING) {
                next = next.reversed();
            }
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator == null ? (a, b) -> 0 : comparator;
    }

    // ==================== Decoding ====================

    private @Nullable ModelInstance materialize(ModelSchema schema,
                                                long id,
                                                Map<String, Object> raw,
                                                Map<String, List<FilterOption>> filtersByField,
                                                ReadSession session,
                                                boolean cache) {
        ModelInstance instance = new ModelInstance(schema);
        instance.assignId(id);
        if (cache) {
            session.register(instance);
        }

        for (Map.Entry<String, FieldSpec<?>> entry : schema.fields().entrySet()) {
            String fieldName = entry.getKey();
            Object value;
            if (ModelSchema.ID.equals(fieldName)) {
                value = id;
            } else {
                try {
                    value = entry.getValue().deserialize(raw.get(fieldName), session);
                } catch (ValidationException e) {
                    throw ValidationException.inField(schema.name(), fieldName, e);
                }
                instance.load(fieldName, value);
            }

            List<FilterOption> filters = filtersByField.get(fieldName);
            if (filters == null) {
                continue;
            }
            for (FilterOption filter : filters) {
                if (!FilterEvaluator.test(filter, value)) {
                    return null;
                }
            }
        }
        return instance;
    }

    private @Nullable Long recordId(String key) {
        KeyLayout.RecordKey parsed = layout.parse(key);
        Long id = parsed == null ? null : parsed.id();
        if (id == null) {
            Logging.warn("Key " + key + " is not a record key, ignoring");
            if (!lenient) {
                throw new ValidationException("Key " + key + " is not a record key");
            }
        }
        return id;
    }

    @SuppressWarnings("unchecked")
    private @Nullable Map<String, Object> decode(String key, String body) {
        try {
            Object decoded = codec.deserialize(body, Object.class);
            if (decoded instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            Logging.warn("Record " + key + " is not a JSON object, ignoring");
            if (!lenient) {
                throw new ValidationException("Record " + key + " is not a JSON object");
            }
            return null;
        } catch (JsonProcessException e) {
            Logging.warn("Record " + key + " could not be decoded: " + e.getMessage());
            if (!lenient) {
                throw new ValidationException("Record " + key + " could not be decoded", e);
            }
            return null;
        }
    }

    private ModelSchema unresolvedModel(String modelName) {
        Logging.warn("Model " + modelName + " is not registered");
        if (!lenient) {
            throw new ValidationException(modelName + " is not a registered model");
        }
        return ModelSchema.opaque(modelName, List.of());
    }
}
