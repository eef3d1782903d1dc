package io.github.flameyossnowy.kvmodels.api;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.DeserializationContext;
import io.github.flameyossnowy.kvmodels.api.field.FieldSpec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.Query;
import io.github.flameyossnowy.kvmodels.api.options.SelectQuery;
import io.github.flameyossnowy.kvmodels.api.query.QueryResult;
import io.github.flameyossnowy.kvmodels.api.store.KeyLayout;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Create, query, update and delete operations for one registered model.
 * <p>
 * Every operation is synchronous and issues blocking round trips to the store; {@link #async()} runs the
 * same operations on the manager's executor.
 */
public class ModelRepository {
    private final ModelManager manager;
    private final ModelSchema schema;
    private final AsyncModelRepository async;

    ModelRepository(@NotNull ModelManager manager, @NotNull ModelSchema schema) {
        this.manager = manager;
        this.schema = schema;
        this.async = new AsyncModelRepository(this, manager.executor());
    }

    public @NotNull ModelSchema schema() {
        return schema;
    }

    public @NotNull String modelName() {
        return schema.name();
    }

    public @NotNull AsyncModelRepository async() {
        return async;
    }

    // ==================== Create ====================

    public @NotNull ModelInstance newInstance() {
        return schema.newInstance();
    }

    /**
     * Builds an instance from {@code values} and saves it.
     *
     * @throws ValidationException if a key is not a field of the model or a value is invalid
     */
    public @NotNull ModelInstance create(@NotNull Map<String, ?> values) {
        for (String fieldName : values.keySet()) {
            if (!schema.hasField(fieldName)) {
                throw new ValidationException(schema.name() + " has no field " + fieldName);
            }
        }
        return save(schema.newInstance(values));
    }

    /**
     * Validates and writes an instance. An instance without an id gets the next id of the model; an
     * instance that already has one overwrites its record.
     * <p>
     * Nothing is written when a field fails validation. On success the slots hold the values as a query
     * would return them: defaults applied, numbers and dates canonical, references resolved.
     *
     * @throws ValidationException naming the model and field of the first invalid value
     */
    public @NotNull ModelInstance save(@NotNull ModelInstance instance) {
        requireOwn(instance);
        for (ModelLifecycleListener listener : schema.listeners()) {
            listener.beforeSave(instance, this);
        }

        Map<String, Object> record = new LinkedHashMap<>(schema.fields().size() * 2);
        for (Map.Entry<String, FieldSpec<?>> entry : schema.fields().entrySet()) {
            String fieldName = entry.getKey();
            if (!ModelSchema.ID.equals(fieldName)) {
                record.put(fieldName, clean(fieldName, entry.getValue(), instance.get(fieldName)));
            }
        }

        Long existing = instance.getId();
        long id;
        if (existing != null) {
            manager.idAllocator().reserve(schema.name(), existing);
            id = existing;
        } else {
            id = manager.idAllocator().nextId(schema.name());
        }
        record.put(ModelSchema.ID, id);

        String body = manager.codec().serialize(record);
        Map<String, Object> loaded = readBack(body);

        manager.store().set(manager.layout().recordKey(schema.name(), id), body);
        instance.assignId(id);
        for (Map.Entry<String, Object> entry : loaded.entrySet()) {
            instance.load(entry.getKey(), entry.getValue());
        }
        Logging.deepInfo(() -> "Saved " + instance);

        for (ModelLifecycleListener listener : schema.listeners()) {
            listener.afterSave(instance);
        }
        return instance;
    }

    // ==================== Query ====================

    public @NotNull QueryResult query() {
        return query(SelectQuery.ALL);
    }

    public @NotNull QueryResult query(@NotNull SelectQuery query) {
        return manager.queryEngine().find(schema, query);
    }

    /**
     * Queries with {@code field__path__operator} lookups, e.g. {@code Map.of("created__gte", yesterday)}.
     */
    public @NotNull QueryResult filter(@NotNull Map<String, ?> lookups) {
        return query(Query.parse(lookups));
    }

    public @NotNull Optional<ModelInstance> findById(long id) {
        List<ModelInstance> found = manager.queryEngine().fetch(schema, List.of(id));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public long count() {
        return count(SelectQuery.ALL);
    }

    public long count(@NotNull SelectQuery query) {
        return manager.queryEngine().count(schema, query);
    }

    // ==================== Update ====================

    /**
     * Updates every instance of the model.
     *
     * @return the updated instances as stored
     */
    public @NotNull List<ModelInstance> update(@NotNull Map<String, ?> values) {
        return update(SelectQuery.ALL, values);
    }

    public @NotNull List<ModelInstance> update(@NotNull SelectQuery query, @NotNull Map<String, ?> values) {
        return updateByIds(query(query).asMap().keySet(), values);
    }

    public @NotNull List<ModelInstance> update(@NotNull ModelInstance instance, @NotNull Map<String, ?> values) {
        return update(List.of(instance), values);
    }

    /**
     * Rewrites only the given fields of each instance's record and carries over every other stored value.
     * The instances passed in are left untouched.
     *
     * @throws ValidationException if an instance is unsaved or of another model, or if a value is invalid
     */
    public @NotNull List<ModelInstance> update(@NotNull Collection<ModelInstance> instances, @NotNull Map<String, ?> values) {
        return updateByIds(idsOf(instances), values);
    }

    private List<ModelInstance> updateByIds(Collection<Long> ids, Map<String, ?> values) {
        Map<String, Object> cleaned = new LinkedHashMap<>(values.size() * 2);
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String fieldName = entry.getKey();
            if (ModelSchema.ID.equals(fieldName)) {
                throw new ValidationException("id of " + schema.name() + " can not be updated");
            }
            FieldSpec<?> spec = schema.requireField(fieldName);
            cleaned.put(fieldName, clean(fieldName, spec, entry.getValue()));
        }
        if (ids.isEmpty()) {
            return new ArrayList<>(0);
        }

        KeyLayout layout = manager.layout();
        Map<String, String> writes = new LinkedHashMap<>(ids.size() * 2);
        List<Long> written = new ArrayList<>(ids.size());
        for (Long id : ids) {
            Map<String, Object> stored = manager.queryEngine().readRaw(schema.name(), id);
            if (stored == null) {
                Logging.warn(schema.name() + " " + id + " no longer exists, skipping update");
                continue;
            }

            Map<String, Object> record = new LinkedHashMap<>(stored);
            record.putAll(cleaned);
            record.put(ModelSchema.ID, id);
            String body = manager.codec().serialize(record);
            readBack(body);
            writes.put(layout.recordKey(schema.name(), id), body);
            written.add(id);
        }

        if (!writes.isEmpty()) {
            manager.store().multiSet(writes);
        }
        Logging.deepInfo(() -> "Updated " + written.size() + " " + schema.name() + " records with " + cleaned.keySet());
        return manager.queryEngine().fetch(schema, written);
    }

    // ==================== Delete ====================

    /**
     * Deletes every instance of the model.
     *
     * @return the number of records removed
     */
    public long delete() {
        List<String> keys = manager.queryEngine().recordKeys(schema.name());
        List<Long> ids = new ArrayList<>(keys.size());
        for (String key : keys) {
            KeyLayout.RecordKey parsed = manager.layout().parse(key);
            if (parsed != null && parsed.id() != null) {
                ids.add(parsed.id());
            }
        }
        return deleteKeys(keys, ids);
    }

    public long delete(@NotNull ModelInstance instance) {
        return delete(List.of(instance));
    }

    /**
     * Deletes the records of the given instances. References to them from other records are left as they are.
     *
     * @throws ValidationException if an instance is unsaved or of another model
     */
    public long delete(@NotNull Collection<ModelInstance> instances) {
        return deleteByIds(idsOf(instances));
    }

    public long delete(@NotNull SelectQuery query) {
        return deleteByIds(query(query).asMap().keySet());
    }

    public long deleteByIds(@NotNull Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        List<String> keys = new ArrayList<>(ids.size());
        for (Long id : ids) {
            keys.add(manager.layout().recordKey(schema.name(), id));
        }
        return deleteKeys(keys, new ArrayList<>(ids));
    }

    private long deleteKeys(List<String> keys, List<Long> ids) {
        if (keys.isEmpty()) {
            return 0;
        }
        long removed = manager.store().delete(keys);
        Logging.deepInfo(() -> "Deleted " + removed + " " + schema.name() + " records");

        for (ModelLifecycleListener listener : schema.listeners()) {
            listener.afterDelete(schema.name(), ids);
        }
        return removed;
    }

    // ==================== Internals ====================

    private Object clean(String fieldName, FieldSpec<?> spec, Object value) {
        try {
            return spec.clean(value);
        } catch (ValidationException e) {
            throw ValidationException.inField(schema.name(), fieldName, e);
        }
    }

    /**
     * Decodes a record body the way a query would, which resolves its references.
     */
    private Map<String, Object> readBack(String body) {
        @SuppressWarnings("unchecked")
        Map<String, Object> raw = manager.codec().deserialize(body, Map.class);
        DeserializationContext context = manager.queryEngine().readContext();

        Map<String, Object> loaded = new LinkedHashMap<>(raw.size() * 2);
        for (Map.Entry<String, FieldSpec<?>> entry : schema.fields().entrySet()) {
            String fieldName = entry.getKey();
            if (ModelSchema.ID.equals(fieldName)) {
                continue;
            }
            try {
                loaded.put(fieldName, entry.getValue().deserialize(raw.get(fieldName), context));
            } catch (ValidationException e) {
                throw ValidationException.inField(schema.name(), fieldName, e);
            }
        }
        return loaded;
    }

    private Set<Long> idsOf(Collection<ModelInstance> instances) {
        Set<Long> ids = new LinkedHashSet<>(instances.size() * 2);
        for (ModelInstance instance : instances) {
            if (instance == null) {
                throw new ValidationException("Expected " + schema.name() + " instances, got null");
            }
            requireOwn(instance);
            Long id = instance.getId();
            if (id == null) {
                throw new ValidationException(schema.name() + " instance has not been saved");
            }
            ids.add(id);
        }
        return ids;
    }

    private void requireOwn(ModelInstance instance) {
        if (!instance.modelName().equals(schema.name())) {
            throw new ValidationException("Expected " + schema.name() + " instances, got " + instance.modelName());
        }
    }

    @Override
    public String toString() {
        return "ModelRepository{" + schema.name() + '}';
    }
}
