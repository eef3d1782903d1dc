package io.github.flameyossnowy.kvmodels.api.query;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.DeserializationContext;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.relationship.RelationResolver;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deserialization context of one read operation.
 * <p>
 * Referenced instances are fetched by key and remembered for the rest of the operation, so a model
 * referenced from many records is read once and reference cycles end at the instance already being loaded.
 */
final class ReadSession implements DeserializationContext, RelationResolver {
    private final QueryEngine engine;
    private final Map<String, ModelInstance> loaded = new HashMap<>();

    ReadSession(QueryEngine engine) {
        this.engine = engine;
    }

    @Override
    public boolean lenient() {
        return engine.isLenient();
    }

    @Override
    public @NotNull RelationResolver relations() {
        return this;
    }

    @Override
    public @NotNull ModelInstance resolveOne(@NotNull String modelName, long id) {
        ModelInstance cached = loaded.get(cacheKey(modelName, id));
        if (cached != null) {
            return cached;
        }

        List<ModelInstance> found = engine.fetch(engine.registry().require(modelName), List.of(id), this);
        if (found.size() != 1) {
            throw new ValidationException("Expected exactly one " + modelName + " with id " + id + ", found " + found.size());
        }
        return found.get(0);
    }

    @Override
    public @NotNull List<ModelInstance> resolveMany(@NotNull String modelName, @NotNull Collection<Long> ids) {
        Set<Long> unique = new LinkedHashSet<>(ids);
        List<ModelInstance> instances = new ArrayList<>(unique.size());
        List<Long> missing = new ArrayList<>(unique.size());
        for (Long id : unique) {
            ModelInstance cached = loaded.get(cacheKey(modelName, id));
            if (cached != null) {
                instances.add(cached);
            } else {
                missing.add(id);
            }
        }

        if (!missing.isEmpty()) {
            ModelSchema schema = engine.registry().require(modelName);
            instances.addAll(engine.fetch(schema, missing, this));
        }
        return instances;
    }

    void register(ModelInstance instance) {
        loaded.put(cacheKey(instance.modelName(), instance.getId()), instance);
    }

    private static String cacheKey(String modelName, Long id) {
        return modelName + ':' + id;
    }
}
