package io.github.flameyossnowy.kvmodels.api.meta;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.FieldSpec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit mapping from model name to schema, filled by registration calls at startup.
 */
public final class ModelRegistry {
    private final Map<String, ModelSchema> schemas = new LinkedHashMap<>();

    /**
     * Registers a batch of schemas. References may point at models of the same batch, so
     * mutually-referencing models can be registered together.
     *
     * @throws ValidationException if a name is taken by a different schema or a reference target is unknown
     */
    public synchronized void register(@NotNull Collection<ModelSchema> batch) {
        Map<String, ModelSchema> pending = new LinkedHashMap<>();
        for (ModelSchema schema : batch) {
            ModelSchema existing = schemas.get(schema.name());
            if (existing != null && existing != schema) {
                throw new ValidationException("model " + schema.name() + " is already registered with a different schema");
            }
            ModelSchema duplicate = pending.put(schema.name(), schema);
            if (duplicate != null && duplicate != schema) {
                throw new ValidationException("model " + schema.name() + " appears twice with different schemas");
            }
        }

        for (ModelSchema schema : pending.values()) {
            for (Map.Entry<String, FieldSpec<?>> entry : schema.fields().entrySet()) {
                String target = entry.getValue().targetModel();
                if (target != null && !schemas.containsKey(target) && !pending.containsKey(target)) {
                    throw new ValidationException(
                        schema.name() + "." + entry.getKey() + " references " + target + ", which is not a registered model");
                }
            }
        }
        schemas.putAll(pending);
    }

    public synchronized @Nullable ModelSchema get(@NotNull String modelName) {
        return schemas.get(modelName);
    }

    public @NotNull ModelSchema require(@NotNull String modelName) {
        ModelSchema schema = get(modelName);
        if (schema == null) {
            throw new ValidationException(modelName + " is not a registered model");
        }
        return schema;
    }

    public synchronized boolean contains(@NotNull String modelName) {
        return schemas.containsKey(modelName);
    }

    public synchronized @NotNull List<String> names() {
        return new ArrayList<>(schemas.keySet());
    }
}
