package io.github.flameyossnowy.kvmodels.api.meta;

import io.github.flameyossnowy.kvmodels.api.ModelLifecycleListener;
import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.FieldSpec;
import io.github.flameyossnowy.kvmodels.api.field.IdField;
import io.github.flameyossnowy.kvmodels.api.field.OpaqueField;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, immutable mapping of field name to {@link FieldSpec} for one model, always starting with the
 * numeric {@code id} field.
 * <p>
 * Schemas are built once through {@link #builder(String)} and registered explicitly with a
 * {@link io.github.flameyossnowy.kvmodels.api.ModelManager}.
 */
public final class ModelSchema {
    public static final String ID = "id";
    public static final String PATH_SEPARATOR = "__";

    private static final IdField ID_FIELD = new IdField();

    private final String name;
    private final Map<String, FieldSpec<?>> fields;
    private final List<ModelLifecycleListener> listeners;
    private final boolean opaque;

    private ModelSchema(String name, Map<String, FieldSpec<?>> fields, List<ModelLifecycleListener> listeners, boolean opaque) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(fields);
        this.listeners = List.copyOf(listeners);
        this.opaque = opaque;
    }

    public static @NotNull Builder builder(@NotNull String name) {
        return new Builder(name);
    }

    /**
     * Describes records tagged with a model the registry does not know. Every field passes its stored
     * value through unchanged.
     */
    public static @NotNull ModelSchema opaque(@NotNull String name, @NotNull Collection<String> fieldNames) {
        Map<String, FieldSpec<?>> fields = new LinkedHashMap<>();
        fields.put(ID, ID_FIELD);
        for (String fieldName : fieldNames) {
            fields.putIfAbsent(fieldName, OpaqueField.INSTANCE);
        }
        return new ModelSchema(name, fields, List.of(), true);
    }

    public @NotNull String name() {
        return name;
    }

    public @NotNull Map<String, FieldSpec<?>> fields() {
        return fields;
    }

    public @NotNull Collection<String> fieldNames() {
        return fields.keySet();
    }

    public boolean hasField(@NotNull String fieldName) {
        return fields.containsKey(fieldName);
    }

    public @Nullable FieldSpec<?> field(@NotNull String fieldName) {
        return fields.get(fieldName);
    }

    public @NotNull FieldSpec<?> requireField(@NotNull String fieldName) {
        FieldSpec<?> field = fields.get(fieldName);
        if (field == null) {
            throw new ValidationException("model " + name + " does not have a field " + fieldName);
        }
        return field;
    }

    public @NotNull List<ModelLifecycleListener> listeners() {
        return listeners;
    }

    public boolean isOpaque() {
        return opaque;
    }

    public @NotNull ModelInstance newInstance() {
        return new ModelInstance(this);
    }

    public @NotNull ModelInstance newInstance(@NotNull Map<String, ?> values) {
        return new ModelInstance(this, values);
    }

    @Override
    public String toString() {
        return "ModelSchema{" + name + ", fields=" + fields.keySet() + '}';
    }

    public static final class Builder {
        private final String name;
        private final Map<String, FieldSpec<?>> fields = new LinkedHashMap<>();
        private final List<ModelLifecycleListener> listeners = new ArrayList<>(2);

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank() || name.indexOf(':') >= 0 || name.chars().anyMatch(c -> c == '*' || c == '?' || c == '[' || c == ']')) {
                throw new ValidationException("'" + name + "' is not a valid model name");
            }
            this.name = name;
            this.fields.put(ID, ID_FIELD);
        }

        /**
         * Copies the parent's fields and listeners, in the parent's order. Fields declared afterwards with
         * the same name replace the inherited ones.
         */
        public Builder extend(@NotNull ModelSchema parent) {
            for (Map.Entry<String, FieldSpec<?>> entry : parent.fields().entrySet()) {
                if (!ID.equals(entry.getKey())) {
                    fields.put(entry.getKey(), entry.getValue());
                }
            }
            listeners.addAll(parent.listeners());
            return this;
        }

        public Builder field(@NotNull String fieldName, @NotNull FieldSpec<?> spec) {
            Objects.requireNonNull(spec, "spec");
            if (fieldName.isBlank() || fieldName.contains(PATH_SEPARATOR) || fieldName.startsWith("-")) {
                throw new ValidationException("'" + fieldName + "' is not a valid field name");
            }
            if (ID.equals(fieldName)) {
                throw new ValidationException("field 'id' is reserved in " + name);
            }
            fields.put(fieldName, spec);
            return this;
        }

        public Builder listener(@NotNull ModelLifecycleListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public ModelSchema build() {
            return new ModelSchema(name, new LinkedHashMap<>(fields), listeners, false);
        }
    }
}
