package io.github.flameyossnowy.kvmodels.api.meta;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * A live object of some model: one value slot per schema field plus the model name.
 * <p>
 * The slot map is the only source of truth; {@link #get(String)} and {@link #set(String, Object)} go
 * straight to it. The {@code id} slot is filled once, on the first successful save, and never changes.
 */
public class ModelInstance {
    private final ModelSchema schema;
    private final Map<String, Object> values;

    public ModelInstance(@NotNull ModelSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.values = new LinkedHashMap<>(schema.fields().size() * 2);
        for (String fieldName : schema.fieldNames()) {
            values.put(fieldName, null);
        }
    }

    public ModelInstance(@NotNull ModelSchema schema, @NotNull Map<String, ?> values) {
        this(schema);
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            set(entry.getKey(), entry.getValue());
        }
    }

    public @NotNull String modelName() {
        return schema.name();
    }

    public @NotNull ModelSchema schema() {
        return schema;
    }

    public @Nullable Long getId() {
        return (Long) values.get(ModelSchema.ID);
    }

    public boolean has(@NotNull String fieldName) {
        return values.containsKey(fieldName);
    }

    public @Nullable Object get(@NotNull String fieldName) {
        requireKnown(fieldName);
        return values.get(fieldName);
    }

    public <V> @Nullable V get(@NotNull String fieldName, @NotNull Class<V> type) {
        Object value = get(fieldName);
        if (value != null && !type.isInstance(value)) {
            throw new ValidationException(modelName() + "." + fieldName + " holds " + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    /**
     * Writes one slot. The value is validated when the instance is saved.
     *
     * @throws ValidationException if the field is unknown, or if an assigned id would change
     */
    public ModelInstance set(@NotNull String fieldName, @Nullable Object value) {
        requireKnown(fieldName);
        if (ModelSchema.ID.equals(fieldName)) {
            setId(value);
            return this;
        }
        values.put(fieldName, value);
        return this;
    }

    /**
     * Read-only view of all slots in schema order.
     */
    public @NotNull Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Fills the id slot after allocation.
     */
    @ApiStatus.Internal
    public void assignId(long id) {
        Long current = getId();
        if (current != null && current != id) {
            throw new IllegalStateException(modelName() + " already has id " + current);
        }
        values.put(ModelSchema.ID, id);
    }

    /**
     * Replaces a slot with a value that was just serialized and read back, bypassing the id guard.
     */
    @ApiStatus.Internal
    public void load(@NotNull String fieldName, @Nullable Object value) {
        values.put(fieldName, value);
    }

    private void setId(@Nullable Object value) {
        Long current = getId();
        Long next;
        if (value == null) {
            next = null;
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            next = ((Number) value).longValue();
        } else {
            throw new ValidationException(value + " is not a valid id for " + modelName());
        }

        if (current != null && !current.equals(next)) {
            throw new ValidationException(modelName() + " id " + current + " can not be changed");
        }
        values.put(ModelSchema.ID, next);
    }

    private void requireKnown(String fieldName) {
        if (!values.containsKey(fieldName)) {
            throw new ValidationException(modelName() + " has no field " + fieldName);
        }
    }

    /**
     * Slots are compared one by one. Referenced instances count as equal when they share model and id,
     * so cyclic graphs compare without descending into each other.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelInstance other)) return false;
        if (!modelName().equals(other.modelName()) || !values.keySet().equals(other.values.keySet())) {
            return false;
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!sameValue(entry.getValue(), other.values.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelName(), getId());
    }

    /**
     * Referenced instances are rendered as {@code Model#id}.
     */
    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", modelName() + "{", "}");
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            joiner.add(entry.getKey() + "=" + render(entry.getValue()));
        }
        return joiner.toString();
    }

    private static boolean sameValue(@Nullable Object a, @Nullable Object b) {
        if (a instanceof ModelInstance left && b instanceof ModelInstance right) {
            return left == right || (left.getId() != null
                && left.modelName().equals(right.modelName())
                && left.getId().equals(right.getId()));
        }
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!sameValue(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    private static Object render(@Nullable Object value) {
        if (value instanceof ModelInstance instance) {
            return instance.modelName() + "#" + instance.getId();
        }
        if (value instanceof List<?> list) {
            List<Object> rendered = new ArrayList<>(list.size());
            for (Object element : list) {
                rendered.add(render(element));
            }
            return rendered;
        }
        return value;
    }
}
