package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Typed contract for a single attribute of a model: validation, default resolution, serialization
 * ({@link #clean(Object)}) and deserialization ({@link #deserialize(Object, DeserializationContext)}).
 * <p>
 * Specs are immutable. The fluent modifiers return a modified copy, so one spec can be the prototype
 * of several fields without sharing state.
 *
 * @param <V> the typed value produced by deserialization
 */
public abstract class FieldSpec<V> {
    protected final FieldSettings settings;

    protected FieldSpec(@NotNull FieldSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public abstract @NotNull FieldKind kind();

    /**
     * Creates a copy of this spec that uses {@code settings}.
     */
    protected abstract @NotNull FieldSpec<V> withSettings(@NotNull FieldSettings settings);

    /**
     * Validates an in-memory value and brings it into its canonical form.
     *
     * @throws ValidationException if the value has the wrong type
     */
    protected abstract @NotNull Object normalize(@NotNull Object value);

    /**
     * Turns a canonical value into the primitive written to the record.
     */
    protected abstract @NotNull Object serialize(@NotNull Object normalized);

    /**
     * Turns a stored primitive back into a typed value.
     *
     * @throws ValidationException if the stored value cannot be read as this kind
     */
    protected abstract @NotNull V read(@NotNull Object raw, @NotNull DeserializationContext context);

    // ==================== Declaration ====================

    @Contract(pure = true)
    public @NotNull FieldSpec<V> defaultValue(@Nullable Object value) {
        return withSettings(settings.withDefault(value == null ? null : () -> value));
    }

    @Contract(pure = true)
    public @NotNull FieldSpec<V> defaultGenerator(@NotNull Supplier<?> generator) {
        return withSettings(settings.withDefault(generator));
    }

    /**
     * Restricts the field to the keys of {@code choices}. Keys are normalized like values.
     */
    @Contract(pure = true)
    public @NotNull FieldSpec<V> choices(@NotNull Map<?, String> choices) {
        Map<Object, String> normalized = new LinkedHashMap<>(choices.size());
        for (Map.Entry<?, String> entry : choices.entrySet()) {
            normalized.put(normalize(Objects.requireNonNull(entry.getKey(), "choice key")), entry.getValue());
        }
        return withSettings(settings.withChoices(normalized));
    }

    @Contract(pure = true)
    public @NotNull FieldSpec<V> notNull() {
        return withSettings(settings.withNullable(false));
    }

    @Contract(pure = true)
    public @NotNull FieldSpec<V> nullable(boolean nullable) {
        return withSettings(settings.withNullable(nullable));
    }

    public boolean isNullable() {
        return settings.nullable();
    }

    public @Nullable Map<Object, String> choices() {
        return settings.choices();
    }

    public @NotNull FieldSettings settings() {
        return settings;
    }

    public boolean isReference() {
        return false;
    }

    /**
     * The model a reference field points at, {@code null} for every other kind.
     */
    public @Nullable String targetModel() {
        return null;
    }

    // ==================== Contract ====================

    /**
     * Resolves the default when {@code value} is null, validates nullability, type and choices, and
     * returns the serializable form.
     *
     * @throws ValidationException if null is disallowed and nothing resolves, if the value has the wrong
     *                             type, or if it is not one of the choices
     */
    public final @Nullable Object clean(@Nullable Object value) {
        Object resolved = value != null ? value : settings.resolveDefault();
        if (resolved == null) {
            if (!settings.nullable()) {
                throw new ValidationException("null is not allowed");
            }
            return null;
        }

        Object normalized = normalize(resolved);
        Map<Object, String> choices = settings.choices();
        if (choices != null && !choices.containsKey(normalized)) {
            throw new ValidationException(normalized + " is not allowed. Allowed values: " + choices.keySet());
        }
        return serialize(normalized);
    }

    /**
     * Converts a value read from the store.
     * <p>
     * A null in a non-nullable field is logged; it is then returned as null in lenient mode and raised
     * otherwise.
     */
    public final @Nullable V deserialize(@Nullable Object raw, @NotNull DeserializationContext context) {
        if (raw == null) {
            if (!settings.nullable()) {
                Logging.warn("null can not be deserialized as " + kind() + ", ignoring");
                if (!context.lenient()) {
                    throw new ValidationException("null can not be deserialized as " + kind());
                }
            }
            return null;
        }
        return read(raw, context);
    }

    protected static ValidationException wrongType(@NotNull Object value, @NotNull String allowed) {
        return new ValidationException(value + " has type: " + value.getClass().getSimpleName() + ". Allowed only: " + allowed);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{nullable=" + settings.nullable()
            + (settings.choices() == null ? "" : ", choices=" + settings.choices().keySet()) + '}';
    }
}
