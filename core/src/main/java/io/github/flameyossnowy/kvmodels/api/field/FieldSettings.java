package io.github.flameyossnowy.kvmodels.api.field;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The model-independent part of a field declaration.
 *
 * @param defaultValue generator invoked whenever a field is cleaned without a value
 * @param choices      allowed values mapped to their labels, or {@code null} for no restriction
 * @param nullable     whether the field may be stored as null
 */
public record FieldSettings(
    @Nullable Supplier<?> defaultValue,
    @Nullable Map<Object, String> choices,
    boolean nullable
) {
    public static final FieldSettings DEFAULT = new FieldSettings(null, null, true);

    public FieldSettings {
        if (choices != null) {
            choices = Collections.unmodifiableMap(new LinkedHashMap<>(choices));
        }
    }

    public FieldSettings withDefault(@Nullable Supplier<?> defaultValue) {
        return new FieldSettings(defaultValue, choices, nullable);
    }

    public FieldSettings withChoices(@Nullable Map<Object, String> choices) {
        return new FieldSettings(defaultValue, choices, nullable);
    }

    public FieldSettings withNullable(boolean nullable) {
        return new FieldSettings(defaultValue, choices, nullable);
    }

    public @Nullable Object resolveDefault() {
        return defaultValue == null ? null : defaultValue.get();
    }
}
