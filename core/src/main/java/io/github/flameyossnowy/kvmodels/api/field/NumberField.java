package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

/**
 * Integral values are kept as {@code Long}, fractional ones as {@code Double}. Nothing else is accepted,
 * not even numeric strings on the way in.
 */
public class NumberField extends FieldSpec<Number> {
    public NumberField(@NotNull FieldSettings settings) {
        super(settings);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.NUMBER;
    }

    @Override
    protected @NotNull FieldSpec<Number> withSettings(@NotNull FieldSettings settings) {
        return new NumberField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        return toNumber(value);
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return normalized;
    }

    @Override
    protected @NotNull Number read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (raw instanceof String text) {
            try {
                return text.indexOf('.') >= 0 ? toNumber(Double.parseDouble(text)) : Long.valueOf(Long.parseLong(text));
            } catch (NumberFormatException e) {
                throw new ValidationException("'" + text + "' is not a number", e);
            }
        }
        return toNumber(raw);
    }

    static @NotNull Number toNumber(@NotNull Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValidationException(value + " is not a finite number");
            }
            return d;
        }
        throw wrongType(value, "Long, Integer, Short, Byte, Double, Float");
    }
}
