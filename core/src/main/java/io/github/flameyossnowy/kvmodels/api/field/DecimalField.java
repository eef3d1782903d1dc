package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;

/**
 * Written as a floating point number, read back as a {@link BigDecimal} without trailing zeros.
 * <p>
 * Only values a {@code double} holds exactly, by their shortest decimal form, can be saved; more digits
 * than that are rejected instead of being rounded on the wire.
 */
public class DecimalField extends FieldSpec<BigDecimal> {
    public DecimalField(@NotNull FieldSettings settings) {
        super(settings);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.DECIMAL;
    }

    @Override
    protected @NotNull FieldSpec<BigDecimal> withSettings(@NotNull FieldSettings settings) {
        return new DecimalField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        BigDecimal decimal;
        if (value instanceof BigDecimal given) {
            decimal = canonical(given);
        } else if (value instanceof Number number) {
            decimal = canonical(new BigDecimal(NumberField.toNumber(number).toString()));
        } else {
            throw wrongType(value, "BigDecimal, Long, Integer, Double, Float");
        }

        double written = decimal.doubleValue();
        if (Double.isInfinite(written) || canonical(BigDecimal.valueOf(written)).compareTo(decimal) != 0) {
            throw new ValidationException(decimal.toPlainString() + " can not be stored as a double without losing precision");
        }
        return decimal;
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return ((BigDecimal) normalized).doubleValue();
    }

    @Override
    protected @NotNull BigDecimal read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (raw instanceof Double || raw instanceof Float) {
            return canonical(BigDecimal.valueOf(((Number) raw).doubleValue()));
        }
        if (raw instanceof Number || raw instanceof String) {
            try {
                return canonical(new BigDecimal(raw.toString()));
            } catch (NumberFormatException e) {
                throw new ValidationException("'" + raw + "' is not a decimal", e);
            }
        }
        throw wrongType(raw, "Double");
    }

    private static BigDecimal canonical(BigDecimal decimal) {
        BigDecimal stripped = decimal.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
