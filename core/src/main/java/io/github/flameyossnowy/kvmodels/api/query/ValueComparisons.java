package io.github.flameyossnowy.kvmodels.api.query;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.DateTimeField;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * Equality and ordering across the value types fields produce.
 * <p>
 * Numbers compare by value regardless of boxing type, date-times compare as instants in UTC, and a
 * referenced instance compares by id, either against another instance of the same model or a bare id.
 */
public final class ValueComparisons {
    public static final Comparator<Object> NULLS_FIRST = Comparator.nullsFirst(ValueComparisons::compare);

    private ValueComparisons() {
    }

    public static boolean isEqual(@Nullable Object value, @Nullable Object operand) {
        if (value == null || operand == null) {
            return value == operand;
        }
        if (value instanceof Number a && operand instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b)) == 0;
        }

        OffsetDateTime left = DateTimeField.toUtc(value);
        OffsetDateTime right = DateTimeField.toUtc(operand);
        if (left != null && right != null) {
            return left.isEqual(right);
        }

        if (value instanceof ModelInstance instance) {
            return sameReference(instance, operand);
        }
        if (operand instanceof ModelInstance instance) {
            return sameReference(instance, value);
        }
        return Objects.equals(value, operand);
    }

    /**
     * @throws ValidationException if the two values have no common ordering
     */
    @SuppressWarnings({"rawtypes", "unchecked"})
    public static int compare(Object value, Object operand) {
        if (value instanceof Number a && operand instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b));
        }

        OffsetDateTime left = DateTimeField.toUtc(value);
        OffsetDateTime right = DateTimeField.toUtc(operand);
        if (left != null && right != null) {
            return left.compareTo(right);
        }

        if (value instanceof ModelInstance a && operand instanceof ModelInstance b) {
            return compare(a.getId(), b.getId());
        }
        if (value instanceof Comparable comparable && value.getClass().isInstance(operand)) {
            return comparable.compareTo(operand);
        }
        throw new ValidationException("can not compare " + describe(value) + " with " + describe(operand));
    }

    private static boolean sameReference(ModelInstance instance, Object other) {
        if (other instanceof ModelInstance otherInstance) {
            return instance.modelName().equals(otherInstance.modelName()) && Objects.equals(instance.getId(), otherInstance.getId());
        }
        if (other instanceof Number number && instance.getId() != null) {
            return isEqual(instance.getId(), number);
        }
        return false;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }

    private static String describe(Object value) {
        return value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")";
    }
}
