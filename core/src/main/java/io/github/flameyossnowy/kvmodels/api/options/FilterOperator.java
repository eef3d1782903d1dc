package io.github.flameyossnowy.kvmodels.api.options;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Operators a predicate may apply to a field value. The lower-case name is the suffix used in the
 * {@code field__operator} form.
 */
public enum FilterOperator {
    EXACT,
    IEXACT,
    CONTAINS,
    IN,
    GT,
    GTE,
    LT,
    LTE,
    STARTSWITH,
    ENDSWITH,
    ISTARTSWITH,
    IENDSWITH,
    RANGE,
    ISNULL;

    private static final Map<String, FilterOperator> BY_SUFFIX = new HashMap<>();

    static {
        for (FilterOperator operator : values()) {
            BY_SUFFIX.put(operator.suffix(), operator);
        }
    }

    public @NotNull String suffix() {
        return name().toLowerCase();
    }

    public static @Nullable FilterOperator lookup(@NotNull String suffix) {
        return BY_SUFFIX.get(suffix);
    }

    /**
     * @throws ValidationException if {@code suffix} names no operator
     */
    public static @NotNull FilterOperator fromSuffix(@NotNull String suffix) {
        FilterOperator operator = BY_SUFFIX.get(suffix);
        if (operator == null) {
            throw new ValidationException("Filter " + suffix + " not supported");
        }
        return operator;
    }
}
