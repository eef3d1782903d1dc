package io.github.flameyossnowy.kvmodels.api.query;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.options.FilterOperator;
import io.github.flameyossnowy.kvmodels.api.options.FilterOption;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates one predicate against the deserialized value of its top-level field.
 * <p>
 * Nested path elements are resolved by indexing into the referenced instance. A null link ends the chain:
 * the predicate then fails, except {@code isnull=true}, which holds.
 * Through a reference list, the predicate holds if it holds for any referenced instance.
 */
public final class FilterEvaluator {
    private FilterEvaluator() {
    }

    public static boolean test(@NotNull FilterOption filter, @Nullable Object fieldValue) {
        return testPath(filter, fieldValue, filter.nestedPath());
    }

    private static boolean testPath(FilterOption filter, @Nullable Object value, List<String> remaining) {
        if (remaining.isEmpty()) {
            return apply(filter.operator(), value, filter.operand());
        }
        if (value == null) {
            return brokenChain(filter);
        }

        if (value instanceof ModelInstance instance) {
            String next = remaining.get(0);
            if (!instance.has(next)) {
                throw new ValidationException(instance.modelName() + " has no field " + next);
            }
            return testPath(filter, instance.get(next), remaining.subList(1, remaining.size()));
        }

        if (value instanceof Collection<?> related && allInstances(related)) {
            if (related.isEmpty()) {
                return brokenChain(filter);
            }
            for (Object element : related) {
                if (testPath(filter, element, remaining)) {
                    return true;
                }
            }
            return false;
        }

        throw new ValidationException(value.getClass().getSimpleName() + " has no field " + remaining.get(0));
    }

    private static boolean brokenChain(FilterOption filter) {
        return filter.operator() == FilterOperator.ISNULL && Boolean.TRUE.equals(filter.operand());
    }

    static boolean apply(@NotNull FilterOperator operator, @Nullable Object value, @Nullable Object operand) {
        return switch (operator) {
            case EXACT -> ValueComparisons.isEqual(value, operand);
            case IEXACT -> value == null || operand == null
                ? value == operand
                : lower(value).equals(lower(operand));
            case CONTAINS -> value != null && contains(value, operand);
            case IN -> containsElement(asCollection(operand, operator), value);
            case GT -> value != null && operand != null && ValueComparisons.compare(value, operand) > 0;
            case GTE -> value != null && operand != null && ValueComparisons.compare(value, operand) >= 0;
            case LT -> value != null && operand != null && ValueComparisons.compare(value, operand) < 0;
            case LTE -> value != null && operand != null && ValueComparisons.compare(value, operand) <= 0;
            case STARTSWITH -> value != null && operand != null && text(value).startsWith(text(operand));
            case ENDSWITH -> value != null && operand != null && text(value).endsWith(text(operand));
            case ISTARTSWITH -> value != null && operand != null && lower(value).startsWith(lower(operand));
            case IENDSWITH -> value != null && operand != null && lower(value).endsWith(lower(operand));
            case RANGE -> value != null && inRange(value, operand);
            case ISNULL -> (value == null) == (Boolean) operand;
        };
    }

    private static boolean contains(Object value, @Nullable Object operand) {
        if (value instanceof String text) {
            return operand != null && text.contains(operand.toString());
        }
        if (value instanceof Collection<?> collection) {
            return containsElement(collection, operand);
        }
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(operand);
        }
        throw new ValidationException("contains is not supported on " + value.getClass().getSimpleName());
    }

    private static boolean containsElement(Collection<?> collection, @Nullable Object candidate) {
        for (Object element : collection) {
            if (ValueComparisons.isEqual(element, candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A single number {@code n} is the span {@code [0, n)}; a pair {@code [start, end]} is inclusive.
     */
    private static boolean inRange(Object value, @Nullable Object operand) {
        if (operand instanceof Number end) {
            return ValueComparisons.compare(value, 0L) >= 0 && ValueComparisons.compare(value, end) < 0;
        }

        Collection<?> bounds = asCollection(operand, FilterOperator.RANGE);
        if (bounds.size() != 2) {
            throw new ValidationException("range expects [start, end], got " + operand);
        }
        Object[] pair = bounds.toArray();
        return ValueComparisons.compare(value, pair[0]) >= 0 && ValueComparisons.compare(value, pair[1]) <= 0;
    }

    private static Collection<?> asCollection(@Nullable Object operand, FilterOperator operator) {
        if (operand instanceof Collection<?> collection) {
            return collection;
        }
        if (operand instanceof Object[] array) {
            return Arrays.asList(array);
        }
        throw new ValidationException(operator.suffix() + " expects a collection operand, got " + operand);
    }

    private static boolean allInstances(Collection<?> collection) {
        for (Object element : collection) {
            if (!(element instanceof ModelInstance)) {
                return false;
            }
        }
        return true;
    }

    private static String text(Object value) {
        if (value instanceof String text) {
            return text;
        }
        throw new ValidationException(value + " is not a string");
    }

    private static String lower(Object value) {
        return text(value).toLowerCase(Locale.ROOT);
    }
}
