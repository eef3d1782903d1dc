package io.github.flameyossnowy.kvmodels.api.options;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Field-scoped operator builder.
 *
 * <p>Ensures operators are attached to a concrete field path and prevents malformed filter construction.</p>
 */
@SuppressWarnings("unused")
public class QueryField {
    private final SelectQuery.SelectQueryBuilder builder;
    private final List<String> path;

    @Contract(pure = true)
    QueryField(SelectQuery.SelectQueryBuilder builder, List<String> path) {
        this.builder = builder;
        this.path = List.copyOf(path);
    }

    private SelectQuery.SelectQueryBuilder add(FilterOperator operator, Object value) {
        builder.addFilter(new FilterOption(path, operator, value));
        return builder;
    }

    public SelectQuery.SelectQueryBuilder eq(Object value) { return add(FilterOperator.EXACT, value); }

    public SelectQuery.SelectQueryBuilder iexact(String value) { return add(FilterOperator.IEXACT, value); }

    public SelectQuery.SelectQueryBuilder contains(Object value) { return add(FilterOperator.CONTAINS, value); }

    public SelectQuery.SelectQueryBuilder in(@NotNull Collection<?> values) { return add(FilterOperator.IN, values); }

    public SelectQuery.SelectQueryBuilder gt(Object value) { return add(FilterOperator.GT, value); }

    public SelectQuery.SelectQueryBuilder gte(Object value) { return add(FilterOperator.GTE, value); }

    public SelectQuery.SelectQueryBuilder lt(Object value) { return add(FilterOperator.LT, value); }

    public SelectQuery.SelectQueryBuilder lte(Object value) { return add(FilterOperator.LTE, value); }

    public SelectQuery.SelectQueryBuilder startsWith(String prefix) { return add(FilterOperator.STARTSWITH, prefix); }

    public SelectQuery.SelectQueryBuilder endsWith(String suffix) { return add(FilterOperator.ENDSWITH, suffix); }

    public SelectQuery.SelectQueryBuilder iStartsWith(String prefix) { return add(FilterOperator.ISTARTSWITH, prefix); }

    public SelectQuery.SelectQueryBuilder iEndsWith(String suffix) { return add(FilterOperator.IENDSWITH, suffix); }

    /**
     * Inclusive span {@code [start, end]}.
     */
    public SelectQuery.SelectQueryBuilder range(Number start, Number end) { return add(FilterOperator.RANGE, List.of(start, end)); }

    /**
     * Half-open span {@code [0, end)}.
     */
    public SelectQuery.SelectQueryBuilder range(Number end) { return add(FilterOperator.RANGE, end); }

    public SelectQuery.SelectQueryBuilder isNull(boolean isNull) { return add(FilterOperator.ISNULL, isNull); }
}
