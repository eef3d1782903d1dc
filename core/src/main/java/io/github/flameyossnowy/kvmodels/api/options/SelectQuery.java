package io.github.flameyossnowy.kvmodels.api.options;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable description of a query: predicates (all must hold), sort order and an optional limit.
 *
 * <p>Instances should be constructed through {@link SelectQueryBuilder} or {@link Query#parse(java.util.Map)}.</p>
 */
public record SelectQuery(
    List<FilterOption> filters,
    List<SortOption> sortOptions,
    int limit
) implements Query {
    public static final SelectQuery ALL = new SelectQuery(List.of(), List.of(), -1);

    public SelectQuery {
        filters = List.copyOf(filters);
        sortOptions = List.copyOf(sortOptions);
    }

    public boolean hasLimit() {
        return limit >= 0;
    }

    /**
     * Fluent builder for {@link SelectQuery}.
     *
     * <pre>{@code
     * Query.select()
     *   .where("token").eq(token)
     *   .where("created").gte(yesterday)
     *   .where("nested", "target", "status").iexact("OK")
     *   .orderBy("-created")
     *   .build();
     * }</pre>
     */
    public static class SelectQueryBuilder {
        private final List<FilterOption> filters = new ArrayList<>();
        private final List<SortOption> sortOptions = new ArrayList<>();
        private int limit = -1;

        SelectQueryBuilder() {
        }

        /**
         * Begins a predicate on a field, or on a field reached through reference fields.
         */
        public QueryField where(@NotNull String field, @NotNull String... nested) {
            List<String> path = new ArrayList<>(nested.length + 1);
            path.add(field);
            path.addAll(List.of(nested));
            return new QueryField(this, path);
        }

        public SelectQueryBuilder where(@NotNull FilterOption filter) {
            filters.add(filter);
            return this;
        }

        public SelectQueryBuilder where(@NotNull List<FilterOption> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public SelectQueryBuilder orderBy(@NotNull String field, @NotNull SortOrder direction) {
            sortOptions.add(new SortOption(field, direction));
            return this;
        }

        /**
         * {@code "field"} sorts ascending, {@code "-field"} descending.
         */
        public SelectQueryBuilder orderBy(@NotNull String expression) {
            sortOptions.add(SortOption.parse(expression));
            return this;
        }

        public SelectQueryBuilder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public SelectQuery build() {
            return new SelectQuery(filters, sortOptions, limit);
        }

        void addFilter(FilterOption filter) {
            filters.add(filter);
        }
    }
}
