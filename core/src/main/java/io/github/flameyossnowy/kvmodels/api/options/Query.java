package io.github.flameyossnowy.kvmodels.api.options;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Entry points for building queries.
 */
public sealed interface Query permits SelectQuery {

    /**
     * Start building a query.
     */
    static SelectQuery.SelectQueryBuilder select() {
        return new SelectQuery.SelectQueryBuilder();
    }

    /**
     * Builds a query from lookups in the {@code field__nested__operator} form, e.g.
     * {@code Map.of("token", t, "created__gte", yesterday)}. A lookup whose last segment is not an
     * operator is an {@code exact} match on the whole path.
     */
    static SelectQuery parse(@NotNull Map<String, ?> lookups) {
        SelectQuery.SelectQueryBuilder builder = select();
        builder.where(parseFilters(lookups));
        return builder.build();
    }

    static List<FilterOption> parseFilters(@NotNull Map<String, ?> lookups) {
        List<FilterOption> filters = new ArrayList<>(lookups.size());
        for (Map.Entry<String, ?> entry : lookups.entrySet()) {
            filters.add(parseFilter(entry.getKey(), entry.getValue()));
        }
        return filters;
    }

    static FilterOption parseFilter(@NotNull String lookup, Object operand) {
        List<String> segments = Arrays.asList(lookup.split(ModelSchema.PATH_SEPARATOR, -1));
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new ValidationException("'" + lookup + "' is not a valid filter");
            }
        }

        FilterOperator operator = segments.size() > 1 ? FilterOperator.lookup(segments.get(segments.size() - 1)) : null;
        if (operator == null) {
            return new FilterOption(segments, FilterOperator.EXACT, operand);
        }
        return new FilterOption(segments.subList(0, segments.size() - 1), operator, operand);
    }
}
