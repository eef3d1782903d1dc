package io.github.flameyossnowy.kvmodels.api.options;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

public record SortOption(@NotNull String field, @NotNull SortOrder order) {

    /**
     * Parses {@code "field"} as ascending and {@code "-field"} as descending.
     */
    public static @NotNull SortOption parse(@NotNull String expression) {
        boolean descending = expression.startsWith("-");
        String field = descending ? expression.substring(1) : expression;
        if (field.isBlank()) {
            throw new ValidationException("'" + expression + "' does not name a field to order by");
        }
        return new SortOption(field, descending ? SortOrder.DESCENDING : SortOrder.ASCENDING);
    }
}
