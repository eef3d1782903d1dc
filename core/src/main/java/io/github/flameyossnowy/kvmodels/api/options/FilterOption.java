package io.github.flameyossnowy.kvmodels.api.options;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * One predicate: a field path, an operator and its operand.
 * <p>
 * The first path element names a field of the queried model; every further element names a field of the
 * model referenced by the previous one.
 */
public record FilterOption(
    @NotNull List<String> path,
    @NotNull FilterOperator operator,
    @Nullable Object operand
) {
    public FilterOption {
        Objects.requireNonNull(operator, "operator");
        path = List.copyOf(path);
        if (path.isEmpty()) {
            throw new ValidationException("A filter needs a field name");
        }
        if (operator == FilterOperator.ISNULL && !(operand instanceof Boolean)) {
            throw new ValidationException("isnull expects a Boolean operand, got " + operand);
        }
    }

    public @NotNull String fieldName() {
        return path.get(0);
    }

    public @NotNull List<String> nestedPath() {
        return path.subList(1, path.size());
    }

    public boolean isNested() {
        return path.size() > 1;
    }

    @Override
    public String toString() {
        return String.join("__", path) + "__" + operator.suffix() + "=" + operand;
    }
}
