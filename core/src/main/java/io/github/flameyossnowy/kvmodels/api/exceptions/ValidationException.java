package io.github.flameyossnowy.kvmodels.api.exceptions;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Raised when a value, a field name, a filter or a relation does not satisfy its contract.
 * <p>
 * Field-level failures raised while saving are re-wrapped with the model and field name through
 * {@link #inField(String, String, ValidationException)}, so the caller always sees where the value came from.
 */
public class ValidationException extends ModelException {
    private final String modelName;
    private final String fieldName;

    public ValidationException(String message) {
        this(message, null, null, null);
    }

    public ValidationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    private ValidationException(String message, @Nullable String modelName, @Nullable String fieldName, @Nullable Throwable cause) {
        super(message, cause);
        this.modelName = modelName;
        this.fieldName = fieldName;
    }

    public static @NotNull ValidationException inField(@NotNull String modelName, @NotNull String fieldName, @NotNull ValidationException cause) {
        return new ValidationException(
            cause.getMessage() + " (" + modelName + " -> " + fieldName + ")",
            modelName,
            fieldName,
            cause
        );
    }

    public @Nullable String getModelName() {
        return modelName;
    }

    public @Nullable String getFieldName() {
        return fieldName;
    }
}
