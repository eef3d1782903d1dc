package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One-to-one reference. The record stores the numeric id of the target; reading resolves it back into
 * exactly one instance of the target model.
 */
public class ReferenceField extends FieldSpec<ModelInstance> {
    private final String targetModel;

    public ReferenceField(@NotNull FieldSettings settings, @NotNull String targetModel) {
        super(settings);
        this.targetModel = Objects.requireNonNull(targetModel, "targetModel");
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.REFERENCE;
    }

    @Override
    protected @NotNull FieldSpec<ModelInstance> withSettings(@NotNull FieldSettings settings) {
        return new ReferenceField(settings, targetModel);
    }

    @Override
    public boolean isReference() {
        return true;
    }

    @Override
    public @NotNull String targetModel() {
        return targetModel;
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        return referencedId(value, targetModel);
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return normalized;
    }

    @Override
    protected @NotNull ModelInstance read(@NotNull Object raw, @NotNull DeserializationContext context) {
        return context.relations().resolveOne(targetModel, storedId(raw));
    }

    /**
     * Accepts a saved instance of {@code targetModel} or a bare integral id.
     */
    static long referencedId(@NotNull Object value, @NotNull String targetModel) {
        if (value instanceof ModelInstance instance) {
            if (!instance.modelName().equals(targetModel)) {
                throw new ValidationException(instance.modelName() + " instance can not be referenced where " + targetModel + " is expected");
            }
            Long id = instance.getId();
            if (id == null) {
                throw new ValidationException(targetModel + " instance must be saved before it can be referenced");
            }
            return id;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw wrongType(value, targetModel + " instance or Long id");
    }

    static long storedId(@NotNull Object raw) {
        if (raw instanceof Long || raw instanceof Integer) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new ValidationException("'" + text + "' is not a stored id", e);
            }
        }
        throw wrongType(raw, "Long");
    }
}
