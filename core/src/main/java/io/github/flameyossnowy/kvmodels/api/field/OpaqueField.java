package io.github.flameyossnowy.kvmodels.api.field;

import org.jetbrains.annotations.NotNull;

/**
 * Stands in for fields of records whose model is not registered; values pass through untouched.
 */
public final class OpaqueField extends FieldSpec<Object> {
    public static final OpaqueField INSTANCE = new OpaqueField();

    private OpaqueField() {
        super(FieldSettings.DEFAULT);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.OPAQUE;
    }

    @Override
    protected @NotNull FieldSpec<Object> withSettings(@NotNull FieldSettings settings) {
        return this;
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        return value;
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return normalized;
    }

    @Override
    protected @NotNull Object read(@NotNull Object raw, @NotNull DeserializationContext context) {
        return raw;
    }
}
