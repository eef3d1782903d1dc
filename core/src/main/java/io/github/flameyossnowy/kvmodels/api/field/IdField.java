package io.github.flameyossnowy.kvmodels.api.field;

import org.jetbrains.annotations.NotNull;

/**
 * The numeric, never-null identifier every schema starts with.
 */
public final class IdField extends NumberField {
    public IdField() {
        super(FieldSettings.DEFAULT.withNullable(false));
    }

    @Override
    protected @NotNull FieldSpec<Number> withSettings(@NotNull FieldSettings settings) {
        return this;
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        Number number = toNumber(value);
        if (number instanceof Double) {
            throw wrongType(value, "Long, Integer, Short, Byte");
        }
        return number;
    }
}
