package io.github.flameyossnowy.kvmodels.api.field;

import org.jetbrains.annotations.NotNull;

public class StringField extends FieldSpec<String> {
    public StringField(@NotNull FieldSettings settings) {
        super(settings);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.STRING;
    }

    @Override
    protected @NotNull FieldSpec<String> withSettings(@NotNull FieldSettings settings) {
        return new StringField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        return value.toString();
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return normalized;
    }

    @Override
    protected @NotNull String read(@NotNull Object raw, @NotNull DeserializationContext context) {
        return raw.toString();
    }
}
