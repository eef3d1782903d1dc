package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored as {@code 1}/{@code 0}. The choices are fixed to {@code true -> "Yes"}, {@code false -> "No"}.
 */
public class BooleanField extends FieldSpec<Boolean> {
    static final Map<Object, String> CHOICES;

    static {
        Map<Object, String> choices = new LinkedHashMap<>(2);
        choices.put(Boolean.TRUE, "Yes");
        choices.put(Boolean.FALSE, "No");
        CHOICES = choices;
    }

    public BooleanField(@NotNull FieldSettings settings) {
        super(settings.withChoices(CHOICES));
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.BOOLEAN;
    }

    @Override
    protected @NotNull FieldSpec<Boolean> withSettings(@NotNull FieldSettings settings) {
        return new BooleanField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        throw wrongType(value, "Boolean");
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return (Boolean) normalized ? 1 : 0;
    }

    @Override
    protected @NotNull Boolean read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        if (raw instanceof Long || raw instanceof Integer) {
            return ((Number) raw).longValue() != 0L;
        }
        if (raw instanceof String text) {
            try {
                return Long.parseLong(text) != 0L;
            } catch (NumberFormatException e) {
                throw new ValidationException("'" + text + "' is not a stored boolean", e);
            }
        }
        throw wrongType(raw, "Integer");
    }
}
