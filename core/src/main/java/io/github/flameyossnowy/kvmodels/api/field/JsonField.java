package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Composite value written as a JSON-encoded string and type-checked against a set of allowed container
 * types both before writing and after reading.
 */
public class JsonField extends FieldSpec<Object> {
    public static final Set<Class<?>> JSON_TYPES = Set.of(Map.class, List.class);

    private final Set<Class<?>> allowedTypes;
    private final JsonCodec codec;

    public JsonField(@NotNull FieldSettings settings, @NotNull Set<Class<?>> allowedTypes, @NotNull JsonCodec codec) {
        super(settings);
        if (allowedTypes.isEmpty()) {
            throw new IllegalArgumentException("A JSON field needs at least one allowed type");
        }
        this.allowedTypes = Set.copyOf(allowedTypes);
        this.codec = codec;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.JSON;
    }

    @Override
    protected @NotNull FieldSpec<Object> withSettings(@NotNull FieldSettings settings) {
        return new JsonField(settings, allowedTypes, codec);
    }

    public @NotNull Set<Class<?>> allowedTypes() {
        return allowedTypes;
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        return checkAllowed(value);
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        try {
            return codec.serialize(normalized);
        } catch (JsonProcessException e) {
            throw new ValidationException("value can not be written as JSON: " + e.getMessage(), e);
        }
    }

    @Override
    protected @NotNull Object read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (!(raw instanceof String json)) {
            throw wrongType(raw, "String");
        }

        Object decoded;
        try {
            decoded = codec.deserialize(json, Object.class);
        } catch (JsonProcessException e) {
            throw new ValidationException("stored value is not valid JSON at " + e.getLocation(), e);
        }
        if (decoded == null) {
            throw new ValidationException("stored JSON value is null");
        }
        return checkAllowed(decoded);
    }

    private Object checkAllowed(Object value) {
        for (Class<?> allowed : allowedTypes) {
            if (allowed.isInstance(value)) {
                return value;
            }
        }
        throw wrongType(value, allowedTypes.stream().map(Class::getSimpleName).sorted().collect(Collectors.joining(", ")));
    }
}
