package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.exceptions.json.JsonProcessException;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Many-to-many reference. The record stores a JSON array of target ids; reading returns the instances
 * that still exist, in no guaranteed order.
 */
public class ReferenceListField extends FieldSpec<List<ModelInstance>> {
    private final String targetModel;
    private final JsonCodec codec;

    public ReferenceListField(@NotNull FieldSettings settings, @NotNull String targetModel, @NotNull JsonCodec codec) {
        super(settings);
        this.targetModel = Objects.requireNonNull(targetModel, "targetModel");
        this.codec = codec;
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.REFERENCE_LIST;
    }

    @Override
    protected @NotNull FieldSpec<List<ModelInstance>> withSettings(@NotNull FieldSettings settings) {
        return new ReferenceListField(settings, targetModel, codec);
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
        if (value instanceof ModelInstance instance) {
            return List.of(ReferenceField.referencedId(instance, targetModel));
        }
        if (!(value instanceof Collection<?> collection)) {
            throw wrongType(value, "Collection of " + targetModel + " instances or ids");
        }

        List<Long> ids = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element == null) {
                throw new ValidationException("null can not be referenced");
            }
            ids.add(ReferenceField.referencedId(element, targetModel));
        }
        return List.copyOf(ids);
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return codec.serialize(normalized);
    }

    @Override
    protected @NotNull List<ModelInstance> read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (!(raw instanceof String json)) {
            throw wrongType(raw, "String");
        }

        Object decoded;
        try {
            decoded = codec.deserialize(json, Object.class);
        } catch (JsonProcessException e) {
            throw new ValidationException("stored reference list is not valid JSON at " + e.getLocation(), e);
        }
        if (!(decoded instanceof List<?> list)) {
            throw new ValidationException("stored reference list is not a JSON array: " + json);
        }

        List<Long> ids = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element == null) {
                throw new ValidationException("stored reference list contains null");
            }
            ids.add(ReferenceField.storedId(element));
        }
        if (ids.isEmpty()) {
            return new ArrayList<>(0);
        }
        return context.relations().resolveMany(targetModel, ids);
    }
}
