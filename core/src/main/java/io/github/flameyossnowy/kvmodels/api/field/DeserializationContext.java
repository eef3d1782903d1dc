package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.relationship.RelationResolver;
import org.jetbrains.annotations.NotNull;

/**
 * What a field needs from its surroundings while turning a stored value back into a typed one.
 */
public interface DeserializationContext {

    /**
     * Whether a null found in a non-nullable field is logged and kept instead of raised.
     */
    boolean lenient();

    @NotNull RelationResolver relations();
}
