package io.github.flameyossnowy.kvmodels.api.relationship;

import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;

/**
 * Resolves stored ids of reference fields back into instances of the referenced model.
 */
public interface RelationResolver {

    /**
     * @throws io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException unless exactly one
     *         record of {@code modelName} carries {@code id}
     */
    @NotNull ModelInstance resolveOne(@NotNull String modelName, long id);

    /**
     * Ids without a record are skipped. The order of the result is not tied to the order of {@code ids}.
     */
    @NotNull List<ModelInstance> resolveMany(@NotNull String modelName, @NotNull Collection<Long> ids);
}
