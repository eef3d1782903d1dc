package io.github.flameyossnowy.kvmodels.api.id;

import org.jetbrains.annotations.NotNull;

/**
 * Hands out strictly increasing ids per model.
 */
public interface IdAllocator {

    /**
     * @return an id never returned before for {@code modelName}, starting at 1
     */
    long nextId(@NotNull String modelName);

    /**
     * Marks {@code id} as taken, so that {@link #nextId(String)} only returns larger ids afterwards.
     */
    void reserve(@NotNull String modelName, long id);
}
