package io.github.flameyossnowy.kvmodels.api;

import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;

/**
 * Hooks around writes of one model.
 */
public interface ModelLifecycleListener {

    /**
     * Runs before the instance is cleaned, so it may still change field values. The repository can be
     * queried, for example to derive a value from existing records.
     */
    default void beforeSave(@NotNull ModelInstance instance, @NotNull ModelRepository repository) {
    }

    default void afterSave(@NotNull ModelInstance instance) {
    }

    default void afterDelete(@NotNull String modelName, @NotNull Collection<Long> ids) {
    }
}
