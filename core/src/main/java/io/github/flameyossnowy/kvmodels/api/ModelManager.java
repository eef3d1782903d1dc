package io.github.flameyossnowy.kvmodels.api;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.id.IdAllocator;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelRegistry;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.SelectQuery;
import io.github.flameyossnowy.kvmodels.api.query.QueryEngine;
import io.github.flameyossnowy.kvmodels.api.query.QueryResult;
import io.github.flameyossnowy.kvmodels.api.store.KeyLayout;
import io.github.flameyossnowy.kvmodels.api.store.KeyValueStore;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Explicit context shared by every model of one store: the connection, the key layout, the registry,
 * the query engine and the id allocator.
 * <p>
 * Build one per store with {@link #builder()}, register the schemas at startup and pass the manager (or
 * its repositories) to the code that needs them.
 *
 * <pre>{@code
 * try (ModelManager manager = ModelManager.builder()
 *         .withStore(store)
 *         .withPrefix("app")
 *         .build()) {
 *     ModelRepository sessions = manager.register(SESSION);
 *     sessions.create(Map.of("token", token));
 * }
 * }</pre>
 */
public class ModelManager implements AutoCloseable {
    private final KeyValueStore store;
    private final KeyLayout layout;
    private final JsonCodec codec;
    private final ModelRegistry registry;
    private final QueryEngine queryEngine;
    private final IdAllocator idAllocator;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Map<String, ModelRepository> repositories = new ConcurrentHashMap<>();

    ModelManager(@NotNull KeyValueStore store,
                 @NotNull KeyLayout layout,
                 @NotNull JsonCodec codec,
                 @NotNull ModelRegistry registry,
                 @NotNull QueryEngine queryEngine,
                 @NotNull IdAllocator idAllocator,
                 @NotNull Executor executor,
                 ExecutorService ownedExecutor) {
        this.store = store;
        this.layout = layout;
        this.codec = codec;
        this.registry = registry;
        this.queryEngine = queryEngine;
        this.idAllocator = idAllocator;
        this.executor = executor;
        this.ownedExecutor = ownedExecutor;
    }

    public static @NotNull ModelManagerBuilder builder() {
        return new ModelManagerBuilder();
    }

    // ==================== Registration ====================

    /**
     * Registers one schema.
     *
     * @return the repository bound to it
     */
    public @NotNull ModelRepository register(@NotNull ModelSchema schema) {
        return register(new ModelSchema[] {schema}).get(0);
    }

    /**
     * Registers schemas as one batch, so they may reference each other.
     *
     * @return one repository per schema, in argument order
     * @throws ValidationException if a name is taken or a reference target is unknown
     */
    public @NotNull List<ModelRepository> register(@NotNull ModelSchema... schemas) {
        registry.register(Arrays.asList(schemas));

        List<ModelRepository> registered = new ArrayList<>(schemas.length);
        for (ModelSchema schema : schemas) {
            registered.add(repositories.computeIfAbsent(schema.name(), name -> new ModelRepository(this, schema)));
            Logging.deepInfo(() -> "Registered " + schema);
        }
        return registered;
    }

    public @NotNull ModelRepository repository(@NotNull String modelName) {
        ModelRepository repository = repositories.get(modelName);
        if (repository == null) {
            throw new ValidationException(modelName + " is not a registered model");
        }
        return repository;
    }

    /**
     * Queries records of any model tag, registered or not. An unregistered tag is read as an opaque model
     * in lenient mode and rejected otherwise.
     */
    public @NotNull QueryResult query(@NotNull String modelName, @NotNull SelectQuery query) {
        return queryEngine.find(modelName, query);
    }

    // ==================== Accessors ====================

    public @NotNull KeyValueStore store() {
        return store;
    }

    public @NotNull KeyLayout layout() {
        return layout;
    }

    public @NotNull ModelRegistry registry() {
        return registry;
    }

    public @NotNull QueryEngine queryEngine() {
        return queryEngine;
    }

    @ApiStatus.Internal
    public @NotNull IdAllocator idAllocator() {
        return idAllocator;
    }

    @ApiStatus.Internal
    public @NotNull JsonCodec codec() {
        return codec;
    }

    public @NotNull Executor executor() {
        return executor;
    }

    public boolean isLenient() {
        return queryEngine.isLenient();
    }

    /**
     * Shuts down the default executor, if the manager created it, and closes the store.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        store.close();
    }
}
