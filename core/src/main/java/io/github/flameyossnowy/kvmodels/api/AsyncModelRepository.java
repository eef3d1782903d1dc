package io.github.flameyossnowy.kvmodels.api;

import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.options.SelectQuery;
import io.github.flameyossnowy.kvmodels.api.query.QueryResult;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Non-blocking view of a {@link ModelRepository}. Each call runs the blocking operation on the manager's
 * executor, so several operations may be in flight at once; id allocation stays mutually exclusive.
 * <p>
 * Cancelling a returned future does not roll back writes that already reached the store.
 */
public class AsyncModelRepository {
    private final ModelRepository repository;
    private final Executor executor;

    AsyncModelRepository(@NotNull ModelRepository repository, @NotNull Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public @NotNull ModelRepository blocking() {
        return repository;
    }

    public CompletableFuture<ModelInstance> create(@NotNull Map<String, ?> values) {
        return CompletableFuture.supplyAsync(() -> repository.create(values), executor);
    }

    public CompletableFuture<ModelInstance> save(@NotNull ModelInstance instance) {
        return CompletableFuture.supplyAsync(() -> repository.save(instance), executor);
    }

    public CompletableFuture<QueryResult> query() {
        return CompletableFuture.supplyAsync(() -> repository.query(), executor);
    }

    public CompletableFuture<QueryResult> query(@NotNull SelectQuery query) {
        return CompletableFuture.supplyAsync(() -> repository.query(query), executor);
    }

    public CompletableFuture<QueryResult> filter(@NotNull Map<String, ?> lookups) {
        return CompletableFuture.supplyAsync(() -> repository.filter(lookups), executor);
    }

    public CompletableFuture<Optional<ModelInstance>> findById(long id) {
        return CompletableFuture.supplyAsync(() -> repository.findById(id), executor);
    }

    public CompletableFuture<Long> count(@NotNull SelectQuery query) {
        return CompletableFuture.supplyAsync(() -> repository.count(query), executor);
    }

    public CompletableFuture<List<ModelInstance>> update(@NotNull Map<String, ?> values) {
        return CompletableFuture.supplyAsync(() -> repository.update(values), executor);
    }

    public CompletableFuture<List<ModelInstance>> update(@NotNull SelectQuery query, @NotNull Map<String, ?> values) {
        return CompletableFuture.supplyAsync(() -> repository.update(query, values), executor);
    }

    public CompletableFuture<List<ModelInstance>> update(@NotNull Collection<ModelInstance> instances, @NotNull Map<String, ?> values) {
        return CompletableFuture.supplyAsync(() -> repository.update(instances, values), executor);
    }

    public CompletableFuture<Long> delete() {
        return CompletableFuture.supplyAsync(() -> repository.delete(), executor);
    }

    public CompletableFuture<Long> delete(@NotNull Collection<ModelInstance> instances) {
        return CompletableFuture.supplyAsync(() -> repository.delete(instances), executor);
    }

    public CompletableFuture<Long> deleteByIds(@NotNull Collection<Long> ids) {
        return CompletableFuture.supplyAsync(() -> repository.deleteByIds(ids), executor);
    }
}
