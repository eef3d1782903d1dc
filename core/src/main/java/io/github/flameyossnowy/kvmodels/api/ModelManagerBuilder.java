package io.github.flameyossnowy.kvmodels.api;

import io.github.flameyossnowy.kvmodels.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.kvmodels.api.id.IdAllocator;
import io.github.flameyossnowy.kvmodels.api.id.LockingIdAllocator;
import io.github.flameyossnowy.kvmodels.api.json.DefaultJsonCodec;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelRegistry;
import io.github.flameyossnowy.kvmodels.api.query.QueryEngine;
import io.github.flameyossnowy.kvmodels.api.store.KeyEnumeration;
import io.github.flameyossnowy.kvmodels.api.store.KeyLayout;
import io.github.flameyossnowy.kvmodels.api.store.KeyValueStore;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@SuppressWarnings("unused")
public class ModelManagerBuilder {
    private KeyValueStore store;
    private String prefix = KeyLayout.DEFAULT_PREFIX;
    private boolean lenient = true;
    private KeyEnumeration keyEnumeration = KeyEnumeration.KEYS;
    private JsonCodec codec;
    private Executor executor;

    ModelManagerBuilder() {
    }

    public ModelManagerBuilder withStore(KeyValueStore store) {
        this.store = store;
        return this;
    }

    /**
     * Namespace of every record key. {@code ':'} is stripped with a warning.
     */
    public ModelManagerBuilder withPrefix(String prefix) {
        this.prefix = prefix;
        return this;
    }

    /**
     * Whether unreadable records (nulls in non-nullable fields, unregistered model tags, malformed keys or
     * bodies) are logged and skipped instead of failing the query. Defaults to {@code true}.
     */
    public ModelManagerBuilder withLenientDeserialization(boolean lenient) {
        this.lenient = lenient;
        return this;
    }

    public ModelManagerBuilder withKeyEnumeration(KeyEnumeration keyEnumeration) {
        this.keyEnumeration = Objects.requireNonNull(keyEnumeration, "keyEnumeration");
        return this;
    }

    public ModelManagerBuilder withJsonCodec(JsonCodec codec) {
        this.codec = codec;
        return this;
    }

    /**
     * Executor of the {@link AsyncModelRepository} operations. When absent, the manager creates a cached
     * pool of daemon threads and shuts it down on close.
     */
    public ModelManagerBuilder withExecutor(Executor executor) {
        this.executor = executor;
        return this;
    }

    public ModelManager build() {
        if (this.store == null) throw new ConfigurationException("A key-value store is required");

        KeyLayout layout = new KeyLayout(prefix);
        JsonCodec jsonCodec = codec != null ? codec : new DefaultJsonCodec();
        ModelRegistry registry = new ModelRegistry();
        QueryEngine queryEngine = new QueryEngine(store, layout, registry, jsonCodec, lenient, keyEnumeration);
        IdAllocator idAllocator = new LockingIdAllocator(store, layout);

        ExecutorService ownedExecutor = executor == null ? newDaemonPool() : null;
        return new ModelManager(
            store,
            layout,
            jsonCodec,
            registry,
            queryEngine,
            idAllocator,
            executor != null ? executor : ownedExecutor,
            ownedExecutor
        );
    }

    private static ExecutorService newDaemonPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "kvmodels-async-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
