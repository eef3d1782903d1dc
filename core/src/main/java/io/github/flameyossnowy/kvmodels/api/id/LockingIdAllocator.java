package io.github.flameyossnowy.kvmodels.api.id;

import io.github.flameyossnowy.kvmodels.api.exceptions.ModelException;
import io.github.flameyossnowy.kvmodels.api.store.KeyLayout;
import io.github.flameyossnowy.kvmodels.api.store.KeyValueStore;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Allocates ids from the per-model counter at {@code max_id:<prefix>:<model>}.
 * <p>
 * Allocation is serialized by one lock per manager, shared by all models. The store-side flag at
 * {@code __lock__:<prefix>} mirrors the lock: {@code "1"} while an allocation is in progress, {@code "0"}
 * otherwise. The counter itself is advanced with the store's atomic increment.
 */
public class LockingIdAllocator implements IdAllocator {
    static final String LOCKED = "1";
    static final String UNLOCKED = "0";

    private final KeyValueStore store;
    private final KeyLayout layout;
    private final ReentrantLock lock = new ReentrantLock();

    public LockingIdAllocator(@NotNull KeyValueStore store, @NotNull KeyLayout layout) {
        this.store = store;
        this.layout = layout;
        store.set(layout.lockKey(), UNLOCKED);
    }

    @Override
    public long nextId(@NotNull String modelName) {
        String counterKey = layout.counterKey(modelName);
        lock.lock();
        try {
            store.set(layout.lockKey(), LOCKED);
            try {
                long id = store.increment(counterKey);
                Logging.deepInfo(() -> "Allocated id " + id + " for " + modelName);
                return id;
            } finally {
                store.set(layout.lockKey(), UNLOCKED);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reserve(@NotNull String modelName, long id) {
        String counterKey = layout.counterKey(modelName);
        lock.lock();
        try {
            store.set(layout.lockKey(), LOCKED);
            try {
                String stored = store.get(counterKey);
                long current = stored == null ? 0 : parseCounter(counterKey, stored);
                if (current < id) {
                    store.set(counterKey, Long.toString(id));
                    Logging.deepInfo(() -> "Raised counter of " + modelName + " from " + current + " to " + id);
                }
            } finally {
                store.set(layout.lockKey(), UNLOCKED);
            }
        } finally {
            lock.unlock();
        }
    }

    private static long parseCounter(String counterKey, String stored) {
        try {
            return Long.parseLong(stored.trim());
        } catch (NumberFormatException e) {
            throw new ModelException("Counter " + counterKey + " holds '" + stored + "', not an integer", e);
        }
    }
}
