package io.github.flameyossnowy.kvmodels.api.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The primitives the model layer needs from a key-value store. All values are UTF-8 text.
 * <p>
 * Patterns are glob-style ({@code *}, {@code ?} and {@code [...]}), the way Redis {@code KEYS} and
 * {@code SCAN MATCH} interpret them.
 */
public interface KeyValueStore extends AutoCloseable {

    @Nullable String get(@NotNull String key);

    void set(@NotNull String key, @NotNull String value);

    /**
     * Fetches several keys in one round trip.
     *
     * @return values in the order of {@code keys}, {@code null} where a key is absent
     */
    @NotNull List<@Nullable String> multiGet(@NotNull List<String> keys);

    void multiSet(@NotNull Map<String, String> entries);

    /**
     * @return the number of keys that existed and were removed
     */
    long delete(@NotNull Collection<String> keys);

    /**
     * Lists every key matching {@code pattern} in one call.
     */
    @NotNull Collection<String> listKeys(@NotNull String pattern);

    /**
     * Streams keys matching {@code pattern} incrementally. Keys may be reported more than once.
     */
    default @NotNull Iterator<String> scanKeys(@NotNull String pattern) {
        return listKeys(pattern).iterator();
    }

    /**
     * Adds one to the integer stored at {@code key}, treating an absent key as {@code 0}.
     * <p>
     * Implementations backed by a store with a native increment must override this; the default
     * read-modify-write is only safe under the caller's own mutual exclusion.
     *
     * @return the incremented value
     */
    default long increment(@NotNull String key) {
        String current = get(key);
        long next = (current == null ? 0L : Long.parseLong(current)) + 1L;
        set(key, Long.toString(next));
        return next;
    }

    @Override
    default void close() {
    }
}
