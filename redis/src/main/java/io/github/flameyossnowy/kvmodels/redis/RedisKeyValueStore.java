package io.github.flameyossnowy.kvmodels.redis;

import io.github.flameyossnowy.kvmodels.api.store.KeyValueStore;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * {@link KeyValueStore} over a Jedis client. Every call is one blocking round trip, except
 * {@link #scanKeys(String)} which issues one {@code SCAN} per batch as the iterator advances.
 */
public class RedisKeyValueStore implements KeyValueStore {
    private final UnifiedJedis client;
    private final int scanCount;

    RedisKeyValueStore(@NotNull UnifiedJedis client, int scanCount) {
        this.client = client;
        this.scanCount = scanCount;
    }

    public static @NotNull RedisKeyValueStoreBuilder builder() {
        return new RedisKeyValueStoreBuilder();
    }

    @Override
    public @Nullable String get(@NotNull String key) {
        return client.get(key);
    }

    @Override
    public void set(@NotNull String key, @NotNull String value) {
        client.set(key, value);
    }

    @Override
    public @NotNull List<@Nullable String> multiGet(@NotNull List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        return client.mget(keys.toArray(new String[0]));
    }

    @Override
    public void multiSet(@NotNull Map<String, String> entries) {
        if (entries.isEmpty()) {
            return;
        }
        String[] keysValues = new String[entries.size() * 2];
        int i = 0;
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            keysValues[i++] = entry.getKey();
            keysValues[i++] = entry.getValue();
        }
        client.mset(keysValues);
    }

    @Override
    public long delete(@NotNull Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        return client.del(keys.toArray(new String[0]));
    }

    @Override
    public @NotNull Collection<String> listKeys(@NotNull String pattern) {
        return client.keys(pattern);
    }

    @Override
    public @NotNull Iterator<String> scanKeys(@NotNull String pattern) {
        return new ScanIterator(pattern);
    }

    @Override
    public long increment(@NotNull String key) {
        return client.incr(key);
    }

    @Override
    public void close() {
        client.close();
    }

    private final class ScanIterator implements Iterator<String> {
        private final ScanParams params;
        private final Deque<String> batch = new ArrayDeque<>();
        private String cursor = ScanParams.SCAN_POINTER_START;
        private boolean finished;

        ScanIterator(String pattern) {
            this.params = new ScanParams().match(pattern).count(scanCount);
        }

        @Override
        public boolean hasNext() {
            while (batch.isEmpty() && !finished) {
                ScanResult<String> result = client.scan(cursor, params);
                batch.addAll(result.getResult());
                cursor = result.getCursor();
                finished = ScanParams.SCAN_POINTER_START.equals(cursor);
                Logging.deepInfo(() -> "SCAN returned " + result.getResult().size() + " keys, cursor " + result.getCursor());
            }
            return !batch.isEmpty();
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return batch.poll();
        }
    }
}
