package io.github.flameyossnowy.kvmodels.redis;

import io.github.flameyossnowy.kvmodels.api.exceptions.ConfigurationException;
import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Configures a {@link RedisKeyValueStore}. {@link #build()} checks the connection once with {@code PING};
 * a failure surfaces as a {@link ConfigurationException} and is not retried.
 */
@SuppressWarnings("unused")
public class RedisKeyValueStoreBuilder {
    public static final int DEFAULT_SCAN_COUNT = 100;

    private RedisCredentials credentials;
    private UnifiedJedis client;
    private int scanCount = DEFAULT_SCAN_COUNT;

    RedisKeyValueStoreBuilder() {
    }

    public RedisKeyValueStoreBuilder withCredentials(RedisCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    /**
     * Uses an existing client instead of opening a pool from credentials. The store closes it on close.
     */
    public RedisKeyValueStoreBuilder withClient(UnifiedJedis client) {
        this.client = client;
        return this;
    }

    /**
     * {@code COUNT} hint of each {@code SCAN} call.
     */
    public RedisKeyValueStoreBuilder withScanCount(int scanCount) {
        if (scanCount < 1) throw new ConfigurationException("Scan count must be positive, got " + scanCount);
        this.scanCount = scanCount;
        return this;
    }

    public RedisKeyValueStore build() {
        if (this.client == null && this.credentials == null) {
            throw new ConfigurationException("Either credentials or a client are required");
        }

        UnifiedJedis jedis = this.client != null ? this.client : open(this.credentials);
        try {
            jedis.ping();
        } catch (JedisException e) {
            jedis.close();
            throw new ConfigurationException("Redis is not reachable" + (credentials == null ? "" : " at " + credentials), e);
        }

        Logging.info("Connected to Redis" + (credentials == null ? "" : " at " + credentials));
        return new RedisKeyValueStore(jedis, scanCount);
    }

    private static UnifiedJedis open(RedisCredentials credentials) {
        JedisClientConfig config = DefaultJedisClientConfig.builder()
            .user(credentials.user())
            .password(credentials.password())
            .database(credentials.database())
            .timeoutMillis(credentials.timeoutMillis())
            .clientName("kvmodels")
            .build();
        try {
            return new JedisPooled(new HostAndPort(credentials.host(), credentials.port()), config);
        } catch (JedisException e) {
            throw new ConfigurationException("Could not open a Redis connection pool for " + credentials, e);
        }
    }
}
