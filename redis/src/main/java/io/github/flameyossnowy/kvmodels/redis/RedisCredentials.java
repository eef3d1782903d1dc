package io.github.flameyossnowy.kvmodels.redis;

import io.github.flameyossnowy.kvmodels.api.exceptions.ConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Connection settings of a Redis server.
 *
 * @param user          ACL user, {@code null} for the default user
 * @param password      {@code null} when the server has no authentication
 * @param database      logical database index
 * @param timeoutMillis connect and socket timeout
 */
public record RedisCredentials(
    @NotNull String host,
    int port,
    @Nullable String user,
    @Nullable String password,
    int database,
    int timeoutMillis
) {
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_TIMEOUT_MILLIS = 2000;

    public RedisCredentials {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("Redis host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Redis port " + port + " is out of range");
        }
        if (database < 0) {
            throw new ConfigurationException("Redis database index must not be negative, got " + database);
        }
        if (timeoutMillis < 0) {
            throw new ConfigurationException("Redis timeout must not be negative, got " + timeoutMillis);
        }
        if (user != null && password == null) {
            throw new ConfigurationException("Redis user " + user + " needs a password");
        }
    }

    public RedisCredentials(@NotNull String host, int port) {
        this(host, port, null, null, 0, DEFAULT_TIMEOUT_MILLIS);
    }

    public static @NotNull RedisCredentials localhost() {
        return new RedisCredentials("localhost", DEFAULT_PORT);
    }

    @Override
    public String toString() {
        return "RedisCredentials{" + host + ':' + port + '/' + database + (user == null ? "" : ", user=" + user) + '}';
    }
}
