package io.github.flameyossnowy.kvmodels.api.store;

import io.github.flameyossnowy.kvmodels.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Builds and parses every key the model layer persists.
 * <pre>
 *   record   &lt;prefix&gt;:&lt;model&gt;:&lt;id&gt;
 *   counter  max_id:&lt;prefix&gt;:&lt;model&gt;
 *   lock     __lock__:&lt;prefix&gt;
 * </pre>
 */
public final class KeyLayout {
    public static final char SEPARATOR = ':';
    public static final String DEFAULT_PREFIX = "kvmodels";

    // the separator plus the glob metacharacters of key patterns
    private static final String RESERVED = SEPARATOR + "*?[]";

    private final String prefix;

    public KeyLayout(@Nullable String prefix) {
        this.prefix = sanitizePrefix(prefix);
    }

    public static @NotNull String sanitizePrefix(@Nullable String prefix) {
        if (prefix == null || prefix.isBlank()) {
            Logging.warn("Prefix '" + prefix + "' is not usable, using default prefix \"" + DEFAULT_PREFIX + "\"");
            return DEFAULT_PREFIX;
        }
        StringBuilder stripped = new StringBuilder(prefix.length());
        for (int i = 0; i < prefix.length(); i++) {
            char c = prefix.charAt(i);
            if (RESERVED.indexOf(c) < 0) {
                stripped.append(c);
            }
        }
        if (stripped.length() != prefix.length()) {
            String sanitized = stripped.length() == 0 ? DEFAULT_PREFIX : stripped.toString();
            Logging.warn("Prefix can not contain any of \"" + RESERVED + "\", using \"" + sanitized + "\" instead");
            return sanitized;
        }
        return prefix;
    }

    public String prefix() {
        return prefix;
    }

    public String recordKey(String modelName, long id) {
        return prefix + SEPARATOR + modelName + SEPARATOR + id;
    }

    public String recordPattern(String modelName) {
        return prefix + SEPARATOR + modelName + SEPARATOR + '*';
    }

    public String counterKey(String modelName) {
        return "max_id" + SEPARATOR + prefix + SEPARATOR + modelName;
    }

    public String lockKey() {
        return "__lock__" + SEPARATOR + prefix;
    }

    /**
     * Splits a record key into its parts.
     *
     * @return {@code null} when the key does not have exactly three parts under this prefix
     */
    public @Nullable RecordKey parse(@NotNull String key) {
        int first = key.indexOf(SEPARATOR);
        int last = key.lastIndexOf(SEPARATOR);
        if (first < 0 || first == last) {
            return null;
        }
        String keyPrefix = key.substring(0, first);
        String modelName = key.substring(first + 1, last);
        if (!prefix.equals(keyPrefix) || modelName.indexOf(SEPARATOR) >= 0) {
            return null;
        }
        return new RecordKey(key, modelName, key.substring(last + 1));
    }

    /**
     * A record key split into its model tag and raw id segment.
     */
    public record RecordKey(String key, String modelName, String rawId) {
        /**
         * @return the numeric id, or {@code null} when the segment is not an integer
         */
        public @Nullable Long id() {
            try {
                return Long.parseLong(rawId);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
