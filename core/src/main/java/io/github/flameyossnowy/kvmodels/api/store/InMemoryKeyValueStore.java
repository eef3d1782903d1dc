package io.github.flameyossnowy.kvmodels.api.store;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Process-local store backed by a {@link ConcurrentHashMap}.
 * <p>
 * Single-key operations and {@link #increment(String)} are atomic. Multi-key operations are not.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentMap<String, String> data = new ConcurrentHashMap<>(128);
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>(16);

    @Override
    public @Nullable String get(@NotNull String key) {
        return data.get(key);
    }

    @Override
    public void set(@NotNull String key, @NotNull String value) {
        data.put(key, value);
    }

    @Override
    public @NotNull List<@Nullable String> multiGet(@NotNull List<String> keys) {
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(data.get(key));
        }
        return values;
    }

    @Override
    public void multiSet(@NotNull Map<String, String> entries) {
        data.putAll(entries);
    }

    @Override
    public long delete(@NotNull Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            if (data.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public @NotNull Collection<String> listKeys(@NotNull String pattern) {
        Pattern regex = compile(pattern);
        List<String> keys = new ArrayList<>();
        for (String key : data.keySet()) {
            if (regex.matcher(key).matches()) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public @NotNull Iterator<String> scanKeys(@NotNull String pattern) {
        Pattern regex = compile(pattern);
        // weakly consistent, like a SCAN cursor
        return data.keySet().stream().filter(key -> regex.matcher(key).matches()).iterator();
    }

    @Override
    public long increment(@NotNull String key) {
        String next = data.merge(key, "1", (current, one) -> Long.toString(Long.parseLong(current) + 1L));
        return Long.parseLong(next);
    }

    public int size() {
        return data.size();
    }

    private Pattern compile(String glob) {
        return patternCache.computeIfAbsent(glob, InMemoryKeyValueStore::globToRegex);
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '\\' && i + 1 < glob.length()) {
                    regex.append('\\').append(glob.charAt(++i));
                } else {
                    regex.append(c);
                }
                continue;
            }

            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    inClass = true;
                    regex.append('[');
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '^') {
                        regex.append('^');
                        i++;
                    }
                }
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        if (inClass) {
            regex.append(']');
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
