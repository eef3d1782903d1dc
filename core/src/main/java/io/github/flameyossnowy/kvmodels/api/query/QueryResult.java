package io.github.flameyossnowy.kvmodels.api.query;

import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.SortOption;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The instances a query matched. Unordered unless {@link #orderBy(String)} was applied.
 */
public final class QueryResult implements Iterable<ModelInstance> {
    private final ModelSchema schema;
    private final List<ModelInstance> results;

    public QueryResult(@NotNull ModelSchema schema, @NotNull List<ModelInstance> results) {
        this.schema = schema;
        this.results = Collections.unmodifiableList(results);
    }

    public @NotNull ModelSchema schema() {
        return schema;
    }

    /**
     * Returns the results sorted by one field, ascending for {@code "field"} and descending for
     * {@code "-field"}. Nulls sort first in ascending order.
     *
     * @throws io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException if the field is not in the schema
     */
    public @NotNull QueryResult orderBy(@NotNull String expression) {
        List<ModelInstance> sorted = new ArrayList<>(results);
        sorted.sort(QueryEngine.comparator(schema, List.of(SortOption.parse(expression))));
        return new QueryResult(schema, sorted);
    }

    public long count() {
        return results.size();
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public @NotNull ModelInstance get(int index) {
        return results.get(index);
    }

    public @NotNull Optional<ModelInstance> first() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public @NotNull List<ModelInstance> asList() {
        return results;
    }

    /**
     * Groups the results by id, keeping their current order.
     */
    public @NotNull Map<Long, ModelInstance> asMap() {
        Map<Long, ModelInstance> byId = new LinkedHashMap<>(results.size() * 2);
        for (ModelInstance instance : results) {
            byId.put(instance.getId(), instance);
        }
        return byId;
    }

    /**
     * Projects every result onto the given fields.
     *
     * @throws io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException if a field is not in the schema
     */
    public @NotNull List<Map<String, Object>> values(@NotNull String... fields) {
        for (String field : fields) {
            schema.requireField(field);
        }

        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        for (ModelInstance instance : results) {
            Map<String, Object> row = new LinkedHashMap<>(fields.length * 2);
            for (String field : fields) {
                row.put(field, instance.get(field));
            }
            rows.add(row);
        }
        return rows;
    }

    public @NotNull Stream<ModelInstance> stream() {
        return results.stream();
    }

    @Override
    public @NotNull Iterator<ModelInstance> iterator() {
        return results.iterator();
    }

    @Override
    public String toString() {
        return "QueryResult{" + schema.name() + ", " + results + '}';
    }
}
