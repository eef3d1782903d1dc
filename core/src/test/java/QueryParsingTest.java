import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.options.FilterOperator;
import io.github.flameyossnowy.kvmodels.api.options.FilterOption;
import io.github.flameyossnowy.kvmodels.api.options.Query;
import io.github.flameyossnowy.kvmodels.api.options.SelectQuery;
import io.github.flameyossnowy.kvmodels.api.options.SortOption;
import io.github.flameyossnowy.kvmodels.api.options.SortOrder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryParsingTest {

    @Test
    void bareFieldIsExactMatch() {
        FilterOption filter = Query.parseFilter("token", "abc");
        assertEquals(List.of("token"), filter.path());
        assertEquals(FilterOperator.EXACT, filter.operator());
        assertEquals("abc", filter.operand());
    }

    @Test
    void trailingOperatorIsSplitOff() {
        FilterOption filter = Query.parseFilter("created__gte", 5);
        assertEquals(List.of("created"), filter.path());
        assertEquals(FilterOperator.GTE, filter.operator());
    }

    @Test
    void nestedPathWithAndWithoutOperator() {
        FilterOption withOperator = Query.parseFilter("nested__target__status__iexact", "ok");
        assertEquals(List.of("nested", "target", "status"), withOperator.path());
        assertEquals(FilterOperator.IEXACT, withOperator.operator());
        assertEquals("nested", withOperator.fieldName());
        assertEquals(List.of("target", "status"), withOperator.nestedPath());

        FilterOption exact = Query.parseFilter("nested__target__status", "ok");
        assertEquals(List.of("nested", "target", "status"), exact.path());
        assertEquals(FilterOperator.EXACT, exact.operator());
    }

    @Test
    void fieldNamedLikeAnOperatorIsStillAField() {
        FilterOption filter = Query.parseFilter("range", 3);
        assertEquals(List.of("range"), filter.path());
        assertEquals(FilterOperator.EXACT, filter.operator());
    }

    @Test
    void everyOperatorSuffixIsRecognized() {
        for (FilterOperator operator : FilterOperator.values()) {
            Object operand = operator == FilterOperator.ISNULL ? Boolean.TRUE : "x";
            assertEquals(operator, Query.parseFilter("f__" + operator.suffix(), operand).operator());
        }
    }

    @Test
    void malformedLookupsFail() {
        assertThrows(ValidationException.class, () -> Query.parseFilter("a____b", 1));
        assertThrows(ValidationException.class, () -> Query.parseFilter("__gte", 1));
        assertThrows(ValidationException.class, () -> Query.parseFilter("a__isnull", "yes"));
        assertThrows(ValidationException.class, () -> FilterOperator.fromSuffix("bogus"));
    }

    @Test
    void builderCollectsFiltersSortsAndLimit() {
        SelectQuery query = Query.select()
            .where("token").eq("abc")
            .where("nested", "target", "status").in(List.of("ok", "fail"))
            .orderBy("-created")
            .orderBy("token", SortOrder.ASCENDING)
            .limit(10)
            .build();

        assertEquals(2, query.filters().size());
        assertEquals(List.of("nested", "target", "status"), query.filters().get(1).path());
        assertEquals(FilterOperator.IN, query.filters().get(1).operator());
        assertEquals(List.of(new SortOption("created", SortOrder.DESCENDING), new SortOption("token", SortOrder.ASCENDING)), query.sortOptions());
        assertTrue(query.hasLimit());
        assertEquals(10, query.limit());
        assertFalse(SelectQuery.ALL.hasLimit());
    }

    @Test
    void parseBuildsOneFilterPerLookup() {
        SelectQuery query = Query.parse(Map.of("token", "abc", "created__lt", 3));
        assertEquals(2, query.filters().size());
        assertTrue(query.sortOptions().isEmpty());
    }

    @Test
    void sortOptionParsing() {
        assertEquals(new SortOption("created", SortOrder.DESCENDING), SortOption.parse("-created"));
        assertEquals(new SortOption("created", SortOrder.ASCENDING), SortOption.parse("created"));
        assertThrows(ValidationException.class, () -> SortOption.parse("-"));
    }

    @Test
    void rangeBuilderForms() {
        SelectQuery query = Query.select().where("n").range(3).where("m").range(1, 5).build();
        assertEquals(3, query.filters().get(0).operand());
        assertEquals(List.of(1, 5), query.filters().get(1).operand());
    }
}
