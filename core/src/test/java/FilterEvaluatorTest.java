import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.Fields;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.options.FilterOperator;
import io.github.flameyossnowy.kvmodels.api.options.FilterOption;
import io.github.flameyossnowy.kvmodels.api.query.FilterEvaluator;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterEvaluatorTest {

    private static boolean test(FilterOperator operator, Object operand, Object value) {
        return FilterEvaluator.test(new FilterOption(List.of("f"), operator, operand), value);
    }

    @Test
    void exactComparesNumbersByValue() {
        assertTrue(test(FilterOperator.EXACT, 5, 5L));
        assertTrue(test(FilterOperator.EXACT, 2.0, 2L));
        assertFalse(test(FilterOperator.EXACT, 5, 6L));
        assertTrue(test(FilterOperator.EXACT, null, null));
        assertFalse(test(FilterOperator.EXACT, "x", null));
    }

    @Test
    void caseInsensitiveOperators() {
        assertTrue(test(FilterOperator.IEXACT, "hello", "HeLLo"));
        assertTrue(test(FilterOperator.ISTARTSWITH, "he", "HeLLo"));
        assertTrue(test(FilterOperator.IENDSWITH, "LO", "hello"));
        assertFalse(test(FilterOperator.STARTSWITH, "he", "HeLLo"));
        assertTrue(test(FilterOperator.STARTSWITH, "He", "HeLLo"));
        assertTrue(test(FilterOperator.ENDSWITH, "Lo", "HeLLo"));
    }

    @Test
    void containsLooksInsideTheFieldValue() {
        assertTrue(test(FilterOperator.CONTAINS, "ell", "hello"));
        assertTrue(test(FilterOperator.CONTAINS, 2, List.of(1, 2, 3)));
        assertFalse(test(FilterOperator.CONTAINS, 4, List.of(1, 2, 3)));
        assertTrue(test(FilterOperator.CONTAINS, "name", Map.of("name", "Alice")));
        assertFalse(test(FilterOperator.CONTAINS, "x", null));
    }

    @Test
    void inChecksMembership() {
        assertTrue(test(FilterOperator.IN, List.of("ok", "fail"), "ok"));
        assertFalse(test(FilterOperator.IN, List.of("ok", "fail"), "bogus"));
        assertThrows(ValidationException.class, () -> test(FilterOperator.IN, "ok", "ok"));
    }

    @Test
    void orderingOperators() {
        assertTrue(test(FilterOperator.GT, 1, 2L));
        assertFalse(test(FilterOperator.GT, 2, 2L));
        assertTrue(test(FilterOperator.GTE, 2, 2L));
        assertTrue(test(FilterOperator.LT, 2.5, 2L));
        assertTrue(test(FilterOperator.LTE, 2, 2L));
        assertFalse(test(FilterOperator.GT, 1, null));
        assertThrows(ValidationException.class, () -> test(FilterOperator.GT, 1, "two"));
    }

    @Test
    void dateTimesAreComparedInUtc() {
        OffsetDateTime utc = OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);
        OffsetDateTime sameInstant = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2));

        assertTrue(test(FilterOperator.EXACT, sameInstant, utc));
        assertTrue(test(FilterOperator.GTE, sameInstant, utc));
        assertFalse(test(FilterOperator.GT, sameInstant, utc));
        assertTrue(test(FilterOperator.LT, sameInstant.plusSeconds(1), utc));
    }

    @Test
    void rangeAcceptsAnUpperBoundOrAnInclusivePair() {
        assertTrue(test(FilterOperator.RANGE, 10, 3L));
        assertTrue(test(FilterOperator.RANGE, 10, 0L));
        assertFalse(test(FilterOperator.RANGE, 10, 10L));
        assertFalse(test(FilterOperator.RANGE, 10, -1L));
        assertTrue(test(FilterOperator.RANGE, List.of(2, 4), 4L));
        assertFalse(test(FilterOperator.RANGE, List.of(2, 4), 5L));
        assertThrows(ValidationException.class, () -> test(FilterOperator.RANGE, List.of(1, 2, 3), 2L));
    }

    @Test
    void isNullComparesNullness() {
        assertTrue(test(FilterOperator.ISNULL, true, null));
        assertFalse(test(FilterOperator.ISNULL, true, "x"));
        assertTrue(test(FilterOperator.ISNULL, false, "x"));
    }

    @Test
    void nestedPathIndexesIntoReferencedInstances() {
        ModelSchema target = ModelSchema.builder("Target").field("status", Fields.string()).build();
        ModelInstance ok = target.newInstance(Map.of("status", "ok"));
        ModelInstance fail = target.newInstance(Map.of("status", "fail"));

        FilterOption statusOk = new FilterOption(List.of("target", "status"), FilterOperator.EXACT, "ok");
        assertTrue(FilterEvaluator.test(statusOk, ok));
        assertFalse(FilterEvaluator.test(statusOk, fail));
        assertTrue(FilterEvaluator.test(statusOk, List.of(fail, ok)));
        assertFalse(FilterEvaluator.test(statusOk, List.of()));
    }

    @Test
    void nullLinkFailsEveryOperatorButIsNull() {
        FilterOption statusNull = new FilterOption(List.of("target", "status"), FilterOperator.ISNULL, true);
        FilterOption statusNotNull = new FilterOption(List.of("target", "status"), FilterOperator.ISNULL, false);
        FilterOption statusOk = new FilterOption(List.of("target", "status"), FilterOperator.EXACT, "ok");
        FilterOption statusIsNone = new FilterOption(List.of("target", "status"), FilterOperator.EXACT, null);

        assertTrue(FilterEvaluator.test(statusNull, null));
        assertFalse(FilterEvaluator.test(statusNotNull, null));
        assertFalse(FilterEvaluator.test(statusOk, null));
        assertFalse(FilterEvaluator.test(statusIsNone, null));
        assertFalse(FilterEvaluator.test(statusIsNone, List.of()));
        assertTrue(FilterEvaluator.test(statusNull, List.of()));
    }

    @Test
    void referenceMatchesInstanceOrId() {
        ModelSchema target = ModelSchema.builder("Target").build();
        ModelInstance instance = target.newInstance();
        instance.assignId(4);
        ModelInstance copy = target.newInstance();
        copy.assignId(4);

        assertTrue(test(FilterOperator.EXACT, copy, instance));
        assertTrue(test(FilterOperator.EXACT, 4, instance));
        assertFalse(test(FilterOperator.EXACT, 5, instance));
    }
}
