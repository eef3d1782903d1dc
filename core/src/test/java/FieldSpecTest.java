import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import io.github.flameyossnowy.kvmodels.api.field.DeserializationContext;
import io.github.flameyossnowy.kvmodels.api.field.FieldSpec;
import io.github.flameyossnowy.kvmodels.api.field.Fields;
import io.github.flameyossnowy.kvmodels.api.json.DefaultJsonCodec;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import io.github.flameyossnowy.kvmodels.api.meta.ModelInstance;
import io.github.flameyossnowy.kvmodels.api.meta.ModelSchema;
import io.github.flameyossnowy.kvmodels.api.relationship.RelationResolver;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FieldSpecTest {
    private static final JsonCodec CODEC = new DefaultJsonCodec();

    private static final RelationResolver NO_RELATIONS = new RelationResolver() {
        @Override
        public @NotNull ModelInstance resolveOne(@NotNull String modelName, long id) {
            throw new ValidationException("no " + modelName + " with id " + id);
        }

        @Override
        public @NotNull List<ModelInstance> resolveMany(@NotNull String modelName, @NotNull Collection<Long> ids) {
            return List.of();
        }
    };

    private static final DeserializationContext STRICT = context(false);
    private static final DeserializationContext LENIENT = context(true);

    private static DeserializationContext context(boolean lenient) {
        return new DeserializationContext() {
            @Override
            public boolean lenient() {
                return lenient;
            }

            @Override
            public @NotNull RelationResolver relations() {
                return NO_RELATIONS;
            }
        };
    }

    /**
     * Cleans a value, writes it into a JSON record, reads the record back and deserializes the field.
     */
    private static <V> V roundTrip(FieldSpec<V> spec, Object value) {
        Map<String, Object> record = new HashMap<>();
        record.put("f", spec.clean(value));
        String json = CODEC.serialize(record);
        Map<?, ?> decoded = CODEC.deserialize(json, Map.class);
        return spec.deserialize(decoded.get("f"), STRICT);
    }

    @Test
    void string_roundTrip() {
        assertEquals("hello", roundTrip(Fields.string(), "hello"));
    }

    @Test
    void number_keepsIntegralAndFractionalApart() {
        assertEquals(42L, roundTrip(Fields.number(), 42));
        assertEquals(2.5, roundTrip(Fields.number(), 2.5));
        assertEquals(Long.MAX_VALUE, roundTrip(Fields.number(), Long.MAX_VALUE));
    }

    @Test
    void number_rejectsStringsAndNonFiniteValues() {
        FieldSpec<Number> spec = Fields.number();
        assertThrows(ValidationException.class, () -> spec.clean("5"));
        assertThrows(ValidationException.class, () -> spec.clean(Double.NaN));
        assertThrows(ValidationException.class, () -> spec.clean(Double.POSITIVE_INFINITY));
    }

    @Test
    void boolean_isStoredAsOneOrZero() {
        FieldSpec<Boolean> spec = Fields.bool();
        assertEquals(1, spec.clean(true));
        assertEquals(0, spec.clean(false));
        assertEquals(Boolean.TRUE, roundTrip(spec, true));
        assertEquals(Boolean.FALSE, roundTrip(spec, false));
        assertThrows(ValidationException.class, () -> spec.clean("yes"));
    }

    @Test
    void decimal_isCanonicalAfterRoundTrip() {
        assertEquals(new BigDecimal("12.5"), roundTrip(Fields.decimal(), new BigDecimal("12.50")));
        assertEquals(new BigDecimal("3"), roundTrip(Fields.decimal(), 3));
        assertEquals(new BigDecimal("0.1"), roundTrip(Fields.decimal(), 0.1));
    }

    @Test
    void decimal_rejectsDigitsADoubleCanNotHold() {
        FieldSpec<BigDecimal> spec = Fields.decimal();
        assertThrows(ValidationException.class, () -> spec.clean(new BigDecimal("0.12345678901234567891")));
        assertThrows(ValidationException.class, () -> spec.clean(new BigDecimal("1e400")));
        assertEquals(new BigDecimal("0.12345678901234568"), roundTrip(spec, new BigDecimal("0.12345678901234568")));
    }

    @Test
    void json_acceptsOnlyAllowedContainers() {
        Map<String, Object> payload = Map.of("name", "Alice", "tags", List.of("a", "b"));
        assertEquals(payload, roundTrip(Fields.dict(), payload));
        assertEquals(List.of(1, "x"), roundTrip(Fields.list(), List.of(1, "x")));
        assertEquals(List.of(1, 2), roundTrip(Fields.json(), List.of(1, 2)));

        assertThrows(ValidationException.class, () -> Fields.dict().clean(List.of(1)));
        assertThrows(ValidationException.class, () -> Fields.list().clean(Map.of("a", 1)));
        assertThrows(ValidationException.class, () -> Fields.json().clean("not a container"));
    }

    @Test
    void json_storedValueOfWrongTypeFailsOnRead() {
        assertThrows(ValidationException.class, () -> Fields.dict().deserialize("[1,2]", STRICT));
        assertThrows(ValidationException.class, () -> Fields.dict().deserialize("{broken", STRICT));
    }

    @Test
    void dateTime_isStoredInUtcWithSecondPrecision() {
        OffsetDateTime local = OffsetDateTime.of(2024, 5, 1, 10, 20, 30, 999_000_000, ZoneOffset.ofHours(2));
        FieldSpec<OffsetDateTime> spec = Fields.dateTime();

        assertEquals("2024.05.01-08:20:30+UTC", spec.clean(local));
        assertEquals(OffsetDateTime.of(2024, 5, 1, 8, 20, 30, 0, ZoneOffset.UTC), roundTrip(spec, local));
        assertEquals(OffsetDateTime.of(2024, 5, 1, 8, 0, 0, 0, ZoneOffset.UTC),
            roundTrip(spec, LocalDateTime.of(2024, 5, 1, 8, 0)));
        assertThrows(ValidationException.class, () -> spec.clean("2024.05.01-08:20:30+UTC"));
        assertThrows(ValidationException.class, () -> spec.deserialize("2024-05-01T08:20:30Z", STRICT));
    }

    @Test
    void date_roundTrip() {
        assertEquals("2024.02.29", Fields.date().clean(LocalDate.of(2024, 2, 29)));
        assertEquals(LocalDate.of(2024, 2, 29), roundTrip(Fields.date(), LocalDate.of(2024, 2, 29)));
    }

    @Test
    void notNull_rejectsNullOnClean() {
        FieldSpec<String> spec = Fields.string().notNull();
        ValidationException e = assertThrows(ValidationException.class, () -> spec.clean(null));
        assertTrue(e.getMessage().contains("null"));
    }

    @Test
    void notNull_onReadFollowsLenientToggle() {
        FieldSpec<String> spec = Fields.string().notNull();
        assertNull(spec.deserialize(null, LENIENT));
        assertThrows(ValidationException.class, () -> spec.deserialize(null, STRICT));
    }

    @Test
    void nullableFieldKeepsNull() {
        assertNull(Fields.string().clean(null));
        assertNull(Fields.number().deserialize(null, STRICT));
    }

    @Test
    void defaultValue_isUsedWhenValueIsNull() {
        FieldSpec<String> spec = Fields.string().defaultValue("in_work").notNull();
        assertEquals("in_work", spec.clean(null));
        assertEquals("done", spec.clean("done"));
    }

    @Test
    void defaultGenerator_runsOnEveryClean() {
        AtomicInteger counter = new AtomicInteger();
        FieldSpec<Number> spec = Fields.number().defaultGenerator(counter::incrementAndGet);
        assertEquals(1L, spec.clean(null));
        assertEquals(2L, spec.clean(null));
    }

    @Test
    void choices_restrictValuesAfterNormalization() {
        FieldSpec<String> status = Fields.string().choices(Map.of("ok", "OK", "fail", "Failed"));
        assertEquals("ok", status.clean("ok"));
        assertThrows(ValidationException.class, () -> status.clean("bogus"));

        FieldSpec<Number> level = Fields.number().choices(Map.of(1, "low", 2, "high"));
        assertEquals(1L, level.clean(1L));
        assertThrows(ValidationException.class, () -> level.clean(3));
    }

    @Test
    void modifiersReturnCopies() {
        FieldSpec<String> base = Fields.string();
        FieldSpec<String> required = base.notNull();

        assertNotSame(base, required);
        assertTrue(base.isNullable());
        assertFalse(required.isNullable());
        assertNull(base.choices());
    }

    @Test
    void reference_storesIdAndRejectsUnsavedOrForeignInstances() {
        ModelSchema target = ModelSchema.builder("Target").field("name", Fields.string()).build();
        ModelSchema other = ModelSchema.builder("Other").build();
        FieldSpec<ModelInstance> spec = Fields.reference("Target");

        ModelInstance unsaved = target.newInstance();
        assertThrows(ValidationException.class, () -> spec.clean(unsaved));

        ModelInstance saved = target.newInstance();
        saved.assignId(7);
        assertEquals(7L, spec.clean(saved));
        assertEquals(7L, spec.clean(7));

        ModelInstance foreign = other.newInstance();
        foreign.assignId(7);
        assertThrows(ValidationException.class, () -> spec.clean(foreign));
    }

    @Test
    void reference_readFailsWhenTargetIsMissing() {
        assertThrows(ValidationException.class, () -> Fields.reference("Target").deserialize(3, STRICT));
    }

    @Test
    void references_storeJsonArrayOfIds() {
        ModelSchema target = ModelSchema.builder("Target").build();
        ModelInstance first = target.newInstance();
        first.assignId(1);
        ModelInstance second = target.newInstance();
        second.assignId(2);

        assertEquals("[1,2]", Fields.references("Target").clean(List.of(first, second)));
        assertEquals(List.of(), Fields.references("Target").deserialize("[]", STRICT));
    }
}
