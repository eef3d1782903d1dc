package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.json.DefaultJsonCodec;
import io.github.flameyossnowy.kvmodels.api.json.JsonCodec;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factories for every field kind.
 *
 * <pre>{@code
 * ModelSchema.builder("Task")
 *     .field("status", Fields.string().defaultValue("in_work").choices(STATUSES).notNull())
 *     .field("created", Fields.dateTime().defaultGenerator(OffsetDateTime::now))
 *     .field("session", Fields.reference("BotSession"))
 *     .build();
 * }</pre>
 */
public final class Fields {
    private static final JsonCodec CODEC = new DefaultJsonCodec();

    private Fields() {
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<String> string() {
        return new StringField(FieldSettings.DEFAULT);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<Number> number() {
        return new NumberField(FieldSettings.DEFAULT);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<Boolean> bool() {
        return new BooleanField(FieldSettings.DEFAULT);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<BigDecimal> decimal() {
        return new DecimalField(FieldSettings.DEFAULT);
    }

    /**
     * Any JSON object or array.
     */
    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<Object> json() {
        return new JsonField(FieldSettings.DEFAULT, JsonField.JSON_TYPES, CODEC);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<Object> dict() {
        return new JsonField(FieldSettings.DEFAULT, Set.of(Map.class), CODEC);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<Object> list() {
        return new JsonField(FieldSettings.DEFAULT, Set.of(List.class), CODEC);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<OffsetDateTime> dateTime() {
        return new DateTimeField(FieldSettings.DEFAULT);
    }

    @Contract(value = "-> new", pure = true)
    public static @NotNull FieldSpec<LocalDate> date() {
        return new DateField(FieldSettings.DEFAULT);
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull ReferenceField reference(@NotNull String targetModel) {
        return new ReferenceField(FieldSettings.DEFAULT, targetModel);
    }

    @Contract(value = "_ -> new", pure = true)
    public static @NotNull ReferenceListField references(@NotNull String targetModel) {
        return new ReferenceListField(FieldSettings.DEFAULT, targetModel, CODEC);
    }
}
