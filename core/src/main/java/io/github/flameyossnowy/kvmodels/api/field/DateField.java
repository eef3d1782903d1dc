package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stored as {@code yyyy.MM.dd}. Date-times are accepted and keep only their date part.
 */
public class DateField extends FieldSpec<LocalDate> {
    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu.MM.dd");

    public DateField(@NotNull FieldSettings settings) {
        super(settings);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.DATE;
    }

    @Override
    protected @NotNull FieldSpec<LocalDate> withSettings(@NotNull FieldSettings settings) {
        return new DateField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        throw wrongType(value, "LocalDate, LocalDateTime, OffsetDateTime, ZonedDateTime");
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return FORMAT.format((LocalDate) normalized);
    }

    @Override
    protected @NotNull LocalDate read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (!(raw instanceof String text)) {
            throw wrongType(raw, "String");
        }
        try {
            return LocalDate.parse(text, FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException("'" + text + "' does not match yyyy.MM.dd", e);
        }
    }
}
