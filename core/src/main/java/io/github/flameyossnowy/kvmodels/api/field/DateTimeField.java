package io.github.flameyossnowy.kvmodels.api.field;

import io.github.flameyossnowy.kvmodels.api.exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Stored as {@code yyyy.MM.dd-HH:mm:ss+UTC}. Values are converted to UTC and truncated to seconds;
 * a {@link LocalDateTime} is taken to already be in UTC.
 */
public class DateTimeField extends FieldSpec<OffsetDateTime> {
    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuu.MM.dd-HH:mm:ss'+UTC'");

    public DateTimeField(@NotNull FieldSettings settings) {
        super(settings);
    }

    @Override
    public @NotNull FieldKind kind() {
        return FieldKind.DATE_TIME;
    }

    @Override
    protected @NotNull FieldSpec<OffsetDateTime> withSettings(@NotNull FieldSettings settings) {
        return new DateTimeField(settings);
    }

    @Override
    protected @NotNull Object normalize(@NotNull Object value) {
        OffsetDateTime utc = toUtc(value);
        if (utc == null) {
            throw wrongType(value, "OffsetDateTime, ZonedDateTime, Instant, LocalDateTime");
        }
        return utc.truncatedTo(ChronoUnit.SECONDS);
    }

    @Override
    protected @NotNull Object serialize(@NotNull Object normalized) {
        return FORMAT.format((OffsetDateTime) normalized);
    }

    @Override
    protected @NotNull OffsetDateTime read(@NotNull Object raw, @NotNull DeserializationContext context) {
        if (!(raw instanceof String text)) {
            throw wrongType(raw, "String");
        }
        try {
            return LocalDateTime.parse(text, FORMAT).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("'" + text + "' does not match yyyy.MM.dd-HH:mm:ss+UTC", e);
        }
    }

    /**
     * @return {@code value} at offset UTC, or {@code null} if it is not a date-time
     */
    public static OffsetDateTime toUtc(Object value) {
        if (value instanceof OffsetDateTime offset) {
            return offset.withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toOffsetDateTime().withOffsetSameInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime local) {
            return local.atOffset(ZoneOffset.UTC);
        }
        return null;
    }
}
