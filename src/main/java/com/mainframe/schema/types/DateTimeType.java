package com.mainframe.schema.types;

import com.mainframe.schema.exception.ConversionException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.function.Supplier;

/**
 * Date-time field holding a {@link LocalDateTime}.
 *
 * Strings are read as ISO-8601 (local, offset or zoned date-time, or a bare date),
 * then with any extra patterns configured on the type, in declaration order.
 * Offset and instant inputs are shifted into {@link #getZone()} before the offset is dropped.
 *
 * <p>The export form is {@code ISO_LOCAL_DATE_TIME} of the stored value. It carries no
 * offset, so an offset or zoned input string exports as the equivalent local time in the
 * configured zone rather than as the text it was read from. Seconds are always written and
 * fractions lose trailing zeros; only local ISO input in that canonical shape exports unchanged.</p>
 */
@Getter
public class DateTimeType extends FieldType<LocalDateTime> {

    private static final Logger log = LoggerFactory.getLogger(DateTimeType.class);

    private final ZoneId zone;
    private final List<DateTimeFormatter> formats;

    public DateTimeType() {
        this(false, null, null, null, null);
    }

    @Builder
    public DateTimeType(boolean required, LocalDateTime defaultValue,
                        @Singular List<FieldValidator<LocalDateTime>> validators,
                        ZoneId zone, @Singular List<String> formats) {
        super(required, defaultValue, List.of(), validators);
        this.zone = zone != null ? zone : ZoneOffset.UTC;
        this.formats = formats == null ? List.of() : formats.stream().map(DateTimeFormatter::ofPattern).toList();
    }

    @Override
    public LocalDateTime convert(Object raw) {
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        if (raw instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (raw instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.atZoneSameInstant(zone).toLocalDateTime();
        }
        if (raw instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.withZoneSameInstant(zone).toLocalDateTime();
        }
        if (raw instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, zone);
        }
        if (raw instanceof Date date) {
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(date.getTime()), zone);
        }
        if (raw instanceof CharSequence text) {
            return parse(text.toString().trim());
        }
        throw new ConversionException("Could not parse " + raw + ". Should be ISO8601.");
    }

    @Override
    public Object toPrimitive(LocalDateTime value, String role) {
        return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
    }

    private LocalDateTime parse(String text) {
        List<Supplier<LocalDateTime>> attempts = new ArrayList<>();
        attempts.add(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        attempts.add(() -> ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME)
                .withZoneSameInstant(zone)
                .toLocalDateTime());
        attempts.add(() -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay());
        for (DateTimeFormatter format : formats) {
            attempts.add(() -> LocalDateTime.parse(text, format));
            attempts.add(() -> LocalDate.parse(text, format).atStartOfDay());
        }

        for (Supplier<LocalDateTime> attempt : attempts) {
            try {
                return attempt.get();
            } catch (DateTimeParseException e) {
                log.trace("Date-time '{}' rejected: {}", text, e.getMessage());
            }
        }
        throw new ConversionException("Could not parse " + text + ". Should be ISO8601.");
    }
}
