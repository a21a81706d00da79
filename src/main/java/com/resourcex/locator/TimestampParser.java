package com.resourcex.locator;

import com.resourcex.exception.InvalidInputException;

import java.text.ParsePosition;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses timestamp strings into canonical UTC instants. Accepts ISO instants
 * and offset date-times, local date-times with a 'T' or space separator, and
 * bare dates. Local forms are read as UTC.
 */
public final class TimestampParser {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss]");

    private TimestampParser() {
    }

    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Timestamp must not be empty");
        }
        String value = text.trim();

        try {
            if (matches(DateTimeFormatter.ISO_OFFSET_DATE_TIME, value)) {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            }
            if (matches(DateTimeFormatter.ISO_LOCAL_DATE_TIME, value)) {
                return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
            }
            if (matches(SPACE_SEPARATED, value)) {
                return LocalDateTime.parse(value, SPACE_SEPARATED).toInstant(ZoneOffset.UTC);
            }
            if (matches(DateTimeFormatter.ISO_LOCAL_DATE, value)) {
                return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Invalid timestamp: '" + text + "'", e);
        }
        throw new InvalidInputException("Unparseable timestamp: '" + text + "'");
    }

    private static boolean matches(DateTimeFormatter format, String value) {
        ParsePosition position = new ParsePosition(0);
        return format.parseUnresolved(value, position) != null
                && position.getErrorIndex() < 0
                && position.getIndex() == value.length();
    }
}
