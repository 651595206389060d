package org.perles.engine.store;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses the timestamp text SQLite stores.
 *
 * Accepts ISO-8601 instants and offsets ({@code 2024-01-15T10:00:00Z}), SQLite's own
 * {@code 2024-01-15 10:00:00} form (read as UTC) and bare dates.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @return The parsed instant, or null when the text is null or blank
     * @throws SQLException If the text is not a recognized timestamp
     */
    public static Instant parse(String text) throws SQLException {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            String iso = value.replace(' ', 'T');
            if (iso.endsWith("Z") || hasOffset(iso)) {
                return OffsetDateTime.parse(iso).toInstant();
            }
            return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new SQLException("Unrecognized timestamp: '" + text + "'", e);
        }
    }

    private static boolean hasOffset(String iso) {
        int timeStart = iso.indexOf('T');
        return timeStart > 0 && (iso.indexOf('+', timeStart) > 0 || iso.indexOf('-', timeStart) > 0);
    }
}
