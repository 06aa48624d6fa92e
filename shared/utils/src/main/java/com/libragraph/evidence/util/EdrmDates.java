package com.libragraph.evidence.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Date-time rendering used by EDRM load files.
 *
 * <p>Values are always written in UTC with millisecond precision and an explicit
 * {@code +00:00} offset, e.g. {@code 2024-01-01T00:00:00.000+00:00}.
 */
public final class EdrmDates {

    private static final DateTimeFormatter EDRM_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'+00:00'").withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter IMAGE_METADATA_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSS 'UTC'").withZone(ZoneOffset.UTC);

    private EdrmDates() {
    }

    public static String format(Instant instant) {
        return EDRM_FORMAT.format(instant);
    }

    /**
     * Format used by the {@code creation-datetime} property of a logical image's metadata file.
     */
    public static String formatImageTimestamp(Instant instant) {
        return IMAGE_METADATA_FORMAT.format(instant);
    }
}
