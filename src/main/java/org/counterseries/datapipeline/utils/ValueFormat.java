package org.counterseries.datapipeline.utils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Text rendering of pipeline values for CSV and HTML outputs. Absent values render as "".
 */
public final class ValueFormat {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ValueFormat() {
        // Utility class - prevent instantiation
    }

    /**
     * Integral values print without a fraction ({@code 120}), others in plain notation
     * ({@code 2.5}, never {@code 2.5E-4}).
     */
    public static String number(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return "";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString(value.longValue());
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String timestamp(LocalDateTime value) {
        return value == null ? "" : TIMESTAMP_FORMAT.format(value);
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9._-]} with {@code _} so that source and
     * item ids can be embedded in file names.
     */
    public static String fileNamePart(String value) {
        if (value == null || value.isEmpty()) {
            return "_";
        }
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
