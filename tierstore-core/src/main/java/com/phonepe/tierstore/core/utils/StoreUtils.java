package com.phonepe.tierstore.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Small helpers shared by the stores
 */
@UtilityClass
public class StoreUtils {
    private static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FILE_STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneOffset.UTC);

    /**
     * Returns at most {@code maxCodePoints} leading code points of the text. Never splits a surrogate pair.
     *
     * @param text          Source text, may be null
     * @param maxCodePoints Upper bound on the result length in code points
     * @return Prefix of the text, empty string for null input
     */
    public static String prefix(final String text, int maxCodePoints) {
        if (Strings.isNullOrEmpty(text)) {
            return "";
        }
        final var available = text.codePointCount(0, text.length());
        if (available <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    /**
     * Archive bucket a record with the given timestamp belongs to. Buckets are UTC calendar months.
     */
    public static String bucketKey(final Instant timestamp) {
        return BUCKET_FORMAT.format(timestamp);
    }

    /**
     * Timestamp fragment used in file names. Sorts lexically in chronological order.
     */
    public static String fileStamp(final Instant timestamp) {
        return FILE_STAMP_FORMAT.format(timestamp);
    }
}
