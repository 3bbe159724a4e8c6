/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Utility methods for working with status sections of custom resources
 */
public class StatusUtils {
    private StatusUtils() { }

    /**
     * Returns the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     *
     * @return the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     */
    public static String iso8601Now() {
        return ZonedDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_INSTANT);
    }

    /**
     * Time elapsed from the given timestamp until now. Resources which were never persisted (tests) have no creation
     * timestamp, which gives a zero duration.
     *
     * @param timestamp  Timestamp in ISO 8601 format
     *
     * @return  The elapsed duration
     */
    public static Duration sinceTimestamp(String timestamp) {
        if (timestamp == null) {
            return Duration.ZERO;
        }

        return Duration.between(Instant.parse(timestamp), Instant.now());
    }
}
