/*
 * Copyright 2025 The Notebook Validator Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.mlops.validator.common.util;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Timestamp and duration conversions for the custom resource fields.
 */
public final class DateTimeExt {

    private static final Pattern DURATION_PART_RE = Pattern.compile("(\\d+)(ms|h|m|s)");

    private DateTimeExt() {
    }

    /**
     * Formats epoch milliseconds as an RFC 3339 timestamp in UTC, or returns null for 0.
     */
    public static String toUtcDateTimeString(long msSinceEpoch) {
        if (msSinceEpoch == 0L) {
            return null;
        }
        return Instant.ofEpochMilli(msSinceEpoch).toString();
    }

    /**
     * Parses RFC 3339 timestamp. Returns 0 for null or malformed input.
     */
    public static long fromUtcDateTimeString(String value) {
        if (StringExt.isEmpty(value)) {
            return 0L;
        }
        try {
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }

    /**
     * Parses a compound duration string like "30m", "1h30m", "45s" or "500ms".
     */
    public static Optional<Duration> parseDuration(String value) {
        String trimmed = StringExt.safeTrim(value);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = DURATION_PART_RE.matcher(trimmed);
        Duration result = Duration.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (matcher.start() != position) {
                return Optional.empty();
            }
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "h":
                    result = result.plusHours(amount);
                    break;
                case "m":
                    result = result.plusMinutes(amount);
                    break;
                case "s":
                    result = result.plusSeconds(amount);
                    break;
                default:
                    result = result.plusMillis(amount);
            }
            position = matcher.end();
        }
        return position == trimmed.length() ? Optional.of(result) : Optional.empty();
    }

    /**
     * Formats a duration in the form read by {@link #parseDuration(String)}, for example 90000 as "1m30s".
     */
    public static String toDurationString(long timeMs) {
        if (timeMs <= 0) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        appendPart(sb, timeMs / 3_600_000, "h");
        appendPart(sb, timeMs / 60_000 % 60, "m");
        appendPart(sb, timeMs / 1_000 % 60, "s");
        appendPart(sb, timeMs % 1_000, "ms");
        return sb.toString();
    }

    private static void appendPart(StringBuilder sb, long amount, String unit) {
        if (amount > 0) {
            sb.append(amount).append(unit);
        }
    }
}
