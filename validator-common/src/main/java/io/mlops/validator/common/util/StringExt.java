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

import java.util.Optional;

/**
 * Null tolerant string helpers. Values decoded from custom resources are often absent rather than empty.
 */
public final class StringExt {

    private StringExt() {
    }

    public static boolean isNotEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Returns the trimmed value, or an empty string for null.
     */
    public static String safeTrim(String s) {
        return s == null || s.isEmpty() ? "" : s.trim();
    }

    public static String nonNull(String value) {
        return value == null ? "" : value;
    }

    public static String getNonEmptyOrDefault(String value, String defaultValue) {
        return isNotEmpty(value) ? value : defaultValue;
    }

    /**
     * Cuts the text to the given number of characters, appending the suffix if anything was removed.
     */
    public static String truncate(String text, int maxLength, String suffix) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + suffix;
    }

    /**
     * Parses a decimal integer, ignoring surrounding whitespace. Returns empty for anything else.
     */
    public static Optional<Integer> parseInt(String s) {
        if (isEmpty(s)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(s.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
