/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessioninsights.core.utils;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Small numeric and text helpers used across the analysis
 */
@UtilityClass
public class AnalysisUtils {

    /**
     * Half-even rounding of the exact binary value of the double. So {@code round(2.675, 2)} is 2.67, since 2.675 is
     * stored as 2.67499999...
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return new BigDecimal(value)
                .setScale(places, RoundingMode.HALF_EVEN)
                .doubleValue();
    }

    /**
     * Zero guarded ratio
     */
    public static double ratio(long numerator, long denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0;
    }

    /**
     * Zero guarded percentage, {@code count / total * 100}
     */
    public static double percentage(long count, long total) {
        return ratio(count, total) * 100;
    }

    /**
     * Zero guarded mean. An empty collection averages to 0.
     */
    public static <T> double mean(Collection<T> items, ToDoubleFunction<T> extractor) {
        if (null == items || items.isEmpty()) {
            return 0;
        }
        return items.stream().mapToDouble(extractor).sum() / items.size();
    }

    public static String lower(String value) {
        return Strings.nullToEmpty(value).toLowerCase(Locale.ROOT);
    }

    public static boolean containsAny(String haystack, Collection<String> needles) {
        return needles.stream().anyMatch(haystack::contains);
    }

    /**
     * Keeps at most {@code maxLength} code points. Surrogate pairs are never split.
     */
    public static String truncate(String value, int maxLength) {
        final var text = Strings.nullToEmpty(value);
        if (text.codePointCount(0, text.length()) <= maxLength) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxLength));
    }
}
