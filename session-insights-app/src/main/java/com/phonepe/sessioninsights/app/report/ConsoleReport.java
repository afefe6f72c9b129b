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

package com.phonepe.sessioninsights.app.report;

import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.aggregation.CorpusSummary;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human readable summary of a run
 */
@UtilityClass
public class ConsoleReport {
    private static final String RULE = Strings.repeat("=", 60);

    public static List<String> lines(CorpusSummary summary) {
        final var lines = new ArrayList<String>();
        lines.add(RULE);
        lines.add("SUMMARY STATISTICS");
        lines.add(RULE);
        lines.add("Total Sessions Analyzed: " + summary.getTotalSessions());
        lines.add("Average Turns per Session: " + summary.getAverageTurns());
        lines.add(format("Average Duration: %.1f minutes", summary.getAverageDurationMinutes()));
        lines.add("");
        lines.add("Approach Frequencies:");
        //Stable sort, ties keep priority order
        summary.getApproachFrequencies()
                .entrySet()
                .stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .forEach(entry -> lines.add(countLine(summary, entry.getKey(), entry.getValue())));
        lines.add("");
        lines.add("Pattern Statistics:");
        summary.getPatternStatistics()
                .asMap()
                .forEach((pattern, count) -> lines.add(countLine(summary, pattern, count)));
        lines.add(RULE);
        return lines;
    }

    private static String countLine(CorpusSummary summary, String name, long count) {
        return format("  %s: %d (%.1f%%)", name, count, summary.percentage(count));
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
