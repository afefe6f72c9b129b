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

package com.phonepe.sessioninsights.core.aggregation;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Corpus wide statistics over all analysed sessions
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"total_sessions", "approach_frequencies", "primary_approach_distribution", "average_turns",
        "average_duration_minutes", "average_messages", "pattern_statistics", "success_indicator_counts",
        "sessions_by_date", "date_range", "timeline"})
public class CorpusSummary {
    long totalSessions;

    /**
     * Sessions per approach label. A session with several labels counts once for each of them.
     */
    @NonNull
    Map<String, Long> approachFrequencies;

    /**
     * Sessions per primary approach. Sums to {@link #totalSessions}.
     */
    @NonNull
    Map<String, Long> primaryApproachDistribution;

    double averageTurns;
    double averageDurationMinutes;
    double averageMessages;

    @NonNull
    PatternStatistics patternStatistics;

    @NonNull
    Map<String, Long> successIndicatorCounts;

    /**
     * Sessions per creation date, ascending by date. Sessions without a creation time are under "unknown".
     */
    @NonNull
    Map<String, Long> sessionsByDate;

    /**
     * Null when no session has a creation time
     */
    DateRange dateRange;

    @NonNull
    List<DailyActivity> timeline;

    /**
     * @return count as a percentage of all sessions, 0 for an empty corpus
     */
    public double percentage(long count) {
        return AnalysisUtils.percentage(count, totalSessions);
    }
}
