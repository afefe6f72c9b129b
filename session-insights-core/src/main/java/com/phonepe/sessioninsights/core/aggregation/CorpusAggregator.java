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

import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.classification.Approach;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.detectors.PatternType;
import com.phonepe.sessioninsights.core.session.SessionRecord;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Reduces session records into a {@link CorpusSummary}. Stateless; the result does not depend on the order of the
 * records.
 */
public class CorpusAggregator {
    static final String UNKNOWN_DATE = "unknown";

    private static final int DATE_LENGTH = 10;

    public CorpusSummary aggregate(@NonNull final Collection<SessionRecord> sessions) {
        return CorpusSummary.builder()
                .totalSessions(sessions.size())
                .approachFrequencies(approachFrequencies(sessions))
                .primaryApproachDistribution(primaryApproachDistribution(sessions))
                .averageTurns(AnalysisUtils.round(AnalysisUtils.mean(sessions, SessionRecord::getTurnCount), 2))
                .averageDurationMinutes(AnalysisUtils.round(
                        AnalysisUtils.mean(sessions, SessionRecord::getDurationMinutes), 2))
                .averageMessages(AnalysisUtils.round(
                        AnalysisUtils.mean(sessions, SessionRecord::getMessageCount), 2))
                .patternStatistics(patternStatistics(sessions))
                .successIndicatorCounts(successIndicatorCounts(sessions))
                .sessionsByDate(sessionsByDate(sessions))
                .dateRange(dateRange(sessions))
                .timeline(timeline(sessions))
                .build();
    }

    static Map<String, Long> approachFrequencies(final Collection<SessionRecord> sessions) {
        final var counts = new EnumMap<Approach, Long>(Approach.class);
        sessions.forEach(session -> session.getApproaches()
                .forEach(approach -> counts.merge(approach, 1L, Long::sum)));
        return byLabel(counts);
    }

    static Map<String, Long> primaryApproachDistribution(final Collection<SessionRecord> sessions) {
        final var counts = new EnumMap<Approach, Long>(Approach.class);
        sessions.forEach(session -> counts.merge(session.getPrimaryApproach(), 1L, Long::sum));
        return byLabel(counts);
    }

    static PatternStatistics patternStatistics(final Collection<SessionRecord> sessions) {
        return PatternStatistics.builder()
                .iterativeSessions(count(sessions, session -> session.detected(PatternType.ITERATION)))
                .exploratorySessions(count(sessions, session -> session.detected(PatternType.EXPLORATION)))
                .implementationSessions(count(sessions, session -> session.detected(PatternType.IMPLEMENTATION)))
                .delegatedSessions(count(sessions, session -> session.detected(PatternType.DELEGATION)))
                .validatedSessions(count(sessions, session -> session.detected(PatternType.VALIDATION)))
                .errorRecoverySessions(count(sessions, session -> session.detected(PatternType.ERROR_RECOVERY)))
                .build();
    }

    static Map<String, Long> successIndicatorCounts(final Collection<SessionRecord> sessions) {
        final var counts = new LinkedHashMap<String, Long>();
        Arrays.stream(SuccessIndicator.values())
                .forEach(indicator -> counts.put(indicator.getLabel(),
                                                 count(sessions, session -> session.hasIndicator(indicator))));
        return Collections.unmodifiableMap(counts);
    }

    static Map<String, Long> sessionsByDate(final Collection<SessionRecord> sessions) {
        return Collections.unmodifiableMap(sessions.stream()
                .collect(Collectors.groupingBy(CorpusAggregator::dateKey,
                                               TreeMap::new,
                                               Collectors.counting())));
    }

    static DateRange dateRange(final Collection<SessionRecord> sessions) {
        final var dated = datedSessions(sessions);
        if (dated.isEmpty()) {
            return null;
        }
        return new DateRange(dated.firstKey(), dated.lastKey());
    }

    static List<DailyActivity> timeline(final Collection<SessionRecord> sessions) {
        return datedSessions(sessions).entrySet()
                .stream()
                .map(entry -> {
                    final var daySessions = entry.getValue();
                    return DailyActivity.builder()
                            .date(entry.getKey())
                            .totalSessions(daySessions.size())
                            .exploratory(countApproach(daySessions, Approach.EXPLORATORY_INVESTIGATION))
                            .errorRecovery(countApproach(daySessions, Approach.ERROR_RECOVERY))
                            .validation(countApproach(daySessions, Approach.VALIDATION_DRIVEN))
                            .directImplementation(countApproach(daySessions, Approach.DIRECT_IMPLEMENTATION))
                            .build();
                })
                .toList();
    }

    static String dateKey(final SessionRecord session) {
        final var created = session.getCreated();
        if (Strings.isNullOrEmpty(created)) {
            return UNKNOWN_DATE;
        }
        return created.length() > DATE_LENGTH ? created.substring(0, DATE_LENGTH) : created;
    }

    private static TreeMap<String, List<SessionRecord>> datedSessions(final Collection<SessionRecord> sessions) {
        return sessions.stream()
                .filter(session -> !Strings.isNullOrEmpty(session.getCreated()))
                .collect(Collectors.groupingBy(CorpusAggregator::dateKey, TreeMap::new, Collectors.toList()));
    }

    private static long countApproach(final Collection<SessionRecord> sessions, Approach approach) {
        return count(sessions, session -> session.hasApproach(approach));
    }

    private static long count(final Collection<SessionRecord> sessions, Predicate<SessionRecord> predicate) {
        return sessions.stream().filter(predicate).count();
    }

    private static Map<String, Long> byLabel(final EnumMap<Approach, Long> counts) {
        return Collections.unmodifiableMap(counts.entrySet()
                .stream()
                .collect(Collectors.toMap(entry -> entry.getKey().getLabel(),
                                          Map.Entry::getValue,
                                          Long::sum,
                                          LinkedHashMap::new)));
    }
}
