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

package com.phonepe.sessioninsights.core.analysis;

import com.phonepe.sessioninsights.core.aggregation.CorpusAggregator;
import com.phonepe.sessioninsights.core.session.RawSession;
import com.phonepe.sessioninsights.core.session.SessionRecord;
import com.phonepe.sessioninsights.core.session.SessionSummarizer;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the analysis pipeline: every raw session is summarized on its own, then all records are aggregated in one
 * reduction. No state is carried between runs.
 */
@Slf4j
public class SessionAnalyzer {
    private static final int PROGRESS_INTERVAL = 10;

    private final SessionSummarizer summarizer;
    private final CorpusAggregator aggregator;

    public SessionAnalyzer() {
        this(new SessionSummarizer(), new CorpusAggregator());
    }

    public SessionAnalyzer(@NonNull SessionSummarizer summarizer, @NonNull CorpusAggregator aggregator) {
        this.summarizer = summarizer;
        this.aggregator = aggregator;
    }

    public AnalysisReport analyze(@NonNull final SessionSource source) {
        return analyze(source.readSessions());
    }

    public AnalysisReport analyze(@NonNull final List<RawSession> rawSessions) {
        final var records = summarizeAll(rawSessions);
        return new AnalysisReport(records, aggregator.aggregate(records));
    }

    /**
     * @return Records for all analysable sessions, in input order
     */
    public List<SessionRecord> summarizeAll(@NonNull final List<RawSession> rawSessions) {
        log.info("Found {} sessions to analyze...", rawSessions.size());
        final var records = new ArrayList<SessionRecord>(rawSessions.size());
        for (int i = 0; i < rawSessions.size(); i++) {
            if (i % PROGRESS_INTERVAL == 0) {
                log.info("Progress: {}/{}", i, rawSessions.size());
            }
            summarizer.summarize(rawSessions.get(i)).ifPresent(records::add);
        }
        log.info("Analyzed {} sessions, skipped {}", records.size(), rawSessions.size() - records.size());
        return List.copyOf(records);
    }
}
