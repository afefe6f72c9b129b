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
import com.phonepe.sessioninsights.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistant;
import static com.phonepe.sessioninsights.core.utils.TestMessages.assistantCalling;
import static com.phonepe.sessioninsights.core.utils.TestMessages.metadata;
import static com.phonepe.sessioninsights.core.utils.TestMessages.session;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionAnalyzerTest {

    @Test
    void analyzesSourceAndSkipsUnusableSessions() {
        final var source = mock(SessionSource.class);
        when(source.readSessions()).thenReturn(corpus());
        final var report = new SessionAnalyzer().analyze(source);
        assertAll(
                () -> assertEquals(3, report.getSessions().size()),
                () -> assertEquals(3, report.getSummary().getTotalSessions()),
                () -> assertEquals(List.of("s1", "s2", "s4"),
                                   report.getSessions().stream().map(SessionRecord::getSessionId).toList()),
                () -> report.getSessions().forEach(record -> {
                    assertFalse(record.getApproaches().isEmpty());
                    assertEquals(record.getApproaches().get(0), record.getPrimaryApproach());
                }));
        verify(source, times(1)).readSessions();
    }

    @Test
    void everySessionIsSummarizedExactlyOnce() {
        final var summarizer = spy(new SessionSummarizer());
        final var analyzer = new SessionAnalyzer(summarizer, new CorpusAggregator());
        analyzer.analyze(corpus());
        verify(summarizer, times(4)).summarize(any(RawSession.class));
    }

    @Test
    @SneakyThrows
    void repeatedRunsProduceIdenticalJson() {
        final var mapper = JsonUtils.createMapper();
        final var analyzer = new SessionAnalyzer();
        final var first = mapper.writeValueAsString(analyzer.analyze(corpus()));
        final var second = mapper.writeValueAsString(analyzer.analyze(corpus()));
        assertEquals(first, second);
    }

    private static List<RawSession> corpus() {
        return List.of(
                session("s1", "2025-01-15T10:00:00", user("Use planner agent please"), assistant("ok")),
                session("s2", "2025-01-15T11:00:00",
                        assistantCalling("read_file"), tool("Error: failed"), assistant("retry")),
                session(metadata("s3", "2025-01-16T09:00:00", 3), List.of()),
                session("s4", "2025-01-16T10:00:00", user("fix this"), user("update that")));
    }
}
