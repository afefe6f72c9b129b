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

package com.phonepe.sessioninsights.core.session;

import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.classification.Approach;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.detectors.PatternDetectors;
import com.phonepe.sessioninsights.core.detectors.PatternType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistant;
import static com.phonepe.sessioninsights.core.utils.TestMessages.assistantCalling;
import static com.phonepe.sessioninsights.core.utils.TestMessages.at;
import static com.phonepe.sessioninsights.core.utils.TestMessages.call;
import static com.phonepe.sessioninsights.core.utils.TestMessages.metadata;
import static com.phonepe.sessioninsights.core.utils.TestMessages.session;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionSummarizerTest {
    private final SessionSummarizer summarizer = new SessionSummarizer();

    @Test
    void summarizesCompleteSession() {
        final var messages = List.of(
                at(user("fix the parser"), "2025-01-15T10:00:00+00:00"),
                at(assistantCalling("write_file"), "2025-01-15T10:01:00+00:00"),
                at(user("now improve the error messages"), "2025-01-15T10:05:00+00:00"),
                at(assistant("done"), "2025-01-15T10:30:30+00:00"));
        final var raw = RawSession.builder()
                .containerName("abc123-child")
                .project("my-project")
                .metadata(SessionMetadata.builder()
                                  .sessionId("abc123-child")
                                  .created("2025-01-15T10:00:00")
                                  .description("Parser work")
                                  .bundle("dev")
                                  .model("big-model")
                                  .turnCount(7)
                                  .build())
                .messages(messages)
                .build();
        final var record = summarizer.summarize(raw).orElseThrow();
        assertAll(
                () -> assertEquals("abc123-child", record.getSessionId()),
                () -> assertEquals("abc123", record.getParentSessionId()),
                () -> assertEquals("Untitled", record.getName()),
                () -> assertEquals("Parser work", record.getDescription()),
                () -> assertEquals("dev", record.getBundle()),
                () -> assertEquals("big-model", record.getModel()),
                () -> assertEquals(7, record.getTurnCount()),
                () -> assertEquals(4, record.getMessageCount()),
                () -> assertEquals(30.5, record.getDurationMinutes()),
                () -> assertEquals(Approach.ITERATIVE_REFINEMENT, record.getPrimaryApproach()),
                () -> assertEquals(record.getApproaches().get(0), record.getPrimaryApproach()),
                () -> assertTrue(record.detected(PatternType.ITERATION)),
                () -> assertEquals(List.of(SuccessIndicator.FILES_MODIFIED, SuccessIndicator.SUBSTANTIAL_WORK),
                                   record.getSuccessIndicators()),
                () -> assertEquals("my-project", record.getProject()));
    }

    @Test
    void skipsSessionsWithoutMessages() {
        assertTrue(summarizer.summarize(session(metadata("s1", "2025-01-01", 2), List.of())).isEmpty());
    }

    @Test
    void skipsSessionsWithoutMetadata() {
        assertTrue(summarizer.summarize(session(null, List.of(user("hello")))).isEmpty());
    }

    @Test
    void truncatesLongDescriptions() {
        final var raw = RawSession.builder()
                .containerName("s2")
                .metadata(SessionMetadata.builder()
                                  .sessionId("s2")
                                  .description(Strings.repeat("x", 450))
                                  .build())
                .messages(List.of(user("hi")))
                .build();
        final var record = summarizer.summarize(raw).orElseThrow();
        assertAll(
                () -> assertEquals(200, record.getDescription().length()),
                () -> assertEquals("", record.getCreated()),
                () -> assertEquals("", record.getParentSessionId()),
                () -> assertEquals(0, record.getTurnCount()),
                () -> assertEquals(0.0, record.getDurationMinutes()),
                () -> assertEquals(List.of(Approach.SIMPLE_CONVERSATIONAL), record.getApproaches()));
    }

    @Test
    void truncationKeepsEmojiWhole() {
        final var raw = RawSession.builder()
                .containerName("s3")
                .metadata(SessionMetadata.builder()
                                  .sessionId("s3")
                                  .description(Strings.repeat("x", 199) + "\uD83D\uDE00tail")
                                  .build())
                .messages(List.of(user("hi")))
                .build();
        final var description = summarizer.summarize(raw).orElseThrow().getDescription();
        assertAll(
                () -> assertEquals(200, description.codePointCount(0, description.length())),
                () -> assertTrue(description.endsWith("\uD83D\uDE00")));
    }

    @Test
    void parentIdIsPrefixBeforeFirstSeparator() {
        assertAll(
                () -> assertEquals("a", SessionSummarizer.parentSessionId("a-b-c")),
                () -> assertEquals("", SessionSummarizer.parentSessionId("plain")),
                () -> assertEquals("", SessionSummarizer.parentSessionId("-leading")),
                () -> assertEquals("", SessionSummarizer.parentSessionId(null)));
    }

    @Test
    void successIndicatorsUseStrictThresholds() {
        final var detectors = PatternDetectors.defaults();
        final var halfRecovered = detectors.detect(List.of(
                tool("error one"), assistant("retry"), tool("failed two")));
        final var validated = detectors.detect(List.of(
                assistantCalling(call("bash", Map.of("command", "pytest"))),
                tool("error"),
                assistant("ok")));
        assertAll(
                () -> assertEquals(List.of(), SessionSummarizer.successIndicators(halfRecovered, 5)),
                () -> assertEquals(List.of(SuccessIndicator.GOOD_ERROR_RECOVERY,
                                           SuccessIndicator.VALIDATED,
                                           SuccessIndicator.SUBSTANTIAL_WORK),
                                   SessionSummarizer.successIndicators(validated, 6)));
    }
}
