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

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistant;
import static com.phonepe.sessioninsights.core.utils.TestMessages.at;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscriptTimingTest {

    @Test
    void measuresFirstToLastMessage() {
        final var messages = List.of(
                at(user("start"), "2025-03-01T09:00:00+00:00"),
                at(assistant("middle"), null),
                at(assistant("end"), "2025-03-01T09:12:20+00:00"));
        assertEquals(12.33, TranscriptTiming.durationMinutes(messages));
    }

    @Test
    void zeroWhenTimingIsUnavailable() {
        assertAll(
                () -> assertEquals(0.0, TranscriptTiming.durationMinutes(List.of())),
                () -> assertEquals(0.0, TranscriptTiming.durationMinutes(
                        List.of(at(user("only"), "2025-03-01T09:00:00")))),
                () -> assertEquals(0.0, TranscriptTiming.durationMinutes(
                        List.of(at(user("a"), "2025-03-01T09:00:00"), user("b")))),
                () -> assertEquals(0.0, TranscriptTiming.durationMinutes(
                        List.of(at(user("a"), "yesterday"), at(user("b"), "2025-03-01T09:00:00")))));
    }

    @Test
    void normalisesOtherOffsetsToUtc() {
        assertAll(
                () -> assertEquals(LocalDateTime.of(2025, 3, 1, 4, 0),
                                   TranscriptTiming.parse("2025-03-01T09:30:00+05:30").orElseThrow()),
                () -> assertEquals(LocalDateTime.of(2025, 3, 1, 9, 0, 0, 500_000_000),
                                   TranscriptTiming.parse("2025-03-01T09:00:00.5+00:00").orElseThrow()),
                () -> assertTrue(TranscriptTiming.parse("").isEmpty()));
    }

    @Test
    void acceptsSpaceSeparatedAndDateOnlyTimestamps() {
        final var spaced = List.of(
                at(user("start"), "2025-01-01 10:00:00"),
                at(assistant("end"), "2025-01-01 10:30:00"));
        final var dateOnly = List.of(
                at(user("start"), "2025-01-01"),
                at(assistant("end"), "2025-01-02"));
        assertAll(
                () -> assertEquals(30.0, TranscriptTiming.durationMinutes(spaced)),
                () -> assertEquals(1440.0, TranscriptTiming.durationMinutes(dateOnly)),
                () -> assertEquals(LocalDateTime.of(2025, 1, 1, 0, 0),
                                   TranscriptTiming.parse("2025-01-01").orElseThrow()),
                () -> assertEquals(LocalDateTime.of(2025, 1, 1, 10, 0),
                                   TranscriptTiming.parse("2025-01-01 10:00:00Z").orElseThrow()));
    }
}
