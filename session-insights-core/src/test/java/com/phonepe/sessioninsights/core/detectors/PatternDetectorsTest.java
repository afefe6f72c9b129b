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

package com.phonepe.sessioninsights.core.detectors;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistantCalling;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternDetectorsTest {
    private final PatternDetectors detectors = PatternDetectors.defaults();

    @Test
    void everyPatternTypeHasExactlyOneDetector() {
        final List<PatternDetector<?>> all = List.of(detectors.getDelegationDetector(),
                                                     detectors.getIterationDetector(),
                                                     detectors.getExplorationDetector(),
                                                     detectors.getImplementationDetector(),
                                                     detectors.getErrorRecoveryDetector(),
                                                     detectors.getPlanningExecutionDetector(),
                                                     detectors.getValidationDetector());
        final var types = all.stream()
                .map(PatternDetector::type)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(PatternType.class)));
        assertEquals(EnumSet.allOf(PatternType.class), types);
    }

    @Test
    void signalsAreReachableByType() {
        final var patterns = detectors.detect(List.of(
                user("fix the bug"),
                user("adjust the test"),
                assistantCalling("write_file"),
                tool("error")));
        assertAll(
                () -> assertSame(patterns.getIteration(), patterns.signal(PatternType.ITERATION)),
                () -> assertSame(patterns.getErrorRecovery(), patterns.signal(PatternType.ERROR_RECOVERY)),
                () -> assertTrue(patterns.detected(PatternType.ITERATION)),
                () -> assertFalse(patterns.detected(PatternType.ERROR_RECOVERY)),
                () -> assertFalse(patterns.detected(PatternType.IMPLEMENTATION)),
                () -> assertEquals(1, patterns.getImplementation().getWriteOperations()));
    }

    @Test
    void emptyTranscriptDetectsNothing() {
        final var patterns = detectors.detect(List.of());
        for (final var type : PatternType.values()) {
            assertFalse(patterns.detected(type), type.name());
        }
    }
}
