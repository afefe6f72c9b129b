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

import java.util.List;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistant;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorRecoveryDetectorTest {
    private final ErrorRecoveryDetector detector = new ErrorRecoveryDetector();

    @Test
    void assistantFollowUpCountsAsRecovery() {
        final var signal = detector.detect(List.of(tool("Error: failed"), assistant("retrying")));
        assertAll(
                () -> assertEquals(1, signal.getErrorsEncountered()),
                () -> assertEquals(1, signal.getRecoveryAttempts()),
                () -> assertEquals(1.0, signal.getRecoveryRate()),
                () -> assertTrue(signal.isHasErrorRecovery()));
    }

    @Test
    void errorsWithoutFollowUpLowerTheRate() {
        final var signal = detector.detect(List.of(
                tool("Build FAILED"),
                assistant("looking"),
                tool("error: not found"),
                user("stop"),
                tool("error again")));
        assertAll(
                () -> assertEquals(3, signal.getErrorsEncountered()),
                () -> assertEquals(1, signal.getRecoveryAttempts()),
                () -> assertEquals(1.0 / 3, signal.getRecoveryRate(), 1e-9),
                () -> assertTrue(signal.detected()));
    }

    @Test
    void onlyToolMessagesAreInspected() {
        final var signal = detector.detect(List.of(user("there is an error"), assistant("the test failed")));
        assertAll(
                () -> assertEquals(0, signal.getErrorsEncountered()),
                () -> assertEquals(0.0, signal.getRecoveryRate()),
                () -> assertFalse(signal.isHasErrorRecovery()));
    }
}
