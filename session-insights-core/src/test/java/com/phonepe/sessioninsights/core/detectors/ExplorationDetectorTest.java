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
import java.util.Map;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistantCalling;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExplorationDetectorTest {
    private final ExplorationDetector detector = new ExplorationDetector();

    @Test
    void sequentialReadsAreExploratory() {
        final var signal = detector.detect(List.of(
                user("look around"),
                assistantCalling("read_file"),
                tool("contents"),
                assistantCalling("read_file"),
                assistantCalling("read_file"),
                assistantCalling("read_file"),
                assistantCalling("read_file"),
                assistantCalling("read_file")));
        assertAll(
                () -> assertEquals(6, signal.getExplorationToolCount()),
                () -> assertEquals(0, signal.getParallelSearches()),
                () -> assertEquals(Map.of("read_file", 6), signal.getToolsUsed()),
                () -> assertTrue(signal.isExploratory()));
    }

    @Test
    void parallelTurnsAreExploratoryWithFewCalls() {
        final var signal = detector.detect(List.of(
                assistantCalling("grep", "write_file"),
                assistantCalling("edit_file", "edit_file")));
        assertAll(
                () -> assertEquals(1, signal.getExplorationToolCount()),
                () -> assertEquals(2, signal.getParallelSearches()),
                () -> assertTrue(signal.isExploratory()));
    }

    @Test
    void toolsUsedKeepsOrderOfFirstUse() {
        final var signal = detector.detect(List.of(
                assistantCalling("web_search"),
                assistantCalling("glob"),
                assistantCalling("web_search"),
                assistantCalling("bash")));
        assertAll(
                () -> assertEquals(List.of("web_search", "glob", "bash"),
                                   List.copyOf(signal.getToolsUsed().keySet())),
                () -> assertEquals(2, signal.getToolsUsed().get("web_search")),
                () -> assertEquals(4, signal.getExplorationToolCount()),
                () -> assertFalse(signal.isExploratory()));
    }
}
