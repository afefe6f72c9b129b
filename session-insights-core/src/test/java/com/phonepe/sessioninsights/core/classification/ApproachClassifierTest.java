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

package com.phonepe.sessioninsights.core.classification;

import com.phonepe.sessioninsights.core.detectors.PatternDetectors;
import com.phonepe.sessioninsights.core.messages.Message;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.phonepe.sessioninsights.core.utils.TestMessages.assistant;
import static com.phonepe.sessioninsights.core.utils.TestMessages.assistantCalling;
import static com.phonepe.sessioninsights.core.utils.TestMessages.call;
import static com.phonepe.sessioninsights.core.utils.TestMessages.tool;
import static com.phonepe.sessioninsights.core.utils.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApproachClassifierTest {
    private final PatternDetectors detectors = PatternDetectors.defaults();
    private final ApproachClassifier classifier = new ApproachClassifier();

    @Test
    void quietSessionIsConversational() {
        assertEquals(List.of(Approach.SIMPLE_CONVERSATIONAL),
                     classify(List.of(user("hi"), assistant("hello"))));
    }

    @Test
    void emptySignalsStillProduceOneLabel() {
        assertEquals(List.of(Approach.SIMPLE_CONVERSATIONAL), classify(List.of()));
    }

    @Test
    void iterativeSessionsAreNeverDirectImplementation() {
        final var approaches = classify(List.of(
                user("fix the build"),
                assistantCalling("write_file", "edit_file"),
                user("refine the output"),
                assistantCalling("edit_file"),
                user("revise the message"),
                user("improve performance")));
        assertEquals(Approach.ITERATIVE_REFINEMENT, approaches.get(0));
        assertTrue(approaches.contains(Approach.ITERATIVE_REFINEMENT));
        assertFalse(approaches.contains(Approach.DIRECT_IMPLEMENTATION));
    }

    @Test
    void labelsFollowPriorityOrder() {
        final var messages = new ArrayList<Message>();
        messages.add(user("Use helper agent to scan the tree"));
        messages.add(assistantCalling("read_file", "grep"));
        messages.add(assistantCalling("glob", "bash"));
        messages.add(assistantCalling("write_file"));
        messages.add(assistantCalling("write_file"));
        messages.add(assistantCalling("edit_file"));
        messages.add(tool("Error: compilation failed"));
        messages.add(assistantCalling(call("run_tests", Map.of())));
        assertEquals(List.of(Approach.EXPLORATORY_INVESTIGATION,
                             Approach.DIRECT_IMPLEMENTATION,
                             Approach.MULTI_AGENT_ORCHESTRATION,
                             Approach.ERROR_RECOVERY,
                             Approach.VALIDATION_DRIVEN),
                     classify(messages));
    }

    @Test
    void labelsRoundTripThroughTheirDisplayNames() {
        for (final var approach : Approach.values()) {
            assertEquals(approach, Approach.fromLabel(approach.getLabel()).orElseThrow());
        }
        assertTrue(Approach.fromLabel("Something Else").isEmpty());
    }

    private List<Approach> classify(List<Message> messages) {
        return classifier.classify(detectors.detect(messages));
    }
}
