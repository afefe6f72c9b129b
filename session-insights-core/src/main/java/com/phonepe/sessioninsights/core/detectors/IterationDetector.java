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

import com.phonepe.sessioninsights.core.detectors.signals.IterationSignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;

import java.util.List;

/**
 * Counts user turns asking for changes to earlier work
 */
public class IterationDetector implements PatternDetector<IterationSignal> {
    static final List<String> REFINEMENT_KEYWORDS = List.of(
            "refine", "improve", "fix", "update", "revise", "modify", "adjust", "correct");

    private static final int MIN_ITERATIONS = 2;

    @Override
    public PatternType type() {
        return PatternType.ITERATION;
    }

    @Override
    public IterationSignal detect(List<Message> messages) {
        final var iterations = (int) messages.stream()
                .filter(message -> message.isFrom(Role.USER))
                .map(message -> AnalysisUtils.lower(message.contentAsText()))
                .filter(text -> AnalysisUtils.containsAny(text, REFINEMENT_KEYWORDS))
                .count();
        return IterationSignal.builder()
                .iterationCount(iterations)
                .iterative(iterations >= MIN_ITERATIONS)
                .build();
    }
}
