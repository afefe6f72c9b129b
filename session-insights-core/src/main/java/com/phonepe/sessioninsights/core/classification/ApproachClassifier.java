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

import com.phonepe.sessioninsights.core.detectors.PatternType;
import com.phonepe.sessioninsights.core.detectors.SessionPatterns;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns detector signals into an ordered list of approach labels. The first label is the primary approach.
 * <p>
 * Labels are checked in a fixed order: iterative, exploratory, direct implementation, multi-agent, error recovery,
 * validation. Direct implementation is never assigned to an iterative session. A session matching nothing is
 * {@link Approach#SIMPLE_CONVERSATIONAL}.
 */
public class ApproachClassifier {

    public List<Approach> classify(final SessionPatterns patterns) {
        final var approaches = new ArrayList<Approach>();
        final var iterative = patterns.detected(PatternType.ITERATION);
        if (iterative) {
            approaches.add(Approach.ITERATIVE_REFINEMENT);
        }
        if (patterns.detected(PatternType.EXPLORATION)) {
            approaches.add(Approach.EXPLORATORY_INVESTIGATION);
        }
        if (patterns.detected(PatternType.IMPLEMENTATION) && !iterative) {
            approaches.add(Approach.DIRECT_IMPLEMENTATION);
        }
        if (patterns.detected(PatternType.DELEGATION)) {
            approaches.add(Approach.MULTI_AGENT_ORCHESTRATION);
        }
        if (patterns.detected(PatternType.ERROR_RECOVERY)) {
            approaches.add(Approach.ERROR_RECOVERY);
        }
        if (patterns.detected(PatternType.VALIDATION)) {
            approaches.add(Approach.VALIDATION_DRIVEN);
        }
        if (approaches.isEmpty()) {
            approaches.add(Approach.SIMPLE_CONVERSATIONAL);
        }
        return List.copyOf(approaches);
    }
}
