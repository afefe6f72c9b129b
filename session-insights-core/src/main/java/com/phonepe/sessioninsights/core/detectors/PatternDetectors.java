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

import com.phonepe.sessioninsights.core.messages.Message;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs the full detector set over a transcript. Detectors are independent of each other, so the order they run in
 * does not matter.
 */
@Value
@Builder
@Slf4j
public class PatternDetectors {
    @NonNull
    DelegationDetector delegationDetector;
    @NonNull
    IterationDetector iterationDetector;
    @NonNull
    ExplorationDetector explorationDetector;
    @NonNull
    ImplementationDetector implementationDetector;
    @NonNull
    ErrorRecoveryDetector errorRecoveryDetector;
    @NonNull
    PlanningExecutionDetector planningExecutionDetector;
    @NonNull
    ValidationDetector validationDetector;

    public static PatternDetectors defaults() {
        return PatternDetectors.builder()
                .delegationDetector(new DelegationDetector())
                .iterationDetector(new IterationDetector())
                .explorationDetector(new ExplorationDetector())
                .implementationDetector(new ImplementationDetector())
                .errorRecoveryDetector(new ErrorRecoveryDetector())
                .planningExecutionDetector(new PlanningExecutionDetector())
                .validationDetector(new ValidationDetector())
                .build();
    }

    public SessionPatterns detect(final List<Message> messages) {
        final var patterns = SessionPatterns.builder()
                .delegation(delegationDetector.detect(messages))
                .iteration(iterationDetector.detect(messages))
                .exploration(explorationDetector.detect(messages))
                .implementation(implementationDetector.detect(messages))
                .errorRecovery(errorRecoveryDetector.detect(messages))
                .planningExecution(planningExecutionDetector.detect(messages))
                .validation(validationDetector.detect(messages))
                .build();
        log.debug("Detected patterns over {} messages: {}", messages.size(), patterns);
        return patterns;
    }
}
