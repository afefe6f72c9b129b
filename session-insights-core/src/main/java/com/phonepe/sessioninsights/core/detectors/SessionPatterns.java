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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.sessioninsights.core.detectors.signals.DelegationSignal;
import com.phonepe.sessioninsights.core.detectors.signals.ErrorRecoverySignal;
import com.phonepe.sessioninsights.core.detectors.signals.ExplorationSignal;
import com.phonepe.sessioninsights.core.detectors.signals.ImplementationSignal;
import com.phonepe.sessioninsights.core.detectors.signals.IterationSignal;
import com.phonepe.sessioninsights.core.detectors.signals.PlanningSignal;
import com.phonepe.sessioninsights.core.detectors.signals.ValidationSignal;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * All detector outputs for one session
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"delegation", "iteration", "exploration", "implementation", "error_recovery",
        "planning_execution", "validation"})
public class SessionPatterns {
    @NonNull
    DelegationSignal delegation;
    @NonNull
    IterationSignal iteration;
    @NonNull
    ExplorationSignal exploration;
    @NonNull
    ImplementationSignal implementation;
    @NonNull
    ErrorRecoverySignal errorRecovery;
    @NonNull
    PlanningSignal planningExecution;
    @NonNull
    ValidationSignal validation;

    public PatternSignal signal(PatternType type) {
        return switch (type) {
            case DELEGATION -> delegation;
            case ITERATION -> iteration;
            case EXPLORATION -> exploration;
            case IMPLEMENTATION -> implementation;
            case ERROR_RECOVERY -> errorRecovery;
            case PLANNING_EXECUTION -> planningExecution;
            case VALIDATION -> validation;
        };
    }

    public boolean detected(PatternType type) {
        return signal(type).detected();
    }
}
