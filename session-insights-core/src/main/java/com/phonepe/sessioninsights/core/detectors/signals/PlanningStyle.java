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

package com.phonepe.sessioninsights.core.detectors.signals;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Balance between thinking and acting in assistant turns
 */
@Getter
@AllArgsConstructor
public enum PlanningStyle {
    PLANNING_HEAVY("planning-heavy"),
    BALANCED("balanced"),
    EXECUTION_HEAVY("execution-heavy"),
    ;

    @JsonValue
    private final String label;

    public static PlanningStyle fromRatio(double planningRatio) {
        if (planningRatio > 0.6) {
            return PLANNING_HEAVY;
        }
        if (planningRatio < 0.3) {
            return EXECUTION_HEAVY;
        }
        return BALANCED;
    }
}
