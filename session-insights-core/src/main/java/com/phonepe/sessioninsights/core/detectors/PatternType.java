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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Behavioural signals looked for in a transcript
 */
@Getter
@AllArgsConstructor
public enum PatternType {
    DELEGATION("delegation"),
    ITERATION("iteration"),
    EXPLORATION("exploration"),
    IMPLEMENTATION("implementation"),
    ERROR_RECOVERY("error_recovery"),
    PLANNING_EXECUTION("planning_execution"),
    VALIDATION("validation"),
    ;

    @JsonValue
    private final String key;
}
