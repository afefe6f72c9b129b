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

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Problem-solving approach labels. Declaration order is classification priority.
 */
@Getter
@AllArgsConstructor
public enum Approach {
    ITERATIVE_REFINEMENT("Iterative Refinement"),
    EXPLORATORY_INVESTIGATION("Exploratory Investigation"),
    DIRECT_IMPLEMENTATION("Direct Implementation"),
    MULTI_AGENT_ORCHESTRATION("Multi-Agent Orchestration"),
    ERROR_RECOVERY("Error Recovery & Resilience"),
    VALIDATION_DRIVEN("Validation-Driven"),
    SIMPLE_CONVERSATIONAL("Simple/Conversational"),
    ;

    @JsonValue
    private final String label;

    public static Optional<Approach> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(approach -> approach.label.equals(label))
                .findFirst();
    }
}
