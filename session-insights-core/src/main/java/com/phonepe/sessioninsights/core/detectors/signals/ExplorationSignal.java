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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.sessioninsights.core.detectors.PatternSignal;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Read-only investigation of the workspace or the web
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExplorationSignal implements PatternSignal {
    int explorationToolCount;

    /**
     * Assistant turns that issued more than one tool call
     */
    int parallelSearches;

    @JsonProperty("is_exploratory")
    boolean exploratory;

    /**
     * Calls per exploration tool, in order of first use
     */
    Map<String, Integer> toolsUsed;

    @Override
    public boolean detected() {
        return exploratory;
    }
}
