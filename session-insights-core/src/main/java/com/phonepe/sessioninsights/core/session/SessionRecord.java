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

package com.phonepe.sessioninsights.core.session;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.phonepe.sessioninsights.core.classification.Approach;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.detectors.PatternType;
import com.phonepe.sessioninsights.core.detectors.SessionPatterns;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Analysis result for one session. Created once by {@link SessionSummarizer} and never modified.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"session_id", "parent_session_id", "created", "name", "description", "bundle", "model",
        "turn_count", "message_count", "duration_minutes", "approaches", "primary_approach", "patterns",
        "success_indicators", "project"})
public class SessionRecord {
    String sessionId;
    String parentSessionId;
    String created;
    String name;
    String description;
    String bundle;
    String model;
    int turnCount;
    int messageCount;
    double durationMinutes;

    /**
     * Never empty. Ordered by classification priority.
     */
    @NonNull
    List<Approach> approaches;

    /**
     * Always the first element of {@link #approaches}
     */
    @NonNull
    Approach primaryApproach;

    @NonNull
    SessionPatterns patterns;

    @NonNull
    List<SuccessIndicator> successIndicators;

    String project;

    public boolean detected(PatternType type) {
        return patterns.detected(type);
    }

    public boolean hasApproach(Approach approach) {
        return approaches.contains(approach);
    }

    public boolean hasIndicator(SuccessIndicator indicator) {
        return successIndicators.contains(indicator);
    }
}
