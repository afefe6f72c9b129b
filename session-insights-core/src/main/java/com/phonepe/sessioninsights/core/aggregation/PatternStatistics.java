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

package com.phonepe.sessioninsights.core.aggregation;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Number of sessions where each detector gate fired. Independent of classification priority, so a session can
 * count towards several of these.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"iterative_sessions", "exploratory_sessions", "implementation_sessions", "delegated_sessions",
        "validated_sessions", "error_recovery_sessions"})
public class PatternStatistics {
    long iterativeSessions;
    long exploratorySessions;
    long implementationSessions;
    long delegatedSessions;
    long validatedSessions;
    long errorRecoverySessions;

    public Map<String, Long> asMap() {
        final var stats = new LinkedHashMap<String, Long>();
        stats.put("iterative_sessions", iterativeSessions);
        stats.put("exploratory_sessions", exploratorySessions);
        stats.put("implementation_sessions", implementationSessions);
        stats.put("delegated_sessions", delegatedSessions);
        stats.put("validated_sessions", validatedSessions);
        stats.put("error_recovery_sessions", errorRecoverySessions);
        return stats;
    }
}
