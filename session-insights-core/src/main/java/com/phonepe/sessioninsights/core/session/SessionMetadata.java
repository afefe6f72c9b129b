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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Metadata record stored alongside a session transcript. Everything except the turn count is optional.
 */
@Value
public class SessionMetadata {
    @JsonProperty("session_id")
    String sessionId;

    /**
     * ISO-8601 creation time as recorded
     */
    String created;

    String name;

    String description;

    String bundle;

    String model;

    /**
     * Turn count as reported by the recorder. Defaults to 0.
     */
    @JsonProperty("turn_count")
    int turnCount;

    @Builder
    @JsonCreator
    public SessionMetadata(@JsonProperty("session_id") String sessionId,
                           @JsonProperty("created") String created,
                           @JsonProperty("name") String name,
                           @JsonProperty("description") String description,
                           @JsonProperty("bundle") String bundle,
                           @JsonProperty("model") String model,
                           @JsonProperty("turn_count") Integer turnCount) {
        this.sessionId = sessionId;
        this.created = created;
        this.name = name;
        this.description = description;
        this.bundle = bundle;
        this.model = model;
        this.turnCount = Objects.requireNonNullElse(turnCount, 0);
    }
}
