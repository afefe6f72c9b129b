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

package com.phonepe.sessioninsights.core.messages;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * One turn of a recorded session transcript. Position in the transcript is chronological order.
 */
@Value
public class Message {
    Role role;

    MessageContent content;

    @JsonProperty("tool_calls")
    List<ToolInvocation> toolCalls;

    /**
     * ISO-8601 timestamp as recorded. May be null.
     */
    String timestamp;

    @Builder
    @JsonCreator
    public Message(@JsonProperty("role") Role role,
                   @JsonProperty("content") MessageContent content,
                   @JsonProperty("tool_calls") List<ToolInvocation> toolCalls,
                   @JsonProperty("timestamp") String timestamp) {
        this.role = role;
        this.content = Objects.requireNonNullElseGet(content, MessageContent::empty);
        this.toolCalls = null == toolCalls
                         ? List.of()
                         : toolCalls.stream().filter(Objects::nonNull).toList();
        this.timestamp = timestamp;
    }

    public boolean isFrom(Role expected) {
        return expected == role;
    }

    public String contentAsText() {
        return content.asText();
    }
}
