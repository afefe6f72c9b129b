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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * A tool call issued by the assistant in a single turn
 */
@Value
public class ToolInvocation {
    /**
     * Name of the tool being called. Empty if the recorder did not capture it.
     */
    @JsonProperty("tool")
    String toolName;

    /**
     * Arguments as recorded. Usually an object, but some recorders store the arguments as an encoded string or
     * some other scalar, so the raw node is kept as is. Missing or null arguments become an empty object.
     */
    @JsonProperty("arguments")
    JsonNode arguments;

    @Builder
    @JsonCreator
    public ToolInvocation(@JsonProperty("tool") @JsonAlias({"name", "tool_name"}) String toolName,
                          @JsonProperty("arguments") JsonNode arguments) {
        this.toolName = Objects.requireNonNullElse(toolName, "");
        this.arguments = null == arguments || arguments.isNull() || arguments.isMissingNode()
                         ? JsonNodeFactory.instance.objectNode()
                         : arguments.deepCopy();
    }

    /**
     * Flattened text form of the arguments. Used for substring based matching.
     */
    public String argumentsAsText() {
        return arguments.isTextual()
               ? arguments.textValue()
               : arguments.toString();
    }
}
