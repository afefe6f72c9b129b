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

package com.phonepe.sessioninsights.core.messages.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.Value;

import java.util.Objects;

/**
 * One typed element of a {@link BlockSequence}. The payload is the block exactly as it was recorded.
 */
@Value
public class ContentBlock {
    public static final String THINKING = "thinking";
    public static final String TOOL_CALL = "tool_call";

    /**
     * Value of the block's {@code type} field, null when absent
     */
    String kind;

    JsonNode payload;

    public ContentBlock(String kind, JsonNode payload) {
        this.kind = kind;
        this.payload = Objects.requireNonNullElse(payload, NullNode.getInstance());
    }

    public boolean isKind(String expected) {
        return expected.equals(kind);
    }
}
