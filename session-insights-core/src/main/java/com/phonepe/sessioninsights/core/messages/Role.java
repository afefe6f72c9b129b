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
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Author of a message in a transcript. Recorders write the role in lower case and only an exact match is accepted,
 * so {@code "User"} or {@code "ASSISTANT"} map to {@link #OTHER}.
 */
public enum Role {
    USER,
    ASSISTANT,
    TOOL,

    //System prompts and anything else the recorder may emit
    OTHER,
    ;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromLabel(String label) {
        return Arrays.stream(values())
                .filter(role -> role != OTHER && role.label().equals(label))
                .findFirst()
                .orElse(OTHER);
    }
}
