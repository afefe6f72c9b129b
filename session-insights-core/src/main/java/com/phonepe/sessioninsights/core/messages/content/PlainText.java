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

import com.phonepe.sessioninsights.core.messages.MessageContent;
import com.phonepe.sessioninsights.core.messages.MessageContentType;
import com.phonepe.sessioninsights.core.messages.MessageContentVisitor;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.util.Objects;

/**
 * Content sent as a single string
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PlainText extends MessageContent {
    String text;

    public PlainText(String text) {
        super(MessageContentType.PLAIN_TEXT);
        this.text = Objects.requireNonNullElse(text, "");
    }

    @Override
    public <T> T accept(MessageContentVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String asText() {
        return text;
    }
}
