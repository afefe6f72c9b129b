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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.phonepe.sessioninsights.core.messages.content.BlockSequence;
import com.phonepe.sessioninsights.core.messages.content.ContentBlock;
import com.phonepe.sessioninsights.core.messages.content.PlainText;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Body of a message. Either a plain string or an ordered sequence of typed blocks.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
@JsonDeserialize(using = MessageContentDeserializer.class)
public abstract class MessageContent {
    private final MessageContentType contentType;

    public abstract <T> T accept(MessageContentVisitor<T> visitor);

    /**
     * Flattened text form of this content. Used for substring based matching.
     */
    public abstract String asText();

    public static MessageContent text(String text) {
        return new PlainText(text);
    }

    public static MessageContent empty() {
        return new PlainText("");
    }

    public static MessageContent blocks(List<ContentBlock> blocks) {
        return new BlockSequence(blocks);
    }
}
