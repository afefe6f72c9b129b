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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.phonepe.sessioninsights.core.messages.content.ContentBlock;

import java.io.IOException;
import java.util.ArrayList;

/**
 * Maps the polymorphic {@code content} field of a transcript message to a {@link MessageContent} variant.
 * Arrays become block sequences, strings become plain text and anything else is kept as its JSON text.
 */
public class MessageContentDeserializer extends StdDeserializer<MessageContent> {

    public MessageContentDeserializer() {
        super(MessageContent.class);
    }

    @Override
    public MessageContent deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        final JsonNode node = parser.readValueAsTree();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MessageContent.empty();
        }
        if (node.isArray()) {
            final var blocks = new ArrayList<ContentBlock>(node.size());
            node.forEach(element -> blocks.add(new ContentBlock(blockKind(element), element)));
            return MessageContent.blocks(blocks);
        }
        if (node.isTextual()) {
            return MessageContent.text(node.textValue());
        }
        return MessageContent.text(node.toString());
    }

    @Override
    public MessageContent getNullValue(DeserializationContext context) {
        return MessageContent.empty();
    }

    private static String blockKind(JsonNode element) {
        if (!element.isObject()) {
            return null;
        }
        final var type = element.get("type");
        return type != null && type.isTextual() ? type.textValue() : null;
    }
}
