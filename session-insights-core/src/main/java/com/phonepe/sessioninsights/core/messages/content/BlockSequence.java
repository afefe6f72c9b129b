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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Content sent as an ordered list of typed blocks (thinking, tool_call, text etc.)
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class BlockSequence extends MessageContent {
    List<ContentBlock> blocks;

    public BlockSequence(List<ContentBlock> blocks) {
        super(MessageContentType.BLOCK_SEQUENCE);
        this.blocks = List.copyOf(Objects.requireNonNullElseGet(blocks, List::<ContentBlock>of));
    }

    public long count(String kind) {
        return blocks.stream()
                .filter(block -> block.isKind(kind))
                .count();
    }

    @Override
    public <T> T accept(MessageContentVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String asText() {
        return blocks.stream()
                .map(block -> block.getPayload().toString())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
