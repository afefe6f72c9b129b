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

package com.phonepe.sessioninsights.core.detectors;

import com.phonepe.sessioninsights.core.detectors.signals.PlanningSignal;
import com.phonepe.sessioninsights.core.detectors.signals.PlanningStyle;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.MessageContentVisitor;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.messages.content.BlockSequence;
import com.phonepe.sessioninsights.core.messages.content.ContentBlock;
import com.phonepe.sessioninsights.core.messages.content.PlainText;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import com.phonepe.sessioninsights.core.utils.Pair;

import java.util.List;

/**
 * Compares thinking blocks against tool call blocks in structured assistant content.
 * Plain text assistant messages carry no blocks and are not counted.
 */
public class PlanningExecutionDetector implements PatternDetector<PlanningSignal> {

    private static final Pair<Long, Long> NO_BLOCKS = Pair.of(0L, 0L);

    private static final MessageContentVisitor<Pair<Long, Long>> BLOCK_COUNTER = new MessageContentVisitor<>() {
        @Override
        public Pair<Long, Long> visit(PlainText plainText) {
            return NO_BLOCKS;
        }

        @Override
        public Pair<Long, Long> visit(BlockSequence blockSequence) {
            return Pair.of(blockSequence.count(ContentBlock.THINKING),
                           blockSequence.count(ContentBlock.TOOL_CALL));
        }
    };

    @Override
    public PatternType type() {
        return PatternType.PLANNING_EXECUTION;
    }

    @Override
    public PlanningSignal detect(List<Message> messages) {
        var planning = 0L;
        var execution = 0L;
        for (final var message : messages) {
            if (!message.isFrom(Role.ASSISTANT)) {
                continue;
            }
            final var counts = message.getContent().accept(BLOCK_COUNTER);
            planning += counts.getFirst();
            execution += counts.getSecond();
        }
        final var ratio = AnalysisUtils.ratio(planning, planning + execution);
        return PlanningSignal.builder()
                .planningMessages((int) planning)
                .executionMessages((int) execution)
                .planningRatio(ratio)
                .approach(PlanningStyle.fromRatio(ratio))
                .build();
    }
}
