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

import com.phonepe.sessioninsights.core.detectors.signals.DelegationSignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.MessageContentVisitor;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.messages.content.BlockSequence;
import com.phonepe.sessioninsights.core.messages.content.PlainText;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Counts delegation to sub agents. A user asking to "use ... agent" in a plain text message counts once, as does
 * every assistant tool call whose name mentions an agent or delegation.
 */
public class DelegationDetector implements PatternDetector<DelegationSignal> {
    private static final Pattern AGENT_NAME = Pattern.compile("use\\s+(\\S+)",
                                                              Pattern.CASE_INSENSITIVE
                                                                      | Pattern.UNICODE_CHARACTER_CLASS);

    private static final MessageContentVisitor<Optional<String>> PLAIN_TEXT_ONLY = new MessageContentVisitor<>() {
        @Override
        public Optional<String> visit(PlainText plainText) {
            return Optional.of(plainText.getText());
        }

        @Override
        public Optional<String> visit(BlockSequence blockSequence) {
            return Optional.empty();
        }
    };

    @Override
    public PatternType type() {
        return PatternType.DELEGATION;
    }

    @Override
    public DelegationSignal detect(List<Message> messages) {
        var delegationCount = 0;
        final var agentsUsed = new LinkedHashSet<String>();
        for (final var message : messages) {
            if (message.isFrom(Role.USER)) {
                final var text = message.getContent().accept(PLAIN_TEXT_ONLY).orElse(null);
                if (null != text && requestsAgent(text)) {
                    delegationCount++;
                    final var matcher = AGENT_NAME.matcher(text);
                    if (matcher.find()) {
                        agentsUsed.add(matcher.group(1));
                    }
                }
            }
            if (message.isFrom(Role.ASSISTANT)) {
                delegationCount += (int) message.getToolCalls()
                        .stream()
                        .filter(call -> call.getToolName().contains("agent")
                                || call.getToolName().contains("delegate"))
                        .count();
            }
        }
        return DelegationSignal.builder()
                .delegationCount(delegationCount)
                .agentsUsed(List.copyOf(agentsUsed))
                .hasDelegation(delegationCount > 0)
                .build();
    }

    private static boolean requestsAgent(String text) {
        final var lowered = AnalysisUtils.lower(text);
        return lowered.contains("use ") && lowered.contains("agent");
    }
}
