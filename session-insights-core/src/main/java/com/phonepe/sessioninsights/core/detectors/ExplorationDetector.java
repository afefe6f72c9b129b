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

import com.phonepe.sessioninsights.core.detectors.signals.ExplorationSignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.messages.ToolInvocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Tallies read-only tool usage and assistant turns that fan out to several tools at once
 */
public class ExplorationDetector implements PatternDetector<ExplorationSignal> {
    static final Set<String> EXPLORATION_TOOLS = Set.of("read_file", "glob", "grep", "bash", "web_search");

    private static final int MIN_EXPLORATION_CALLS = 5;
    private static final int MIN_PARALLEL_SEARCHES = 2;

    @Override
    public PatternType type() {
        return PatternType.EXPLORATION;
    }

    @Override
    public ExplorationSignal detect(List<Message> messages) {
        final var toolUsage = new LinkedHashMap<String, Integer>();
        var parallelSearches = 0;
        for (final var message : messages) {
            if (!message.isFrom(Role.ASSISTANT)) {
                continue;
            }
            final var toolCalls = message.getToolCalls();
            if (toolCalls.size() > 1) {
                parallelSearches++;
            }
            toolCalls.stream()
                    .map(ToolInvocation::getToolName)
                    .filter(EXPLORATION_TOOLS::contains)
                    .forEach(tool -> toolUsage.merge(tool, 1, Integer::sum));
        }
        final var totalExploration = toolUsage.values().stream().mapToInt(Integer::intValue).sum();
        return ExplorationSignal.builder()
                .explorationToolCount(totalExploration)
                .parallelSearches(parallelSearches)
                .exploratory(totalExploration >= MIN_EXPLORATION_CALLS
                                     || parallelSearches >= MIN_PARALLEL_SEARCHES)
                .toolsUsed(Collections.unmodifiableMap(toolUsage))
                .build();
    }
}
