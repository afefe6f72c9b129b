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

import com.phonepe.sessioninsights.core.detectors.signals.ValidationSignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.messages.ToolInvocation;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;

import java.util.List;

/**
 * Counts tool calls that run tests, code checks or reviews. One call can count towards more than one bucket.
 */
public class ValidationDetector implements PatternDetector<ValidationSignal> {
    static final String CHECK_TOOL = "python_check";

    @Override
    public PatternType type() {
        return PatternType.VALIDATION;
    }

    @Override
    public ValidationSignal detect(List<Message> messages) {
        var testRuns = 0;
        var checks = 0;
        var reviews = 0;
        for (final var message : messages) {
            if (!message.isFrom(Role.ASSISTANT)) {
                continue;
            }
            for (final var call : message.getToolCalls()) {
                if (mentions(call, "test")) {
                    testRuns++;
                }
                if (CHECK_TOOL.equals(call.getToolName())) {
                    checks++;
                }
                if (mentions(call, "review")) {
                    reviews++;
                }
            }
        }
        final var total = testRuns + checks + reviews;
        return ValidationSignal.builder()
                .testRuns(testRuns)
                .codeChecks(checks)
                .reviews(reviews)
                .totalValidation(total)
                .hasValidation(total > 0)
                .build();
    }

    private static boolean mentions(ToolInvocation call, String word) {
        return AnalysisUtils.lower(call.getToolName()).contains(word)
                || AnalysisUtils.lower(call.argumentsAsText()).contains(word);
    }
}
