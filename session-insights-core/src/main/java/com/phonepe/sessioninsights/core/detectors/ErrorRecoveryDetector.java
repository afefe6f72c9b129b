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

import com.phonepe.sessioninsights.core.detectors.signals.ErrorRecoverySignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.Role;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;

import java.util.List;

/**
 * Finds failed tool results and checks whether the very next message is an assistant turn.
 */
public class ErrorRecoveryDetector implements PatternDetector<ErrorRecoverySignal> {
    static final List<String> ERROR_MARKERS = List.of("error", "failed");

    @Override
    public PatternType type() {
        return PatternType.ERROR_RECOVERY;
    }

    @Override
    public ErrorRecoverySignal detect(List<Message> messages) {
        var errors = 0;
        var recoveryAttempts = 0;
        for (int i = 0; i < messages.size(); i++) {
            final var message = messages.get(i);
            if (!message.isFrom(Role.TOOL) || !isError(message)) {
                continue;
            }
            errors++;
            if (i + 1 < messages.size() && messages.get(i + 1).isFrom(Role.ASSISTANT)) {
                recoveryAttempts++;
            }
        }
        return ErrorRecoverySignal.builder()
                .errorsEncountered(errors)
                .recoveryAttempts(recoveryAttempts)
                .hasErrorRecovery(errors > 0 && recoveryAttempts > 0)
                .recoveryRate(AnalysisUtils.ratio(recoveryAttempts, errors))
                .build();
    }

    private static boolean isError(Message message) {
        return AnalysisUtils.containsAny(AnalysisUtils.lower(message.contentAsText()), ERROR_MARKERS);
    }
}
