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

import com.phonepe.sessioninsights.core.detectors.signals.ImplementationSignal;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.messages.Role;

import java.util.List;

/**
 * Counts file writes and edits made by the assistant
 */
public class ImplementationDetector implements PatternDetector<ImplementationSignal> {
    static final String WRITE_TOOL = "write_file";
    static final String EDIT_TOOL = "edit_file";

    private static final int MIN_FILE_OPS = 3;

    @Override
    public PatternType type() {
        return PatternType.IMPLEMENTATION;
    }

    @Override
    public ImplementationSignal detect(List<Message> messages) {
        var writes = 0;
        var edits = 0;
        for (final var message : messages) {
            if (!message.isFrom(Role.ASSISTANT)) {
                continue;
            }
            for (final var call : message.getToolCalls()) {
                switch (call.getToolName()) {
                    case WRITE_TOOL -> writes++;
                    case EDIT_TOOL -> edits++;
                    default -> {
                        //Not a file operation
                    }
                }
            }
        }
        final var total = writes + edits;
        return ImplementationSignal.builder()
                .writeOperations(writes)
                .editOperations(edits)
                .totalFileOps(total)
                .implementation(total >= MIN_FILE_OPS)
                .build();
    }
}
