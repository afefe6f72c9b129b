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

package com.phonepe.sessioninsights.core.session;

import com.phonepe.sessioninsights.core.messages.Message;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * A session as handed over by a session source, before any analysis
 */
@Value
public class RawSession {
    /**
     * Name of the directory (or equivalent container) the session was read from. Used to derive the parent session.
     */
    String containerName;

    /**
     * Project the session belongs to. Empty when unknown.
     */
    String project;

    /**
     * Parsed metadata. Null when it was missing or could not be read.
     */
    SessionMetadata metadata;

    List<Message> messages;

    @Builder
    public RawSession(String containerName, String project, SessionMetadata metadata, List<Message> messages) {
        this.containerName = Objects.requireNonNullElse(containerName, "");
        this.project = Objects.requireNonNullElse(project, "");
        this.metadata = metadata;
        this.messages = null == messages ? List.of() : List.copyOf(messages);
    }

    public boolean isAnalyzable() {
        return null != metadata && !messages.isEmpty();
    }
}
