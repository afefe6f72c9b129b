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

package com.phonepe.sessioninsights.app.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Where to read sessions from and what to write. Every field has a default.
 */
@Value
@Builder
@Jacksonized
public class SessionInsightsConfig {
    /**
     * Root of the recorded projects. A leading {@code ~} is the user's home directory.
     */
    @Builder.Default
    String projectsDir = "~/.amplifier/projects";

    @Builder.Default
    String outputDir = ".";

    @Builder.Default
    String jsonFileName = "session_analysis.json";

    @Builder.Default
    String csvFileName = "session_analysis.csv";

    @Builder.Default
    String xlsxFileName = "amplifier-sessions-problem-solving-dashboard.xlsx";

    @Builder.Default
    boolean exportJson = true;

    @Builder.Default
    boolean exportCsv = true;

    /**
     * Excel dashboard with charts. Off unless asked for.
     */
    @Builder.Default
    boolean exportXlsx = false;
}
