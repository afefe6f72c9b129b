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

package com.phonepe.sessioninsights.filesystem.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.sessioninsights.core.analysis.AnalysisReport;
import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Pretty printed JSON report with the generation time, the corpus summary and every session record
 */
@Slf4j
public class JsonReportExporter implements ReportExporter {
    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonReportExporter(@NonNull ObjectMapper mapper) {
        this(mapper, Clock.systemDefaultZone());
    }

    public JsonReportExporter(@NonNull ObjectMapper mapper, @NonNull Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Path export(@NonNull AnalysisReport report, @NonNull Path outputFile) {
        final var envelope = new ReportEnvelope(LocalDateTime.now(clock).toString(),
                                                report.getSummary(),
                                                report.getSessions());
        try {
            FileUtils.write(outputFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(envelope));
        }
        catch (JsonProcessingException e) {
            throw SessionInsightsException.error(ErrorType.SERIALIZATION_ERROR, e, outputFile, e.getMessage());
        }
        log.info("Exported {} sessions to {}", report.getSessions().size(), outputFile);
        return outputFile;
    }
}
