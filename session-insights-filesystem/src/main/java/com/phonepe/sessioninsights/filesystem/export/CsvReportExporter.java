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
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.phonepe.sessioninsights.core.analysis.AnalysisReport;
import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * One CSV row per session, with a header line. The corpus summary is not part of this export.
 */
@Slf4j
public class CsvReportExporter implements ReportExporter {
    private final CsvMapper mapper;
    private final CsvSchema schema;

    public CsvReportExporter() {
        this.mapper = CsvMapper.builder()
                .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                .build();
        this.schema = mapper.schemaFor(SessionRow.class).withHeader();
    }

    @Override
    public Path export(@NonNull AnalysisReport report, @NonNull Path outputFile) {
        final var rows = report.getSessions()
                .stream()
                .map(SessionRow::from)
                .toList();
        try {
            final var data = rows.isEmpty()
                             ? headerOnly()
                             : mapper.writer(schema).writeValueAsBytes(rows);
            FileUtils.write(outputFile, data);
        }
        catch (JsonProcessingException e) {
            throw SessionInsightsException.error(ErrorType.SERIALIZATION_ERROR, e, outputFile, e.getMessage());
        }
        log.info("Exported {} rows to {}", rows.size(), outputFile);
        return outputFile;
    }

    /**
     * The CSV generator only emits the header together with the first row
     */
    private byte[] headerOnly() {
        return (StreamSupport.stream(schema.spliterator(), false)
                        .map(CsvSchema.Column::getName)
                        .collect(Collectors.joining(String.valueOf(schema.getColumnSeparator())))
                + new String(schema.getLineSeparator()))
                .getBytes(StandardCharsets.UTF_8);
    }
}
