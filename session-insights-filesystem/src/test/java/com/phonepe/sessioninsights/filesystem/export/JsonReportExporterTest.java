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

import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonReportExporterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-02-01T12:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @SneakyThrows
    void writesEnvelopeWithSummaryAndSessions() {
        final var mapper = JsonUtils.createMapper();
        final var output = new JsonReportExporter(mapper, CLOCK)
                .export(ExportFixtures.report(), tempDir.resolve("session_analysis.json"));
        final var root = mapper.readTree(output.toFile());
        final var summary = root.get("summary_statistics");
        final var first = root.get("sessions").get(0);
        assertAll(
                () -> assertEquals("2025-02-01T12:30", root.get("generated_at").asText()),
                () -> assertEquals(2, summary.get("total_sessions").asInt()),
                () -> assertEquals(1, summary.get("approach_frequencies").get("Iterative Refinement").asInt()),
                () -> assertEquals(1, summary.get("pattern_statistics").get("iterative_sessions").asInt()),
                () -> assertEquals(2, root.get("sessions").size()),
                () -> assertEquals("parent", first.get("parent_session_id").asText()),
                () -> assertEquals("Iterative Refinement", first.get("primary_approach").asText()),
                () -> assertTrue(first.get("patterns").get("iteration").get("is_iterative").asBoolean()),
                () -> assertEquals("execution-heavy",
                                   first.get("patterns").get("planning_execution").get("approach").asText()),
                () -> assertEquals("Files Modified", first.get("success_indicators").get(0).asText()));
    }

    @Test
    @SneakyThrows
    void emptyCorpusStillProducesAReport() {
        final var mapper = JsonUtils.createMapper();
        final var output = new JsonReportExporter(mapper, CLOCK)
                .export(ExportFixtures.emptyReport(), tempDir.resolve("empty.json"));
        final var root = mapper.readTree(output.toFile());
        assertAll(
                () -> assertEquals(0, root.get("summary_statistics").get("total_sessions").asInt()),
                () -> assertEquals(0, root.get("sessions").size()));
    }

    @Test
    void unwritableTargetIsFatal() {
        final var exporter = new JsonReportExporter(JsonUtils.createMapper(), CLOCK);
        final var error = assertThrows(SessionInsightsException.class,
                                       () -> exporter.export(ExportFixtures.report(),
                                                             tempDir.resolve("missing/dir/out.json")));
        assertEquals(ErrorType.OUTPUT_NOT_WRITABLE, error.getErrorType());
    }
}
