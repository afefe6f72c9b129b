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

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CsvReportExporterTest {
    private static final String HEADER = "Session ID,Parent Session,Created,Name,Project,Bundle,Model,Turn Count,"
            + "Message Count,Duration (min),Primary Approach,All Approaches,Is Iterative,Iteration Count,"
            + "Is Exploratory,Exploration Count,Has Delegation,Delegation Count,File Operations,Errors,"
            + "Recovery Rate,Validation Count,Planning Ratio,Success Indicators";

    @TempDir
    Path tempDir;

    @Test
    @SneakyThrows
    void writesOneRowPerSession() {
        final var output = new CsvReportExporter().export(ExportFixtures.report(), tempDir.resolve("out.csv"));
        final var lines = Files.readAllLines(output);
        assertEquals(HEADER, lines.get(0));
        assertEquals(3, lines.size());

        final MappingIterator<Map<String, String>> rows = new CsvMapper()
                .readerForMapOf(String.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(output.toFile());
        final var first = rows.next();
        final var second = rows.next();
        assertAll(
                () -> assertEquals("parent-1", first.get("Session ID")),
                () -> assertEquals("parent", first.get("Parent Session")),
                () -> assertEquals("Fix, then refine", first.get("Name")),
                () -> assertEquals("Iterative Refinement", first.get("All Approaches")),
                () -> assertEquals("true", first.get("Is Iterative")),
                () -> assertEquals("2", first.get("Iteration Count")),
                () -> assertEquals("1", first.get("File Operations")),
                () -> assertEquals("0.0", first.get("Planning Ratio")),
                () -> assertEquals("Files Modified, Substantial Work", first.get("Success Indicators")),
                () -> assertEquals("Untitled", second.get("Name")),
                () -> assertEquals("Simple/Conversational", second.get("Primary Approach")),
                () -> assertEquals("", second.get("Success Indicators")));
    }

    @Test
    @SneakyThrows
    void emptyCorpusWritesHeaderOnly() {
        final var output = new CsvReportExporter().export(ExportFixtures.emptyReport(), tempDir.resolve("empty.csv"));
        assertEquals(List.of(HEADER), Files.readAllLines(output));
    }
}
