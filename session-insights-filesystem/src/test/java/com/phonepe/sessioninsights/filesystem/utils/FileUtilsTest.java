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

package com.phonepe.sessioninsights.filesystem.utils;

import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEnsurePathCreate() {
        final var ensured = FileUtils.ensurePath(tempDir.resolve("reports/daily"), true, true);
        assertTrue(Files.isDirectory(ensured));
        assertTrue(ensured.isAbsolute());
    }

    @Test
    void testEnsurePathIsFile() throws Exception {
        final var file = Files.writeString(tempDir.resolve("a-file"), "content");
        final var error = assertThrows(SessionInsightsException.class,
                                       () -> FileUtils.ensurePath(file, true, true));
        assertEquals(ErrorType.OUTPUT_NOT_WRITABLE, error.getErrorType());
    }

    @Test
    void testEnsurePathNotExistsNoCreate() {
        final var error = assertThrows(SessionInsightsException.class,
                                       () -> FileUtils.ensurePath(tempDir.resolve("missing"), false, false));
        assertEquals(ErrorType.SOURCE_NOT_READABLE, error.getErrorType());
    }

    @Test
    void testWriteReplacesContent() throws Exception {
        final var path = tempDir.resolve("out.txt");
        FileUtils.write(path, "a much longer first version".getBytes());
        FileUtils.write(path, "short".getBytes());
        assertEquals("short", Files.readString(path));
    }

    @Test
    void testExpandPath() {
        final var home = Path.of(System.getProperty("user.home")).toAbsolutePath().normalize();
        assertEquals(home.resolve(".amplifier/projects"), FileUtils.expandPath("~/.amplifier/projects"));
        assertEquals(home, FileUtils.expandPath("~"));
        assertEquals(Path.of("/tmp/x").toAbsolutePath().normalize(), FileUtils.expandPath("/tmp/./x"));
    }
}
