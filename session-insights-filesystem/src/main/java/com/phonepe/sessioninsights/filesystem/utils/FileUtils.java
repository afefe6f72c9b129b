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
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

@UtilityClass
@Slf4j
public class FileUtils {
    private static final String HOME_PREFIX = "~";

    /**
     * Expands a leading {@code ~} to the user's home directory and normalises the result.
     *
     * @param path Path as written by the user
     * @return Absolute, normalised path
     */
    public static Path expandPath(String path) {
        if (path.equals(HOME_PREFIX) || path.startsWith(HOME_PREFIX + "/")) {
            return Path.of(System.getProperty("user.home") + path.substring(HOME_PREFIX.length()))
                    .toAbsolutePath()
                    .normalize();
        }
        return Path.of(path).toAbsolutePath().normalize();
    }

    /**
     * Makes sure the provided path is a readable directory. When {@code createIfNotExists} is set, a missing directory
     * is created. When {@code writeCheck} is set, the directory must also be writable.
     *
     * @param path              Directory to check or create
     * @param createIfNotExists Whether to create the directory if it is missing
     * @param writeCheck        Whether the directory must be writable
     * @return The absolute, normalized directory
     * @throws SessionInsightsException if the directory cannot be read, written or created as required
     */
    public static Path ensurePath(Path path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = path.toAbsolutePath().normalize();
        final var errorType = writeCheck ? ErrorType.OUTPUT_NOT_WRITABLE : ErrorType.SOURCE_NOT_READABLE;
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw SessionInsightsException.error(errorType, absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
                log.debug("Created directory {}", absolutePath);
            }
            catch (IOException e) {
                throw SessionInsightsException.error(errorType, e, absolutePath);
            }
        }
        if (!Files.isDirectory(absolutePath)
                || !Files.isReadable(absolutePath)
                || (writeCheck && !Files.isWritable(absolutePath))) {
            throw SessionInsightsException.error(errorType, absolutePath);
        }
        return absolutePath;
    }

    /**
     * Replaces the contents of a file, creating it if needed
     *
     * @param filePath File to write
     * @param data     Bytes to write
     * @return The path that was written
     * @throws SessionInsightsException if the file could not be written
     */
    public static Path write(Path filePath, byte[] data) {
        try {
            Files.write(filePath, data,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING);
            return filePath;
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.OUTPUT_NOT_WRITABLE, e, filePath);
        }
    }
}
