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

package com.phonepe.sessioninsights.filesystem.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.analysis.SessionSource;
import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.session.RawSession;
import com.phonepe.sessioninsights.core.session.SessionMetadata;
import com.phonepe.sessioninsights.filesystem.utils.FileUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads recorded sessions from a projects directory.
 * Layout:
 * - Any directory below the root whose path contains "sessions" and that holds a metadata.json is a session
 * - The transcript is a transcript.jsonl next to the metadata, one message per line, oldest first
 * - Sessions are returned in ascending path order
 * Broken metadata or transcripts are logged and do not stop the scan. Such sessions come back with missing metadata
 * or a shortened transcript and are dropped later by the analyzer.
 */
@Slf4j
public class FileSystemSessionLoader implements SessionSource {
    static final String METADATA_FILE_NAME = "metadata.json";
    static final String TRANSCRIPT_FILE_NAME = "transcript.jsonl";
    static final String SESSIONS_MARKER = "sessions";

    private static final String PROJECTS_SEGMENT = "/projects/";
    private static final String SESSIONS_SEGMENT = "/sessions/";

    private final Path projectsDir;
    private final ObjectMapper mapper;

    public FileSystemSessionLoader(@NonNull Path projectsDir, @NonNull ObjectMapper mapper) {
        this.projectsDir = FileUtils.ensurePath(projectsDir, false, false);
        this.mapper = mapper;
    }

    @Override
    public List<RawSession> readSessions() {
        final var metadataFiles = findMetadataFiles();
        log.info("Found {} session directories under {}", metadataFiles.size(), projectsDir);
        return metadataFiles.stream()
                .map(this::readSession)
                .toList();
    }

    /**
     * Directories that cannot be listed are logged and skipped. Only a failure on the root itself aborts the scan.
     *
     * @return metadata.json files of all session directories, sorted by path
     */
    List<Path> findMetadataFiles() {
        final var collector = new MetadataFileCollector(projectsDir);
        try {
            Files.walkFileTree(projectsDir, collector);
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.SOURCE_NOT_READABLE, e, projectsDir);
        }
        return collector.getFound()
                .stream()
                .sorted()
                .toList();
    }

    RawSession readSession(Path metadataFile) {
        final var sessionDir = metadataFile.getParent();
        return RawSession.builder()
                .containerName(sessionDir.getFileName().toString())
                .project(projectName(metadataFile))
                .metadata(readMetadata(metadataFile))
                .messages(readTranscript(sessionDir.resolve(TRANSCRIPT_FILE_NAME)))
                .build();
    }

    /**
     * @return Parsed metadata, or null if the file is unreadable, malformed or an empty object
     */
    SessionMetadata readMetadata(Path metadataFile) {
        try {
            final JsonNode node = mapper.readTree(metadataFile.toFile());
            if (null == node || !node.isObject() || node.isEmpty()) {
                log.warn("Ignoring empty or non-object metadata in {}", metadataFile);
                return null;
            }
            return mapper.treeToValue(node, SessionMetadata.class);
        }
        catch (IOException e) {
            log.warn("Error parsing {}: {}", metadataFile, e.getMessage());
            return null;
        }
    }

    /**
     * Reads messages until the first line that cannot be parsed. Blank lines are skipped.
     *
     * @return Messages read so far, empty if there is no transcript
     */
    List<Message> readTranscript(Path transcriptFile) {
        if (!Files.isRegularFile(transcriptFile)) {
            return List.of();
        }
        final var messages = new ArrayList<Message>();
        try (final var lines = Files.newBufferedReader(transcriptFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = lines.readLine()) != null) {
                if (Strings.isNullOrEmpty(line.strip())) {
                    continue;
                }
                final var message = mapper.readValue(line, Message.class);
                if (null != message) {
                    messages.add(message);
                }
            }
        }
        catch (IOException e) {
            log.warn("Error parsing transcript {} after {} messages: {}",
                     transcriptFile, messages.size(), e.getMessage());
        }
        return messages;
    }

    /**
     * Project name is the part of the path after the last "/projects/" and before the next "/sessions/"
     */
    static String projectName(Path metadataFile) {
        final var path = metadataFile.toString().replace('\\', '/');
        final var projectsIndex = path.lastIndexOf(PROJECTS_SEGMENT);
        final var afterProjects = projectsIndex >= 0
                                  ? path.substring(projectsIndex + PROJECTS_SEGMENT.length())
                                  : path;
        final var sessionsIndex = afterProjects.indexOf(SESSIONS_SEGMENT);
        return sessionsIndex >= 0 ? afterProjects.substring(0, sessionsIndex) : afterProjects;
    }

    /**
     * Collects metadata.json files that sit in a directory whose path contains "sessions"
     */
    static final class MetadataFileCollector extends SimpleFileVisitor<Path> {
        private final Path root;
        @Getter
        private final List<Path> found = new ArrayList<>();

        MetadataFileCollector(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            final var parent = file.getParent();
            if (attrs.isRegularFile()
                    && METADATA_FILE_NAME.equals(file.getFileName().toString())
                    && null != parent
                    && parent.toString().contains(SESSIONS_MARKER)) {
                found.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (root.equals(file)) {
                throw exc;
            }
            log.warn("Skipping unreadable path {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (null != exc) {
                if (root.equals(dir)) {
                    throw exc;
                }
                log.warn("Listing of {} stopped early: {}", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
