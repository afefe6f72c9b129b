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

import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.classification.ApproachClassifier;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.detectors.PatternDetectors;
import com.phonepe.sessioninsights.core.detectors.SessionPatterns;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the {@link SessionRecord} for a single session: detectors, classifier, timing and success indicators.
 */
@Slf4j
public class SessionSummarizer {
    static final int MAX_DESCRIPTION_LENGTH = 200;
    static final String DEFAULT_NAME = "Untitled";
    static final String PARENT_SEPARATOR = "-";

    private static final double GOOD_RECOVERY_RATE = 0.5;
    private static final int SUBSTANTIAL_TURN_COUNT = 5;

    private final PatternDetectors detectors;
    private final ApproachClassifier classifier;

    public SessionSummarizer() {
        this(PatternDetectors.defaults(), new ApproachClassifier());
    }

    public SessionSummarizer(@NonNull PatternDetectors detectors, @NonNull ApproachClassifier classifier) {
        this.detectors = detectors;
        this.classifier = classifier;
    }

    /**
     * @param session Session to summarize
     * @return Record for the session, or empty if the session has no metadata or no messages and must be skipped
     */
    public Optional<SessionRecord> summarize(@NonNull final RawSession session) {
        if (!session.isAnalyzable()) {
            log.debug("Skipping session in {}: metadata present: {}, messages: {}",
                      session.getContainerName(),
                      session.getMetadata() != null,
                      session.getMessages().size());
            return Optional.empty();
        }
        final var metadata = session.getMetadata();
        final var messages = session.getMessages();
        final var patterns = detectors.detect(messages);
        final var approaches = classifier.classify(patterns);
        return Optional.of(SessionRecord.builder()
                                   .sessionId(Strings.nullToEmpty(metadata.getSessionId()))
                                   .parentSessionId(parentSessionId(session.getContainerName()))
                                   .created(Strings.nullToEmpty(metadata.getCreated()))
                                   .name(Objects.requireNonNullElse(metadata.getName(), DEFAULT_NAME))
                                   .description(AnalysisUtils.truncate(metadata.getDescription(),
                                                                       MAX_DESCRIPTION_LENGTH))
                                   .bundle(Strings.nullToEmpty(metadata.getBundle()))
                                   .model(Strings.nullToEmpty(metadata.getModel()))
                                   .turnCount(metadata.getTurnCount())
                                   .messageCount(messages.size())
                                   .durationMinutes(TranscriptTiming.durationMinutes(messages))
                                   .approaches(approaches)
                                   .primaryApproach(approaches.get(0))
                                   .patterns(patterns)
                                   .successIndicators(successIndicators(patterns, metadata.getTurnCount()))
                                   .project(session.getProject())
                                   .build());
    }

    static String parentSessionId(final String containerName) {
        final var name = Strings.nullToEmpty(containerName);
        final var separatorIndex = name.indexOf(PARENT_SEPARATOR);
        return separatorIndex >= 0 ? name.substring(0, separatorIndex) : "";
    }

    static List<SuccessIndicator> successIndicators(final SessionPatterns patterns, int turnCount) {
        final var indicators = new ArrayList<SuccessIndicator>();
        if (patterns.getImplementation().getTotalFileOps() > 0) {
            indicators.add(SuccessIndicator.FILES_MODIFIED);
        }
        if (patterns.getErrorRecovery().getRecoveryRate() > GOOD_RECOVERY_RATE) {
            indicators.add(SuccessIndicator.GOOD_ERROR_RECOVERY);
        }
        if (patterns.getValidation().isHasValidation()) {
            indicators.add(SuccessIndicator.VALIDATED);
        }
        if (turnCount > SUBSTANTIAL_TURN_COUNT) {
            indicators.add(SuccessIndicator.SUBSTANTIAL_WORK);
        }
        return List.copyOf(indicators);
    }
}
