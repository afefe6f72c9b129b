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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.phonepe.sessioninsights.core.classification.Approach;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.session.SessionRecord;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import lombok.Builder;
import lombok.Value;

import java.util.stream.Collectors;

/**
 * Flattened view of a {@link SessionRecord} for spreadsheet use
 */
@Value
@Builder
@JsonPropertyOrder({"Session ID", "Parent Session", "Created", "Name", "Project", "Bundle", "Model", "Turn Count",
        "Message Count", "Duration (min)", "Primary Approach", "All Approaches", "Is Iterative", "Iteration Count",
        "Is Exploratory", "Exploration Count", "Has Delegation", "Delegation Count", "File Operations", "Errors",
        "Recovery Rate", "Validation Count", "Planning Ratio", "Success Indicators"})
public class SessionRow {
    private static final String LIST_SEPARATOR = ", ";

    @JsonProperty("Session ID")
    String sessionId;
    @JsonProperty("Parent Session")
    String parentSession;
    @JsonProperty("Created")
    String created;
    @JsonProperty("Name")
    String name;
    @JsonProperty("Project")
    String project;
    @JsonProperty("Bundle")
    String bundle;
    @JsonProperty("Model")
    String model;
    @JsonProperty("Turn Count")
    int turnCount;
    @JsonProperty("Message Count")
    int messageCount;
    @JsonProperty("Duration (min)")
    double durationMinutes;
    @JsonProperty("Primary Approach")
    String primaryApproach;
    @JsonProperty("All Approaches")
    String allApproaches;
    @JsonProperty("Is Iterative")
    boolean iterative;
    @JsonProperty("Iteration Count")
    int iterationCount;
    @JsonProperty("Is Exploratory")
    boolean exploratory;
    @JsonProperty("Exploration Count")
    int explorationCount;
    @JsonProperty("Has Delegation")
    boolean delegation;
    @JsonProperty("Delegation Count")
    int delegationCount;
    @JsonProperty("File Operations")
    int fileOperations;
    @JsonProperty("Errors")
    int errors;
    @JsonProperty("Recovery Rate")
    double recoveryRate;
    @JsonProperty("Validation Count")
    int validationCount;
    @JsonProperty("Planning Ratio")
    double planningRatio;
    @JsonProperty("Success Indicators")
    String successIndicators;

    public static SessionRow from(SessionRecord session) {
        final var patterns = session.getPatterns();
        return SessionRow.builder()
                .sessionId(session.getSessionId())
                .parentSession(session.getParentSessionId())
                .created(session.getCreated())
                .name(session.getName())
                .project(session.getProject())
                .bundle(session.getBundle())
                .model(session.getModel())
                .turnCount(session.getTurnCount())
                .messageCount(session.getMessageCount())
                .durationMinutes(session.getDurationMinutes())
                .primaryApproach(session.getPrimaryApproach().getLabel())
                .allApproaches(session.getApproaches()
                                       .stream()
                                       .map(Approach::getLabel)
                                       .collect(Collectors.joining(LIST_SEPARATOR)))
                .iterative(patterns.getIteration().isIterative())
                .iterationCount(patterns.getIteration().getIterationCount())
                .exploratory(patterns.getExploration().isExploratory())
                .explorationCount(patterns.getExploration().getExplorationToolCount())
                .delegation(patterns.getDelegation().isHasDelegation())
                .delegationCount(patterns.getDelegation().getDelegationCount())
                .fileOperations(patterns.getImplementation().getTotalFileOps())
                .errors(patterns.getErrorRecovery().getErrorsEncountered())
                .recoveryRate(patterns.getErrorRecovery().getRecoveryRate())
                .validationCount(patterns.getValidation().getTotalValidation())
                .planningRatio(AnalysisUtils.round(patterns.getPlanningExecution().getPlanningRatio(), 2))
                .successIndicators(session.getSuccessIndicators()
                                           .stream()
                                           .map(SuccessIndicator::getLabel)
                                           .collect(Collectors.joining(LIST_SEPARATOR)))
                .build();
    }
}
