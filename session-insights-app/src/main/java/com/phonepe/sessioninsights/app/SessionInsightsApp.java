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

package com.phonepe.sessioninsights.app;

import com.phonepe.sessioninsights.app.config.ConfigLoader;
import com.phonepe.sessioninsights.app.config.SessionInsightsConfig;
import com.phonepe.sessioninsights.app.report.ConsoleReport;
import com.phonepe.sessioninsights.core.analysis.AnalysisReport;
import com.phonepe.sessioninsights.core.analysis.SessionAnalyzer;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.core.utils.JsonUtils;
import com.phonepe.sessioninsights.filesystem.export.CsvReportExporter;
import com.phonepe.sessioninsights.filesystem.export.JsonReportExporter;
import com.phonepe.sessioninsights.filesystem.export.XlsxDashboardExporter;
import com.phonepe.sessioninsights.filesystem.session.FileSystemSessionLoader;
import com.phonepe.sessioninsights.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point. Loads sessions, analyses them, writes the configured reports and logs a summary.
 */
@Slf4j
public class SessionInsightsApp {
    private final SessionInsightsConfig config;
    private final SessionAnalyzer analyzer;

    public SessionInsightsApp(@NonNull SessionInsightsConfig config) {
        this(config, new SessionAnalyzer());
    }

    public SessionInsightsApp(@NonNull SessionInsightsConfig config, @NonNull SessionAnalyzer analyzer) {
        this.config = config;
        this.analyzer = analyzer;
    }

    public static void main(String[] args) {
        try {
            new SessionInsightsApp(ConfigLoader.load(args)).run();
        }
        catch (SessionInsightsException e) {
            log.error("Analysis failed [{}]: {}", e.getErrorType(), e.getMessage(), e);
            System.exit(1);
        }
    }

    public AnalysisReport run() {
        final var mapper = JsonUtils.createMapper();
        final var projectsDir = FileUtils.expandPath(config.getProjectsDir());
        log.info("Analyzing sessions under {}", projectsDir);
        final var report = analyzer.analyze(new FileSystemSessionLoader(projectsDir, mapper));

        final var outputDir = FileUtils.ensurePath(FileUtils.expandPath(config.getOutputDir()), true, true);
        if (config.isExportJson()) {
            new JsonReportExporter(mapper).export(report, outputDir.resolve(config.getJsonFileName()));
        }
        if (config.isExportCsv()) {
            new CsvReportExporter().export(report, outputDir.resolve(config.getCsvFileName()));
        }
        if (config.isExportXlsx()) {
            new XlsxDashboardExporter().export(report, outputDir.resolve(config.getXlsxFileName()));
        }
        ConsoleReport.lines(report.getSummary()).forEach(line -> log.info("{}", line));
        log.info("Analysis complete");
        return report;
    }
}
