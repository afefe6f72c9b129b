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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.phonepe.sessioninsights.core.aggregation.CorpusSummary;
import com.phonepe.sessioninsights.core.aggregation.DailyActivity;
import com.phonepe.sessioninsights.core.analysis.AnalysisReport;
import com.phonepe.sessioninsights.core.classification.SuccessIndicator;
import com.phonepe.sessioninsights.core.errors.ErrorType;
import com.phonepe.sessioninsights.core.errors.SessionInsightsException;
import com.phonepe.sessioninsights.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xddf.usermodel.chart.AxisPosition;
import org.apache.poi.xddf.usermodel.chart.BarDirection;
import org.apache.poi.xddf.usermodel.chart.ChartTypes;
import org.apache.poi.xddf.usermodel.chart.LegendPosition;
import org.apache.poi.xddf.usermodel.chart.XDDFBarChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSourcesFactory;
import org.apache.poi.xddf.usermodel.chart.XDDFPieChartData;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFChart;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.StreamSupport;

/**
 * Excel workbook with a dashboard sheet (headline numbers, an approach frequency bar chart and a primary approach
 * pie chart) followed by the data sheets the charts are drawn from and the raw per-session rows.
 */
@Slf4j
public class XlsxDashboardExporter implements ReportExporter {
    static final String DASHBOARD_SHEET = "Dashboard";
    static final String FREQUENCY_SHEET = "Approach Frequency";
    static final String PRIMARY_SHEET = "Primary Approach";
    static final String TIMELINE_SHEET = "Timeline";
    static final String SUCCESS_SHEET = "Success Patterns";
    static final String RAW_DATA_SHEET = "Raw Data";
    static final String TITLE = "Amplifier Problem-Solving Approaches Dashboard";

    private static final DateTimeFormatter ANALYSIS_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final byte[] TITLE_FILL = {(byte) 0x44, (byte) 0x72, (byte) 0xC4};
    private static final byte[] HEADER_FILL = {(byte) 0xD9, (byte) 0xE1, (byte) 0xF2};
    private static final int WIDE_COLUMN = 35;
    private static final int NARROW_COLUMN = 12;
    private static final int TIMELINE_COLUMN = 15;
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };
    private static final Map<SuccessIndicator, String> INDICATOR_METRICS = indicatorMetrics();

    private final CsvMapper mapper = new CsvMapper();
    private final List<String> rawColumns;
    private final Clock clock;

    public XlsxDashboardExporter() {
        this(Clock.systemDefaultZone());
    }

    public XlsxDashboardExporter(@NonNull Clock clock) {
        this.clock = clock;
        final CsvSchema schema = mapper.schemaFor(SessionRow.class);
        this.rawColumns = StreamSupport.stream(schema.spliterator(), false)
                .map(CsvSchema.Column::getName)
                .toList();
    }

    @Override
    public Path export(@NonNull AnalysisReport report, @NonNull Path outputFile) {
        try (final var workbook = new XSSFWorkbook();
             final var bytes = new ByteArrayOutputStream()) {
            final var styles = new Styles(workbook);
            final var summary = report.getSummary();
            final var dashboard = workbook.createSheet(DASHBOARD_SHEET);
            final var frequency = frequencySheet(workbook, summary, styles);
            final var primary = primarySheet(workbook, summary, styles);
            timelineSheet(workbook, summary, styles);
            successSheet(workbook, summary, styles);
            rawDataSheet(workbook, report, styles);
            fillDashboard(dashboard, summary, styles);
            if (frequency.getLastRowNum() > 0) {
                barChart(dashboard, frequency);
            }
            if (primary.getLastRowNum() > 0) {
                pieChart(dashboard, primary);
            }
            workbook.write(bytes);
            FileUtils.write(outputFile, bytes.toByteArray());
        }
        catch (IOException e) {
            throw SessionInsightsException.error(ErrorType.SERIALIZATION_ERROR, e, outputFile, e.getMessage());
        }
        log.info("Exported dashboard for {} sessions to {}", report.getSessions().size(), outputFile);
        return outputFile;
    }

    private void fillDashboard(XSSFSheet sheet, CorpusSummary summary, Styles styles) {
        final var titleRow = sheet.createRow(0);
        titleRow.setHeightInPoints(30);
        final var title = titleRow.createCell(0);
        title.setCellValue(TITLE);
        title.setCellStyle(styles.title);
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, 5));

        labelled(sheet, 2, "Analysis Date:").setCellValue(LocalDateTime.now(clock).format(ANALYSIS_DATE_FORMAT));
        labelled(sheet, 3, "Total Sessions:").setCellValue(summary.getTotalSessions());
        final var range = labelled(sheet, 4, "Date Range:");
        if (null != summary.getDateRange()) {
            range.setCellValue(summary.getDateRange().getFrom() + " to " + summary.getDateRange().getTo());
        }
        sheet.setColumnWidth(0, NARROW_COLUMN * 2 * 256);
    }

    private XSSFSheet frequencySheet(XSSFWorkbook workbook, CorpusSummary summary, Styles styles) {
        final var sheet = workbook.createSheet(FREQUENCY_SHEET);
        header(sheet, 0, styles, "Problem-Solving Approach", "Count", "Percentage");
        var rowIndex = 1;
        for (final var entry : mostCommonFirst(summary.getApproachFrequencies())) {
            final var row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(entry.getKey());
            row.createCell(1).setCellValue(entry.getValue());
            row.createCell(2).setCellValue(percent(summary, entry.getValue()));
        }
        widths(sheet, WIDE_COLUMN, NARROW_COLUMN, NARROW_COLUMN);
        return sheet;
    }

    private XSSFSheet primarySheet(XSSFWorkbook workbook, CorpusSummary summary, Styles styles) {
        final var sheet = workbook.createSheet(PRIMARY_SHEET);
        header(sheet, 0, styles, "Primary Approach", "Count");
        var rowIndex = 1;
        for (final var entry : mostCommonFirst(summary.getPrimaryApproachDistribution())) {
            final var row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(entry.getKey());
            row.createCell(1).setCellValue(entry.getValue());
        }
        widths(sheet, WIDE_COLUMN, NARROW_COLUMN);
        return sheet;
    }

    private void timelineSheet(XSSFWorkbook workbook, CorpusSummary summary, Styles styles) {
        final var sheet = workbook.createSheet(TIMELINE_SHEET);
        header(sheet, 0, styles,
               "Date", "Total Sessions", "Exploratory", "Error Recovery", "Validation", "Direct Implementation");
        var rowIndex = 1;
        for (final DailyActivity day : summary.getTimeline()) {
            final var row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(day.getDate());
            row.createCell(1).setCellValue(day.getTotalSessions());
            row.createCell(2).setCellValue(day.getExploratory());
            row.createCell(3).setCellValue(day.getErrorRecovery());
            row.createCell(4).setCellValue(day.getValidation());
            row.createCell(5).setCellValue(day.getDirectImplementation());
        }
        widths(sheet, TIMELINE_COLUMN, TIMELINE_COLUMN, TIMELINE_COLUMN,
               TIMELINE_COLUMN, TIMELINE_COLUMN, TIMELINE_COLUMN);
    }

    private void successSheet(XSSFWorkbook workbook, CorpusSummary summary, Styles styles) {
        final var sheet = workbook.createSheet(SUCCESS_SHEET);
        final var title = sheet.createRow(0).createCell(0);
        title.setCellValue("Pattern Analysis");
        title.setCellStyle(styles.sectionTitle);
        sheet.addMergedRegion(new CellRangeAddress(0, 0, 0, 2));

        header(sheet, 2, styles, "Metric", "Value", "Notes");
        var rowIndex = 3;
        for (final var metric : INDICATOR_METRICS.entrySet()) {
            final long count = summary.getSuccessIndicatorCounts().getOrDefault(metric.getKey().getLabel(), 0L);
            final var row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(metric.getValue());
            row.createCell(1).setCellValue(count);
            row.createCell(2).setCellValue(percent(summary, count));
        }

        rowIndex++;
        final var averages = sheet.createRow(rowIndex).createCell(0);
        averages.setCellValue("Average Metrics");
        averages.setCellStyle(styles.bold);
        sheet.addMergedRegion(new CellRangeAddress(rowIndex, rowIndex, 0, 2));
        rowIndex++;
        final var turns = sheet.createRow(rowIndex++);
        turns.createCell(0).setCellValue("Average Turns per Session");
        turns.createCell(1).setCellValue(String.format("%.1f", summary.getAverageTurns()));
        final var messages = sheet.createRow(rowIndex);
        messages.createCell(0).setCellValue("Average Messages per Session");
        messages.createCell(1).setCellValue(String.format("%.1f", summary.getAverageMessages()));
        widths(sheet, WIDE_COLUMN, WIDE_COLUMN, WIDE_COLUMN);
    }

    private void rawDataSheet(XSSFWorkbook workbook, AnalysisReport report, Styles styles) {
        final var sheet = workbook.createSheet(RAW_DATA_SHEET);
        header(sheet, 0, styles, rawColumns.toArray(String[]::new));
        var rowIndex = 1;
        for (final var session : report.getSessions()) {
            final var values = mapper.convertValue(SessionRow.from(session), ROW_TYPE);
            final var row = sheet.createRow(rowIndex++);
            for (int column = 0; column < rawColumns.size(); column++) {
                value(row.createCell(column), values.get(rawColumns.get(column)));
            }
        }
        sheet.createFreezePane(0, 1);
    }

    private static void barChart(XSSFSheet dashboard, XSSFSheet frequency) {
        final var drawing = dashboard.createDrawingPatriarch();
        final XSSFChart chart = drawing.createChart(drawing.createAnchor(0, 0, 0, 0, 0, 7, 9, 30));
        chart.setTitleText("Problem-Solving Approach Frequency");
        chart.setTitleOverlay(false);
        final var categoryAxis = chart.createCategoryAxis(AxisPosition.BOTTOM);
        categoryAxis.setTitle("Approach");
        final var valueAxis = chart.createValueAxis(AxisPosition.LEFT);
        valueAxis.setTitle("Number of Sessions");
        final var last = frequency.getLastRowNum();
        final var data = (XDDFBarChartData) chart.createData(ChartTypes.BAR, categoryAxis, valueAxis);
        data.setBarDirection(BarDirection.COL);
        data.addSeries(XDDFDataSourcesFactory.fromStringCellRange(frequency, new CellRangeAddress(1, last, 0, 0)),
                       XDDFDataSourcesFactory.fromNumericCellRange(frequency, new CellRangeAddress(1, last, 1, 1)));
        chart.plot(data);
    }

    private static void pieChart(XSSFSheet dashboard, XSSFSheet primary) {
        final var drawing = dashboard.createDrawingPatriarch();
        final XSSFChart chart = drawing.createChart(drawing.createAnchor(0, 0, 0, 0, 10, 7, 19, 30));
        chart.setTitleText("Primary Approach Distribution");
        chart.setTitleOverlay(false);
        chart.getOrAddLegend().setPosition(LegendPosition.RIGHT);
        final var last = primary.getLastRowNum();
        final var data = (XDDFPieChartData) chart.createData(ChartTypes.PIE, null, null);
        data.setVaryColors(true);
        data.addSeries(XDDFDataSourcesFactory.fromStringCellRange(primary, new CellRangeAddress(1, last, 0, 0)),
                       XDDFDataSourcesFactory.fromNumericCellRange(primary, new CellRangeAddress(1, last, 1, 1)));
        chart.plot(data);
    }

    private static Cell labelled(Sheet sheet, int rowIndex, String label) {
        final Row row = sheet.createRow(rowIndex);
        row.createCell(0).setCellValue(label);
        return row.createCell(1);
    }

    private static void header(Sheet sheet, int rowIndex, Styles styles, String... names) {
        final var row = sheet.createRow(rowIndex);
        for (int column = 0; column < names.length; column++) {
            final var cell = row.createCell(column);
            cell.setCellValue(names[column]);
            cell.setCellStyle(styles.header);
        }
    }

    private static void widths(Sheet sheet, int... characters) {
        for (int column = 0; column < characters.length; column++) {
            sheet.setColumnWidth(column, characters[column] * 256);
        }
    }

    private static void value(Cell cell, Object value) {
        if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        }
        else if (value instanceof Boolean flag) {
            cell.setCellValue(flag);
        }
        else if (null != value) {
            cell.setCellValue(value.toString());
        }
    }

    private static String percent(CorpusSummary summary, long count) {
        return String.format("%.1f%%", summary.percentage(count));
    }

    private static List<Map.Entry<String, Long>> mostCommonFirst(Map<String, Long> counts) {
        return counts.entrySet()
                .stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .toList();
    }

    private static Map<SuccessIndicator, String> indicatorMetrics() {
        final var metrics = new LinkedHashMap<SuccessIndicator, String>();
        metrics.put(SuccessIndicator.FILES_MODIFIED, "Sessions with File Modifications");
        metrics.put(SuccessIndicator.VALIDATED, "Sessions with Validation");
        metrics.put(SuccessIndicator.GOOD_ERROR_RECOVERY, "Sessions with Good Error Recovery");
        metrics.put(SuccessIndicator.SUBSTANTIAL_WORK, "Substantial Work Sessions");
        return metrics;
    }

    private static final class Styles {
        private final CellStyle title;
        private final CellStyle sectionTitle;
        private final CellStyle header;
        private final CellStyle bold;

        private Styles(XSSFWorkbook workbook) {
            final var titleFont = workbook.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 18);
            titleFont.setColor(IndexedColors.WHITE.getIndex());
            this.title = filled(workbook, TITLE_FILL);
            this.title.setFont(titleFont);

            final var sectionFont = workbook.createFont();
            sectionFont.setBold(true);
            sectionFont.setFontHeightInPoints((short) 14);
            this.sectionTitle = workbook.createCellStyle();
            this.sectionTitle.setFont(sectionFont);

            final var boldFont = workbook.createFont();
            boldFont.setBold(true);
            this.bold = workbook.createCellStyle();
            this.bold.setFont(boldFont);
            this.header = filled(workbook, HEADER_FILL);
            this.header.setFont(boldFont);
        }

        private static XSSFCellStyle filled(XSSFWorkbook workbook, byte[] rgb) {
            final var style = workbook.createCellStyle();
            style.setFillForegroundColor(new XSSFColor(rgb, null));
            style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            return style;
        }
    }
}
