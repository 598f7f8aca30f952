package org.counterseries.cli.rendering;

import org.counterseries.cli.rendering.ItemRanking.RankedItem;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.services.aggregation.Aggregator;
import org.counterseries.datapipeline.services.metrics.MetricsEngine;
import org.counterseries.junit.extensions.logging.ExpectLog;
import org.counterseries.junit.extensions.logging.LogLevel;
import org.counterseries.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.counterseries.testutils.TestRecords.LISTENERS;
import static org.counterseries.testutils.TestRecords.PLAYS;
import static org.counterseries.testutils.TestRecords.at;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class HtmlReportWriterTest {

    @TempDir
    Path tempDir;

    private final PipelineConfig config = PipelineConfig.defaults();
    private OutputLayout layout;
    private HtmlReportWriter writer;

    @BeforeEach
    void setUp() {
        layout = new OutputLayout(tempDir);
        writer = new HtmlReportWriter(config, layout);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Found 1 negative-diff anomalies.*")
    void itemReportContainsSummarySeriesAndCharts() throws IOException {
        // Given
        final List<MetricRecord> series = new MetricsEngine(config).computeMetrics(List.of(
                record("a/b", "<b>Hit & Run</b>", 100.0, "2025-12-17T10:00"),
                record("a/b", "<b>Hit & Run</b>", 90.0, "2025-12-17T10:10"))).records();
        final SummaryRecord summary = new Aggregator(config).aggregate(series).summaries().get(0);

        // When
        final Path file = writer.writeItemReport(summary, series, true);

        // Then
        assertThat(file).isEqualTo(tempDir.resolve("reports/GENIE_a_b_report.html"));
        final String html = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(html)
                .contains("&lt;b&gt;Hit &amp; Run&lt;/b&gt;")
                .doesNotContain("<b>Hit")
                .contains("<th>net_plays</th><td>-10</td>")
                .contains("<th>num_anomalies_negative_diff</th><td>1</td>")
                .contains("<tr class=\"anomaly\"><td>2025-12-17 10:10:00</td>")
                .contains("src=\"../png/GENIE_a_b_totals.png\"")
                .contains("src=\"../png/GENIE_a_b_deltas.png\"");
    }

    @Test
    void itemReportWithoutChartsHasNoImages() throws IOException {
        final List<MetricRecord> series = new MetricsEngine(config).computeMetrics(List.of(
                record("1", "Song", 1.0, "2025-12-17T10:00"))).records();
        final SummaryRecord summary = new Aggregator(config).aggregate(series).summaries().get(0);

        final String html = Files.readString(writer.writeItemReport(summary, series, false), StandardCharsets.UTF_8);

        assertThat(html).doesNotContain("<img").contains("<h2>Series</h2>");
    }

    @Test
    void sourceIndexListsBothRankingsAndLinks() throws IOException {
        final SummaryRecord top = summary("1", "First", 50.0);
        final SummaryRecord second = summary("2", "Second", 5.0);
        final CounterField plays = config.counters().get(0);

        final Path file = writer.writeSourceIndex("GENIE", List.of(top, second), plays,
                List.of(new RankedItem(top, 50.0), new RankedItem(second, 5.0)),
                List.of(new RankedItem(second, 2.5)), 10, true);

        final String html = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(file.getFileName().toString()).isEqualTo("GENIE_index.html");
        assertThat(html)
                .contains("<h2>Top 2 by last total_plays</h2>")
                .contains("src=\"../png/GENIE_top10_totals.png\"")
                .contains("<tr><td>1</td><td>1</td><td>First</td><td>Artist</td><td>50</td></tr>")
                .contains("<h2>Top 1 by average delta_plays over the last 3 points</h2>")
                .contains("src=\"../png/GENIE_top10_delta.png\"")
                .contains("<th>avg_delta_plays</th>")
                .contains("<tr><td>1</td><td>2</td><td>Second</td><td>Artist</td><td>2.5</td></tr>")
                .contains("<a href=\"GENIE_2_report.html\">2</a>");
        assertThat(html.indexOf("First")).isLessThan(html.indexOf("Second"));
    }

    @Test
    void sourceIndexWithoutChartsHasNoImages() throws IOException {
        final SummaryRecord only = summary("1", "First", 50.0);

        final Path file = writer.writeSourceIndex("GENIE", List.of(only), config.counters().get(0),
                List.of(new RankedItem(only, 50.0)), List.of(), 10, false);

        assertThat(Files.readString(file, StandardCharsets.UTF_8))
                .doesNotContain("<img")
                .contains("<h2>Top 0 by average delta_plays over the last 3 points</h2>");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "File name 'A_B_x' is already taken.*")
    void coincidingItemNamesGetDistinctReports() throws IOException {
        final OutputLayout unique = OutputLayout.forSeries(tempDir,
                List.of(new GroupKey("A", "B:x"), new GroupKey("A_B", "x"), new GroupKey("A", "B/x")));
        final HtmlReportWriter uniqueWriter = new HtmlReportWriter(config, unique);

        final Path first = uniqueWriter.writeItemReport(summaryOf("A", "B/x"), List.of(), true);
        final Path second = uniqueWriter.writeItemReport(summaryOf("A", "B:x"), List.of(), true);
        final Path third = uniqueWriter.writeItemReport(summaryOf("A_B", "x"), List.of(), true);

        assertThat(List.of(first, second, third)).extracting(path -> path.getFileName().toString())
                .containsExactly("A_B_x_report.html", "A_B_x_2_report.html", "A_B_x_3_report.html");
        assertThat(Files.readString(second, StandardCharsets.UTF_8)).contains("src=\"../png/A_B_x_2_totals.png\"");
    }

    @Test
    void escapesMarkup() {
        assertThat(HtmlReportWriter.escape("<a href=\"x\">'&'</a>"))
                .isEqualTo("&lt;a href=&quot;x&quot;&gt;&#39;&amp;&#39;&lt;/a&gt;");
        assertThat(HtmlReportWriter.escape(null)).isEmpty();
    }

    private static CanonicalRecord record(String itemId, String name, Double plays, String timestamp) {
        final Map<String, Double> counters = new LinkedHashMap<>();
        counters.put(PLAYS, plays);
        counters.put(LISTENERS, null);
        return new CanonicalRecord("GENIE", itemId, at(timestamp),
                Map.of("item_name", name, "artist_name", "Artist"), counters);
    }

    private static SummaryRecord summaryOf(String source, String itemId) {
        final Map<String, Double> values = new LinkedHashMap<>();
        values.put(PLAYS, 1.0);
        values.put(LISTENERS, null);
        return new SummaryRecord(source, itemId, "", "", at("2025-12-17T10:00"), at("2025-12-17T11:00"),
                values, values, values, values, 1, 0);
    }

    private static SummaryRecord summary(String itemId, String name, Double net) {
        final Map<String, Double> values = new LinkedHashMap<>();
        values.put(PLAYS, net);
        values.put(LISTENERS, null);
        return new SummaryRecord("GENIE", itemId, name, "Artist", at("2025-12-17T10:00"), at("2025-12-17T11:00"),
                values, values, values, values, 2, 0);
    }
}
