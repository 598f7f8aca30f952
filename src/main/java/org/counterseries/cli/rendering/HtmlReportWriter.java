package org.counterseries.cli.rendering;

import org.counterseries.cli.rendering.ItemRanking.RankedItem;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.ValueFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes self-contained HTML pages: one report per item and one index per source.
 */
public class HtmlReportWriter {

    private static final Logger log = LoggerFactory.getLogger(HtmlReportWriter.class);

    private final PipelineConfig config;
    private final OutputLayout layout;

    public HtmlReportWriter(PipelineConfig config, OutputLayout layout) {
        this.config = config;
        this.layout = layout;
    }

    /**
     * Writes the report of one item: summary table, optional charts and the annotated series.
     *
     * @param summary    the item summary
     * @param series     the item's annotated records in timestamp order
     * @param withCharts whether the PNG charts of this item were rendered
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeItemReport(SummaryRecord summary, List<MetricRecord> series, boolean withCharts) throws IOException {
        final StringBuilder html = new StringBuilder();
        open(html, "Item report: " + summary.source() + " / " + summary.itemId());

        html.append("<h2>Summary</h2>\n<table>\n");
        for (Map.Entry<String, String> entry : summaryRows(summary).entrySet()) {
            html.append("<tr><th>").append(escape(entry.getKey())).append("</th><td>")
                    .append(escape(entry.getValue())).append("</td></tr>\n");
        }
        html.append("</table>\n");

        if (withCharts) {
            html.append("<h2>Cumulative totals</h2>\n");
            appendLegend(html);
            html.append("<img src=\"").append(escape(layout.chartLinkFromReports(layout.totalsChartName(summary.groupKey()))))
                    .append("\" alt=\"totals\">\n");
            html.append("<h2>Deltas</h2>\n");
            appendLegend(html);
            html.append("<img src=\"").append(escape(layout.chartLinkFromReports(layout.deltasChartName(summary.groupKey()))))
                    .append("\" alt=\"deltas\">\n");
        }

        html.append("<h2>Series</h2>\n");
        appendSeriesTable(html, series);
        close(html);

        final Path file = layout.reportsDir().resolve(layout.itemReportName(summary.groupKey()));
        write(file, html);
        log.debug("Item report written: {}", file);
        return file;
    }

    /**
     * Writes the index of one source: both item rankings, their charts if rendered, and links to
     * all item reports.
     *
     * @param source        the source
     * @param summaries     all summaries of the source
     * @param rankCounter   the counter the rankings are based on
     * @param byLastValue   top items by latest cumulative value, in rank order
     * @param byRecentDelta top items by recent average delta, in rank order
     * @param topN          the requested ranking size, part of the chart file names
     * @param withCharts    whether the ranking charts were rendered
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeSourceIndex(String source, List<SummaryRecord> summaries, CounterField rankCounter,
                                 List<RankedItem> byLastValue, List<RankedItem> byRecentDelta,
                                 int topN, boolean withCharts) throws IOException {
        final StringBuilder html = new StringBuilder();
        open(html, "Source overview: " + source);

        appendRanking(html, "Top " + byLastValue.size() + " by last " + rankCounter.name(),
                rankCounter.lastColumn(), byLastValue,
                withCharts ? layout.topTotalsChartName(source, topN) : null);
        appendRanking(html, "Top " + byRecentDelta.size() + " by average " + rankCounter.deltaColumn()
                        + " over the last " + ItemRanking.RECENT_POINTS + " points",
                "avg_" + rankCounter.deltaColumn(), byRecentDelta,
                withCharts ? layout.topDeltaChartName(source, topN) : null);

        html.append("<h2>Items</h2>\n<ul>\n");
        for (SummaryRecord summary : summaries) {
            html.append("<li><a href=\"").append(escape(layout.itemReportName(summary.groupKey()))).append("\">")
                    .append(escape(summary.itemId())).append("</a> ").append(escape(summary.itemName()))
                    .append(" (").append(summary.numPoints()).append(" points, ")
                    .append(summary.numAnomaliesNegativeDiff()).append(" anomalies)</li>\n");
        }
        html.append("</ul>\n");
        close(html);

        final Path file = layout.reportsDir().resolve(layout.sourceIndexName(source));
        write(file, html);
        log.debug("Source index written: {}", file);
        return file;
    }

    private void appendRanking(StringBuilder html, String title, String valueColumn, List<RankedItem> ranked,
                               String chart) {
        html.append("<h2>").append(escape(title)).append("</h2>\n");
        if (chart != null) {
            html.append("<img src=\"").append(escape(layout.chartLinkFromReports(chart))).append("\" alt=\"ranking\">\n");
        }
        html.append("<table>\n<tr><th>rank</th><th>item_id</th><th>item_name</th><th>artist_name</th><th>")
                .append(escape(valueColumn)).append("</th></tr>\n");
        int rank = 1;
        for (RankedItem item : ranked) {
            final SummaryRecord summary = item.summary();
            html.append("<tr><td>").append(rank++).append("</td><td>").append(escape(summary.itemId()))
                    .append("</td><td>").append(escape(summary.itemName()))
                    .append("</td><td>").append(escape(summary.artistName()))
                    .append("</td><td>").append(ValueFormat.number(item.value()))
                    .append("</td></tr>\n");
        }
        html.append("</table>\n");
    }

    private Map<String, String> summaryRows(SummaryRecord summary) {
        final Map<String, String> rows = new LinkedHashMap<>();
        rows.put("source", summary.source());
        rows.put("item_id", summary.itemId());
        rows.put("item_name", summary.itemName());
        rows.put("artist_name", summary.artistName());
        rows.put("first_timestamp", ValueFormat.timestamp(summary.firstTimestamp()));
        rows.put("last_timestamp", ValueFormat.timestamp(summary.lastTimestamp()));
        for (CounterField counter : config.counters()) {
            rows.put(counter.firstColumn(), ValueFormat.number(summary.firstValues().get(counter.name())));
            rows.put(counter.lastColumn(), ValueFormat.number(summary.lastValues().get(counter.name())));
            rows.put(counter.netColumn(), ValueFormat.number(summary.netChanges().get(counter.name())));
            rows.put(counter.avgRateColumn(), ValueFormat.number(summary.averageRates().get(counter.name())));
        }
        rows.put("num_points", Integer.toString(summary.numPoints()));
        rows.put("num_anomalies_negative_diff", Integer.toString(summary.numAnomaliesNegativeDiff()));
        return rows;
    }

    private void appendSeriesTable(StringBuilder html, List<MetricRecord> series) {
        html.append("<table>\n<tr><th>timestamp</th>");
        for (CounterField counter : config.counters()) {
            html.append("<th>").append(escape(counter.name())).append("</th>");
        }
        for (CounterField counter : config.counters()) {
            html.append("<th>").append(escape(counter.deltaColumn())).append("</th>");
        }
        html.append("<th>delta_minutes</th>");
        for (CounterField counter : config.counters()) {
            html.append("<th>").append(escape(counter.rateColumn())).append("</th>");
        }
        html.append("<th>is_anomaly_negative_diff</th></tr>\n");

        for (MetricRecord metric : series) {
            final CanonicalRecord record = metric.record();
            html.append(metric.anomalyNegativeDiff() ? "<tr class=\"anomaly\">" : "<tr>");
            html.append("<td>").append(ValueFormat.timestamp(record.timestamp())).append("</td>");
            for (CounterField counter : config.counters()) {
                html.append("<td>").append(ValueFormat.number(record.counter(counter.name()))).append("</td>");
            }
            for (CounterField counter : config.counters()) {
                html.append("<td>").append(ValueFormat.number(metric.delta(counter.name()))).append("</td>");
            }
            html.append("<td>").append(ValueFormat.number(metric.deltaMinutes())).append("</td>");
            for (CounterField counter : config.counters()) {
                html.append("<td>").append(ValueFormat.number(metric.rate(counter.name()))).append("</td>");
            }
            html.append("<td>").append(metric.anomalyNegativeDiff()).append("</td></tr>\n");
        }
        html.append("</table>\n");
    }

    private void appendLegend(StringBuilder html) {
        html.append("<p class=\"legend\">");
        final List<CounterField> counters = config.counters();
        for (int i = 0; i < counters.size(); i++) {
            final Color color = SeriesChartRenderer.PALETTE[i % SeriesChartRenderer.PALETTE.length];
            html.append("<span style=\"color:").append(String.format("#%06x", color.getRGB() & 0xFFFFFF))
                    .append("\">&#9632; ").append(escape(counters.get(i).name())).append("</span> ");
        }
        html.append("<span style=\"color:#d62728\">&#9679; negative diff</span></p>\n");
    }

    private static void open(StringBuilder html, String title) {
        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n<title>")
                .append(escape(title)).append("</title>\n<style>\n")
                .append("table { border-collapse: collapse; }\n")
                .append("th, td { border: 1px solid #999; padding: 2px 6px; text-align: left; }\n")
                .append("tr.anomaly td { background: #fde0e0; }\n")
                .append("</style>\n</head>\n<body>\n<h1>").append(escape(title)).append("</h1>\n");
    }

    private static void close(StringBuilder html) {
        html.append("</body>\n</html>\n");
    }

    private static void write(Path file, StringBuilder html) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, html, StandardCharsets.UTF_8);
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        final StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
