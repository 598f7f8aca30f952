package org.counterseries.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.counterseries.cli.CommandLineInterface;
import org.counterseries.cli.rendering.HtmlReportWriter;
import org.counterseries.cli.rendering.ItemRanking;
import org.counterseries.cli.rendering.OutputLayout;
import org.counterseries.cli.rendering.SeriesChartRenderer;
import org.counterseries.cli.rendering.TopItemsChartRenderer;
import org.counterseries.datapipeline.PipelineRun;
import org.counterseries.datapipeline.SeriesFilter;
import org.counterseries.datapipeline.SeriesPipeline;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.resources.ingest.JsonLinesRecordReader;
import org.counterseries.datapipeline.resources.storage.SeriesCsvWriter;
import org.counterseries.datapipeline.resources.storage.SummaryCsvWriter;
import org.counterseries.datapipeline.utils.PathExpansion;
import org.counterseries.datapipeline.utils.SeriesGrouping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

@Command(name = "render", description = "Normalizes counter snapshots and writes summaries, series, charts and reports.")
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    private static final int TOP_CHART_ROW_HEIGHT = 24;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--input", required = true, description = "JSONL file or directory searched recursively for *.jsonl files.")
    private String input;

    @Option(names = "--outdir", description = "Output root directory. Default: render.outdir from configuration.")
    private String outdir;

    @Option(names = {"--source", "--platform"}, description = "Only process this source.")
    private String source;

    @Option(names = {"--item-id", "--song-id"}, description = "Only process this item.")
    private String itemId;

    @Option(names = "--topn", description = "Number of items in the per-source ranking. Default: render.topn from configuration.")
    private Integer topN;

    @Option(names = "--threads", description = "Number of threads for per-series processing. Default: pipeline.parallelism from configuration.")
    private Integer threads;

    @Option(names = "--export-png", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Render PNG charts. Default: true")
    private boolean exportPng;

    @Option(names = "--export-html", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Write HTML reports. Default: true")
    private boolean exportHtml;

    @Option(names = "--export-series", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Write the annotated series CSV. Default: true")
    private boolean exportSeries;

    @Override
    public Integer call() {
        final Config config;
        final PipelineConfig pipelineConfig;
        final Path inputPath;
        final Path outputRoot;
        final int rankSize;
        final SeriesChartRenderer seriesCharts;
        final TopItemsChartRenderer topCharts;
        try {
            config = parent.getConfig();
            pipelineConfig = threads == null
                    ? PipelineConfig.fromConfig(config)
                    : PipelineConfig.fromConfig(config).withParallelism(threads);
            inputPath = Path.of(PathExpansion.expandPath(input));
            outputRoot = Path.of(PathExpansion.expandPath(
                    outdir != null ? outdir : config.getString("render.outdir")));
            rankSize = topN != null ? topN : config.getInt("render.topn");
            if (rankSize < 1) {
                throw new IllegalArgumentException("--topn must be at least 1, got " + rankSize);
            }
            seriesCharts = new SeriesChartRenderer(config.getInt("render.chart-width"), config.getInt("render.chart-height"));
            topCharts = new TopItemsChartRenderer(config.getInt("render.chart-width"), TOP_CHART_ROW_HEIGHT);
        } catch (ConfigException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        final SeriesPipeline pipeline = new SeriesPipeline(pipelineConfig, new JsonLinesRecordReader());
        final PipelineRun run = pipeline.run(inputPath, new SeriesFilter(source, itemId));
        if (!run.hasOutput()) {
            return 0;
        }

        try {
            writeOutputs(run, pipelineConfig, outputRoot, rankSize, seriesCharts, topCharts);
        } catch (IOException e) {
            log.error("Failed to write output to {}: {}", outputRoot, e.getMessage());
            return 1;
        }

        log.info("Rendering complete. Output directory: {}", outputRoot.toAbsolutePath());
        return 0;
    }

    private void writeOutputs(PipelineRun run, PipelineConfig pipelineConfig, Path outputRoot, int rankSize,
                              SeriesChartRenderer seriesCharts, TopItemsChartRenderer topCharts) throws IOException {
        final List<SummaryRecord> summaries = run.aggregation().summaries();
        final List<MetricRecord> metrics = run.metrics().records();
        final List<GroupKey> keys = new ArrayList<>();
        for (SummaryRecord summary : summaries) {
            keys.add(summary.groupKey());
        }
        final OutputLayout layout = OutputLayout.forSeries(outputRoot, keys);

        new SummaryCsvWriter(pipelineConfig).write(summaries, layout.csvDir());
        if (exportSeries) {
            new SeriesCsvWriter(pipelineConfig).write(metrics, layout.csvDir());
        }
        if (!exportPng && !exportHtml) {
            return;
        }

        final Map<GroupKey, List<MetricRecord>> series = SeriesGrouping.group(
                metrics, MetricRecord::groupKey, Comparator.comparing(metric -> metric.record().timestamp()));
        final Map<String, List<SummaryRecord>> bySource = new TreeMap<>();
        for (SummaryRecord summary : summaries) {
            bySource.computeIfAbsent(summary.source(), key -> new ArrayList<>()).add(summary);
        }
        final CounterField rankCounter = pipelineConfig.counters().get(0);

        if (exportPng) {
            for (Map.Entry<GroupKey, List<MetricRecord>> entry : series.entrySet()) {
                SeriesChartRenderer.writePng(seriesCharts.renderTotals(entry.getValue(), pipelineConfig.counters()),
                        layout.pngDir().resolve(layout.totalsChartName(entry.getKey())));
                SeriesChartRenderer.writePng(seriesCharts.renderDeltas(entry.getValue(), pipelineConfig.counters()),
                        layout.pngDir().resolve(layout.deltasChartName(entry.getKey())));
            }
            for (Map.Entry<String, List<SummaryRecord>> entry : bySource.entrySet()) {
                SeriesChartRenderer.writePng(
                        topCharts.render(ItemRanking.byLastValue(entry.getValue(), rankCounter, rankSize)),
                        layout.pngDir().resolve(layout.topTotalsChartName(entry.getKey(), rankSize)));
                SeriesChartRenderer.writePng(
                        topCharts.render(ItemRanking.byRecentDelta(entry.getValue(), series, rankCounter, rankSize)),
                        layout.pngDir().resolve(layout.topDeltaChartName(entry.getKey(), rankSize)));
            }
            log.info("Charts written to {}", layout.pngDir());
        }

        if (exportHtml) {
            final HtmlReportWriter reports = new HtmlReportWriter(pipelineConfig, layout);
            for (SummaryRecord summary : summaries) {
                reports.writeItemReport(summary, series.getOrDefault(summary.groupKey(), List.of()), exportPng);
            }
            for (Map.Entry<String, List<SummaryRecord>> entry : bySource.entrySet()) {
                reports.writeSourceIndex(entry.getKey(), entry.getValue(), rankCounter,
                        ItemRanking.byLastValue(entry.getValue(), rankCounter, rankSize),
                        ItemRanking.byRecentDelta(entry.getValue(), series, rankCounter, rankSize),
                        rankSize, exportPng);
            }
            log.info("Reports written to {}", layout.reportsDir());
        }
    }
}
