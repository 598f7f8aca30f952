package org.counterseries.datapipeline;

import org.counterseries.datapipeline.api.contracts.AggregationResult;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.MetricsResult;
import org.counterseries.datapipeline.api.contracts.NormalizationResult;
import org.counterseries.datapipeline.api.contracts.RawRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.resources.ingest.IRecordReader;
import org.counterseries.datapipeline.services.aggregation.Aggregator;
import org.counterseries.datapipeline.services.metrics.MetricsEngine;
import org.counterseries.datapipeline.services.normalizer.Normalizer;
import org.counterseries.datapipeline.utils.GroupExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the batch transform: ingestion, normalization, filtering, metrics and aggregation.
 * <p>
 * Every stage returns a new structure and never modifies its input, so each stage can be rerun
 * or tested on its own. Bad data only ever reduces the number of valid records; empty input and
 * an empty filtered set are reported through {@link PipelineRun#status()}, not as errors.
 */
public class SeriesPipeline {

    private static final Logger log = LoggerFactory.getLogger(SeriesPipeline.class);

    private final IRecordReader reader;
    private final Normalizer normalizer;
    private final MetricsEngine metricsEngine;
    private final Aggregator aggregator;

    public SeriesPipeline(PipelineConfig config, IRecordReader reader) {
        Objects.requireNonNull(config, "config");
        final GroupExecutor executor = new GroupExecutor(config.parallelism());
        this.reader = Objects.requireNonNull(reader, "reader");
        this.normalizer = new Normalizer(config);
        this.metricsEngine = new MetricsEngine(config, executor);
        this.aggregator = new Aggregator(config, executor);
    }

    /**
     * Loads records from {@code input} and processes them.
     */
    public PipelineRun run(Path input, SeriesFilter filter) {
        log.info("Loading input records from {}", input);
        return process(reader.read(input), filter);
    }

    /**
     * Processes records that are already in memory.
     *
     * @param rawRecords records in precedence order
     * @param filter     restriction applied after normalization and before metrics
     */
    public PipelineRun process(List<RawRecord> rawRecords, SeriesFilter filter) {
        Objects.requireNonNull(filter, "filter");
        if (rawRecords.isEmpty()) {
            log.error("Input data is empty, nothing to process");
            return PipelineRun.emptyInput();
        }

        final NormalizationResult normalized = normalizer.normalize(rawRecords);
        log.info("Normalization complete: {} records, {} duplicate-key collisions, {} rejected",
                normalized.records().size(), normalized.collisionCount(), normalized.rejectedCount());

        if (normalized.isEmpty()) {
            log.error("No valid records after normalization, nothing to process");
            return new PipelineRun(PipelineRun.Status.NO_VALID_RECORDS, rawRecords.size(), normalized,
                    MetricsResult.empty(), AggregationResult.empty());
        }

        final List<CanonicalRecord> selected = applyFilter(normalized.records(), filter);
        if (selected.isEmpty()) {
            log.error("No records left after filtering ({}), nothing to process", describe(filter));
            return new PipelineRun(PipelineRun.Status.EMPTY_AFTER_FILTER, rawRecords.size(), normalized,
                    MetricsResult.empty(), AggregationResult.empty());
        }

        final MetricsResult metrics = metricsEngine.computeMetrics(selected);
        log.info("Derived metrics complete: {} negative-diff anomalies", metrics.anomalyCount());

        final AggregationResult aggregation = aggregator.aggregate(metrics.records());
        log.info("Aggregation complete: {} series summarized", aggregation.summaries().size());

        return new PipelineRun(PipelineRun.Status.COMPLETED, rawRecords.size(), normalized, metrics, aggregation);
    }

    private static List<CanonicalRecord> applyFilter(List<CanonicalRecord> records, SeriesFilter filter) {
        if (filter.isEmpty()) {
            return records;
        }
        final List<CanonicalRecord> selected = new ArrayList<>();
        for (CanonicalRecord record : records) {
            if (filter.matches(record)) {
                selected.add(record);
            }
        }
        return selected;
    }

    private static String describe(SeriesFilter filter) {
        return "source=" + (filter.source() == null ? "*" : filter.source())
                + ", item_id=" + (filter.itemId() == null ? "*" : filter.itemId());
    }
}
