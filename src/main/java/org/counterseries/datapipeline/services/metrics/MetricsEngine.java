package org.counterseries.datapipeline.services.metrics;

import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.MetricsResult;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.GroupExecutor;
import org.counterseries.datapipeline.utils.SeriesGrouping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes first differences, elapsed minutes, per-minute rates and the negative-diff anomaly
 * flag for every series.
 * <p>
 * Deltas are only taken between consecutive points of the same (source, item) series. The first
 * point of a series has no deltas, no elapsed time and no rates. A rate exists only when both the
 * delta is present and the elapsed time is strictly positive. Anomalies are flagged and counted,
 * never corrected or removed.
 */
public class MetricsEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

    private final PipelineConfig config;
    private final GroupExecutor executor;

    public MetricsEngine(PipelineConfig config) {
        this(config, new GroupExecutor(config.parallelism()));
    }

    public MetricsEngine(PipelineConfig config, GroupExecutor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * @param records canonical records, normally the normalizer output
     * @return annotated records grouped by series in (source, item, timestamp) order
     */
    public MetricsResult computeMetrics(List<CanonicalRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return MetricsResult.empty();
        }

        final Map<GroupKey, List<CanonicalRecord>> series = SeriesGrouping.group(
                records, CanonicalRecord::groupKey, Comparator.comparing(CanonicalRecord::timestamp));
        final List<List<MetricRecord>> annotated = executor.map(new ArrayList<>(series.values()), this::annotateSeries);

        final List<MetricRecord> result = new ArrayList<>(records.size());
        int anomalies = 0;
        for (List<MetricRecord> group : annotated) {
            for (MetricRecord metric : group) {
                if (metric.anomalyNegativeDiff()) {
                    anomalies++;
                }
                result.add(metric);
            }
        }

        if (anomalies > 0) {
            log.warn("Found {} negative-diff anomalies (cumulative counter decreased)", anomalies);
        }
        log.debug("Computed metrics for {} records in {} series", result.size(), series.size());
        return new MetricsResult(result, anomalies);
    }

    /**
     * Annotates one series already sorted by timestamp.
     */
    List<MetricRecord> annotateSeries(List<CanonicalRecord> series) {
        final List<MetricRecord> annotated = new ArrayList<>(series.size());
        CanonicalRecord previous = null;
        for (CanonicalRecord current : series) {
            annotated.add(previous == null ? firstPoint(current) : annotate(previous, current));
            previous = current;
        }
        return annotated;
    }

    private MetricRecord firstPoint(CanonicalRecord record) {
        final Map<String, Double> absent = new LinkedHashMap<>();
        for (CounterField counter : config.counters()) {
            absent.put(counter.name(), null);
        }
        return new MetricRecord(record, absent, null, absent, false);
    }

    private MetricRecord annotate(CanonicalRecord previous, CanonicalRecord current) {
        final double deltaMinutes = Duration.between(previous.timestamp(), current.timestamp()).toMillis() / 60_000.0;

        final Map<String, Double> deltas = new LinkedHashMap<>();
        final Map<String, Double> rates = new LinkedHashMap<>();
        boolean negative = false;
        for (CounterField counter : config.counters()) {
            final Double before = previous.counter(counter.name());
            final Double after = current.counter(counter.name());
            final Double delta = before == null || after == null ? null : after - before;
            deltas.put(counter.name(), delta);
            rates.put(counter.name(), delta != null && deltaMinutes > 0 ? delta / deltaMinutes : null);
            if (delta != null && delta < 0) {
                negative = true;
            }
        }
        return new MetricRecord(current, deltas, deltaMinutes, rates, negative);
    }
}
