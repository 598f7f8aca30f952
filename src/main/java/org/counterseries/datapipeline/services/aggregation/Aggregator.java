package org.counterseries.datapipeline.services.aggregation;

import org.counterseries.datapipeline.api.contracts.AggregationResult;
import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.GroupExecutor;
import org.counterseries.datapipeline.utils.SeriesGrouping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Reduces each annotated series to a {@link SummaryRecord} and totals anomalies per source.
 * <p>
 * Only reads fields computed by the metrics engine; deltas are never re-derived here.
 */
public class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    static final String ITEM_NAME_FIELD = "item_name";
    static final String ARTIST_NAME_FIELD = "artist_name";

    private final PipelineConfig config;
    private final GroupExecutor executor;

    public Aggregator(PipelineConfig config) {
        this(config, new GroupExecutor(config.parallelism()));
    }

    public Aggregator(PipelineConfig config, GroupExecutor executor) {
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * @param metrics annotated records of any number of series
     * @return one summary per series in (source, item) order, plus anomaly totals per source
     */
    public AggregationResult aggregate(List<MetricRecord> metrics) {
        Objects.requireNonNull(metrics, "metrics");
        if (metrics.isEmpty()) {
            return AggregationResult.empty();
        }

        final Map<GroupKey, List<MetricRecord>> series = SeriesGrouping.group(
                metrics, MetricRecord::groupKey, Comparator.comparing(metric -> metric.record().timestamp()));
        final List<SummaryRecord> summaries = executor.map(new ArrayList<>(series.values()), this::summarize);

        final Map<String, Integer> anomaliesBySource = new TreeMap<>();
        for (SummaryRecord summary : summaries) {
            anomaliesBySource.merge(summary.source(), summary.numAnomaliesNegativeDiff(), Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : anomaliesBySource.entrySet()) {
            if (entry.getValue() > 0) {
                log.info("Source {}: {} negative-diff anomalies", entry.getKey(), entry.getValue());
            }
        }

        log.debug("Aggregated {} records into {} summaries", metrics.size(), summaries.size());
        return new AggregationResult(summaries, anomaliesBySource);
    }

    /**
     * Summarizes one series already sorted by timestamp.
     */
    SummaryRecord summarize(List<MetricRecord> series) {
        final CanonicalRecord first = series.get(0).record();
        final CanonicalRecord last = series.get(series.size() - 1).record();

        final Map<String, Double> firstValues = new LinkedHashMap<>();
        final Map<String, Double> lastValues = new LinkedHashMap<>();
        final Map<String, Double> netChanges = new LinkedHashMap<>();
        final Map<String, Double> averageRates = new LinkedHashMap<>();
        for (CounterField counter : config.counters()) {
            final Double firstValue = first.counter(counter.name());
            final Double lastValue = last.counter(counter.name());
            firstValues.put(counter.name(), firstValue);
            lastValues.put(counter.name(), lastValue);
            netChanges.put(counter.name(), netChange(firstValue, lastValue));
            averageRates.put(counter.name(), averageRate(series, counter));
        }

        int anomalies = 0;
        for (MetricRecord metric : series) {
            if (metric.anomalyNegativeDiff()) {
                anomalies++;
            }
        }

        return new SummaryRecord(
                first.source(),
                first.itemId(),
                preferLast(first.descriptive(ITEM_NAME_FIELD), last.descriptive(ITEM_NAME_FIELD)),
                preferLast(first.descriptive(ARTIST_NAME_FIELD), last.descriptive(ARTIST_NAME_FIELD)),
                first.timestamp(),
                last.timestamp(),
                firstValues,
                lastValues,
                netChanges,
                averageRates,
                series.size(),
                anomalies);
    }

    private Double netChange(Double firstValue, Double lastValue) {
        return switch (config.netChangePolicy()) {
            case ABSENT -> firstValue == null || lastValue == null ? null : lastValue - firstValue;
            case ZERO -> (lastValue == null ? 0.0 : lastValue) - (firstValue == null ? 0.0 : firstValue);
        };
    }

    /**
     * @return mean of the present rates, or {@code null} when the series has none
     */
    private static Double averageRate(List<MetricRecord> series, CounterField counter) {
        double sum = 0.0;
        int count = 0;
        for (MetricRecord metric : series) {
            final Double rate = metric.rate(counter.name());
            if (rate != null) {
                sum += rate;
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    private static String preferLast(String firstValue, String lastValue) {
        if (!lastValue.isEmpty()) {
            return lastValue;
        }
        return firstValue;
    }
}
