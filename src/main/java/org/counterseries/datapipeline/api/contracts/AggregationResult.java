package org.counterseries.datapipeline.api.contracts;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Output of the aggregator.
 *
 * @param summaries         one summary per series, ordered by (source, item)
 * @param anomaliesBySource negative-diff anomaly totals per source, ordered by source
 */
public record AggregationResult(List<SummaryRecord> summaries, Map<String, Integer> anomaliesBySource) {

    public AggregationResult {
        summaries = List.copyOf(summaries);
        anomaliesBySource = Collections.unmodifiableMap(new TreeMap<>(anomaliesBySource));
    }

    public static AggregationResult empty() {
        return new AggregationResult(List.of(), Map.of());
    }
}
