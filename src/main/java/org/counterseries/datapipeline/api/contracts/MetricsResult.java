package org.counterseries.datapipeline.api.contracts;

import java.util.List;

/**
 * Output of the metrics engine.
 *
 * @param records      annotated records in the same order as the input series
 * @param anomalyCount number of records flagged with a negative delta
 */
public record MetricsResult(List<MetricRecord> records, int anomalyCount) {

    public MetricsResult {
        records = List.copyOf(records);
    }

    public static MetricsResult empty() {
        return new MetricsResult(List.of(), 0);
    }
}
