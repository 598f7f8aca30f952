package org.counterseries.datapipeline.api.contracts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A canonical record annotated with interval metrics relative to the previous point of its series.
 * <p>
 * All derived values are {@code null} when absent. The first point of every series has no deltas,
 * no elapsed time and no rates.
 *
 * @param record              the underlying observation
 * @param deltas              counter differences keyed by counter field name
 * @param deltaMinutes        elapsed minutes since the previous point
 * @param rates               per-minute rates keyed by counter field name
 * @param anomalyNegativeDiff whether any present delta is negative
 */
public record MetricRecord(
        CanonicalRecord record,
        Map<String, Double> deltas,
        Double deltaMinutes,
        Map<String, Double> rates,
        boolean anomalyNegativeDiff
) {

    public MetricRecord {
        Objects.requireNonNull(record, "record");
        deltas = Collections.unmodifiableMap(new LinkedHashMap<>(deltas));
        rates = Collections.unmodifiableMap(new LinkedHashMap<>(rates));
    }

    public GroupKey groupKey() {
        return record.groupKey();
    }

    public Double delta(String counter) {
        return deltas.get(counter);
    }

    public Double rate(String counter) {
        return rates.get(counter);
    }
}
