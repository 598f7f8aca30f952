package org.counterseries.datapipeline.api.contracts;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Roll-up of one series. Maps are keyed by counter field name; absent values are {@code null}.
 */
public record SummaryRecord(
        String source,
        String itemId,
        String itemName,
        String artistName,
        LocalDateTime firstTimestamp,
        LocalDateTime lastTimestamp,
        Map<String, Double> firstValues,
        Map<String, Double> lastValues,
        Map<String, Double> netChanges,
        Map<String, Double> averageRates,
        int numPoints,
        int numAnomaliesNegativeDiff
) {

    public SummaryRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(itemId, "itemId");
        firstValues = Collections.unmodifiableMap(new LinkedHashMap<>(firstValues));
        lastValues = Collections.unmodifiableMap(new LinkedHashMap<>(lastValues));
        netChanges = Collections.unmodifiableMap(new LinkedHashMap<>(netChanges));
        averageRates = Collections.unmodifiableMap(new LinkedHashMap<>(averageRates));
    }

    public GroupKey groupKey() {
        return new GroupKey(source, itemId);
    }
}
