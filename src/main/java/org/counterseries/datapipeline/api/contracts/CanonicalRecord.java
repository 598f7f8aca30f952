package org.counterseries.datapipeline.api.contracts;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A validated observation with a minute-resolution timestamp.
 * <p>
 * Counter values are {@code null} when absent. Descriptive values are never {@code null}.
 *
 * @param source      data source, e.g. {@code GENIE}
 * @param itemId      item identifier within the source
 * @param timestamp   observation time truncated to the minute
 * @param descriptive descriptive fields such as {@code item_name}
 * @param counters    counter values keyed by counter field name
 */
public record CanonicalRecord(
        String source,
        String itemId,
        LocalDateTime timestamp,
        Map<String, String> descriptive,
        Map<String, Double> counters
) {

    public CanonicalRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(itemId, "itemId");
        Objects.requireNonNull(timestamp, "timestamp");
        // LinkedHashMap instead of Map.copyOf: absent counters are stored as null values
        descriptive = Collections.unmodifiableMap(new LinkedHashMap<>(descriptive));
        counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public GroupKey groupKey() {
        return new GroupKey(source, itemId);
    }

    /**
     * @param counter counter field name
     * @return the value, or {@code null} if absent
     */
    public Double counter(String counter) {
        return counters.get(counter);
    }

    /**
     * @param field descriptive field name
     * @return the value, or an empty string if the field was not materialized
     */
    public String descriptive(String field) {
        return descriptive.getOrDefault(field, "");
    }
}
