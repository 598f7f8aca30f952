package org.counterseries.datapipeline.api.contracts;

import java.util.List;

/**
 * Output of the normalizer.
 *
 * @param records        canonical records ordered by (source, item, timestamp)
 * @param collisionCount records discarded because a later record shared their dedup key
 * @param rejectedCount  records dropped because no timestamp could be constructed
 */
public record NormalizationResult(List<CanonicalRecord> records, int collisionCount, int rejectedCount) {

    public NormalizationResult {
        records = List.copyOf(records);
    }

    public static NormalizationResult empty() {
        return new NormalizationResult(List.of(), 0, 0);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
