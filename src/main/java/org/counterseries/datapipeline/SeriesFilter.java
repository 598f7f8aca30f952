package org.counterseries.datapipeline;

import org.counterseries.datapipeline.api.contracts.CanonicalRecord;

/**
 * Optional restriction of a run to one source and/or one item. {@code null} matches everything.
 */
public record SeriesFilter(String source, String itemId) {

    public static SeriesFilter none() {
        return new SeriesFilter(null, null);
    }

    public boolean isEmpty() {
        return source == null && itemId == null;
    }

    public boolean matches(CanonicalRecord record) {
        return (source == null || source.equals(record.source()))
                && (itemId == null || itemId.equals(record.itemId()));
    }
}
