package org.counterseries.datapipeline.api.contracts;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies one series: a (source, item) pair.
 */
public record GroupKey(String source, String itemId) implements Comparable<GroupKey> {

    private static final Comparator<GroupKey> ORDER = Comparator
            .comparing(GroupKey::source)
            .thenComparing(GroupKey::itemId);

    public GroupKey {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(itemId, "itemId");
    }

    @Override
    public int compareTo(GroupKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return source + "/" + itemId;
    }
}
