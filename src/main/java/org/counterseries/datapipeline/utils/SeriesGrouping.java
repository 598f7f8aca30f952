package org.counterseries.datapipeline.utils;

import org.counterseries.datapipeline.api.contracts.GroupKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Splits a flat record list into per-series lists.
 */
public final class SeriesGrouping {

    private SeriesGrouping() {
        // Utility class - prevent instantiation
    }

    /**
     * Groups records in a single pass, keeping their encounter order within each group, then
     * stable-sorts every group. Groups iterate in {@link GroupKey} order.
     *
     * @param records     flat record list
     * @param keyFunction extracts the series key
     * @param order       ordering within one series
     * @return groups keyed and ordered by series key
     */
    public static <T> Map<GroupKey, List<T>> group(List<T> records, Function<T, GroupKey> keyFunction,
                                                  Comparator<T> order) {
        final Map<GroupKey, List<T>> groups = new TreeMap<>();
        for (T record : records) {
            groups.computeIfAbsent(keyFunction.apply(record), key -> new ArrayList<>()).add(record);
        }
        for (List<T> series : groups.values()) {
            series.sort(order);
        }
        return groups;
    }
}
