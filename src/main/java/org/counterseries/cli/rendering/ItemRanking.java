package org.counterseries.cli.rendering;

import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.GroupKey;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Per-source rankings of items shown as top-N charts and tables.
 * <p>
 * Both rankings are descending, skip items without a value and keep the (source, item) order of
 * the input on ties.
 */
public final class ItemRanking {

    /** Number of most recent points whose deltas are averaged for {@link #byRecentDelta}. */
    public static final int RECENT_POINTS = 3;

    /**
     * One ranked item.
     *
     * @param summary the item summary
     * @param value   the value the item was ranked by
     */
    public record RankedItem(SummaryRecord summary, double value) {
    }

    private ItemRanking() {
        // Utility class - prevent instantiation
    }

    /**
     * Ranks items by the cumulative value at their last point.
     */
    public static List<RankedItem> byLastValue(List<SummaryRecord> summaries, CounterField counter, int topN) {
        final List<RankedItem> ranked = new ArrayList<>();
        for (SummaryRecord summary : summaries) {
            final Double last = summary.lastValues().get(counter.name());
            if (last != null) {
                ranked.add(new RankedItem(summary, last));
            }
        }
        return top(ranked, topN);
    }

    /**
     * Ranks items by the mean of the present deltas among their last {@value #RECENT_POINTS} points.
     *
     * @param series annotated records per series in timestamp order
     */
    public static List<RankedItem> byRecentDelta(List<SummaryRecord> summaries,
                                                 Map<GroupKey, List<MetricRecord>> series,
                                                 CounterField counter, int topN) {
        final List<RankedItem> ranked = new ArrayList<>();
        for (SummaryRecord summary : summaries) {
            final List<MetricRecord> points = series.getOrDefault(summary.groupKey(), List.of());
            double sum = 0.0;
            int count = 0;
            for (MetricRecord metric : points.subList(Math.max(points.size() - RECENT_POINTS, 0), points.size())) {
                final Double delta = metric.delta(counter.name());
                if (delta != null) {
                    sum += delta;
                    count++;
                }
            }
            if (count > 0) {
                ranked.add(new RankedItem(summary, sum / count));
            }
        }
        return top(ranked, topN);
    }

    private static List<RankedItem> top(List<RankedItem> ranked, int topN) {
        ranked.sort(Comparator.comparingDouble(RankedItem::value).reversed());
        return List.copyOf(ranked.subList(0, Math.min(Math.max(topN, 0), ranked.size())));
    }
}
