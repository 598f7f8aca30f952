package org.counterseries.datapipeline.resources.storage;

import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.ValueFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code <source>_summary.csv}: one row per (source, item) series.
 */
public class SummaryCsvWriter extends AbstractCsvWriter<SummaryRecord> {

    public SummaryCsvWriter(PipelineConfig config) {
        super(config);
    }

    @Override
    public List<String> columns() {
        final List<String> columns = new ArrayList<>(List.of(
                "source", "item_id", "item_name", "artist_name", "first_timestamp", "last_timestamp"));
        for (CounterField counter : config.counters()) {
            columns.add(counter.firstColumn());
            columns.add(counter.lastColumn());
            columns.add(counter.netColumn());
        }
        for (CounterField counter : config.counters()) {
            columns.add(counter.avgRateColumn());
        }
        columns.add("num_points");
        columns.add("num_anomalies_negative_diff");
        return columns;
    }

    @Override
    protected Map<String, String> row(SummaryRecord summary) {
        final Map<String, String> row = new LinkedHashMap<>();
        row.put("source", summary.source());
        row.put("item_id", summary.itemId());
        row.put("item_name", summary.itemName());
        row.put("artist_name", summary.artistName());
        row.put("first_timestamp", ValueFormat.timestamp(summary.firstTimestamp()));
        row.put("last_timestamp", ValueFormat.timestamp(summary.lastTimestamp()));
        for (CounterField counter : config.counters()) {
            row.put(counter.firstColumn(), ValueFormat.number(summary.firstValues().get(counter.name())));
            row.put(counter.lastColumn(), ValueFormat.number(summary.lastValues().get(counter.name())));
            row.put(counter.netColumn(), ValueFormat.number(summary.netChanges().get(counter.name())));
        }
        for (CounterField counter : config.counters()) {
            row.put(counter.avgRateColumn(), ValueFormat.number(summary.averageRates().get(counter.name())));
        }
        row.put("num_points", Integer.toString(summary.numPoints()));
        row.put("num_anomalies_negative_diff", Integer.toString(summary.numAnomaliesNegativeDiff()));
        return row;
    }

    @Override
    protected String source(SummaryRecord summary) {
        return summary.source();
    }

    @Override
    protected String fileSuffix() {
        return "_summary.csv";
    }
}
