package org.counterseries.datapipeline.resources.storage;

import org.counterseries.datapipeline.api.contracts.CanonicalRecord;
import org.counterseries.datapipeline.api.contracts.CounterField;
import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.utils.ValueFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes {@code <source>_series.csv}: the normalized, annotated time series, one row per point.
 */
public class SeriesCsvWriter extends AbstractCsvWriter<MetricRecord> {

    public SeriesCsvWriter(PipelineConfig config) {
        super(config);
    }

    @Override
    public List<String> columns() {
        final List<String> columns = new ArrayList<>(List.of("source", "item_id"));
        columns.addAll(config.descriptiveFields());
        columns.add("timestamp");
        for (CounterField counter : config.counters()) {
            columns.add(counter.name());
        }
        for (CounterField counter : config.counters()) {
            columns.add(counter.deltaColumn());
        }
        columns.add("delta_minutes");
        for (CounterField counter : config.counters()) {
            columns.add(counter.rateColumn());
        }
        columns.add("is_anomaly_negative_diff");
        return columns;
    }

    @Override
    protected Map<String, String> row(MetricRecord metric) {
        final CanonicalRecord record = metric.record();
        final Map<String, String> row = new LinkedHashMap<>();
        row.put("source", record.source());
        row.put("item_id", record.itemId());
        for (String field : config.descriptiveFields()) {
            row.put(field, record.descriptive(field));
        }
        row.put("timestamp", ValueFormat.timestamp(record.timestamp()));
        for (CounterField counter : config.counters()) {
            row.put(counter.name(), ValueFormat.number(record.counter(counter.name())));
        }
        for (CounterField counter : config.counters()) {
            row.put(counter.deltaColumn(), ValueFormat.number(metric.delta(counter.name())));
        }
        row.put("delta_minutes", ValueFormat.number(metric.deltaMinutes()));
        for (CounterField counter : config.counters()) {
            row.put(counter.rateColumn(), ValueFormat.number(metric.rate(counter.name())));
        }
        row.put("is_anomaly_negative_diff", Boolean.toString(metric.anomalyNegativeDiff()));
        return row;
    }

    @Override
    protected String source(MetricRecord metric) {
        return metric.record().source();
    }

    @Override
    protected String fileSuffix() {
        return "_series.csv";
    }
}
