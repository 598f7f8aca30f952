package org.counterseries.datapipeline.resources.storage;

import org.counterseries.datapipeline.api.contracts.MetricRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.services.metrics.MetricsEngine;
import org.counterseries.junit.extensions.logging.ExpectLog;
import org.counterseries.junit.extensions.logging.LogLevel;
import org.counterseries.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.counterseries.testutils.TestRecords.canonical;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SeriesCsvWriterTest {

    @TempDir
    Path tempDir;

    private final PipelineConfig config = PipelineConfig.defaults();
    private final SeriesCsvWriter writer = new SeriesCsvWriter(config);

    @Test
    void columnLayout() {
        assertThat(writer.columns()).containsExactly(
                "source", "item_id", "item_name", "artist_name", "collection_name", "timestamp",
                "total_plays", "total_listeners", "delta_plays", "delta_listeners", "delta_minutes",
                "rate_plays_per_min", "rate_listeners_per_min", "is_anomaly_negative_diff");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Found 1 negative-diff anomalies.*")
    void writesAnnotatedSeries() throws IOException {
        // Given
        final List<MetricRecord> metrics = new MetricsEngine(config).computeMetrics(List.of(
                canonical("GENIE", "1", "2025-12-17T10:00", 100.0, 10.0),
                canonical("GENIE", "1", "2025-12-17T10:10", 120.0, null),
                canonical("GENIE", "1", "2025-12-17T10:15", 110.0, 12.0))).records();

        // When
        final List<Path> files = writer.write(metrics, tempDir);

        // Then
        assertThat(files).singleElement().satisfies(file ->
                assertThat(file.getFileName().toString()).isEqualTo("GENIE_series.csv"));
        assertThat(CsvTestSupport.headerLine(files.get(0))).isEqualTo(String.join(",", writer.columns()));
        final List<Map<String, String>> rows = CsvTestSupport.readRows(files.get(0));
        assertThat(rows).hasSize(3);
        assertThat(rows.get(0))
                .containsEntry("timestamp", "2025-12-17 10:00:00")
                .containsEntry("delta_plays", "")
                .containsEntry("delta_minutes", "")
                .containsEntry("is_anomaly_negative_diff", "false");
        assertThat(rows.get(1))
                .containsEntry("item_name", "Song 1")
                .containsEntry("total_listeners", "")
                .containsEntry("delta_plays", "20")
                .containsEntry("delta_minutes", "10")
                .containsEntry("rate_plays_per_min", "2")
                .containsEntry("rate_listeners_per_min", "");
        assertThat(rows.get(2))
                .containsEntry("delta_plays", "-10")
                .containsEntry("rate_plays_per_min", "-2")
                .containsEntry("is_anomaly_negative_diff", "true");
    }
}
