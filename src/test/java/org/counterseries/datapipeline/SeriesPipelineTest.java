package org.counterseries.datapipeline;

import org.counterseries.datapipeline.api.contracts.RawRecord;
import org.counterseries.datapipeline.api.contracts.SummaryRecord;
import org.counterseries.datapipeline.config.PipelineConfig;
import org.counterseries.datapipeline.resources.ingest.IRecordReader;
import org.counterseries.junit.extensions.logging.ExpectLog;
import org.counterseries.junit.extensions.logging.LogLevel;
import org.counterseries.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.counterseries.testutils.TestRecords.PLAYS;
import static org.counterseries.testutils.TestRecords.raw;
import static org.counterseries.testutils.TestRecords.snapshot;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SeriesPipelineTest {

    private static final Path INPUT = Path.of("snapshots");

    private IRecordReader reader;
    private SeriesPipeline pipeline;

    @BeforeEach
    void setUp() {
        reader = mock(IRecordReader.class);
        pipeline = new SeriesPipeline(PipelineConfig.defaults(), reader);
    }

    @Test
    void runsAllStages() {
        // Given
        when(reader.read(INPUT)).thenReturn(List.of(
                snapshot("GENIE", "1", "2025-12-17", 10, 0, 100.0),
                snapshot("GENIE", "1", "2025-12-17", 10, 10, 120.0),
                snapshot("GENIE", "1", "2025-12-17", 10, 20, 150.0),
                snapshot("GENIE", "1", "2025-12-17", 10, 20, 150.0),
                snapshot("MELON", "5", "2025-12-17", 10, 0, 7.0)));

        // When
        final PipelineRun run = pipeline.run(INPUT, SeriesFilter.none());

        // Then
        verify(reader).read(INPUT);
        assertThat(run.status()).isEqualTo(PipelineRun.Status.COMPLETED);
        assertThat(run.hasOutput()).isTrue();
        assertThat(run.rawRecordCount()).isEqualTo(5);
        assertThat(run.normalization().collisionCount()).isEqualTo(1);
        assertThat(run.metrics().records()).hasSize(4);
        assertThat(run.aggregation().summaries()).hasSize(2);
        final SummaryRecord genie = run.aggregation().summaries().get(0);
        assertThat(genie.netChanges()).containsEntry(PLAYS, 50.0);
        assertThat(genie.numPoints()).isEqualTo(3);
    }

    @Test
    void filterRestrictsToOneSeries() {
        when(reader.read(INPUT)).thenReturn(List.of(
                snapshot("GENIE", "1", "2025-12-17", 10, 0, 100.0),
                snapshot("GENIE", "2", "2025-12-17", 10, 0, 100.0),
                snapshot("MELON", "1", "2025-12-17", 10, 0, 100.0)));

        final PipelineRun run = pipeline.run(INPUT, new SeriesFilter("GENIE", "2"));

        assertThat(run.aggregation().summaries()).extracting(summary -> summary.groupKey().toString())
                .containsExactly("GENIE/2");
    }

    @Test
    void sourceFilterKeepsAllItemsOfThatSource() {
        when(reader.read(INPUT)).thenReturn(List.of(
                snapshot("GENIE", "1", "2025-12-17", 10, 0, 100.0),
                snapshot("GENIE", "2", "2025-12-17", 10, 0, 100.0),
                snapshot("MELON", "1", "2025-12-17", 10, 0, 100.0)));

        final PipelineRun run = pipeline.run(INPUT, new SeriesFilter("GENIE", null));

        assertThat(run.aggregation().summaries()).hasSize(2);
        assertThat(run.aggregation().anomaliesBySource()).containsOnlyKeys("GENIE");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Input data is empty, nothing to process")
    void emptyInputEndsRunWithoutOutput() {
        when(reader.read(INPUT)).thenReturn(List.of());

        final PipelineRun run = pipeline.run(INPUT, SeriesFilter.none());

        assertThat(run.status()).isEqualTo(PipelineRun.Status.EMPTY_INPUT);
        assertThat(run.hasOutput()).isFalse();
        assertThat(run.aggregation().summaries()).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Dropped 1 records whose timestamp could not be parsed")
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "No valid records after normalization.*")
    void allInvalidRecordsEndRunWithoutOutput() {
        final List<RawRecord> invalid = List.of(raw("{\"source\":\"GENIE\",\"item_id\":\"1\",\"date\":\"yesterday\"}"));

        final PipelineRun run = pipeline.process(invalid, SeriesFilter.none());

        assertThat(run.status()).isEqualTo(PipelineRun.Status.NO_VALID_RECORDS);
        assertThat(run.normalization().rejectedCount()).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "No records left after filtering \\(source=SPOTIFY, item_id=\\*\\).*")
    void emptyFilteredSetEndsRunWithoutOutput() {
        final PipelineRun run = pipeline.process(
                List.of(snapshot("GENIE", "1", "2025-12-17", 10, 0, 100.0)), new SeriesFilter("SPOTIFY", null));

        assertThat(run.status()).isEqualTo(PipelineRun.Status.EMPTY_AFTER_FILTER);
        assertThat(run.metrics().records()).isEmpty();
    }

    @Test
    void parallelRunGivesSameSummaries() {
        final List<RawRecord> input = List.of(
                snapshot("GENIE", "1", "2025-12-17", 10, 0, 100.0),
                snapshot("GENIE", "1", "2025-12-17", 10, 10, 120.0),
                snapshot("GENIE", "2", "2025-12-17", 10, 0, 1.0),
                snapshot("GENIE", "2", "2025-12-17", 11, 0, 61.0),
                snapshot("MELON", "3", "2025-12-17", 10, 0, 5.0));

        final PipelineRun sequential = pipeline.process(input, SeriesFilter.none());
        final PipelineRun parallel = new SeriesPipeline(PipelineConfig.defaults().withParallelism(3), reader)
                .process(input, SeriesFilter.none());

        assertThat(parallel.aggregation()).isEqualTo(sequential.aggregation());
    }
}
