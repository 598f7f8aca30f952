package org.counterseries.datapipeline;

import org.counterseries.datapipeline.api.contracts.AggregationResult;
import org.counterseries.datapipeline.api.contracts.MetricsResult;
import org.counterseries.datapipeline.api.contracts.NormalizationResult;

/**
 * Outcome of one batch run. Stages after an empty stage hold empty results.
 */
public record PipelineRun(
        Status status,
        int rawRecordCount,
        NormalizationResult normalization,
        MetricsResult metrics,
        AggregationResult aggregation
) {

    public enum Status {
        COMPLETED,
        EMPTY_INPUT,
        NO_VALID_RECORDS,
        EMPTY_AFTER_FILTER
    }

    public boolean hasOutput() {
        return status == Status.COMPLETED;
    }

    static PipelineRun emptyInput() {
        return new PipelineRun(Status.EMPTY_INPUT, 0, NormalizationResult.empty(), MetricsResult.empty(),
                AggregationResult.empty());
    }
}
