package org.counterseries.datapipeline.services.aggregation;

/**
 * How a net change is computed when a boundary value of the series is absent.
 */
public enum NetChangePolicy {
    /** Net change is absent unless both the first and the last value are present. */
    ABSENT,
    /** An absent boundary value counts as zero. */
    ZERO
}
