package org.counterseries.datapipeline.resources.ingest;

import org.counterseries.datapipeline.api.contracts.RawRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads raw snapshot records from storage.
 * <p>
 * The returned order is part of the contract: the normalizer resolves dedup-key collisions with
 * "last record wins", so implementations must document and keep a deterministic order.
 */
public interface IRecordReader {

    /**
     * @param input a file or a directory
     * @return records in precedence order, empty if nothing could be read
     */
    List<RawRecord> read(Path input);
}
