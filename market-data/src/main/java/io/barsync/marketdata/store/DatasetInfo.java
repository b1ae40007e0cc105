package io.barsync.marketdata.store;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SeriesKey;

import java.time.Instant;
import java.util.List;

/**
 * Metadata kept in the store index for one dataset. {@code earliest} and {@code latest} are meaningful only
 * when {@code rowCount > 0}; a dataset may exist with coverage but no bars (e.g. a holiday-only range).
 */
public record DatasetInfo(SeriesKey key,
                          int rowCount,
                          long earliest,
                          long latest,
                          Instant lastUpdated,
                          int schemaVersion,
                          int rowsPerBlock,
                          int blockCount,
                          String checksum,
                          String sourceTag,
                          List<CoverageRange> coverage,
                          List<ProvenanceEntry> provenance) {

    public DatasetInfo {
        coverage = List.copyOf(coverage);
        provenance = List.copyOf(provenance);
    }

    public boolean hasBars() { return rowCount > 0; }
}
