package io.barsync.marketdata.sync;

import io.barsync.marketdata.fetch.FetchReport;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.OutcomeStatus;
import io.barsync.marketdata.model.SeriesKey;

import java.util.List;

/**
 * @param planned  missing sub-ranges found before fetching; empty when the series was already complete
 * @param fetch    per-chunk results, or null when nothing was fetched
 * @param coverage stored coverage after the sync
 * @param error    why the series could not be synced at all, or null
 */
public record SyncResult(SeriesKey key, CoverageRange requested, List<CoverageRange> planned, FetchReport fetch,
                         List<CoverageRange> coverage, OutcomeStatus status, String error) {

    public SyncResult {
        planned = List.copyOf(planned);
        coverage = List.copyOf(coverage);
    }

    static SyncResult upToDate(SeriesKey key, CoverageRange requested, List<CoverageRange> coverage) {
        return new SyncResult(key, requested, List.of(), null, coverage, OutcomeStatus.SUCCEEDED, null);
    }

    static SyncResult failed(SeriesKey key, CoverageRange requested, String error) {
        return new SyncResult(key, requested, List.of(), null, List.of(), OutcomeStatus.FAILED, error);
    }

    public int rowsCommitted() { return fetch == null ? 0 : fetch.rowsCommitted(); }
}
