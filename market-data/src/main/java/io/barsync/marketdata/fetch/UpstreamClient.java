package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.RawBar;
import io.barsync.marketdata.model.SeriesKey;

import java.util.List;

/**
 * Historical bar source. One call is one rate-limited request; callers keep the span within the interval's
 * maximum.
 */
public interface UpstreamClient {
    List<RawBar> fetchBars(SeriesKey key, long startEpochSecond, long endEpochSecond)
            throws TransientFetchException, PermanentFetchException, InterruptedException;
}
