package io.barsync.marketdata.plan;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SeriesKey;

import java.io.IOException;
import java.util.List;

/** Read access to stored coverage metadata. Empty list when nothing is stored for the key. */
public interface CoverageLookup {
    List<CoverageRange> coverage(SeriesKey key) throws IOException;
}
