package io.barsync.marketdata.target;

import io.barsync.marketdata.model.SeriesKey;

import java.util.OptionalLong;

/**
 * A stored bar flattened with its series fields, ready for the secondary store.
 *
 * @param dataSource provenance tag written alongside the row
 */
public record MigrationRecord(SeriesKey key, long timestamp, double open, double high, double low, double close,
                              long volume, OptionalLong openInterest, String dataSource) {

    public DedupKey dedupKey() {
        return new DedupKey(timestamp, key.exchange().name(), key.symbol(), key.interval().code());
    }

    public String table() { return TargetTables.tableFor(key.segment()); }
}
