package io.barsync.marketdata.target;

import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SeriesKey;

import java.util.Locale;

/** One table per segment, and the SQL shared by the JDBC-backed stores. */
public final class TargetTables {
    static final String COLUMNS = "ts, exchange, symbol, bar_interval, open, high, low, close, volume, oi, data_source";
    static final String KEY_COLUMNS = "ts, exchange, symbol, bar_interval";

    private TargetTables() {}

    public static String tableFor(MarketSegment segment) {
        return "ohlcv_" + segment.name().toLowerCase(Locale.ROOT);
    }

    static String countSql(SeriesKey key) {
        return "SELECT COUNT(*) FROM " + tableFor(key.segment()) + " WHERE exchange = ? AND symbol = ? AND bar_interval = ?";
    }
}
