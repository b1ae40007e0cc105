package io.barsync.marketdata.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of one time series. A store holds at most one dataset per key.
 */
public record SeriesKey(MarketSegment segment, Exchange exchange, String symbol, SamplingInterval interval) {

    public SeriesKey {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(interval, "interval");
        symbol = normalizeSymbol(symbol);
        if (exchange.segment() != segment) {
            throw new IllegalArgumentException(exchange + " does not belong to segment " + segment);
        }
    }

    public static SeriesKey of(Exchange exchange, String symbol, SamplingInterval interval) {
        return new SeriesKey(exchange.segment(), exchange, symbol, interval);
    }

    public static SeriesKey of(String exchange, String symbol, String interval) {
        return of(Exchange.parse(exchange), symbol, SamplingInterval.fromCode(interval));
    }

    /** Hierarchical dataset path inside a store, {@code /data/NSE/RELIANCE/day}. */
    public String path() {
        return "/data/" + exchange.name() + "/" + symbol + "/" + interval.code();
    }

    public static SeriesKey parsePath(String path) {
        String[] parts = path.split("/");
        if (parts.length != 5 || !parts[0].isEmpty() || !"data".equals(parts[1])) {
            throw new IllegalArgumentException("Not a dataset path: " + path);
        }
        return of(Exchange.parse(parts[2]), parts[3], SamplingInterval.fromCode(parts[4]));
    }

    static String normalizeSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        String s = symbol.trim().toUpperCase(Locale.ROOT)
                .replace('&', '_')
                .replace('-', '_')
                .replace(' ', '_');
        if (s.isEmpty() || s.contains("/")) throw new IllegalArgumentException("Invalid symbol: '" + symbol + "'");
        return s;
    }

    @Override
    public String toString() { return exchange + ":" + symbol + "@" + interval.code(); }
}
