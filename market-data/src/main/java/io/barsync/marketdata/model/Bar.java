package io.barsync.marketdata.model;

/**
 * One validated price bar. Timestamps are epoch seconds.
 */
public sealed interface Bar permits EquityBar, DerivativeBar {
    long timestamp();
    double open();
    double high();
    double low();
    double close();
    long volume();

    /** Open interest, zero for bars without the field. */
    default long openInterest() { return 0L; }

    static Bar of(MarketSegment segment, long ts, double open, double high, double low, double close, long volume, long oi) {
        return segment.carriesOpenInterest()
                ? new DerivativeBar(ts, open, high, low, close, volume, oi)
                : new EquityBar(ts, open, high, low, close, volume);
    }
}
