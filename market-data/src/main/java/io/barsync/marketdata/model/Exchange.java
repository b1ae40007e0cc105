package io.barsync.marketdata.model;

import java.time.ZoneId;
import java.util.Locale;

public enum Exchange {
    NSE(MarketSegment.EQUITY),
    BSE(MarketSegment.EQUITY),
    NFO(MarketSegment.DERIVATIVES),
    BFO(MarketSegment.DERIVATIVES),
    MCX(MarketSegment.COMMODITY),
    CDS(MarketSegment.CURRENCY);

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");

    private final MarketSegment segment;

    Exchange(MarketSegment segment) { this.segment = segment; }

    public MarketSegment segment() { return segment; }

    /** Time zone that defines trading days for this exchange. */
    public ZoneId zone() { return IST; }

    public static Exchange parse(String code) {
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exchange: " + code);
        }
    }
}
