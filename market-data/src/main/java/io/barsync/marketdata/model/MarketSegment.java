package io.barsync.marketdata.model;

/**
 * Storage partition. Each segment has its own store file and its own record layout.
 */
public enum MarketSegment {
    EQUITY(false, false),
    DERIVATIVES(true, true),
    COMMODITY(true, true),
    CURRENCY(true, true);

    private final boolean carriesOpenInterest;
    private final boolean zeroPriceAllowed;

    MarketSegment(boolean carriesOpenInterest, boolean zeroPriceAllowed) {
        this.carriesOpenInterest = carriesOpenInterest;
        this.zeroPriceAllowed = zeroPriceAllowed;
    }

    /** Whether bars of this segment carry an open-interest field. */
    public boolean carriesOpenInterest() { return carriesOpenInterest; }

    /** Expiring contracts may legitimately trade at zero. */
    public boolean zeroPriceAllowed() { return zeroPriceAllowed; }

    public String storeFileName() { return name() + ".bars"; }
}
