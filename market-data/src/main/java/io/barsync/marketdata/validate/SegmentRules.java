package io.barsync.marketdata.validate;

import io.barsync.marketdata.model.MarketSegment;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Plausibility bounds for one market segment.
 */
public record SegmentRules(String name,
                           double minPrice,
                           double maxPrice,
                           boolean zeroPriceAllowed,
                           long maxVolume,
                           boolean openInterestExpected,
                           long maxOpenInterest,
                           long minTimestamp,
                           long maxTimestamp,
                           double spikeThreshold) {

    static final long MIN_TS = LocalDate.of(2000, 1, 1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    static final long MAX_TS = LocalDate.of(2099, 12, 31).atStartOfDay(ZoneOffset.UTC).toEpochSecond();

    public static final SegmentRules EQUITY =
            new SegmentRules("equity", 0.01, 1_000_000, false, 10_000_000_000L, false, 100_000_000L, MIN_TS, MAX_TS, 0.25);

    public static final SegmentRules DERIVATIVES =
            new SegmentRules("derivatives", 0.0, 100_000, true, 10_000_000_000L, true, 100_000_000L, MIN_TS, MAX_TS, 0.25);

    public static SegmentRules forSegment(MarketSegment segment) {
        return switch (segment) {
            case EQUITY -> EQUITY;
            case DERIVATIVES -> DERIVATIVES;
            case COMMODITY -> DERIVATIVES.named("commodity");
            case CURRENCY -> DERIVATIVES.named("currency");
        };
    }

    public SegmentRules named(String n) {
        return new SegmentRules(n, minPrice, maxPrice, zeroPriceAllowed, maxVolume, openInterestExpected, maxOpenInterest,
                minTimestamp, maxTimestamp, spikeThreshold);
    }
}
