package io.barsync.marketdata.model;

import java.time.Duration;

/**
 * Bar width. Each interval carries the upstream's maximum span per request and the block size used when the
 * bars are compressed: fine intervals use small blocks so partial reads stay cheap, daily bars use large ones.
 */
public enum SamplingInterval {
    MINUTE("minute", 60, 60, 4_096, 3),
    MINUTE_3("3minute", 180, 100, 4_096, 3),
    MINUTE_5("5minute", 300, 100, 8_192, 3),
    MINUTE_10("10minute", 600, 100, 8_192, 3),
    MINUTE_15("15minute", 900, 200, 16_384, 3),
    MINUTE_30("30minute", 1_800, 200, 16_384, 3),
    MINUTE_60("60minute", 3_600, 400, 32_768, 6),
    DAY("day", 86_400, 2_000, 65_536, 9);

    private final String code;
    private final long unitSeconds;
    private final int maxSpanDays;
    private final int rowsPerBlock;
    private final int compressionLevel;

    SamplingInterval(String code, long unitSeconds, int maxSpanDays, int rowsPerBlock, int compressionLevel) {
        this.code = code;
        this.unitSeconds = unitSeconds;
        this.maxSpanDays = maxSpanDays;
        this.rowsPerBlock = rowsPerBlock;
        this.compressionLevel = compressionLevel;
    }

    /** Upstream and storage-path spelling, e.g. {@code 5minute}. */
    public String code() { return code; }
    public long unitSeconds() { return unitSeconds; }
    public int maxSpanDays() { return maxSpanDays; }
    public long maxSpanSeconds() { return maxSpanDays * 86_400L; }
    public int rowsPerBlock() { return rowsPerBlock; }
    public int compressionLevel() { return compressionLevel; }
    public boolean isIntraday() { return this != DAY; }

    /**
     * Largest spacing between consecutive bars that is not reported as a gap. Daily bars allow a long
     * weekend; intraday bars allow overnight and weekend closures.
     */
    public Duration gapTolerance() { return this == DAY ? Duration.ofDays(5) : Duration.ofDays(4); }

    public static SamplingInterval fromCode(String code) {
        for (SamplingInterval i : values()) {
            if (i.code.equalsIgnoreCase(code.trim())) return i;
        }
        throw new IllegalArgumentException("Unknown sampling interval: " + code);
    }

    @Override
    public String toString() { return code; }
}
