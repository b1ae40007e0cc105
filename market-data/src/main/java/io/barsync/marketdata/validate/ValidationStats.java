package io.barsync.marketdata.validate;

/**
 * Row counts for one validated batch. Warning rows are the accepted rows that carry a quality warning
 * (zero volume, price spike, gap); structural notes about open interest are counted separately.
 */
public record ValidationStats(int totalRows,
                              int acceptedRows,
                              int errorRows,
                              int warningRows,
                              int outsideRange,
                              int zeroVolumeRows,
                              int duplicateTimestamps,
                              int priceSpikes,
                              int gaps,
                              int missingOpenInterest,
                              int droppedOpenInterest) {

    public double warningRatio() { return acceptedRows == 0 ? 0.0 : (double) warningRows / acceptedRows; }
}
