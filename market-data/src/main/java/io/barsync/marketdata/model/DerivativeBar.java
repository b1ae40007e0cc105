package io.barsync.marketdata.model;

public record DerivativeBar(long timestamp, double open, double high, double low, double close, long volume,
                            long openInterest) implements Bar {
}
