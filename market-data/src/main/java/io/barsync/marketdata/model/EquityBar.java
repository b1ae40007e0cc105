package io.barsync.marketdata.model;

public record EquityBar(long timestamp, double open, double high, double low, double close, long volume) implements Bar {
}
