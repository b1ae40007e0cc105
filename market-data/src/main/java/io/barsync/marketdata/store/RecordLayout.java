package io.barsync.marketdata.store;

import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.DerivativeBar;
import io.barsync.marketdata.model.EquityBar;
import io.barsync.marketdata.model.MarketSegment;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width big-endian row encodings. Prices are float64; the derivative layout appends open interest.
 */
public enum RecordLayout {
    EQUITY(48),
    DERIVATIVE(56);

    /** Version of the row encodings written by this release. */
    public static final int SCHEMA_VERSION = 2;

    private final int recordBytes;

    RecordLayout(int recordBytes) { this.recordBytes = recordBytes; }

    public int recordBytes() { return recordBytes; }

    public static RecordLayout forSegment(MarketSegment segment) {
        return segment.carriesOpenInterest() ? DERIVATIVE : EQUITY;
    }

    public byte[] encode(List<? extends Bar> bars) {
        ByteBuffer buf = ByteBuffer.allocate(bars.size() * recordBytes);
        for (Bar b : bars) {
            buf.putLong(b.timestamp());
            buf.putDouble(b.open());
            buf.putDouble(b.high());
            buf.putDouble(b.low());
            buf.putDouble(b.close());
            buf.putLong(b.volume());
            if (this == DERIVATIVE) buf.putLong(b.openInterest());
        }
        return buf.array();
    }

    public List<Bar> decode(byte[] raw) {
        if (raw.length % recordBytes != 0) {
            throw new IllegalArgumentException(raw.length + " bytes is not a multiple of " + recordBytes);
        }
        ByteBuffer buf = ByteBuffer.wrap(raw);
        List<Bar> bars = new ArrayList<>(raw.length / recordBytes);
        while (buf.hasRemaining()) {
            long ts = buf.getLong();
            double o = buf.getDouble(), h = buf.getDouble(), l = buf.getDouble(), c = buf.getDouble();
            long v = buf.getLong();
            bars.add(this == DERIVATIVE
                    ? new DerivativeBar(ts, o, h, l, c, v, buf.getLong())
                    : new EquityBar(ts, o, h, l, c, v));
        }
        return bars;
    }
}
