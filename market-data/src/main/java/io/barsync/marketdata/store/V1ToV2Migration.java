package io.barsync.marketdata.store;

import com.github.luben.zstd.Zstd;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Version 1 stored prices as float32, compressed each dataset as a single frame and had no coverage list.
 * <pre>
 * header (20 bytes): int magic, int version=1, long indexOffset, int indexLength
 * index: int count, then per dataset: exchange, symbol, interval, long offset, int length, int rows,
 *        long lastUpdatedMillis, sourceTag, sha256 of raw rows
 * row:   long ts, float open, high, low, close, long volume [, long openInterest]
 * </pre>
 * Prices widen to float64 exactly. Coverage becomes the span between the first and last stored bar.
 */
public class V1ToV2Migration implements StoreMigration {
    static final int V1_HEADER_BYTES = 20;
    static final String SOURCE_TAG = "store-migration:v1-v2";

    @Override public int fromVersion() { return 1; }
    @Override public int toVersion() { return 2; }

    @Override
    public byte[] apply(byte[] image) throws IOException {
        ByteBuffer h = ByteBuffer.wrap(image, 0, Math.min(image.length, V1_HEADER_BYTES));
        if (image.length < V1_HEADER_BYTES || h.getInt() != StoreFormat.MAGIC || h.getInt() != 1) {
            throw new StoreMigrationException("not a version 1 store image");
        }
        long indexOffset = h.getLong();
        int indexLength = h.getInt();
        if (indexOffset < V1_HEADER_BYTES || indexOffset + indexLength > image.length) {
            throw new StoreMigrationException("version 1 index out of bounds");
        }
        List<StoreFormat.PendingDataset> datasets = new ArrayList<>();
        long newest = 0;
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(image, (int) indexOffset, indexLength))) {
            int count = in.readInt();
            for (int i = 0; i < count; i++) {
                SeriesKey key = SeriesKey.of(Exchange.parse(in.readUTF()), in.readUTF(), SamplingInterval.fromCode(in.readUTF()));
                long offset = in.readLong();
                int length = in.readInt();
                int rows = in.readInt();
                long updated = in.readLong();
                String sourceTag = in.readUTF();
                String checksum = in.readUTF();
                if (offset < V1_HEADER_BYTES || offset + length > indexOffset) {
                    throw new StoreMigrationException(key + ": version 1 payload out of bounds");
                }
                byte[] compressed = new byte[length];
                System.arraycopy(image, (int) offset, compressed, 0, length);
                datasets.add(convert(key, compressed, rows, updated, sourceTag, checksum));
                newest = Math.max(newest, updated);
            }
        } catch (EOFException | IllegalArgumentException e) {
            throw new StoreMigrationException("unreadable version 1 index: " + e.getMessage(), e, null);
        }
        return StoreFormat.toBytes(datasets, newest);
    }

    private StoreFormat.PendingDataset convert(SeriesKey key, byte[] compressed, int rows, long updatedMillis,
                                               String sourceTag, String checksum) throws StoreMigrationException {
        boolean withOi = key.segment().carriesOpenInterest();
        int v1RowBytes = withOi ? 40 : 32;
        byte[] raw;
        try {
            raw = rows == 0 ? new byte[0] : Zstd.decompress(compressed, rows * v1RowBytes);
        } catch (RuntimeException e) {
            throw new StoreMigrationException(key + ": version 1 payload does not decompress", e, null);
        }
        if (raw.length != rows * v1RowBytes || !Checksums.sha256(raw).equals(checksum)) {
            throw new StoreMigrationException(key + ": version 1 payload checksum mismatch");
        }
        ByteBuffer buf = ByteBuffer.wrap(raw);
        List<Bar> bars = new ArrayList<>(rows);
        for (int r = 0; r < rows; r++) {
            long ts = buf.getLong();
            double o = buf.getFloat(), hi = buf.getFloat(), lo = buf.getFloat(), c = buf.getFloat();
            long v = buf.getLong();
            long oi = withOi ? buf.getLong() : 0L;
            bars.add(Bar.of(key.segment(), ts, o, hi, lo, c, v, oi));
        }
        RecordLayout layout = RecordLayout.forSegment(key.segment());
        byte[] encoded = layout.encode(bars);
        SamplingInterval interval = key.interval();
        BlockCodec.Encoded blocks = BlockCodec.encode(encoded, layout.recordBytes(), interval.rowsPerBlock(), interval.compressionLevel());
        Instant updated = Instant.ofEpochMilli(updatedMillis);
        List<CoverageRange> coverage = new ArrayList<>();
        List<ProvenanceEntry> provenance = new ArrayList<>();
        long earliest = rows == 0 ? 0L : bars.get(0).timestamp();
        long latest = rows == 0 ? 0L : bars.get(rows - 1).timestamp();
        if (rows > 0) {
            CoverageRange span = new CoverageRange(earliest, latest);
            coverage.add(span);
            provenance.add(new ProvenanceEntry(updated, span, SOURCE_TAG,
                    List.of("prices widened from float32; coverage inferred from stored bars; original source " + sourceTag)));
        }
        DatasetInfo info = new DatasetInfo(key, rows, earliest, latest, updated, RecordLayout.SCHEMA_VERSION,
                interval.rowsPerBlock(), blocks.blockCount(), Checksums.sha256(encoded), sourceTag, coverage, provenance);
        return new StoreFormat.PendingDataset(info, blocks::bytes);
    }
}
