package io.barsync.marketdata.store;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;

import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Container layout, version 2:
 * <pre>
 * header (32 bytes): int magic "BARS", int version, long indexOffset, int indexLength, int indexCrc32, long writtenAtMillis
 * payloads:          one block-compressed payload per dataset, back to back
 * index:             int count, then one entry per dataset (key, payload offset/length, metadata, coverage, provenance)
 * </pre>
 * The first eight bytes (magic, version) are shared by every version so a reader can decide how to proceed.
 */
final class StoreFormat {
    static final int MAGIC = 0x42415253;
    static final int CURRENT_VERSION = 2;
    static final int HEADER_BYTES = 32;

    private StoreFormat() {}

    record Header(int version, long indexOffset, int indexLength, int indexCrc, long writtenAtMillis) {}

    record Entry(DatasetInfo info, long offset, int length) {}

    record Contents(Header header, Map<SeriesKey, Entry> entries) {}

    @FunctionalInterface
    interface PayloadSupplier {
        byte[] get() throws IOException;
    }

    record PendingDataset(DatasetInfo info, PayloadSupplier payload) {}

    /** Positional reads over a file channel or an in-memory image. */
    interface ByteReader {
        byte[] read(long position, int length) throws IOException;

        long size() throws IOException;
    }

    static ByteReader reader(FileChannel ch) {
        return new ByteReader() {
            @Override
            public byte[] read(long position, int length) throws IOException {
                ByteBuffer buf = ByteBuffer.allocate(length);
                while (buf.hasRemaining()) {
                    int n = ch.read(buf, position + buf.position());
                    if (n < 0) throw new EOFException("unexpected end of store file at " + (position + buf.position()));
                }
                return buf.array();
            }

            @Override
            public long size() throws IOException { return ch.size(); }
        };
    }

    static ByteReader reader(byte[] image) {
        return new ByteReader() {
            @Override
            public byte[] read(long position, int length) throws IOException {
                if (position < 0 || position + length > image.length) {
                    throw new EOFException("read of " + length + " bytes at " + position + " beyond " + image.length);
                }
                byte[] out = new byte[length];
                System.arraycopy(image, (int) position, out, 0, length);
                return out;
            }

            @Override
            public long size() { return image.length; }
        };
    }

    /** Reads magic and version only. */
    static int peekVersion(ByteReader r) throws IOException {
        if (r.size() < 8) throw new StorageIntegrityException(null, "store file too short for a header");
        ByteBuffer buf = ByteBuffer.wrap(r.read(0, 8));
        if (buf.getInt() != MAGIC) throw new StorageIntegrityException(null, "not a bar store file (bad magic)");
        return buf.getInt();
    }

    static Contents read(ByteReader r) throws IOException {
        int version = peekVersion(r);
        if (version != CURRENT_VERSION) throw new StoreVersionException(null, version, CURRENT_VERSION);
        long size = r.size();
        if (size < HEADER_BYTES) throw new StorageIntegrityException(null, "truncated header");
        ByteBuffer h = ByteBuffer.wrap(r.read(0, HEADER_BYTES));
        h.getInt();
        h.getInt();
        Header header = new Header(version, h.getLong(), h.getInt(), h.getInt(), h.getLong());
        if (header.indexOffset() < HEADER_BYTES || header.indexLength() < 4
                || header.indexOffset() + header.indexLength() > size) {
            throw new StorageIntegrityException(null, "index location out of bounds");
        }
        byte[] index = r.read(header.indexOffset(), header.indexLength());
        if (crc(index) != header.indexCrc()) throw new StorageIntegrityException(null, "index checksum mismatch");
        Map<SeriesKey, Entry> entries;
        try {
            entries = decodeIndex(index);
        } catch (EOFException | IllegalArgumentException e) {
            throw new StorageIntegrityException(null, "unreadable index: " + e.getMessage(), e);
        }
        for (Entry e : entries.values()) {
            if (e.offset() < HEADER_BYTES || e.length() < 0 || e.offset() + e.length() > header.indexOffset()) {
                throw new StorageIntegrityException(e.info().key(), "payload location out of bounds");
            }
        }
        return new Contents(header, entries);
    }

    static byte[] readPayload(ByteReader r, Entry e) throws IOException {
        return r.read(e.offset(), e.length());
    }

    /** Writes a complete container into an empty channel and forces it to disk. */
    static Map<SeriesKey, Entry> write(FileChannel ch, List<PendingDataset> datasets, long writtenAtMillis) throws IOException {
        ch.position(0);
        writeFully(ch, ByteBuffer.allocate(HEADER_BYTES));
        OutputStream out = new BufferedOutputStream(Channels.newOutputStream(ch), 1 << 16);
        Body body = writeBody(out, datasets);
        out.flush();
        ch.position(0);
        writeFully(ch, header(body, writtenAtMillis));
        ch.force(true);
        return body.entries();
    }

    /** Same layout as {@link #write}, built in memory. */
    static byte[] toBytes(List<PendingDataset> datasets, long writtenAtMillis) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(new byte[HEADER_BYTES]);
        Body body = writeBody(out, datasets);
        byte[] image = out.toByteArray();
        ByteBuffer.wrap(image).put(header(body, writtenAtMillis));
        return image;
    }

    private record Body(Map<SeriesKey, Entry> entries, long indexOffset, int indexLength, int indexCrc) {}

    private static Body writeBody(OutputStream out, List<PendingDataset> datasets) throws IOException {
        List<PendingDataset> sorted = new ArrayList<>(datasets);
        sorted.sort(Comparator.comparing(d -> d.info().key().path()));
        Map<SeriesKey, Entry> entries = new LinkedHashMap<>();
        long position = HEADER_BYTES;
        for (PendingDataset d : sorted) {
            byte[] payload = d.payload().get();
            out.write(payload);
            entries.put(d.info().key(), new Entry(d.info(), position, payload.length));
            position += payload.length;
        }
        byte[] index = encodeIndex(entries.values());
        out.write(index);
        return new Body(entries, position, index.length, crc(index));
    }

    private static ByteBuffer header(Body body, long writtenAtMillis) {
        ByteBuffer h = ByteBuffer.allocate(HEADER_BYTES);
        h.putInt(MAGIC).putInt(CURRENT_VERSION).putLong(body.indexOffset()).putInt(body.indexLength())
                .putInt(body.indexCrc()).putLong(writtenAtMillis);
        h.flip();
        return h;
    }

    private static void writeFully(FileChannel ch, ByteBuffer buf) throws IOException {
        while (buf.hasRemaining()) ch.write(buf);
    }

    private static byte[] encodeIndex(Iterable<Entry> entries) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        List<Entry> list = new ArrayList<>();
        entries.forEach(list::add);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(list.size());
            for (Entry e : list) {
                DatasetInfo info = e.info();
                SeriesKey key = info.key();
                out.writeUTF(key.segment().name());
                out.writeUTF(key.exchange().name());
                out.writeUTF(key.symbol());
                out.writeUTF(key.interval().code());
                out.writeLong(e.offset());
                out.writeInt(e.length());
                out.writeInt(info.rowCount());
                out.writeLong(info.earliest());
                out.writeLong(info.latest());
                out.writeLong(info.lastUpdated().toEpochMilli());
                out.writeInt(info.schemaVersion());
                out.writeInt(info.rowsPerBlock());
                out.writeInt(info.blockCount());
                out.writeUTF(info.checksum());
                out.writeUTF(info.sourceTag());
                out.writeInt(info.coverage().size());
                for (CoverageRange r : info.coverage()) {
                    out.writeLong(r.start());
                    out.writeLong(r.end());
                }
                out.writeInt(info.provenance().size());
                for (ProvenanceEntry p : info.provenance()) {
                    out.writeLong(p.appliedAt().toEpochMilli());
                    out.writeLong(p.range().start());
                    out.writeLong(p.range().end());
                    out.writeUTF(p.sourceTag());
                    out.writeInt(p.messages().size());
                    for (String m : p.messages()) out.writeUTF(m);
                }
            }
        }
        return bytes.toByteArray();
    }

    private static Map<SeriesKey, Entry> decodeIndex(byte[] index) throws IOException {
        Map<SeriesKey, Entry> entries = new LinkedHashMap<>();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(index))) {
            int count = in.readInt();
            if (count < 0) throw new IllegalArgumentException("negative dataset count");
            for (int i = 0; i < count; i++) {
                MarketSegment segment = MarketSegment.valueOf(in.readUTF());
                Exchange exchange = Exchange.parse(in.readUTF());
                String symbol = in.readUTF();
                SamplingInterval interval = SamplingInterval.fromCode(in.readUTF());
                SeriesKey key = new SeriesKey(segment, exchange, symbol, interval);
                long offset = in.readLong();
                int length = in.readInt();
                int rows = in.readInt();
                long earliest = in.readLong();
                long latest = in.readLong();
                Instant updated = Instant.ofEpochMilli(in.readLong());
                int schema = in.readInt();
                int rowsPerBlock = in.readInt();
                int blocks = in.readInt();
                String checksum = in.readUTF();
                String sourceTag = in.readUTF();
                int coverageCount = in.readInt();
                List<CoverageRange> coverage = new ArrayList<>();
                for (int c = 0; c < coverageCount; c++) coverage.add(new CoverageRange(in.readLong(), in.readLong()));
                int provenanceCount = in.readInt();
                List<ProvenanceEntry> provenance = new ArrayList<>();
                for (int p = 0; p < provenanceCount; p++) {
                    Instant at = Instant.ofEpochMilli(in.readLong());
                    CoverageRange range = new CoverageRange(in.readLong(), in.readLong());
                    String tag = in.readUTF();
                    int messageCount = in.readInt();
                    List<String> messages = new ArrayList<>();
                    for (int m = 0; m < messageCount; m++) messages.add(in.readUTF());
                    provenance.add(new ProvenanceEntry(at, range, tag, messages));
                }
                DatasetInfo info = new DatasetInfo(key, rows, earliest, latest, updated, schema, rowsPerBlock, blocks,
                        checksum, sourceTag, coverage, provenance);
                if (entries.put(key, new Entry(info, offset, length)) != null) {
                    throw new IllegalArgumentException("duplicate dataset " + key.path());
                }
            }
            if (in.available() > 0) throw new IllegalArgumentException(in.available() + " trailing index bytes");
        }
        return entries;
    }

    static int crc(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data);
        return (int) crc.getValue();
    }
}
