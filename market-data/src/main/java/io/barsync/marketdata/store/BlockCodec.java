package io.barsync.marketdata.store;

import com.github.luben.zstd.Zstd;
import io.barsync.marketdata.model.SeriesKey;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Splits encoded rows into blocks of {@code rowsPerBlock} and compresses each block with zstd.
 * Block framing:
 * <pre>
 * int rawLength, int compressedLength, long firstTimestamp, long lastTimestamp, int rawCrc32, compressed bytes
 * </pre>
 * Every row starts with its timestamp, so the header bounds can be checked against the decoded block.
 */
final class BlockCodec {
    static final int BLOCK_HEADER_BYTES = 28;

    private BlockCodec() {}

    record Encoded(byte[] bytes, int blockCount) {}

    private record Header(int rawLength, int compressedLength, long first, long last, int crc) {}

    static Encoded encode(byte[] raw, int recordBytes, int rowsPerBlock, int level) {
        int blockBytes = recordBytes * Math.max(1, rowsPerBlock);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(raw.length / 2 + 16);
        int blocks = 0;
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            for (int off = 0; off < raw.length; off += blockBytes) {
                byte[] block = Arrays.copyOfRange(raw, off, Math.min(raw.length, off + blockBytes));
                byte[] compressed = Zstd.compress(block, level);
                ByteBuffer rows = ByteBuffer.wrap(block);
                out.writeInt(block.length);
                out.writeInt(compressed.length);
                out.writeLong(rows.getLong(0));
                out.writeLong(rows.getLong(block.length - recordBytes));
                out.writeInt(crc(block));
                out.write(compressed);
                blocks++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new Encoded(bytes.toByteArray(), blocks);
    }

    /** Decodes every block of a payload held in memory. */
    static byte[] decode(byte[] payload, int blockCount, int recordBytes, SeriesKey key) throws StorageIntegrityException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream(payload.length * 3);
        int pos = 0;
        for (int i = 0; i < blockCount; i++) {
            if (payload.length - pos < BLOCK_HEADER_BYTES) throw new StorageIntegrityException(key, "payload truncated at block " + i);
            Header h = header(ByteBuffer.wrap(payload, pos, BLOCK_HEADER_BYTES), payload.length - pos - BLOCK_HEADER_BYTES, i, key);
            pos += BLOCK_HEADER_BYTES;
            byte[] block = inflate(Arrays.copyOfRange(payload, pos, pos + h.compressedLength()), h, recordBytes, i, key);
            raw.write(block, 0, block.length);
            pos += h.compressedLength();
        }
        if (pos != payload.length) {
            throw new StorageIntegrityException(key, (payload.length - pos) + " trailing bytes after " + blockCount + " blocks");
        }
        return raw.toByteArray();
    }

    /**
     * Decodes only the blocks whose timestamps overlap [from, to]. Block headers are read in place, so
     * blocks outside the range are neither read in full nor decompressed.
     */
    static byte[] decodeRange(StoreFormat.ByteReader reader, StoreFormat.Entry entry, int recordBytes, long from, long to)
            throws IOException {
        SeriesKey key = entry.info().key();
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        long pos = entry.offset();
        long end = entry.offset() + entry.length();
        for (int i = 0; i < entry.info().blockCount(); i++) {
            if (end - pos < BLOCK_HEADER_BYTES) throw new StorageIntegrityException(key, "payload truncated at block " + i);
            Header h = header(ByteBuffer.wrap(reader.read(pos, BLOCK_HEADER_BYTES)), end - pos - BLOCK_HEADER_BYTES, i, key);
            pos += BLOCK_HEADER_BYTES;
            if (h.first() > to) break;
            if (h.last() >= from) {
                byte[] block = inflate(reader.read(pos, h.compressedLength()), h, recordBytes, i, key);
                raw.write(block, 0, block.length);
            }
            pos += h.compressedLength();
        }
        return raw.toByteArray();
    }

    private static Header header(ByteBuffer buf, long available, int index, SeriesKey key) throws StorageIntegrityException {
        Header h = new Header(buf.getInt(), buf.getInt(), buf.getLong(), buf.getLong(), buf.getInt());
        if (h.rawLength() <= 0 || h.compressedLength() < 0 || h.compressedLength() > available || h.first() > h.last()) {
            throw new StorageIntegrityException(key, "corrupt block header in block " + index);
        }
        return h;
    }

    private static byte[] inflate(byte[] compressed, Header h, int recordBytes, int index, SeriesKey key)
            throws StorageIntegrityException {
        byte[] block;
        try {
            block = Zstd.decompress(compressed, h.rawLength());
        } catch (RuntimeException e) {
            throw new StorageIntegrityException(key, "block " + index + " decompression failed: " + e.getMessage(), e);
        }
        if (block.length != h.rawLength() || block.length % recordBytes != 0) {
            throw new StorageIntegrityException(key, "block " + index + " decompressed to " + block.length + " bytes, expected " + h.rawLength());
        }
        if (crc(block) != h.crc()) throw new StorageIntegrityException(key, "block " + index + " checksum mismatch");
        ByteBuffer rows = ByteBuffer.wrap(block);
        if (rows.getLong(0) != h.first() || rows.getLong(block.length - recordBytes) != h.last()) {
            throw new StorageIntegrityException(key, "block " + index + " timestamps do not match its header");
        }
        return block;
    }

    private static int crc(byte[] data) {
        CRC32 crc = new CRC32();
        crc.update(data);
        return (int) crc.getValue();
    }
}
