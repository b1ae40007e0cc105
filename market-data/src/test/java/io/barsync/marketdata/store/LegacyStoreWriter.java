package io.barsync.marketdata.store;

import com.github.luben.zstd.Zstd;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.SeriesKey;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes version 1 store files for upgrade tests. */
final class LegacyStoreWriter {
    private LegacyStoreWriter() {}

    static void write(Path file, Map<SeriesKey, List<Bar>> datasets, long updatedMillis) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        Map<SeriesKey, long[]> locations = new LinkedHashMap<>();
        Map<SeriesKey, String> checksums = new LinkedHashMap<>();
        long offset = V1ToV2Migration.V1_HEADER_BYTES;
        for (Map.Entry<SeriesKey, List<Bar>> e : datasets.entrySet()) {
            boolean withOi = e.getKey().segment().carriesOpenInterest();
            ByteBuffer raw = ByteBuffer.allocate(e.getValue().size() * (withOi ? 40 : 32));
            for (Bar b : e.getValue()) {
                raw.putLong(b.timestamp());
                raw.putFloat((float) b.open()).putFloat((float) b.high()).putFloat((float) b.low()).putFloat((float) b.close());
                raw.putLong(b.volume());
                if (withOi) raw.putLong(b.openInterest());
            }
            byte[] compressed = Zstd.compress(raw.array());
            body.write(compressed);
            locations.put(e.getKey(), new long[]{offset, compressed.length, e.getValue().size()});
            checksums.put(e.getKey(), Checksums.sha256(raw.array()));
            offset += compressed.length;
        }
        ByteArrayOutputStream index = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(index)) {
            out.writeInt(datasets.size());
            for (Map.Entry<SeriesKey, long[]> e : locations.entrySet()) {
                SeriesKey key = e.getKey();
                out.writeUTF(key.exchange().name());
                out.writeUTF(key.symbol());
                out.writeUTF(key.interval().code());
                out.writeLong(e.getValue()[0]);
                out.writeInt((int) e.getValue()[1]);
                out.writeInt((int) e.getValue()[2]);
                out.writeLong(updatedMillis);
                out.writeUTF("legacy-fetcher");
                out.writeUTF(checksums.get(key));
            }
        }
        ByteBuffer header = ByteBuffer.allocate(V1ToV2Migration.V1_HEADER_BYTES);
        header.putInt(StoreFormat.MAGIC).putInt(1).putLong(offset).putInt(index.size());
        ByteArrayOutputStream image = new ByteArrayOutputStream();
        image.write(header.array());
        image.write(body.toByteArray());
        image.write(index.toByteArray());
        Files.write(file, image.toByteArray());
    }
}
