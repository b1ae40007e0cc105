package io.barsync.marketdata.store;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.plan.CoverageLookup;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Opens one store file per market segment under a data directory, lazily and at most once.
 */
public class LocalStoreRegistry implements CoverageLookup, Closeable {
    private final Path dataDir;
    private final StoreOptions options;
    private final Map<MarketSegment, LocalStore> stores = new EnumMap<>(MarketSegment.class);

    public LocalStoreRegistry(Path dataDir, StoreOptions options) {
        this.dataDir = dataDir;
        this.options = options;
    }

    public synchronized LocalStore forSegment(MarketSegment segment) throws IOException {
        LocalStore store = stores.get(segment);
        if (store == null) {
            store = LocalStore.open(dataDir.resolve(segment.storeFileName()), segment, options);
            stores.put(segment, store);
        }
        return store;
    }

    public LocalStore forKey(SeriesKey key) throws IOException { return forSegment(key.segment()); }

    @Override
    public List<CoverageRange> coverage(SeriesKey key) throws IOException { return forKey(key).coverage(key); }

    /** Opens every segment's store. */
    public List<LocalStore> openAll() throws IOException {
        List<LocalStore> all = new ArrayList<>();
        for (MarketSegment s : MarketSegment.values()) all.add(forSegment(s));
        return all;
    }

    public Path dataDir() { return dataDir; }

    @Override
    public synchronized void close() {
        for (LocalStore s : stores.values()) s.close();
        stores.clear();
    }
}
