package io.barsync.marketdata.migrate;

import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.target.TargetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Compares each series' distinct source timestamps with the target's row count. */
public class MigrationVerifier {
    private static final Logger log = LoggerFactory.getLogger(MigrationVerifier.class);

    private final TargetStore target;
    private final int batchSize;

    public MigrationVerifier(TargetStore target, int batchSize) {
        this.target = target;
        this.batchSize = batchSize;
    }

    public VerificationReport verify(List<DatasetRef> datasets, Map<Path, LocalStore> stores) throws Exception {
        Map<SeriesKey, List<DatasetRef>> byKey = new LinkedHashMap<>();
        for (DatasetRef ref : datasets) byKey.computeIfAbsent(ref.key(), k -> new ArrayList<>()).add(ref);
        List<VerificationReport.KeyCount> all = new ArrayList<>();
        List<VerificationReport.KeyCount> mismatches = new ArrayList<>();
        for (Map.Entry<SeriesKey, List<DatasetRef>> e : byKey.entrySet()) {
            long[] raw = new long[1];
            Set<Long> distinct = new HashSet<>();
            for (DatasetRef ref : e.getValue()) {
                stores.get(ref.storeFile()).forEachBatch(ref.key(), batchSize, batch -> {
                    raw[0] += batch.size();
                    for (Bar b : batch) distinct.add(b.timestamp());
                });
            }
            VerificationReport.KeyCount count = new VerificationReport.KeyCount(e.getKey(), raw[0], distinct.size(), target.countRows(e.getKey()));
            all.add(count);
            if (!count.matches()) {
                mismatches.add(count);
                log.warn("Verification mismatch for {}: source distinct={} target={}", e.getKey(), count.distinctRows(), count.targetRows());
            }
        }
        log.info("Verified {} series, {} mismatch(es)", all.size(), mismatches.size());
        return new VerificationReport(all, mismatches);
    }
}
