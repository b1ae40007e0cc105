package io.barsync.marketdata.migrate;

import com.codahale.metrics.Counter;
import io.barsync.core.Record;
import io.barsync.core.Transform;
import io.barsync.error.DeadLetterSink;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.target.DedupKey;
import io.barsync.marketdata.target.MigrationRecord;
import io.barsync.marketdata.target.TargetStore;
import io.barsync.marketdata.target.TargetWriter;
import io.barsync.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Migrates whole datasets, one per call. Each worker gets its own instance and so its own target writer,
 * opened on first use and closed when the worker exits.
 */
class DatasetMigrationTransform implements Transform<DatasetRef, DatasetOutcome> {
    private static final Logger log = LoggerFactory.getLogger(DatasetMigrationTransform.class);

    private final Map<Path, LocalStore> stores;
    private final TargetStore target;
    private final int batchSize;
    private final boolean dryRun;
    private final MigrationCheckpoint checkpoint;
    private final DeadLetterSink<Bar> rowDlq;
    private final String dataSource;
    private final Counter rowsWritten;
    private final Counter duplicates;
    private final Counter rowErrors;
    private TargetWriter writer;

    DatasetMigrationTransform(Map<Path, LocalStore> stores, TargetStore target, int batchSize, boolean dryRun,
                              MigrationCheckpoint checkpoint, DeadLetterSink<Bar> rowDlq, String dataSource, Metrics metrics) {
        this.stores = stores;
        this.target = target;
        this.batchSize = batchSize;
        this.dryRun = dryRun;
        this.checkpoint = checkpoint;
        this.rowDlq = rowDlq;
        this.dataSource = dataSource;
        this.rowsWritten = metrics.counter("rows.written");
        this.duplicates = metrics.counter("rows.duplicate");
        this.rowErrors = metrics.counter("rows.errors");
    }

    @Override
    public List<Record<DatasetOutcome>> apply(Record<DatasetRef> in) throws InterruptedException {
        return List.of(in.derive(0, migrate(in.payload())));
    }

    private DatasetOutcome migrate(DatasetRef ref) throws InterruptedException {
        if (checkpoint != null && checkpoint.isDone(ref)) {
            log.debug("Skipping {}: already migrated", ref);
            return DatasetOutcome.skipped(ref);
        }
        long[] counts = new long[4]; // read, written, duplicate, row errors
        try {
            if (!dryRun && writer == null) writer = target.openWriter();
            stores.get(ref.storeFile()).forEachBatch(ref.key(), batchSize, batch -> {
                if (Thread.currentThread().isInterrupted()) throw new InterruptedException();
                counts[0] += batch.size();
                Map<DedupKey, MigrationRecord> unique = new LinkedHashMap<>();
                for (Bar bar : batch) {
                    MigrationRecord r;
                    try {
                        r = toRecord(ref.key(), bar, dataSource);
                    } catch (MigrationRowException e) {
                        counts[3]++;
                        rowErrors.inc();
                        rowDlq.acceptFailure("migrate:" + ref, Record.of(bar.timestamp(), bar), e);
                        continue;
                    }
                    if (unique.put(r.dedupKey(), r) != null) {
                        counts[2]++;
                        duplicates.inc();
                    }
                }
                if (!dryRun) {
                    int n = writer.write(new ArrayList<>(unique.values()));
                    counts[1] += n;
                    rowsWritten.inc(n);
                }
            });
            if (!dryRun) {
                writer.flush();
                if (checkpoint != null) checkpoint.markDone(ref);
            }
            log.info("Migrated {}: read={} written={} duplicates={} rowErrors={}", ref, counts[0], counts[1], counts[2], counts[3]);
            return new DatasetOutcome(ref, DatasetOutcome.Status.MIGRATED, counts[0], counts[1], counts[2], counts[3], null);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Dataset {} failed after {} row(s): {}", ref, counts[0], e.toString());
            return DatasetOutcome.failed(ref, counts[0], counts[1], e.toString());
        }
    }

    static MigrationRecord toRecord(SeriesKey key, Bar bar, String dataSource) throws MigrationRowException {
        double[] prices = {bar.open(), bar.high(), bar.low(), bar.close()};
        for (double p : prices) {
            if (!Double.isFinite(p) || p < 0) throw new MigrationRowException("invalid price " + p + " at " + bar.timestamp());
        }
        if (bar.low() > bar.high()) throw new MigrationRowException("low above high at " + bar.timestamp());
        if (bar.volume() < 0) throw new MigrationRowException("negative volume at " + bar.timestamp());
        if (bar.timestamp() <= 0) throw new MigrationRowException("non-positive timestamp " + bar.timestamp());
        OptionalLong oi = key.segment().carriesOpenInterest() ? OptionalLong.of(bar.openInterest()) : OptionalLong.empty();
        return new MigrationRecord(key, bar.timestamp(), bar.open(), bar.high(), bar.low(), bar.close(), bar.volume(), oi, dataSource);
    }

    @Override
    public void close() throws Exception {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
