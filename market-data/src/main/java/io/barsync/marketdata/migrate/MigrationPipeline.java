package io.barsync.marketdata.migrate;

import com.codahale.metrics.MetricRegistry;
import io.barsync.core.Record;
import io.barsync.error.CollectingDeadLetterSink;
import io.barsync.error.DeadLetterSink;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.store.DatasetInfo;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.store.StoreOptions;
import io.barsync.marketdata.target.TargetStore;
import io.barsync.metrics.Metrics;
import io.barsync.runtime.CancellationToken;
import io.barsync.runtime.PipelineBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drains local store files into a {@link TargetStore}. Every dataset of every file is one unit of work;
 * a fixed pool of workers takes units end to end, each through its own target writer. Source files are
 * opened read-only; one that is missing or unreadable is reported and the others still migrate.
 */
public class MigrationPipeline {
    private static final Logger log = LoggerFactory.getLogger(MigrationPipeline.class);

    /** Run switches beyond worker count and batch size. */
    public record Options(boolean dryRun, Path checkpointFile, boolean verify, String dataSource) {
        public static Options defaults() { return new Options(false, null, true, "local-store"); }
    }

    private final TargetStore target;
    private final StoreOptions storeOptions;
    private final DeadLetterSink<Bar> rowDlq;
    private final MetricRegistry registry;

    public MigrationPipeline(TargetStore target, StoreOptions storeOptions, DeadLetterSink<Bar> rowDlq, MetricRegistry registry) {
        this.target = target;
        this.storeOptions = storeOptions;
        this.rowDlq = rowDlq;
        this.registry = registry;
    }

    public MigrationSummary migrate(List<Path> sourceStores, int workers, int batchSize) throws Exception {
        return migrate(sourceStores, workers, batchSize, Options.defaults(), new CancellationToken());
    }

    public MigrationSummary migrate(List<Path> sourceStores, int workers, int batchSize, Options options,
                                    CancellationToken cancellation) throws Exception {
        if (!options.dryRun()) target.ensureSchema();
        MigrationCheckpoint checkpoint = options.checkpointFile() == null || options.dryRun()
                ? null : MigrationCheckpoint.open(options.checkpointFile());
        Map<Path, LocalStore> stores = new LinkedHashMap<>();
        Metrics metrics = new Metrics(registry, "migrate");
        try {
            List<DatasetRef> datasets = new ArrayList<>();
            List<SourceFailure> sourceFailures = new ArrayList<>();
            for (Path file : sourceStores) {
                LocalStore store;
                try {
                    store = LocalStore.openReadOnly(file, segmentOf(file), storeOptions);
                } catch (IOException e) {
                    log.error("Skipping store file {}: {}", file, e.toString());
                    metrics.counter("source.failures").inc();
                    sourceFailures.add(new SourceFailure(file, e.toString()));
                    continue;
                }
                stores.put(file, store);
                for (DatasetInfo info : store.infos()) {
                    datasets.add(new DatasetRef(file, info.key(), info.rowCount(), info.checksum()));
                }
            }
            log.info("Migrating {} dataset(s) from {} store file(s) with {} worker(s){}", datasets.size(), stores.size(),
                    workers, options.dryRun() ? " (dry run)" : "");
            Map<Path, LocalStore> shared = Collections.unmodifiableMap(stores);
            List<DatasetOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
            CollectingDeadLetterSink<DatasetRef> crashed = new CollectingDeadLetterSink<>();
            if (!datasets.isEmpty()) {
                new PipelineBuilder<DatasetRef, DatasetOutcome>()
                        .name("migrate")
                        .source(datasets)
                        .transformPerWorker(() -> new DatasetMigrationTransform(shared, target, Math.max(1, batchSize),
                                options.dryRun(), checkpoint, rowDlq, options.dataSource(), metrics))
                        .sink(r -> outcomes.add(r.payload()))
                        .workers(Math.max(1, Math.min(workers, datasets.size())))
                        .queueCapacity(Math.max(4, workers * 2))
                        .sinkBatchSize(1)
                        .deadLetterIn(crashed)
                        .cancellation(cancellation)
                        .metrics(registry)
                        .build()
                        .run();
            }
            List<DatasetOutcome> all = new ArrayList<>(outcomes);
            for (CollectingDeadLetterSink.Failure<DatasetRef> f : crashed.failures()) {
                Record<DatasetRef> r = f.record();
                all.add(DatasetOutcome.failed(r.payload(), 0, 0, String.valueOf(f.error())));
            }
            Set<DatasetRef> seen = new HashSet<>();
            for (DatasetOutcome o : all) seen.add(o.dataset());
            for (DatasetRef ref : datasets) {
                if (!seen.contains(ref)) all.add(DatasetOutcome.failed(ref, 0, 0, "cancelled"));
            }
            VerificationReport verification = options.verify() && !options.dryRun()
                    ? new MigrationVerifier(target, Math.max(1, batchSize)).verify(datasets, shared) : null;
            MigrationSummary summary = MigrationSummary.of(all, sourceFailures, verification, options.dryRun());
            log.info("Migration finished: status={} processed={} skipped={} written={} duplicates={} failures={} unreadable files={}",
                    summary.status(), summary.datasetsProcessed(), summary.datasetsSkipped(), summary.rowsWritten(),
                    summary.duplicatesSkipped(), summary.failures().size(), summary.sourceFailures().size());
            return summary;
        } finally {
            for (LocalStore s : stores.values()) s.close();
        }
    }

    /** Store files are named after their segment, e.g. {@code EQUITY.bars} or {@code EQUITY_2023.bars}. */
    static MarketSegment segmentOf(Path file) throws IOException {
        String name = file.getFileName().toString().toUpperCase(Locale.ROOT);
        for (MarketSegment s : MarketSegment.values()) {
            if (name.startsWith(s.name() + ".") || name.startsWith(s.name() + "_")) return s;
        }
        throw new IOException("Cannot tell the market segment of store file " + file);
    }
}
