package io.barsync.marketdata.sync;

import com.codahale.metrics.MetricRegistry;
import io.barsync.error.FileDeadLetterSink;
import io.barsync.marketdata.config.MigrationConfig;
import io.barsync.marketdata.fetch.FetchExecutor;
import io.barsync.marketdata.fetch.FetchReport;
import io.barsync.marketdata.migrate.MigrationPipeline;
import io.barsync.marketdata.migrate.MigrationSummary;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.plan.GapPlanner;
import io.barsync.marketdata.plan.TradingCalendar;
import io.barsync.marketdata.store.LocalStoreRegistry;
import io.barsync.marketdata.store.StoreOptions;
import io.barsync.marketdata.target.JdbcTargetStore;
import io.barsync.marketdata.target.LineProtocolTargetStore;
import io.barsync.marketdata.target.TargetStore;
import io.barsync.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Entry point for collaborators: incremental sync of a series, coverage lookup and migration into the
 * secondary store.
 */
public class MarketDataSync implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(MarketDataSync.class);

    private final LocalStoreRegistry stores;
    private final GapPlanner planner;
    private final FetchExecutor executor;
    private final StoreOptions storeOptions;
    private final MetricRegistry registry;

    public MarketDataSync(LocalStoreRegistry stores, GapPlanner planner, FetchExecutor executor,
                          StoreOptions storeOptions, MetricRegistry registry) {
        this.stores = stores;
        this.planner = planner;
        this.executor = executor;
        this.storeOptions = storeOptions;
        this.registry = registry;
    }

    public SyncResult syncSeries(SeriesKey key, LocalDate from, LocalDate to) throws IOException, InterruptedException {
        CoverageRange span = TradingCalendar.span(key, from, to);
        return syncSeries(key, span.start(), span.end(), new CancellationToken());
    }

    public SyncResult syncSeries(SeriesKey key, long start, long end) throws IOException, InterruptedException {
        return syncSeries(key, start, end, new CancellationToken());
    }

    /** Fetches only what the store is missing in {@code [start, end]} and commits it chunk by chunk. */
    public SyncResult syncSeries(SeriesKey key, long start, long end, CancellationToken cancellation)
            throws IOException, InterruptedException {
        CoverageRange requested = new CoverageRange(start, end);
        List<CoverageRange> missing = planner.plan(key, start, end);
        if (missing.isEmpty()) {
            log.info("{} already covers {}", key, requested);
            return SyncResult.upToDate(key, requested, getCoverage(key));
        }
        log.info("{} is missing {} sub-range(s) of {}: {}", key, missing.size(), requested, missing);
        FetchReport report = executor.execute(key, missing, cancellation);
        return new SyncResult(key, requested, missing, report, getCoverage(key), report.status(), null);
    }

    public List<CoverageRange> getCoverage(SeriesKey key) throws IOException {
        return stores.coverage(key);
    }

    /**
     * Syncs many series on {@code parallelism} threads. Requests for the same key run one after another on
     * one thread; a series that cannot be synced is reported as FAILED without affecting the others.
     * Results come back in request order.
     */
    public List<SyncResult> syncAll(List<SyncRequest> requests, int parallelism, CancellationToken cancellation)
            throws InterruptedException {
        Map<SeriesKey, List<Integer>> byKey = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) byKey.computeIfAbsent(requests.get(i).key(), k -> new ArrayList<>()).add(i);
        SyncResult[] results = new SyncResult[requests.size()];
        AtomicInteger threadNo = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, byKey.size())), r -> {
            Thread t = new Thread(r, "sync-" + threadNo.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (List<Integer> indices : byKey.values()) {
                futures.add(pool.submit(() -> {
                    for (int i : indices) results[i] = syncOne(requests.get(i), cancellation);
                    return null;
                }));
            }
            int task = 0;
            for (List<Integer> indices : byKey.values()) {
                try {
                    futures.get(task++).get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof InterruptedException ie) throw ie;
                    log.error("Sync task for {} failed", requests.get(indices.get(0)).key(), e.getCause());
                    for (int i : indices) {
                        if (results[i] == null) results[i] = SyncResult.failed(requests.get(i).key(), null, String.valueOf(e.getCause()));
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return List.of(results);
    }

    private SyncResult syncOne(SyncRequest request, CancellationToken cancellation) throws InterruptedException {
        CoverageRange requested = null;
        try {
            requested = TradingCalendar.span(request.key(), request.from(), request.to());
            return syncSeries(request.key(), requested.start(), requested.end(), cancellation);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not sync {}: {}", request.key(), e.getMessage());
            return SyncResult.failed(request.key(), requested, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync of {} failed unexpectedly", request.key(), e);
            return SyncResult.failed(request.key(), requested, e.toString());
        }
    }

    public MigrationSummary runMigration(MigrationConfig config) throws Exception {
        try (TargetStore target = openTarget(config)) {
            return runMigration(config, target);
        }
    }

    /**
     * Drains the configured store files, or every store file in the data directory, into {@code target}.
     * The sync side's open stores are closed first so the migration reads files nobody else is writing.
     */
    public MigrationSummary runMigration(MigrationConfig config, TargetStore target) throws Exception {
        List<Path> sources = config.sourceStores().isEmpty() ? storeFiles(stores.dataDir()) : config.sourceStores();
        stores.close();
        try (FileDeadLetterSink<Bar> dlq = new FileDeadLetterSink<>(config.deadLetterFile())) {
            MigrationPipeline pipeline = new MigrationPipeline(target, storeOptions, dlq, registry);
            MigrationPipeline.Options options = new MigrationPipeline.Options(config.dryRun(), config.checkpointFile(),
                    config.verify(), "local-store");
            return pipeline.migrate(sources, config.workers(), config.batchSize(), options, new CancellationToken());
        }
    }

    static TargetStore openTarget(MigrationConfig config) {
        return switch (config.targetKind()) {
            case JDBC -> new JdbcTargetStore(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
            case LINE_PROTOCOL -> new LineProtocolTargetStore(config.lineProtocolHost(), config.lineProtocolPort(),
                    config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
        };
    }

    static List<Path> storeFiles(Path dataDir) throws IOException {
        if (!Files.isDirectory(dataDir)) return List.of();
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".bars")).sorted().toList();
        }
    }

    public LocalStoreRegistry stores() { return stores; }

    public MetricRegistry registry() { return registry; }

    @Override
    public void close() { stores.close(); }
}
