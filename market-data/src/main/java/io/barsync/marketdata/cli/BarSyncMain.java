package io.barsync.marketdata.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.barsync.marketdata.config.MigrationConfig;
import io.barsync.marketdata.config.SyncConfig;
import io.barsync.marketdata.fetch.ChunkOutcome;
import io.barsync.marketdata.migrate.DatasetOutcome;
import io.barsync.marketdata.migrate.MigrationSummary;
import io.barsync.marketdata.migrate.SourceFailure;
import io.barsync.marketdata.migrate.VerificationReport;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.OutcomeStatus;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.store.DatasetInfo;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.store.StoreStats;
import io.barsync.marketdata.sync.MarketDataSync;
import io.barsync.marketdata.sync.SyncRequest;
import io.barsync.marketdata.sync.SyncResult;
import io.barsync.runtime.CancellationToken;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI over {@link MarketDataSync}: incremental sync, coverage listing, store statistics and migration.
 */
@CommandLine.Command(name = "barsync", mixinStandardHelpOptions = true,
        description = "Incremental market bar sync and migration",
        subcommands = {BarSyncMain.Sync.class, BarSyncMain.Coverage.class, BarSyncMain.Stats.class, BarSyncMain.Migrate.class})
public final class BarSyncMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-d", "--data"}, description = "Data directory (default: barsync.data or ./data)")
    Path dataDir;

    public static void main(String[] args) {
        int code = new CommandLine(new BarSyncMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    SyncConfig config() {
        SyncConfig c = SyncConfig.fromEnv();
        return dataDir == null ? c : c.withDataDir(dataDir);
    }

    MarketDataSync sync() {
        Injector injector = Guice.createInjector(new MarketDataModule(config()));
        return injector.getInstance(MarketDataSync.class);
    }

    static int exitCode(OutcomeStatus status) {
        return switch (status) {
            case SUCCEEDED -> 0;
            case PARTIAL -> 3;
            case FAILED -> 1;
        };
    }

    @CommandLine.Command(name = "sync", mixinStandardHelpOptions = true, description = "Fetch the missing bars of one or more series")
    static final class Sync implements Callable<Integer> {
        @CommandLine.ParentCommand BarSyncMain parent;

        @CommandLine.Option(names = {"-s", "--symbol"}, split = ",", required = true, description = "EXCHANGE:SYMBOL, comma-separated or repeated")
        List<String> symbols = new ArrayList<>();

        @CommandLine.Option(names = {"-i", "--interval"}, defaultValue = "day", description = "Sampling interval: minute, 3minute, ... 60minute, day")
        String interval;

        @CommandLine.Option(names = "--from", required = true, description = "First date (yyyy-MM-dd)")
        LocalDate from;

        @CommandLine.Option(names = "--to", description = "Last date (yyyy-MM-dd); default today")
        LocalDate to;

        @CommandLine.Option(names = {"-p", "--parallel"}, defaultValue = "2", description = "Series synced at once")
        int parallel;

        @Override
        public Integer call() throws Exception {
            SamplingInterval iv = SamplingInterval.fromCode(interval);
            List<SyncRequest> requests = new ArrayList<>();
            for (String s : symbols) {
                SeriesKey key = parseKey(s, iv);
                LocalDate end = to == null ? LocalDate.now(key.exchange().zone()) : to;
                if (from.isAfter(end)) {
                    System.err.println("Start date must be on/before end date");
                    return 2;
                }
                requests.add(new SyncRequest(key, from, end));
            }
            CancellationToken cancellation = new CancellationToken();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> cancellation.cancel("interrupted by user")));
            OutcomeStatus worst = OutcomeStatus.SUCCEEDED;
            try (MarketDataSync sync = parent.sync()) {
                for (SyncResult r : sync.syncAll(requests, parallel, cancellation)) {
                    System.out.println(r.key() + ": " + r.status() + " planned=" + r.planned().size()
                            + " rows=" + r.rowsCommitted() + " coverage=" + r.coverage());
                    if (r.error() != null) System.out.println("  error: " + r.error());
                    if (r.fetch() != null) {
                        for (ChunkOutcome c : r.fetch().failures()) {
                            System.out.println("  chunk " + c.chunk().range() + " " + c.status() + ": " + c.error());
                        }
                    }
                    if (r.status().ordinal() > worst.ordinal()) worst = r.status();
                }
                printCounters(sync);
            }
            return exitCode(worst);
        }

        private static void printCounters(MarketDataSync sync) {
            MetricRegistry r = sync.registry();
            System.out.println("fetch: chunks=" + r.counter("fetch.chunks").getCount()
                    + " retries=" + r.counter("fetch.retries").getCount()
                    + " failures=" + r.counter("fetch.chunk.failures").getCount()
                    + " rows=" + r.counter("fetch.rows.committed").getCount());
        }
    }

    @CommandLine.Command(name = "coverage", mixinStandardHelpOptions = true, description = "Show stored coverage of a series")
    static final class Coverage implements Callable<Integer> {
        @CommandLine.ParentCommand BarSyncMain parent;

        @CommandLine.Parameters(index = "0", description = "EXCHANGE:SYMBOL")
        String symbol;

        @CommandLine.Option(names = {"-i", "--interval"}, defaultValue = "day")
        String interval;

        @Override
        public Integer call() throws Exception {
            SeriesKey key = parseKey(symbol, SamplingInterval.fromCode(interval));
            ZoneId zone = key.exchange().zone();
            try (MarketDataSync sync = parent.sync()) {
                List<CoverageRange> coverage = sync.getCoverage(key);
                if (coverage.isEmpty()) System.out.println(key + ": no data");
                for (CoverageRange r : coverage) {
                    System.out.println(key + ": " + Instant.ofEpochSecond(r.start()).atZone(zone).toLocalDateTime()
                            + " .. " + Instant.ofEpochSecond(r.end()).atZone(zone).toLocalDateTime());
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "stats", mixinStandardHelpOptions = true, description = "Summarise every store file")
    static final class Stats implements Callable<Integer> {
        @CommandLine.ParentCommand BarSyncMain parent;

        @CommandLine.Option(names = {"-v", "--verbose"}, description = "List every dataset")
        boolean verbose;

        @Override
        public Integer call() throws Exception {
            try (MarketDataSync sync = parent.sync()) {
                for (LocalStore store : sync.stores().openAll()) {
                    StoreStats s = store.stats();
                    System.out.println(s.segment() + ": datasets=" + s.datasets() + " rows=" + s.rows()
                            + " bytes=" + s.fileBytes() + " version=" + s.version() + " quarantined=" + s.quarantined());
                    if (!verbose) continue;
                    for (DatasetInfo info : store.infos()) {
                        System.out.println("  " + info.key().path() + " rows=" + info.rowCount() + " coverage=" + info.coverage()
                                + " updated=" + info.lastUpdated());
                    }
                }
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "migrate", mixinStandardHelpOptions = true, description = "Copy stored bars into the secondary store")
    static final class Migrate implements Callable<Integer> {
        @CommandLine.ParentCommand BarSyncMain parent;

        @CommandLine.Option(names = {"-w", "--workers"}, description = "Worker threads (default: barsync.migrate.workers)")
        Integer workers;

        @CommandLine.Option(names = {"-b", "--batch-size"}, description = "Rows per target write (default: barsync.migrate.batch-size)")
        Integer batchSize;

        @CommandLine.Option(names = "--dry-run", description = "Read and count without writing")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            MigrationConfig config = MigrationConfig.fromEnv();
            if (workers != null) config = config.withWorkers(workers);
            if (batchSize != null) config = config.withBatchSize(batchSize);
            if (dryRun) config = config.withDryRun(true);
            try (MarketDataSync sync = parent.sync()) {
                MigrationSummary s = sync.runMigration(config);
                System.out.println("Migration " + s.status() + (s.dryRun() ? " (dry run)" : "") + ": datasets=" + s.datasetsProcessed()
                        + " skipped=" + s.datasetsSkipped() + " rowsRead=" + s.rowsRead() + " rowsWritten=" + s.rowsWritten()
                        + " duplicates=" + s.duplicatesSkipped() + " rowErrors=" + s.rowErrors());
                for (SourceFailure f : s.sourceFailures()) System.out.println("  unreadable " + f);
                for (DatasetOutcome f : s.failures()) System.out.println("  failed " + f.dataset() + ": " + f.error());
                VerificationReport v = s.verification();
                if (v != null) {
                    System.out.println("Verification: " + v.keys().size() + " series, " + v.mismatches().size() + " mismatch(es)");
                    for (VerificationReport.KeyCount k : v.mismatches()) {
                        System.out.println("  " + k.key() + " source=" + k.distinctRows() + " target=" + k.targetRows());
                    }
                }
                return exitCode(s.status());
            }
        }
    }

    static SeriesKey parseKey(String s, SamplingInterval interval) {
        int colon = s.indexOf(':');
        if (colon <= 0) throw new CommandLine.TypeConversionException("expected EXCHANGE:SYMBOL but was " + s);
        return SeriesKey.of(Exchange.parse(s.substring(0, colon)), s.substring(colon + 1), interval);
    }
}
