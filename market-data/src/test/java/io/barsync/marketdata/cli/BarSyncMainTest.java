package io.barsync.marketdata.cli;

import com.google.inject.Guice;
import io.barsync.marketdata.config.SyncConfig;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.OutcomeStatus;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.store.WriteMode;
import io.barsync.marketdata.sync.MarketDataSync;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.barsync.marketdata.BarFixtures.dailyBars;
import static io.barsync.marketdata.BarFixtures.deleteRecursively;
import static io.barsync.marketdata.BarFixtures.storeOptions;
import static org.junit.jupiter.api.Assertions.*;

public class BarSyncMainTest {
    private Path dir;
    private PrintStream stdout;
    private ByteArrayOutputStream captured;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("cli");
        stdout = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void cleanup() throws Exception {
        System.setOut(stdout);
        deleteRecursively(dir);
    }

    @Test
    void keys_parse_from_exchange_and_symbol() {
        SeriesKey key = BarSyncMain.parseKey("nse:reliance", SamplingInterval.MINUTE_5);
        assertEquals(Exchange.NSE, key.exchange());
        assertEquals("RELIANCE", key.symbol());
        assertEquals(SamplingInterval.MINUTE_5, key.interval());
        assertThrows(CommandLine.TypeConversionException.class, () -> BarSyncMain.parseKey("RELIANCE", SamplingInterval.DAY));
    }

    @Test
    void exit_codes_follow_outcome() {
        assertEquals(0, BarSyncMain.exitCode(OutcomeStatus.SUCCEEDED));
        assertEquals(3, BarSyncMain.exitCode(OutcomeStatus.PARTIAL));
        assertEquals(1, BarSyncMain.exitCode(OutcomeStatus.FAILED));
    }

    @Test
    void module_wires_a_working_sync() throws Exception {
        SyncConfig config = SyncConfig.fromEnv().withDataDir(dir);
        try (MarketDataSync sync = Guice.createInjector(new MarketDataModule(config)).getInstance(MarketDataSync.class)) {
            SeriesKey key = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);
            assertTrue(sync.getCoverage(key).isEmpty());
        }
        assertTrue(Files.exists(dir.resolve(MarketSegment.EQUITY.storeFileName())));
    }

    @Test
    void coverage_and_stats_commands_print_store_contents() throws Exception {
        SeriesKey key = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);
        try (LocalStore store = LocalStore.open(dir.resolve("EQUITY.bars"), MarketSegment.EQUITY, storeOptions(dir))) {
            store.write(key, dailyBars(key, "2024-01-01", "2024-01-03"), WriteMode.APPEND);
        }

        int coverage = new CommandLine(new BarSyncMain()).execute("-d", dir.toString(), "coverage", "NSE:INFY");
        int stats = new CommandLine(new BarSyncMain()).execute("-d", dir.toString(), "stats", "-v");

        assertEquals(0, coverage);
        assertEquals(0, stats);
        String out = captured.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("NSE:INFY@day: 2024-01-01T00:00 .. 2024-01-03T00:00"), out);
        assertTrue(out.contains("EQUITY: datasets=1 rows=3"), out);
        assertTrue(out.contains("/data/NSE/INFY/day rows=3"), out);
    }
}
