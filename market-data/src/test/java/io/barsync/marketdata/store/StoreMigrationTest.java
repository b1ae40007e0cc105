package io.barsync.marketdata.store;

import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.DerivativeBar;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static io.barsync.marketdata.BarFixtures.dailyBars;
import static io.barsync.marketdata.BarFixtures.day;
import static io.barsync.marketdata.BarFixtures.days;
import static io.barsync.marketdata.BarFixtures.deleteRecursively;
import static io.barsync.marketdata.BarFixtures.storeOptions;
import static org.junit.jupiter.api.Assertions.*;

public class StoreMigrationTest {
    private static final SeriesKey INFY = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);

    private Path dir;

    @BeforeEach
    void setUp() throws Exception { dir = Files.createTempDirectory("migrate"); }

    @AfterEach
    void cleanup() throws Exception { deleteRecursively(dir); }

    @Test
    void version_one_file_is_backed_up_and_upgraded_on_open() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        List<Bar> bars = dailyBars(INFY, "2024-01-01", "2024-01-05");
        LegacyStoreWriter.write(file, Map.of(INFY, bars), 1_700_000_000_000L);

        try (LocalStore store = LocalStore.open(file, MarketSegment.EQUITY, storeOptions(dir))) {
            Dataset ds = store.read(INFY).orElseThrow();
            assertEquals(bars, ds.bars());
            assertEquals(List.of(days("2024-01-01", "2024-01-05")), ds.info().coverage());
            assertEquals(V1ToV2Migration.SOURCE_TAG, ds.info().provenance().get(0).sourceTag());
            assertEquals("legacy-fetcher", ds.info().sourceTag());
            List<Path> backups = store.backups();
            assertEquals(1, backups.size());
            assertTrue(backups.get(0).getFileName().toString().endsWith("_v1.bars"));
        }
        assertEquals(StoreFormat.CURRENT_VERSION, versionOf(file));
    }

    @Test
    void version_one_derivatives_keep_open_interest() throws Exception {
        SeriesKey fut = SeriesKey.of(Exchange.NFO, "BANKNIFTY24JANFUT", SamplingInterval.DAY);
        Path file = dir.resolve("DERIVATIVES.bars");
        List<Bar> bars = List.of(new DerivativeBar(day("2024-01-02"), 45_000, 45_500, 44_800, 45_250, 10, 900),
                new DerivativeBar(day("2024-01-03"), 45_250, 45_600, 45_000, 45_100, 12, 950));
        LegacyStoreWriter.write(file, Map.of(fut, bars), 1_700_000_000_000L);
        try (LocalStore store = LocalStore.open(file, MarketSegment.DERIVATIVES, storeOptions(dir))) {
            assertEquals(bars, store.read(fut).orElseThrow().bars());
        }
    }

    @Test
    void read_only_open_upgrades_version_one_in_memory_only() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        List<Bar> bars = dailyBars(INFY, "2024-01-01", "2024-01-05");
        LegacyStoreWriter.write(file, Map.of(INFY, bars), 1_700_000_000_000L);
        byte[] before = Files.readAllBytes(file);

        try (LocalStore store = LocalStore.openReadOnly(file, MarketSegment.EQUITY, storeOptions(dir))) {
            assertEquals(bars, store.read(INFY).orElseThrow().bars());
            assertEquals(bars.subList(1, 3), store.read(INFY, day("2024-01-02"), day("2024-01-03")));
            assertTrue(store.backups().isEmpty());
        }
        assertArrayEquals(before, Files.readAllBytes(file));
        assertEquals(1, versionOf(file));
    }

    @Test
    void read_only_open_refuses_newer_version() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        byte[] image = ByteBuffer.allocate(64).putInt(StoreFormat.MAGIC).putInt(StoreFormat.CURRENT_VERSION + 1).array();
        Files.write(file, image);
        assertThrows(StoreVersionException.class, () -> LocalStore.openReadOnly(file, MarketSegment.EQUITY, storeOptions(dir)));
        assertArrayEquals(image, Files.readAllBytes(file));
    }

    @Test
    void newer_version_is_refused_and_file_untouched() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        byte[] image = ByteBuffer.allocate(64).putInt(StoreFormat.MAGIC).putInt(StoreFormat.CURRENT_VERSION + 1).array();
        Files.write(file, image);
        StoreVersionException e = assertThrows(StoreVersionException.class,
                () -> LocalStore.open(file, MarketSegment.EQUITY, storeOptions(dir)));
        assertTrue(e.getMessage().contains(String.valueOf(StoreFormat.CURRENT_VERSION + 1)));
        assertArrayEquals(image, Files.readAllBytes(file));
    }

    @Test
    void failing_step_leaves_original_in_place_and_keeps_backup() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        LegacyStoreWriter.write(file, Map.of(INFY, dailyBars(INFY, "2024-01-01", "2024-01-05")), 1_700_000_000_000L);
        byte[] before = Files.readAllBytes(file);
        StoreMigration broken = new StoreMigration() {
            @Override public int fromVersion() { return 1; }
            @Override public int toVersion() { return 2; }
            @Override public byte[] apply(byte[] image) throws IOException { throw new IOException("disk says no"); }
        };
        StoreOptions options = storeOptions(dir).withMigrations(new StoreMigrations(List.of(broken)));

        StoreMigrationException e = assertThrows(StoreMigrationException.class,
                () -> LocalStore.open(file, MarketSegment.EQUITY, options));
        assertArrayEquals(before, Files.readAllBytes(file));
        assertNotNull(e.backup());
        assertArrayEquals(before, Files.readAllBytes(e.backup()));
        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void missing_step_is_a_migration_failure() throws Exception {
        Path file = dir.resolve("EQUITY.bars");
        LegacyStoreWriter.write(file, Map.of(INFY, dailyBars(INFY, "2024-01-01", "2024-01-02")), 1_700_000_000_000L);
        StoreOptions options = storeOptions(dir).withMigrations(new StoreMigrations(List.of()));
        assertThrows(StoreMigrationException.class, () -> LocalStore.open(file, MarketSegment.EQUITY, options));
    }

    private static int versionOf(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            return StoreFormat.peekVersion(StoreFormat.reader(ch));
        }
    }
}
