package io.barsync.marketdata.store;

import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.DerivativeBar;
import io.barsync.marketdata.model.EquityBar;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.plan.GapPlanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.RandomAccessFile;
import java.nio.file.NoSuchFileException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static io.barsync.marketdata.BarFixtures.CLOCK;
import static io.barsync.marketdata.BarFixtures.dailyBars;
import static io.barsync.marketdata.BarFixtures.day;
import static io.barsync.marketdata.BarFixtures.days;
import static io.barsync.marketdata.BarFixtures.deleteRecursively;
import static io.barsync.marketdata.BarFixtures.storeOptions;
import static org.junit.jupiter.api.Assertions.*;

public class LocalStoreTest {
    private static final SeriesKey INFY = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);
    private static final SeriesKey TCS = SeriesKey.of(Exchange.NSE, "TCS", SamplingInterval.DAY);
    private static final SeriesKey INFY_MINUTE = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.MINUTE);
    private static final long MINUTE_START = day("2024-01-01");

    private Path dir;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("store");
        file = dir.resolve(MarketSegment.EQUITY.storeFileName());
    }

    @AfterEach
    void cleanup() throws Exception { deleteRecursively(dir); }

    private LocalStore open() throws Exception {
        return LocalStore.open(file, MarketSegment.EQUITY, storeOptions(dir));
    }

    @Test
    void written_bars_read_back_identically_after_reopen() throws Exception {
        List<Bar> bars = dailyBars(INFY, "2024-01-01", "2024-01-10");
        DatasetInfo written;
        try (LocalStore store = open()) {
            written = store.write(INFY, days("2024-01-01", "2024-01-10"), bars, WriteMode.APPEND, "test", List.of());
        }
        try (LocalStore store = open()) {
            Dataset ds = store.read(INFY).orElseThrow();
            assertEquals(bars, ds.bars());
            assertEquals(written.checksum(), ds.info().checksum());
            assertEquals(10, ds.info().rowCount());
            assertEquals(day("2024-01-01"), ds.info().earliest());
            assertEquals(day("2024-01-10"), ds.info().latest());
            assertEquals(List.of(days("2024-01-01", "2024-01-10")), store.coverage(INFY));
            assertEquals(RecordLayout.SCHEMA_VERSION, ds.info().schemaVersion());
        }
    }

    @Test
    void append_merges_bars_and_coverage() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, days("2024-01-01", "2024-01-10"), dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND, "a", List.of());
            store.write(INFY, days("2024-01-11", "2024-01-15"), dailyBars(INFY, "2024-01-11", "2024-01-15"), WriteMode.APPEND, "b",
                    List.of("row 2: zero volume"));
            DatasetInfo info = store.info(INFY).orElseThrow();
            assertEquals(15, info.rowCount());
            assertEquals(List.of(days("2024-01-01", "2024-01-15")), info.coverage());
            assertEquals(2, info.provenance().size());
            assertEquals(List.of("row 2: zero volume"), info.provenance().get(1).messages());
        }
    }

    @Test
    void append_overlapping_coverage_is_rejected_and_store_unchanged() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, days("2024-01-01", "2024-01-10"), dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND, "a", List.of());
            String before = store.info(INFY).orElseThrow().checksum();
            assertThrows(IllegalArgumentException.class, () -> store.write(INFY, days("2024-01-10", "2024-01-12"),
                    dailyBars(INFY, "2024-01-10", "2024-01-12"), WriteMode.APPEND, "b", List.of()));
            assertEquals(before, store.info(INFY).orElseThrow().checksum());
            assertEquals(List.of(days("2024-01-01", "2024-01-10")), store.coverage(INFY));
        }
        try (Stream<Path> s = Files.list(dir)) {
            assertTrue(s.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void overwrite_replaces_dataset() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, days("2024-01-01", "2024-01-10"), dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND, "a", List.of());
            store.write(INFY, days("2024-02-01", "2024-02-03"), dailyBars(INFY, "2024-02-01", "2024-02-03"), WriteMode.OVERWRITE, "b", List.of());
            assertEquals(3, store.read(INFY).orElseThrow().bars().size());
            assertEquals(List.of(days("2024-02-01", "2024-02-03")), store.coverage(INFY));
        }
    }

    @Test
    void bars_must_be_increasing_and_inside_range() throws Exception {
        try (LocalStore store = open()) {
            List<Bar> bars = new ArrayList<>(dailyBars(INFY, "2024-01-01", "2024-01-03"));
            assertThrows(IllegalArgumentException.class,
                    () -> store.write(INFY, days("2024-01-02", "2024-01-03"), bars, WriteMode.APPEND, "a", List.of()));
            bars.add(bars.get(0));
            assertThrows(IllegalArgumentException.class,
                    () -> store.write(INFY, days("2024-01-01", "2024-01-03"), bars, WriteMode.APPEND, "a", List.of()));
            assertTrue(store.info(INFY).isEmpty());
        }
    }

    @Test
    void empty_commit_records_coverage_without_rows() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, days("2024-01-06", "2024-01-07"), List.of(), WriteMode.APPEND, "a", List.of("no trading days"));
            DatasetInfo info = store.info(INFY).orElseThrow();
            assertFalse(info.hasBars());
            assertEquals(List.of(days("2024-01-06", "2024-01-07")), info.coverage());
            assertTrue(store.read(INFY).orElseThrow().bars().isEmpty());
        }
    }

    @Test
    void derivative_store_keeps_open_interest() throws Exception {
        SeriesKey fut = SeriesKey.of(Exchange.NFO, "NIFTY24JANFUT", SamplingInterval.DAY);
        Path derivatives = dir.resolve(MarketSegment.DERIVATIVES.storeFileName());
        List<Bar> bars = List.of(new DerivativeBar(day("2024-01-02"), 0.0, 10, 0.0, 5, 100, 12_345));
        try (LocalStore store = LocalStore.open(derivatives, MarketSegment.DERIVATIVES, storeOptions(dir))) {
            store.write(fut, days("2024-01-02", "2024-01-02"), bars, WriteMode.APPEND, "a", List.of());
            assertThrows(IllegalArgumentException.class, () -> store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-02"), WriteMode.APPEND));
        }
        try (LocalStore store = LocalStore.open(derivatives, MarketSegment.DERIVATIVES, storeOptions(dir))) {
            assertEquals(12_345, store.read(fut).orElseThrow().bars().get(0).openInterest());
        }
    }

    @Test
    void batches_stream_in_order() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND);
            List<Integer> sizes = new ArrayList<>();
            List<Long> first = new ArrayList<>();
            store.forEachBatch(INFY, 4, batch -> {
                sizes.add(batch.size());
                first.add(batch.get(0).timestamp());
            });
            assertEquals(List.of(4, 4, 2), sizes);
            assertEquals(List.of(day("2024-01-01"), day("2024-01-05"), day("2024-01-09")), first);
        }
    }

    @Test
    void checksum_mismatch_on_read_quarantines_dataset_until_remediated() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND);
        }
        corruptFirstPayload();
        StoreOptions lenient = new StoreOptions(dir.resolve("backups"), 3, false, CLOCK, StoreMigrations.standard());
        try (LocalStore store = LocalStore.open(file, MarketSegment.EQUITY, lenient)) {
            assertThrows(StorageIntegrityException.class, () -> store.read(INFY));
            assertTrue(store.isQuarantined(INFY));
            assertThrows(StorageIntegrityException.class, () -> store.coverage(INFY));
            assertThrows(StorageIntegrityException.class, () -> store.write(INFY, days("2024-02-01", "2024-02-01"),
                    List.of(), WriteMode.APPEND, "a", List.of()));

            assertTrue(store.remediate(INFY));
            assertFalse(store.isQuarantined(INFY));
            assertTrue(store.coverage(INFY).isEmpty());
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-02"), WriteMode.APPEND);
            assertEquals(2, store.read(INFY).orElseThrow().bars().size());
        }
    }

    @Test
    void corrupt_dataset_at_open_moves_file_aside_and_planner_sees_nothing() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, days("2024-01-01", "2024-01-10"), dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND, "a", List.of());
        }
        corruptFirstPayload();
        try (LocalStore store = open()) {
            assertTrue(store.listSeries().isEmpty());
            assertEquals(List.of(days("2024-01-01", "2024-01-10")), new GapPlanner(store).plan(INFY, day("2024-01-01"), day("2024-01-10")));
        }
        assertTrue(Files.exists(dir.resolve(file.getFileName() + ".corrupt-" + CLOCK.millis())));
    }

    @Test
    void garbage_file_is_moved_aside() throws Exception {
        Files.writeString(file, "definitely not a store");
        try (LocalStore store = open()) {
            assertTrue(store.listSeries().isEmpty());
            store.write(TCS, dailyBars(TCS, "2024-01-01", "2024-01-02"), WriteMode.APPEND);
        }
        assertTrue(Files.exists(dir.resolve(file.getFileName() + ".corrupt-" + CLOCK.millis())));
    }

    @Test
    void delete_removes_only_that_dataset() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-03"), WriteMode.APPEND);
            store.write(TCS, dailyBars(TCS, "2024-01-01", "2024-01-05"), WriteMode.APPEND);
            assertTrue(store.delete(INFY));
            assertFalse(store.delete(INFY));
            assertEquals(List.of(TCS), store.listSeries());
            StoreStats stats = store.stats();
            assertEquals(1, stats.datasets());
            assertEquals(5, stats.rows());
        }
    }

    @Test
    void backups_are_pruned_to_the_newest_three() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-03"), WriteMode.APPEND);
            for (int i = 0; i < 5; i++) store.createBackup();
            assertEquals(3, store.backups().size());
            for (Path b : store.backups()) assertEquals(Files.size(file), Files.size(b));
        }
    }

    @Test
    void ranged_read_returns_only_bars_inside_the_range() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY_MINUTE, minuteBars(10_000), WriteMode.APPEND);
            assertEquals(3, store.info(INFY_MINUTE).orElseThrow().blockCount());

            List<Bar> firstHour = store.read(INFY_MINUTE, minute(0), minute(59));
            assertEquals(60, firstHour.size());
            assertEquals(minute(0), firstHour.get(0).timestamp());
            assertEquals(minute(59), firstHour.get(59).timestamp());

            List<Bar> acrossBlocks = store.read(INFY_MINUTE, minute(4_000), minute(4_200));
            assertEquals(201, acrossBlocks.size());
            assertEquals(minuteBars(10_000).subList(4_000, 4_201), acrossBlocks);

            List<Bar> tail = store.read(INFY_MINUTE, minute(9_990) + 30, minute(20_000));
            assertEquals(9, tail.size());
            assertEquals(minute(9_991), tail.get(0).timestamp());

            assertTrue(store.read(INFY_MINUTE, minute(-100), minute(-1)).isEmpty());
            assertTrue(store.read(INFY_MINUTE, minute(10_000), minute(10_100)).isEmpty());
            assertTrue(store.read(TCS, day("2024-01-01"), day("2024-01-31")).isEmpty());
            assertThrows(IllegalArgumentException.class, () -> store.read(INFY_MINUTE, minute(10), minute(5)));
        }
    }

    @Test
    void ranged_read_skips_damaged_blocks_outside_the_range() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY_MINUTE, minuteBars(10_000), WriteMode.APPEND);
        }
        StoreFormat.Entry entry = entryOf(INFY_MINUTE);
        flipByte(entry.offset() + entry.length() - 1);

        StoreOptions lenient = new StoreOptions(dir.resolve("backups"), 3, false, CLOCK, StoreMigrations.standard());
        try (LocalStore store = LocalStore.open(file, MarketSegment.EQUITY, lenient)) {
            assertEquals(60, store.read(INFY_MINUTE, minute(0), minute(59)).size());
            assertFalse(store.isQuarantined(INFY_MINUTE));

            assertThrows(StorageIntegrityException.class, () -> store.read(INFY_MINUTE, minute(9_000), minute(9_100)));
            assertTrue(store.isQuarantined(INFY_MINUTE));
            assertThrows(StorageIntegrityException.class, () -> store.read(INFY_MINUTE, minute(0), minute(59)));
        }
    }

    @Test
    void writing_one_dataset_copies_the_others_byte_for_byte() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-31"), WriteMode.APPEND);
        }
        byte[] before = payloadOf(INFY);
        try (LocalStore store = open()) {
            store.write(TCS, dailyBars(TCS, "2024-01-01", "2024-01-10"), WriteMode.APPEND);
            store.write(TCS, dailyBars(TCS, "2024-01-11", "2024-01-12"), WriteMode.APPEND);
        }
        assertArrayEquals(before, payloadOf(INFY));
        try (LocalStore store = open()) {
            assertEquals(dailyBars(INFY, "2024-01-01", "2024-01-31"), store.read(INFY).orElseThrow().bars());
            assertEquals(12, store.read(TCS).orElseThrow().bars().size());
        }
    }

    @Test
    void read_only_store_refuses_changes_and_leaves_the_file_alone() throws Exception {
        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND);
        }
        byte[] before = Files.readAllBytes(file);
        try (LocalStore store = LocalStore.openReadOnly(file, MarketSegment.EQUITY, storeOptions(dir))) {
            assertTrue(store.isReadOnly());
            assertEquals(10, store.read(INFY).orElseThrow().bars().size());
            assertThrows(IllegalStateException.class, () -> store.write(TCS, dailyBars(TCS, "2024-01-01", "2024-01-02"), WriteMode.APPEND));
            assertThrows(IllegalStateException.class, () -> store.delete(INFY));
            assertThrows(IllegalStateException.class, () -> store.remediate(INFY));
        }
        assertArrayEquals(before, Files.readAllBytes(file));
    }

    @Test
    void read_only_open_reports_missing_and_corrupt_files() throws Exception {
        assertThrows(NoSuchFileException.class, () -> LocalStore.openReadOnly(file, MarketSegment.EQUITY, storeOptions(dir)));
        assertFalse(Files.exists(file));

        try (LocalStore store = open()) {
            store.write(INFY, dailyBars(INFY, "2024-01-01", "2024-01-10"), WriteMode.APPEND);
        }
        corruptFirstPayload();
        byte[] corrupt = Files.readAllBytes(file);
        assertThrows(StorageIntegrityException.class, () -> LocalStore.openReadOnly(file, MarketSegment.EQUITY, storeOptions(dir)));
        assertArrayEquals(corrupt, Files.readAllBytes(file));
        try (Stream<Path> s = Files.list(dir)) {
            assertTrue(s.noneMatch(p -> p.getFileName().toString().contains(".corrupt-")));
        }
    }

    /** Flips a bit in the first dataset's block header, which sits right after the container header. */
    private void corruptFirstPayload() throws Exception {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            long pos = StoreFormat.HEADER_BYTES + 3;
            raf.seek(pos);
            int b = raf.read();
            raf.seek(pos);
            raf.write(b ^ 0x01);
        }
    }

    private void flipByte(long pos) throws Exception {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
            raf.seek(pos);
            int b = raf.read();
            raf.seek(pos);
            raf.write(b ^ 0xFF);
        }
    }

    private StoreFormat.Entry entryOf(SeriesKey key) throws Exception {
        return StoreFormat.read(StoreFormat.reader(Files.readAllBytes(file))).entries().get(key);
    }

    private byte[] payloadOf(SeriesKey key) throws Exception {
        StoreFormat.ByteReader reader = StoreFormat.reader(Files.readAllBytes(file));
        return StoreFormat.readPayload(reader, StoreFormat.read(reader).entries().get(key));
    }

    private static long minute(int i) { return MINUTE_START + i * 60L; }

    private static List<Bar> minuteBars(int count) {
        List<Bar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double price = 1_500 + (i % 97) * 0.25;
            bars.add(new EquityBar(minute(i), price, price + 1, price - 1, price + 0.5, 100 + i));
        }
        return bars;
    }
}
