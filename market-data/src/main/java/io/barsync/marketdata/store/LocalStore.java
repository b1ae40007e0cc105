package io.barsync.marketdata.store;

import io.barsync.core.CheckedConsumer;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.CoverageRanges;
import io.barsync.marketdata.model.MarketSegment;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.plan.CoverageLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One container file holding every dataset of a market segment.
 * <p>
 * Writes rebuild the container into a temp file next to the store, verify it, and publish it with an atomic
 * rename; the in-memory index snapshot is swapped under a short exclusive lock. Writers are serialized,
 * readers only wait for the swap. A dataset whose checksum does not match on read is quarantined until
 * {@link #remediate(SeriesKey)} drops it.
 * <p>
 * Every write costs a copy of the whole container: the changed dataset is encoded and compressed, the
 * others are copied over as their stored compressed bytes. Keeping one file per segment (or per year, as
 * {@code EQUITY_2023.bars}) keeps that copy bounded.
 * <p>
 * {@link #openReadOnly} gives a view that never creates, moves, upgrades or rewrites the file.
 */
public class LocalStore implements CoverageLookup, Closeable {
    private static final Logger log = LoggerFactory.getLogger(LocalStore.class);

    private final Path file;
    private final MarketSegment segment;
    private final RecordLayout layout;
    private final StoreOptions options;
    private final Clock clock;
    private final StoreBackups backups;
    private final boolean readOnly;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final ReentrantReadWriteLock publishLock = new ReentrantReadWriteLock();
    private final Set<SeriesKey> quarantined = ConcurrentHashMap.newKeySet();
    private volatile Map<SeriesKey, StoreFormat.Entry> snapshot = Map.of();
    /** Upgraded container held in memory by a read-only view of an older file; null otherwise. */
    private byte[] image;

    private LocalStore(Path file, MarketSegment segment, StoreOptions options, boolean readOnly) {
        this.file = file.toAbsolutePath();
        this.segment = Objects.requireNonNull(segment, "segment");
        this.layout = RecordLayout.forSegment(segment);
        this.options = Objects.requireNonNull(options, "options");
        this.clock = options.clock();
        this.backups = new StoreBackups(options.backupDir(), options.maxBackups(), options.clock());
        this.readOnly = readOnly;
    }

    /**
     * Opens or creates a store. Older files are backed up and upgraded, newer ones refused, unreadable or
     * corrupt ones moved aside as {@code <file>.corrupt-<millis>} and replaced by an empty store.
     */
    public static LocalStore open(Path file, MarketSegment segment, StoreOptions options) throws IOException {
        LocalStore store = new LocalStore(file, segment, options, false);
        store.load();
        return store;
    }

    /**
     * Opens an existing store for reading only. Unlike {@link #open}, problems are reported instead of
     * repaired: a missing file is a {@link NoSuchFileException}, an unreadable or corrupt one a
     * {@link StorageIntegrityException}, a newer one a {@link StoreVersionException}. An older file is
     * upgraded in memory and left as it is on disk.
     */
    public static LocalStore openReadOnly(Path file, MarketSegment segment, StoreOptions options) throws IOException {
        LocalStore store = new LocalStore(file, segment, options, true);
        store.loadReadOnly();
        return store;
    }

    private void loadReadOnly() throws IOException {
        if (!Files.isRegularFile(file)) throw new NoSuchFileException(file.toString(), null, "store file not found");
        int version;
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            version = StoreFormat.peekVersion(StoreFormat.reader(ch));
        }
        if (version > StoreFormat.CURRENT_VERSION) {
            throw new StoreVersionException(file, version, StoreFormat.CURRENT_VERSION);
        }
        if (version < StoreFormat.CURRENT_VERSION) {
            try {
                image = options.migrations().upgrade(Files.readAllBytes(file), version, StoreFormat.CURRENT_VERSION);
            } catch (IOException | RuntimeException e) {
                throw new StoreMigrationException("Could not read " + file + " from store version " + version, e, null);
            }
        }
        Map<SeriesKey, StoreFormat.Entry> entries = withReader(reader -> {
            Map<SeriesKey, StoreFormat.Entry> read = StoreFormat.read(reader).entries();
            checkEntries(read);
            if (options.verifyOnOpen() || image != null) verifyAll(read, reader);
            return read;
        });
        snapshot = Collections.unmodifiableMap(entries);
        log.info("Opened {} store {} read-only with {} dataset(s){}", segment, file, entries.size(),
                image == null ? "" : ", upgraded in memory from version " + version);
    }

    private void load() throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            log.info("Creating empty {} store at {}", segment, file);
            publish(Map.of(), null, null);
            return;
        }
        int version;
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            version = StoreFormat.peekVersion(StoreFormat.reader(ch));
        } catch (StorageIntegrityException e) {
            quarantineFile(e);
            return;
        }
        if (version > StoreFormat.CURRENT_VERSION) {
            throw new StoreVersionException(file, version, StoreFormat.CURRENT_VERSION);
        }
        if (version < StoreFormat.CURRENT_VERSION) {
            upgrade(version);
        }
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            StoreFormat.ByteReader reader = StoreFormat.reader(ch);
            Map<SeriesKey, StoreFormat.Entry> entries = StoreFormat.read(reader).entries();
            checkEntries(entries);
            if (options.verifyOnOpen()) verifyAll(entries, reader);
            snapshot = Collections.unmodifiableMap(entries);
            log.info("Opened {} store {} with {} dataset(s)", segment, file, entries.size());
        } catch (StorageIntegrityException e) {
            quarantineFile(e);
        }
    }

    private void quarantineFile(StorageIntegrityException cause) throws IOException {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + clock.millis());
        Files.move(file, aside);
        log.error("Store {} failed integrity checks ({}); moved to {} and starting empty", file, cause.getMessage(), aside);
        publish(Map.of(), null, null);
    }

    private void upgrade(int fromVersion) throws IOException {
        Path backup = backups.backup(file, "v" + fromVersion);
        byte[] upgraded;
        try {
            upgraded = options.migrations().upgrade(Files.readAllBytes(file), fromVersion, StoreFormat.CURRENT_VERSION);
            StoreFormat.ByteReader reader = StoreFormat.reader(upgraded);
            Map<SeriesKey, StoreFormat.Entry> entries = StoreFormat.read(reader).entries();
            checkEntries(entries);
            verifyAll(entries, reader);
        } catch (IOException | RuntimeException e) {
            throw new StoreMigrationException("Could not migrate " + file + " from v" + fromVersion + " to v"
                    + StoreFormat.CURRENT_VERSION + "; original left in place, backup at " + backup, e, backup);
        }
        Path temp = tempFile();
        try {
            try (FileChannel ch = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(upgraded);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            moveIntoPlace(temp);
        } catch (IOException e) {
            deleteTemp(temp, e);
            throw new StoreMigrationException("Could not publish migrated " + file + "; original left in place", e, backup);
        }
        log.info("Migrated {} from store version {} to {}", file, fromVersion, StoreFormat.CURRENT_VERSION);
    }

    public Path file() { return file; }

    public MarketSegment segment() { return segment; }

    public Optional<Dataset> read(SeriesKey key) throws IOException {
        requireHealthy(key);
        StoreFormat.Entry entry;
        byte[] payload;
        publishLock.readLock().lock();
        try {
            entry = snapshot.get(key);
            if (entry == null) return Optional.empty();
            payload = readPayload(entry);
        } finally {
            publishLock.readLock().unlock();
        }
        return Optional.of(new Dataset(entry.info(), decodeVerified(entry, payload)));
    }

    /**
     * Bars of {@code key} with {@code from <= timestamp <= to}. Only the blocks overlapping the range are
     * read and decompressed; each is checked against its own block checksum, the whole-dataset checksum is
     * left to {@link #read(SeriesKey)}. A damaged block quarantines the dataset.
     */
    public List<Bar> read(SeriesKey key, long from, long to) throws IOException {
        if (from > to) throw new IllegalArgumentException("from " + from + " is after to " + to);
        requireHealthy(key);
        StoreFormat.Entry entry;
        byte[] raw;
        publishLock.readLock().lock();
        try {
            entry = snapshot.get(key);
            if (entry == null || !entry.info().hasBars() || to < entry.info().earliest() || from > entry.info().latest()) {
                return List.of();
            }
            raw = withReader(reader -> BlockCodec.decodeRange(reader, entry, layout.recordBytes(), from, to));
        } catch (StorageIntegrityException e) {
            quarantined.add(key);
            log.error("Quarantined dataset {} in {}: {}", key, file, e.getMessage());
            throw e;
        } finally {
            publishLock.readLock().unlock();
        }
        List<Bar> out = new ArrayList<>();
        for (Bar b : layout.decode(raw)) {
            if (b.timestamp() >= from && b.timestamp() <= to) out.add(b);
        }
        return out;
    }

    /** Appends or replaces bars for the range they were fetched for. */
    public DatasetInfo write(SeriesKey key, CoverageRange range, List<? extends Bar> bars, WriteMode mode,
                             String sourceTag, List<String> messages) throws IOException {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(mode, "mode");
        requireWritable();
        if (key.segment() != segment) {
            throw new IllegalArgumentException(key + " does not belong to the " + segment + " store");
        }
        checkBars(key, range, bars);
        writeLock.lock();
        try {
            requireHealthy(key);
            Map<SeriesKey, StoreFormat.Entry> base = snapshot;
            StoreFormat.Entry current = base.get(key);
            long unit = key.interval().unitSeconds();
            List<Bar> merged;
            List<CoverageRange> coverage;
            List<ProvenanceEntry> provenance;
            if (current == null || mode == WriteMode.OVERWRITE) {
                merged = new ArrayList<>(bars);
                coverage = List.of(range);
                provenance = current == null ? List.of() : current.info().provenance();
            } else {
                List<CoverageRange> existing = current.info().coverage();
                if (CoverageRanges.overlapsAny(existing, range)) {
                    throw new IllegalArgumentException(key + ": append range " + range + " overlaps stored coverage " + existing);
                }
                merged = mergeSorted(key, decodeVerified(current, readPayload(current)), bars);
                coverage = CoverageRanges.add(existing, range, unit);
                provenance = current.info().provenance();
            }
            provenance = ProvenanceEntry.append(provenance, new ProvenanceEntry(clock.instant(), range, sourceTag, messages));

            SamplingInterval interval = key.interval();
            byte[] raw = layout.encode(merged);
            BlockCodec.Encoded blocks = BlockCodec.encode(raw, layout.recordBytes(), interval.rowsPerBlock(), interval.compressionLevel());
            DatasetInfo info = new DatasetInfo(key, merged.size(),
                    merged.isEmpty() ? 0L : merged.get(0).timestamp(),
                    merged.isEmpty() ? 0L : merged.get(merged.size() - 1).timestamp(),
                    clock.instant(), RecordLayout.SCHEMA_VERSION, interval.rowsPerBlock(), blocks.blockCount(),
                    Checksums.sha256(raw), sourceTag == null ? "" : sourceTag, coverage, provenance);
            publish(base, key, new StoreFormat.PendingDataset(info, blocks::bytes));
            log.debug("Wrote {} bar(s) for {} in {} mode, coverage now {}", bars.size(), key, mode, coverage);
            return info;
        } finally {
            writeLock.unlock();
        }
    }

    /** Writes bars whose range is their own first and last timestamp. */
    public DatasetInfo write(SeriesKey key, List<? extends Bar> bars, WriteMode mode) throws IOException {
        if (bars.isEmpty()) throw new IllegalArgumentException("no bars to write for " + key);
        CoverageRange range = new CoverageRange(bars.get(0).timestamp(), bars.get(bars.size() - 1).timestamp());
        return write(key, range, bars, mode, "manual", List.of());
    }

    @Override
    public List<CoverageRange> coverage(SeriesKey key) throws StorageIntegrityException {
        requireHealthy(key);
        StoreFormat.Entry entry = snapshot.get(key);
        return entry == null ? List.of() : entry.info().coverage();
    }

    public Optional<DatasetInfo> info(SeriesKey key) {
        StoreFormat.Entry entry = snapshot.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.info());
    }

    public List<SeriesKey> listSeries() { return List.copyOf(snapshot.keySet()); }

    public List<DatasetInfo> infos() {
        List<DatasetInfo> out = new ArrayList<>();
        for (StoreFormat.Entry e : snapshot.values()) out.add(e.info());
        return out;
    }

    /** Streams a dataset's bars in timestamp order, at most {@code batchSize} at a time. */
    public void forEachBatch(SeriesKey key, int batchSize, CheckedConsumer<List<Bar>> consumer) throws Exception {
        Optional<Dataset> dataset = read(key);
        if (dataset.isEmpty()) return;
        List<Bar> bars = dataset.get().bars();
        int size = Math.max(1, batchSize);
        for (int from = 0; from < bars.size(); from += size) {
            consumer.accept(bars.subList(from, Math.min(bars.size(), from + size)));
        }
    }

    public boolean delete(SeriesKey key) throws IOException {
        requireWritable();
        writeLock.lock();
        try {
            Map<SeriesKey, StoreFormat.Entry> base = snapshot;
            if (!base.containsKey(key)) return false;
            publish(base, key, null);
            quarantined.remove(key);
            log.info("Deleted dataset {} from {}", key, file);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /** Drops a quarantined dataset so it can be fetched again from scratch. */
    public boolean remediate(SeriesKey key) throws IOException {
        requireWritable();
        if (!quarantined.contains(key)) return false;
        writeLock.lock();
        try {
            Map<SeriesKey, StoreFormat.Entry> base = snapshot;
            if (base.containsKey(key)) publish(base, key, null);
            quarantined.remove(key);
            log.warn("Remediated quarantined dataset {}; its data and coverage were dropped", key);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    public boolean isQuarantined(SeriesKey key) { return quarantined.contains(key); }

    public Path createBackup() throws IOException {
        writeLock.lock();
        try {
            return backups.backup(file, "manual");
        } finally {
            writeLock.unlock();
        }
    }

    public List<Path> backups() throws IOException { return backups.list(file); }

    public StoreStats stats() throws IOException {
        Map<SeriesKey, StoreFormat.Entry> s = snapshot;
        long rows = 0;
        for (StoreFormat.Entry e : s.values()) rows += e.info().rowCount();
        return new StoreStats(file, segment, StoreFormat.CURRENT_VERSION, s.size(), rows, Files.size(file), Set.copyOf(quarantined));
    }

    @Override
    public void close() {
        log.debug("Closed store {}", file);
    }

    public boolean isReadOnly() { return readOnly; }

    private void requireHealthy(SeriesKey key) throws StorageIntegrityException {
        if (quarantined.contains(key)) throw new StorageIntegrityException(key, "dataset is quarantined");
    }

    private void requireWritable() {
        if (readOnly) throw new IllegalStateException(file + " is open read-only");
    }

    @FunctionalInterface
    private interface ReaderFunction<T> {
        T apply(StoreFormat.ByteReader reader) throws IOException;
    }

    private <T> T withReader(ReaderFunction<T> fn) throws IOException {
        if (image != null) return fn.apply(StoreFormat.reader(image));
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            return fn.apply(StoreFormat.reader(ch));
        }
    }

    private byte[] readPayload(StoreFormat.Entry entry) throws IOException {
        return withReader(reader -> StoreFormat.readPayload(reader, entry));
    }

    private List<Bar> decodeVerified(StoreFormat.Entry entry, byte[] payload) throws StorageIntegrityException {
        try {
            return verify(entry, payload);
        } catch (StorageIntegrityException e) {
            quarantined.add(entry.info().key());
            log.error("Quarantined dataset {} in {}: {}", entry.info().key(), file, e.getMessage());
            throw e;
        }
    }

    private List<Bar> verify(StoreFormat.Entry entry, byte[] payload) throws StorageIntegrityException {
        DatasetInfo info = entry.info();
        byte[] raw = BlockCodec.decode(payload, info.blockCount(), layout.recordBytes(), info.key());
        if (raw.length != info.rowCount() * layout.recordBytes()) {
            throw new StorageIntegrityException(info.key(), "expected " + info.rowCount() + " rows but found " + raw.length + " bytes");
        }
        if (!Checksums.sha256(raw).equals(info.checksum())) {
            throw new StorageIntegrityException(info.key(), "checksum mismatch");
        }
        return layout.decode(raw);
    }

    private void verifyAll(Map<SeriesKey, StoreFormat.Entry> entries, StoreFormat.ByteReader reader) throws IOException {
        for (StoreFormat.Entry e : entries.values()) verify(e, StoreFormat.readPayload(reader, e));
    }

    private void checkEntries(Map<SeriesKey, StoreFormat.Entry> entries) throws StorageIntegrityException {
        for (StoreFormat.Entry e : entries.values()) {
            SeriesKey key = e.info().key();
            if (key.segment() != segment) throw new StorageIntegrityException(key, "dataset stored in the " + segment + " store");
            if (!CoverageRanges.isConsistent(e.info().coverage())) {
                throw new StorageIntegrityException(key, "overlapping coverage ranges " + e.info().coverage());
            }
        }
    }

    private static void checkBars(SeriesKey key, CoverageRange range, List<? extends Bar> bars) {
        long previous = Long.MIN_VALUE;
        for (Bar b : bars) {
            if (b.timestamp() <= previous) {
                throw new IllegalArgumentException(key + ": bar timestamps must be strictly increasing at " + b.timestamp());
            }
            if (!range.contains(b.timestamp())) {
                throw new IllegalArgumentException(key + ": bar at " + b.timestamp() + " lies outside " + range);
            }
            previous = b.timestamp();
        }
    }

    private static List<Bar> mergeSorted(SeriesKey key, List<Bar> stored, List<? extends Bar> added) {
        List<Bar> out = new ArrayList<>(stored.size() + added.size());
        int i = 0, j = 0;
        while (i < stored.size() || j < added.size()) {
            if (j == added.size()) out.add(stored.get(i++));
            else if (i == stored.size()) out.add(added.get(j++));
            else {
                long a = stored.get(i).timestamp(), b = added.get(j).timestamp();
                if (a == b) throw new IllegalArgumentException(key + ": bar at " + a + " is already stored");
                out.add(a < b ? stored.get(i++) : added.get(j++));
            }
        }
        return out;
    }

    /**
     * Rebuilds the container with {@code changed} replaced (or removed when {@code replacement} is null),
     * verifies the temp file, then renames it over the store and swaps the snapshot. Unchanged datasets
     * are copied as their compressed bytes through one channel on the current file.
     */
    private void publish(Map<SeriesKey, StoreFormat.Entry> base, SeriesKey changed, StoreFormat.PendingDataset replacement) throws IOException {
        Path temp = tempFile();
        try (FileChannel current = base.isEmpty() ? null : FileChannel.open(file, StandardOpenOption.READ)) {
            List<StoreFormat.PendingDataset> datasets = new ArrayList<>();
            for (StoreFormat.Entry e : base.values()) {
                if (e.info().key().equals(changed)) continue;
                datasets.add(new StoreFormat.PendingDataset(e.info(), () -> StoreFormat.readPayload(StoreFormat.reader(current), e)));
            }
            if (replacement != null) datasets.add(replacement);
            Map<SeriesKey, StoreFormat.Entry> written;
            try (FileChannel ch = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.READ)) {
                written = StoreFormat.write(ch, datasets, clock.millis());
                StoreFormat.ByteReader reader = StoreFormat.reader(ch);
                Map<SeriesKey, StoreFormat.Entry> reread = StoreFormat.read(reader).entries();
                if (!reread.keySet().equals(written.keySet())) {
                    throw new StorageIntegrityException(changed, "temp store index does not match what was written");
                }
                if (replacement != null) verify(reread.get(replacement.info().key()), StoreFormat.readPayload(reader, reread.get(replacement.info().key())));
            }
            publishLock.writeLock().lock();
            try {
                moveIntoPlace(temp);
                snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(written));
            } finally {
                publishLock.writeLock().unlock();
            }
        } catch (IOException | RuntimeException e) {
            deleteTemp(temp, e);
            throw e;
        }
    }

    private Path tempFile() {
        return file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}; falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp, Exception failure) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }
}
