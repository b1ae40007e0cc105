package io.barsync.marketdata.migrate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Journal of datasets that finished migrating, one {@code storeFile \t datasetPath \t checksum} line each.
 * A dataset whose checksum changed since it was journalled is migrated again.
 */
public class MigrationCheckpoint {
    private static final Logger log = LoggerFactory.getLogger(MigrationCheckpoint.class);

    private final Path journal;
    private final Set<String> done = new HashSet<>();

    private MigrationCheckpoint(Path journal) { this.journal = journal; }

    public static MigrationCheckpoint open(Path journal) throws IOException {
        MigrationCheckpoint cp = new MigrationCheckpoint(journal);
        if (Files.exists(journal)) {
            List<String> lines = Files.readAllLines(journal, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.split("\t", -1).length == 3) cp.done.add(line);
                else if (!line.isBlank()) log.warn("Ignoring malformed checkpoint line in {}: {}", journal, line);
            }
            log.info("Loaded {} completed dataset(s) from {}", cp.done.size(), journal);
        } else {
            Path parent = journal.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        }
        return cp;
    }

    public synchronized boolean isDone(DatasetRef ref) { return done.contains(line(ref)); }

    public synchronized void markDone(DatasetRef ref) throws IOException {
        String line = line(ref);
        if (!done.add(line)) return;
        Files.writeString(journal, line + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
    }

    public synchronized int size() { return done.size(); }

    public Path journal() { return journal; }

    private static String line(DatasetRef ref) {
        return ref.storeFile().toAbsolutePath().normalize() + "\t" + ref.key().path() + "\t" + ref.checksum();
    }
}
