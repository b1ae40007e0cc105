package io.barsync.marketdata.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Timestamped copies of store files, newest {@code maxBackups} kept per store.
 * Names look like {@code EQUITY_backup_20240105_093000_123_v1.bars}.
 */
public class StoreBackups {
    private static final Logger log = LoggerFactory.getLogger(StoreBackups.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Path backupDir;
    private final int maxBackups;
    private final Clock clock;

    public StoreBackups(Path backupDir, int maxBackups, Clock clock) {
        this.backupDir = backupDir;
        this.maxBackups = Math.max(1, maxBackups);
        this.clock = clock;
    }

    public Path backup(Path storeFile, String reason) throws IOException {
        Files.createDirectories(backupDir);
        String base = prefix(storeFile) + STAMP.format(clock.instant());
        String suffix = reason == null || reason.isBlank() ? "" : "_" + reason;
        Path target = backupDir.resolve(base + suffix + ".bars");
        for (int n = 1; Files.exists(target); n++) {
            target = backupDir.resolve(base + "_" + n + suffix + ".bars");
        }
        Files.copy(storeFile, target, StandardCopyOption.COPY_ATTRIBUTES);
        if (Files.size(target) != Files.size(storeFile)) {
            Files.deleteIfExists(target);
            throw new IOException("backup of " + storeFile + " is incomplete");
        }
        log.info("Backed up {} to {}", storeFile, target);
        prune(storeFile);
        return target;
    }

    /** Backups of the given store, newest first. */
    public List<Path> list(Path storeFile) throws IOException {
        if (!Files.isDirectory(backupDir)) return List.of();
        String prefix = prefix(storeFile);
        List<Path> found = new ArrayList<>();
        try (Stream<Path> s = Files.list(backupDir)) {
            s.filter(p -> p.getFileName().toString().startsWith(prefix)).forEach(found::add);
        }
        found.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        return found;
    }

    private void prune(Path storeFile) throws IOException {
        List<Path> all = list(storeFile);
        for (Path old : all.subList(Math.min(maxBackups, all.size()), all.size())) {
            try {
                Files.deleteIfExists(old);
                log.debug("Removed old backup {}", old);
            } catch (IOException e) {
                log.warn("Could not remove old backup {}: {}", old, e.getMessage());
            }
        }
    }

    private static String prefix(Path storeFile) {
        String name = storeFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + "_backup_";
    }
}
