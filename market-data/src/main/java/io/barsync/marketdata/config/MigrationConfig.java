package io.barsync.marketdata.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for draining local store files into the secondary store. An empty {@code sourceStores} list means
 * every {@code *.bars} file in the data directory.
 */
public record MigrationConfig(
        List<Path> sourceStores,
        TargetKind targetKind,
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String lineProtocolHost,
        int lineProtocolPort,
        int workers,
        int batchSize,
        boolean dryRun,
        boolean verify,
        Path checkpointFile,
        Path deadLetterFile
) {
    public enum TargetKind { JDBC, LINE_PROTOCOL }

    public MigrationConfig {
        sourceStores = List.copyOf(sourceStores);
    }

    public static MigrationConfig fromEnv() {
        Path data = Path.of(SyncConfig.get("barsync.data", "BARSYNC_DATA", "./data"));
        List<Path> sources = new ArrayList<>();
        for (String s : SyncConfig.get("barsync.migrate.sources", "BARSYNC_MIGRATE_SOURCES", "").split(",")) {
            if (!s.isBlank()) sources.add(Path.of(s.trim()));
        }
        TargetKind kind = TargetKind.valueOf(SyncConfig.get("barsync.target.kind", "BARSYNC_TARGET_KIND", "LINE_PROTOCOL"));
        String url = SyncConfig.get("barsync.target.jdbc-url", "BARSYNC_TARGET_JDBC_URL", "jdbc:postgresql://localhost:8812/qdb");
        String user = SyncConfig.get("barsync.target.user", "BARSYNC_TARGET_USER", "admin");
        String password = SyncConfig.get("barsync.target.password", "BARSYNC_TARGET_PASSWORD", "quest");
        String host = SyncConfig.get("barsync.target.ilp-host", "BARSYNC_TARGET_ILP_HOST", "localhost");
        int port = Integer.parseInt(SyncConfig.get("barsync.target.ilp-port", "BARSYNC_TARGET_ILP_PORT", "9009"));
        int workers = Integer.parseInt(SyncConfig.get("barsync.migrate.workers", "BARSYNC_MIGRATE_WORKERS", "4"));
        int batch = Integer.parseInt(SyncConfig.get("barsync.migrate.batch-size", "BARSYNC_MIGRATE_BATCH_SIZE", "10000"));
        boolean dryRun = Boolean.parseBoolean(SyncConfig.get("barsync.migrate.dry-run", "BARSYNC_MIGRATE_DRY_RUN", "false"));
        boolean verify = Boolean.parseBoolean(SyncConfig.get("barsync.migrate.verify", "BARSYNC_MIGRATE_VERIFY", "true"));
        Path checkpoint = data.resolve(SyncConfig.get("barsync.migrate.checkpoint", "BARSYNC_MIGRATE_CHECKPOINT", "migration.checkpoint"));
        Path dlq = data.resolve(SyncConfig.get("barsync.migrate.dlq", "BARSYNC_MIGRATE_DLQ", "migration_dlq.jsonl"));
        return new MigrationConfig(sources, kind, url, user, password, host, port, workers, batch, dryRun, verify, checkpoint, dlq);
    }

    /** A JDBC target with everything else at its defaults; checkpoint and dead letters go under {@code workDir}. */
    public static MigrationConfig jdbc(String jdbcUrl, List<Path> sources, Path workDir) {
        return new MigrationConfig(sources, TargetKind.JDBC, jdbcUrl, null, null, null, 0, 4, 10_000, false, true,
                workDir.resolve("migration.checkpoint"), workDir.resolve("migration_dlq.jsonl"));
    }

    public MigrationConfig withWorkers(int w) {
        return new MigrationConfig(sourceStores, targetKind, jdbcUrl, jdbcUser, jdbcPassword, lineProtocolHost,
                lineProtocolPort, w, batchSize, dryRun, verify, checkpointFile, deadLetterFile);
    }

    public MigrationConfig withBatchSize(int b) {
        return new MigrationConfig(sourceStores, targetKind, jdbcUrl, jdbcUser, jdbcPassword, lineProtocolHost,
                lineProtocolPort, workers, b, dryRun, verify, checkpointFile, deadLetterFile);
    }

    public MigrationConfig withDryRun(boolean d) {
        return new MigrationConfig(sourceStores, targetKind, jdbcUrl, jdbcUser, jdbcPassword, lineProtocolHost,
                lineProtocolPort, workers, batchSize, d, verify, checkpointFile, deadLetterFile);
    }
}
