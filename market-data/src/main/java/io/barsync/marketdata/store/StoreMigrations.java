package io.barsync.marketdata.store;

import java.io.IOException;
import java.util.List;

/** Ordered chain of upgrade steps. */
public class StoreMigrations {
    private final List<StoreMigration> steps;

    public StoreMigrations(List<StoreMigration> steps) { this.steps = List.copyOf(steps); }

    public static StoreMigrations standard() {
        return new StoreMigrations(List.of(new V1ToV2Migration()));
    }

    public byte[] upgrade(byte[] image, int fromVersion, int toVersion) throws IOException {
        int version = fromVersion;
        byte[] current = image;
        while (version < toVersion) {
            StoreMigration step = find(version);
            current = step.apply(current);
            int produced = StoreFormat.peekVersion(StoreFormat.reader(current));
            if (produced != step.toVersion()) {
                throw new StoreMigrationException("migration v" + version + " produced version " + produced
                        + " instead of " + step.toVersion());
            }
            version = produced;
        }
        return current;
    }

    private StoreMigration find(int fromVersion) throws StoreMigrationException {
        for (StoreMigration s : steps) {
            if (s.fromVersion() == fromVersion && s.toVersion() > fromVersion) return s;
        }
        throw new StoreMigrationException("no migration registered from store version " + fromVersion);
    }
}
