package io.barsync.marketdata.migrate;

import io.barsync.marketdata.model.SeriesKey;

import java.util.List;

/** Source versus target row counts per series after a migration. */
public record VerificationReport(List<KeyCount> keys, List<KeyCount> mismatches) {

    /**
     * @param sourceRows   rows across every source file, duplicates included
     * @param distinctRows distinct timestamps across every source file
     */
    public record KeyCount(SeriesKey key, long sourceRows, long distinctRows, long targetRows) {
        public boolean matches() { return distinctRows == targetRows; }
    }

    public VerificationReport {
        keys = List.copyOf(keys);
        mismatches = List.copyOf(mismatches);
    }

    public boolean passed() { return mismatches.isEmpty(); }
}
