package io.barsync.marketdata.store;

import io.barsync.marketdata.model.CoverageRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One applied write: when, which range, from where, and the validation messages that came with it.
 */
public record ProvenanceEntry(Instant appliedAt, CoverageRange range, String sourceTag, List<String> messages) {
    public static final int MAX_RETAINED = 64;
    static final int MAX_MESSAGES = 50;
    static final int MAX_MESSAGE_CHARS = 512;

    public ProvenanceEntry {
        sourceTag = sourceTag == null ? "" : clip(sourceTag);
        List<String> clipped = new ArrayList<>();
        if (messages != null) {
            for (String m : messages) {
                if (clipped.size() == MAX_MESSAGES) break;
                clipped.add(clip(m));
            }
        }
        messages = List.copyOf(clipped);
    }

    /** Appends and keeps only the newest {@link #MAX_RETAINED} entries. */
    static List<ProvenanceEntry> append(List<ProvenanceEntry> log, ProvenanceEntry entry) {
        List<ProvenanceEntry> out = new ArrayList<>(log);
        out.add(entry);
        int drop = out.size() - MAX_RETAINED;
        return List.copyOf(drop > 0 ? out.subList(drop, out.size()) : out);
    }

    private static String clip(String s) {
        return s.length() <= MAX_MESSAGE_CHARS ? s : s.substring(0, MAX_MESSAGE_CHARS);
    }
}
