package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.OutcomeStatus;
import io.barsync.marketdata.model.SeriesKey;

import java.util.ArrayList;
import java.util.List;

/** Per-chunk results for one series, in chunk order. */
public record FetchReport(SeriesKey key, List<ChunkOutcome> chunks, OutcomeStatus status) {

    public FetchReport {
        chunks = List.copyOf(chunks);
    }

    static FetchReport of(SeriesKey key, List<ChunkOutcome> chunks) {
        long committed = chunks.stream().filter(ChunkOutcome::isCommitted).count();
        return new FetchReport(key, chunks, OutcomeStatus.of(committed, chunks.size()));
    }

    public int rowsCommitted() {
        int n = 0;
        for (ChunkOutcome c : chunks) n += c.rowsCommitted();
        return n;
    }

    public List<CoverageRange> committedRanges() {
        List<CoverageRange> out = new ArrayList<>();
        for (ChunkOutcome c : chunks) if (c.isCommitted()) out.add(c.chunk().range());
        return out;
    }

    public List<ChunkOutcome> failures() {
        return chunks.stream().filter(c -> !c.isCommitted()).toList();
    }

    /** Warnings recorded with committed chunks. */
    public List<String> warnings() {
        List<String> out = new ArrayList<>();
        for (ChunkOutcome c : chunks) {
            if (c.isCommitted() && c.validation() != null) out.addAll(c.validation().warnings());
        }
        return out;
    }
}
