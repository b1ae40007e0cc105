package io.barsync.marketdata.fetch;

import com.codahale.metrics.Counter;
import io.barsync.core.Record;
import io.barsync.core.Sink;
import io.barsync.marketdata.model.Bar;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.store.StorageIntegrityException;
import io.barsync.marketdata.store.WriteMode;
import io.barsync.marketdata.validate.ValidationFailureException;
import io.barsync.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Receives chunk outcomes in chunk order and appends fetched bars to the store. An integrity failure stops
 * the series: the run is cancelled and later chunks are reported as halted.
 */
class ChunkCommitSink implements Sink<ChunkOutcome> {
    private static final Logger log = LoggerFactory.getLogger(ChunkCommitSink.class);

    private final LocalStore store;
    private final CancellationToken cancellation;
    private final String sourceTag;
    private final Counter failures;
    private final Counter rows;
    private final List<ChunkOutcome> outcomes = new ArrayList<>();
    private StorageIntegrityException halt;

    ChunkCommitSink(LocalStore store, CancellationToken cancellation, String sourceTag, Counter failures, Counter rows) {
        this.store = store;
        this.cancellation = cancellation;
        this.sourceTag = sourceTag;
        this.failures = failures;
        this.rows = rows;
    }

    @Override
    public void accept(Record<ChunkOutcome> record) {
        ChunkOutcome o = record.payload();
        if (halt != null) {
            outcomes.add(o.with(ChunkOutcome.Status.HALTED, halt.getMessage()));
            return;
        }
        if (o.status() != ChunkOutcome.Status.FETCHED && o.status() != ChunkOutcome.Status.NO_TRADING_DAYS) {
            if (o.status() != ChunkOutcome.Status.CANCELLED) failures.inc();
            outcomes.add(o);
            return;
        }
        if (cancellation.isCancelled()) {
            outcomes.add(o.with(ChunkOutcome.Status.CANCELLED, cancellation.reason()));
            return;
        }
        try {
            List<Bar> bars;
            List<String> messages;
            if (o.status() == ChunkOutcome.Status.FETCHED) {
                bars = o.validation().requireStorable().bars();
                messages = o.validation().warnings();
            } else {
                bars = List.of();
                messages = List.of("no trading days in range, nothing requested");
            }
            store.write(o.chunk().key(), o.chunk().range(), bars, WriteMode.APPEND, sourceTag, messages);
            rows.inc(bars.size());
            outcomes.add(o.committed(bars.size()));
        } catch (StorageIntegrityException e) {
            halt = e;
            cancellation.cancel("storage integrity failure: " + e.getMessage());
            failures.inc();
            log.error("Halting {} after integrity failure: {}", o.chunk().key(), e.getMessage());
            outcomes.add(o.with(ChunkOutcome.Status.STORAGE_FAILED, e.getMessage()));
        } catch (ValidationFailureException e) {
            failures.inc();
            outcomes.add(o.with(ChunkOutcome.Status.VALIDATION_FAILED, e.getMessage()));
        } catch (IOException | IllegalArgumentException e) {
            failures.inc();
            log.warn("Could not commit {}: {}", o.chunk(), e.getMessage());
            outcomes.add(o.with(ChunkOutcome.Status.STORAGE_FAILED, e.getMessage()));
        }
    }

    List<ChunkOutcome> outcomes() { return outcomes; }

    StorageIntegrityException halt() { return halt; }
}
