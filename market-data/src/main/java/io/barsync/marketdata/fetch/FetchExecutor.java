package io.barsync.marketdata.fetch;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.barsync.budget.RateLimiter;
import io.barsync.budget.TimeSource;
import io.barsync.core.Record;
import io.barsync.error.CollectingDeadLetterSink;
import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.plan.TradingCalendar;
import io.barsync.marketdata.store.LocalStore;
import io.barsync.marketdata.store.LocalStoreRegistry;
import io.barsync.marketdata.validate.BarValidator;
import io.barsync.metrics.Metrics;
import io.barsync.retry.Retrier;
import io.barsync.retry.RetryPolicy;
import io.barsync.runtime.CancellationToken;
import io.barsync.runtime.PipelineBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches the missing ranges of one series: chunks run on a bounded worker pool, share one rate limiter,
 * retry transient failures, and are committed to the local store strictly in ascending chunk order.
 * A failed chunk does not stop its siblings; the hole it leaves is found again by the next plan.
 */
public class FetchExecutor {
    private static final Logger log = LoggerFactory.getLogger(FetchExecutor.class);

    private final UpstreamClient client;
    private final RateLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final TimeSource time;
    private final BarValidator validator;
    private final TradingCalendar calendar;
    private final LocalStoreRegistry stores;
    private final int workers;
    private final MetricRegistry registry;
    private final String sourceTag;

    private final Counter chunkCounter;
    private final Counter failureCounter;
    private final Counter retryCounter;
    private final Counter rowCounter;

    public FetchExecutor(UpstreamClient client, RateLimiter limiter, RetryPolicy retryPolicy, TimeSource time,
                         BarValidator validator, TradingCalendar calendar, LocalStoreRegistry stores, int workers,
                         MetricRegistry registry, String sourceTag) {
        this.client = client;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
        this.time = time;
        this.validator = validator;
        this.calendar = calendar;
        this.stores = stores;
        this.workers = Math.max(1, workers);
        this.registry = registry;
        this.sourceTag = sourceTag;
        Metrics metrics = new Metrics(registry, "fetch");
        this.chunkCounter = metrics.counter("chunks");
        this.failureCounter = metrics.counter("chunk.failures");
        this.retryCounter = metrics.counter("retries");
        this.rowCounter = metrics.counter("rows.committed");
    }

    public FetchReport execute(SeriesKey key, List<CoverageRange> subRanges) throws IOException, InterruptedException {
        return execute(key, subRanges, new CancellationToken());
    }

    public FetchReport execute(SeriesKey key, List<CoverageRange> subRanges, CancellationToken cancellation)
            throws IOException, InterruptedException {
        List<Chunk> chunks = ChunkSplitter.split(key, subRanges);
        if (chunks.isEmpty()) return FetchReport.of(key, List.of());
        LocalStore store = stores.forKey(key);
        CancellationToken run = cancellation.child();
        ChunkCommitSink sink = new ChunkCommitSink(store, run, sourceTag, failureCounter, rowCounter);
        CollectingDeadLetterSink<Chunk> crashed = new CollectingDeadLetterSink<>();
        Retrier retrier = new Retrier(retryPolicy, time, (attempt, error, next) -> {
            if (next == Retrier.State.WAITING) {
                retryCounter.inc();
                log.info("{} attempt {} failed ({}); backing off", key, attempt, error.getMessage());
            }
        });
        log.info("Fetching {} in {} chunk(s) over {} range(s)", key, chunks.size(), subRanges.size());
        new PipelineBuilder<Chunk, ChunkOutcome>()
                .name("fetch")
                .source(chunks)
                .transform(new ChunkFetchTransform(client, limiter, retrier, validator, calendar, run, chunkCounter))
                .sink(sink)
                .workers(Math.min(workers, chunks.size()))
                .queueCapacity(Math.max(4, workers * 2))
                .sinkBatchSize(1)
                .deadLetterIn(crashed)
                .cancellation(run)
                .metrics(registry)
                .build()
                .run();
        FetchReport report = FetchReport.of(key, complete(chunks, sink, crashed));
        log.info("Fetched {}: {} of {} chunk(s) committed, {} row(s), status {}", key,
                report.committedRanges().size(), chunks.size(), report.rowsCommitted(), report.status());
        return report;
    }

    /** Chunks the sink never saw were discarded by cancellation or crashed in the transform. */
    private List<ChunkOutcome> complete(List<Chunk> chunks, ChunkCommitSink sink, CollectingDeadLetterSink<Chunk> crashed) {
        Map<Integer, ChunkOutcome> byIndex = new HashMap<>();
        for (ChunkOutcome o : sink.outcomes()) byIndex.put(o.chunk().index(), o);
        for (CollectingDeadLetterSink.Failure<Chunk> f : crashed.failures()) {
            Record<Chunk> r = f.record();
            failureCounter.inc();
            byIndex.putIfAbsent(r.payload().index(), ChunkOutcome.of(r.payload(), ChunkOutcome.Status.ERROR, 1, String.valueOf(f.error())));
        }
        List<ChunkOutcome> out = new ArrayList<>(chunks.size());
        for (Chunk c : chunks) {
            ChunkOutcome o = byIndex.get(c.index());
            if (o == null) {
                o = sink.halt() != null
                        ? ChunkOutcome.of(c, ChunkOutcome.Status.HALTED, 0, sink.halt().getMessage())
                        : ChunkOutcome.of(c, ChunkOutcome.Status.CANCELLED, 0, "cancelled");
            }
            out.add(o);
        }
        return out;
    }
}
