package io.barsync.marketdata.fetch;

import com.codahale.metrics.Counter;
import io.barsync.budget.RateLimiter;
import io.barsync.core.Record;
import io.barsync.core.Transform;
import io.barsync.marketdata.model.RawBar;
import io.barsync.marketdata.plan.TradingCalendar;
import io.barsync.marketdata.validate.BarValidator;
import io.barsync.marketdata.validate.SegmentRules;
import io.barsync.marketdata.validate.ValidationReport;
import io.barsync.retry.Retrier;
import io.barsync.runtime.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fetches and validates one chunk. Every attempt, retries included, takes a token from the shared limiter.
 * Chunks spanning no trading day are passed on without a request.
 */
class ChunkFetchTransform implements Transform<Chunk, ChunkOutcome> {
    private static final Logger log = LoggerFactory.getLogger(ChunkFetchTransform.class);

    private final UpstreamClient client;
    private final RateLimiter limiter;
    private final Retrier retrier;
    private final BarValidator validator;
    private final TradingCalendar calendar;
    private final CancellationToken cancellation;
    private final Counter chunks;

    ChunkFetchTransform(UpstreamClient client, RateLimiter limiter, Retrier retrier, BarValidator validator,
                        TradingCalendar calendar, CancellationToken cancellation, Counter chunks) {
        this.client = client;
        this.limiter = limiter;
        this.retrier = retrier;
        this.validator = validator;
        this.calendar = calendar;
        this.cancellation = cancellation;
        this.chunks = chunks;
    }

    @Override
    public List<Record<ChunkOutcome>> apply(Record<Chunk> in) throws InterruptedException {
        return List.of(in.derive(0, fetch(in.payload())));
    }

    private ChunkOutcome fetch(Chunk chunk) throws InterruptedException {
        if (cancellation.isCancelled()) return ChunkOutcome.of(chunk, ChunkOutcome.Status.CANCELLED, 0, cancellation.reason());
        chunks.inc();
        if (!calendar.containsTradingDay(chunk.range(), chunk.key().exchange().zone())) {
            log.debug("Skipping request for {}: no trading days", chunk);
            return ChunkOutcome.of(chunk, ChunkOutcome.Status.NO_TRADING_DAYS, 0, null);
        }
        Retrier.Outcome<List<RawBar>> fetched = retrier.run(() -> {
            limiter.acquire();
            if (cancellation.isCancelled()) {
                limiter.release();
                throw new ChunkCancelled();
            }
            return client.fetchBars(chunk.key(), chunk.start(), chunk.end());
        });
        switch (fetched.state()) {
            case SUCCEEDED -> {
                ValidationReport report = validator.validate(fetched.value(), SegmentRules.forSegment(chunk.key().segment()),
                        chunk.range(), chunk.key().interval());
                if (!report.verdict().storable()) {
                    log.warn("Chunk {} failed validation: {}", chunk, report.errors());
                    return new ChunkOutcome(chunk, ChunkOutcome.Status.VALIDATION_FAILED, report, fetched.attempts(), 0,
                            String.join("; ", report.errors()));
                }
                return new ChunkOutcome(chunk, ChunkOutcome.Status.FETCHED, report, fetched.attempts(), 0, null);
            }
            case EXHAUSTED -> {
                log.warn("Chunk {} still failing after {} attempt(s): {}", chunk, fetched.attempts(), fetched.lastError().getMessage());
                return ChunkOutcome.of(chunk, ChunkOutcome.Status.TRANSIENT_EXHAUSTED, fetched.attempts(), fetched.lastError().getMessage());
            }
            default -> {
                if (fetched.lastError() instanceof ChunkCancelled) {
                    return ChunkOutcome.of(chunk, ChunkOutcome.Status.CANCELLED, fetched.attempts(), cancellation.reason());
                }
                log.warn("Chunk {} failed permanently: {}", chunk, fetched.lastError().getMessage());
                return ChunkOutcome.of(chunk, ChunkOutcome.Status.PERMANENT_FAILURE, fetched.attempts(), fetched.lastError().getMessage());
            }
        }
    }

    private static final class ChunkCancelled extends Exception {
        ChunkCancelled() { super("cancelled before request", null, false, false); }
    }
}
