package io.barsync.runtime;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.barsync.budget.TimeSource;
import io.barsync.core.BatchSink;
import io.barsync.core.Record;
import io.barsync.core.Sink;
import io.barsync.core.Source;
import io.barsync.core.Transform;
import io.barsync.error.DeadLetterSink;
import io.barsync.metrics.Metrics;
import io.barsync.retry.Retrier;
import io.barsync.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Single-source -> transform workers -> single ordered sink.
 * <p>
 * Each worker owns its own transform instance. Results are released to the sink strictly in source seq
 * order through a reorder buffer, so the sink observes a deterministic sequence regardless of which worker
 * finished first. A failed input still occupies its seq slot (as an empty batch) so later results are not held
 * back. {@link #run()} blocks the calling thread, which acts as the sink thread.
 */
public class Pipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);
    private static final long DRAIN_POLL_MILLIS = 20;

    private final String name;
    private final Source<I> source;
    private final Supplier<? extends Transform<I, O>> transforms;
    private final Sink<O> sink;
    private final RetryPolicy retryPolicy;
    private final TimeSource time;
    private final int workers;
    private final int queueCapacity;
    private final int sinkBatchSize;
    private final DeadLetterSink<I> dlqIn;
    private final CancellationToken cancellation;

    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;
    private final Counter retryCounter;

    private final AtomicLong polled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private long emitted;
    private long sinkErrors;
    private long discarded;

    Pipeline(String name,
             Source<I> source,
             Supplier<? extends Transform<I, O>> transforms,
             Sink<O> sink,
             RetryPolicy retryPolicy,
             TimeSource time,
             int workers,
             int queueCapacity,
             int sinkBatchSize,
             Metrics metrics,
             DeadLetterSink<I> dlqIn,
             CancellationToken cancellation) {
        this.name = Objects.requireNonNull(name);
        this.source = Objects.requireNonNull(source);
        this.transforms = Objects.requireNonNull(transforms);
        this.sink = Objects.requireNonNull(sink);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.time = Objects.requireNonNull(time);
        this.workers = Math.max(1, workers);
        this.queueCapacity = Math.max(1, queueCapacity);
        this.sinkBatchSize = Math.max(1, sinkBatchSize);
        this.dlqIn = dlqIn;
        this.cancellation = Objects.requireNonNull(cancellation);
        Metrics scoped = metrics.scoped(name);
        this.transformTimer = scoped.timer("transform.time");
        this.sinkTimer = scoped.timer("sink.time");
        this.inMeter = scoped.meter("input.rate");
        this.outMeter = scoped.meter("output.rate");
        this.errorMeter = scoped.meter("error.rate");
        this.retryCounter = scoped.counter("retries");
    }

    /**
     * Runs until the source is exhausted (or the run is cancelled) and every produced result has been
     * offered to the sink.
     */
    public PipelineStats run() throws InterruptedException {
        BlockingQueue<Batch<O>> queue = new ArrayBlockingQueue<>(queueCapacity);
        AtomicInteger live = new AtomicInteger(workers);
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, name + "-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            for (int i = 0; i < workers; i++) {
                pool.submit(() -> runWorker(queue, live));
            }
            drainInOrder(queue, live);
        } finally {
            pool.shutdownNow();
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Pipeline {} workers did not stop within 10s", name);
            }
        }
        PipelineStats stats = new PipelineStats(polled.get(), emitted, failed.get(), sinkErrors, discarded,
                cancellation.isCancelled());
        log.debug("Pipeline {} finished: {}", name, stats);
        return stats;
    }

    private void runWorker(BlockingQueue<Batch<O>> queue, AtomicInteger live) {
        try (Transform<I, O> transform = transforms.get()) {
            while (!cancellation.isCancelled()) {
                Optional<Record<I>> next = pollSource();
                if (next.isEmpty()) {
                    if (sourceFinished()) break;
                    time.sleepMillis(1);
                    continue;
                }
                Record<I> in = next.get();
                polled.incrementAndGet();
                inMeter.mark();
                queue.put(process(transform, in));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Pipeline {} worker failed to release its transform", name, e);
        } finally {
            live.decrementAndGet();
        }
    }

    private Optional<Record<I>> pollSource() {
        synchronized (source) {
            return source.poll();
        }
    }

    private boolean sourceFinished() {
        synchronized (source) {
            return source.isFinished();
        }
    }

    private Batch<O> process(Transform<I, O> transform, Record<I> in) throws InterruptedException {
        Retrier retrier = new Retrier(retryPolicy, time, (attempt, error, next) -> {
            if (next == Retrier.State.WAITING) {
                retryCounter.inc();
                log.debug("Pipeline {} retrying seq {} after attempt {}: {}", name, in.seq(), attempt, error.toString());
            }
        });
        Retrier.Outcome<List<Record<O>>> outcome;
        try (Timer.Context ignored = transformTimer.time()) {
            outcome = retrier.run(() -> transform.apply(in));
        }
        if (outcome.succeeded()) {
            List<Record<O>> outputs = outcome.value() == null ? new ArrayList<>() : new ArrayList<>(outcome.value());
            outputs.sort(Comparator.comparingInt(Record::subSeq));
            return Batch.of(in.seq(), outputs);
        }
        failed.incrementAndGet();
        errorMeter.mark();
        log.warn("Pipeline {} dropped seq {} after {} attempt(s): {}", name, in.seq(), outcome.attempts(),
                String.valueOf(outcome.lastError()));
        if (dlqIn != null) dlqIn.acceptFailure("transform", in, outcome.lastError());
        return Batch.of(in.seq(), List.of());
    }

    private void drainInOrder(BlockingQueue<Batch<O>> queue, AtomicInteger live) throws InterruptedException {
        TreeMap<Long, Batch<O>> pending = new TreeMap<>();
        List<Record<O>> emitBuffer = new ArrayList<>();
        long expectedSeq = 0;
        while (true) {
            Batch<O> batch = queue.poll(DRAIN_POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (batch != null) {
                pending.put(batch.seq(), batch);
            } else if (live.get() == 0 && queue.isEmpty()) {
                break;
            }
            Batch<O> ready;
            while ((ready = pending.remove(expectedSeq)) != null) {
                emit(ready, emitBuffer);
                expectedSeq++;
            }
        }
        if (!pending.isEmpty()) {
            log.warn("Pipeline {} releasing {} batch(es) after a seq gap at {}", name, pending.size(), expectedSeq);
            for (Map.Entry<Long, Batch<O>> e : pending.entrySet()) emit(e.getValue(), emitBuffer);
        }
        flush(emitBuffer);
    }

    private void emit(Batch<O> batch, List<Record<O>> emitBuffer) {
        for (Record<O> next : batch.items()) {
            if (cancellation.isCancelled()) {
                discarded++;
                continue;
            }
            emitBuffer.add(next);
            if (emitBuffer.size() >= sinkBatchSize) flush(emitBuffer);
        }
    }

    private void flush(List<Record<O>> records) {
        if (records.isEmpty()) return;
        if (cancellation.isCancelled()) {
            discarded += records.size();
            records.clear();
            return;
        }
        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> bs) {
                bs.acceptBatch(records);
                emitted += records.size();
                outMeter.mark(records.size());
            } else {
                for (Record<O> r : records) {
                    sink.accept(r);
                    emitted++;
                    outMeter.mark();
                }
            }
        } catch (Exception e) {
            int rejected = sink instanceof BatchSink<O> ? records.size() : 1;
            sinkErrors += rejected;
            errorMeter.mark();
            log.warn("Pipeline {} sink rejected {} record(s): {}", name, rejected, e.toString());
        } finally {
            records.clear();
        }
    }

    record Batch<T>(long seq, List<Record<T>> items) {
        static <T> Batch<T> of(long seq, List<Record<T>> items) { return new Batch<>(seq, items); }
    }
}
