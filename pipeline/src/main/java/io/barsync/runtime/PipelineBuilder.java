package io.barsync.runtime;

import com.codahale.metrics.MetricRegistry;
import io.barsync.budget.TimeSource;
import io.barsync.core.Sink;
import io.barsync.core.Source;
import io.barsync.core.Transform;
import io.barsync.error.DeadLetterSink;
import io.barsync.metrics.Metrics;
import io.barsync.retry.RetryPolicy;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

public class PipelineBuilder<I, O> {
    private String name = "pipeline";
    private Source<I> source;
    private Supplier<? extends Transform<I, O>> transforms;
    private Sink<O> sink;
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private TimeSource time = TimeSource.SYSTEM;
    private int workers = 4;
    private int queueCapacity = 1024;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> dlqIn;
    private int sinkBatchSize = 16;
    private CancellationToken cancellation = new CancellationToken();

    public PipelineBuilder<I, O> name(String n) { this.name = n; return this; }
    public PipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public PipelineBuilder<I, O> source(List<I> items) { this.source = Source.of(items); return this; }

    /** One transform shared by all workers; it must be thread-safe and is not closed by the pipeline. */
    public PipelineBuilder<I, O> transform(Transform<I, O> t) {
        Objects.requireNonNull(t, "transform");
        this.transforms = () -> t::apply;
        return this;
    }

    /** A fresh transform per worker, closed when that worker exits. */
    public PipelineBuilder<I, O> transformPerWorker(Supplier<? extends Transform<I, O>> factory) { this.transforms = factory; return this; }

    public PipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public PipelineBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public PipelineBuilder<I, O> time(TimeSource t) { this.time = t; return this; }
    public PipelineBuilder<I, O> workers(int w) { this.workers = w; return this; }
    public PipelineBuilder<I, O> queueCapacity(int c) { this.queueCapacity = c; return this; }
    public PipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public PipelineBuilder<I, O> deadLetterIn(DeadLetterSink<I> d) { this.dlqIn = d; return this; }
    public PipelineBuilder<I, O> sinkBatchSize(int n) { this.sinkBatchSize = Math.max(1, n); return this; }
    public PipelineBuilder<I, O> cancellation(CancellationToken c) { this.cancellation = c; return this; }

    public Pipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transforms, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(cancellation, "cancellation");
        return new Pipeline<>(name, source, transforms, sink, retryPolicy, time, workers, queueCapacity, sinkBatchSize,
                new Metrics(metricRegistry), dlqIn, cancellation);
    }
}
