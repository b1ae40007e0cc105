package io.barsync.error;

import io.barsync.core.Record;

import java.util.ArrayList;
import java.util.List;

/** Keeps failures in memory; used when the caller reports them itself. */
public class CollectingDeadLetterSink<T> implements DeadLetterSink<T> {
    public record Failure<T>(String stage, Record<T> record, Exception error) {}

    private final List<Failure<T>> failures = new ArrayList<>();

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, Exception e) {
        failures.add(new Failure<>(stage, record, e));
    }

    public synchronized List<Failure<T>> failures() { return List.copyOf(failures); }
}
