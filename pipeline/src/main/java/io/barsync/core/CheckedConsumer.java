package io.barsync.core;

/** Consumer that may throw a checked exception. */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T value) throws Exception;
}
