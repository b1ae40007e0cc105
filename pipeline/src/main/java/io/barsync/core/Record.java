package io.barsync.core;

/**
 * Carries a payload plus the ordering coordinates the runtime uses to emit results deterministically.
 *
 * @param seq    position assigned by the source, monotonically increasing from zero
 * @param subSeq position among the outputs a transform produced for one input
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {

    public static <T> Record<T> of(long seq, T payload) { return new Record<>(seq, 0, payload); }

    /** Output record that keeps this record's seq. */
    public <R> Record<R> derive(int subSeq, R payload) { return new Record<>(seq, subSeq, payload); }

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(this.seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(this.subSeq, o.subSeq);
    }
}
