package io.barsync.runtime;

/**
 * Totals for one pipeline run.
 *
 * @param polled    inputs taken from the source
 * @param emitted   outputs handed to the sink
 * @param failed    inputs whose transform failed after retries
 * @param sinkErrors outputs the sink rejected
 * @param discarded outputs dropped because the run was cancelled
 */
public record PipelineStats(long polled, long emitted, long failed, long sinkErrors, long discarded, boolean cancelled) {
}
