package io.github.galkahana.taskengine;

/**
 * Snapshot of a {@link WorkerPool}'s counters.
 *
 * @param submitted Total tasks accepted by submit
 * @param succeeded Tasks that completed successfully
 * @param failed Tasks that failed, including recovered faults
 * @param recovered Failures that were faults caught at the worker boundary
 * @param cancelled Tasks that ended cancelled, whether or not their body ran
 * @param queued Tasks waiting in the work queue
 * @param active Tasks currently executing
 */
public record PoolStats(int submitted, int succeeded, int failed, int recovered, int cancelled,
                        int queued, int active) {

    public int finished() {
        return succeeded + failed + cancelled;
    }
}
