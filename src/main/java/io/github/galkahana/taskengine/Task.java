package io.github.galkahana.taskengine;

/**
 * A unit of work executed by a {@link WorkerPool}.
 * <p>
 * The body receives the token governing its execution. Long-running bodies should observe it
 * (for example with {@link CancellationToken#throwIfCancelled()}) to abort promptly, since the engine never
 * interrupts a running task. Any per-task input should be captured by value when the task is built, not read
 * from shared mutable state.
 *
 * @param <T> Result type
 */
@FunctionalInterface
public interface Task<T> {
    T execute(CancellationToken token) throws Exception;
}
