package io.github.galkahana.taskengine;

/**
 * Thrown by {@link CancellationToken#throwIfCancelled()} so a task body can abort cooperatively.
 * <p>
 * Workers translate it into {@link TaskResult#cancelled(CancelReason)} instead of a failure, so callers
 * can tell "didn't finish because of cancellation" apart from "ran and failed".
 */
public class TaskCancelledException extends RuntimeException {

    private final CancelReason reason;

    public TaskCancelledException(CancelReason reason) {
        super("Task cancelled: " + reason);
        this.reason = reason;
    }

    public CancelReason getReason() {
        return reason;
    }
}
