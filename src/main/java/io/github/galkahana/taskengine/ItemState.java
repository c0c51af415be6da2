package io.github.galkahana.taskengine;

/**
 * Lifecycle of one item inside a batch: {@code PENDING -> DISPATCHED -> COMPLETED | FAILED | CANCELLED},
 * or {@code PENDING -> CANCELLED} when the batch is cancelled before the item is handed to the pool.
 */
public enum ItemState {
    PENDING,
    DISPATCHED,
    COMPLETED,
    FAILED,
    CANCELLED;

    static ItemState of(TaskResult<?> result) {
        return switch (result.status()) {
            case SUCCESS -> COMPLETED;
            case FAILURE -> FAILED;
            case CANCELLED -> CANCELLED;
        };
    }
}
