package io.github.galkahana.taskengine;

import java.util.Objects;

/**
 * Terminal outcome of one task: success with a value, failure with an error, or cancelled.
 * <p>
 * Every submitted task yields exactly one {@code TaskResult}. Failures raised by the task body itself are
 * plain failures. Throwables that are not {@link Exception}s (assertion errors, stack overflows and the like)
 * are caught at the worker boundary and reported as failures with {@link #recovered()} set.
 *
 * @param status Which variant this is
 * @param value Result value, only meaningful for {@link Status#SUCCESS}
 * @param error Failure cause, only set for {@link Status#FAILURE}
 * @param recovered True when the failure was a fault caught at the worker boundary
 * @param cancelReason Why the task was cancelled, {@link CancelReason#NONE} unless {@link Status#CANCELLED}
 */
public record TaskResult<T>(Status status, T value, Throwable error, boolean recovered, CancelReason cancelReason) {

    public enum Status {
        SUCCESS,
        FAILURE,
        CANCELLED
    }

    public static <T> TaskResult<T> success(T value) {
        return new TaskResult<>(Status.SUCCESS, value, null, false, CancelReason.NONE);
    }

    public static <T> TaskResult<T> failure(Throwable error) {
        return new TaskResult<>(Status.FAILURE, null, Objects.requireNonNull(error, "error"), false, CancelReason.NONE);
    }

    public static <T> TaskResult<T> recovered(Throwable fault) {
        return new TaskResult<>(Status.FAILURE, null, Objects.requireNonNull(fault, "fault"), true, CancelReason.NONE);
    }

    public static <T> TaskResult<T> cancelled(CancelReason reason) {
        if (reason == null || reason == CancelReason.NONE) {
            throw new IllegalArgumentException("A cancelled result needs a cancellation reason");
        }
        return new TaskResult<>(Status.CANCELLED, null, null, false, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
