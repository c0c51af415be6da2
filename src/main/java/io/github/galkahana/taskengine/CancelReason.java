package io.github.galkahana.taskengine;

/**
 * Why a {@link CancellationToken} was cancelled.
 */
public enum CancelReason {
    /** Not cancelled. */
    NONE,
    /** The token's deadline elapsed. */
    TIMEOUT,
    /** Someone called {@link CancellationToken#cancel()}, or a pool was shut down without draining. */
    EXPLICIT
}
