package io.github.galkahana.taskengine;

/**
 * Batch-level end state.
 */
public enum BatchOutcome {
    /** Every item ran to completion, successfully or not. */
    ALL_COMPLETED,
    /** Some items were cancelled explicitly, by the caller or by a pool shutdown. */
    PARTIALLY_CANCELLED,
    /** The batch token's deadline elapsed before every item ran. */
    TIMED_OUT
}
