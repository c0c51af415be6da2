package io.github.galkahana.taskengine;

import java.time.Duration;

/**
 * Construction-time settings of a {@link WorkerPool}. None of them change for the lifetime of the pool.
 *
 * @param size Number of concurrent worker threads, at least 1
 * @param queueCapacity Capacity of the work queue. 0 means unbounded. When bounded, submitters block while
 *                      the queue is full (backpressure)
 * @param maxRetries Retry attempts for a task that fails with an exception, 0 to disable retries
 * @param retryWait Pause between retry attempts
 * @param threadNamePrefix Prefix of worker thread names
 */
public record PoolConfig(int size, int queueCapacity, int maxRetries, Duration retryWait, String threadNamePrefix) {

    public static final String DEFAULT_THREAD_NAME_PREFIX = "task-engine-worker";
    public static final Duration DEFAULT_RETRY_WAIT = Duration.ofMillis(50);

    public PoolConfig {
        if (size < 1) throw new IllegalArgumentException("Pool size must be >= 1, got " + size);
        if (queueCapacity < 0) throw new IllegalArgumentException("Queue capacity must be >= 0, got " + queueCapacity);
        if (maxRetries < 0) throw new IllegalArgumentException("Max retries must be >= 0, got " + maxRetries);
        if (retryWait == null) retryWait = DEFAULT_RETRY_WAIT;
        if (retryWait.isNegative()) throw new IllegalArgumentException("Retry wait must not be negative");
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) threadNamePrefix = DEFAULT_THREAD_NAME_PREFIX;
    }

    /**
     * Unbounded queue, no retries.
     */
    public static PoolConfig of(int size) {
        return new PoolConfig(size, 0, 0, DEFAULT_RETRY_WAIT, DEFAULT_THREAD_NAME_PREFIX);
    }

    /**
     * Bounded queue, no retries.
     */
    public static PoolConfig bounded(int size, int queueCapacity) {
        return new PoolConfig(size, queueCapacity, 0, DEFAULT_RETRY_WAIT, DEFAULT_THREAD_NAME_PREFIX);
    }

    public PoolConfig withRetries(int retries, Duration wait) {
        return new PoolConfig(size, queueCapacity, retries, wait, threadNamePrefix);
    }

    public PoolConfig withThreadNamePrefix(String prefix) {
        return new PoolConfig(size, queueCapacity, maxRetries, retryWait, prefix);
    }

    public boolean isBounded() {
        return queueCapacity > 0;
    }
}
