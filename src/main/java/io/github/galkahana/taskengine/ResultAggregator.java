package io.github.galkahana.taskengine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiConsumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Write-once, index-addressed collection of task results.
 * <p>
 * Results arrive in completion order from any thread and are stored at their submission index. Each slot may
 * be written exactly once. A second write is a caller bug and fails loudly. Slot writes are lock-free, only the
 * completion counter is shared.
 *
 * @param <T> Result value type
 */
@Slf4j
public class ResultAggregator<T> {

    private final AtomicReferenceArray<TaskResult<T>> slots;
    private final AtomicInteger recorded = new AtomicInteger(0);
    private final CountDownLatch complete;
    private final ConcurrentLinkedQueue<Integer> arrivals = new ConcurrentLinkedQueue<>();
    private final BiConsumer<Integer, TaskResult<T>> onRecord;

    /**
     * @param size Number of results expected
     */
    public ResultAggregator(int size) {
        this(size, (index, result) -> {});
    }

    /**
     * @param size Number of results expected
     * @param onRecord Called with every recorded result, in completion order, on the recording thread
     */
    public ResultAggregator(int size, BiConsumer<Integer, TaskResult<T>> onRecord) {
        if (size < 0) throw new IllegalArgumentException("Aggregator size must be >= 0, got " + size);
        this.slots = new AtomicReferenceArray<>(size);
        this.complete = new CountDownLatch(size);
        this.onRecord = Objects.requireNonNull(onRecord, "onRecord");
    }

    /**
     * Store the result for an index.
     *
     * @throws IndexOutOfBoundsException If the index is outside {@code [0, size)}
     * @throws IllegalStateException If the index was already recorded
     */
    public void record(int index, TaskResult<T> result) {
        Objects.requireNonNull(result, "result");
        Objects.checkIndex(index, slots.length());
        if (!slots.compareAndSet(index, null, result)) {
            throw new IllegalStateException("Result for index " + index + " was already recorded as "
                    + slots.get(index).status() + ", refusing to overwrite with " + result.status());
        }
        arrivals.add(index);
        recorded.incrementAndGet();
        complete.countDown();

        try {
            onRecord.accept(index, result);
        } catch (RuntimeException e) {
            log.warn("Result listener failed for index {}", index, e);
        }
    }

    public int size() {
        return slots.length();
    }

    public int recordedCount() {
        return recorded.get();
    }

    public boolean isRecorded(int index) {
        return slots.get(index) != null;
    }

    public boolean isComplete() {
        return recorded.get() == slots.length();
    }

    /**
     * Block until every index is recorded.
     */
    public void await() throws InterruptedException {
        complete.await();
    }

    /**
     * Block until every index is recorded or the wait elapses.
     *
     * @return true if complete
     */
    public boolean await(Duration wait) throws InterruptedException {
        return complete.await(TimeUnit.NANOSECONDS.convert(wait), TimeUnit.NANOSECONDS);
    }

    /**
     * @return All results in submission order
     * @throws IllegalStateException If not every index has been recorded yet
     */
    public List<TaskResult<T>> collect() {
        if (!isComplete()) {
            throw new IllegalStateException("Cannot collect results: only " + recorded.get() + " of "
                    + slots.length() + " recorded");
        }
        List<TaskResult<T>> results = new ArrayList<>(slots.length());
        for (int i = 0; i < slots.length(); i++) {
            results.add(slots.get(i));
        }
        return List.copyOf(results);
    }

    /**
     * @return Indices recorded so far, in the order their results arrived
     */
    public List<Integer> completionOrder() {
        return List.copyOf(arrivals);
    }

    /**
     * Count results recorded so far by status. Usable before completion for partial progress.
     */
    public Summary summary() {
        int succeeded = 0, failed = 0, recoveredFaults = 0, cancelled = 0;
        for (int i = 0; i < slots.length(); i++) {
            TaskResult<T> result = slots.get(i);
            if (result == null) continue;
            switch (result.status()) {
                case SUCCESS -> succeeded++;
                case FAILURE -> {
                    failed++;
                    if (result.recovered()) recoveredFaults++;
                }
                case CANCELLED -> cancelled++;
            }
        }
        return new Summary(slots.length(), succeeded, failed, recoveredFaults, cancelled);
    }

    /**
     * Result counts of an aggregator.
     *
     * @param total Expected number of results
     * @param succeeded Successful results
     * @param failed Failed results, recovered faults included
     * @param recovered Failed results that were faults caught at the worker boundary
     * @param cancelled Cancelled results
     */
    public record Summary(int total, int succeeded, int failed, int recovered, int cancelled) {
        public int recorded() {
            return succeeded + failed + cancelled;
        }

        public int missing() {
            return total - recorded();
        }
    }
}
