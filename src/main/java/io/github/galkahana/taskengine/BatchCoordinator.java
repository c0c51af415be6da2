package io.github.galkahana.taskengine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Fan-out/fan-in over a {@link WorkerPool}: runs a batch of tasks under one cancellation token and returns their
 * results in submission order, whatever order they complete in.
 * <p>
 * At most {@code maxInFlight} items of a batch are handed to the pool at a time (the pool size by default). The
 * rest stay pending in the coordinator, so when the batch token is cancelled they are marked
 * {@link TaskResult.Status#CANCELLED} right away and their bodies never run. Items already dispatched finish on
 * their own, or abort if they observe the token. Either way, every index ends up with exactly one result.
 *
 * <pre>{@code
 * BatchCoordinator coordinator = new BatchCoordinator();
 * List<Task<Integer>> tasks = urls.stream()
 *         .map(url -> (Task<Integer>) token -> fetchStatus(url, token))
 *         .toList();
 * List<TaskResult<Integer>> results = coordinator.runBatch(pool, tasks, CancellationToken.create(Duration.ofSeconds(2)));
 * }</pre>
 */
@Slf4j
public class BatchCoordinator {

    private final int maxInFlight;

    /**
     * Coordinator that keeps up to the pool size items of a batch in flight.
     */
    public BatchCoordinator() {
        this(0);
    }

    /**
     * @param maxInFlight Maximum items of one batch handed to the pool at once, 0 to use the pool size
     */
    public BatchCoordinator(int maxInFlight) {
        if (maxInFlight < 0) throw new IllegalArgumentException("maxInFlight must be >= 0, got " + maxInFlight);
        this.maxInFlight = maxInFlight;
    }

    /**
     * Run a batch and return its results, index-aligned with {@code tasks}. Blocks until every index has a result.
     */
    public <T> List<TaskResult<T>> runBatch(WorkerPool pool, List<? extends Task<T>> tasks, CancellationToken token)
            throws InterruptedException {
        return run(pool, tasks, token).results();
    }

    /**
     * Run a batch under a fresh token that times out after {@code timeout}.
     */
    public <T> List<TaskResult<T>> runBatch(WorkerPool pool, List<? extends Task<T>> tasks, Duration timeout)
            throws InterruptedException {
        CancellationToken token = CancellationToken.create(timeout);
        try {
            return runBatch(pool, tasks, token);
        } finally {
            token.release();
        }
    }

    /**
     * Run a batch and report results together with the batch outcome.
     */
    public <T> BatchReport<T> run(WorkerPool pool, List<? extends Task<T>> tasks, CancellationToken token)
            throws InterruptedException {
        return run(pool, tasks, token, (index, result) -> {});
    }

    /**
     * Run a batch, streaming each result to {@code onResult} as it completes.
     *
     * @param onResult Receives (index, result) in completion order, on the thread that recorded the result. Items
     *                 cancelled by a batch timeout are recorded on the shared deadline timer thread, so the
     *                 callback should be fast and must not block
     */
    public <T> BatchReport<T> run(WorkerPool pool, List<? extends Task<T>> tasks, CancellationToken token,
                                  BiConsumer<Integer, TaskResult<T>> onResult) throws InterruptedException {
        Objects.requireNonNull(pool, "pool");
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(onResult, "onResult");

        int window = maxInFlight > 0 ? maxInFlight : pool.size();
        Batch<T> batch = new Batch<>(pool, List.copyOf(tasks), CancellationToken.childOf(token), window, onResult);
        try {
            return batch.run();
        } finally {
            batch.token.release();
        }
    }

    private record WorkItem<T>(int index, Task<T> task, AtomicReference<ItemState> state) {
        WorkItem(int index, Task<T> task) {
            this(index, task, new AtomicReference<>(ItemState.PENDING));
        }

        boolean transition(ItemState from, ItemState to) {
            return state.compareAndSet(from, to);
        }
    }

    private static final class Batch<T> {
        private final WorkerPool pool;
        private final List<WorkItem<T>> items;
        private final CancellationToken token;
        private final int window;
        private final ResultAggregator<T> aggregator;

        private final ReentrantLock lock = new ReentrantLock();
        private final Condition slotFreed = lock.newCondition();
        private int inFlight = 0; // guarded by lock

        private Batch(WorkerPool pool, List<Task<T>> tasks, CancellationToken token, int window,
                      BiConsumer<Integer, TaskResult<T>> onResult) {
            this.pool = pool;
            this.token = token;
            this.window = window;
            this.aggregator = new ResultAggregator<>(tasks.size(), onResult);
            this.items = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                items.add(new WorkItem<>(i, tasks.get(i)));
            }
        }

        private BatchReport<T> run() throws InterruptedException {
            long startNanos = System.nanoTime();
            log.debug("Running batch of {} tasks, {} in flight at most", items.size(), window);

            CancellationToken.Registration onCancel = token.onCancel(this::cancelPending);
            try {
                dispatchAll();
                aggregator.await();
            } catch (InterruptedException e) {
                log.warn("Interrupted while running batch, cancelling remaining items");
                token.cancel(CancelReason.EXPLICIT);
                throw e;
            } finally {
                onCancel.close();
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            ResultAggregator.Summary summary = aggregator.summary();
            BatchOutcome outcome = summary.cancelled() == 0 ? BatchOutcome.ALL_COMPLETED
                    : token.reason() == CancelReason.TIMEOUT ? BatchOutcome.TIMED_OUT
                    : BatchOutcome.PARTIALLY_CANCELLED;

            log.debug("Batch finished as {} in {} ms: succeeded={}, failed={}, cancelled={}", outcome,
                    elapsed.toMillis(), summary.succeeded(), summary.failed(), summary.cancelled());
            return new BatchReport<>(aggregator.collect(), outcome, summary, elapsed);
        }

        private void dispatchAll() throws InterruptedException {
            for (WorkItem<T> item : items) {
                if (!acquireSlot()) return;
                if (!item.transition(ItemState.PENDING, ItemState.DISPATCHED)) {
                    // cancelled between acquiring the slot and dispatching
                    releaseSlot();
                    return;
                }

                CompletableFuture<TaskResult<T>> future;
                try {
                    future = pool.submit(item.task(), token);
                } catch (IllegalStateException e) {
                    log.warn("Pool rejected batch item {}, cancelling the rest of the batch: {}", item.index(), e.getMessage());
                    finish(item, TaskResult.cancelled(CancelReason.EXPLICIT));
                    token.cancel(CancelReason.EXPLICIT);
                    return;
                } catch (InterruptedException e) {
                    finish(item, TaskResult.cancelled(CancelReason.EXPLICIT));
                    throw e;
                }

                future.whenComplete((result, error) -> {
                    try {
                        finish(item, result != null ? result : TaskResult.recovered(error));
                    } catch (RuntimeException e) {
                        log.error("Failed to record result of batch item {}", item.index(), e);
                        throw e;
                    }
                });
            }
        }

        private boolean acquireSlot() throws InterruptedException {
            lock.lock();
            try {
                while (inFlight >= window && !token.isCancelled()) {
                    slotFreed.await();
                }
                if (token.isCancelled()) return false;
                inFlight++;
                return true;
            } finally {
                lock.unlock();
            }
        }

        private void releaseSlot() {
            lock.lock();
            try {
                inFlight--;
                slotFreed.signalAll();
            } finally {
                lock.unlock();
            }
        }

        private void finish(WorkItem<T> item, TaskResult<T> result) {
            ItemState terminal = ItemState.of(result);
            if (!item.transition(ItemState.DISPATCHED, terminal)) {
                throw new IllegalStateException("Batch item " + item.index() + " finished twice, state was "
                        + item.state().get());
            }
            aggregator.record(item.index(), result);
            releaseSlot();
        }

        private void cancelPending() {
            CancelReason reason = token.reason();
            int cancelled = 0;
            for (WorkItem<T> item : items) {
                if (item.transition(ItemState.PENDING, ItemState.CANCELLED)) {
                    aggregator.record(item.index(), TaskResult.cancelled(reason));
                    cancelled++;
                }
            }
            if (cancelled > 0) log.info("Batch cancelled ({}), {} pending items will not run", reason, cancelled);

            lock.lock();
            try {
                slotFreed.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
