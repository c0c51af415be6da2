package io.github.galkahana.taskengine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size worker pool with a FIFO work queue, backpressure, per-task cancellation and optional retry.
 * <p>
 * Each submission yields a future that always completes with exactly one {@link TaskResult}, never
 * exceptionally. A task body that throws, even an {@link Error}, is reported as a failure and the worker moves
 * on to the next task. When the queue is bounded and full, {@link #submit} blocks until space frees up.
 * <p>
 * The pool is meant to be created once and reused for many batches. See {@link BatchCoordinator} for running a
 * batch with ordered results.
 */
@Slf4j
public class WorkerPool implements AutoCloseable {

    private final PoolConfig config;
    private final Retry retry;
    private final ThreadPoolExecutor executor;
    private final CancellationToken poolToken = CancellationToken.create();

    private volatile boolean running = true;
    private boolean aborted = false; // guarded by this

    private final AtomicLong taskIds = new AtomicLong(0);
    private final AtomicInteger tasksSubmitted = new AtomicInteger(0);
    private final AtomicInteger tasksSucceeded = new AtomicInteger(0);
    private final AtomicInteger tasksFailed = new AtomicInteger(0);
    private final AtomicInteger tasksRecovered = new AtomicInteger(0);
    private final AtomicInteger tasksCancelled = new AtomicInteger(0);

    /**
     * Create a pool with an unbounded queue and no retries.
     *
     * @param size Number of concurrent worker threads, at least 1
     */
    public WorkerPool(int size) {
        this(PoolConfig.of(size));
    }

    public WorkerPool(PoolConfig config) {
        this.config = Objects.requireNonNull(config, "config");

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(config.maxRetries() + 1)
                .waitDuration(config.retryWait())
                .retryOnException(e -> !(e instanceof InterruptedException) && !(e instanceof TaskCancelledException))
                .build();
        this.retry = Retry.of(config.threadNamePrefix() + "-retry", retryConfig);

        BlockingQueue<Runnable> queue = config.isBounded()
                ? new LinkedBlockingQueue<>(config.queueCapacity())
                : new LinkedBlockingQueue<>();
        executor = new ThreadPoolExecutor(config.size(), config.size(), 0L, TimeUnit.MILLISECONDS,
                queue, new WorkerThreadFactory(config.threadNamePrefix()));
        executor.setRejectedExecutionHandler((runnable, exec) -> {
            if (exec.isShutdown()) throw new RejectedExecutionException("Executor is shut down");
            try {
                exec.getQueue().put(runnable);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RejectedExecutionException("Interrupted while waiting for queue space", e);
            }
            // Shutdown may have raced the blocked put, and terminated workers would never pick the item up
            if (exec.isShutdown() && exec.getQueue().remove(runnable)) {
                throw new RejectedExecutionException("Executor shut down while waiting for queue space");
            }
        });

        log.info("Started worker pool with {} workers, queue capacity {}, max retries {}",
                config.size(), config.isBounded() ? config.queueCapacity() : "unbounded", config.maxRetries());
    }

    /**
     * Submit a task that can only be cancelled by shutting the pool down.
     */
    public <T> CompletableFuture<TaskResult<T>> submit(Task<T> task) throws InterruptedException {
        return submit(task, CancellationToken.create());
    }

    /**
     * Submit a task. Thread-safe. Blocks while a bounded queue is full.
     * <p>
     * The task runs under a child of {@code token}. If that token is cancelled before a worker picks the task up,
     * the body is never invoked and the result is {@link TaskResult.Status#CANCELLED}.
     *
     * @param task Task to run
     * @param token Token the task observes
     * @return Future completing with the task's single result
     * @throws IllegalStateException If the pool is shut down
     * @throws InterruptedException If interrupted while waiting for queue space
     */
    public <T> CompletableFuture<TaskResult<T>> submit(Task<T> task, CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(token, "token");
        if (!running) throw new IllegalStateException("Pool is shut down");

        WorkItem<T> item = new WorkItem<>(taskIds.incrementAndGet(), task, CancellationToken.childOf(token));
        item.poolLink = poolToken.onCancel(() -> item.token.cancel(CancelReason.EXPLICIT));

        tasksSubmitted.incrementAndGet();
        try {
            executor.execute(item);
        } catch (RejectedExecutionException e) {
            tasksSubmitted.decrementAndGet();
            item.release();
            if (e.getCause() instanceof InterruptedException) throw (InterruptedException) e.getCause();
            throw new IllegalStateException("Task submission rejected, pool is shut down", e);
        }
        return item.future;
    }

    /**
     * Stop accepting tasks. Repeating a call of the same mode has no effect. An immediate shutdown may follow
     * a draining one that is still waiting, and cuts the drain short; a draining shutdown after an immediate
     * one returns at once.
     *
     * @param drain If true, block until queued and in-flight tasks finish. If false, complete queued tasks as
     *              cancelled, cancel the tokens of in-flight tasks and return without waiting
     */
    public void shutdown(boolean drain) throws InterruptedException {
        synchronized (this) {
            if (drain ? !running : aborted) return;
            running = false;
            if (!drain) aborted = true;
        }

        if (drain) {
            log.info("Shutdown requested, draining {} queued tasks", executor.getQueue().size());
            executor.shutdown();
            executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
            logFinalStats();
            return;
        }

        log.info("Immediate shutdown requested");
        poolToken.cancel(CancelReason.EXPLICIT);

        List<Runnable> pending = new ArrayList<>();
        executor.getQueue().drainTo(pending);
        for (Runnable runnable : pending) {
            abandon((WorkItem<?>) runnable);
        }
        if (!pending.isEmpty()) log.info("Discarded {} pending tasks", pending.size());

        // No interrupts: in-flight tasks stop only if they observe their token
        executor.shutdown();
    }

    /**
     * Wait for the workers to stop after {@link #shutdown(boolean)}.
     *
     * @return true if all workers stopped within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return executor.awaitTermination(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
    }

    /**
     * Same as {@code shutdown(true)}.
     */
    @Override
    public void close() throws InterruptedException {
        shutdown(true);
    }

    public int size() {
        return config.size();
    }

    public boolean isShutdown() {
        return !running;
    }

    /**
     * Get current processing statistics.
     */
    public PoolStats getStats() {
        return new PoolStats(tasksSubmitted.get(), tasksSucceeded.get(), tasksFailed.get(), tasksRecovered.get(),
                tasksCancelled.get(), executor.getQueue().size(), executor.getActiveCount());
    }

    private <T> void runItem(WorkItem<T> item) {
        TaskResult<T> result = null;
        try {
            result = execute(item);
        } finally {
            complete(item, result != null
                    ? result
                    : TaskResult.recovered(new IllegalStateException("Task " + item.id + " ended without a result")));
        }
    }

    private <T> TaskResult<T> execute(WorkItem<T> item) {
        CancellationToken token = item.token;
        if (token.isCancelled()) {
            log.debug("Task {} cancelled before start ({})", item.id, token.reason());
            return TaskResult.cancelled(token.reason());
        }

        // Failure of the last attempt that ran, reported if cancellation stops the retries
        AtomicReference<Exception> lastFailure = new AtomicReference<>();
        try {
            T value = retry.executeCallable(() -> {
                token.throwIfCancelled();
                log.debug("Processing task {}", item.id);
                try {
                    return item.task.execute(token);
                } catch (TaskCancelledException e) {
                    lastFailure.set(null);
                    throw e;
                } catch (Exception e) {
                    lastFailure.set(e);
                    throw e;
                }
            });
            return TaskResult.success(value);
        } catch (TaskCancelledException e) {
            Exception previous = lastFailure.get();
            if (previous != null) {
                log.warn("Task {} cancelled ({}) before retrying, reporting last failure: {}", item.id,
                        e.getReason(), previous.toString());
                return TaskResult.failure(previous);
            }
            log.debug("Task {} aborted on cancellation ({})", item.id, e.getReason());
            return TaskResult.cancelled(e.getReason());
        } catch (InterruptedException e) {
            log.warn("Task {} interrupted", item.id);
            Thread.currentThread().interrupt();
            return TaskResult.failure(e);
        } catch (Exception e) {
            log.warn("Task {} failed after {} attempts: {}", item.id, config.maxRetries() + 1, e.toString());
            return TaskResult.failure(e);
        } catch (Throwable t) {
            log.error("Task {} crashed, worker recovered", item.id, t);
            return TaskResult.recovered(t);
        }
    }

    private <T> void abandon(WorkItem<T> item) {
        complete(item, TaskResult.cancelled(CancelReason.EXPLICIT));
    }

    private <T> void complete(WorkItem<T> item, TaskResult<T> result) {
        item.release();
        if (!item.completed.compareAndSet(false, true)) return;

        // Counters first, so stats are current once the future is observed complete
        switch (result.status()) {
            case SUCCESS -> tasksSucceeded.incrementAndGet();
            case FAILURE -> {
                tasksFailed.incrementAndGet();
                if (result.recovered()) tasksRecovered.incrementAndGet();
            }
            case CANCELLED -> tasksCancelled.incrementAndGet();
        }
        item.future.complete(result);
    }

    private void logFinalStats() {
        PoolStats stats = getStats();
        log.info("All workers stopped. Stats: submitted={}, succeeded={}, failed={}, recovered={}, cancelled={}",
                stats.submitted(), stats.succeeded(), stats.failed(), stats.recovered(), stats.cancelled());
    }

    private final class WorkItem<T> implements Runnable {
        private final long id;
        private final Task<T> task;
        private final CancellationToken token;
        private final CompletableFuture<TaskResult<T>> future = new CompletableFuture<>();
        private final AtomicBoolean completed = new AtomicBoolean(false);
        private volatile CancellationToken.Registration poolLink;

        private WorkItem(long id, Task<T> task, CancellationToken token) {
            this.id = id;
            this.task = task;
            this.token = token;
        }

        @Override
        public void run() {
            runItem(this);
        }

        private void release() {
            token.release();
            CancellationToken.Registration link = poolLink;
            if (link != null) link.close();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            return new Thread(runnable, prefix + "-" + counter.incrementAndGet());
        }
    }
}
