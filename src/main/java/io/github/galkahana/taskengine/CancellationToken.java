package io.github.galkahana.taskengine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Cooperative cancellation signal shared by the tasks of one batch.
 * <p>
 * A token is cancelled at most once: the first {@link #cancel(CancelReason)} wins and records its reason,
 * later calls are no-ops. Tokens form a tree. Cancelling a parent cancels every child with the parent's
 * reason, while cancelling a child never touches the parent. A token created with a timeout is cancelled
 * with {@link CancelReason#TIMEOUT} when its deadline passes.
 * <p>
 * Cancellation never interrupts a running thread. Task bodies observe it by polling {@link #isCancelled()},
 * calling {@link #throwIfCancelled()}, blocking in {@link #awaitCancellation()}, or registering a listener
 * with {@link #onCancel(Runnable)}.
 *
 * <pre>{@code
 * CancellationToken batchToken = CancellationToken.create(Duration.ofSeconds(5));
 * List<TaskResult<String>> results = coordinator.runBatch(pool, tasks, batchToken);
 * }</pre>
 */
@Slf4j
public final class CancellationToken {

    private static final ScheduledThreadPoolExecutor DEADLINE_TIMER = createDeadlineTimer();

    private final AtomicReference<CancelReason> reason = new AtomicReference<>(CancelReason.NONE);
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Instant deadline;

    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>(); // guarded by lock

    private volatile ScheduledFuture<?> deadlineTimer;
    private volatile Registration parentRegistration;

    /**
     * Handle returned by {@link #onCancel(Runnable)}. Closing it unregisters the listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    /**
     * Create a root token that is cancelled only explicitly.
     */
    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    /**
     * Create a root token that cancels itself with {@link CancelReason#TIMEOUT} after the given timeout.
     *
     * @param timeout Time until the token cancels itself. Zero or negative cancels immediately.
     */
    public static CancellationToken create(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        CancellationToken token = new CancellationToken(deadlineAfter(timeout));
        token.armDeadline(timeout);
        return token;
    }

    /**
     * Create a child token that is cancelled whenever the parent is.
     */
    public static CancellationToken childOf(CancellationToken parent) {
        return childOf(parent, null);
    }

    /**
     * Create a child token that is cancelled whenever the parent is, or when its own timeout elapses,
     * whichever happens first.
     *
     * @param parent Token whose cancellation propagates to the child
     * @param timeout Optional timeout for the child, {@code null} for none
     */
    public static CancellationToken childOf(CancellationToken parent, Duration timeout) {
        Objects.requireNonNull(parent, "parent");

        Instant own = timeout != null ? deadlineAfter(timeout) : null;
        Instant inherited = parent.deadline;
        Instant effective = own == null ? inherited
                : inherited == null ? own
                : own.isBefore(inherited) ? own : inherited;

        CancellationToken child = new CancellationToken(effective);
        child.parentRegistration = parent.onCancel(() -> child.cancel(parent.reason()));
        if (timeout != null) child.armDeadline(timeout);
        return child;
    }

    /**
     * Cancel with {@link CancelReason#EXPLICIT}.
     *
     * @return true if this call performed the cancellation, false if the token was already cancelled
     */
    public boolean cancel() {
        return cancel(CancelReason.EXPLICIT);
    }

    /**
     * Cancel with the given reason. Only the first call has an effect.
     *
     * @param cause Reason to record, must not be {@link CancelReason#NONE}
     * @return true if this call performed the cancellation, false if the token was already cancelled
     */
    public boolean cancel(CancelReason cause) {
        if (cause == null || cause == CancelReason.NONE) {
            throw new IllegalArgumentException("Cancellation reason must be TIMEOUT or EXPLICIT");
        }
        if (!reason.compareAndSet(CancelReason.NONE, cause)) return false;

        cancelled.countDown();
        release();

        List<Runnable> toNotify;
        synchronized (lock) {
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        log.debug("Token cancelled ({}), notifying {} listeners", cause, toNotify.size());
        toNotify.forEach(CancellationToken::notifyListener);
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != CancelReason.NONE;
    }

    /**
     * @return {@link CancelReason#NONE} while not cancelled, otherwise the reason recorded by the first cancel
     */
    public CancelReason reason() {
        return reason.get();
    }

    /**
     * @return The instant this token times out, including any deadline inherited from its parent
     */
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Throw {@link TaskCancelledException} if cancellation was requested. Meant for polling from task bodies.
     */
    public void throwIfCancelled() {
        CancelReason current = reason.get();
        if (current != CancelReason.NONE) throw new TaskCancelledException(current);
    }

    /**
     * Block until the token is cancelled.
     */
    public void awaitCancellation() throws InterruptedException {
        cancelled.await();
    }

    /**
     * Block until the token is cancelled or the wait elapses.
     *
     * @return true if the token was cancelled within the wait
     */
    public boolean awaitCancellation(Duration wait) throws InterruptedException {
        return cancelled.await(TimeUnit.NANOSECONDS.convert(wait), TimeUnit.NANOSECONDS);
    }

    /**
     * Register a listener to run once on cancellation. If the token is already cancelled the listener runs
     * immediately on the calling thread. Listeners should be fast and must not block.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (lock) {
            if (!isCancelled()) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        notifyListener(listener);
        return () -> {};
    }

    /**
     * Detach from the parent token and stop the deadline timer. The token keeps its current state but will no
     * longer be cancelled by its parent or its deadline. Used for short-lived per-item tokens once their task
     * has finished, so the parent does not accumulate listeners.
     */
    public void release() {
        Registration registration = parentRegistration;
        if (registration != null) {
            parentRegistration = null;
            registration.close();
        }
        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            deadlineTimer = null;
            timer.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{reason=" + reason.get() + ", deadline=" + deadline + "}";
    }

    private void armDeadline(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            cancel(CancelReason.TIMEOUT);
            return;
        }
        deadlineTimer = DEADLINE_TIMER.schedule(
                () -> cancel(CancelReason.TIMEOUT), TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        // cancel() may have run before the timer was published
        if (isCancelled()) release();
    }

    // Saturates at Instant.MAX for timeouts past the end of the time line
    private static Instant deadlineAfter(Duration timeout) {
        Instant now = Instant.now();
        if (timeout.isNegative()) return now;
        return timeout.compareTo(Duration.between(now, Instant.MAX)) >= 0 ? Instant.MAX : now.plus(timeout);
    }

    private static void notifyListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener threw", e);
        }
    }

    private static ScheduledThreadPoolExecutor createDeadlineTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cancellation-deadline-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}
