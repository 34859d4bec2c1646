package io.hypha.core.readiness;

import io.hypha.core.HyphaException;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One outstanding readiness wait. Settles exactly once: with a value, with a
 * {@link io.hypha.core.ServiceTimeoutException}, or by cancellation.
 *
 * @param <T> value the wait resolves to
 */
public final class PendingWait<T> {

    private final String waitId;
    private final String target;
    private final Instant deadline;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final AtomicBoolean matched = new AtomicBoolean();
    private volatile ScheduledFuture<?> timer;

    PendingWait(String waitId, String target, Instant deadline) {
        this.waitId = waitId;
        this.target = target;
        this.deadline = deadline;
    }

    public String getWaitId() {
        return waitId;
    }

    public String getTarget() {
        return target;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public CompletableFuture<T> future() {
        return future;
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * @return true when this call cancelled the wait.
     */
    public boolean cancel() {
        return future.cancel(false);
    }

    /**
     * Blocks until the wait settles.
     *
     * @throws HyphaException on timeout, cancellation, interruption or a failed fetch
     */
    public T await() throws HyphaException {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HyphaException("interrupted while waiting for " + target, ex);
        } catch (CancellationException ex) {
            throw new HyphaException("wait for " + target + " was cancelled", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof HyphaException) {
                throw (HyphaException) cause;
            }
            throw new HyphaException("wait for " + target + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Settles the race between a matching event and the timer: only the first caller wins, and a
     * winning event disarms the timer.
     */
    boolean claim() {
        if (!matched.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> armed = timer;
        if (armed != null) {
            armed.cancel(false);
        }
        return true;
    }

    void arm(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void disarm() {
        ScheduledFuture<?> armed = timer;
        if (armed != null) {
            armed.cancel(false);
        }
    }

    @Override
    public String toString() {
        return "PendingWait{" + waitId + " -> " + target + "}";
    }
}
