package com.bountyscope.core.ratelimit;

import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.model.RateBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds both burst concurrency and steady-state rate of an external action.
 * <p>
 * A caller first takes one of {@code maxConcurrency} permits, then reserves the next
 * grant slot, which is at least {@code 60 / requestsPerMinute} seconds after the
 * previous grant. The internal lock covers only slot bookkeeping; waiting happens
 * outside it. Use the returned {@link Permit} in try-with-resources so the concurrency
 * permit is released on every exit path.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);
    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(60);

    private final String name;
    private final RateBudget budget;
    private final long intervalNanos;
    private final Semaphore permits;
    private final Ticker ticker;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> grantTimes = new ArrayDeque<>();
    private long lastGrantNanos;
    private boolean granted;

    public RateLimiter(String name, RateBudget budget) {
        this(name, budget, Ticker.system());
    }

    RateLimiter(String name, RateBudget budget, Ticker ticker) {
        this.name = name;
        this.budget = budget;
        this.intervalNanos = budget.interval().toNanos();
        this.permits = new Semaphore(budget.maxConcurrency(), true);
        this.ticker = ticker;
    }

    /**
     * Blocks until a concurrency permit is free and the minimum interval since the
     * previous grant has elapsed.
     *
     * @throws RunCancelledException if the signal fires or the thread is interrupted while waiting;
     *                               no permit is held afterwards
     */
    public Permit acquire(CancellationSignal signal) {
        CancellationSignal cancel = signal != null ? signal : CancellationSignal.NONE;
        takePermit(cancel);
        long slot;
        try {
            slot = reserveSlot();
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
        try {
            waitUntil(slot, cancel);
        } catch (RunCancelledException e) {
            rollback(slot);
            permits.release();
            throw e;
        }
        return new Permit();
    }

    public Permit acquire() {
        return acquire(CancellationSignal.NONE);
    }

    /**
     * Number of grants within the trailing 60 seconds. Informational only.
     */
    public int currentRate() {
        long now = ticker.nanoTime();
        lock.lock();
        try {
            int count = 0;
            for (long t : grantTimes) {
                if (now - t < WINDOW_NANOS) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public RateBudget budget() {
        return budget;
    }

    public String name() {
        return name;
    }

    private void takePermit(CancellationSignal cancel) {
        try {
            cancel.throwIfCancelled();
            while (!permits.tryAcquire(POLL_NANOS, TimeUnit.NANOSECONDS)) {
                cancel.throwIfCancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted");
        }
        if (cancel.isCancelled()) {
            permits.release();
            cancel.throwIfCancelled();
        }
    }

    private long reserveSlot() {
        lock.lock();
        try {
            long now = ticker.nanoTime();
            long slot = granted ? Math.max(now, lastGrantNanos + intervalNanos) : now;
            lastGrantNanos = slot;
            granted = true;
            grantTimes.addLast(slot);
            while (grantTimes.size() > budget.requestsPerMinute()) {
                grantTimes.removeFirst();
            }
            return slot;
        } finally {
            lock.unlock();
        }
    }

    /** Gives an abandoned slot back when nobody has reserved after it. */
    private void rollback(long slot) {
        lock.lock();
        try {
            if (granted && lastGrantNanos == slot && !grantTimes.isEmpty() && grantTimes.peekLast() == slot) {
                grantTimes.removeLast();
                if (grantTimes.isEmpty()) {
                    granted = false;
                } else {
                    lastGrantNanos = slot - intervalNanos;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void waitUntil(long slot, CancellationSignal cancel) {
        try {
            long remaining = slot - ticker.nanoTime();
            if (remaining > 0) {
                log.debug("Rate limiter '{}' delaying grant by {} ms", name, TimeUnit.NANOSECONDS.toMillis(remaining));
            }
            while (remaining > 0) {
                cancel.throwIfCancelled();
                ticker.sleepNanos(Math.min(remaining, POLL_NANOS));
                remaining = slot - ticker.nanoTime();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted");
        }
    }

    /**
     * Scoped grant. Closing it returns the concurrency permit; repeated closes are no-ops.
     */
    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }

    /**
     * Time source, replaceable in tests.
     */
    interface Ticker {

        long nanoTime();

        void sleepNanos(long nanos) throws InterruptedException;

        static Ticker system() {
            return new Ticker() {
                @Override
                public long nanoTime() {
                    return System.nanoTime();
                }

                @Override
                public void sleepNanos(long nanos) throws InterruptedException {
                    TimeUnit.NANOSECONDS.sleep(nanos);
                }
            };
        }
    }
}
