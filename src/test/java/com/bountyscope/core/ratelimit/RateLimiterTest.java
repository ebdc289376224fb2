package com.bountyscope.core.ratelimit;

import com.bountyscope.core.engine.CancellationSignal;
import com.bountyscope.core.engine.RunCancelledException;
import com.bountyscope.core.model.RateBudget;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    /** Clock that only moves when the limiter sleeps. */
    static class FakeTicker implements RateLimiter.Ticker {

        final AtomicLong now = new AtomicLong(TimeUnit.SECONDS.toNanos(1000));

        @Override
        public long nanoTime() {
            return now.get();
        }

        @Override
        public void sleepNanos(long nanos) {
            now.addAndGet(nanos);
        }

        long elapsedSince(long start) {
            return now.get() - start;
        }
    }

    private static CancellationSignal cancelledWhen(java.util.function.BooleanSupplier condition) {
        return new CancellationSignal() {
            @Override
            public boolean isCancelled() {
                return condition.getAsBoolean();
            }

            @Override
            public String reason() {
                return "cancelled";
            }
        };
    }

    @Nested
    @DisplayName("rate")
    class Rate {

        @Test
        @DisplayName("first grant is immediate, later grants are spaced by the interval")
        void spacing() {
            var ticker = new FakeTicker();
            var limiter = new RateLimiter("test", new RateBudget(5, 4), ticker);
            long start = ticker.nanoTime();

            limiter.acquire().close();
            assertEquals(0, ticker.elapsedSince(start));

            limiter.acquire().close();
            assertEquals(TimeUnit.SECONDS.toNanos(12), ticker.elapsedSince(start));

            limiter.acquire().close();
            assertEquals(TimeUnit.SECONDS.toNanos(24), ticker.elapsedSince(start));
            assertEquals(3, limiter.currentRate());
        }

        @Test
        @DisplayName("no wait when the interval has already passed")
        void idleLimiter() {
            var ticker = new FakeTicker();
            var limiter = new RateLimiter("test", new RateBudget(60, 1), ticker);

            limiter.acquire().close();
            ticker.now.addAndGet(TimeUnit.SECONDS.toNanos(5));
            long before = ticker.nanoTime();
            limiter.acquire().close();

            assertEquals(before, ticker.nanoTime());
        }

        @Test
        @DisplayName("a grant inside the interval waits exactly the remaining deficit")
        void waitsForDeficit() {
            var ticker = new FakeTicker();
            var limiter = new RateLimiter("test", new RateBudget(5, 1), ticker);

            limiter.acquire().close();
            ticker.now.addAndGet(TimeUnit.SECONDS.toNanos(5));
            long before = ticker.nanoTime();
            limiter.acquire().close();

            assertEquals(TimeUnit.SECONDS.toNanos(7), ticker.elapsedSince(before));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("permits are bounded by max concurrency and returned on close")
        void bounded() {
            var limiter = new RateLimiter("test", new RateBudget(100, 2), new FakeTicker());

            var p1 = limiter.acquire();
            var p2 = limiter.acquire();
            assertEquals(0, limiter.availablePermits());

            p1.close();
            p1.close();
            assertEquals(1, limiter.availablePermits());
            p2.close();
            assertEquals(2, limiter.availablePermits());
        }

        @Test
        @DisplayName("a caller waiting for a permit proceeds once another releases")
        void waitsForRelease() throws Exception {
            var limiter = new RateLimiter("test", new RateBudget(100, 1), new FakeTicker());
            var held = limiter.acquire();
            var acquired = new CountDownLatch(1);

            Thread waiter = new Thread(() -> {
                try (var p = limiter.acquire()) {
                    acquired.countDown();
                }
            });
            waiter.start();

            assertFalse(acquired.await(250, TimeUnit.MILLISECONDS));
            held.close();
            assertTrue(acquired.await(2, TimeUnit.SECONDS));
            waiter.join(2000);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("cancel while waiting for a permit throws and holds nothing")
        void cancelWhileWaitingForPermit() throws Exception {
            var limiter = new RateLimiter("test", new RateBudget(100, 1), new FakeTicker());
            var held = limiter.acquire();
            var cancelled = new AtomicBoolean(false);
            var error = new AtomicReference<Throwable>();

            Thread waiter = new Thread(() -> {
                try {
                    limiter.acquire(cancelledWhen(cancelled::get));
                } catch (Throwable t) {
                    error.set(t);
                }
            });
            waiter.start();
            Thread.sleep(150);
            cancelled.set(true);
            waiter.join(2000);

            assertInstanceOf(RunCancelledException.class, error.get());
            held.close();
            assertEquals(1, limiter.availablePermits());
        }

        @Test
        @DisplayName("cancel during the rate wait releases the permit and the slot")
        void cancelDuringRateWait() {
            var ticker = new FakeTicker();
            var limiter = new RateLimiter("test", new RateBudget(5, 2), ticker);
            long start = ticker.nanoTime();
            limiter.acquire().close();

            long cancelAt = start + TimeUnit.SECONDS.toNanos(5);
            var ex = assertThrows(RunCancelledException.class,
                    () -> limiter.acquire(cancelledWhen(() -> ticker.nanoTime() >= cancelAt)));

            assertEquals("cancelled", ex.getReason());
            assertEquals(2, limiter.availablePermits());
            assertEquals(1, limiter.currentRate());

            limiter.acquire().close();
            assertEquals(TimeUnit.SECONDS.toNanos(12), ticker.elapsedSince(start));
        }

        @Test
        @DisplayName("an already cancelled signal never takes a permit")
        void alreadyCancelled() {
            var limiter = new RateLimiter("test", new RateBudget(10, 1), new FakeTicker());
            assertThrows(RunCancelledException.class, () -> limiter.acquire(cancelledWhen(() -> true)));
            assertEquals(1, limiter.availablePermits());
        }
    }
}
