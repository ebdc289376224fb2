package com.bountyscope.core.engine;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Generates run ids of the form {@code <millis>_<target token>}. The millisecond part
 * strictly increases across calls, so ids are unique within the process.
 */
@Component
public class RunIdGenerator {

    private final AtomicLong last = new AtomicLong(0);
    private final LongSupplier clock;

    public RunIdGenerator() {
        this(System::currentTimeMillis);
    }

    RunIdGenerator(LongSupplier clock) {
        this.clock = clock;
    }

    public String next(String target) {
        long now = clock.getAsLong();
        long millis = last.updateAndGet(prev -> Math.max(now, prev + 1));
        return millis + "_" + sanitize(target);
    }

    static String sanitize(String target) {
        if (target == null || target.isEmpty()) {
            return "target";
        }
        return target.replaceAll("[^A-Za-z0-9-]", "_");
    }
}
