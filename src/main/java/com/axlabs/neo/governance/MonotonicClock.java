package com.axlabs.neo.governance;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps a clock and hides any step back of it by repeating the highest value read so far.
 */
public class MonotonicClock implements Clock {

    private final Clock source;
    private final AtomicLong highest = new AtomicLong(Long.MIN_VALUE);

    public MonotonicClock(Clock source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    @Override
    public long now() {
        long time = source.now();
        return highest.accumulateAndGet(time, Math::max);
    }
}
