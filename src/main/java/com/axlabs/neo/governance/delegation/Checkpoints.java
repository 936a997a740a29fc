package com.axlabs.neo.governance.delegation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * An append-only history of a numeric value. Each checkpoint records the value that holds from its time on, so the
 * value at any past point can be found with a binary search.
 * <p>
 * Not thread-safe. Owners synchronize access.
 */
public class Checkpoints {

    private final List<Long> times = new ArrayList<>();
    private final List<BigInteger> values = new ArrayList<>();

    /**
     * Records {@code value} as of {@code time}. A second push at the same time replaces the first one.
     *
     * @param time  The time from which on the value holds. Must not be before the latest checkpoint.
     * @param value The new value.
     */
    public void push(long time, BigInteger value) {
        int n = times.size();
        if (n > 0) {
            long last = times.get(n - 1);
            if (time < last) {
                throw new IllegalArgumentException("Checkpoint at " + time + " is older than latest checkpoint at "
                        + last);
            }
            if (time == last) {
                values.set(n - 1, value);
                return;
            }
        }
        times.add(time);
        values.add(value);
    }

    /**
     * Gets the value as it was at {@code time}, i.e., the value of the last checkpoint recorded at or before that
     * time.
     *
     * @param time The point in time.
     * @return the value, or zero if there is no checkpoint at or before {@code time}.
     */
    public BigInteger valueAt(long time) {
        int low = 0;
        int high = times.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (times.get(mid) > time) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low == 0 ? BigInteger.ZERO : values.get(low - 1);
    }

    /**
     * @return the time of the latest checkpoint, or {@link Long#MIN_VALUE} if there is none.
     */
    public long latestTime() {
        return times.isEmpty() ? Long.MIN_VALUE : times.get(times.size() - 1);
    }

    public BigInteger latest() {
        return values.isEmpty() ? BigInteger.ZERO : values.get(values.size() - 1);
    }

    public int size() {
        return times.size();
    }
}
