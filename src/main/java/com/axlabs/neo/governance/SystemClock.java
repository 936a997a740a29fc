package com.axlabs.neo.governance;

/**
 * Wall clock time in milliseconds since the epoch, never going backwards.
 */
public class SystemClock extends MonotonicClock {

    public SystemClock() {
        super(System::currentTimeMillis);
    }
}
