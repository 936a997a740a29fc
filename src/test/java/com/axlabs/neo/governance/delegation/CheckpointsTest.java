package com.axlabs.neo.governance.delegation;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CheckpointsTest {

    @Test
    public void succeed_finding_values_at_past_times() {
        Checkpoints c = new Checkpoints();
        c.push(10, BigInteger.valueOf(1));
        c.push(20, BigInteger.valueOf(2));
        c.push(30, BigInteger.valueOf(3));

        assertThat(c.valueAt(9), is(BigInteger.ZERO));
        assertThat(c.valueAt(10), is(BigInteger.ONE));
        assertThat(c.valueAt(19), is(BigInteger.ONE));
        assertThat(c.valueAt(20), is(BigInteger.valueOf(2)));
        assertThat(c.valueAt(Long.MAX_VALUE), is(BigInteger.valueOf(3)));
        assertThat(c.latest(), is(BigInteger.valueOf(3)));
        assertThat(c.latestTime(), is(30L));
    }

    @Test
    public void succeed_replacing_value_at_same_time() {
        Checkpoints c = new Checkpoints();
        c.push(10, BigInteger.ONE);
        c.push(10, BigInteger.TEN);
        assertThat(c.size(), is(1));
        assertThat(c.valueAt(10), is(BigInteger.TEN));
    }

    @Test
    public void fail_pushing_older_checkpoint() {
        Checkpoints c = new Checkpoints();
        c.push(10, BigInteger.ONE);
        assertThrows(IllegalArgumentException.class, () -> c.push(9, BigInteger.TEN));
        assertThat(c.valueAt(10), is(BigInteger.ONE));
    }

    @Test
    public void succeed_reading_empty_history() {
        Checkpoints c = new Checkpoints();
        assertThat(c.valueAt(0), is(BigInteger.ZERO));
        assertThat(c.latest(), is(BigInteger.ZERO));
        assertThat(c.latestTime(), is(Long.MIN_VALUE));
    }
}
