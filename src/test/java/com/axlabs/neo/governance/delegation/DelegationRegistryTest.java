package com.axlabs.neo.governance.delegation;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static com.axlabs.neo.governance.util.TestHelper.ALICE;
import static com.axlabs.neo.governance.util.TestHelper.BOB;
import static com.axlabs.neo.governance.util.TestHelper.CHARLIE;
import static com.axlabs.neo.governance.util.TestHelper.DENISE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DelegationRegistryTest {

    private BalanceHistory powers;
    private DelegationRegistry registry;

    @BeforeEach
    public void setUp() {
        powers = new BalanceHistory();
        powers.setPower(ALICE, BigInteger.valueOf(100), 0);
        powers.setPower(BOB, BigInteger.valueOf(50), 0);
        powers.setPower(CHARLIE, BigInteger.valueOf(30), 0);
        registry = new DelegationRegistry(powers);
    }

    private BigInteger totalPower(long snapshot) {
        BigInteger total = BigInteger.ZERO;
        for (Hash160 account : Arrays.asList(ALICE, BOB, CHARLIE, DENISE)) {
            total = total.add(registry.powerOf(account, snapshot));
        }
        return total;
    }

    @Test
    public void succeed_conserving_total_power() {
        BigInteger before = totalPower(5);
        registry.delegate(ALICE, BOB, BigInteger.valueOf(60), 10);
        registry.delegate(BOB, CHARLIE, BigInteger.valueOf(50), 11);
        registry.delegate(ALICE, DENISE, BigInteger.valueOf(40), 12);
        registry.revoke(ALICE, BOB, BigInteger.valueOf(20), 13);

        assertThat(totalPower(13), is(before));
        assertThat(registry.powerOf(ALICE, 13), is(BigInteger.valueOf(20)));
        // Delegated power can't be passed on, so BOB keeps what ALICE delegated.
        assertThat(registry.powerOf(BOB, 13), is(BigInteger.valueOf(40)));
        assertThat(registry.powerOf(CHARLIE, 13), is(BigInteger.valueOf(80)));
        assertThat(registry.powerOf(DENISE, 13), is(BigInteger.valueOf(40)));
    }

    @Test
    public void succeed_isolating_snapshots() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(60), 10);
        registry.revoke(ALICE, BOB, BigInteger.valueOf(60), 20);

        assertThat(registry.powerOf(BOB, 9), is(BigInteger.valueOf(50)));
        assertThat(registry.powerOf(BOB, 10), is(BigInteger.valueOf(110)));
        assertThat(registry.powerOf(BOB, 19), is(BigInteger.valueOf(110)));
        assertThat(registry.powerOf(BOB, 20), is(BigInteger.valueOf(50)));
        assertThat(registry.powerOf(ALICE, 15), is(BigInteger.valueOf(40)));
        assertThat(registry.delegatedOut(ALICE, 15), is(BigInteger.valueOf(60)));
        assertThat(registry.delegatedIn(BOB, 15), is(BigInteger.valueOf(60)));
    }

    @Test
    public void succeed_listing_delegations() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(10), 10);
        registry.delegate(ALICE, CHARLIE, BigInteger.valueOf(20), 10);
        registry.delegate(ALICE, BOB, BigInteger.valueOf(5), 11);
        registry.delegate(CHARLIE, BOB, BigInteger.valueOf(30), 11);

        List<Delegation> fromAlice = registry.delegationsFrom(ALICE);
        assertThat(fromAlice, contains(
                new Delegation(ALICE, BOB, BigInteger.valueOf(15)),
                new Delegation(ALICE, CHARLIE, BigInteger.valueOf(20))));
        assertThat(registry.delegationsTo(BOB).size(), is(2));
        assertThat(registry.delegation(ALICE, BOB), is(BigInteger.valueOf(15)));

        Delegation remaining = registry.revoke(ALICE, BOB, BigInteger.valueOf(15), 12);
        assertThat(remaining.getAmount(), is(BigInteger.ZERO));
        assertThat(registry.delegation(ALICE, BOB), is(BigInteger.ZERO));
        assertThat(registry.delegationsFrom(BOB), is(empty()));
    }

    @Test
    public void fail_delegating_to_self() {
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> registry.delegate(ALICE, ALICE, BigInteger.ONE, 10));
        assertThat(e.getError(), is(GovernanceError.SELF_DELEGATION));
    }

    @Test
    public void fail_delegating_more_than_undelegated_power() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(80), 10);
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> registry.delegate(ALICE, CHARLIE, BigInteger.valueOf(21), 11));
        assertThat(e.getError(), is(GovernanceError.INSUFFICIENT_POWER));
        assertThat(registry.powerOf(CHARLIE, 11), is(BigInteger.valueOf(30)));
    }

    @Test
    public void fail_delegating_non_positive_amount() {
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> registry.delegate(ALICE, BOB, BigInteger.ZERO, 10));
        assertThat(e.getError(), is(GovernanceError.INVALID_AMOUNT));
        e = assertThrows(GovernanceException.class,
                () -> registry.revoke(ALICE, BOB, BigInteger.valueOf(-1), 10));
        assertThat(e.getError(), is(GovernanceError.INVALID_AMOUNT));
    }

    @Test
    public void fail_revoking_more_than_delegated() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(10), 10);
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> registry.revoke(ALICE, BOB, BigInteger.valueOf(11), 11));
        assertThat(e.getError(), is(GovernanceError.INSUFFICIENT_DELEGATION));
        assertThat(registry.delegation(ALICE, BOB), is(BigInteger.TEN));
    }

    @Test
    public void fail_delegating_back_in_time() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(10), 10);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> registry.delegate(ALICE, CHARLIE, BigInteger.valueOf(10), 9));
        assertTrue(e.getMessage().startsWith("[DelegationRegistry.delegate]"));
        assertThat(registry.delegation(ALICE, CHARLIE), is(BigInteger.ZERO));
        assertThat(registry.delegatedOut(ALICE, 10), is(BigInteger.TEN));
    }

    @Test
    public void succeed_capping_delegation_at_remaining_own_power() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(80), 10);
        BigInteger before = totalPower(10);
        // ALICE transfers 50 of her 100 tokens to CHARLIE.
        powers.setPower(ALICE, BigInteger.valueOf(50), 20);
        powers.setPower(CHARLIE, BigInteger.valueOf(80), 20);

        assertThat(registry.undelegatedPower(ALICE, 20), is(BigInteger.ZERO));
        assertThat(registry.delegatedIn(BOB, 20), is(BigInteger.valueOf(80)));
        assertThat(registry.backedDelegatedIn(BOB, 20), is(BigInteger.valueOf(50)));
        assertThat(registry.powerOf(BOB, 20), is(BigInteger.valueOf(100)));
        assertThat(registry.powerOf(CHARLIE, 20), is(BigInteger.valueOf(80)));
        assertThat(totalPower(20), is(before));
        // The snapshot before the transfer is unchanged.
        assertThat(registry.powerOf(BOB, 19), is(BigInteger.valueOf(130)));
    }

    @Test
    public void succeed_not_counting_delegation_of_moved_power_twice() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(100), 10);
        powers.setPower(ALICE, BigInteger.ZERO, 20);
        powers.setPower(DENISE, BigInteger.valueOf(100), 20);

        assertThat(registry.powerOf(BOB, 30), is(BigInteger.valueOf(50)));
        assertThat(registry.powerOf(DENISE, 30), is(BigInteger.valueOf(100)));
        assertThat(totalPower(30), is(BigInteger.valueOf(180)));
    }

    @Test
    public void succeed_scaling_all_delegations_of_delegator() {
        registry.delegate(ALICE, BOB, BigInteger.valueOf(60), 10);
        registry.delegate(ALICE, DENISE, BigInteger.valueOf(40), 10);
        powers.setPower(ALICE, BigInteger.valueOf(50), 20);

        assertThat(registry.powerOf(BOB, 20), is(BigInteger.valueOf(80)));
        assertThat(registry.powerOf(DENISE, 20), is(BigInteger.valueOf(20)));
        assertThat(totalPower(20), is(BigInteger.valueOf(130)));

        // Once ALICE owns enough again, the delegations count in full.
        powers.setPower(ALICE, BigInteger.valueOf(100), 30);
        assertThat(registry.powerOf(BOB, 30), is(BigInteger.valueOf(110)));
        assertThat(registry.powerOf(DENISE, 30), is(BigInteger.valueOf(40)));
    }
}
