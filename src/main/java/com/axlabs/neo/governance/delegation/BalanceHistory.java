package com.axlabs.neo.governance.delegation;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link VotingPowerSource} keeping the power of every account as a checkpointed history. Useful when balances are
 * mirrored from a token contract's transfer events.
 */
public class BalanceHistory implements VotingPowerSource {

    private final Map<Hash160, Checkpoints> balances = new HashMap<>();

    /**
     * Sets the power of {@code account} from {@code time} on.
     *
     * @param account The account.
     * @param power   The new power. Must not be negative.
     * @param time    The time of the change. Must not be before the account's latest change.
     */
    public synchronized void setPower(Hash160 account, BigInteger power, long time) {
        Objects.requireNonNull(account, "account");
        if (power == null || power.signum() < 0) {
            throw new IllegalArgumentException("Power must not be negative");
        }
        balances.computeIfAbsent(account, a -> new Checkpoints()).push(time, power);
    }

    @Override
    public synchronized BigInteger getPower(Hash160 account, long snapshot) {
        Checkpoints c = balances.get(account);
        return c == null ? BigInteger.ZERO : c.valueAt(snapshot);
    }
}
