package com.axlabs.neo.governance.delegation;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tracks how much of their own voting power accounts have delegated to other accounts.
 * <p>
 * The delegated-out and delegated-in totals of every account are kept as {@link Checkpoints}, so the power of an
 * account can be reconstructed for any past snapshot. Power delegated to an account cannot be passed on; only own
 * power can be delegated.
 * <p>
 * A delegation counts only as far as the delegator's own power backs it at the snapshot. If the delegator's own
 * power dropped below the total it delegated, each of its delegations is scaled down by the same ratio, so the
 * power of all accounts together never exceeds their own power.
 * <p>
 * All methods are synchronized on the registry.
 */
public class DelegationRegistry {

    private final VotingPowerSource powerSource;
    private final Map<Hash160, Checkpoints> delegatedOut = new HashMap<>();
    private final Map<Hash160, Checkpoints> delegatedIn = new HashMap<>();
    // [delegator: [delegate: amount]]
    private final Map<Hash160, Map<Hash160, BigInteger>> edges = new HashMap<>();
    // [delegate: [delegator: amount over time]]
    private final Map<Hash160, Map<Hash160, Checkpoints>> incoming = new HashMap<>();

    public DelegationRegistry(VotingPowerSource powerSource) {
        this.powerSource = Objects.requireNonNull(powerSource, "powerSource");
    }

    /**
     * Delegates {@code amount} of the own power of {@code from} to {@code to}.
     *
     * @param from   The delegator.
     * @param to     The delegate.
     * @param amount The amount to delegate. Must be positive.
     * @param now    The time of the delegation.
     * @return the resulting delegation edge from {@code from} to {@code to}.
     */
    public synchronized Delegation delegate(Hash160 from, Hash160 to, BigInteger amount, long now) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (amount == null || amount.signum() <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_AMOUNT, "DelegationRegistry.delegate",
                    "Delegated amount must be positive");
        }
        if (from.equals(to)) {
            throw new GovernanceException(GovernanceError.SELF_DELEGATION, "DelegationRegistry.delegate");
        }
        BigInteger available = undelegatedPower(from, now);
        if (amount.compareTo(available) > 0) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_POWER, "DelegationRegistry.delegate",
                    "Insufficient undelegated power: " + available + " < " + amount);
        }
        requireInOrder(from, to, now, "DelegationRegistry.delegate");
        Map<Hash160, BigInteger> out = edges.computeIfAbsent(from, a -> new LinkedHashMap<>());
        BigInteger edge = out.getOrDefault(to, BigInteger.ZERO).add(amount);
        out.put(to, edge);
        adjust(delegatedOut, from, amount, now);
        adjust(delegatedIn, to, amount, now);
        incoming.computeIfAbsent(to, a -> new LinkedHashMap<>())
                .computeIfAbsent(from, a -> new Checkpoints())
                .push(now, edge);
        return new Delegation(from, to, edge);
    }

    /**
     * Takes back {@code amount} of the power {@code from} delegated to {@code to}.
     *
     * @param from   The delegator.
     * @param to     The delegate.
     * @param amount The amount to take back. Must be positive and not exceed the current delegation.
     * @param now    The time of the revocation.
     * @return the remaining delegation edge, with an amount of zero if it was removed completely.
     */
    public synchronized Delegation revoke(Hash160 from, Hash160 to, BigInteger amount, long now) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (amount == null || amount.signum() <= 0) {
            throw new GovernanceException(GovernanceError.INVALID_AMOUNT, "DelegationRegistry.revoke",
                    "Revoked amount must be positive");
        }
        BigInteger edge = delegation(from, to);
        if (amount.compareTo(edge) > 0) {
            throw new GovernanceException(GovernanceError.INSUFFICIENT_DELEGATION, "DelegationRegistry.revoke",
                    "Insufficient delegation: " + edge + " < " + amount);
        }
        requireInOrder(from, to, now, "DelegationRegistry.revoke");
        BigInteger remaining = edge.subtract(amount);
        Map<Hash160, BigInteger> out = edges.get(from);
        if (remaining.signum() == 0) {
            out.remove(to);
            if (out.isEmpty()) {
                edges.remove(from);
            }
        } else {
            out.put(to, remaining);
        }
        adjust(delegatedOut, from, amount.negate(), now);
        adjust(delegatedIn, to, amount.negate(), now);
        incoming.get(to).get(from).push(now, remaining);
        return new Delegation(from, to, remaining);
    }

    private void requireInOrder(Hash160 from, Hash160 to, long now, String method) {
        long latest = Math.max(latestTime(delegatedOut, from), latestTime(delegatedIn, to));
        if (now < latest) {
            throw new IllegalStateException("[" + method + "] Time " + now + " is before the latest change at "
                    + latest);
        }
    }

    private static long latestTime(Map<Hash160, Checkpoints> totals, Hash160 account) {
        Checkpoints c = totals.get(account);
        return c == null ? Long.MIN_VALUE : c.latestTime();
    }

    private static void adjust(Map<Hash160, Checkpoints> totals, Hash160 account, BigInteger delta, long now) {
        Checkpoints c = totals.computeIfAbsent(account, a -> new Checkpoints());
        c.push(now, c.latest().add(delta));
    }

    /**
     * Gets the voting power of {@code account} at {@code snapshot}: its own power that was not delegated away plus
     * the backed part of the power delegated to it.
     *
     * @param account  The account.
     * @param snapshot The point in time.
     * @return the effective voting power.
     */
    public synchronized BigInteger powerOf(Hash160 account, long snapshot) {
        return undelegatedPower(account, snapshot).add(backedDelegatedIn(account, snapshot));
    }

    /**
     * Gets the power delegated to {@code account} at {@code snapshot}, each delegation counted only as far as its
     * delegator's own power backs it.
     */
    public synchronized BigInteger backedDelegatedIn(Hash160 account, long snapshot) {
        Map<Hash160, Checkpoints> in = incoming.get(account);
        if (in == null) {
            return BigInteger.ZERO;
        }
        BigInteger total = BigInteger.ZERO;
        for (Map.Entry<Hash160, Checkpoints> e : in.entrySet()) {
            BigInteger edge = e.getValue().valueAt(snapshot);
            if (edge.signum() > 0) {
                total = total.add(backed(e.getKey(), edge, snapshot));
            }
        }
        return total;
    }

    // edge * min(1, own / delegatedOut), rounded down
    private BigInteger backed(Hash160 delegator, BigInteger edge, long snapshot) {
        BigInteger own = ownPower(delegator, snapshot).max(BigInteger.ZERO);
        BigInteger out = delegatedOut(delegator, snapshot);
        if (own.compareTo(out) >= 0) {
            return edge;
        }
        return edge.multiply(own).divide(out);
    }

    public synchronized BigInteger ownPower(Hash160 account, long snapshot) {
        return powerSource.getPower(account, snapshot);
    }

    /**
     * Gets the part of the own power of {@code account} that is not delegated. If the own power dropped below the
     * delegated amount, e.g., because tokens were transferred, this is zero.
     */
    public synchronized BigInteger undelegatedPower(Hash160 account, long snapshot) {
        BigInteger rest = ownPower(account, snapshot).subtract(delegatedOut(account, snapshot));
        return rest.max(BigInteger.ZERO);
    }

    public synchronized BigInteger delegatedOut(Hash160 account, long snapshot) {
        Checkpoints c = delegatedOut.get(account);
        return c == null ? BigInteger.ZERO : c.valueAt(snapshot);
    }

    /**
     * @return the nominal amount delegated to {@code account} at {@code snapshot}, whether backed or not.
     */
    public synchronized BigInteger delegatedIn(Hash160 account, long snapshot) {
        Checkpoints c = delegatedIn.get(account);
        return c == null ? BigInteger.ZERO : c.valueAt(snapshot);
    }

    /**
     * @return the amount {@code from} currently delegates to {@code to}, zero if none.
     */
    public synchronized BigInteger delegation(Hash160 from, Hash160 to) {
        Map<Hash160, BigInteger> out = edges.get(from);
        if (out == null) {
            return BigInteger.ZERO;
        }
        return out.getOrDefault(to, BigInteger.ZERO);
    }

    /**
     * @return the current delegations of {@code delegator}, in the order they were first made.
     */
    public synchronized List<Delegation> delegationsFrom(Hash160 delegator) {
        Map<Hash160, BigInteger> out = edges.get(delegator);
        if (out == null) {
            return Collections.emptyList();
        }
        List<Delegation> list = new ArrayList<>();
        out.forEach((to, amount) -> list.add(new Delegation(delegator, to, amount)));
        return list;
    }

    /**
     * @return the current delegations pointing at {@code delegate}.
     */
    public synchronized List<Delegation> delegationsTo(Hash160 delegate) {
        List<Delegation> list = new ArrayList<>();
        edges.forEach((from, out) -> {
            BigInteger amount = out.get(delegate);
            if (amount != null) {
                list.add(new Delegation(from, delegate, amount));
            }
        });
        return list;
    }
}
