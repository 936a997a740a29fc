package com.axlabs.neo.governance.delegation;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A delegation edge, i.e., the amount of voting power {@code delegator} currently lets {@code delegate} use.
 */
public final class Delegation {

    private final Hash160 delegator;
    private final Hash160 delegate;
    private final BigInteger amount;

    public Delegation(Hash160 delegator, Hash160 delegate, BigInteger amount) {
        this.delegator = delegator;
        this.delegate = delegate;
        this.amount = amount;
    }

    public Hash160 getDelegator() {
        return delegator;
    }

    public Hash160 getDelegate() {
        return delegate;
    }

    public BigInteger getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delegation)) return false;
        Delegation that = (Delegation) o;
        return delegator.equals(that.delegator) && delegate.equals(that.delegate) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delegator, delegate, amount);
    }

    @Override
    public String toString() {
        return "Delegation{" + delegator + " -> " + delegate + ": " + amount + "}";
    }
}
