package com.axlabs.neo.governance.proposal;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Represents an action of a proposal. Proposals are made up of one or more intents that are executed once the
 * proposal is accepted.
 */
public final class Intent {

    /**
     * The contract to be called.
     */
    private final Hash160 target;

    /**
     * The amount of GAS (in fractions) sent to the target along with the call. Zero if nothing is sent.
     */
    private final BigInteger value;

    /**
     * The method, parameters and call flags of the call.
     */
    private final CallPayload payload;

    public Intent(Hash160 target, BigInteger value, CallPayload payload) {
        this.target = target;
        this.value = value;
        this.payload = payload;
    }

    public Hash160 getTarget() {
        return target;
    }

    public BigInteger getValue() {
        return value;
    }

    public CallPayload getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Intent)) return false;
        Intent intent = (Intent) o;
        return Objects.equals(target, intent.target) && Objects.equals(value, intent.value)
                && Objects.equals(payload, intent.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, value, payload);
    }

    @Override
    public String toString() {
        return "Intent{" + target + ", " + value + ", " + payload + "}";
    }
}
