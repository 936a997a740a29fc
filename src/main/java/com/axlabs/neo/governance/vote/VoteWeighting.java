package com.axlabs.neo.governance.vote;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Turns a voter's power into the weight of their vote.
 */
public interface VoteWeighting {

    BigInteger HUNDRED = BigInteger.valueOf(100);

    BigInteger weigh(Hash160 voter, BigInteger power, long snapshot);

    static VoteWeighting linear() {
        return (voter, power, snapshot) -> power;
    }

    static VoteWeighting quadratic() {
        return (voter, power, snapshot) -> power.sqrt();
    }

    /**
     * Scales the power by the voter's reputation at the snapshot. The weight never drops below zero.
     */
    static VoteWeighting reputation(ReputationSource reputationSource) {
        Objects.requireNonNull(reputationSource, "reputationSource");
        return (voter, power, snapshot) -> {
            BigInteger factor = HUNDRED.add(reputationSource.getReputation(voter, snapshot));
            return power.multiply(factor).divide(HUNDRED).max(BigInteger.ZERO);
        };
    }
}
