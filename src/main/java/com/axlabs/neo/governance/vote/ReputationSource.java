package com.axlabs.neo.governance.vote;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Provides the reputation of accounts for {@link WeightingMode#REPUTATION} voting. A reputation of 50 increases the
 * weight of a vote by half, -50 decreases it by half.
 */
public interface ReputationSource {

    BigInteger getReputation(Hash160 account, long snapshot);
}
