package com.axlabs.neo.governance.delegation;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Provides the voting power an account owns, e.g., its balance of a governance token.
 * <p>
 * Implementations must be deterministic for a given snapshot: once {@code snapshot} lies in the past the returned
 * value never changes.
 */
public interface VotingPowerSource {

    /**
     * @param account  The account.
     * @param snapshot The point in time. The result includes all changes recorded at or before it.
     * @return the account's own power at {@code snapshot}, never negative.
     */
    BigInteger getPower(Hash160 account, long snapshot);
}
