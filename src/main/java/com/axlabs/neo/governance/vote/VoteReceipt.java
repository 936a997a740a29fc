package com.axlabs.neo.governance.vote;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The record of a single vote. Receipts are never changed once cast.
 */
public final class VoteReceipt {

    private final int proposalId;
    private final Hash160 voter;
    private final VoteChoice choice;
    private final BigInteger weight;
    private final long timestamp;

    public VoteReceipt(int proposalId, Hash160 voter, VoteChoice choice, BigInteger weight, long timestamp) {
        this.proposalId = proposalId;
        this.voter = voter;
        this.choice = choice;
        this.weight = weight;
        this.timestamp = timestamp;
    }

    public int getProposalId() {
        return proposalId;
    }

    public Hash160 getVoter() {
        return voter;
    }

    public VoteChoice getChoice() {
        return choice;
    }

    /**
     * @return the voter's power at the proposal's snapshot, after applying the proposal's weighting.
     */
    public BigInteger getWeight() {
        return weight;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VoteReceipt)) return false;
        VoteReceipt that = (VoteReceipt) o;
        return proposalId == that.proposalId && timestamp == that.timestamp && voter.equals(that.voter)
                && choice == that.choice && weight.equals(that.weight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(proposalId, voter, choice, weight, timestamp);
    }

    @Override
    public String toString() {
        return "VoteReceipt{" + proposalId + ", " + voter + ", " + choice + ", " + weight + "}";
    }
}
