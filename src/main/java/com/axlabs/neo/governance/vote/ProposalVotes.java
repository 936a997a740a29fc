package com.axlabs.neo.governance.vote;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The weighted approve, reject, and abstain votes of a proposal and the receipts of all voters.
 */
public class ProposalVotes {

    /**
     * The weight of all votes approving the proposal.
     */
    private BigInteger approve = BigInteger.ZERO;

    /**
     * The weight of all votes rejecting the proposal.
     */
    private BigInteger reject = BigInteger.ZERO;

    /**
     * The weight of all votes that abstain from yes or no position.
     */
    private BigInteger abstain = BigInteger.ZERO;

    /**
     * Holds information about what members voted on a proposal.
     */
    private final Map<Hash160, VoteReceipt> voters = new LinkedHashMap<>();

    synchronized boolean hasVoted(Hash160 voter) {
        return voters.containsKey(voter);
    }

    synchronized void add(VoteReceipt receipt) {
        voters.put(receipt.getVoter(), receipt);
        switch (receipt.getChoice()) {
            case AGAINST:
                reject = reject.add(receipt.getWeight());
                break;
            case FOR:
                approve = approve.add(receipt.getWeight());
                break;
            default:
                abstain = abstain.add(receipt.getWeight());
        }
    }

    public synchronized BigInteger getApprove() {
        return approve;
    }

    public synchronized BigInteger getReject() {
        return reject;
    }

    public synchronized BigInteger getAbstain() {
        return abstain;
    }

    public synchronized BigInteger getTotal() {
        return approve.add(reject).add(abstain);
    }

    public synchronized int getVoterCount() {
        return voters.size();
    }

    public synchronized VoteReceipt getReceipt(Hash160 voter) {
        return voters.get(voter);
    }

    /**
     * @return the receipts in the order the votes were cast.
     */
    public synchronized List<VoteReceipt> getReceipts() {
        return new ArrayList<>(voters.values());
    }
}
