package com.axlabs.neo.governance;

import com.axlabs.neo.governance.proposal.Intent;
import com.axlabs.neo.governance.proposal.Proposal;
import com.axlabs.neo.governance.proposal.ProposalState;
import com.axlabs.neo.governance.vote.ProposalVotes;
import com.axlabs.neo.governance.vote.WeightingMode;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.util.List;

/**
 * Used to return all proposal information, including its votes and current state, as one structure in getter
 * methods.
 */
public final class ProposalDTO {

    private final int id;
    private final Hash160 proposer;
    private final List<Intent> intents;
    private final String description;
    private final Hash256 proposalHash;
    private final long createdAt;
    private final long votingStart;
    private final long votingEnd;
    private final long snapshot;
    private final BigInteger quorum;
    private final int acceptanceRate;
    private final WeightingMode weightingMode;
    private final long queuedAt;
    private final long executeAfter;
    private final long expiration;
    private final boolean executed;
    private final BigInteger approve;
    private final BigInteger reject;
    private final BigInteger abstain;
    private final int voterCount;
    private final ProposalState state;

    ProposalDTO(Proposal p, ProposalVotes votes, ProposalState state) {
        this.id = p.getId();
        this.proposer = p.getProposer();
        this.intents = p.getIntents();
        this.description = p.getDescription();
        this.proposalHash = p.getProposalHash();
        this.createdAt = p.getCreatedAt();
        this.votingStart = p.getVotingStart();
        this.votingEnd = p.getVotingEnd();
        this.snapshot = p.getSnapshot();
        this.quorum = p.getQuorum();
        this.acceptanceRate = p.getAcceptanceRate();
        this.weightingMode = p.getWeightingMode();
        this.queuedAt = p.getQueuedAt();
        this.executeAfter = p.getExecuteAfter();
        this.expiration = p.getExpiration();
        this.executed = p.isExecuted();
        this.approve = votes.getApprove();
        this.reject = votes.getReject();
        this.abstain = votes.getAbstain();
        this.voterCount = votes.getVoterCount();
        this.state = state;
    }

    public int getId() {
        return id;
    }

    public Hash160 getProposer() {
        return proposer;
    }

    public List<Intent> getIntents() {
        return intents;
    }

    public String getDescription() {
        return description;
    }

    public Hash256 getProposalHash() {
        return proposalHash;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getVotingStart() {
        return votingStart;
    }

    public long getVotingEnd() {
        return votingEnd;
    }

    public long getSnapshot() {
        return snapshot;
    }

    public BigInteger getQuorum() {
        return quorum;
    }

    public int getAcceptanceRate() {
        return acceptanceRate;
    }

    public WeightingMode getWeightingMode() {
        return weightingMode;
    }

    public long getQueuedAt() {
        return queuedAt;
    }

    public long getExecuteAfter() {
        return executeAfter;
    }

    public long getExpiration() {
        return expiration;
    }

    public boolean isExecuted() {
        return executed;
    }

    public BigInteger getApprove() {
        return approve;
    }

    public BigInteger getReject() {
        return reject;
    }

    public BigInteger getAbstain() {
        return abstain;
    }

    public int getVoterCount() {
        return voterCount;
    }

    public ProposalState getState() {
        return state;
    }

    @Override
    public String toString() {
        return "ProposalDTO{id=" + id + ", state=" + state + ", approve=" + approve + ", reject=" + reject
                + ", abstain=" + abstain + "}";
    }
}
