package com.axlabs.neo.governance.vote;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;
import com.axlabs.neo.governance.delegation.DelegationRegistry;
import com.axlabs.neo.governance.proposal.Proposal;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records the votes on proposals. Each account can vote once per proposal, with the power it had at the proposal's
 * snapshot.
 */
public class VoteLedger {

    private final DelegationRegistry delegations;
    private final ReputationSource reputationSource;
    private final Map<Integer, ProposalVotes> votes = new ConcurrentHashMap<>();

    /**
     * @param delegations      The source of voting power.
     * @param reputationSource The reputation used by {@link WeightingMode#REPUTATION}. May be null, in which case
     *                         that mode is not supported.
     */
    public VoteLedger(DelegationRegistry delegations, ReputationSource reputationSource) {
        this.delegations = Objects.requireNonNull(delegations, "delegations");
        this.reputationSource = reputationSource;
    }

    public boolean supports(WeightingMode mode) {
        return mode != WeightingMode.REPUTATION || reputationSource != null;
    }

    /**
     * Casts the vote of {@code voter} on {@code proposal}. The caller makes sure the proposal is active.
     *
     * @param proposal The proposal.
     * @param voter    The voter.
     * @param choice   The vote.
     * @param now      The time of the vote.
     * @return the weight the vote was counted with.
     */
    public BigInteger castVote(Proposal proposal, Hash160 voter, VoteChoice choice, long now) {
        Objects.requireNonNull(voter, "voter");
        if (choice == null) {
            throw new GovernanceException(GovernanceError.INVALID_VOTE, "VoteLedger.castVote");
        }
        ProposalVotes pv = votes.computeIfAbsent(proposal.getId(), id -> new ProposalVotes());
        synchronized (pv) {
            if (pv.hasVoted(voter)) {
                throw new GovernanceException(GovernanceError.ALREADY_VOTED, "VoteLedger.castVote");
            }
            BigInteger power = delegations.powerOf(voter, proposal.getSnapshot());
            if (power.signum() <= 0) {
                throw new GovernanceException(GovernanceError.NO_VOTING_POWER, "VoteLedger.castVote",
                        "No voting power at snapshot " + proposal.getSnapshot());
            }
            BigInteger weight = weighting(proposal.getWeightingMode())
                    .weigh(voter, power, proposal.getSnapshot());
            pv.add(new VoteReceipt(proposal.getId(), voter, choice, weight, now));
            return weight;
        }
    }

    private VoteWeighting weighting(WeightingMode mode) {
        switch (mode) {
            case QUADRATIC:
                return VoteWeighting.quadratic();
            case REPUTATION:
                if (reputationSource == null) {
                    throw new GovernanceException(GovernanceError.INVALID_VOTE, "VoteLedger.castVote",
                            "Reputation weighting not supported");
                }
                return VoteWeighting.reputation(reputationSource);
            default:
                return VoteWeighting.linear();
        }
    }

    /**
     * Gets the receipt of the vote of {@code voter} on the proposal with {@code proposalId}.
     */
    public VoteReceipt receiptOf(int proposalId, Hash160 voter) {
        ProposalVotes pv = votes.get(proposalId);
        VoteReceipt receipt = pv == null ? null : pv.getReceipt(voter);
        if (receipt == null) {
            throw new GovernanceException(GovernanceError.NOT_FOUND, "VoteLedger.receiptOf",
                    "No vote of " + voter + " on proposal " + proposalId);
        }
        return receipt;
    }

    public boolean hasVoted(int proposalId, Hash160 voter) {
        ProposalVotes pv = votes.get(proposalId);
        return pv != null && pv.hasVoted(voter);
    }

    /**
     * @return the votes on the proposal with {@code proposalId}, empty if nobody voted yet.
     */
    public ProposalVotes votesOf(int proposalId) {
        ProposalVotes pv = votes.get(proposalId);
        return pv == null ? new ProposalVotes() : pv;
    }
}
