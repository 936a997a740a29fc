package com.axlabs.neo.governance.events;

import com.axlabs.neo.governance.proposal.ProposalState;
import com.axlabs.neo.governance.vote.VoteChoice;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Base of all events fired by the governance engine.
 */
public abstract class GovernanceEvent {

    private final String name;
    private final long timestamp;

    protected GovernanceEvent(String name, long timestamp) {
        this.name = name;
        this.timestamp = timestamp;
    }

    /**
     * @return the display name of the event, e.g., {@code ProposalCreated}.
     */
    public String getName() {
        return name;
    }

    public long getTimestamp() {
        return timestamp;
    }

    //region EVENTS

    public static final class ProposalCreated extends GovernanceEvent {
        private final int proposalId;
        private final Hash160 proposer;
        private final long votingStart;
        private final long votingEnd;
        private final BigInteger quorum;
        private final int acceptanceRate;

        public ProposalCreated(long timestamp, int proposalId, Hash160 proposer, long votingStart, long votingEnd,
                BigInteger quorum, int acceptanceRate) {
            super("ProposalCreated", timestamp);
            this.proposalId = proposalId;
            this.proposer = proposer;
            this.votingStart = votingStart;
            this.votingEnd = votingEnd;
            this.quorum = quorum;
            this.acceptanceRate = acceptanceRate;
        }

        public int getProposalId() {
            return proposalId;
        }

        public Hash160 getProposer() {
            return proposer;
        }

        public long getVotingStart() {
            return votingStart;
        }

        public long getVotingEnd() {
            return votingEnd;
        }

        public BigInteger getQuorum() {
            return quorum;
        }

        public int getAcceptanceRate() {
            return acceptanceRate;
        }

        @Override
        public String toString() {
            return "ProposalCreated{id=" + proposalId + ", proposer=" + proposer + ", voting=[" + votingStart
                    + ", " + votingEnd + "], quorum=" + quorum + ", acceptanceRate=" + acceptanceRate + "}";
        }
    }

    public static final class VoteCast extends GovernanceEvent {
        private final int proposalId;
        private final Hash160 voter;
        private final VoteChoice choice;
        private final BigInteger weight;

        public VoteCast(long timestamp, int proposalId, Hash160 voter, VoteChoice choice, BigInteger weight) {
            super("VoteCast", timestamp);
            this.proposalId = proposalId;
            this.voter = voter;
            this.choice = choice;
            this.weight = weight;
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

        public BigInteger getWeight() {
            return weight;
        }

        @Override
        public String toString() {
            return "VoteCast{id=" + proposalId + ", voter=" + voter + ", choice=" + choice + ", weight=" + weight
                    + "}";
        }
    }

    public static final class ProposalStateChanged extends GovernanceEvent {
        private final int proposalId;
        private final ProposalState from;
        private final ProposalState to;

        public ProposalStateChanged(long timestamp, int proposalId, ProposalState from, ProposalState to) {
            super("ProposalStateChanged", timestamp);
            this.proposalId = proposalId;
            this.from = from;
            this.to = to;
        }

        public int getProposalId() {
            return proposalId;
        }

        public ProposalState getFrom() {
            return from;
        }

        public ProposalState getTo() {
            return to;
        }

        @Override
        public String toString() {
            return "ProposalStateChanged{id=" + proposalId + ", " + from + " -> " + to + "}";
        }
    }

    public static final class ProposalQueued extends GovernanceEvent {
        private final int proposalId;
        private final Hash160 caller;
        private final long executeAfter;

        public ProposalQueued(long timestamp, int proposalId, Hash160 caller, long executeAfter) {
            super("ProposalQueued", timestamp);
            this.proposalId = proposalId;
            this.caller = caller;
            this.executeAfter = executeAfter;
        }

        public int getProposalId() {
            return proposalId;
        }

        public Hash160 getCaller() {
            return caller;
        }

        public long getExecuteAfter() {
            return executeAfter;
        }

        @Override
        public String toString() {
            return "ProposalQueued{id=" + proposalId + ", caller=" + caller + ", executeAfter=" + executeAfter + "}";
        }
    }

    public static final class ProposalExecuted extends GovernanceEvent {
        private final int proposalId;
        private final Hash160 caller;

        public ProposalExecuted(long timestamp, int proposalId, Hash160 caller) {
            super("ProposalExecuted", timestamp);
            this.proposalId = proposalId;
            this.caller = caller;
        }

        public int getProposalId() {
            return proposalId;
        }

        public Hash160 getCaller() {
            return caller;
        }

        @Override
        public String toString() {
            return "ProposalExecuted{id=" + proposalId + ", caller=" + caller + "}";
        }
    }

    public static final class ProposalCancelled extends GovernanceEvent {
        private final int proposalId;
        private final Hash160 caller;

        public ProposalCancelled(long timestamp, int proposalId, Hash160 caller) {
            super("ProposalCancelled", timestamp);
            this.proposalId = proposalId;
            this.caller = caller;
        }

        public int getProposalId() {
            return proposalId;
        }

        public Hash160 getCaller() {
            return caller;
        }

        @Override
        public String toString() {
            return "ProposalCancelled{id=" + proposalId + ", caller=" + caller + "}";
        }
    }

    public static final class DelegationChanged extends GovernanceEvent {
        private final Hash160 delegator;
        private final Hash160 delegate;
        private final BigInteger amount;
        private final BigInteger delegatePower;

        public DelegationChanged(long timestamp, Hash160 delegator, Hash160 delegate, BigInteger amount,
                BigInteger delegatePower) {
            super("DelegationChanged", timestamp);
            this.delegator = delegator;
            this.delegate = delegate;
            this.amount = amount;
            this.delegatePower = delegatePower;
        }

        public Hash160 getDelegator() {
            return delegator;
        }

        public Hash160 getDelegate() {
            return delegate;
        }

        /**
         * @return the delegated amount after the change.
         */
        public BigInteger getAmount() {
            return amount;
        }

        /**
         * @return the voting power of the delegate after the change.
         */
        public BigInteger getDelegatePower() {
            return delegatePower;
        }

        @Override
        public String toString() {
            return "DelegationChanged{" + delegator + " -> " + delegate + ", amount=" + amount + ", delegatePower="
                    + delegatePower + "}";
        }
    }

    //endregion EVENTS
}
