package com.axlabs.neo.governance.proposal;

import com.axlabs.neo.governance.vote.WeightingMode;
import io.neow3j.types.Hash160;
import io.neow3j.types.Hash256;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A proposal as held by the {@link ProposalStore}.
 * <p>
 * Everything but the lifecycle markers (queued, executed, cancelled) is fixed at creation. The markers are only set
 * through {@link ProposalStore#transition}. Votes are held separately by the vote ledger.
 */
public class Proposal {

    /**
     * The proposal's ID. IDs are assigned incrementally.
     */
    private final int id;

    /**
     * The creator of the proposal.
     */
    private final Hash160 proposer;

    /**
     * The proposal's intents executed if it gets accepted.
     */
    private final List<Intent> intents;

    /**
     * The description, e.g., the URL of the discussion of the proposal.
     */
    private final String description;

    /**
     * SHA-256 of the UTF-8 encoded description.
     */
    private final byte[] descriptionHash;

    /**
     * Hash over the intents and the description hash. Identifies proposals with identical content.
     */
    private final Hash256 proposalHash;

    private final long createdAt;

    /**
     * The first point in time at which votes are accepted.
     */
    private final long votingStart;

    /**
     * The last point in time at which votes are accepted.
     */
    private final long votingEnd;

    /**
     * The total weight of votes (approve, reject and abstain) necessary for this proposal to reach its quorum.
     */
    private final BigInteger quorum;

    /**
     * The necessary proportion of approving votes required for accepting this proposal. Given in percentage. E.g., a
     * value of 50 means that half of the votes have to approve.
     */
    private final int acceptanceRate;

    private final WeightingMode weightingMode;

    /**
     * The time between queuing and the earliest execution.
     */
    private final long timelockLength;

    /**
     * How long the proposal stays executable once its time lock ended. Zero means it never expires.
     */
    private final long expirationLength;

    /**
     * The time at which the proposal was queued. Negative as long as it is not queued.
     */
    private volatile long queuedAt = -1;

    /**
     * Tells if this proposal was already executed.
     */
    private volatile boolean executed;

    private volatile long executedAt = -1;

    private volatile boolean cancelled;

    /**
     * The state the proposal was in when it was last looked at. Used to report state changes that happen merely
     * by the passing of time.
     */
    private volatile ProposalState observedState = ProposalState.PENDING;

    Proposal(int id, Hash160 proposer, List<Intent> intents, String description, byte[] descriptionHash,
            Hash256 proposalHash, long createdAt, ProposalParameters params) {
        this.id = id;
        this.proposer = proposer;
        this.intents = Collections.unmodifiableList(intents);
        this.description = description;
        this.descriptionHash = descriptionHash;
        this.proposalHash = proposalHash;
        this.createdAt = createdAt;
        this.votingStart = createdAt + params.getVotingDelay();
        this.votingEnd = votingStart + params.getVotingPeriod();
        this.quorum = params.getQuorum();
        this.acceptanceRate = params.getAcceptanceRate();
        this.weightingMode = params.getWeightingMode();
        this.timelockLength = params.getTimelockLength();
        this.expirationLength = params.getExpirationLength();
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

    public List<Hash160> getTargets() {
        return intents.stream().map(Intent::getTarget).collect(Collectors.toList());
    }

    public List<BigInteger> getValues() {
        return intents.stream().map(Intent::getValue).collect(Collectors.toList());
    }

    public List<CallPayload> getPayloads() {
        return intents.stream().map(Intent::getPayload).collect(Collectors.toList());
    }

    public String getDescription() {
        return description;
    }

    public byte[] getDescriptionHash() {
        return descriptionHash.clone();
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

    /**
     * The point in time voting power is read at. It is the last instant before the voting starts, so that power
     * acquired once voting is open never counts.
     *
     * @return the snapshot.
     */
    public long getSnapshot() {
        return votingStart - 1;
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

    public long getTimelockLength() {
        return timelockLength;
    }

    public long getExpirationLength() {
        return expirationLength;
    }

    public boolean isQueued() {
        return queuedAt >= 0;
    }

    public long getQueuedAt() {
        return queuedAt;
    }

    /**
     * @return the earliest execution time, or -1 if the proposal is not queued.
     */
    public long getExecuteAfter() {
        return isQueued() ? saturatedAdd(queuedAt, timelockLength) : -1;
    }

    /**
     * @return the time from which on the queued proposal can no longer be executed, or -1 if it is not queued or
     * never expires.
     */
    public long getExpiration() {
        return isQueued() && expirationLength > 0 ? saturatedAdd(getExecuteAfter(), expirationLength) : -1;
    }

    private static long saturatedAdd(long time, long length) {
        return length > Long.MAX_VALUE - time ? Long.MAX_VALUE : time + length;
    }

    public boolean isExecuted() {
        return executed;
    }

    public long getExecutedAt() {
        return executedAt;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    ProposalState getObservedState() {
        return observedState;
    }

    void markQueued(long now) {
        queuedAt = now;
    }

    void markExecuted(long now) {
        executed = true;
        executedAt = now;
    }

    void markCancelled() {
        cancelled = true;
    }

    ProposalState observe(ProposalState state) {
        ProposalState previous = observedState;
        observedState = state;
        return previous;
    }
}
