package com.axlabs.neo.governance;

import com.axlabs.neo.governance.proposal.ProposalParameters;
import com.axlabs.neo.governance.vote.TallyRule;
import com.axlabs.neo.governance.vote.WeightingMode;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The parameters of a governance engine. Immutable, created with {@link #builder()} or loaded with
 * {@link GovernanceProperties}.
 * <p>
 * Lengths are given in the unit of the engine's {@link Clock}, usually milliseconds.
 */
public final class GovernanceConfig {

    // Parameter keys
    public static final String VOTING_DELAY_KEY = "voting_delay";
    public static final String VOTING_LENGTH_KEY = "voting_len";
    public static final String TIMELOCK_LENGTH_KEY = "timelock_len";
    public static final String EXPIRATION_LENGTH_KEY = "expiration_len";
    public static final String MIN_ACCEPTANCE_RATE_KEY = "min_accept_rate"; // percentage
    public static final String MIN_QUORUM_KEY = "min_quorum"; // voting weight
    public static final String WEIGHTING_KEY = "weighting";
    public static final String ABSTAIN_IN_APPROVAL_KEY = "abstain_in_approval";
    public static final String CANCELLERS_KEY = "cancellers";
    public static final String QUEUERS_KEY = "queuers";
    public static final String EXECUTORS_KEY = "executors";

    private final long votingDelay;
    private final long votingPeriod;
    private final long timelockLength;
    private final long expirationLength;
    private final int minAcceptanceRate;
    private final BigInteger minQuorum;
    private final WeightingMode weightingMode;
    private final boolean abstainCountsTowardApproval;
    private final Set<Hash160> cancellers;
    private final Set<Hash160> queuers;
    private final Set<Hash160> executors;

    private GovernanceConfig(Builder b) {
        this.votingDelay = b.votingDelay;
        this.votingPeriod = b.votingPeriod;
        this.timelockLength = b.timelockLength;
        this.expirationLength = b.expirationLength;
        this.minAcceptanceRate = b.minAcceptanceRate;
        this.minQuorum = b.minQuorum;
        this.weightingMode = b.weightingMode;
        this.abstainCountsTowardApproval = b.abstainCountsTowardApproval;
        this.cancellers = Collections.unmodifiableSet(new LinkedHashSet<>(b.cancellers));
        this.queuers = Collections.unmodifiableSet(new LinkedHashSet<>(b.queuers));
        this.executors = Collections.unmodifiableSet(new LinkedHashSet<>(b.executors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getVotingDelay() {
        return votingDelay;
    }

    public long getVotingPeriod() {
        return votingPeriod;
    }

    public long getTimelockLength() {
        return timelockLength;
    }

    /**
     * @return how long a queued proposal stays executable after its time lock ended. Zero means forever.
     */
    public long getExpirationLength() {
        return expirationLength;
    }

    /**
     * @return the acceptance rate proposals get by default. Proposers can only choose higher rates.
     */
    public int getMinAcceptanceRate() {
        return minAcceptanceRate;
    }

    /**
     * @return the quorum proposals get by default. Proposers can only choose higher quorums.
     */
    public BigInteger getMinQuorum() {
        return minQuorum;
    }

    public WeightingMode getWeightingMode() {
        return weightingMode;
    }

    public boolean isAbstainCountedTowardApproval() {
        return abstainCountsTowardApproval;
    }

    /**
     * @return the accounts that can cancel any pending or active proposal, in addition to its proposer.
     */
    public Set<Hash160> getCancellers() {
        return cancellers;
    }

    /**
     * @return the accounts allowed to queue proposals. Empty if anyone can.
     */
    public Set<Hash160> getQueuers() {
        return queuers;
    }

    /**
     * @return the accounts allowed to execute proposals. Empty if anyone can.
     */
    public Set<Hash160> getExecutors() {
        return executors;
    }

    public TallyRule tallyRule() {
        return new TallyRule(abstainCountsTowardApproval);
    }

    /**
     * @return the rules a proposal gets if the proposer does not choose its own quorum and acceptance rate.
     */
    public ProposalParameters defaultProposalParameters() {
        return new ProposalParameters(votingDelay, votingPeriod, timelockLength, expirationLength, minQuorum,
                minAcceptanceRate, weightingMode);
    }

    /**
     * Checks that {@code value} is valid for the numeric parameter {@code paramKey}.
     *
     * @throws IllegalArgumentException if the value is invalid or the parameter unknown.
     */
    static void throwOnInvalidValue(String paramKey, long value) {
        switch (paramKey) {
            case VOTING_DELAY_KEY:
            case VOTING_LENGTH_KEY:
            case TIMELOCK_LENGTH_KEY:
            case EXPIRATION_LENGTH_KEY:
            case MIN_QUORUM_KEY:
                if (value < 0) throw new IllegalArgumentException("Invalid parameter value for " + paramKey);
                break;
            case MIN_ACCEPTANCE_RATE_KEY:
                if (value <= 0 || value > 100) {
                    throw new IllegalArgumentException("Invalid parameter value for " + paramKey);
                }
                break;
            default:
                throw new IllegalArgumentException("Unknown parameter " + paramKey);
        }
    }

    @Override
    public String toString() {
        return "GovernanceConfig{" +
                VOTING_DELAY_KEY + "=" + votingDelay +
                ", " + VOTING_LENGTH_KEY + "=" + votingPeriod +
                ", " + TIMELOCK_LENGTH_KEY + "=" + timelockLength +
                ", " + EXPIRATION_LENGTH_KEY + "=" + expirationLength +
                ", " + MIN_ACCEPTANCE_RATE_KEY + "=" + minAcceptanceRate +
                ", " + MIN_QUORUM_KEY + "=" + minQuorum +
                ", " + WEIGHTING_KEY + "=" + weightingMode +
                ", " + ABSTAIN_IN_APPROVAL_KEY + "=" + abstainCountsTowardApproval +
                "}";
    }

    public static final class Builder {

        private long votingDelay = 0;
        private long votingPeriod = 7 * 24 * 3600 * 1000L; // 1 week
        private long timelockLength = 2 * 24 * 3600 * 1000L; // 2 days
        private long expirationLength = 0;
        private int minAcceptanceRate = 50;
        private BigInteger minQuorum = BigInteger.ZERO;
        private WeightingMode weightingMode = WeightingMode.LINEAR;
        private boolean abstainCountsTowardApproval = false;
        private final Set<Hash160> cancellers = new LinkedHashSet<>();
        private final Set<Hash160> queuers = new LinkedHashSet<>();
        private final Set<Hash160> executors = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder votingDelay(long votingDelay) {
            throwOnInvalidValue(VOTING_DELAY_KEY, votingDelay);
            this.votingDelay = votingDelay;
            return this;
        }

        public Builder votingPeriod(long votingPeriod) {
            throwOnInvalidValue(VOTING_LENGTH_KEY, votingPeriod);
            this.votingPeriod = votingPeriod;
            return this;
        }

        public Builder timelockLength(long timelockLength) {
            throwOnInvalidValue(TIMELOCK_LENGTH_KEY, timelockLength);
            this.timelockLength = timelockLength;
            return this;
        }

        public Builder expirationLength(long expirationLength) {
            throwOnInvalidValue(EXPIRATION_LENGTH_KEY, expirationLength);
            this.expirationLength = expirationLength;
            return this;
        }

        public Builder minAcceptanceRate(int minAcceptanceRate) {
            throwOnInvalidValue(MIN_ACCEPTANCE_RATE_KEY, minAcceptanceRate);
            this.minAcceptanceRate = minAcceptanceRate;
            return this;
        }

        public Builder minQuorum(BigInteger minQuorum) {
            Objects.requireNonNull(minQuorum, MIN_QUORUM_KEY);
            if (minQuorum.signum() < 0) {
                throw new IllegalArgumentException("Invalid parameter value for " + MIN_QUORUM_KEY);
            }
            this.minQuorum = minQuorum;
            return this;
        }

        public Builder minQuorum(long minQuorum) {
            return minQuorum(BigInteger.valueOf(minQuorum));
        }

        public Builder weightingMode(WeightingMode weightingMode) {
            this.weightingMode = Objects.requireNonNull(weightingMode, WEIGHTING_KEY);
            return this;
        }

        public Builder abstainCountsTowardApproval(boolean abstainCountsTowardApproval) {
            this.abstainCountsTowardApproval = abstainCountsTowardApproval;
            return this;
        }

        public Builder canceller(Hash160 account) {
            cancellers.add(Objects.requireNonNull(account));
            return this;
        }

        public Builder queuer(Hash160 account) {
            queuers.add(Objects.requireNonNull(account));
            return this;
        }

        public Builder executor(Hash160 account) {
            executors.add(Objects.requireNonNull(account));
            return this;
        }

        public GovernanceConfig build() {
            return new GovernanceConfig(this);
        }
    }
}
