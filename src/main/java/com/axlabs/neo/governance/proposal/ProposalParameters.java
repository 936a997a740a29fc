package com.axlabs.neo.governance.proposal;

import com.axlabs.neo.governance.vote.WeightingMode;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The rules a proposal is created with. They are copied into the proposal and do not change after creation, even
 * if the governance configuration changes.
 */
public final class ProposalParameters {

    private final long votingDelay;
    private final long votingPeriod;
    private final long timelockLength;
    private final long expirationLength;
    private final BigInteger quorum;
    private final int acceptanceRate;
    private final WeightingMode weightingMode;

    public ProposalParameters(long votingDelay, long votingPeriod, long timelockLength, long expirationLength,
            BigInteger quorum, int acceptanceRate, WeightingMode weightingMode) {
        this.votingDelay = votingDelay;
        this.votingPeriod = votingPeriod;
        this.timelockLength = timelockLength;
        this.expirationLength = expirationLength;
        this.quorum = quorum;
        this.acceptanceRate = acceptanceRate;
        this.weightingMode = weightingMode;
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
     * @return how long a queued proposal stays executable after its timelock ended. Zero means forever.
     */
    public long getExpirationLength() {
        return expirationLength;
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

    public ProposalParameters withVoteRules(BigInteger quorum, int acceptanceRate) {
        return new ProposalParameters(votingDelay, votingPeriod, timelockLength, expirationLength, quorum,
                acceptanceRate, weightingMode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProposalParameters)) return false;
        ProposalParameters that = (ProposalParameters) o;
        return votingDelay == that.votingDelay && votingPeriod == that.votingPeriod
                && timelockLength == that.timelockLength && expirationLength == that.expirationLength
                && acceptanceRate == that.acceptanceRate && Objects.equals(quorum, that.quorum)
                && weightingMode == that.weightingMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(votingDelay, votingPeriod, timelockLength, expirationLength, quorum, acceptanceRate,
                weightingMode);
    }
}
