package com.axlabs.neo.governance.vote;

import java.math.BigInteger;

/**
 * Decides whether the votes on a proposal accept it.
 * <p>
 * All votes, including abstentions, count toward the quorum. Whether abstentions also count toward the approval
 * ratio's denominator is configurable. By default they do not.
 */
public class TallyRule {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final boolean abstainCountsTowardApproval;

    public TallyRule(boolean abstainCountsTowardApproval) {
        this.abstainCountsTowardApproval = abstainCountsTowardApproval;
    }

    public boolean isAbstainCountedTowardApproval() {
        return abstainCountsTowardApproval;
    }

    /**
     * A proposal without any votes never reaches its quorum, even if the quorum is zero.
     */
    public boolean isQuorumReached(ProposalVotes votes, BigInteger quorum) {
        BigInteger total = votes.getTotal();
        return total.signum() > 0 && total.compareTo(quorum) >= 0;
    }

    /**
     * Checks {@code approve * 100 >= acceptanceRate * (approve + reject [+ abstain])}. Equality passes. Without any
     * approving vote a proposal is never approved.
     */
    public boolean isApproved(ProposalVotes votes, int acceptanceRate) {
        BigInteger approve = votes.getApprove();
        if (approve.signum() == 0) {
            return false;
        }
        BigInteger denominator = approve.add(votes.getReject());
        if (abstainCountsTowardApproval) {
            denominator = denominator.add(votes.getAbstain());
        }
        return approve.multiply(HUNDRED).compareTo(BigInteger.valueOf(acceptanceRate).multiply(denominator)) >= 0;
    }

    public boolean isAccepted(ProposalVotes votes, BigInteger quorum, int acceptanceRate) {
        return isQuorumReached(votes, quorum) && isApproved(votes, acceptanceRate);
    }
}
