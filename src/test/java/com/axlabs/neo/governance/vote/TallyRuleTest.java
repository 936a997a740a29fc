package com.axlabs.neo.governance.vote;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.axlabs.neo.governance.util.TestHelper.ALICE;
import static com.axlabs.neo.governance.util.TestHelper.BOB;
import static com.axlabs.neo.governance.util.TestHelper.CHARLIE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

public class TallyRuleTest {

    private final TallyRule rule = new TallyRule(false);

    private static ProposalVotes votes(long approve, long reject, long abstain) {
        ProposalVotes votes = new ProposalVotes();
        if (approve > 0) votes.add(new VoteReceipt(0, ALICE, VoteChoice.FOR, BigInteger.valueOf(approve), 0));
        if (reject > 0) votes.add(new VoteReceipt(0, BOB, VoteChoice.AGAINST, BigInteger.valueOf(reject), 0));
        if (abstain > 0) votes.add(new VoteReceipt(0, CHARLIE, VoteChoice.ABSTAIN, BigInteger.valueOf(abstain), 0));
        return votes;
    }

    @Test
    public void succeed_at_exact_acceptance_rate() {
        assertThat(rule.isApproved(votes(60, 40, 0), 60), is(true));
    }

    @Test
    public void fail_just_below_acceptance_rate() {
        assertThat(rule.isApproved(votes(60, 40, 0), 61), is(false));
    }

    @Test
    public void fail_without_approving_votes() {
        assertThat(rule.isApproved(votes(0, 0, 100), 1), is(false));
        assertThat(rule.isApproved(votes(0, 0, 0), 1), is(false));
    }

    @Test
    public void fail_with_zero_votes_and_zero_quorum() {
        assertThat(rule.isQuorumReached(votes(0, 0, 0), BigInteger.ZERO), is(false));
    }

    @Test
    public void succeed_counting_abstentions_toward_quorum() {
        ProposalVotes votes = votes(10, 0, 90);
        assertThat(rule.isQuorumReached(votes, BigInteger.valueOf(100)), is(true));
        assertThat(rule.isQuorumReached(votes, BigInteger.valueOf(101)), is(false));
        assertThat(rule.isAccepted(votes, BigInteger.valueOf(100), 100), is(true));
    }

    @Test
    public void fail_with_majority_but_without_quorum() {
        assertThat(rule.isAccepted(votes(99, 0, 0), BigInteger.valueOf(100), 50), is(false));
    }

    @Test
    public void succeed_counting_abstentions_toward_approval_if_configured() {
        TallyRule strict = new TallyRule(true);
        ProposalVotes votes = votes(50, 0, 50);
        assertThat(rule.isApproved(votes, 51), is(true));
        assertThat(strict.isApproved(votes, 51), is(false));
        assertThat(strict.isApproved(votes, 50), is(true));
    }
}
