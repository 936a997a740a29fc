package com.axlabs.neo.governance.vote;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;
import com.axlabs.neo.governance.delegation.BalanceHistory;
import com.axlabs.neo.governance.delegation.DelegationRegistry;
import com.axlabs.neo.governance.proposal.Proposal;
import com.axlabs.neo.governance.proposal.ProposalParameters;
import com.axlabs.neo.governance.proposal.ProposalStore;
import com.axlabs.neo.governance.proposal.ProposalState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.axlabs.neo.governance.util.TestHelper.ALICE;
import static com.axlabs.neo.governance.util.TestHelper.BOB;
import static com.axlabs.neo.governance.util.TestHelper.TREASURY;
import static com.axlabs.neo.governance.util.TestHelper.releaseCall;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class VoteLedgerTest {

    private BalanceHistory powers;
    private VoteLedger ledger;
    private ProposalStore store;

    @BeforeEach
    public void setUp() {
        powers = new BalanceHistory();
        powers.setPower(ALICE, BigInteger.valueOf(100), 0);
        powers.setPower(BOB, BigInteger.valueOf(400), 0);
        ledger = new VoteLedger(new DelegationRegistry(powers), (account, snapshot) -> BigInteger.valueOf(10));
        store = new ProposalStore((p, now) -> ProposalState.ACTIVE);
    }

    private Proposal proposal(WeightingMode mode) {
        ProposalParameters params = new ProposalParameters(10, 100, 0, 0, BigInteger.ZERO, 50, mode);
        int id = store.create(ALICE, Collections.singletonList(TREASURY),
                Collections.singletonList(BigInteger.ZERO), Collections.singletonList(releaseCall(ALICE, 1)),
                "proposal " + store.count(), params, 100);
        return store.get(id);
    }

    @Test
    public void succeed_recording_votes_and_receipts() {
        Proposal p = proposal(WeightingMode.LINEAR);
        ledger.castVote(p, ALICE, VoteChoice.FOR, 120);
        ledger.castVote(p, BOB, VoteChoice.ABSTAIN, 121);

        ProposalVotes votes = ledger.votesOf(p.getId());
        assertThat(votes.getApprove(), is(BigInteger.valueOf(100)));
        assertThat(votes.getAbstain(), is(BigInteger.valueOf(400)));
        assertThat(votes.getTotal(), is(BigInteger.valueOf(500)));
        VoteReceipt receipt = ledger.receiptOf(p.getId(), BOB);
        assertThat(receipt.getChoice(), is(VoteChoice.ABSTAIN));
        assertThat(receipt.getTimestamp(), is(121L));
        assertThat(votes.getReceipts().get(0).getVoter(), is(ALICE));
    }

    @Test
    public void succeed_weighing_quadratic_and_by_reputation() {
        Proposal quadratic = proposal(WeightingMode.QUADRATIC);
        Proposal reputation = proposal(WeightingMode.REPUTATION);
        assertThat(ledger.castVote(quadratic, BOB, VoteChoice.FOR, 120), is(BigInteger.valueOf(20)));
        assertThat(ledger.castVote(reputation, BOB, VoteChoice.FOR, 120), is(BigInteger.valueOf(440)));
    }

    @Test
    public void fail_weighing_by_reputation_without_source() {
        VoteLedger plain = new VoteLedger(new DelegationRegistry(powers), null);
        assertThat(plain.supports(WeightingMode.REPUTATION), is(false));
        GovernanceException e = assertThrows(GovernanceException.class,
                () -> plain.castVote(proposal(WeightingMode.REPUTATION), ALICE, VoteChoice.FOR, 120));
        assertThat(e.getError(), is(GovernanceError.INVALID_VOTE));
    }

    @Test
    public void fail_getting_missing_receipt() {
        Proposal p = proposal(WeightingMode.LINEAR);
        GovernanceException e = assertThrows(GovernanceException.class, () -> ledger.receiptOf(p.getId(), ALICE));
        assertThat(e.getError(), is(GovernanceError.NOT_FOUND));
        assertThat(ledger.hasVoted(p.getId(), ALICE), is(false));
    }

    @Test
    public void succeed_counting_only_one_of_concurrent_votes_of_same_voter() throws Exception {
        Proposal p = proposal(WeightingMode.LINEAR);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> results = new ArrayList<>();
        Callable<Boolean> vote = () -> {
            try {
                ledger.castVote(p, BOB, VoteChoice.FOR, 120);
                return true;
            } catch (GovernanceException e) {
                assertTrue(e.getMessage().endsWith("Already voted on this proposal"));
                return false;
            }
        };
        for (int i = 0; i < 32; i++) {
            results.add(executor.submit(vote));
        }
        int successes = 0;
        for (Future<Boolean> r : results) {
            if (r.get()) {
                successes++;
            }
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertThat(successes, is(1));
        assertThat(ledger.votesOf(p.getId()).getApprove(), is(BigInteger.valueOf(400)));
        assertThat(ledger.votesOf(p.getId()).getReceipts().size(), is(1));
        assertThat(ledger.votesOf(p.getId()).getReceipts(), contains(ledger.receiptOf(p.getId(), BOB)));
    }
}
