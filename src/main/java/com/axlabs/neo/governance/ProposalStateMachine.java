package com.axlabs.neo.governance;

import com.axlabs.neo.governance.proposal.Proposal;
import com.axlabs.neo.governance.proposal.ProposalState;
import com.axlabs.neo.governance.proposal.ProposalStateResolver;
import com.axlabs.neo.governance.vote.ProposalVotes;
import com.axlabs.neo.governance.vote.TallyRule;
import com.axlabs.neo.governance.vote.VoteLedger;

/**
 * Derives proposal states from the recorded lifecycle markers, the votes and the time:
 * <pre>
 *  PENDING   now &lt; votingStart
 *  ACTIVE    votingStart &lt;= now &lt;= votingEnd
 *  SUCCEEDED now &gt; votingEnd, quorum reached and approved
 *  DEFEATED  now &gt; votingEnd, otherwise
 *  QUEUED    queued, not yet expired
 *  EXPIRED   queued and now &gt;= executeAfter + expirationLength (if expirationLength &gt; 0)
 *  EXECUTED, CANCELLED as recorded
 * </pre>
 */
public class ProposalStateMachine implements ProposalStateResolver {

    private final VoteLedger votes;
    private final TallyRule tallyRule;

    public ProposalStateMachine(VoteLedger votes, TallyRule tallyRule) {
        this.votes = votes;
        this.tallyRule = tallyRule;
    }

    @Override
    public ProposalState resolve(Proposal proposal, long now) {
        if (proposal.isExecuted()) {
            return ProposalState.EXECUTED;
        }
        if (proposal.isCancelled()) {
            return ProposalState.CANCELLED;
        }
        if (proposal.isQueued()) {
            long expiration = proposal.getExpiration();
            return expiration >= 0 && now >= expiration ? ProposalState.EXPIRED : ProposalState.QUEUED;
        }
        if (now < proposal.getVotingStart()) {
            return ProposalState.PENDING;
        }
        if (now <= proposal.getVotingEnd()) {
            return ProposalState.ACTIVE;
        }
        ProposalVotes pv = votes.votesOf(proposal.getId());
        return tallyRule.isAccepted(pv, proposal.getQuorum(), proposal.getAcceptanceRate())
                ? ProposalState.SUCCEEDED
                : ProposalState.DEFEATED;
    }
}
