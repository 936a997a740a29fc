package com.axlabs.neo.governance.proposal;

/**
 * Derives the current state of a proposal from its stored data and the current time.
 */
@FunctionalInterface
public interface ProposalStateResolver {

    ProposalState resolve(Proposal proposal, long now);
}
