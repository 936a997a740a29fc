package com.axlabs.neo.governance.proposal;

/**
 * The phases of a proposal. Only {@link #QUEUED}, {@link #EXECUTED} and {@link #CANCELLED} are ever recorded, all
 * other states follow from the proposal's data, its votes and the current time.
 */
public enum ProposalState {

    PENDING,
    ACTIVE,
    DEFEATED,
    SUCCEEDED,
    QUEUED,
    EXECUTED,
    CANCELLED,
    EXPIRED;

    /**
     * @return true if no transition leads out of this state.
     */
    public boolean isTerminal() {
        return this == DEFEATED || this == EXECUTED || this == CANCELLED || this == EXPIRED;
    }
}
