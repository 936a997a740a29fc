package com.axlabs.neo.governance;

/**
 * The failures a governance operation can end in. Every error belongs to a {@link Category} that tells the caller
 * whether trying again later can succeed.
 */
public enum GovernanceError {

    INVALID_PROPOSAL(Category.VALIDATION, "Invalid proposal"),
    DUPLICATE_PROPOSAL(Category.VALIDATION, "Proposal already pending or active"),
    INVALID_VOTE(Category.VALIDATION, "Invalid vote"),
    INVALID_AMOUNT(Category.VALIDATION, "Invalid amount"),
    SELF_DELEGATION(Category.VALIDATION, "Cannot delegate to self"),

    NOT_AUTHORIZED(Category.AUTHORIZATION, "Not authorised"),

    VOTING_NOT_OPEN(Category.TEMPORAL, "Proposal not active"),
    VOTING_NOT_CLOSED(Category.TEMPORAL, "Voting not closed"),
    TIMELOCK_NOT_ELAPSED(Category.TEMPORAL, "Proposal not in execution phase"),

    NOT_FOUND(Category.STATE, "Proposal doesn't exist"),
    ILLEGAL_TRANSITION(Category.STATE, "Illegal state transition"),
    ALREADY_VOTED(Category.STATE, "Already voted on this proposal"),
    ALREADY_EXECUTED(Category.STATE, "Proposal already executed"),
    PROPOSAL_EXPIRED(Category.STATE, "Proposal expired"),
    NO_VOTING_POWER(Category.STATE, "No voting power at snapshot"),
    INSUFFICIENT_POWER(Category.STATE, "Insufficient undelegated power"),
    INSUFFICIENT_DELEGATION(Category.STATE, "Insufficient delegation"),

    TARGET_CALL_FAILED(Category.EXECUTION, "Target call failed");

    public enum Category {
        VALIDATION,
        AUTHORIZATION,
        TEMPORAL,
        STATE,
        EXECUTION
    }

    private final Category category;
    private final String reason;

    GovernanceError(Category category, String reason) {
        this.category = category;
        this.reason = reason;
    }

    public Category getCategory() {
        return category;
    }

    /**
     * @return the default human readable reason used in exception messages.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Tells if an operation that failed with this error can succeed when retried later without any change of input.
     *
     * @return true for temporal and execution errors.
     */
    public boolean isRetryable() {
        return category == Category.TEMPORAL || category == Category.EXECUTION;
    }
}
