package com.axlabs.neo.governance;

/**
 * Thrown by {@link GovernanceEngine#execute} if one of the proposal's intents fails. None of the intents took effect.
 * The proposal stays queued and the execution can be retried.
 */
public class TargetCallFailedException extends GovernanceException {

    private final int proposalId;
    private final int intentIndex;
    private final Object returnData;

    public TargetCallFailedException(int proposalId, int intentIndex, Object returnData, String message) {
        super(GovernanceError.TARGET_CALL_FAILED, "GovernanceEngine.execute",
                (intentIndex < 0 ? "Execution of proposal " + proposalId
                        : "Intent " + intentIndex + " of proposal " + proposalId) + " failed"
                        + (message == null ? "" : ": " + message));
        this.proposalId = proposalId;
        this.intentIndex = intentIndex;
        this.returnData = returnData;
    }

    public int getProposalId() {
        return proposalId;
    }

    /**
     * @return the position of the failing intent in the proposal's intent list, or -1 if the gateway could not tell
     * which intent failed.
     */
    public int getIntentIndex() {
        return intentIndex;
    }

    /**
     * @return whatever the failing target returned, or null if it returned nothing.
     */
    public Object getReturnData() {
        return returnData;
    }
}
