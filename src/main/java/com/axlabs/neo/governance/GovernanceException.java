package com.axlabs.neo.governance;

/**
 * Thrown when a governance operation is rejected. The operation never leaves partial changes behind when this is
 * thrown.
 * <p>
 * Messages have the form {@code [Class.method] Reason}.
 */
public class GovernanceException extends RuntimeException {

    private final GovernanceError error;

    public GovernanceException(GovernanceError error, String method) {
        this(error, method, error.getReason());
    }

    public GovernanceException(GovernanceError error, String method, String reason) {
        super("[" + method + "] " + reason);
        this.error = error;
    }

    public GovernanceError getError() {
        return error;
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
