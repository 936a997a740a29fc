package com.axlabs.neo.governance.vote;

import com.axlabs.neo.governance.GovernanceError;
import com.axlabs.neo.governance.GovernanceException;

/**
 * A vote. The numeric codes are -1 for rejecting, 1 for approving and 0 for abstaining.
 */
public enum VoteChoice {

    AGAINST(-1),
    FOR(1),
    ABSTAIN(0);

    private final int code;

    VoteChoice(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static VoteChoice fromCode(int code) {
        for (VoteChoice c : values()) {
            if (c.code == code) {
                return c;
            }
        }
        throw new GovernanceException(GovernanceError.INVALID_VOTE, "VoteChoice.fromCode",
                "Invalid vote " + code);
    }
}
