package com.axlabs.neo.governance.vote;

import java.util.Locale;

/**
 * How a voter's power turns into the weight of their vote.
 */
public enum WeightingMode {

    /**
     * The weight is the power.
     */
    LINEAR,

    /**
     * The weight is the integer square root of the power.
     */
    QUADRATIC,

    /**
     * The power is scaled by the voter's reputation: {@code power * (100 + reputation) / 100}.
     */
    REPUTATION;

    public static WeightingMode fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
