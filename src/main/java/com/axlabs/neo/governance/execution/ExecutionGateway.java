package com.axlabs.neo.governance.execution;

import com.axlabs.neo.governance.proposal.Intent;

import java.util.List;

/**
 * Carries out the effects of accepted proposals.
 * <p>
 * Implementations report failures through the returned {@link ExecutionResult} instead of throwing.
 */
public interface ExecutionGateway {

    /**
     * Invokes all {@code intents} in order as one unit. Either every intent takes effect or none does.
     *
     * @param intents The intents of a proposal.
     * @return on success the return value of each intent, in order. On failure the reason and, if known, the index
     * of the failing intent.
     */
    ExecutionResult invokeAll(List<Intent> intents);
}
