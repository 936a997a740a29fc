package com.axlabs.neo.governance.events;

/**
 * Receives the events of a governance engine. Listeners are called synchronously after the operation that fired
 * the event took effect.
 */
@FunctionalInterface
public interface GovernanceEventListener {

    void onEvent(GovernanceEvent event);
}
