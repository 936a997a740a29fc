package com.axlabs.neo.governance.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every governance event to the log.
 */
public class LoggingEventListener implements GovernanceEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(GovernanceEvent event) {
        log.info("{} at {}: {}", event.getName(), event.getTimestamp(), event);
    }
}
