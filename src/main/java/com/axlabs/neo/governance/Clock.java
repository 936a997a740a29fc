package com.axlabs.neo.governance;

/**
 * The time source of the governance engine. Values are milliseconds (or block heights) and must never decrease
 * between two reads.
 */
public interface Clock {

    long now();
}
