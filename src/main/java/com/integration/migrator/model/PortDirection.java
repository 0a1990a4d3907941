package com.integration.migrator.model;

/**
 * Port direction as seen from the orchestration.
 */
public enum PortDirection {
    NONE,
    /** One-way inbound. */
    RECEIVE,
    /** One-way outbound. */
    SEND,
    /** Request-response implemented by the orchestration. */
    RECEIVE_SEND,
    /** Solicit-response used by the orchestration. */
    SEND_RECEIVE
}
