package com.integration.migrator.analysis;

/**
 * How a flow is activated, derived from its activating receives.
 */
public enum TriggerPattern {
    /** No activating receive: the flow is started by a caller. */
    CALLABLE,
    SINGLE_TRIGGER,
    /** One activating receive plus correlated follow-up receives. */
    CONVOY,
    /** Several activating receives inside one listen: the first message wins. */
    LISTEN_FIRST_TO_COMPLETE,
    /** Several activating receives in parallel branches. Not expressible as one trigger. */
    PARALLEL_ALL_MUST_COMPLETE,
    /** Several activating receives in sequence. */
    INVALID
}
