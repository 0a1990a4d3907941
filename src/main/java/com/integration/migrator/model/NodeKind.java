package com.integration.migrator.model;

/**
 * Kind tag of a process-flow node. Several kinds share one node class
 * (e.g. the four scope flavours), the class decides dispatch, the kind decides wording.
 */
public enum NodeKind {
    RECEIVE,
    SEND,
    DECIDE,
    SWITCH,
    LOOP,
    WHILE,
    UNTIL,
    PARALLEL,
    PARALLEL_BRANCH,
    LISTEN,
    CONSTRUCT,
    TRANSFORM,
    VARIABLE_DECLARATION,
    MESSAGE_ASSIGNMENT,
    VARIABLE_ASSIGNMENT,
    CORRELATION_DECLARATION,
    SCOPE,
    ATOMIC_TRANSACTION,
    LONG_RUNNING_TRANSACTION,
    COMPENSATION_SCOPE,
    CATCH,
    CALL,
    START,
    TERMINATE,
    DELAY,
    COMPENSATE,
    GROUP,
    TASK,
    CALL_POLICY,
    EXPRESSION,
    FALLBACK;

    public boolean isTransaction() {
        return this == ATOMIC_TRANSACTION || this == LONG_RUNNING_TRANSACTION;
    }
}
