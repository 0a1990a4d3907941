package com.integration.migrator.workflow;

public enum ActionKind {
    INITIALIZE_VARIABLE,
    COMPOSE,
    IF,
    SWITCH,
    SCOPE,
    FOREACH,
    UNTIL,
    PARALLEL,
    TERMINATE,
    DELAY,
    TRANSFORM_XSLT,
    SEND_CONNECTOR,
    RESPONSE,
    INVOKE_WORKFLOW,
    RULE_EXECUTE,
    X12_DECODE,
    EDIFACT_DECODE;

    public boolean isDecode() {
        return this == X12_DECODE || this == EDIFACT_DECODE;
    }
}
