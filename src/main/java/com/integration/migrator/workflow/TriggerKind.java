package com.integration.migrator.workflow;

public enum TriggerKind {
    REQUEST,
    CONNECTOR
}
