package com.integration.migrator.model;

public enum BindingKind {
    LOGICAL,
    PHYSICAL,
    DIRECT,
    WEB,
    UNKNOWN
}
