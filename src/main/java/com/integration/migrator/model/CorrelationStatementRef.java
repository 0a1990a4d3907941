package com.integration.migrator.model;

import lombok.Value;

/**
 * Reference from a correlation declaration to the statement (by source id) that uses it.
 */
@Value
public class CorrelationStatementRef {
    String refId;
    boolean initializes;
}
