package com.integration.migrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Port-type operation with the message types bound to its request, response and fault slots.
 */
@Value
@Builder
public class OperationDeclaration {
    String name;
    String operationType;
    String requestMessageType;
    String responseMessageType;
    String faultMessageType;
}
