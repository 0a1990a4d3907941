package com.integration.migrator.binding;

import lombok.Builder;
import lombok.Value;

/**
 * One subscription filter statement of a send port. Operator "0" means equals.
 */
@Value
@Builder
public class FilterCondition {
    public static final String EQUALS = "0";
    public static final String RECEIVE_PORT_NAME = "BTS.ReceivePortName";

    String property;
    @Builder.Default
    String operator = EQUALS;
    String value;

    public boolean isEquality() {
        return EQUALS.equals(operator);
    }

    public boolean isReceivePortFilter() {
        return RECEIVE_PORT_NAME.equalsIgnoreCase(property);
    }
}
