package com.integration.migrator.binding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * Send ports that subscribe to the same promoted property with different values.
 */
@Getter
public class ContentBasedRoutingGroup {
    private final String routingProperty;
    private final Map<String, List<SendPortBinding>> routesByValue = new LinkedHashMap<>();

    public ContentBasedRoutingGroup(String routingProperty) {
        this.routingProperty = routingProperty;
    }

    void addRoute(String value, SendPortBinding sendPort) {
        routesByValue.computeIfAbsent(value, v -> new ArrayList<>()).add(sendPort);
    }

    public String getPropertyShortName() {
        int dot = routingProperty.lastIndexOf('.');
        return dot >= 0 ? routingProperty.substring(dot + 1) : routingProperty;
    }

    public List<SendPortBinding> allSendPorts() {
        List<SendPortBinding> all = new ArrayList<>();
        routesByValue.values().forEach(all::addAll);
        return all;
    }
}
