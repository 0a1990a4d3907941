package com.integration.migrator.binding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * Deployment metadata read from a binding file: receive locations and send ports, in file order.
 */
@Getter
public class BindingSnapshot {

    private final List<ReceiveLocationBinding> receiveLocations;
    private final List<SendPortBinding> sendPorts;

    public BindingSnapshot(List<ReceiveLocationBinding> receiveLocations, List<SendPortBinding> sendPorts) {
        this.receiveLocations = List.copyOf(receiveLocations);
        this.sendPorts = List.copyOf(sendPorts);
    }

    public static BindingSnapshot empty() {
        return new BindingSnapshot(List.of(), List.of());
    }

    public boolean isEmpty() {
        return receiveLocations.isEmpty() && sendPorts.isEmpty();
    }

    public Map<String, List<ReceiveLocationBinding>> receiveLocationsByPort() {
        Map<String, List<ReceiveLocationBinding>> byPort = new LinkedHashMap<>();
        for (ReceiveLocationBinding location : receiveLocations) {
            byPort.computeIfAbsent(location.getReceivePortName(), p -> new ArrayList<>()).add(location);
        }
        return byPort;
    }

    /**
     * Send ports subscribed to the receive port through an equality filter on its name.
     */
    public List<SendPortBinding> sendPortsForReceivePort(String receivePortName) {
        if (receivePortName == null) {
            return List.of();
        }
        return sendPorts.stream()
                .filter(sp -> sp.getFilters().stream()
                        .anyMatch(f -> f.isReceivePortFilter() && f.isEquality()
                                && receivePortName.equals(f.getValue())))
                .toList();
    }

    /**
     * Groups send ports by routing property. Only properties routed to at least two distinct
     * values form a group.
     */
    public List<ContentBasedRoutingGroup> detectContentBasedRouting() {
        Map<String, ContentBasedRoutingGroup> groups = new LinkedHashMap<>();
        for (SendPortBinding sendPort : sendPorts) {
            sendPort.routingFilter().ifPresent(filter -> {
                String value = filter.getValue() != null ? filter.getValue() : "default";
                groups.computeIfAbsent(filter.getProperty(), ContentBasedRoutingGroup::new)
                        .addRoute(value, sendPort);
            });
        }
        return groups.values().stream()
                .filter(g -> g.getRoutesByValue().size() >= 2)
                .toList();
    }

    public Optional<SendPortBinding> findSendPort(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return sendPorts.stream().filter(sp -> name.equalsIgnoreCase(sp.getName())).findFirst();
    }

    public boolean hasReceivePort(String receivePortName) {
        return receivePortName != null
                && receiveLocations.stream().anyMatch(rl -> receivePortName.equals(rl.getReceivePortName()));
    }

    /**
     * Picks a receive location for a trigger: the receive port's own locations first (enabled
     * preferred), then the first enabled location overall, then the first location.
     */
    public Optional<ReceiveLocationBinding> preferredReceiveLocation(String receivePortName) {
        if (receivePortName != null) {
            List<ReceiveLocationBinding> own = receiveLocations.stream()
                    .filter(rl -> receivePortName.equalsIgnoreCase(rl.getReceivePortName()))
                    .toList();
            if (!own.isEmpty()) {
                return Optional.of(firstEnabledOrFirst(own));
            }
        }
        if (receiveLocations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(firstEnabledOrFirst(receiveLocations));
    }

    private static ReceiveLocationBinding firstEnabledOrFirst(List<ReceiveLocationBinding> locations) {
        return locations.stream()
                .filter(ReceiveLocationBinding::isEnabled)
                .findFirst()
                .orElse(locations.get(0));
    }
}
