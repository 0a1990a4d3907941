package com.integration.migrator.binding;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class SendPortBinding {
    String name;
    String transportType;
    String address;
    String sendPipelineName;
    String userName;
    String connectionString;
    String hostAppsSubtype;
    @Singular
    List<TransformReference> transforms;
    @Singular
    List<FilterCondition> filters;

    /**
     * First equality filter on something other than the receive port name: the routing criterion.
     */
    public Optional<FilterCondition> routingFilter() {
        return filters.stream()
                .filter(f -> f.getProperty() != null && !f.isReceivePortFilter() && f.isEquality())
                .findFirst();
    }

    public Optional<String> subscribedReceivePort() {
        return filters.stream()
                .filter(f -> f.isReceivePortFilter() && f.isEquality())
                .map(FilterCondition::getValue)
                .findFirst();
    }
}
