package com.integration.migrator.workflow;

import lombok.Builder;
import lombok.Value;

/**
 * What starts a workflow: an inbound request or a polling/push connector bound to a receive location.
 */
@Value
@Builder
public class WorkflowTrigger {
    public static final String CALLED_FROM_PARENT = "When_called_from_parent_workflow";
    public static final String HTTP_REQUEST = "When_an_HTTP_request_is_received";

    String name;
    TriggerKind kind;
    ConnectorKind connectorKind;
    String transportType;
    String address;
    String folderPath;
    String fileMask;
    Integer pollingIntervalSeconds;
    String receivePipeline;
    boolean sessionEnabled;

    public static WorkflowTrigger request(String name) {
        return WorkflowTrigger.builder()
                .name(name)
                .kind(TriggerKind.REQUEST)
                .connectorKind(ConnectorKind.HTTP)
                .build();
    }
}
