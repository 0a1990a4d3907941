package com.integration.migrator.transform;

import java.util.List;

import com.integration.migrator.binding.SendPortBinding;
import com.integration.migrator.binding.TransformReference;
import com.integration.migrator.util.NamingUtil;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.ConnectorKind;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Builds send-connector actions for send ports, including the outbound maps they apply.
 */
public class SendActionFactory {

    private final ConnectorKindResolver connectorKinds;

    public SendActionFactory(ConnectorKindResolver connectorKinds) {
        this.connectorKinds = connectorKinds;
    }

    public WorkflowAction connector(String name, String transportType, String address, String hostAppsSubtype) {
        ConnectorKind kind = connectorKinds.resolve(transportType, address, hostAppsSubtype);
        WorkflowAction action = WorkflowAction.builder()
                .name(NamingUtil.safeActionName(name))
                .kind(ActionKind.SEND_CONNECTOR)
                .connectorKind(kind)
                .targetAddress(address)
                .build();
        if (kind == ConnectorKind.SERVICE_BUS) {
            connectorKinds.populateServiceBusParts(action, address);
        }
        return action;
    }

    /**
     * A plain send connector, or a branch-container scope running the port's outbound maps in
     * order before the send.
     */
    public WorkflowAction fromSendPort(SendPortBinding sendPort) {
        WorkflowAction send = connector(sendPort.getName(), sendPort.getTransportType(), sendPort.getAddress(),
                sendPort.getHostAppsSubtype());
        send.setDetails("Send to " + sendPort.getName());
        List<TransformReference> transforms = sendPort.getTransforms();
        if (transforms.isEmpty()) {
            return send;
        }

        WorkflowAction scope = WorkflowAction.scope(NamingUtil.safeActionName(sendPort.getName() + "_Outbound"),
                transforms.size() + " outbound map(s) applied before sending");
        String previousOutput = null;
        int sequence = 0;
        for (TransformReference transform : transforms) {
            // Port suffix keeps names distinct when several ports share a map in one workflow.
            String output = transform.getShortName() + "_" + sendPort.getName() + "_Output";
            scope.getChildren().add(WorkflowAction.builder()
                    .name(NamingUtil.safeActionName("Transform_" + transform.getShortName() + "_" + sendPort.getName()))
                    .kind(ActionKind.TRANSFORM_XSLT)
                    .details(transform.getFullName())
                    .transformClassName(transform.getFullName())
                    .inputMessageName(previousOutput)
                    .outputMessageName(output)
                    .sequence(sequence++)
                    .build());
            previousOutput = output;
        }
        send.setInputMessageName(previousOutput);
        send.setSequence(sequence);
        scope.getChildren().add(send);
        return scope;
    }
}
