package com.integration.migrator.transform;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.analysis.TriggerAnalysis;
import com.integration.migrator.binding.ReceiveLocationBinding;
import com.integration.migrator.model.ReceiveNode;
import com.integration.migrator.util.NamingUtil;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.TriggerKind;
import com.integration.migrator.workflow.WorkflowAction;
import com.integration.migrator.workflow.WorkflowTrigger;

/**
 * Chooses the trigger of a migrated workflow.
 */
public class TriggerSelector {

    private static final Logger log = LoggerFactory.getLogger(TriggerSelector.class);

    private final ConnectorKindResolver connectorKinds;

    public TriggerSelector(ConnectorKindResolver connectorKinds) {
        this.connectorKinds = connectorKinds;
    }

    public WorkflowTrigger select(TransformationContext context) {
        if (context.getOptions().isCallable()) {
            return WorkflowTrigger.request(WorkflowTrigger.CALLED_FROM_PARENT);
        }
        TriggerAnalysis analysis = context.getAnalysis();
        ReceiveNode primary = analysis.getPrimaryReceive();
        Optional<ReceiveLocationBinding> location = context.getBindings()
                .preferredReceiveLocation(primary != null ? primary.getPortName() : null);
        if (location.isEmpty()) {
            return WorkflowTrigger.request(WorkflowTrigger.HTTP_REQUEST);
        }
        log.debug("Trigger bound to receive location {}", location.get().getName());
        return fromReceiveLocation(location.get(), analysis.isRequiresSessionSupport());
    }

    public WorkflowTrigger fromReceiveLocation(ReceiveLocationBinding location, boolean sessionEnabled) {
        return WorkflowTrigger.builder()
                .name(NamingUtil.safeActionName(location.getName()))
                .kind(TriggerKind.CONNECTOR)
                .connectorKind(connectorKinds.resolve(location.getTransportType(), location.getAddress(),
                        location.getHostAppsSubtype()))
                .transportType(location.getTransportType())
                .address(location.getAddress())
                .folderPath(location.getFolderPath())
                .fileMask(location.getFileMask())
                .pollingIntervalSeconds(location.getPollingIntervalSeconds())
                .receivePipeline(location.getReceivePipelineName())
                .sessionEnabled(sessionEnabled)
                .build();
    }

    /**
     * EDI interchange decode required by a trigger address, if any.
     */
    public Optional<WorkflowAction> ediDecodeFor(WorkflowTrigger trigger) {
        String address = trigger.getAddress() == null ? "" : trigger.getAddress().toLowerCase(Locale.ROOT);
        if (address.contains("x12")) {
            return Optional.of(WorkflowAction.builder()
                    .name("X12Decode")
                    .kind(ActionKind.X12_DECODE)
                    .details("Decode X12 message")
                    .build());
        }
        if (address.contains("edifact")) {
            return Optional.of(WorkflowAction.builder()
                    .name("EdifactDecode")
                    .kind(ActionKind.EDIFACT_DECODE)
                    .details("Decode EDIFACT message")
                    .build());
        }
        return Optional.empty();
    }
}
