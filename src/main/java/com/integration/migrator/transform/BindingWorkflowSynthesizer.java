package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.binding.ContentBasedRoutingGroup;
import com.integration.migrator.binding.ReceiveLocationBinding;
import com.integration.migrator.binding.SendPortBinding;
import com.integration.migrator.util.NamingUtil;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;
import com.integration.migrator.workflow.WorkflowTrigger;

/**
 * Builds workflows from binding metadata alone: one per receive location, one per
 * content-based routing group, and one collecting send ports nothing else reaches.
 */
public class BindingWorkflowSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(BindingWorkflowSynthesizer.class);

    static final String ORPHANS_WORKFLOW = "OrphanedSendPorts";

    private final TriggerSelector triggers;
    private final SendActionFactory sendActions;
    private final DataFlowResolver dataFlow;

    public BindingWorkflowSynthesizer(TriggerSelector triggers, SendActionFactory sendActions, DataFlowResolver dataFlow) {
        this.triggers = triggers;
        this.sendActions = sendActions;
        this.dataFlow = dataFlow;
    }

    public TransformationResult synthesize(BindingSnapshot bindings) {
        MigrationDiagnostics diagnostics = new MigrationDiagnostics();
        List<Workflow> workflows = new ArrayList<>();
        Map<String, List<ReceiveLocationBinding>> locationsByPort = bindings.receiveLocationsByPort();

        for (Map.Entry<String, List<ReceiveLocationBinding>> entry : locationsByPort.entrySet()) {
            List<SendPortBinding> subscribers = bindings.sendPortsForReceivePort(entry.getKey());
            for (ReceiveLocationBinding location : entry.getValue()) {
                Workflow workflow = new Workflow(NamingUtil.safeActionName(location.getName()));
                WorkflowTrigger trigger = triggers.fromReceiveLocation(location, false);
                workflow.setTrigger(trigger);
                triggers.ediDecodeFor(trigger).ifPresent(workflow.getActions()::add);
                subscribers.forEach(sp -> workflow.getActions().add(sendActions.fromSendPort(sp)));
                workflows.add(workflow);
            }
        }

        List<ContentBasedRoutingGroup> groups = bindings.detectContentBasedRouting();
        Set<String> routedLocationNames = new HashSet<>();
        for (ContentBasedRoutingGroup group : groups) {
            Optional<ReceiveLocationBinding> location = routingLocation(bindings, group);
            if (location.isEmpty()) {
                diagnostics.warn("Content-based routing on " + group.getRoutingProperty()
                        + " has no receive location to trigger it");
                continue;
            }
            log.info("Content-based routing on {} with {} route(s)", group.getRoutingProperty(),
                    group.getRoutesByValue().size());
            workflows.add(routingWorkflow(group, location.get()));
            routedLocationNames.add(location.get().getName());
        }

        workflows.removeIf(w -> isSupersededByRouting(w, routedLocationNames));

        Set<String> routedSendPorts = new HashSet<>();
        groups.forEach(g -> g.allSendPorts().forEach(sp -> routedSendPorts.add(sp.getName().toLowerCase(Locale.ROOT))));
        List<SendPortBinding> orphans = bindings.getSendPorts().stream()
                .filter(sp -> !routedSendPorts.contains(sp.getName().toLowerCase(Locale.ROOT)))
                .filter(sp -> sp.subscribedReceivePort().map(port -> !locationsByPort.containsKey(port)).orElse(true))
                .toList();
        if (!orphans.isEmpty()) {
            Workflow orphanWorkflow = new Workflow(ORPHANS_WORKFLOW);
            orphanWorkflow.setTrigger(WorkflowTrigger.request(WorkflowTrigger.HTTP_REQUEST));
            orphans.forEach(sp -> orphanWorkflow.getActions().add(sendActions.fromSendPort(sp)));
            diagnostics.warn(orphans.size() + " send port(s) have no subscribing receive port");
            workflows.add(orphanWorkflow);
        }

        for (Workflow workflow : workflows) {
            dataFlow.resolve(workflow, null);
            workflow.resequence();
        }
        return new TransformationResult(workflows, null, diagnostics);
    }

    /**
     * When every routed port names the same receive port, that port's locations are preferred;
     * otherwise the first enabled location overall is used.
     */
    private static Optional<ReceiveLocationBinding> routingLocation(BindingSnapshot bindings,
            ContentBasedRoutingGroup group) {
        Set<String> receivePorts = new HashSet<>();
        boolean allNamed = true;
        for (SendPortBinding sendPort : group.allSendPorts()) {
            Optional<String> port = sendPort.subscribedReceivePort();
            if (port.isPresent()) {
                receivePorts.add(port.get());
            } else {
                allNamed = false;
            }
        }
        String sharedPort = allNamed && receivePorts.size() == 1 ? receivePorts.iterator().next() : null;
        return bindings.preferredReceiveLocation(sharedPort);
    }

    private WorkflowAction routingSwitch(ContentBasedRoutingGroup group) {
        String property = group.getPropertyShortName();
        WorkflowAction switchAction = WorkflowAction.builder()
                .name("Route_By_" + NamingUtil.safeActionName(property))
                .kind(ActionKind.SWITCH)
                .details(group.getRoutingProperty())
                .build();
        int sequence = 0;
        for (Map.Entry<String, List<SendPortBinding>> route : new TreeMap<>(group.getRoutesByValue()).entrySet()) {
            WorkflowAction caseScope = WorkflowAction.scope("Case_" + NamingUtil.safeActionName(route.getKey()),
                    "Route to: " + String.join(", ", route.getValue().stream().map(SendPortBinding::getName).toList()));
            caseScope.setSequence(sequence++);
            int sendSequence = 0;
            for (SendPortBinding sendPort : route.getValue()) {
                WorkflowAction send = sendActions.fromSendPort(sendPort);
                send.setSequence(sendSequence++);
                caseScope.getChildren().add(send);
            }
            switchAction.getChildren().add(caseScope);
        }
        WorkflowAction defaultRoute = WorkflowAction.scope("Default_Route", "No routing match");
        defaultRoute.setSequence(sequence);
        defaultRoute.getChildren().add(WorkflowAction.compose("Log_Unmatched_Route",
                "Unmatched routing value for " + group.getRoutingProperty()));
        switchAction.getChildren().add(defaultRoute);
        return switchAction;
    }

    private Workflow routingWorkflow(ContentBasedRoutingGroup group, ReceiveLocationBinding location) {
        Workflow workflow = new Workflow(NamingUtil.safeActionName("CBR_" + group.getPropertyShortName() + "_Workflow"));
        WorkflowTrigger trigger = triggers.fromReceiveLocation(location, false);
        workflow.setTrigger(trigger);
        triggers.ediDecodeFor(trigger).ifPresent(workflow.getActions()::add);
        workflow.getActions().add(routingSwitch(group));
        return workflow;
    }

    private static boolean isSupersededByRouting(Workflow workflow, Set<String> routedLocationNames) {
        if (workflow.getTrigger() == null || workflow.getName().startsWith("CBR_")) {
            return false;
        }
        boolean onlyDecodes = workflow.getActions().stream().allMatch(a -> a.getKind().isDecode());
        boolean routedTrigger = routedLocationNames.stream()
                .anyMatch(name -> NamingUtil.safeActionName(name).equals(workflow.getTrigger().getName()));
        if (onlyDecodes && routedTrigger) {
            log.debug("Suppressing {}: its receive location feeds a routing workflow", workflow.getName());
            return true;
        }
        return false;
    }
}
