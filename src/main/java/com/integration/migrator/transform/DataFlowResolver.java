package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Links transforms and sends to the action that produced their input message. Every such action
 * ends up pointing at a preceding producer or at the trigger.
 */
public class DataFlowResolver {

    private record Producer(int position, String actionName) {
    }

    /**
     * @param triggerMessage message delivered by the trigger, may be null
     */
    public void resolve(Workflow workflow, String triggerMessage) {
        List<WorkflowAction> flat = workflow.allActions();

        Map<String, List<Producer>> producers = new HashMap<>();
        if (triggerMessage != null) {
            producers.computeIfAbsent(key(triggerMessage), k -> new ArrayList<>())
                    .add(new Producer(-1, WorkflowAction.TRIGGER_SOURCE));
        }
        for (int i = 0; i < flat.size(); i++) {
            WorkflowAction action = flat.get(i);
            if (action.getKind() == ActionKind.TRANSFORM_XSLT && action.getOutputMessageName() != null) {
                producers.computeIfAbsent(key(action.getOutputMessageName()), k -> new ArrayList<>())
                        .add(new Producer(i, action.getName()));
            }
        }

        for (int i = 0; i < flat.size(); i++) {
            WorkflowAction action = flat.get(i);
            if (action.getKind() != ActionKind.TRANSFORM_XSLT && action.getKind() != ActionKind.SEND_CONNECTOR) {
                continue;
            }
            action.setInputSourceAction(latestProducerBefore(producers, action.getInputMessageName(), i));
        }
    }

    private static String latestProducerBefore(Map<String, List<Producer>> producers, String message, int position) {
        if (message == null) {
            return WorkflowAction.TRIGGER_SOURCE;
        }
        String source = WorkflowAction.TRIGGER_SOURCE;
        for (Producer producer : producers.getOrDefault(key(message), List.of())) {
            if (producer.position() < position) {
                source = producer.actionName();
            }
        }
        return source;
    }

    private static String key(String message) {
        return message.toLowerCase(Locale.ROOT);
    }
}
