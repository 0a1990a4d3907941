package com.integration.migrator.validation;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.transform.MigrationDiagnostics;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;
import com.integration.migrator.workflow.WorkflowTrigger;

/**
 * Structural checks on a generated workflow. Every problem is reported, none stops the run;
 * findings go to the unit's diagnostics prefixed with an issue code.
 */
public class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    public static final int MAX_NAME_LENGTH = 80;

    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z0-9_-]+$");

    /**
     * @return true when the workflow produced no errors
     */
    public boolean validate(Workflow workflow, MigrationDiagnostics diagnostics) {
        int errorsBefore = diagnostics.getErrors().size();
        String prefix = "Workflow '" + workflow.getName() + "'";

        validateTrigger(workflow.getTrigger(), prefix, diagnostics);

        List<WorkflowAction> all = workflow.allActions();
        if (all.isEmpty()) {
            diagnostics.warn("[NO_ACTIONS] " + prefix + " has no actions");
        }

        Set<String> names = new HashSet<>();
        for (WorkflowAction action : all) {
            String name = action.getName();
            if (name == null || name.isBlank()) {
                diagnostics.error("[MISSING_ACTION_NAME] " + prefix + " has an action without a name");
                continue;
            }
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                diagnostics.error("[DUPLICATE_ACTION_NAME] " + prefix + ": action name '" + name + "' is used more than once");
            }
            validateName("ACTION", name, prefix, diagnostics);
            if (action.getKind() == null) {
                diagnostics.error("[MISSING_ACTION_KIND] " + prefix + ": action '" + name + "' has no kind");
            }
            if (action.getKind() == ActionKind.UNTIL
                    && (action.getLoopThreshold() == null || action.getLoopThreshold() < 1)) {
                diagnostics.error("[UNTIL_WITHOUT_LIMIT] " + prefix + ": loop '" + name + "' has no iteration limit");
            }
        }

        for (WorkflowAction action : all) {
            String source = action.getInputSourceAction();
            if (source != null && !WorkflowAction.TRIGGER_SOURCE.equals(source)
                    && !names.contains(source.toLowerCase(Locale.ROOT))) {
                diagnostics.error("[INVALID_DEPENDENCY] " + prefix + ": action '" + action.getName()
                        + "' reads from non-existent action '" + source + "'");
            }
        }

        int newErrors = diagnostics.getErrors().size() - errorsBefore;
        log.debug("Validated {}: {} action(s), {} error(s)", workflow.getName(), all.size(), newErrors);
        return newErrors == 0;
    }

    private static void validateTrigger(WorkflowTrigger trigger, String prefix, MigrationDiagnostics diagnostics) {
        if (trigger == null) {
            diagnostics.error("[NO_TRIGGER] " + prefix + " has no trigger");
            return;
        }
        if (trigger.getKind() == null) {
            diagnostics.error("[MISSING_TRIGGER_KIND] " + prefix + ": trigger '" + trigger.getName() + "' has no kind");
        }
        validateName("TRIGGER", trigger.getName(), prefix, diagnostics);
    }

    private static void validateName(String subject, String name, String prefix, MigrationDiagnostics diagnostics) {
        if (name == null) {
            return;
        }
        if (name.length() > MAX_NAME_LENGTH) {
            diagnostics.error("[" + subject + "_NAME_TOO_LONG] " + prefix + ": '" + name + "' exceeds "
                    + MAX_NAME_LENGTH + " characters (" + name.length() + ")");
        }
        if (!VALID_NAME.matcher(name).matches()) {
            diagnostics.warn("[" + subject + "_NAME_INVALID_CHARS] " + prefix + ": '" + name
                    + "' should use only letters, digits, underscores and hyphens");
        }
    }
}
