package com.integration.migrator.workflow;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Data;

/**
 * A migrated workflow: one trigger plus an ordered list of top-level actions.
 */
@Data
public class Workflow {
    private final String name;
    private WorkflowTrigger trigger;
    private final List<WorkflowAction> actions = new ArrayList<>();
    private final Set<String> variableNames = new LinkedHashSet<>();
    private final Set<String> synthesizedVariableNames = new LinkedHashSet<>();

    @JsonIgnore
    public List<WorkflowAction> allActions() {
        List<WorkflowAction> all = new ArrayList<>();
        actions.forEach(a -> all.addAll(a.flatten()));
        return all;
    }

    public void resequence() {
        for (int i = 0; i < actions.size(); i++) {
            actions.get(i).setSequence(i);
        }
    }
}
