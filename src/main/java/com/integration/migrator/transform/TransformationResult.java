package com.integration.migrator.transform;

import java.util.List;
import java.util.Optional;

import com.integration.migrator.analysis.TriggerAnalysis;
import com.integration.migrator.workflow.Workflow;

import lombok.Getter;

/**
 * Output of one transformation run.
 */
@Getter
public class TransformationResult {
    private final List<Workflow> workflows;
    private final TriggerAnalysis analysis;
    private final MigrationDiagnostics diagnostics;

    public TransformationResult(List<Workflow> workflows, TriggerAnalysis analysis, MigrationDiagnostics diagnostics) {
        this.workflows = List.copyOf(workflows);
        this.analysis = analysis;
        this.diagnostics = diagnostics;
    }

    /**
     * Absent for bindings-only runs.
     */
    public Optional<TriggerAnalysis> getAnalysis() {
        return Optional.ofNullable(analysis);
    }

    public Workflow getWorkflow() {
        return workflows.get(0);
    }
}
