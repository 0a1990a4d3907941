package com.integration.migrator.transform;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import com.integration.migrator.analysis.TriggerAnalysis;
import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.model.FlowSummary;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Per-run state of one transformation. Created when a unit's transformation starts and
 * passed explicitly to every pass; nothing outlives the run.
 */
@Getter
@Builder
public final class TransformationContext {

    @NonNull
    private final FlowSummary flow;

    @NonNull
    private final TriggerAnalysis analysis;

    @NonNull
    private final TransformOptions options;

    @NonNull
    private final BindingSnapshot bindings;

    @Builder.Default
    private final MigrationDiagnostics diagnostics = new MigrationDiagnostics();

    @Builder.Default
    private final Set<String> variableNames = new LinkedHashSet<>();

    /** Variables used but never declared, for which initializers were synthesized. */
    @Builder.Default
    private final Set<String> synthesizedVariables = new LinkedHashSet<>();

    public String getShortName() {
        return flow.getName();
    }

    public String getQualifiedName() {
        return flow.getQualifiedName();
    }

    public boolean isKnownVariable(String name) {
        return name != null && variableNames.stream().anyMatch(v -> v.equalsIgnoreCase(name));
    }

    /**
     * Whether an invocation target names the flow being transformed.
     */
    public boolean isSelfReference(String target) {
        if (target == null || target.isBlank()) {
            return false;
        }
        String t = target.trim().toLowerCase(Locale.ROOT);
        String shortName = getShortName().toLowerCase(Locale.ROOT);
        String qualified = getQualifiedName().toLowerCase(Locale.ROOT);
        return t.equals(shortName) || t.equals(qualified)
                || t.endsWith("." + shortName) || qualified.endsWith("." + t);
    }
}
