package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.analysis.TriggerAnalysis;
import com.integration.migrator.analysis.TriggerPatternAnalyzer;
import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.expression.ConditionInverter;
import com.integration.migrator.expression.ExpressionTranslator;
import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.validation.WorkflowValidator;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;
import com.integration.migrator.workflow.WorkflowTrigger;

/**
 * Transforms a parsed orchestration into a workflow.
 *
 * <p>Instances hold no per-run state; every run builds its own {@link TransformationContext},
 * so one transformer may serve concurrent units.
 */
public class WorkflowTransformer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTransformer.class);

    private final TriggerPatternAnalyzer analyzer = new TriggerPatternAnalyzer();
    private final ExpressionTranslator translator = new ExpressionTranslator();
    private final ConnectorKindResolver connectorKinds = new ConnectorKindResolver();
    private final TriggerSelector triggers = new TriggerSelector(connectorKinds);
    private final SendActionFactory sendActions = new SendActionFactory(connectorKinds);
    private final VariableHoister hoister = new VariableHoister();
    private final LoopConditionPass loopConditions = new LoopConditionPass(new ConditionInverter(), translator);
    private final DataFlowResolver dataFlow = new DataFlowResolver();
    private final BindingWorkflowSynthesizer synthesizer = new BindingWorkflowSynthesizer(triggers, sendActions, dataFlow);
    private final WorkflowValidator validator = new WorkflowValidator();

    public TransformationResult transform(FlowSummary flow, BindingSnapshot bindings, TransformOptions options) {
        TriggerAnalysis analysis = analyzer.analyze(flow);
        TransformationContext context = TransformationContext.builder()
                .flow(flow)
                .analysis(analysis)
                .options(options != null ? options : TransformOptions.defaults())
                .bindings(bindings != null ? bindings : BindingSnapshot.empty())
                .build();
        recordAnalysisFindings(context);

        Workflow workflow = new Workflow(flow.getQualifiedName());
        WorkflowTrigger trigger = triggers.select(context);
        workflow.setTrigger(trigger);

        List<WorkflowAction> actions = new ArrayList<>(hoister.hoist(context));
        triggers.ediDecodeFor(trigger).ifPresent(actions::add);
        actions.addAll(new NodeLowering(context, translator, sendActions).lowerAll(flow.getRoots()));
        workflow.getActions().addAll(actions);

        loopConditions.apply(workflow.getActions(), context);
        String triggerMessage = analysis.getPrimaryReceive() != null ? analysis.getPrimaryReceive().getMessageName() : null;
        dataFlow.resolve(workflow, triggerMessage);
        workflow.resequence();
        workflow.getVariableNames().addAll(context.getVariableNames());
        workflow.getSynthesizedVariableNames().addAll(context.getSynthesizedVariables());
        validator.validate(workflow, context.getDiagnostics());

        log.debug("Transformed {} into {} top-level action(s)", flow.getQualifiedName(), workflow.getActions().size());
        return new TransformationResult(List.of(workflow), analysis, context.getDiagnostics());
    }

    public TransformationResult synthesizeFromBindings(BindingSnapshot bindings) {
        TransformationResult result = synthesizer.synthesize(bindings);
        result.getWorkflows().forEach(w -> validator.validate(w, result.getDiagnostics()));
        return result;
    }

    private static void recordAnalysisFindings(TransformationContext context) {
        TriggerAnalysis analysis = context.getAnalysis();
        if (analysis.getBlockingReason() != null) {
            context.getDiagnostics().error(analysis.getBlockingReason());
        }
        analysis.getWarnings().forEach(context.getDiagnostics()::warn);
    }
}
