package com.integration.migrator.model;

/**
 * Visitor over the closed set of process-flow node classes.
 */
public interface ProcessNodeVisitor<R> {
    R visit(ReceiveNode receive);
    R visit(SendNode send);
    R visit(DecideNode decide);
    R visit(SwitchNode switchNode);
    R visit(ListenNode listen);
    R visit(ConstructNode construct);
    R visit(TransformNode transform);
    R visit(VariableDeclarationNode declaration);
    R visit(AssignmentNode assignment);
    R visit(CorrelationDeclarationNode correlation);
    R visit(InvocationNode invocation);
    R visit(TerminateNode terminate);
    R visit(DelayNode delay);
    R visit(CompensateNode compensate);
    R visit(CallPolicyNode callPolicy);
    R visit(ExpressionNode expression);
    R visit(ScopeNode scope);
    R visit(LoopNode loop);
    R visit(ConditionalLoopNode conditionalLoop);
    R visit(ParallelNode parallel);
    R visit(ParallelBranchNode branch);
    R visit(TaskNode task);
    R visit(GroupNode group);
    R visit(CatchNode catchNode);
    R visit(FallbackNode fallback);
}
