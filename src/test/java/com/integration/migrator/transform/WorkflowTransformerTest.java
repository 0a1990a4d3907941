package com.integration.migrator.transform;

import static com.integration.migrator.support.OdxFixtures.el;
import static com.integration.migrator.support.OdxFixtures.message;
import static com.integration.migrator.support.OdxFixtures.port;
import static com.integration.migrator.support.OdxFixtures.prop;
import static com.integration.migrator.support.OdxFixtures.receive;
import static com.integration.migrator.support.OdxFixtures.send;
import static com.integration.migrator.support.OdxFixtures.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.integration.migrator.binding.BindingParser;
import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.binding.ReceiveLocationBinding;
import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.support.OdxFixtures;
import com.integration.migrator.support.TestResources;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.ConnectorKind;
import com.integration.migrator.workflow.TriggerKind;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;
import com.integration.migrator.workflow.WorkflowTrigger;

/**
 * Unit tests for WorkflowTransformer.
 */
class WorkflowTransformerTest {

    private final WorkflowTransformer transformer = new WorkflowTransformer();

    private static FlowSummary invoiceFlow() {
        return OdxFixtures.parse("Contoso.Billing", "BuildInvoice",
                message("Order", "Contoso.Schemas.Order")
                        + message("Invoice", "Contoso.Schemas.Invoice")
                        + port("ReceiveOrders", "Implements", "FILE", "C:\\in\\*.xml")
                        + port("SendInvoices", "Uses", "FILE", "C:\\out\\%MessageID%.xml"),
                receive("Receive_Order", "ReceiveOrders", "Order", true)
                        + el("Construct", prop("Name", "Build_Invoice"),
                                el("MessageRef", prop("Ref", "Invoice")),
                                el("Transform", prop("Name", "Map_Order"), prop("ClassName", "Contoso.Maps.OrderToInvoice"),
                                        el("MessagePartRef", prop("MessageRef", "Order")),
                                        el("MessagePartRef", prop("MessageRef", "Invoice"))))
                        + send("Send_Invoice", "SendInvoices", "Invoice"));
    }

    private static WorkflowAction named(Workflow workflow, String name) {
        return workflow.allActions().stream()
                .filter(a -> a.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No action named " + name));
    }

    @Test
    void testReceiveTransformSend() {
        TransformationResult result = transformer.transform(invoiceFlow(), BindingSnapshot.empty(), TransformOptions.defaults());
        Workflow workflow = result.getWorkflow();

        assertThat(workflow.getName()).isEqualTo("Contoso.Billing.BuildInvoice");
        assertThat(workflow.getTrigger().getName()).isEqualTo(WorkflowTrigger.HTTP_REQUEST);
        assertThat(workflow.getActions()).extracting(WorkflowAction::getName)
                .containsExactly("Build_Invoice", "Send_Invoice");

        WorkflowAction build = named(workflow, "Build_Invoice");
        assertThat(build.getKind()).isEqualTo(ActionKind.TRANSFORM_XSLT);
        assertThat(build.getTransformClassName()).isEqualTo("Contoso.Maps.OrderToInvoice");
        assertThat(build.getInputSourceAction()).isEqualTo(WorkflowAction.TRIGGER_SOURCE);

        WorkflowAction send = named(workflow, "Send_Invoice");
        assertThat(send.getKind()).isEqualTo(ActionKind.SEND_CONNECTOR);
        assertThat(send.getConnectorKind()).isEqualTo(ConnectorKind.FILE_SYSTEM);
        assertThat(send.getInputSourceAction()).isEqualTo("Build_Invoice");
        assertThat(workflow.getActions()).extracting(WorkflowAction::getSequence).containsExactly(0, 1);
        assertThat(result.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void testTriggerBoundToReceiveLocation() {
        BindingSnapshot bindings = new BindingParser().parse(TestResources.read(TestResources.ORDER_ROUTING_BINDINGS));

        Workflow workflow = transformer.transform(invoiceFlow(), bindings, TransformOptions.defaults()).getWorkflow();

        assertThat(workflow.getTrigger().getKind()).isEqualTo(TriggerKind.CONNECTOR);
        assertThat(workflow.getTrigger().getName()).isEqualTo("RL_Orders_File");
        assertThat(workflow.getTrigger().getConnectorKind()).isEqualTo(ConnectorKind.FILE_SYSTEM);
    }

    @Test
    void testCallableWorkflowUsesParentTrigger() {
        TransformOptions options = TransformOptions.builder().callable(true).build();

        Workflow workflow = transformer.transform(invoiceFlow(), BindingSnapshot.empty(), options).getWorkflow();

        assertThat(workflow.getTrigger().getName()).isEqualTo(WorkflowTrigger.CALLED_FROM_PARENT);
        assertThat(workflow.getTrigger().getKind()).isEqualTo(TriggerKind.REQUEST);
    }

    @Test
    void testSelfRecursionBecomesRetryLoop() {
        FlowSummary flow = OdxFixtures.parse("Ns", "RetryOrder", "",
                receive("Receive", "In", "Order", true)
                        + el("Call", prop("Name", "Call_Self"), prop("Invokee", "Ns.RetryOrder")));
        TransformOptions options = TransformOptions.builder().selfRecursionRetryLimit(3).build();

        TransformationResult result = transformer.transform(flow, BindingSnapshot.empty(), options);
        Workflow workflow = result.getWorkflow();

        assertThat(workflow.getActions().get(0).getName()).isEqualTo("Initialize_retryComplete");
        WorkflowAction loop = named(workflow, "Call_Self");
        assertThat(loop.getKind()).isEqualTo(ActionKind.UNTIL);
        assertThat(loop.getDetails()).isEqualTo("@equals(variables('retryComplete'), true)");
        assertThat(loop.getLoopThreshold()).isEqualTo(3);
        assertThat(workflow.getSynthesizedVariableNames()).contains("retryComplete");
        assertThat(result.getDiagnostics().getInfos()).anyMatch(i -> i.contains("retry loop"));
    }

    @Test
    void testCallToOtherFlowInvokesWorkflow() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Parent", "",
                el("Call", prop("Name", "Call_Child"), prop("Invokee", "Ns.ChildFlow")));

        WorkflowAction call = transformer.transform(flow, null, null).getWorkflow().getActions().get(0);

        assertThat(call.getKind()).isEqualTo(ActionKind.INVOKE_WORKFLOW);
        assertThat(call.getDetails()).isEqualTo("Ns.ChildFlow");
    }

    @Test
    void testWhileLoopBecomesUntil() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Counting", variable("counter", "System.Int32"),
                el("While", prop("Name", "Loop_Counter"), prop("Expression", "counter < 5"),
                        el("VariableAssignment", prop("Name", "Increment"), prop("Expression", "counter = counter + 1;"))));

        Workflow workflow = transformer.transform(flow, BindingSnapshot.empty(), TransformOptions.defaults()).getWorkflow();

        WorkflowAction loop = named(workflow, "Loop_Counter");
        assertThat(loop.getKind()).isEqualTo(ActionKind.UNTIL);
        assertThat(loop.getDetails()).isEqualTo("@greaterOrEquals(variables('counter'), 5)");
        assertThat(loop.getSourceExpression()).isEqualTo("counter < 5");
        assertThat(loop.getLoopThreshold()).isEqualTo(5);
        assertThat(loop.getChildren()).extracting(WorkflowAction::getName).containsExactly("Increment");
    }

    @Test
    void testInitializersPrecedeEverythingElse() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Ordering", "",
                send("Send_First", "Out", "Msg")
                        + el("Scope", prop("Name", "Work"), variable("lateFlag", "System.Boolean"),
                                send("Send_Inner", "Out", "Msg")));

        List<WorkflowAction> actions = transformer.transform(flow, null, null).getWorkflow().getActions();

        assertThat(actions).extracting(WorkflowAction::getName)
                .containsExactly("Initialize_lateFlag", "Send_First", "Work");
        assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.INITIALIZE_VARIABLE);
        assertThat(actions.get(2).getChildren()).extracting(WorkflowAction::getName).containsExactly("Send_Inner");
    }

    @Test
    void testUndeclaredDecideVariableIsSynthesized() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Approval", "",
                el("Decision", prop("Name", "NeedsApproval"),
                        el("DecisionBranch", prop("Name", "Yes"), prop("Expression", "approvalLimit > 100"),
                                send("Send_Approval", "Out", "Msg")),
                        el("DecisionBranch", prop("Name", "Else"), send("Send_Direct", "Out", "Msg"))));

        Workflow workflow = transformer.transform(flow, null, null).getWorkflow();

        assertThat(workflow.getSynthesizedVariableNames()).containsExactly("approvalLimit");
        WorkflowAction decide = workflow.getActions().get(1);
        assertThat(decide.getKind()).isEqualTo(ActionKind.IF);
        assertThat(decide.getName()).startsWith("NeedsApproval_");
        assertThat(decide.getDetails()).isEqualTo("@greater(variables('approvalLimit'), 100)");
        assertThat(decide.getTrueBranch()).singleElement()
                .satisfies(a -> assertThat(a.getName()).startsWith("Send_Approval_"));
        assertThat(decide.getFalseBranch()).singleElement()
                .satisfies(a -> assertThat(a.getName()).startsWith("Send_Direct_"));
    }

    @Test
    void testExceptionTypeDecideIsKeptAsMarker() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Faults", "",
                el("Decision", prop("Name", "IsTimeout"),
                        el("DecisionBranch", prop("Name", "Yes"),
                                prop("Expression", "ex.GetType() == typeof(System.TimeoutException)"),
                                send("Send_Retry", "Out", "Msg")),
                        el("DecisionBranch", prop("Name", "Else"))));

        TransformationResult result = transformer.transform(flow, null, null);
        WorkflowAction marker = result.getWorkflow().getActions().get(0);

        assertThat(marker.getKind()).isEqualTo(ActionKind.COMPOSE);
        assertThat(marker.getDetails()).startsWith("Exception type checks cannot be migrated");
        assertThat(marker.getChildren()).hasSize(1);
        assertThat(result.getDiagnostics().getWarnings()).anyMatch(w -> w.contains("inspects exception types"));
    }

    @Test
    void testDelayTimeSpanBecomesDuration() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Waiting", "",
                el("Delay", prop("Name", "Wait"), prop("Expression", "new System.TimeSpan(0, 5, 30)"))
                        + el("Delay", prop("Name", "Wait_Default")));

        List<WorkflowAction> actions = transformer.transform(flow, null, null).getWorkflow().getActions();

        assertThat(actions).extracting(WorkflowAction::getDetails).containsExactly("PT0H5M30S", "PT1M");
        assertThat(actions).allMatch(a -> a.getKind() == ActionKind.DELAY);
    }

    @Test
    void testInvalidPatternStillProducesWorkflow() {
        FlowSummary flow = OdxFixtures.parse("Ns", "TwoStarts", "",
                receive("Receive_A", "In", "A", true) + receive("Receive_B", "In", "B", true));

        TransformationResult result = transformer.transform(flow, null, null);

        assertThat(result.getDiagnostics().hasErrors()).isTrue();
        assertThat(result.getDiagnostics().getErrors()).anyMatch(e -> e.contains("sequential"));
        assertThat(result.getWorkflow().getActions()).extracting(WorkflowAction::getName).containsExactly("Receive_B");
        assertThat(result.getAnalysis()).isPresent();
    }

    @Test
    void testUnboundedLoopsGetDefaultLimit() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Polling", variable("lbDone", "System.Boolean"),
                el("While", prop("Name", "Wait_While_Pending"), prop("Expression", "lbDone == false"))
                        + el("Until", prop("Name", "Poll_Until_Done"), prop("Expression", "lbDone == true")));

        TransformationResult result = transformer.transform(flow, null, null);
        Workflow workflow = result.getWorkflow();

        assertThat(named(workflow, "Wait_While_Pending").getLoopThreshold()).isEqualTo(LoopConditionPass.DEFAULT_LOOP_LIMIT);
        assertThat(named(workflow, "Poll_Until_Done").getLoopThreshold()).isEqualTo(60);
        assertThat(named(workflow, "Poll_Until_Done").getDetails()).isEqualTo("@equals(variables('lbDone'), true)");
        assertThat(result.getDiagnostics().getErrors()).noneMatch(e -> e.startsWith("[UNTIL_WITHOUT_LIMIT]"));
    }

    @Test
    void testUndeclaredLoopCounterIsInitialized() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Counting", "",
                el("While", prop("Name", "Loop_Counter"), prop("Expression", "liCounter < 10")));

        Workflow workflow = transformer.transform(flow, null, null).getWorkflow();

        assertThat(workflow.getActions()).extracting(WorkflowAction::getName)
                .containsExactly("Initialize_liCounter", "Loop_Counter");
        assertThat(workflow.getActions().get(1).getDetails()).isEqualTo("@greaterOrEquals(variables('liCounter'), 10)");
    }

    @Test
    void testConstructMergesAssignmentsIntoTransform() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Enrich", "",
                el("Construct", prop("Name", "Build_Order"),
                        el("MessageRef", prop("Ref", "Order")),
                        el("Transform", prop("Name", "Map_Raw"), prop("ClassName", "Contoso.Maps.RawToOrder"),
                                el("MessagePartRef", prop("MessageRef", "Raw")),
                                el("MessagePartRef", prop("MessageRef", "Order"))),
                        el("MessageAssignment", prop("Name", "Stamp"),
                                prop("Expression", "Order.Status = \"New\"; Order.Priority = \"High\";"))));

        List<WorkflowAction> actions = transformer.transform(flow, null, null).getWorkflow().getActions();

        assertThat(actions).singleElement().satisfies(action -> {
            assertThat(action.getName()).isEqualTo("Build_Order");
            assertThat(action.getKind()).isEqualTo(ActionKind.TRANSFORM_XSLT);
            assertThat(action.getTransformClassName()).isEqualTo("Contoso.Maps.RawToOrder");
            assertThat(action.getPropertyAssignments()).containsExactly(
                    entry("Status", "New"),
                    entry("Priority", "High"));
        });
    }

    @Test
    void testSwitchLowersToCaseScopesAndDefault() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Routing", "",
                el("Switch", prop("Name", "Route_Region"), prop("Expression", "Region"),
                        el("DecisionBranch", prop("Name", "EU_Branch"), prop("Expression", "EU"),
                                send("Send_EU", "Out", "Msg")),
                        el("DecisionBranch", prop("Name", "US_Branch"), prop("Expression", "US"),
                                send("Send_US", "Out", "Msg")),
                        el("DecisionBranch", prop("Name", "Default"), send("Send_Other", "Out", "Msg"))));

        WorkflowAction dispatch = named(transformer.transform(flow, null, null).getWorkflow(), "Route_Region");

        assertThat(dispatch.getKind()).isEqualTo(ActionKind.SWITCH);
        assertThat(dispatch.getDetails()).isEqualTo("@variables('Region')");
        assertThat(dispatch.getChildren()).extracting(WorkflowAction::getName)
                .containsExactly("Case_EU", "Case_US", "Default");
        assertThat(dispatch.getChildren()).allMatch(WorkflowAction::isBranchContainer);
        assertThat(dispatch.getChildren().get(0).getChildren()).extracting(WorkflowAction::getName)
                .containsExactly("Send_EU");
        assertThat(dispatch.getChildren().get(2).getChildren()).extracting(WorkflowAction::getName)
                .containsExactly("Send_Other");
    }

    @Test
    void testListenBranchesBecomeParallelContainers() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Waiting", "",
                receive("Receive_Start", "In", "Msg", true)
                        + el("Listen", prop("Name", "Wait_For_Reply"),
                                el("ListenBranch", prop("Name", "Got_Reply"), receive("Receive_Reply", "Reply", "Msg", false)),
                                el("ListenBranch", prop("Name", "Timed_Out"),
                                        el("Delay", prop("Name", "Wait_A_Minute"), prop("Expression", "new System.TimeSpan(0, 1, 0)")))));

        WorkflowAction listen = transformer.transform(flow, null, null).getWorkflow().getActions().get(0);

        assertThat(listen.getName()).isEqualTo("Wait_For_Reply");
        assertThat(listen.getKind()).isEqualTo(ActionKind.PARALLEL);
        assertThat(listen.getChildren()).extracting(WorkflowAction::getName)
                .containsExactly("Wait_For_Reply_Branch1", "Wait_For_Reply_Branch2");
        assertThat(listen.getChildren().get(0).getChildren()).singleElement()
                .satisfies(a -> assertThat(a.getKind()).isEqualTo(ActionKind.RESPONSE));
        assertThat(listen.getChildren().get(1).getChildren()).singleElement()
                .satisfies(a -> assertThat(a.getDetails()).isEqualTo("PT0H1M0S"));
    }

    @Test
    void testParallelBranchesBecomeContainers() {
        FlowSummary flow = OdxFixtures.parse("Ns", "FanOut", "",
                el("Parallel", prop("Name", "Fan_Out"),
                        el("ParallelBranch", prop("Name", "Left"), send("Send_Left", "Out", "Msg")),
                        el("ParallelBranch", prop("Name", "Right"), send("Send_Right", "Out", "Msg"))));

        WorkflowAction parallel = transformer.transform(flow, null, null).getWorkflow().getActions().get(0);

        assertThat(parallel.getKind()).isEqualTo(ActionKind.PARALLEL);
        assertThat(parallel.getChildren()).extracting(WorkflowAction::getName).containsExactly("Left", "Right");
        assertThat(parallel.getChildren().get(1).getChildren()).extracting(WorkflowAction::getName)
                .containsExactly("Send_Right");
    }

    @Test
    void testUnknownShapesBecomeMarkers() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Mystery", "",
                el("MysteryShape", prop("Name", "Mystery"), send("Send_Inside", "Out", "Msg"))
                        + el("Gizmo"));

        TransformationResult result = transformer.transform(flow, null, null);
        List<WorkflowAction> actions = result.getWorkflow().getActions();

        assertThat(actions).extracting(WorkflowAction::getName).containsExactly("Mystery", "Unknown_Gizmo");
        assertThat(actions.get(0).getKind()).isEqualTo(ActionKind.SCOPE);
        assertThat(actions.get(0).getChildren()).extracting(WorkflowAction::getName).containsExactly("Send_Inside");
        assertThat(actions.get(1).getKind()).isEqualTo(ActionKind.COMPOSE);
        assertThat(actions.get(1).getDetails()).isEqualTo("Unhandled shape type: Gizmo");
        assertThat(result.getDiagnostics().getWarnings())
                .anyMatch(w -> w.contains("MysteryShape"))
                .anyMatch(w -> w.contains("Gizmo"));
    }

    @Test
    void testPartiallyQualifiedSelfCallBecomesRetryLoop() {
        FlowSummary flow = OdxFixtures.parse("Contoso.Orders", "RetryOrder", "",
                el("Call", prop("Name", "Call_Again"), prop("Invokee", "Orders.RetryOrder")));

        WorkflowAction call = named(transformer.transform(flow, null, null).getWorkflow(), "Call_Again");

        assertThat(call.getKind()).isEqualTo(ActionKind.UNTIL);
        assertThat(call.getLoopThreshold()).isEqualTo(TransformOptions.DEFAULT_RETRY_LIMIT);
    }

    @Test
    void testEdiDecodeFollowsInitializers() {
        FlowSummary flow = OdxFixtures.parse("Contoso.Edi", "ReceivePurchaseOrder",
                variable("total", "System.Decimal")
                        + message("Order", "Contoso.Schemas.Order")
                        + port("ReceiveOrders", "Implements", "FILE", "C:\\edi\\*.edi")
                        + port("SendOrders", "Uses", "FILE", "C:\\out\\%MessageID%.xml"),
                receive("Receive_Order", "ReceiveOrders", "Order", true)
                        + send("Send_Order", "SendOrders", "Order"));
        ReceiveLocationBinding location = ReceiveLocationBinding.builder()
                .name("RL_X12_Inbound").receivePortName("ReceiveOrders").transportType("FILE")
                .address("C:\\edi\\x12\\*.edi").enabled(true).build();

        Workflow workflow = transformer.transform(flow, new BindingSnapshot(List.of(location), List.of()),
                TransformOptions.defaults()).getWorkflow();

        assertThat(workflow.getActions()).extracting(WorkflowAction::getName)
                .containsExactly("Initialize_total", "X12Decode", "Send_Order");
        assertThat(workflow.getActions().get(1).getKind()).isEqualTo(ActionKind.X12_DECODE);
    }
}
