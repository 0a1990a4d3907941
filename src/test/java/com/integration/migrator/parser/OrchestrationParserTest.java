package com.integration.migrator.parser;

import static com.integration.migrator.support.OdxFixtures.correlation;
import static com.integration.migrator.support.OdxFixtures.el;
import static com.integration.migrator.support.OdxFixtures.message;
import static com.integration.migrator.support.OdxFixtures.port;
import static com.integration.migrator.support.OdxFixtures.prop;
import static com.integration.migrator.support.OdxFixtures.receive;
import static com.integration.migrator.support.OdxFixtures.receiveWithOid;
import static com.integration.migrator.support.OdxFixtures.send;
import static com.integration.migrator.support.OdxFixtures.variable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.integration.migrator.model.ConstructNode;
import com.integration.migrator.model.DecideNode;
import com.integration.migrator.model.FallbackNode;
import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.model.NodeKind;
import com.integration.migrator.model.NodeTraversal;
import com.integration.migrator.model.PortDirection;
import com.integration.migrator.model.ProcessNode;
import com.integration.migrator.model.ReceiveNode;
import com.integration.migrator.model.ScopeNode;
import com.integration.migrator.model.SwitchNode;
import com.integration.migrator.model.TransformNode;
import com.integration.migrator.support.OdxFixtures;

/**
 * Unit tests for OrchestrationParser.
 */
class OrchestrationParserTest {

    @Test
    void testParseNameNamespaceAndDeclarations() {
        FlowSummary flow = OdxFixtures.parse("Contoso.Orders", "ProcessOrder",
                message("OrderMsg", "Contoso.Schemas.Order")
                        + variable("retryCount", "System.Int32")
                        + port("ReceiveOrders", "Implements", "FILE", "C:\\in\\*.xml")
                        + port("SendOrders", "Uses", null, null),
                receive("Receive_Order", "ReceiveOrders", "OrderMsg", true)
                        + send("Send_Order", "SendOrders", "OrderMsg"));

        assertThat(flow.getName()).isEqualTo("ProcessOrder");
        assertThat(flow.getQualifiedName()).isEqualTo("Contoso.Orders.ProcessOrder");
        assertThat(flow.getMessages()).extracting("name").containsExactly("OrderMsg");
        assertThat(flow.getPorts()).hasSize(2);
        assertThat(flow.findPort("receiveorders")).hasValueSatisfying(p -> {
            assertThat(p.getDirection()).isEqualTo(PortDirection.RECEIVE);
            assertThat(p.getTransportType()).isEqualTo("FILE");
            assertThat(p.getAddress()).isEqualTo("C:\\in\\*.xml");
        });
        assertThat(flow.findPort("SendOrders")).hasValueSatisfying(
                p -> assertThat(p.getDirection()).isEqualTo(PortDirection.SEND));

        // service-level variable first, then the two body shapes
        assertThat(flow.getRoots()).extracting(ProcessNode::getKind)
                .containsExactly(NodeKind.VARIABLE_DECLARATION, NodeKind.RECEIVE, NodeKind.SEND);
    }

    @Test
    void testEveryNodeHasExactlyOneOwner() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Nested", "",
                el("Scope", prop("Name", "Outer"),
                        el("Decision", prop("Name", "Check"),
                                el("DecisionBranch", prop("Name", "Yes"), prop("Expression", "a > 1"),
                                        send("Send_A", "P", "M")),
                                el("DecisionBranch", prop("Name", "Else"),
                                        el("Group", prop("Name", "G"), send("Send_B", "P", "M")))),
                        el("Catch", prop("Name", "OnError"), prop("ExceptionType", "System.Exception"),
                                el("Terminate", prop("Name", "Stop"), prop("ErrorMessage", "boom")))));

        List<ProcessNode> all = flow.allNodes();
        Map<ProcessNode, Integer> owners = new IdentityHashMap<>();
        for (ProcessNode node : all) {
            for (ProcessNode child : node.structuralChildren()) {
                owners.merge(child, 1, Integer::sum);
                assertThat(child.getParent()).isSameAs(node);
            }
        }
        for (ProcessNode root : flow.getRoots()) {
            assertThat(owners).doesNotContainKey(root);
        }
        assertThat(owners.values()).allMatch(count -> count == 1);
        assertThat(owners).hasSize(all.size() - flow.getRoots().size());
    }

    @Test
    void testDecideBranchesAreSeparateSlots() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Decisions", "",
                el("Decision", prop("Name", "IsLarge"),
                        el("DecisionBranch", prop("Name", "Large"), prop("Expression", "Order.Total > 1000"),
                                send("Send_Approval", "Approvals", "Order")),
                        el("DecisionBranch", prop("Name", "Else"),
                                send("Send_Direct", "Direct", "Order"),
                                send("Send_Audit", "Audit", "Order"))));

        DecideNode decide = (DecideNode) flow.getRoots().get(0);
        assertThat(decide.getExpression()).isEqualTo("Order.Total > 1000");
        assertThat(decide.getTrueBranch()).extracting(ProcessNode::getDisplayName).containsExactly("Send_Approval");
        assertThat(decide.getFalseBranch()).extracting(ProcessNode::getDisplayName)
                .containsExactly("Send_Direct", "Send_Audit");
        assertThat(decide.getUniqueId()).isNotBlank();
        assertThat(decide.getTrueBranch().get(0).getUniqueId()).isNotBlank();
    }

    @Test
    void testSwitchKeepsCaseOrderAndDefault() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Switching", "",
                el("Switch", prop("Name", "ByRegion"), prop("Expression", "region"),
                        el("DecisionBranch", prop("Name", "North"), prop("Expression", "\"N\""),
                                send("Send_N", "P", "M")),
                        el("DecisionBranch", prop("Name", "Empty"), prop("Expression", "\"E\"")),
                        el("DecisionBranch", prop("Name", "Default"),
                                send("Send_Other", "P", "M"))));

        SwitchNode node = (SwitchNode) flow.getRoots().get(0);
        assertThat(node.getCases()).containsOnlyKeys("\"N\"", "\"E\"");
        assertThat(node.getCases().keySet()).containsExactly("\"N\"", "\"E\"");
        assertThat(node.getCases().get("\"E\"")).isEmpty();
        assertThat(node.getDefaultCase()).extracting(ProcessNode::getDisplayName).containsExactly("Send_Other");
    }

    @Test
    void testResolvesCorrelationsFromServiceAndBody() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Convoy",
                correlation("OrderCorrelation", "recv-1", true),
                receiveWithOid("recv-1", "First", "P", "M1", true)
                        + correlation("OrderCorrelation", "recv-2", false)
                        + receiveWithOid("recv-2", "Second", "P", "M2", false));

        List<ReceiveNode> receives = NodeTraversal.findAll(flow.getRoots(), ReceiveNode.class);
        assertThat(receives).hasSize(2);
        assertThat(receives.get(0).getInitializesCorrelations()).containsExactly("OrderCorrelation");
        assertThat(receives.get(1).getFollowsCorrelations()).containsExactly("OrderCorrelation");
        assertThat(flow.getCorrelationDeclarations()).hasSize(1);
    }

    @Test
    void testConstructOwnsTransformAndAssignment() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Mapping", "",
                el("Construct", prop("Name", "Build_Invoice"),
                        el("MessageRef", prop("Ref", "Invoice")),
                        el("Transform", prop("Name", "Map_Order"), prop("ClassName", "Ns.Maps.OrderToInvoice"),
                                el("MessagePartRef", prop("MessageRef", "Order")),
                                el("MessagePartRef", prop("MessageRef", "Invoice"))),
                        el("MessageAssignment", prop("Name", "Set_Date"),
                                prop("Expression", "Invoice(Ns.Date) = System.DateTime.Now;"))));

        ConstructNode construct = (ConstructNode) flow.getRoots().get(0);
        assertThat(construct.getConstructedMessages()).containsExactly("Invoice");
        assertThat(construct.getInner()).extracting(ProcessNode::getKind)
                .containsExactly(NodeKind.TRANSFORM, NodeKind.MESSAGE_ASSIGNMENT);
        TransformNode transform = (TransformNode) construct.getInner().get(0);
        assertThat(transform.getInputMessages()).containsExactly("Order");
        assertThat(transform.getOutputMessages()).containsExactly("Invoice");
        assertThat(transform.getClassRef()).isEqualTo("Ns.Maps.OrderToInvoice");
        assertThat(transform.getParent()).isSameAs(construct);
    }

    @Test
    void testScopeFlavoursAndUnknownShapes() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Scopes", "",
                el("AtomicTransaction", prop("Name", "Txn"), el("TransactionAttribute"),
                        send("Send_In_Txn", "P", "M"))
                        + el("Sparkle", prop("Name", "Glitter"), send("Inside", "P", "M")));

        ScopeNode txn = (ScopeNode) flow.getRoots().get(0);
        assertThat(txn.getKind()).isEqualTo(NodeKind.ATOMIC_TRANSACTION);
        assertThat(txn.getChildren()).hasSize(1);

        FallbackNode unknown = (FallbackNode) flow.getRoots().get(1);
        assertThat(unknown.getRawKind()).isEqualTo("Sparkle");
        assertThat(unknown.getChildren()).hasSize(1);
    }

    @Test
    void testUniqueIdsAreDistinct() {
        FlowSummary flow = OdxFixtures.parse("Ns", "Ids", "",
                send("S1", "P", "M") + send("S2", "P", "M") + send("S3", "P", "M"));

        Set<String> ids = new HashSet<>();
        for (ProcessNode node : flow.allNodes()) {
            assertThat(ids.add(node.getUniqueId())).isTrue();
        }
    }

    @Test
    void testMissingEndSentinelIsMalformed() {
        String source = OdxFixtures.orchestration("Ns", "Broken", "", "").replace("#endif", "");

        assertThatThrownBy(() -> new OrchestrationParser(source, "Broken.odx").parse())
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("#endif");
    }

    @Test
    void testMissingXmlDeclarationIsMalformed() {
        assertThatThrownBy(() -> new OrchestrationParser("module Nothing {}", "Empty.odx").parse())
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("missing XML declaration");
    }

    @Test
    void testBrokenXmlIsMalformed() {
        String source = "<?xml version=\"1.0\"?><om:MetaModel xmlns:om=\"x\"><om:Element>\n#endif";

        assertThatThrownBy(() -> new OrchestrationParser(source, "Bad.odx").parse())
                .isInstanceOf(MalformedSourceException.class);
    }

    @Test
    void testMissingServiceNameIsMalformed() {
        String source = "<?xml version=\"1.0\"?><om:MetaModel xmlns:om=\"x\"></om:MetaModel>\n#endif";

        assertThatThrownBy(() -> new OrchestrationParser(source, "NoName.odx").parse())
                .isInstanceOf(MalformedSourceException.class)
                .hasMessageContaining("orchestration name");
    }

    @Test
    void testParseFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("FromDisk.odx");
        Files.writeString(file, OdxFixtures.orchestration("Ns", "FromDisk", "", send("S", "P", "M")));

        FlowSummary flow = OrchestrationParser.parseFile(file);

        assertThat(flow.getName()).isEqualTo("FromDisk");
        assertThat(flow.getRoots()).hasSize(1);
    }
}
