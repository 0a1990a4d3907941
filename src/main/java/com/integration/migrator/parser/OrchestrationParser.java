package com.integration.migrator.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import com.integration.migrator.model.AssignmentNode;
import com.integration.migrator.model.BindingKind;
import com.integration.migrator.model.CallPolicyNode;
import com.integration.migrator.model.CatchNode;
import com.integration.migrator.model.CompensateNode;
import com.integration.migrator.model.ConditionalLoopNode;
import com.integration.migrator.model.ConstructNode;
import com.integration.migrator.model.ContainerNode;
import com.integration.migrator.model.CorrelationDeclarationNode;
import com.integration.migrator.model.CorrelationStatementRef;
import com.integration.migrator.model.DecideNode;
import com.integration.migrator.model.DelayNode;
import com.integration.migrator.model.ExpressionNode;
import com.integration.migrator.model.FallbackNode;
import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.model.GroupNode;
import com.integration.migrator.model.InvocationNode;
import com.integration.migrator.model.ListenNode;
import com.integration.migrator.model.LoopNode;
import com.integration.migrator.model.MessageDeclaration;
import com.integration.migrator.model.NodeKind;
import com.integration.migrator.model.NodeTraversal;
import com.integration.migrator.model.OperationDeclaration;
import com.integration.migrator.model.ParallelBranchNode;
import com.integration.migrator.model.ParallelNode;
import com.integration.migrator.model.PortDeclaration;
import com.integration.migrator.model.PortDirection;
import com.integration.migrator.model.PortTypeDeclaration;
import com.integration.migrator.model.ProcessNode;
import com.integration.migrator.model.ReceiveNode;
import com.integration.migrator.model.ScopeNode;
import com.integration.migrator.model.SendNode;
import com.integration.migrator.model.SwitchNode;
import com.integration.migrator.model.TaskNode;
import com.integration.migrator.model.TerminateNode;
import com.integration.migrator.model.TransformNode;
import com.integration.migrator.model.UniqueIdGenerator;
import com.integration.migrator.model.VariableDeclarationNode;
import com.integration.migrator.util.XmlDocuments;

/**
 * Parser for orchestration designer files (.odx).
 * Extracts the XML designer block embedded in the generated code and builds the
 * process-flow tree from it.
 *
 * Parsing only:
 * - Builds the node tree and the declarations
 * - Resolves correlation references once the whole tree exists
 *
 * It does NOT analyze activation patterns or lower anything.
 */
public class OrchestrationParser {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationParser.class);

    public static final String DESIGNER_NAMESPACE = "http://schemas.microsoft.com/BizTalk/2003/DesignerData";

    private static final String XML_ANCHOR = "<?xml";
    private static final String END_SENTINEL = "#endif";
    private static final int MAX_POLICY_SEGMENT = 40;

    private final String content;
    private final String sourceName;
    private final UniqueIdGenerator uniqueIds = new UniqueIdGenerator();
    private final Map<String, ProcessNode> nodesBySourceId = new HashMap<>();
    private int sequence = 0;

    public OrchestrationParser(String content, String sourceName) {
        this.content = content;
        this.sourceName = sourceName == null ? "<memory>" : sourceName;
    }

    public static FlowSummary parseFile(Path path) throws IOException {
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        return new OrchestrationParser(raw, path.getFileName().toString()).parse();
    }

    public FlowSummary parse() {
        log.info("Parsing orchestration: {}", sourceName);

        Element metaModel = loadDesignerBlock().getDocumentElement();
        Element module = findElementOfType(metaModel, "Module");
        Element service = module == null ? null : findElementOfType(module, "ServiceDeclaration");
        String name = service == null ? null : property(service, "Name");
        if (name == null) {
            throw new MalformedSourceException("Failed to extract orchestration name from '" + sourceName
                    + "'. The file structure may be invalid.");
        }

        FlowSummary.FlowSummaryBuilder builder = FlowSummary.builder()
                .name(name)
                .namespace(property(module, "Name"))
                .uniqueIds(uniqueIds);

        for (Element message : elementsOfType(service, "MessageDeclaration")) {
            String messageName = property(message, "Name");
            if (messageName == null) {
                continue;
            }
            builder.message(MessageDeclaration.builder()
                    .name(messageName)
                    .type(property(message, "Type"))
                    .direction(property(message, "ParamDirection"))
                    .build());
        }

        // Service-level variables sit outside the body; they still need hoisting.
        for (Element variable : elementsOfType(service, "VariableDeclaration")) {
            if (property(variable, "Name") == null) {
                continue;
            }
            VariableDeclarationNode node = parseVariableDeclaration(variable);
            node.setSequence(-1);
            builder.root(node);
        }

        for (Element portType : elementsOfType(module, "PortType")) {
            PortTypeDeclaration parsed = parsePortType(portType);
            if (parsed != null) {
                builder.portType(parsed);
            }
        }

        for (Element port : elementsOfType(service, "PortDeclaration")) {
            PortDeclaration parsed = parsePort(port);
            if (parsed != null) {
                builder.port(parsed);
            }
        }

        List<CorrelationDeclarationNode> serviceCorrelations = new ArrayList<>();
        for (Element correlation : elementsOfType(service, "CorrelationDeclaration")) {
            CorrelationDeclarationNode node = parseCorrelation(correlation);
            serviceCorrelations.add(node);
            builder.correlationDeclaration(node);
        }

        List<ProcessNode> bodyRoots = new ArrayList<>();
        Element body = findElementOfType(service, "ServiceBody");
        if (body != null) {
            for (Element child : XmlDocuments.childElements(body, "Element")) {
                ProcessNode node = parseElement(child);
                if (node != null) {
                    bodyRoots.add(node);
                }
            }
        } else {
            log.warn("Orchestration {} has no ServiceBody; the flow will be empty", name);
        }
        builder.roots(bodyRoots);

        resolveCorrelations(serviceCorrelations, bodyRoots);

        FlowSummary flow = builder.build();
        log.info("Parsed orchestration {}: {} message(s), {} port(s), {} root node(s)",
                flow.getQualifiedName(), flow.getMessages().size(), flow.getPorts().size(), flow.getRoots().size());
        return flow;
    }

    private Document loadDesignerBlock() {
        if (content == null) {
            throw new MalformedSourceException("Orchestration source '" + sourceName + "' is empty.");
        }
        int start = content.indexOf(XML_ANCHOR);
        if (start < 0) {
            throw new MalformedSourceException("Invalid orchestration file '" + sourceName
                    + "': missing XML declaration.");
        }
        int end = content.indexOf(END_SENTINEL, start);
        if (end < 0) {
            throw new MalformedSourceException("Invalid orchestration file '" + sourceName
                    + "': missing '" + END_SENTINEL + "' sentinel. The file may be truncated.");
        }
        try {
            return XmlDocuments.parse(content.substring(start, end));
        } catch (SAXException | IOException e) {
            throw new MalformedSourceException("Failed to parse designer XML in '" + sourceName + "': "
                    + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private PortTypeDeclaration parsePortType(Element portType) {
        String name = property(portType, "Name");
        if (name == null) {
            return null;
        }
        PortTypeDeclaration.PortTypeDeclarationBuilder builder = PortTypeDeclaration.builder().name(name);
        for (Element operation : elementsOfType(portType, "OperationDeclaration")) {
            String operationName = property(operation, "Name");
            if (operationName == null) {
                continue;
            }
            Map<String, String> refs = new HashMap<>();
            for (Element messageRef : elementsOfType(operation, "MessageRef")) {
                String slot = property(messageRef, "Name");
                if (slot != null) {
                    refs.putIfAbsent(slot, property(messageRef, "Ref"));
                }
            }
            builder.operation(OperationDeclaration.builder()
                    .name(operationName)
                    .operationType(property(operation, "OperationType"))
                    .requestMessageType(refs.get("Request"))
                    .responseMessageType(refs.get("Response"))
                    .faultMessageType(refs.get("Fault"))
                    .build());
        }
        return builder.build();
    }

    private PortDeclaration parsePort(Element port) {
        String name = property(port, "Name");
        if (name == null) {
            return null;
        }
        Element physical = findElementOfType(port, "PhysicalBindingAttribute");
        Element web = findElementOfType(port, "WebPortBindingAttribute");

        String transport = null;
        if (physical != null) {
            transport = firstNonBlank(property(physical, "TransportType"), property(physical, "Adapter"),
                    property(physical, "AdapterName"));
        }
        if (transport == null && web != null) {
            transport = property(web, "TransportType");
        }

        return PortDeclaration.builder()
                .name(name)
                .portTypeRef(property(port, "Type"))
                .direction(portDirection(property(port, "PortModifier"), property(port, "Signal")))
                .bindingKind(bindingKind(port))
                .transportType(transport)
                .address(physical == null ? null : property(physical, "Address"))
                .build();
    }

    static PortDirection portDirection(String modifier, String signal) {
        boolean oneWaySignal = "True".equalsIgnoreCase(signal);
        if ("Implements".equalsIgnoreCase(modifier)) {
            return oneWaySignal ? PortDirection.RECEIVE : PortDirection.RECEIVE_SEND;
        }
        if ("Uses".equalsIgnoreCase(modifier)) {
            return oneWaySignal ? PortDirection.SEND_RECEIVE : PortDirection.SEND;
        }
        return PortDirection.NONE;
    }

    private BindingKind bindingKind(Element port) {
        if (findElementOfType(port, "LogicalBindingAttribute") != null) {
            return BindingKind.LOGICAL;
        }
        if (findElementOfType(port, "PhysicalBindingAttribute") != null) {
            return BindingKind.PHYSICAL;
        }
        if (findElementOfType(port, "DirectBindingAttribute") != null) {
            return BindingKind.DIRECT;
        }
        if (findElementOfType(port, "WebPortBindingAttribute") != null) {
            return BindingKind.WEB;
        }
        return BindingKind.UNKNOWN;
    }

    // ---------------------------------------------------------------------
    // Body
    // ---------------------------------------------------------------------

    /**
     * Maps one designer element to exactly one node, or null for metadata elements
     * that carry no behavior.
     */
    private ProcessNode parseElement(Element element) {
        String type = element.getAttribute("Type");
        String key = type.toLowerCase(Locale.ROOT);
        log.debug("Parsing element type {} (OID {})", type, element.getAttribute("OID"));

        return switch (key) {
            case "transactionattribute" -> null;
            case "receive" -> parseReceive(element);
            case "send" -> parseSend(element);
            case "decision", "decide", "if", "ifelse" -> parseDecide(element);
            case "switch" -> parseSwitch(element);
            case "loop", "foreach" -> parseLoop(element);
            case "while" -> parseConditionalLoop(element, NodeKind.WHILE);
            case "until" -> parseConditionalLoop(element, NodeKind.UNTIL);
            case "parallel" -> parseContainer(element, new ParallelNode());
            case "parallelbranch" -> parseContainer(element, new ParallelBranchNode());
            case "listen" -> parseListen(element);
            case "construct" -> parseConstruct(element);
            case "transform" -> parseTransform(element);
            case "variabledeclaration", "messagedeclaration" -> parseVariableDeclaration(element);
            case "messageassignment" -> parseAssignment(element, NodeKind.MESSAGE_ASSIGNMENT);
            case "variableassignment" -> parseAssignment(element, NodeKind.VARIABLE_ASSIGNMENT);
            case "correlationdeclaration" -> parseCorrelation(element);
            case "scope" -> parseContainer(element, new ScopeNode(NodeKind.SCOPE));
            case "atomictransaction" -> parseContainer(element, new ScopeNode(NodeKind.ATOMIC_TRANSACTION));
            case "longrunningtransaction" -> parseContainer(element, new ScopeNode(NodeKind.LONG_RUNNING_TRANSACTION));
            case "compensation" -> parseContainer(element, new ScopeNode(NodeKind.COMPENSATION_SCOPE));
            case "catch", "catchexception" -> parseCatch(element);
            case "call" -> parseInvocation(element, NodeKind.CALL);
            case "exec", "start", "startorchestration" -> parseInvocation(element, NodeKind.START);
            case "terminate", "throw", "suspend" -> parseTerminate(element, type);
            case "delay" -> parseDelay(element);
            case "compensate" -> parseCompensate(element);
            case "group" -> parseContainer(element, new GroupNode());
            case "task", "listenbranch" -> parseContainer(element, new TaskNode());
            case "callrules", "callpolicy" -> parseCallPolicy(element);
            case "expression" -> parseExpression(element);
            default -> parseFallback(element, type);
        };
    }

    private ReceiveNode parseReceive(Element element) {
        ReceiveNode node = stamp(new ReceiveNode(), element);
        node.setPortName(property(element, "PortName"));
        node.setMessageName(property(element, "MessageName"));
        node.setOperationName(property(element, "OperationName"));
        node.setOperationMessageName(property(element, "OperationMessageName"));
        node.setActivating("True".equalsIgnoreCase(property(element, "Activate")));
        return node;
    }

    private SendNode parseSend(Element element) {
        SendNode node = stamp(new SendNode(), element);
        node.setPortName(property(element, "PortName"));
        node.setMessageName(property(element, "MessageName"));
        node.setOperationName(property(element, "OperationName"));
        uniqueIds.assignIfMissing(node, "SEND");
        return node;
    }

    private DecideNode parseDecide(Element element) {
        DecideNode decide = stamp(new DecideNode(), element);
        uniqueIds.assignIfMissing(decide, "DECIDE");

        List<Element> branches = elementsOfType(element, "DecisionBranch");
        Element trueBranch = null;
        for (Element branch : branches) {
            if (branchExpression(branch) != null) {
                trueBranch = branch;
                break;
            }
        }
        Element falseBranch = null;
        if (trueBranch == null) {
            trueBranch = branches.isEmpty() ? null : branches.get(0);
            falseBranch = branches.size() > 1 ? branches.get(1) : null;
        } else {
            for (Element branch : branches) {
                if (branch != trueBranch) {
                    falseBranch = branch;
                    break;
                }
            }
        }

        String expression = firstNonBlank(property(element, "Expression"),
                trueBranch == null ? null : branchExpression(trueBranch));
        if (expression == null) {
            Element sibling = findElementOfType(element, "Expression");
            expression = sibling == null ? null : property(sibling, "Expression");
        }

        if (trueBranch != null) {
            Element conditionElement = findElementOfType(trueBranch, "Expression");
            for (Element child : XmlDocuments.childElements(trueBranch, "Element")) {
                if (child == conditionElement && property(trueBranch, "Expression") == null) {
                    continue;
                }
                ProcessNode node = parseElement(child);
                if (node != null) {
                    decide.addTrueBranch(node);
                    uniqueIds.assignIfMissing(node, "TRUE");
                }
            }
        }
        if (falseBranch != null) {
            for (Element child : XmlDocuments.childElements(falseBranch, "Element")) {
                ProcessNode node = parseElement(child);
                if (node != null) {
                    decide.addFalseBranch(node);
                    uniqueIds.assignIfMissing(node, "FALSE");
                }
            }
        }

        if (expression == null) {
            expression = decide.getTrueBranch().stream()
                    .filter(ExpressionNode.class::isInstance)
                    .map(n -> ((ExpressionNode) n).getExpression())
                    .filter(e -> e != null && !e.isBlank())
                    .findFirst()
                    .orElse(null);
        }
        decide.setExpression(expression);
        return decide;
    }

    private String branchExpression(Element branch) {
        String expression = property(branch, "Expression");
        if (expression != null) {
            return expression;
        }
        Element nested = findElementOfType(branch, "Expression");
        return nested == null ? null : property(nested, "Expression");
    }

    private SwitchNode parseSwitch(Element element) {
        SwitchNode node = stamp(new SwitchNode(), element);
        uniqueIds.assignIfMissing(node, "SWITCH");

        String expression = property(element, "Expression");
        if (expression == null) {
            Element nested = findElementOfType(element, "Expression");
            expression = nested == null ? null : property(nested, "Expression");
        }
        node.setExpression(expression);

        int index = 0;
        for (Element branch : elementsOfType(element, "DecisionBranch")) {
            String caseExpression = property(branch, "Expression");
            String caseName = property(branch, "Name");
            String lowerName = caseName == null ? "" : caseName.toLowerCase(Locale.ROOT);
            boolean isDefault = caseExpression == null || lowerName.contains("default") || lowerName.contains("else");
            String key = firstNonBlank(caseExpression, caseName, "Case_" + index);

            if (!isDefault) {
                node.declareCase(key);
            }
            for (Element child : XmlDocuments.childElements(branch, "Element")) {
                ProcessNode parsed = parseElement(child);
                if (parsed == null) {
                    continue;
                }
                if (isDefault) {
                    node.addDefault(parsed);
                    uniqueIds.assignIfMissing(parsed, "DEFAULT");
                } else {
                    node.addCase(key, parsed);
                    uniqueIds.assignIfMissing(parsed, "CASE_" + index);
                }
            }
            index++;
        }
        return node;
    }

    private LoopNode parseLoop(Element element) {
        LoopNode node = stamp(new LoopNode(), element);
        Element collection = findElementOfType(element, "Expression");
        if (collection != null) {
            node.setCollectionExpression(property(collection, "Expression"));
        }
        Element iterator = findElementOfType(element, "IteratorVariable");
        String item = iterator == null ? null : property(iterator, "Name");
        if (item != null) {
            node.setItemVariable(item);
        }
        for (Element child : XmlDocuments.childElements(element, "Element")) {
            if (child == collection || child == iterator) {
                continue;
            }
            ProcessNode parsed = parseElement(child);
            if (parsed != null) {
                node.addChild(parsed);
            }
        }
        return node;
    }

    private ConditionalLoopNode parseConditionalLoop(Element element, NodeKind kind) {
        ConditionalLoopNode node = parseContainer(element, new ConditionalLoopNode(kind));
        node.setExpression(property(element, "Expression"));
        return node;
    }

    private ListenNode parseListen(Element element) {
        ListenNode node = stamp(new ListenNode(), element);
        for (Element child : XmlDocuments.childElements(element, "Element")) {
            ProcessNode parsed = parseElement(child);
            if (parsed == null) {
                continue;
            }
            if (parsed instanceof TaskNode branch) {
                node.addBranch(branch);
            } else {
                TaskNode wrapper = new TaskNode();
                wrapper.setDisplayName(parsed.getDisplayName());
                wrapper.setSequence(parsed.getSequence());
                wrapper.addChild(parsed);
                node.addBranch(wrapper);
            }
        }
        return node;
    }

    private ConstructNode parseConstruct(Element element) {
        ConstructNode node = stamp(new ConstructNode(), element);
        uniqueIds.assignIfMissing(node, "CONSTRUCT");

        for (Element messageRef : elementsOfType(element, "MessageRef")) {
            String ref = property(messageRef, "Ref");
            if (ref != null) {
                node.getConstructedMessages().add(ref);
            }
        }
        for (Element transform : elementsOfType(element, "Transform")) {
            TransformNode inner = parseTransform(transform);
            node.addInner(inner);
            uniqueIds.assignIfMissing(inner, "INNER");
        }
        for (Element assignment : elementsOfType(element, "MessageAssignment")) {
            AssignmentNode inner = parseAssignment(assignment, NodeKind.MESSAGE_ASSIGNMENT);
            node.addInner(inner);
            uniqueIds.assignIfMissing(inner, "INNER");
        }
        return node;
    }

    private TransformNode parseTransform(Element element) {
        TransformNode node = stamp(new TransformNode(), element);
        node.setClassRef(property(element, "ClassName"));
        uniqueIds.assignIfMissing(node, "TRANSFORM");

        List<String> unplaced = new ArrayList<>();
        for (Element partRef : elementsOfType(element, "MessagePartRef")) {
            String message = property(partRef, "MessageRef");
            if (message == null) {
                continue;
            }
            String link = partRef.getAttribute("ParentLink");
            if (link.contains("Output")) {
                node.getOutputMessages().add(message);
            } else if (link.contains("Input")) {
                node.getInputMessages().add(message);
            } else {
                unplaced.add(message);
            }
        }
        // Without parent links, two references read as input then output.
        if (unplaced.size() == 2 && node.getInputMessages().isEmpty() && node.getOutputMessages().isEmpty()) {
            node.getInputMessages().add(unplaced.get(0));
            node.getOutputMessages().add(unplaced.get(1));
        } else {
            node.getInputMessages().addAll(unplaced);
        }
        return node;
    }

    private VariableDeclarationNode parseVariableDeclaration(Element element) {
        VariableDeclarationNode node = stamp(new VariableDeclarationNode(), element);
        node.setVarType(property(element, "Type"));
        node.setUseDefaultConstructor("True".equalsIgnoreCase(property(element, "UseDefaultConstructor")));
        return node;
    }

    private AssignmentNode parseAssignment(Element element, NodeKind kind) {
        AssignmentNode node = stamp(new AssignmentNode(kind), element);
        node.setExpression(property(element, "Expression"));
        return node;
    }

    private CorrelationDeclarationNode parseCorrelation(Element element) {
        CorrelationDeclarationNode node = stamp(new CorrelationDeclarationNode(), element);
        node.setTypeRef(property(element, "Type"));
        for (Element statementRef : elementsOfType(element, "StatementRef")) {
            String ref = property(statementRef, "Ref");
            if (ref != null) {
                node.getStatementRefs().add(new CorrelationStatementRef(ref,
                        "True".equalsIgnoreCase(property(statementRef, "Initializes"))));
            }
        }
        return node;
    }

    private CatchNode parseCatch(Element element) {
        CatchNode node = parseContainer(element, new CatchNode());
        String exceptionType = firstNonBlank(property(element, "ExceptionType"), property(element, "Exception"));
        if (exceptionType != null) {
            node.setExceptionType(exceptionType);
        }
        String variable = firstNonBlank(property(element, "ExceptionName"), property(element, "ExceptionVariable"));
        if (variable != null) {
            node.setExceptionVariable(variable);
        }
        return node;
    }

    private InvocationNode parseInvocation(Element element, NodeKind kind) {
        InvocationNode node = stamp(new InvocationNode(kind), element);
        node.setTargetName(property(element, "Invokee"));
        return node;
    }

    private TerminateNode parseTerminate(Element element, String type) {
        TerminateNode node = stamp(new TerminateNode(), element);
        node.setOrigin(type);
        switch (type.toLowerCase(Locale.ROOT)) {
            case "throw" -> node.setErrorMessage(
                    firstNonBlank(property(element, "Exception"), property(element, "ExceptionType")));
            case "suspend" -> node.setErrorMessage(firstNonBlank(property(element, "ErrorMessage"), "Suspended"));
            default -> node.setErrorMessage(property(element, "ErrorMessage"));
        }
        return node;
    }

    private DelayNode parseDelay(Element element) {
        DelayNode node = stamp(new DelayNode(), element);
        node.setExpression(firstNonBlank(property(element, "Expression"), property(element, "Timeout")));
        return node;
    }

    private CompensateNode parseCompensate(Element element) {
        CompensateNode node = stamp(new CompensateNode(), element);
        node.setTarget(property(element, "Target"));
        return node;
    }

    private CallPolicyNode parseCallPolicy(Element element) {
        CallPolicyNode node = stamp(new CallPolicyNode(), element);
        String policy = firstNonBlank(property(element, "Policy"), property(element, "PolicyName"),
                property(element, "Ruleset"));
        node.setPolicyName(policy);
        node.setDisplayName(policy == null ? "Execute_Rules_Engine" : "Execute_Rules_Engine_" + policySegment(policy));
        return node;
    }

    private static String policySegment(String policy) {
        String alphanumeric = policy.replaceAll("[^A-Za-z0-9]", "");
        return alphanumeric.length() > MAX_POLICY_SEGMENT ? alphanumeric.substring(0, MAX_POLICY_SEGMENT) : alphanumeric;
    }

    private ExpressionNode parseExpression(Element element) {
        ExpressionNode node = stamp(new ExpressionNode(), element);
        node.setExpression(property(element, "Expression"));
        return node;
    }

    private FallbackNode parseFallback(Element element, String type) {
        log.debug("Unrecognized element type '{}' kept as a fallback node", type);
        FallbackNode node = parseContainer(element, new FallbackNode());
        node.setRawKind(type);
        if (node.getDisplayName() == null) {
            node.setDisplayName("Unknown_" + type);
        }
        return node;
    }

    private <T extends ContainerNode> T parseContainer(Element element, T node) {
        stamp(node, element);
        for (Element child : XmlDocuments.childElements(element, "Element")) {
            ProcessNode parsed = parseElement(child);
            if (parsed != null) {
                node.addChild(parsed);
            }
        }
        return node;
    }

    /**
     * Fills the common fields and registers the node for correlation lookup.
     * Sequence numbers are issued in preorder, so a node always precedes its descendants.
     */
    private <T extends ProcessNode> T stamp(T node, Element element) {
        String oid = XmlDocuments.attribute(element, "OID");
        node.setSourceId(oid);
        node.setDisplayName(property(element, "Name"));
        node.setSequence(sequence++);
        if (oid != null) {
            nodesBySourceId.put(oid, node);
        }
        return node;
    }

    // ---------------------------------------------------------------------
    // Correlations
    // ---------------------------------------------------------------------

    private void resolveCorrelations(List<CorrelationDeclarationNode> serviceCorrelations, List<ProcessNode> bodyRoots) {
        List<CorrelationDeclarationNode> all = new ArrayList<>(serviceCorrelations);
        all.addAll(NodeTraversal.findAll(bodyRoots, CorrelationDeclarationNode.class));

        for (CorrelationDeclarationNode correlation : all) {
            String correlationName = correlation.getDisplayName();
            for (CorrelationStatementRef ref : correlation.getStatementRefs()) {
                ProcessNode target = nodesBySourceId.get(ref.getRefId());
                if (!(target instanceof ReceiveNode receive)) {
                    log.debug("Correlation {} references {} which is not a receive", correlationName, ref.getRefId());
                    continue;
                }
                if (ref.isInitializes()) {
                    receive.getInitializesCorrelations().add(correlationName);
                } else {
                    receive.getFollowsCorrelations().add(correlationName);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // DOM helpers
    // ---------------------------------------------------------------------

    private static String property(Element element, String name) {
        for (Element property : XmlDocuments.childElements(element, "Property")) {
            if (name.equals(property.getAttribute("Name"))) {
                return XmlDocuments.attribute(property, "Value");
            }
        }
        return null;
    }

    private static List<Element> elementsOfType(Element parent, String type) {
        List<Element> result = new ArrayList<>();
        for (Element child : XmlDocuments.childElements(parent, "Element")) {
            if (type.equals(child.getAttribute("Type"))) {
                result.add(child);
            }
        }
        return result;
    }

    private static Element findElementOfType(Element parent, String type) {
        List<Element> matches = elementsOfType(parent, type);
        return matches.isEmpty() ? null : matches.get(0);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
