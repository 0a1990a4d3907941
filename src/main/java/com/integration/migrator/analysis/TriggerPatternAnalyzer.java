package com.integration.migrator.analysis;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.model.ListenNode;
import com.integration.migrator.model.NodeTraversal;
import com.integration.migrator.model.ParallelNode;
import com.integration.migrator.model.ReceiveNode;

/**
 * Classifies how a flow is activated. Pure function of the parsed tree.
 */
public class TriggerPatternAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TriggerPatternAnalyzer.class);

    public TriggerAnalysis analyze(FlowSummary flow) {
        List<ReceiveNode> receives = NodeTraversal.findAll(flow.getRoots(), ReceiveNode.class);
        List<ReceiveNode> activating = receives.stream().filter(ReceiveNode::isActivating).toList();

        TriggerAnalysis analysis;
        if (activating.isEmpty()) {
            analysis = callable();
        } else if (activating.size() == 1) {
            analysis = singleActivation(activating.get(0), receives);
        } else {
            analysis = multipleActivations(activating);
        }

        log.info("Trigger pattern for {}: {} ({} receive(s) involved)", flow.getQualifiedName(),
                analysis.getPattern(), analysis.totalReceiveCount());
        if (!analysis.isValid()) {
            log.warn("{}", analysis.getBlockingReason());
        }
        return analysis;
    }

    private TriggerAnalysis callable() {
        return TriggerAnalysis.builder()
                .pattern(TriggerPattern.CALLABLE)
                .requiresRequestTrigger(true)
                .warning("No activating Receive shapes found. Workflow will use HTTP Request trigger (callable workflow).")
                .build();
    }

    private TriggerAnalysis singleActivation(ReceiveNode primary, List<ReceiveNode> receives) {
        List<ReceiveNode> followers = receives.stream()
                .filter(r -> !r.isActivating())
                .filter(r -> r.getFollowsCorrelations().stream()
                        .anyMatch(c -> primary.getInitializesCorrelations().contains(c)))
                .toList();

        if (!primary.initializesAnyCorrelation() || followers.isEmpty()) {
            return TriggerAnalysis.builder()
                    .pattern(TriggerPattern.SINGLE_TRIGGER)
                    .primaryReceive(primary)
                    .build();
        }

        return TriggerAnalysis.builder()
                .pattern(TriggerPattern.CONVOY)
                .primaryReceive(primary)
                .secondaryReceives(followers)
                .requiresSessionSupport(true)
                .warning("Convoy pattern detected with " + followers.size() + " correlated receive(s). "
                        + "Requires Service Bus with session support or custom correlation implementation.")
                .build();
    }

    private TriggerAnalysis multipleActivations(List<ReceiveNode> activating) {
        ReceiveNode primary = activating.get(0);
        List<ReceiveNode> secondaries = activating.subList(1, activating.size());
        int count = activating.size();

        if (shareOneListen(activating)) {
            return TriggerAnalysis.builder()
                    .pattern(TriggerPattern.LISTEN_FIRST_TO_COMPLETE)
                    .primaryReceive(primary)
                    .secondaryReceives(secondaries)
                    .requiresTimeoutHandling(true)
                    .warning("Listen pattern with " + count + " activating receives. The first branch to receive "
                            + "a message wins; the other branches need timeout or routing handling.")
                    .build();
        }

        if (activating.stream().allMatch(r -> r.findAncestor(ParallelNode.class).isPresent())) {
            return TriggerAnalysis.builder()
                    .pattern(TriggerPattern.PARALLEL_ALL_MUST_COMPLETE)
                    .primaryReceive(primary)
                    .secondaryReceives(secondaries)
                    .blockingReason("INVALID PATTERN: " + count + " activating Receive shapes in Parallel branches "
                            + "detected. A workflow can only have ONE trigger. Split the orchestration into separate "
                            + "workflows or use a single activating receive followed by correlated receives.")
                    .build();
        }

        return TriggerAnalysis.builder()
                .pattern(TriggerPattern.INVALID)
                .primaryReceive(primary)
                .secondaryReceives(secondaries)
                .blockingReason("INVALID PATTERN: " + count + " sequential activating Receive shapes detected. "
                        + "A workflow can only have ONE trigger. Only the first receive can activate the flow; "
                        + "later receives must follow a correlation set.")
                .build();
    }

    private static boolean shareOneListen(List<ReceiveNode> activating) {
        Optional<ListenNode> first = activating.get(0).findAncestor(ListenNode.class);
        if (first.isEmpty()) {
            return false;
        }
        for (ReceiveNode receive : activating) {
            Optional<ListenNode> listen = receive.findAncestor(ListenNode.class);
            if (listen.isEmpty() || listen.get() != first.get()) {
                return false;
            }
        }
        return true;
    }
}
