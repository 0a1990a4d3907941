package com.integration.migrator.analysis;

import java.util.List;

import com.integration.migrator.model.ReceiveNode;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of trigger pattern analysis for one flow.
 */
@Value
@Builder
public class TriggerAnalysis {
    TriggerPattern pattern;
    ReceiveNode primaryReceive;
    @Singular("secondaryReceive")
    List<ReceiveNode> secondaryReceives;
    boolean requiresRequestTrigger;
    boolean requiresSessionSupport;
    boolean requiresTimeoutHandling;
    @Singular
    List<String> warnings;
    /** Why the flow cannot be migrated as a single workflow; null when it can. */
    String blockingReason;

    public boolean isValid() {
        return pattern != TriggerPattern.INVALID && pattern != TriggerPattern.PARALLEL_ALL_MUST_COMPLETE;
    }

    public int totalReceiveCount() {
        return (primaryReceive == null ? 0 : 1) + secondaryReceives.size();
    }

    public boolean isPrimary(ReceiveNode receive) {
        return primaryReceive != null && primaryReceive == receive;
    }
}
