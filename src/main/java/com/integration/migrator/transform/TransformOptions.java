package com.integration.migrator.transform;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable per-run switches handed to the transformer.
 */
@Value
@Builder
public class TransformOptions {
    public static final int DEFAULT_RETRY_LIMIT = 10;

    boolean callable;
    @Builder.Default
    int selfRecursionRetryLimit = DEFAULT_RETRY_LIMIT;
    @Builder.Default
    String defaultDelay = "PT1M";

    public static TransformOptions defaults() {
        return TransformOptions.builder().build();
    }
}
