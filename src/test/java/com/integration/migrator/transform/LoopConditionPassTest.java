package com.integration.migrator.transform;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for LoopConditionPass threshold extraction.
 */
class LoopConditionPassTest {

    @Test
    void testUpperBoundIsExtracted() {
        assertThat(LoopConditionPass.extractThreshold("liCounter < 10")).isEqualTo(10);
        assertThat(LoopConditionPass.extractThreshold("i <= 5")).isEqualTo(5);
        assertThat(LoopConditionPass.extractThreshold("while (attempt < 3)")).isEqualTo(3);
    }

    @Test
    void testBooleanGuardHasNoBound() {
        assertThat(LoopConditionPass.extractThreshold("lbDone == false")).isNull();
        assertThat(LoopConditionPass.extractThreshold("")).isNull();
        assertThat(LoopConditionPass.extractThreshold(null)).isNull();
    }

    @Test
    void testMissingBoundFallsBackToDefault() {
        assertThat(LoopConditionPass.thresholdOrDefault("lbDone == false")).isEqualTo(60);
        assertThat(LoopConditionPass.thresholdOrDefault(null)).isEqualTo(LoopConditionPass.DEFAULT_LOOP_LIMIT);
        assertThat(LoopConditionPass.thresholdOrDefault("liCounter < 25")).isEqualTo(25);
        assertThat(LoopConditionPass.thresholdOrDefault("count < 99999999999")).isEqualTo(60);
    }
}
