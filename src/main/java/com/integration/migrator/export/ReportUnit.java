package com.integration.migrator.export;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Report row for one migrated unit, flattened for the template.
 */
@Value
@Builder
public class ReportUnit {
    String name;
    String source;
    String pattern;
    boolean valid;
    String failure;
    @Singular
    List<String> errors;
    @Singular
    List<String> warnings;
    @Singular
    List<String> infos;
    @Singular("actionCount")
    Map<String, Integer> actionCounts;
    @Singular
    List<String> synthesizedVariables;
}
