package com.integration.migrator.batch;

import java.nio.file.Path;
import java.util.Optional;

import com.integration.migrator.transform.TransformationResult;

import lombok.Getter;

/**
 * Result of migrating one source: either a transformation result or a failure message.
 */
@Getter
public final class UnitOutcome {
    private final Path source;
    private final TransformationResult result;
    private final String failure;

    private UnitOutcome(Path source, TransformationResult result, String failure) {
        this.source = source;
        this.result = result;
        this.failure = failure;
    }

    public static UnitOutcome success(Path source, TransformationResult result) {
        return new UnitOutcome(source, result, null);
    }

    public static UnitOutcome failure(Path source, String message) {
        return new UnitOutcome(source, null, message);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<TransformationResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<String> getFailure() {
        return Optional.ofNullable(failure);
    }
}
