package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.core.passes.opts.OptimizationStats;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * What happened to one function of a module.
 */
public final class FunctionOutcome {
    public enum Status {
        OPTIMIZED,
        SKIPPED,
        FAILED,
    }

    public final String functionName;
    public final Status status;
    @Nullable
    private final OptimizationStats stats;
    @Nullable
    private final OptimizationFailure failure;
    @Nullable
    private final String skipReason;

    private FunctionOutcome(
            String functionName,
            Status status,
            @Nullable OptimizationStats stats,
            @Nullable OptimizationFailure failure,
            @Nullable String skipReason
    ) {
        this.functionName = functionName;
        this.status = status;
        this.stats = stats;
        this.failure = failure;
        this.skipReason = skipReason;
    }

    public static FunctionOutcome optimized(String functionName, OptimizationStats stats) {
        return new FunctionOutcome(functionName, Status.OPTIMIZED, stats, null, null);
    }

    public static FunctionOutcome skipped(String functionName, String reason) {
        return new FunctionOutcome(functionName, Status.SKIPPED, null, null, reason);
    }

    public static FunctionOutcome failed(OptimizationFailure failure) {
        return new FunctionOutcome(failure.functionName, Status.FAILED, null, failure, null);
    }

    public Optional<OptimizationStats> getStats() {
        return Optional.ofNullable(stats);
    }

    public Optional<OptimizationFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    @Override
    public String toString() {
        switch (status) {
            case OPTIMIZED:
                return functionName + ": " + stats;
            case SKIPPED:
                return functionName + ": skipped (" + skipReason + ")";
            default:
                return functionName + ": failed (" + failure + ")";
        }
    }
}
