package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.core.passes.MalformedFunctionException;
import io.github.eutro.ssadce.core.passes.meta.StructuralError;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Why a function of a module could not be optimised.
 */
public final class OptimizationFailure {
    public enum Kind {
        /**
         * The function was not well-formed to begin with, and was left untouched.
         */
        MALFORMED_INPUT,
        /**
         * The function failed verification after it was optimised, which is a bug in the optimiser.
         * The function is left as the optimiser left it.
         */
        STRUCTURAL_VIOLATION,
    }

    public final String functionName;
    public final Kind kind;
    public final String message;
    @Nullable
    private final StructuralError error;

    private OptimizationFailure(String functionName, Kind kind, String message, @Nullable StructuralError error) {
        this.functionName = functionName;
        this.kind = kind;
        this.message = message;
        this.error = error;
    }

    public static OptimizationFailure malformed(MalformedFunctionException e) {
        return new OptimizationFailure(e.getFunctionName(), Kind.MALFORMED_INPUT, e.getMessage(), e.getError().orElse(null));
    }

    public static OptimizationFailure violation(StructuralError error) {
        return new OptimizationFailure(error.functionName, Kind.STRUCTURAL_VIOLATION, error.toString(), error);
    }

    public Optional<StructuralError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
