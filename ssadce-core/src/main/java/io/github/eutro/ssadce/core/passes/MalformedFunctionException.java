package io.github.eutro.ssadce.core.passes;

import io.github.eutro.ssadce.core.passes.meta.StructuralError;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Thrown when a function handed to a pass is not well-formed enough to be processed,
 * such as when it has no entry block.
 */
public class MalformedFunctionException extends RuntimeException {
    private final String functionName;
    @Nullable
    private final StructuralError error;

    public MalformedFunctionException(String functionName, String reason) {
        super("Malformed function " + functionName + ": " + reason);
        this.functionName = functionName;
        this.error = null;
    }

    public MalformedFunctionException(StructuralError error) {
        super("Malformed function " + error.functionName + ": " + error);
        this.functionName = error.functionName;
        this.error = error;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Get the structural problem that was found, if the function was rejected by the verifier.
     *
     * @return The error.
     */
    public Optional<StructuralError> getError() {
        return Optional.ofNullable(error);
    }
}
