package io.github.eutro.ssadce.core.passes.meta;

/**
 * Thrown by {@link CheckSsa} when run as a pass over a function that fails verification.
 */
public class StructuralException extends RuntimeException {
    private final StructuralError error;

    public StructuralException(StructuralError error) {
        super(error.toString());
        this.error = error;
    }

    public StructuralError getError() {
        return error;
    }
}
