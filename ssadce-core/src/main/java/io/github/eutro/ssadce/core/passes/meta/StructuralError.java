package io.github.eutro.ssadce.core.passes.meta;

/**
 * A structural problem in a function, found by {@link CheckSsa}.
 */
public final class StructuralError {
    public enum Kind {
        MISSING_ENTRY,
        MISSING_TERMINATOR,
        DANGLING_TARGET,
        DUPLICATE_DEFINITION,
        DANGLING_OPERAND,
        OPERAND_COUNT,
        PHI_MISMATCH,
    }

    public final Kind kind;
    public final String functionName;
    public final String description;

    public StructuralError(Kind kind, String functionName, String description) {
        this.kind = kind;
        this.functionName = functionName;
        this.description = description;
    }

    @Override
    public String toString() {
        return kind + " in " + functionName + ": " + description;
    }
}
