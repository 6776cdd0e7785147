package io.github.eutro.ssadce.core.ops;

/**
 * The kind of an instruction.
 * <p>
 * Every analysis that treats instructions differently switches over this,
 * so a new kind has to be handled everywhere before the project compiles again.
 */
public enum InsnKind {
    ARG,
    ALLOCA,
    LOAD,
    STORE,
    BINARY,
    UNARY,
    CAST,
    GEP,
    CALL,
    PHI,
    VECTOR,

    RETURN(true),
    BR(true),
    COND_BR(true),
    SWITCH(true),
    INDIRECT_BR(true),
    UNREACHABLE(true),
    ;

    private final boolean terminator;

    InsnKind(boolean terminator) {
        this.terminator = terminator;
    }

    InsnKind() {
        this(false);
    }

    public boolean isTerminator() {
        return terminator;
    }
}
