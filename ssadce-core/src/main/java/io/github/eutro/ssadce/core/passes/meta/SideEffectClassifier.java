package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ops.Callee;
import io.github.eutro.ssadce.core.ops.IrOps;
import io.github.eutro.ssadce.core.ssa.Insn;

/**
 * Decides the {@link SideEffectClass} of instructions.
 * <p>
 * Stores are only {@link SideEffectClass#MEMORY_WRITE} when they write to a
 * {@link EscapeStatus#LOCAL local} allocation. Calls are {@link SideEffectClass#EFFECTFUL},
 * unless pure calls are trusted and the callee is known pure and has a body.
 */
public class SideEffectClassifier {
    public static final SideEffectClassifier CONSERVATIVE = new SideEffectClassifier(false);
    public static final SideEffectClassifier TRUSTING = new SideEffectClassifier(true);

    private final boolean trustPureCalls;

    private SideEffectClassifier(boolean trustPureCalls) {
        this.trustPureCalls = trustPureCalls;
    }

    public static SideEffectClassifier of(boolean trustPureCalls) {
        return trustPureCalls ? TRUSTING : CONSERVATIVE;
    }

    public SideEffectClass classify(Insn insn, EscapeTable escapes) {
        return switch (insn.kind()) {
            case ARG, BINARY, UNARY, CAST, GEP, PHI, VECTOR -> SideEffectClass.PURE;
            case LOAD -> SideEffectClass.MEMORY_READ;
            case STORE -> escapes.targetStatus(insn.args().get(1)) == EscapeStatus.LOCAL
                    ? SideEffectClass.MEMORY_WRITE
                    : SideEffectClass.EFFECTFUL;
            case ALLOCA -> SideEffectClass.MEMORY_WRITE;
            case CALL -> isTrustedPure(IrOps.CALL.immediate(insn))
                    ? SideEffectClass.PURE
                    : SideEffectClass.EFFECTFUL;
            case RETURN, BR, COND_BR, SWITCH, INDIRECT_BR, UNREACHABLE -> SideEffectClass.EFFECTFUL;
        };
    }

    private boolean isTrustedPure(Callee callee) {
        return trustPureCalls && callee.knownPure && !callee.external;
    }
}
