package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.MetadataState;
import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.passes.InPlaceIRPass;
import io.github.eutro.ssadce.core.passes.meta.StructuralError.Kind;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.*;

/**
 * Checks that a function is structurally sound:
 * <ul>
 *     <li>the entry block exists and is one of the function's blocks,</li>
 *     <li>every block ends in a terminator whose targets are blocks of the function,</li>
 *     <li>every value is defined once, and every operand is an immediate or a defined value,</li>
 *     <li>every instruction has as many operands as its kind takes,</li>
 *     <li>every phi has exactly one entry per distinct predecessor of its block.</li>
 * </ul>
 * Running this as a pass throws a {@link StructuralException} on the first problem found.
 */
public class CheckSsa implements InPlaceIRPass<Function> {
    public static final CheckSsa INSTANCE = new CheckSsa();

    @Override
    public void runInPlace(Function func) {
        Optional<StructuralError> error = verify(func);
        if (error.isPresent()) {
            throw new StructuralException(error.get());
        }
    }

    /**
     * Verify a function.
     *
     * @param func The function.
     * @return The first problem found, or empty if there is none.
     */
    public Optional<StructuralError> verify(Function func) {
        String name = func.name;
        BasicBlock entry = func.getEntry();
        if (entry == null) {
            return error(Kind.MISSING_ENTRY, name, "no entry block");
        }
        Set<BasicBlock> blocks = Collections.newSetFromMap(new IdentityHashMap<>());
        blocks.addAll(func.blocks);
        if (!blocks.contains(entry)) {
            return error(Kind.MISSING_ENTRY, name, "entry " + entry.toTargetString() + " is not a block of the function");
        }

        for (BasicBlock block : func.blocks) {
            Control ctrl = block.getControl();
            if (ctrl == null) {
                return error(Kind.MISSING_TERMINATOR, name, block.toTargetString() + " has no terminator");
            }
            if (!ctrl.insn().kind().isTerminator()) {
                return error(Kind.MISSING_TERMINATOR, name, block.toTargetString() + " ends in " + ctrl);
            }
            for (BasicBlock target : ctrl.targets) {
                if (!blocks.contains(target)) {
                    return error(Kind.DANGLING_TARGET, name,
                            block.toTargetString() + " jumps to " + target.toTargetString() + " outside the function");
                }
            }
        }

        Set<Var> defined = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var var : effect.getAssignsTo()) {
                    if (!defined.add(var)) {
                        return error(Kind.DUPLICATE_DEFINITION, name, var + " is defined more than once");
                    }
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                Optional<StructuralError> err = checkOperands(name, block, effect.insn(), defined);
                if (err.isPresent()) return err;
            }
            Optional<StructuralError> err = checkOperands(name, block, block.getControl().insn(), defined);
            if (err.isPresent()) return err;
        }

        // cached predecessors are not trusted here
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.invalidate(MetadataState.PREDS);
        ms.ensureValid(func, MetadataState.PREDS);
        for (BasicBlock block : func.blocks) {
            List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
            for (Effect effect : block.getEffects()) {
                if (effect.insn().kind() != InsnKind.PHI) continue;
                Optional<StructuralError> err = checkPhi(name, block, effect, preds);
                if (err.isPresent()) return err;
            }
        }
        return Optional.empty();
    }

    private static Optional<StructuralError> checkOperands(String name, BasicBlock block, Insn insn, Set<Var> defined) {
        int count = insn.args().size();
        if (count < minOperands(insn.kind()) || count > maxOperands(insn.kind())) {
            return error(Kind.OPERAND_COUNT, name,
                    "'" + insn + "' in " + block.toTargetString() + " has " + count + " operands");
        }
        for (Var arg : insn.args()) {
            if (!arg.isConstant() && !defined.contains(arg)) {
                return error(Kind.DANGLING_OPERAND, name,
                        "'" + insn + "' in " + block.toTargetString() + " uses undefined " + arg);
            }
        }
        return Optional.empty();
    }

    private static int minOperands(InsnKind kind) {
        switch (kind) {
            case LOAD:
            case UNARY:
            case CAST:
            case COND_BR:
            case SWITCH:
            case INDIRECT_BR:
                return 1;
            case STORE:
            case BINARY:
            case GEP:
                return 2;
            default:
                return 0;
        }
    }

    private static int maxOperands(InsnKind kind) {
        switch (kind) {
            case CALL:
            case PHI:
            case VECTOR:
                return Integer.MAX_VALUE;
            case RETURN:
                return 1;
            default:
                return minOperands(kind);
        }
    }

    private static Optional<StructuralError> checkPhi(String name, BasicBlock block, Effect phi, List<BasicBlock> preds) {
        List<BasicBlock> incoming = CommonOps.PHI.immediate(phi.insn());
        if (incoming.size() != phi.insn().args().size()) {
            return error(Kind.PHI_MISMATCH, name, "'" + phi + "' has " + incoming.size()
                    + " predecessors but " + phi.insn().args().size() + " values");
        }
        Set<BasicBlock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BasicBlock pred : incoming) {
            if (!seen.add(pred)) {
                return error(Kind.PHI_MISMATCH, name, "'" + phi + "' has two entries for " + pred.toTargetString());
            }
            if (!preds.contains(pred)) {
                return error(Kind.PHI_MISMATCH, name, "'" + phi + "' has an entry for "
                        + pred.toTargetString() + ", which is not a predecessor of " + block.toTargetString());
            }
        }
        if (incoming.size() != preds.size()) {
            return error(Kind.PHI_MISMATCH, name, "'" + phi + "' in " + block.toTargetString() + " has "
                    + incoming.size() + " entries for " + preds.size() + " predecessors");
        }
        return Optional.empty();
    }

    private static Optional<StructuralError> error(Kind kind, String name, String description) {
        return Optional.of(new StructuralError(kind, name, description));
    }
}
