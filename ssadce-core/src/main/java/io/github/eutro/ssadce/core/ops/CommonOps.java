package io.github.eutro.ssadce.core.ops;

import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Control;
import io.github.eutro.ssadce.core.ssa.Insn;
import io.github.eutro.ssadce.core.ssa.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The {@link Op}s and {@link OpKey}s that structure every function.
 *
 * @see IrOps
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its only target.
     */
    public static final Op BR = new SimpleOpKey("br", InsnKind.BR).create();
    /**
     * Control: returns from the function, with its argument if it has one.
     */
    public static final Op RETURN = new SimpleOpKey("return", InsnKind.RETURN).create();

    /**
     * Effect: returns the argument corresponding to its predecessor.
     * <p>
     * The immediate is the list of predecessors, aligned with the arguments.
     * Must precede any other (non-phi) effect instructions within its basic block.
     * Every phi op holds its own copy of the list, since entries are removed from it
     * when predecessors are.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", InsnKind.PHI,
            bbs -> bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")),
            ArrayList::new);

    /**
     * Effect: returns the {@code n}th argument of the function.
     */
    public static final UnaryOpKey<Integer> ARG = new UnaryOpKey<>("arg", InsnKind.ARG);

    /**
     * Construct a phi.
     *
     * @param preds  The predecessors.
     * @param values The incoming values, aligned with {@code preds}.
     * @return The phi instruction.
     */
    public static Insn phi(List<BasicBlock> preds, List<Var> values) {
        if (preds.size() != values.size()) {
            throw new IllegalArgumentException("Got " + values.size() + " values for " + preds.size() + " predecessors");
        }
        return PHI.create(preds).insn(values);
    }

    public static Control ret(Var... value) {
        return RETURN.insn(value).jumpsTo();
    }
}
