package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.Ext;
import io.github.eutro.ssadce.core.ext.ExtHolder;
import io.github.eutro.ssadce.core.ops.CommonOps;

import java.util.List;

/**
 * A terminator, encapsulating a raw {@link Insn instruction}
 * and the jump targets.
 */
public final class Control extends ExtHolder {
    private static final Ext<?>[] SLOTS = {CommonExts.OWNING_BLOCK};

    private final Insn insn;
    /**
     * The jump targets of this instruction. The semantics of the order depend on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        super(SLOTS);
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
        this.insn = insn;
        this.targets = targets;
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }
}
