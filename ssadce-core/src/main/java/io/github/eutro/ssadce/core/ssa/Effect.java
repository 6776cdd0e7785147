package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.Ext;
import io.github.eutro.ssadce.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A non-terminator instruction in a block, encapsulating an {@link Insn instruction}
 * and the variable its result is assigned to, if any.
 */
public final class Effect extends ExtHolder {
    private static final Ext<?>[] SLOTS = {CommonExts.OWNING_BLOCK, CommonExts.SOURCE_SPAN};

    private final Insn insn;
    private final List<Var> assignsTo;

    Effect(List<Var> assignsTo, Insn insn) {
        super(SLOTS);
        if (assignsTo.size() > 1) {
            throw new IllegalArgumentException("An effect assigns to at most one variable, got " + assignsTo);
        }
        this.assignsTo = Collections.unmodifiableList(assignsTo);
        for (Var var : assignsTo) {
            var.attachExt(CommonExts.ASSIGNED_AT, this);
        }
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) return insn.toString();
        return assignsTo.get(0) + " = " + insn;
    }

    /**
     * Get the list of variables this effect assigns to, which has at most one element.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return assignsTo;
    }

    /**
     * Get the variable this effect assigns to.
     *
     * @return The variable, or null if the result is discarded.
     */
    @Nullable
    public Var getResult() {
        return assignsTo.isEmpty() ? null : assignsTo.get(0);
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }
}
