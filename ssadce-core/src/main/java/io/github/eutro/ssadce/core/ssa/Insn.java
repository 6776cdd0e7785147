package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.Ext;
import io.github.eutro.ssadce.core.ext.ExtHolder;
import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.ops.Op;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * An instruction: an {@link Op operation} applied to a list of operands.
 * <p>
 * An instruction on its own has no result or jump targets; it is wrapped in an
 * {@link Effect} or a {@link Control} to place it in a block.
 */
public final class Insn extends ExtHolder implements Iterable<Var> {
    private static final Ext<?>[] SLOTS = {CommonExts.OWNING_EFFECT, CommonExts.OWNING_CONTROL};

    public final Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        super(SLOTS);
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    /**
     * Get the kind of this instruction, shorthand for {@code op.key.kind}.
     *
     * @return The kind.
     */
    public InsnKind kind() {
        return op.key.kind;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    /**
     * Get the operands of this instruction. The list may be modified in place.
     *
     * @return The operands.
     */
    public List<Var> args() {
        return args;
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args.iterator();
    }
}
