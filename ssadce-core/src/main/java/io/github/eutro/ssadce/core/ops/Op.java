package io.github.eutro.ssadce.core.ops;

import io.github.eutro.ssadce.core.ssa.Insn;
import io.github.eutro.ssadce.core.ssa.Var;

import java.util.Arrays;
import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if it has any.
 * <p>
 * Ops are shared between instructions, so they must not hold per-instruction state.
 */
public class Op {
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    public Insn insn(Var... args) {
        return insn(Arrays.asList(args));
    }

    public Insn insn(List<Var> args) {
        return new Insn(this, args);
    }

    @Override
    public String toString() {
        return key.mnemonic;
    }
}
