package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ops.InsnKind;
import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Effect;
import io.github.eutro.ssadce.core.ssa.Insn;
import io.github.eutro.ssadce.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The definitions and uses of every value in a function, as it was when computed.
 */
public final class DefUseChains {
    /**
     * A use of a value.
     */
    public static final class UseSite {
        public final BasicBlock block;
        /**
         * The index of the using effect in the block, or the number of effects
         * if the use is by the terminator.
         */
        public final int position;
        public final Insn insn;
        /**
         * Which operand of {@link #insn} the use is.
         */
        public final int operand;

        UseSite(BasicBlock block, int position, Insn insn, int operand) {
            this.block = block;
            this.position = position;
            this.insn = insn;
            this.operand = operand;
        }

        public boolean isTerminator() {
            return insn.kind().isTerminator();
        }

        @Override
        public String toString() {
            return block.toTargetString() + "#" + position + "[" + operand + "]";
        }
    }

    private final Map<Var, Effect> defs;
    private final Map<Var, List<UseSite>> uses;

    DefUseChains(Map<Var, Effect> defs, Map<Var, List<UseSite>> uses) {
        this.defs = defs;
        this.uses = uses;
    }

    /**
     * Get the effect that defines a value.
     *
     * @param var The value.
     * @return The defining effect, or null if the value is not defined in the function.
     */
    @Nullable
    public Effect definition(Var var) {
        return defs.get(var);
    }

    public boolean isDefined(Var var) {
        return defs.containsKey(var);
    }

    /**
     * Get the uses of a value, in block order then instruction order.
     *
     * @param var The value.
     * @return The uses.
     */
    public List<UseSite> usesOf(Var var) {
        return uses.getOrDefault(var, Collections.emptyList());
    }

    public int useCount(Var var) {
        return usesOf(var).size();
    }

    /**
     * Count the loads that read directly through a pointer.
     *
     * @param ptr The pointer.
     * @return The number of loads with {@code ptr} as their address.
     */
    public int loadsFrom(Var ptr) {
        int count = 0;
        for (UseSite use : usesOf(ptr)) {
            if (use.insn.kind() == InsnKind.LOAD && use.operand == 0) count++;
        }
        return count;
    }

    public Iterable<Var> definedValues() {
        return defs.keySet();
    }
}
