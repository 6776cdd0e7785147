package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ssa.Var;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The liveness sets of a single block.
 */
public final class LiveData {
    /**
     * Values used in the block before any definition in it. Phi operands are not
     * included here, but in {@link #exitUses} of the corresponding predecessor.
     */
    final Set<Var> gen = new LinkedHashSet<>();
    /**
     * Values defined in the block.
     */
    final Set<Var> kill = new LinkedHashSet<>();
    /**
     * Values flowing into a phi of a successor along an edge leaving this block.
     */
    final Set<Var> exitUses = new LinkedHashSet<>();
    final Set<Var> liveIn = new LinkedHashSet<>();
    final Set<Var> liveOut = new LinkedHashSet<>();

    public Set<Var> getLiveIn() {
        return Collections.unmodifiableSet(liveIn);
    }

    public Set<Var> getLiveOut() {
        return Collections.unmodifiableSet(liveOut);
    }

    @Override
    public String toString() {
        return "in=" + liveIn + " out=" + liveOut;
    }
}
