package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ssa.BasicBlock;

import java.util.BitSet;

/**
 * The indices of the blocks reachable from the entry of a function, at the time it was computed.
 */
public final class ReachableSet {
    private final BitSet indices;

    ReachableSet(BitSet indices) {
        this.indices = (BitSet) indices.clone();
    }

    public boolean contains(BasicBlock block) {
        return indices.get(block.getIndex());
    }

    public int size() {
        return indices.cardinality();
    }

    @Override
    public String toString() {
        return "reachable" + indices;
    }
}
