package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.passes.MalformedFunctionException;
import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Function;
import io.github.eutro.ssadce.core.util.GraphWalker;

import java.util.BitSet;

/**
 * Computes the set of blocks reachable from the entry, with one depth-first walk.
 */
public class ReachabilityAnalysis implements IRPass<Function, ReachableSet> {
    public static final ReachabilityAnalysis INSTANCE = new ReachabilityAnalysis();

    @Override
    public ReachableSet run(Function func) {
        BasicBlock entry = func.getEntry();
        if (entry == null) {
            throw new MalformedFunctionException(func.name, "no entry block");
        }
        BitSet indices = new BitSet(func.blockIndexBound());
        for (BasicBlock block : GraphWalker.blockWalker(entry).preOrder()) {
            indices.set(block.getIndex());
        }
        return new ReachableSet(indices);
    }
}
