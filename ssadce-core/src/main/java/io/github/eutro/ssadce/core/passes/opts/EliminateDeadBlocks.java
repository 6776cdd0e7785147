package io.github.eutro.ssadce.core.passes.opts;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ops.CommonOps;
import io.github.eutro.ssadce.core.passes.InPlaceIRPass;
import io.github.eutro.ssadce.core.passes.meta.ReachabilityAnalysis;
import io.github.eutro.ssadce.core.passes.meta.ReachableSet;
import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Control;
import io.github.eutro.ssadce.core.ssa.Effect;
import io.github.eutro.ssadce.core.ssa.Function;

import java.util.*;

/**
 * An optimisation pass that removes any blocks unreachable from the entry block.
 * <p>
 * Phis in the surviving blocks lose their entries for removed predecessors.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Function> {
    /**
     * An instance of this pass.
     */
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Function function) {
        apply(function, ReachabilityAnalysis.INSTANCE.run(function));
    }

    /**
     * Remove the blocks of a function that are not in a reachable set.
     *
     * @param function  The function.
     * @param reachable The blocks to keep.
     * @return The number of blocks removed.
     */
    public int apply(Function function, ReachableSet reachable) {
        Set<BasicBlock> removed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BasicBlock block : function.blocks) {
            if (!reachable.contains(block)) removed.add(block);
        }
        if (removed.isEmpty()) return 0;

        function.blocks.removeIf(removed::contains);
        for (BasicBlock block : removed) {
            Control ctrl = block.getControl();
            if (ctrl != null) ctrl.targets.clear();
        }
        for (BasicBlock block : function.blocks) {
            for (Effect effect : block.getEffects()) {
                if (!CommonOps.PHI.matches(effect.insn())) continue;
                removeIncoming(effect, removed);
            }
        }

        function.getExtOrThrow(CommonExts.METADATA_STATE)
                .graphChanged();
        return removed.size();
    }

    private static void removeIncoming(Effect phi, Set<BasicBlock> removed) {
        List<BasicBlock> preds = CommonOps.PHI.immediate(phi.insn());
        // by predecessor, never by position
        for (int i = preds.size() - 1; i >= 0; i--) {
            if (removed.contains(preds.get(i))) {
                preds.remove(i);
                phi.insn().args().remove(i);
            }
        }
    }
}
