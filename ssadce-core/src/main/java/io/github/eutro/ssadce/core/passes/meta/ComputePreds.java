package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.MetadataState;
import io.github.eutro.ssadce.core.passes.InPlaceIRPass;
import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Attaches {@link CommonExts#PREDS} to every block of a function, and marks them valid.
 * <p>
 * Predecessors are distinct and listed in block order. A block that jumps to the
 * same target from several edges, like a switch with shared cases, appears once.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        IdentityHashMap<BasicBlock, List<BasicBlock>> preds = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            preds.put(block, new ArrayList<>());
        }

        Set<BasicBlock> targetsOfBlock = Collections.newSetFromMap(new IdentityHashMap<>());
        for (BasicBlock block : func.blocks) {
            targetsOfBlock.clear();
            for (BasicBlock target : block.getSuccessors()) {
                List<BasicBlock> targetPreds = preds.get(target);
                // foreign targets are left for CheckSsa
                if (targetPreds != null && targetsOfBlock.add(target)) {
                    targetPreds.add(block);
                }
            }
        }

        preds.forEach((block, list) -> block.attachExt(CommonExts.PREDS, list));
        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
    }
}
