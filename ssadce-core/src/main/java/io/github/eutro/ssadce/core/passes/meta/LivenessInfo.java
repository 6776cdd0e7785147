package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Var;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * The result of {@link LivenessAnalysis}.
 */
public final class LivenessInfo {
    private final Map<BasicBlock, LiveData> blocks;
    private final Set<Var> liveAtDefinition;
    private final int iterations;
    private final boolean converged;

    LivenessInfo(Map<BasicBlock, LiveData> blocks, Set<Var> liveAtDefinition, int iterations, boolean converged) {
        this.blocks = blocks;
        this.liveAtDefinition = liveAtDefinition;
        this.iterations = iterations;
        this.converged = converged;
    }

    /**
     * Check whether a value is live just after its definition, i.e. whether any surviving
     * instruction, phi or terminator may read it.
     *
     * @param var The value.
     * @return Whether it is live.
     */
    public boolean isLive(Var var) {
        return liveAtDefinition.contains(var);
    }

    public Set<Var> liveIn(BasicBlock block) {
        LiveData data = blocks.get(block);
        return data == null ? Collections.emptySet() : data.getLiveIn();
    }

    public Set<Var> liveOut(BasicBlock block) {
        LiveData data = blocks.get(block);
        return data == null ? Collections.emptySet() : data.getLiveOut();
    }

    /**
     * Get the number of sweeps over the blocks that were run.
     *
     * @return The number of sweeps.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Whether the dataflow reached a fixed point. If it did not, {@link #isLive(Var)}
     * answers from use counts instead, which is coarser but still sound.
     *
     * @return Whether it converged.
     */
    public boolean isConverged() {
        return converged;
    }
}
