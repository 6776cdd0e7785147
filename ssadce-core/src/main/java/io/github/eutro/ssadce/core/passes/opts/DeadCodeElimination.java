package io.github.eutro.ssadce.core.passes.opts;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.passes.MalformedFunctionException;
import io.github.eutro.ssadce.core.passes.meta.*;
import io.github.eutro.ssadce.core.ssa.Effect;
import io.github.eutro.ssadce.core.ssa.Function;

import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes dead code from a function, running rounds until a round removes nothing.
 * <p>
 * Each round first removes the blocks that are unreachable from the entry, then
 * recomputes def-use chains, liveness and escape statuses from scratch and removes
 * the instructions that are dead and free of observable effects. Every round only ever
 * removes code, so stopping at the iteration limit leaves a correct function behind.
 */
public class DeadCodeElimination implements IRPass<Function, OptimizationStats> {
    private static final Logger LOGGER = Logger.getLogger(DeadCodeElimination.class.getName());

    public static final DeadCodeElimination INSTANCE = new DeadCodeElimination(DceOptions.DEFAULT);

    private final DceOptions options;
    private final LivenessAnalysis liveness;
    private final EliminateDeadVars eliminateVars;

    public DeadCodeElimination(DceOptions options) {
        this.options = options;
        this.liveness = new LivenessAnalysis(options.getMaxLivenessIterations());
        this.eliminateVars = new EliminateDeadVars(SideEffectClassifier.of(options.isTrustPureCalls()));
    }

    public DceOptions getOptions() {
        return options;
    }

    /**
     * Optimise a function in place.
     *
     * @param func The function.
     * @return What was removed. Declarations are left alone, with empty stats.
     * @throws MalformedFunctionException If the function is not well-formed to begin with.
     */
    @Override
    public OptimizationStats run(Function func) {
        if (func.isDeclaration()) return OptimizationStats.EMPTY;
        Optional<StructuralError> malformed = CheckSsa.INSTANCE.verify(func);
        if (malformed.isPresent()) {
            throw new MalformedFunctionException(malformed.get());
        }

        OptimizationStats.Builder stats = new OptimizationStats.Builder();
        BiConsumer<Effect, ConservativeDecision> decisions = options.isRecordConservativeDecisions()
                ? stats::record
                : (effect, decision) -> {
                };
        stats.converged = false;
        while (stats.iterations < options.getMaxIterations()) {
            stats.iterations++;
            int blocks = EliminateDeadBlocks.INSTANCE.apply(func, ReachabilityAnalysis.INSTANCE.run(func));

            DefUseChains chains = DefUseAnalysis.INSTANCE.run(func);
            LivenessInfo live = liveness.run(func);
            if (!live.isConverged()) {
                stats.warnings.add("liveness did not converge within "
                        + options.getMaxLivenessIterations() + " iterations in round " + stats.iterations
                        + ", fell back to use counts");
            }
            EscapeTable escapes = EscapeAnalysis.INSTANCE.run(func);
            int insns = eliminateVars.apply(func, chains, live, escapes, decisions);

            stats.blocksRemoved += blocks;
            stats.instructionsRemoved += insns;
            LOGGER.log(Level.FINE, "{0} round {1}: removed {2} blocks, {3} instructions",
                    new Object[]{func.name, stats.iterations, blocks, insns});
            if (blocks == 0 && insns == 0) {
                stats.converged = true;
                break;
            }
        }
        if (!stats.converged) {
            String warning = "did not converge within " + options.getMaxIterations() + " iterations";
            stats.warnings.add(warning);
            LOGGER.log(Level.WARNING, "{0} {1}", new Object[]{func.name, warning});
        }
        return stats.build();
    }
}
