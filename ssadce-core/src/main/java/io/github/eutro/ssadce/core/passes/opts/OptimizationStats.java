package io.github.eutro.ssadce.core.passes.opts;

import io.github.eutro.ssadce.core.ssa.Effect;

import java.util.*;

/**
 * What {@link DeadCodeElimination} did to one function, or, {@link #merge(OptimizationStats) merged},
 * to several.
 */
public final class OptimizationStats {
    public static final OptimizationStats EMPTY = new Builder().build();

    private final int instructionsRemoved;
    private final int blocksRemoved;
    private final int iterations;
    private final boolean converged;
    private final List<ConservativeDecision> conservativeDecisions;
    private final List<String> warnings;

    private OptimizationStats(Builder builder) {
        this.instructionsRemoved = builder.instructionsRemoved;
        this.blocksRemoved = builder.blocksRemoved;
        this.iterations = builder.iterations;
        this.converged = builder.converged;
        this.conservativeDecisions = Collections.unmodifiableList(new ArrayList<>(builder.conservativeDecisions));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    /**
     * Get the number of instructions removed one by one. Instructions in removed
     * blocks are not counted.
     *
     * @return The number of instructions.
     */
    public int getInstructionsRemoved() {
        return instructionsRemoved;
    }

    public int getBlocksRemoved() {
        return blocksRemoved;
    }

    /**
     * Get the number of rounds run, including the final round that removed nothing.
     *
     * @return The number of rounds.
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Whether the last round removed nothing. If not, the iteration limit was hit first.
     *
     * @return Whether a fixed point was reached.
     */
    public boolean isConverged() {
        return converged;
    }

    public List<ConservativeDecision> getConservativeDecisions() {
        return conservativeDecisions;
    }

    /**
     * Get the non-fatal problems met, such as hitting an iteration limit.
     *
     * @return The warnings.
     */
    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hadEffect() {
        return instructionsRemoved > 0 || blocksRemoved > 0;
    }

    /**
     * Combine these stats with another's, summing the counters and concatenating the lists.
     *
     * @param other The other stats.
     * @return The combined stats.
     */
    public OptimizationStats merge(OptimizationStats other) {
        Builder builder = new Builder();
        builder.instructionsRemoved = instructionsRemoved + other.instructionsRemoved;
        builder.blocksRemoved = blocksRemoved + other.blocksRemoved;
        builder.iterations = iterations + other.iterations;
        builder.converged = converged && other.converged;
        builder.conservativeDecisions.addAll(conservativeDecisions);
        builder.conservativeDecisions.addAll(other.conservativeDecisions);
        builder.warnings.addAll(warnings);
        builder.warnings.addAll(other.warnings);
        return builder.build();
    }

    public String formatReport(String functionName) {
        StringBuilder sb = new StringBuilder();
        sb.append("DCE statistics for '").append(functionName).append("':\n");
        sb.append("  instructions removed: ").append(instructionsRemoved).append('\n');
        sb.append("  blocks removed: ").append(blocksRemoved).append('\n');
        sb.append("  iterations: ").append(iterations).append(converged ? "" : " (did not converge)").append('\n');
        sb.append("  conservative decisions: ").append(conservativeDecisions.size()).append('\n');
        for (ConservativeDecision decision : conservativeDecisions) {
            sb.append("    ").append(decision).append('\n');
        }
        for (String warning : warnings) {
            sb.append("  warning: ").append(warning).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "OptimizationStats{instructions=" + instructionsRemoved
                + ", blocks=" + blocksRemoved
                + ", iterations=" + iterations
                + ", decisions=" + conservativeDecisions.size()
                + ", warnings=" + warnings.size()
                + "}";
    }

    static final class Builder {
        int instructionsRemoved;
        int blocksRemoved;
        int iterations;
        boolean converged = true;
        final List<ConservativeDecision> conservativeDecisions = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        private final Map<Effect, Set<ConservativeReason>> decided = new IdentityHashMap<>();

        /**
         * Record a decision about an effect, unless the same effect was already kept
         * for the same reason in an earlier round.
         *
         * @param effect   The effect that was kept.
         * @param decision The decision.
         * @return Whether it was new.
         */
        boolean record(Effect effect, ConservativeDecision decision) {
            Set<ConservativeReason> reasons = decided.computeIfAbsent(effect, $ -> EnumSet.noneOf(ConservativeReason.class));
            if (!reasons.add(decision.reason)) return false;
            conservativeDecisions.add(decision);
            return true;
        }

        OptimizationStats build() {
            return new OptimizationStats(this);
        }
    }
}
