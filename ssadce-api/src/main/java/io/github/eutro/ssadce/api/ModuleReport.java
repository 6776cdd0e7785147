package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.core.passes.opts.OptimizationStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What a {@link DeadCodeEliminator} did to each function of a module.
 */
public final class ModuleReport {
    public final String moduleName;
    private final List<FunctionOutcome> outcomes;

    public ModuleReport(String moduleName, List<FunctionOutcome> outcomes) {
        this.moduleName = moduleName;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    /**
     * Get the outcome of every function in the module, in module order.
     *
     * @return The outcomes.
     */
    public List<FunctionOutcome> getOutcomes() {
        return outcomes;
    }

    public Optional<FunctionOutcome> outcome(String functionName) {
        for (FunctionOutcome outcome : outcomes) {
            if (outcome.functionName.equals(functionName)) return Optional.of(outcome);
        }
        return Optional.empty();
    }

    public List<OptimizationFailure> getFailures() {
        List<OptimizationFailure> failures = new ArrayList<>();
        for (FunctionOutcome outcome : outcomes) {
            outcome.getFailure().ifPresent(failures::add);
        }
        return failures;
    }

    public boolean hasFailures() {
        return !getFailures().isEmpty();
    }

    /**
     * Sum the stats of every function that was optimised.
     *
     * @return The total.
     */
    public OptimizationStats total() {
        OptimizationStats total = OptimizationStats.EMPTY;
        for (FunctionOutcome outcome : outcomes) {
            if (outcome.getStats().isPresent()) {
                total = total.merge(outcome.getStats().get());
            }
        }
        return total;
    }

    /**
     * Render this report for people to read.
     *
     * @return The rendered report.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("Dead code elimination of module '").append(moduleName).append("':\n");
        for (FunctionOutcome outcome : outcomes) {
            switch (outcome.status) {
                case OPTIMIZED:
                    sb.append(outcome.getStats().orElse(OptimizationStats.EMPTY).formatReport(outcome.functionName));
                    break;
                case SKIPPED:
                    sb.append("'").append(outcome.functionName).append("' skipped (")
                            .append(outcome.getSkipReason().orElse("")).append(")\n");
                    break;
                case FAILED:
                    sb.append("'").append(outcome.functionName).append("' FAILED: ")
                            .append(outcome.getFailure().map(Object::toString).orElse("")).append('\n');
                    break;
            }
        }
        OptimizationStats total = total();
        if (total.hadEffect()) {
            sb.append("Total: ").append(total.getInstructionsRemoved()).append(" instructions, ")
                    .append(total.getBlocksRemoved()).append(" blocks removed\n");
        } else {
            sb.append("No dead code found\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ModuleReport{" + moduleName + ", " + outcomes + "}";
    }
}
