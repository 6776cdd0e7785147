package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.api.events.*;
import io.github.eutro.ssadce.core.passes.MalformedFunctionException;
import io.github.eutro.ssadce.core.passes.meta.CheckSsa;
import io.github.eutro.ssadce.core.passes.meta.StructuralError;
import io.github.eutro.ssadce.core.passes.opts.ConservativeDecision;
import io.github.eutro.ssadce.core.passes.opts.DceOptions;
import io.github.eutro.ssadce.core.passes.opts.DeadCodeElimination;
import io.github.eutro.ssadce.core.passes.opts.OptimizationStats;
import io.github.eutro.ssadce.core.ssa.Function;
import io.github.eutro.ssadce.core.ssa.Module;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes dead code from every function of a module, one function at a time.
 * <p>
 * A function that cannot be optimised does not stop the others from being optimised;
 * it is recorded as a failure in the {@link ModuleReport} instead.
 */
public class DeadCodeEliminator extends EventSupplier<DceEvent> implements Phase<ModuleReport> {
    private static final Logger LOGGER = Logger.getLogger(DeadCodeEliminator.class.getName());

    private final DeadCodeElimination dce;
    private final boolean verifyAfterOptimize;
    @Nullable
    private ModuleReport lastReport;

    public DeadCodeEliminator() {
        this(DceOptions.DEFAULT);
    }

    public DeadCodeEliminator(DceOptions options) {
        this(options, true);
    }

    /**
     * Construct an eliminator.
     *
     * @param options             The options of the optimiser.
     * @param verifyAfterOptimize Whether to {@link #verify(Function) verify} each function once optimised.
     */
    public DeadCodeEliminator(DceOptions options, boolean verifyAfterOptimize) {
        this.dce = new DeadCodeElimination(options);
        this.verifyAfterOptimize = verifyAfterOptimize;
    }

    @Override
    public String name() {
        return "dead-code-elimination";
    }

    public DceOptions getOptions() {
        return dce.getOptions();
    }

    /**
     * Optimise every function of a module in place.
     *
     * @param module The module.
     * @return What happened to each function.
     */
    @Override
    public ModuleReport run(Module module) {
        List<FunctionOutcome> outcomes = new ArrayList<>();
        for (Function func : new ArrayList<>(module.functions)) {
            outcomes.add(runFunction(func));
        }
        ModuleReport report = new ModuleReport(module.name, outcomes);
        lastReport = report;

        OptimizationStats total = report.total();
        LOGGER.log(Level.INFO, "Module {0}: removed {1} instructions and {2} blocks from {3} functions, {4} failed",
                new Object[]{
                        module.name,
                        total.getInstructionsRemoved(),
                        total.getBlocksRemoved(),
                        outcomes.size(),
                        report.getFailures().size(),
                });
        return report;
    }

    private FunctionOutcome runFunction(Function func) {
        if (func.isDeclaration()) {
            return FunctionOutcome.skipped(func.name, "declaration");
        }
        OptimizeFunctionEvent before = dispatch(OptimizeFunctionEvent.class, new OptimizeFunctionEvent(func));
        if (before.isCancelled()) {
            LOGGER.log(Level.FINE, "Skipping {0}, cancelled by a listener", func.name);
            return FunctionOutcome.skipped(func.name, before.getCancelReason());
        }

        OptimizationStats stats;
        try {
            stats = optimize(func);
        } catch (MalformedFunctionException e) {
            LOGGER.log(Level.WARNING, "Could not optimise " + func.name, e);
            return fail(func, OptimizationFailure.malformed(e));
        }

        for (ConservativeDecision decision : stats.getConservativeDecisions()) {
            dispatchIfListened(ConservativeDecisionEvent.class, () -> new ConservativeDecisionEvent(func, decision));
        }
        for (String warning : stats.getWarnings()) {
            dispatch(ConvergenceWarningEvent.class, new ConvergenceWarningEvent(func, warning));
        }

        if (verifyAfterOptimize) {
            Optional<StructuralError> error = verify(func);
            if (error.isPresent()) {
                LOGGER.log(Level.SEVERE, "Optimised function failed verification: {0}", error.get());
                return fail(func, OptimizationFailure.violation(error.get()));
            }
        }

        dispatch(FunctionOptimizedEvent.class, new FunctionOptimizedEvent(func, stats));
        return FunctionOutcome.optimized(func.name, stats);
    }

    private FunctionOutcome fail(Function func, OptimizationFailure failure) {
        dispatch(FunctionFailedEvent.class, new FunctionFailedEvent(func, failure));
        return FunctionOutcome.failed(failure);
    }

    /**
     * Optimise a single function in place.
     *
     * @param func The function.
     * @return What was removed.
     * @throws MalformedFunctionException If the function is not well-formed.
     */
    public OptimizationStats optimize(Function func) {
        return dce.run(func);
    }

    /**
     * Check that a function is structurally sound.
     *
     * @param func The function.
     * @return The first problem found, if any.
     */
    public Optional<StructuralError> verify(Function func) {
        return CheckSsa.INSTANCE.verify(func);
    }

    /**
     * Get the report of the last module {@link #run(Module) run}.
     *
     * @return The report, or empty if no module has been run yet.
     */
    public Optional<ModuleReport> getLastReport() {
        return Optional.ofNullable(lastReport);
    }
}
