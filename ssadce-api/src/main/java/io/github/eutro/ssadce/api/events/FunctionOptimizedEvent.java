package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.core.passes.opts.OptimizationStats;
import io.github.eutro.ssadce.core.ssa.Function;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired after a function was optimised, and verified if verification is enabled.
 */
public class FunctionOptimizedEvent implements DceEvent {
    @NotNull
    public final Function function;
    @NotNull
    public final OptimizationStats stats;

    public FunctionOptimizedEvent(@NotNull Function function, @NotNull OptimizationStats stats) {
        this.function = function;
        this.stats = stats;
    }
}
