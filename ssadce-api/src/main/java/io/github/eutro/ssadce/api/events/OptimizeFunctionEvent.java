package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.core.ssa.Function;
import org.jetbrains.annotations.NotNull;

/**
 * Fired just before a function of a module is optimised.
 * <p>
 * Cancelling it leaves the function untouched, and it is reported as skipped
 * with the cancel reason.
 */
public class OptimizeFunctionEvent extends CancellableEvent {
    @NotNull
    public final Function function;

    public OptimizeFunctionEvent(@NotNull Function function) {
        this.function = function;
    }
}
