package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.api.OptimizationFailure;
import io.github.eutro.ssadce.core.ssa.Function;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when a function could not be optimised, or failed verification afterwards.
 * The rest of the module is still processed.
 */
public class FunctionFailedEvent implements DceEvent {
    @NotNull
    public final Function function;
    @NotNull
    public final OptimizationFailure failure;

    public FunctionFailedEvent(@NotNull Function function, @NotNull OptimizationFailure failure) {
        this.function = function;
        this.failure = failure;
    }
}
