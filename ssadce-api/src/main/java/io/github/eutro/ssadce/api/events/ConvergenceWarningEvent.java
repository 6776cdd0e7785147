package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.core.ssa.Function;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired when an iteration limit was hit while optimising a function.
 * <p>
 * The function is still correct, but may have dead code left in it.
 */
public class ConvergenceWarningEvent implements DceEvent {
    @NotNull
    public final Function function;
    @NotNull
    public final String message;

    public ConvergenceWarningEvent(@NotNull Function function, @NotNull String message) {
        this.function = function;
        this.message = message;
    }
}
