package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.core.passes.opts.ConservativeDecision;
import io.github.eutro.ssadce.core.ssa.Function;
import org.jetbrains.annotations.NotNull;

/**
 * An event fired for each instruction that was kept in a function only to be safe.
 */
public class ConservativeDecisionEvent implements DceEvent {
    @NotNull
    public final Function function;
    @NotNull
    public final ConservativeDecision decision;

    public ConservativeDecisionEvent(@NotNull Function function, @NotNull ConservativeDecision decision) {
        this.function = function;
        this.decision = decision;
    }
}
