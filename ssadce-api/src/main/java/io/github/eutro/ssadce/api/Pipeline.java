package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.passes.InPlaceIRPass;
import io.github.eutro.ssadce.core.ssa.Module;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An ordered list of {@link Phase}s, run one after the other over a module.
 */
public class Pipeline implements InPlaceIRPass<Module> {
    private static final Logger LOGGER = Logger.getLogger(Pipeline.class.getName());

    private final List<Phase<?>> phases = new ArrayList<>();

    public Pipeline add(Phase<?> phase) {
        phases.add(phase);
        return this;
    }

    public List<Phase<?>> getPhases() {
        return Collections.unmodifiableList(phases);
    }

    /**
     * Chain the phases into a single pass, which discards what each phase reports.
     *
     * @return The pass.
     */
    public IRPass<Module, Module> asPass() {
        IRPass<Module, Module> pass = InPlaceIRPass.identity();
        for (Phase<?> phase : phases) {
            pass = pass.then(runPhase(phase));
        }
        return pass;
    }

    private static InPlaceIRPass<Module> runPhase(Phase<?> phase) {
        return module -> {
            LOGGER.log(Level.FINE, "Running phase {0} on {1}", new Object[]{phase.name(), module.name});
            phase.run(module);
        };
    }

    @Override
    public void runInPlace(Module module) {
        asPass().run(module);
    }
}
