package io.github.eutro.ssadce.api;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.ssa.Module;

/**
 * A named pass over a whole {@link Module}, which edits it in place.
 *
 * @param <R> What the phase reports back.
 */
public interface Phase<R> extends IRPass<Module, R> {
    String name();

    @Override
    default boolean isInPlace() {
        return true;
    }
}
