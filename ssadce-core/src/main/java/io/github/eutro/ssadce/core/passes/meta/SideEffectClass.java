package io.github.eutro.ssadce.core.passes.meta;

/**
 * What removing an instruction could change, besides its result.
 */
public enum SideEffectClass {
    /**
     * Nothing.
     */
    PURE,
    /**
     * Nothing, the instruction only reads memory.
     */
    MEMORY_READ,
    /**
     * Memory that is private to the function.
     */
    MEMORY_WRITE,
    /**
     * Anything at all.
     */
    EFFECTFUL,
}
