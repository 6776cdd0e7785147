/**
 * The SSA intermediate representation.
 * <p>
 * A {@link io.github.eutro.ssadce.core.ssa.Module} holds
 * {@link io.github.eutro.ssadce.core.ssa.Function}s, which hold
 * {@link io.github.eutro.ssadce.core.ssa.BasicBlock}s of
 * {@link io.github.eutro.ssadce.core.ssa.Effect}s ending in a
 * {@link io.github.eutro.ssadce.core.ssa.Control}.
 */
package io.github.eutro.ssadce.core.ssa;
