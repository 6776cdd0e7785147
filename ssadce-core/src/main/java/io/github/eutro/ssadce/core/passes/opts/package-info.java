/**
 * {@link io.github.eutro.ssadce.core.passes.IRPass IR passes} that remove code.
 * <p>
 * {@link io.github.eutro.ssadce.core.passes.opts.DeadCodeElimination} drives the others
 * to a fixed point.
 */
package io.github.eutro.ssadce.core.passes.opts;
