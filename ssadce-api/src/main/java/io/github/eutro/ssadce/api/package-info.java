/**
 * A configurable API over the lower-level core passes.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.ssadce.api.DeadCodeEliminator},
 * which optimises whole modules and reports per function.
 * <p>
 * It can be observed using the {@link io.github.eutro.ssadce.api.events events API}.
 */
package io.github.eutro.ssadce.api;
