/**
 * Events that occur while dead code is removed from a module.
 * <p>
 * These can be used to skip functions, or to collect diagnostics
 * as they are produced.
 * <p>
 * The API revolves around {@link io.github.eutro.ssadce.api.events.EventSupplier}s,
 * which dispatch events to the listeners registered for their exact class.
 */
package io.github.eutro.ssadce.api.events;
