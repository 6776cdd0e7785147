package io.github.eutro.ssadce.api.events;

import io.github.eutro.ssadce.api.DeadCodeEliminator;

/**
 * An event fired by a {@link DeadCodeEliminator} while it processes a module.
 */
public interface DceEvent {
}
