package io.github.eutro.ssadce.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Keeps listeners for events of type {@code S}, and dispatches events to them.
 * <p>
 * Listeners are keyed by the exact class of the event they were registered for,
 * and run in registration order.
 *
 * @param <S> The base type of the events.
 */
public class EventSupplier<S> {
    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    /**
     * Listen to events of exactly the given class. Registering the same listener twice has no effect.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        ((CopyOnWriteArrayList<Consumer<?>>) listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArrayList<>()))
                .addIfAbsent(listener);
    }

    /**
     * @param eventClass The event class.
     * @param listener   The listener, as passed to {@link #listen(Class, Consumer)}.
     * @param <T>        The event type.
     * @return Whether the listener had been registered.
     */
    public <T extends S> boolean unlisten(Class<T> eventClass, @NotNull Consumer<T> listener) {
        List<Consumer<?>> registered = listeners.get(eventClass);
        return registered != null && registered.remove(listener);
    }

    public boolean hasListeners(Class<? extends S> eventClass) {
        List<Consumer<?>> registered = listeners.get(eventClass);
        return registered != null && !registered.isEmpty();
    }

    /**
     * Pass an event to the listeners of its class, stopping early if a listener cancels it.
     *
     * @param eventClass The exact class of the event.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return The event.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        List<Consumer<T>> registered = (List<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptyList());
        for (Consumer<T> listener : registered) {
            listener.accept(event);
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) break;
        }
        return event;
    }

    /**
     * Like {@link #dispatch(Class, Object)}, but only builds the event if anything listens to it.
     *
     * @param eventClass The exact class of the event.
     * @param event      Builds the event.
     * @param <T>        The type of the event.
     */
    public <T extends S> void dispatchIfListened(Class<T> eventClass, Supplier<T> event) {
        if (hasListeners(eventClass)) dispatch(eventClass, event.get());
    }
}
