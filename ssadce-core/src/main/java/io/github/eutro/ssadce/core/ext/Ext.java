package io.github.eutro.ssadce.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a value of type {@code T} can be stored
 * on any {@link ExtContainer}.
 * <p>
 * Exts are compared by identity, and ordered by creation, so the order
 * of two exts is only meaningful within one run of the program.
 *
 * @param <T> The type of the value stored under this ext.
 */
public class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Creates a new ext.
     * <p>
     * The class only serves to make debugging output readable, so a raw class
     * can be given for generic value types, e.g. {@code Ext.<List<Var>>create(List.class, "VARS")}.
     *
     * @param type The most specific raw class of the values.
     * @param name The name of the ext.
     * @param <T>  The raw type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + "<" + type.getSimpleName() + ">#" + id;
    }
}
