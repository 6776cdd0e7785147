package io.github.eutro.ssadce.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to.
 * <p>
 * IR objects use exts for their structural links (owning block, defining effect)
 * and for metadata computed by passes, such as predecessor lists.
 */
public interface ExtContainer {
    /**
     * Set the value of {@code ext} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value, never null.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Clear the value of {@code ext} in this container. Does nothing if it has none.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value of {@code ext} in this container, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    default boolean hasExt(Ext<?> ext) {
        return getNullable(ext) != null;
    }

    /**
     * Like {@link #getNullable(Ext)}, for exts that the IR's invariants say must be present.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is not present.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) {
            throw new IllegalStateException(ext.getName() + " is not attached to " + this);
        }
        return value;
    }
}
