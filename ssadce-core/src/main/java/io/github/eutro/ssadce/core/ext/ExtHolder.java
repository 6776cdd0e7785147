package io.github.eutro.ssadce.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * An {@link ExtContainer} that stores its exts in small arrays.
 * <p>
 * Subclasses declare the exts they carry most often, such as their owner, and get a
 * dedicated slot for each. Every other ext goes into an overflow array kept sorted by
 * {@link Ext#compareTo(Ext) ext order}; IR objects rarely carry more than one or two of those.
 */
public class ExtHolder implements ExtContainer {
    private static final Ext<?>[] NO_EXTS = new Ext<?>[0];
    private static final Object[] NO_VALUES = new Object[0];

    private final Ext<?>[] slotExts;
    private final Object[] slots;

    private Ext<?>[] extraExts = NO_EXTS;
    private Object[] extraValues = NO_VALUES;
    private int extraCount = 0;

    public ExtHolder() {
        this(NO_EXTS);
    }

    /**
     * Construct a holder with a slot for each of the given exts.
     *
     * @param slotExts The exts to give slots to. The array is not copied, so it should be a shared constant.
     */
    protected ExtHolder(Ext<?>... slotExts) {
        this.slotExts = slotExts;
        this.slots = slotExts.length == 0 ? NO_VALUES : new Object[slotExts.length];
    }

    private int slotOf(Ext<?> ext) {
        for (int i = 0; i < slotExts.length; i++) {
            if (slotExts[i] == ext) return i;
        }
        return -1;
    }

    private int extraIndex(Ext<?> ext) {
        return Arrays.binarySearch(extraExts, 0, extraCount, ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        int slot = slotOf(ext);
        if (slot >= 0) {
            slots[slot] = value;
            return;
        }
        int idx = extraIndex(ext);
        if (idx >= 0) {
            extraValues[idx] = value;
            return;
        }
        int at = -(idx + 1);
        if (extraCount == extraExts.length) {
            int size = Math.max(2, extraCount * 2);
            extraExts = Arrays.copyOf(extraExts, size);
            extraValues = Arrays.copyOf(extraValues, size);
        }
        System.arraycopy(extraExts, at, extraExts, at + 1, extraCount - at);
        System.arraycopy(extraValues, at, extraValues, at + 1, extraCount - at);
        extraExts[at] = ext;
        extraValues[at] = value;
        extraCount++;
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        int slot = slotOf(ext);
        if (slot >= 0) {
            slots[slot] = null;
            return;
        }
        int idx = extraIndex(ext);
        if (idx < 0) return;
        extraCount--;
        System.arraycopy(extraExts, idx + 1, extraExts, idx, extraCount - idx);
        System.arraycopy(extraValues, idx + 1, extraValues, idx, extraCount - idx);
        extraExts[extraCount] = null;
        extraValues[extraCount] = null;
        if (extraCount == 0) {
            extraExts = NO_EXTS;
            extraValues = NO_VALUES;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        int slot = slotOf(ext);
        if (slot >= 0) return (T) slots[slot];
        int idx = extraIndex(ext);
        return idx < 0 ? null : (T) extraValues[idx];
    }
}
