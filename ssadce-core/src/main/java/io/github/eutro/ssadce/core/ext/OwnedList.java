package io.github.eutro.ssadce.core.ext;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list whose elements record, through an owner {@link Ext}, which object holds them.
 * <p>
 * Whichever way an element enters the list, including through iterators and
 * {@link #removeIf(java.util.function.Predicate) removeIf}, the owner ext is attached,
 * and whichever way it leaves, the ext is removed. An element may only be in one
 * owned list at a time.
 *
 * @param <O> The type of the owner.
 * @param <E> The type of the elements.
 */
public final class OwnedList<O, E extends ExtContainer> extends AbstractList<E> implements RandomAccess {
    private final List<E> elements = new ArrayList<>();
    private final O owner;
    private final Ext<O> ownerExt;

    public OwnedList(O owner, Ext<O> ownerExt) {
        this.owner = owner;
        this.ownerExt = ownerExt;
    }

    private E claim(E elt) {
        O current = elt.getNullable(ownerExt);
        if (current != null) {
            throw new IllegalStateException(elt + " is already owned by " + current);
        }
        elt.attachExt(ownerExt, owner);
        return elt;
    }

    private void release(E elt) {
        elt.removeExt(ownerExt);
    }

    @Override
    public E get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    @Override
    public void add(int index, E element) {
        elements.add(index, claim(element));
        modCount++;
    }

    @Override
    public E set(int index, E element) {
        E old = elements.get(index);
        if (old == element) return old;
        elements.set(index, claim(element));
        release(old);
        return old;
    }

    @Override
    public E remove(int index) {
        E removed = elements.remove(index);
        modCount++;
        release(removed);
        return removed;
    }
}
