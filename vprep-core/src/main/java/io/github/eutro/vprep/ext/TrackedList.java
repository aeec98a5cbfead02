package io.github.eutro.vprep.ext;

import java.util.*;

/**
 * A list which notifies its owner whenever an element enters or leaves it.
 * <p>
 * Used to keep owner links (such as an operation's owning block) in sync with the
 * list that actually contains the element.
 *
 * @param <E> The element type.
 */
public abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> viewed;

    public TrackedList(List<E> viewed) {
        this.viewed = viewed;
    }

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    /**
     * Find an element by identity, rather than by {@link Object#equals(Object)}.
     *
     * @param e The element.
     * @return Its index, or -1 if absent.
     */
    public int identityIndexOf(Object e) {
        for (int i = 0; i < viewed.size(); i++) {
            if (viewed.get(i) == e) return i;
        }
        return -1;
    }

    /**
     * Remove an element by identity.
     *
     * @param e The element.
     * @return Whether the element was present.
     */
    public boolean removeIdentical(Object e) {
        int i = identityIndexOf(e);
        if (i == -1) return false;
        remove(i);
        return true;
    }

    @Override
    public E get(int index) {
        return viewed.get(index);
    }

    @Override
    public int size() {
        return viewed.size();
    }

    @Override
    public E set(int index, E element) {
        E removed = viewed.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        viewed.add(index, element);
        onAdded(element);
    }

    @Override
    public E remove(int index) {
        E removed = viewed.remove(index);
        onRemoved(removed);
        return removed;
    }

    @Override
    public void clear() {
        List<E> old = new ArrayList<>(viewed);
        viewed.clear();
        for (E e : old) {
            onRemoved(e);
        }
    }
}
