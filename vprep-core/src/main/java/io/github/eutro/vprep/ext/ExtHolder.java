package io.github.eutro.vprep.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer} using a {@link Map}.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most values and operations never get an ext, so don't allocate it!

    @NotNull
    private Map<Ext<?>, Object> getMap() {
        if (map == null) {
            map = new TreeMap<>();
        }
        return map;
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        getMap().put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        Map<Ext<?>, Object> map = this.map;
        map.remove(ext);
        if (map.isEmpty()) {
            this.map = null;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }

    /**
     * Get the exts stored in this holder's map, in creation order.
     * <p>
     * Exts that subclasses keep in dedicated fields are not included.
     *
     * @return An unmodifiable view of the exts.
     */
    public Set<Ext<?>> getExtKeys() {
        if (map == null) return Collections.emptySet();
        return Collections.unmodifiableSet(map.keySet());
    }

    /**
     * Copy every ext stored in {@code other}'s map into this holder.
     *
     * @param other The holder to copy from.
     */
    public void copyExtsFrom(ExtHolder other) {
        if (other.map == null) return;
        getMap().putAll(other.map);
    }
}
