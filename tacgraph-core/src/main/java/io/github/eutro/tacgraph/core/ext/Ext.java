package io.github.eutro.tacgraph.core.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which a derived result (of type {@code T})
 * can be stored in an {@link ExtContainer}.
 * <p>
 * Exts are compared by creation order, which only matters for
 * the iteration order of an {@link ExtHolder}'s backing map.
 *
 * @param <T> The type of the ext.
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
     * Creates a new ext, typed by (a supertype of) the given class, with the given name.
     * <p>
     * Classes are not generic, so an ext for a {@code Map<Block, Stmt>} is created from
     * {@code Map.class}; {@code R} is what callers actually see.
     *
     * @param type The most specific raw class of the ext's values.
     * @param name The name of the ext, for debugging.
     * @param <T>  The raw type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    @SuppressWarnings("unchecked")
    T cast(@Nullable Object value) {
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException(name + " holds a " + value.getClass().getName() + ", not a " + type.getName());
        }
        return (T) value;
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
        return name + ": " + type.getName();
    }
}
