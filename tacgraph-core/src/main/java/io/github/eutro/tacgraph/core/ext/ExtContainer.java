package io.github.eutro.tacgraph.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * A container for {@link Ext}s. See the {@link io.github.eutro.tacgraph.core.ext package-level documentation}.
 */
public interface ExtContainer {
    /**
     * Associate {@code ext} with {@code value} in this container.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Get the value of {@code ext} in this container, or null if absent.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, throwing if it has not been computed.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws IllegalStateException If the ext is absent.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new IllegalStateException("Ext not present: " + ext);
    }
}
