package io.github.eutro.tacgraph.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An implementation of {@link ExtContainer} that keeps its values in a {@link TreeMap},
 * allocated on the first attachment. Attaching to an ext that already has a value replaces it.
 */
public class ExtHolder implements ExtContainer {
    private Map<Ext<?>, Object> values;

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (values == null) values = new TreeMap<>();
        values.put(ext, value);
    }

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        return values == null ? null : ext.cast(values.get(ext));
    }
}
