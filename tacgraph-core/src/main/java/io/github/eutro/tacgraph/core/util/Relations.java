package io.github.eutro.tacgraph.core.util;

import java.util.*;

/**
 * Helpers for indexing binary relations.
 */
public class Relations {
    /**
     * Index a binary relation by its left column, keeping first-seen order.
     *
     * @param pairs The relation.
     * @param <K>   The left type.
     * @param <V>   The right type.
     * @return Each left value, mapped to the right values it is paired with.
     */
    public static <K, V> Map<K, Set<V>> group(Iterable<Pair<K, V>> pairs) {
        Map<K, Set<V>> map = new LinkedHashMap<>();
        for (Pair<K, V> pair : pairs) {
            putMulti(map, pair.left, pair.right);
        }
        return map;
    }

    /**
     * Add a value to the set a key maps to, creating the set if needed.
     *
     * @param map   The map.
     * @param key   The key.
     * @param value The value.
     * @param <K>   The key type.
     * @param <V>   The value type.
     * @return Whether the value was not already present.
     */
    public static <K, V> boolean putMulti(Map<K, Set<V>> map, K key, V value) {
        return map.computeIfAbsent(key, $ -> new LinkedHashSet<>()).add(value);
    }
}
