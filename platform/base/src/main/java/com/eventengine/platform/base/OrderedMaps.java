package com.eventengine.platform.base;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Helpers for insertion-ordered, string-keyed configuration maps.
 *
 * Compiled engine configuration relies on key order (commands, events and aggregates are
 * listed to clients in declaration order), so every copy made here is a {@link LinkedHashMap}.
 */
public final class OrderedMaps {

    private OrderedMaps() {} // Utility class

    /**
     * Map over the entries of a map, producing a list in the map's iteration order.
     *
     * <pre>{@code
     * List<QuerySchema> queries = mapWithKey(queryMap, QuerySchema::new);
     * }</pre>
     */
    public static <K, V, R> List<R> mapWithKey(Map<K, V> map, BiFunction<? super K, ? super V, ? extends R> f) {
        List<R> result = new ArrayList<>(map.size());
        for (Map.Entry<K, V> entry : map.entrySet()) {
            result.add(f.apply(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    /**
     * Keep the entries matching the predicate, preserving relative order.
     */
    public static <K, V> Map<K, V> filter(Map<K, V> map, BiPredicate<? super K, ? super V> predicate) {
        Map<K, V> result = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (predicate.test(k, v)) {
                result.put(k, v);
            }
        });
        return result;
    }

    /**
     * Unmodifiable, order-preserving copy. A null map becomes an empty one.
     */
    public static <K, V> Map<K, V> immutableCopy(Map<K, V> map) {
        if (map == null || map.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
