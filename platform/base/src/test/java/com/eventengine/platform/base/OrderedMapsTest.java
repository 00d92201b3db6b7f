package com.eventengine.platform.base;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedMapsTest {

    private static Map<String, Integer> ordered() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("zeta", 1);
        map.put("alpha", 2);
        map.put("mu", 3);
        map.put("beta", 4);
        return map;
    }

    @Test
    void mapWithKeyKeepsIterationOrder() {
        assertThat(OrderedMaps.mapWithKey(ordered(), (k, v) -> k + "=" + v))
                .containsExactly("zeta=1", "alpha=2", "mu=3", "beta=4");
    }

    @Test
    void filterKeepsRelativeOrder() {
        assertThat(OrderedMaps.filter(ordered(), (k, v) -> v % 2 == 0).keySet())
                .containsExactly("alpha", "beta");
    }

    @Test
    void immutableCopyKeepsOrderAndRejectsWrites() {
        Map<String, Integer> copy = OrderedMaps.immutableCopy(ordered());

        assertThat(copy.keySet()).containsExactly("zeta", "alpha", "mu", "beta");
        assertThatThrownBy(() -> copy.put("x", 9)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void immutableCopyOfNullIsEmpty() {
        assertThat(OrderedMaps.<String, Object>immutableCopy(null)).isEmpty();
    }
}
