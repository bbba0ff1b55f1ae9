package com.hoopsbot.model;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Value
public final class BenchShape {
    public final Map<BenchCategory, Integer> actual;
    public final Map<BenchCategory, Integer> target;
    public final boolean met;
    public final String description;

    public BenchShape(Map<BenchCategory, Integer> actual, Map<BenchCategory, Integer> target, boolean met, String description) {
        this.actual = Collections.unmodifiableMap(copy(actual));
        this.target = Collections.unmodifiableMap(copy(target));
        this.met = met;
        this.description = description == null ? "" : description;
    }

    public int have(BenchCategory category) {
        return actual.getOrDefault(category, 0);
    }

    public int want(BenchCategory category) {
        return target.getOrDefault(category, 0);
    }

    private static Map<BenchCategory, Integer> copy(Map<BenchCategory, Integer> source) {
        Map<BenchCategory, Integer> out = new EnumMap<>(BenchCategory.class);
        if (source != null) {
            out.putAll(source);
        }
        return out;
    }
}
