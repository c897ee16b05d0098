package com.rom.ei.api;

import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable assignment of named scalar parameter components, e.g.
 * {@code {"diffusion": 0.1, "reaction": 2.0}}.
 */
public record Parameter(Map<String, Double> values) {

    public Parameter {
        values = Map.copyOf(values);
    }

    public static Parameter of(String name, double value) {
        return new Parameter(Map.of(name, value));
    }

    public static Parameter of(String name1, double value1, String name2, double value2) {
        return new Parameter(Map.of(name1, value1, name2, value2));
    }

    /**
     * Returns the value of a parameter component.
     *
     * @throws IllegalArgumentException if the component is not part of this parameter.
     */
    public double get(String name) {
        Double v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown parameter component: " + name);
        return v;
    }

    @Override
    public String toString() {
        return new TreeMap<>(values).toString();
    }
}
