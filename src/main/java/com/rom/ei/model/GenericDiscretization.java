package com.rom.ei.model;

import com.rom.ei.api.Discretization;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * A discretization assembled from a solver function and a map of named
 * operators.
 *
 * {@link #with(Map, String)} shares the solver with the copy, so replacing an
 * operator by its interpolant does not change the solution snapshots.
 */
public final class GenericDiscretization implements Discretization {
    private final String name;
    private final Function<Parameter, VectorArray> solver;
    private final Map<String, Operator> operators;

    public GenericDiscretization(String name, Function<Parameter, VectorArray> solver,
            Map<String, Operator> operators) {
        this.name = name;
        this.solver = solver;
        this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public VectorArray solve(Parameter mu) {
        return solver.apply(mu);
    }

    @Override
    public Map<String, Operator> operators() {
        return operators;
    }

    @Override
    public Discretization with(Map<String, Operator> operators, String name) {
        return new GenericDiscretization(name, solver, operators);
    }

    /**
     * Convenience lookup.
     *
     * @throws IllegalArgumentException if there is no operator of that name.
     */
    public Operator operator(String operatorName) {
        Operator op = operators.get(operatorName);
        if (op == null)
            throw new IllegalArgumentException("Unknown operator: " + operatorName);
        return op;
    }

    @Override
    public String toString() {
        return "GenericDiscretization{name=" + name + ", operators=" + operators.keySet() + "}";
    }
}
