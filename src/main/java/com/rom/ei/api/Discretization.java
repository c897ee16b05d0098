package com.rom.ei.api;

import java.util.Map;

/**
 * A full-order model: solves for a parameter and exposes its operators by name.
 */
public interface Discretization {

    String name();

    /**
     * Computes the solution snapshot(s) for the given parameter.
     */
    VectorArray solve(Parameter mu);

    /**
     * Named operators of this model. The returned map must not be modified.
     */
    Map<String, Operator> operators();

    /**
     * Returns a copy of this model with the given operators and name; the
     * solver is shared.
     */
    Discretization with(Map<String, Operator> operators, String name);
}
