package com.rom.ei.interpolation;

import com.rom.ei.algorithms.Deim;
import com.rom.ei.algorithms.DeimConfig;
import com.rom.ei.algorithms.EiGreedy;
import com.rom.ei.algorithms.EiGreedyConfig;
import com.rom.ei.algorithms.GreedyResult;
import com.rom.ei.api.CacheRegion;
import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.Discretization;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import com.rom.ei.cache.CacheRegions;
import com.rom.ei.io.InterpolationSettings;
import com.rom.ei.operators.EmpiricalInterpolatedOperator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Empirical interpolation of the operators of a discretization in one call.
 *
 * Steps:
 * 1. Look up the named operators.
 * 2. Wrap solver and operators in an {@link EvaluationProvider} over the sample.
 * 3. Run {@link EiGreedy} (or {@link Deim} on all evaluations at once).
 * 4. Replace every named operator by an {@link EmpiricalInterpolatedOperator}
 * built on the common DOFs and collateral basis.
 *
 * All operators share ONE collateral basis, which is only a good idea if their
 * ranges are similar.
 *
 * The evaluations are cached for the duration of one call and released from
 * the cache region before it returns.
 */
@Log4j2
public final class OperatorInterpolation {
    private OperatorInterpolation() {
        // Utility class
    }

    /**
     * EI-Greedy with evaluations cached in the {@value CacheRegions#MEMORY} region.
     */
    public static InterpolationResult run(Discretization discretization, List<String> operatorNames,
            Collection<Parameter> sample, EiGreedyConfig config) {
        return run(discretization, operatorNames, sample, config, CacheRegions.MEMORY);
    }

    /**
     * EI-Greedy with evaluations cached in the named region.
     *
     * @throws InvalidConfigurationException if an operator or the cache region is unknown.
     * @throws DimensionMismatchException    if the operators' ranges differ or the sample is empty.
     */
    public static InterpolationResult run(Discretization discretization, List<String> operatorNames,
            Collection<Parameter> sample, EiGreedyConfig config, String cacheRegion) {
        CacheRegion region = CacheRegions.get(cacheRegion);
        List<Operator> operators = lookup(discretization, operatorNames);
        GreedyResult result;
        try (EvaluationProvider evaluations = new EvaluationProvider(discretization, operators,
                List.copyOf(sample), region)) {
            result = EiGreedy.run(evaluations, config);
        }
        return substitute(discretization, operatorNames, operators, result);
    }

    /**
     * Runs the algorithm selected in {@code settings}.
     */
    public static InterpolationResult run(Discretization discretization, List<String> operatorNames,
            Collection<Parameter> sample, InterpolationSettings settings) {
        return switch (settings.algorithmType()) {
            case EI_GREEDY -> run(discretization, operatorNames, sample, settings.toEiGreedyConfig(),
                    settings.getCacheRegion());
            case DEIM -> runDeim(discretization, operatorNames, sample, settings.toDeimConfig(),
                    settings.getCacheRegion());
        };
    }

    /**
     * DEIM on the evaluations of all sample parameters.
     */
    public static InterpolationResult runDeim(Discretization discretization, List<String> operatorNames,
            Collection<Parameter> sample, DeimConfig config, String cacheRegion) {
        CacheRegion region = CacheRegions.get(cacheRegion);
        List<Operator> operators = lookup(discretization, operatorNames);
        VectorArray all;
        try (EvaluationProvider evaluations = new EvaluationProvider(discretization, operators,
                List.copyOf(sample), region)) {
            if (evaluations.isEmpty())
                throw new DimensionMismatchException("Parameter sample is empty");
            all = evaluations.get(0).emptyLike(evaluations.size());
            for (VectorArray au : evaluations)
                all.append(au, false);
        }
        GreedyResult result = Deim.run(all, config);
        return substitute(discretization, operatorNames, operators, result);
    }

    private static List<Operator> lookup(Discretization discretization, List<String> operatorNames) {
        if (operatorNames == null || operatorNames.isEmpty())
            throw new InvalidConfigurationException("No operators to interpolate");
        List<Operator> operators = new ArrayList<>(operatorNames.size());
        for (String name : operatorNames) {
            Operator op = discretization.operators().get(name);
            if (op == null)
                throw new InvalidConfigurationException("Discretization '" + discretization.name()
                        + "' has no operator '" + name + "', known: " + discretization.operators().keySet());
            if (!operators.isEmpty() && op.dimRange() != operators.get(0).dimRange())
                throw new DimensionMismatchException("Operator '" + name + "' has range dimension " + op.dimRange()
                        + ", expected " + operators.get(0).dimRange());
            operators.add(op);
        }
        return operators;
    }

    private static InterpolationResult substitute(Discretization discretization, List<String> operatorNames,
            List<Operator> operators, GreedyResult result) {
        Map<String, Operator> substituted = new LinkedHashMap<>(discretization.operators());
        for (int i = 0; i < operatorNames.size(); i++)
            substituted.put(operatorNames.get(i),
                    new EmpiricalInterpolatedOperator(operators.get(i), result.dofs(), result.basis()));
        Discretization interpolated = discretization.with(substituted, discretization.name() + "_ei");
        log.info("Interpolated operators {} of '{}' with {} DOFs", operatorNames, discretization.name(),
                result.size());
        return new InterpolationResult(interpolated, result.dofs(), result.basis(), result.history());
    }
}
