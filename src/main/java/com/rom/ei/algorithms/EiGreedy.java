package com.rom.ei.algorithms;

import com.rom.ei.api.DimensionMismatchException;
import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.StopReason;
import com.rom.ei.api.VectorArray;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Greedy generation of empirical interpolation data (EI-Greedy algorithm).
 *
 * Each iteration adds the worst approximated evaluation to the collateral
 * basis:
 *
 * 1. Estimate: {@link ProjectionErrorEvaluator} returns the maximum error and a
 * candidate vector.
 * 2. Converged: if a target error is set and reached, stop without using the
 * candidate.
 * 3. Select: the new DOF is the largest-magnitude component of the candidate.
 * If it was selected before, stop (DOF collision). If the candidate is zero
 * there, stop as well (candidate vanished).
 * 4. Extend: divide the candidate by its DOF component, append it, record the
 * error and the triangularity deviation of the interpolation matrix.
 * 5. Budget: if the maximum number of DOFs is reached, compute the final error
 * for reporting and stop.
 *
 * All stops are successful outcomes and are reported through
 * {@link GreedyHistory#stopReason()}. Invalid input fails before the first
 * iteration; a numerical breakdown aborts the run without a result.
 */
@Log4j2
public final class EiGreedy {
    private EiGreedy() {
        // Utility class
    }

    /**
     * Runs the search on a single array of evaluations.
     */
    public static GreedyResult run(VectorArray evaluations, EiGreedyConfig config) {
        return run(List.of(evaluations), config);
    }

    /**
     * Runs the search.
     *
     * @param evaluations batches of operator evaluations, all of the same type and
     *                    dimension; may be a lazily computed list such as
     *                    {@link com.rom.ei.interpolation.EvaluationProvider}.
     * @throws DimensionMismatchException if there are no evaluation vectors or the
     *                                    batches are incompatible.
     * @throws com.rom.ei.api.NumericalException if the Gram matrix of the basis
     *                                           cannot be factorized.
     */
    public static GreedyResult run(List<? extends VectorArray> evaluations, EiGreedyConfig config) {
        VectorArray prototype = validate(evaluations);

        log.info("Generating interpolation data ({}) ...", config);

        GreedyState state = new GreedyState(prototype.emptyLike(8));
        ProjectionErrorEvaluator evaluator = new ProjectionErrorEvaluator(state, evaluations,
                config.projection(), config.errorNorm(), config.product());
        GreedyListener listener = config.listener();
        Double targetError = config.targetError();
        Integer maxDofs = config.maxInterpolationDofs();

        List<Double> maxErrs = new ArrayList<>();
        List<Double> triangularityErrs = new ArrayList<>();
        Double finalError = null;
        StopReason reason;

        while (true) {
            ProjectionError estimate = evaluator.evaluate();
            double maxErr = estimate.maxError();

            log.info("Maximum interpolation error with {} interpolation DOFs: {}", state.size(), maxErr);
            listener.onErrorEstimated(state.size(), maxErr);

            if (targetError != null && maxErr <= targetError) {
                log.info("Target error reached! Stopping extension loop.");
                reason = StopReason.CONVERGED;
                break;
            }

            VectorArray candidate = estimate.candidate();
            int newDof = candidate.amax().index(0);
            if (state.isSelected(newDof)) {
                log.info("DOF {} selected twice for interpolation! Stopping extension loop.", newDof);
                reason = StopReason.DOF_COLLISION;
                break;
            }

            double pivot = candidate.components(new int[] { newDof })[0][0];
            if (pivot == 0.0) {
                log.info("Candidate vector is zero. Stopping extension loop.");
                reason = StopReason.CANDIDATE_VANISHED;
                break;
            }
            candidate.scal(1.0 / pivot);
            state.extend(candidate, newDof);
            maxErrs.add(maxErr);

            double triangularityErr = state.triangularityError();
            triangularityErrs.add(triangularityErr);
            log.info("Interpolation matrix is not lower triangular with maximum error of {}", triangularityErr);
            listener.onExtended(state.dofs(), state.basis(), triangularityErr);

            if (maxDofs != null && state.size() >= maxDofs) {
                log.info("Maximum number of interpolation DOFs reached. Stopping extension loop.");
                finalError = evaluator.evaluate().maxError();
                log.info("Final maximum interpolation error with {} interpolation DOFs: {}", state.size(),
                        finalError);
                reason = StopReason.MAX_DOFS_REACHED;
                break;
            }
        }

        listener.onStopped(reason, state.size());
        return new GreedyResult(state.dofs(), state.basis(),
                GreedyHistory.ofEiGreedy(maxErrs, triangularityErrs, reason, finalError));
    }

    /**
     * Checks that there is at least one evaluation vector and that all batches
     * share type and dimension.
     *
     * @return the first batch, used as prototype for the basis.
     */
    static VectorArray validate(List<? extends VectorArray> evaluations) {
        if (evaluations == null || evaluations.isEmpty())
            throw new DimensionMismatchException("No operator evaluations given");
        VectorArray prototype = null;
        int total = 0;
        int batch = 0;
        for (VectorArray au : evaluations) {
            if (au == null)
                throw new DimensionMismatchException("Evaluation batch " + batch + " is null");
            if (prototype == null) {
                prototype = au;
            } else if (!prototype.isCompatible(au)) {
                throw new DimensionMismatchException("Evaluation batch " + batch + " (" + au.getClass().getSimpleName()
                        + ", dim=" + au.dim() + ") does not match batch 0 ("
                        + prototype.getClass().getSimpleName() + ", dim=" + prototype.dim() + ")");
            }
            total += au.len();
            batch++;
        }
        if (total == 0)
            throw new DimensionMismatchException("All " + batch + " evaluation batches are empty");
        if (prototype.dim() == 0)
            throw new DimensionMismatchException("Evaluations have dimension 0");
        return prototype;
    }
}
