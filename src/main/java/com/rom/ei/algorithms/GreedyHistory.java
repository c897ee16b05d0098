package com.rom.ei.algorithms;

import com.rom.ei.api.StopReason;

import java.util.List;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Diagnostics of a greedy run.
 *
 * {@code errors.get(i)} is the maximum error that led to accepting the i-th
 * DOF. For EI-Greedy {@code triangularityErrors} runs parallel to it; DEIM
 * leaves it empty.
 */
@Getter
@Accessors(fluent = true)
public final class GreedyHistory {
    private final List<Double> errors;
    private final List<Double> triangularityErrors;
    private final StopReason stopReason;
    /** Error after the last extension, only computed when the DOF budget stopped the run. */
    private final Double finalError;
    /** DEIM: number of modes asked for (null = all). */
    private final Integer requestedModes;
    /** DEIM: number of modes POD delivered. */
    private final Integer podModes;
    /** DEIM: true if fewer basis vectors than requested (or than POD delivered) were kept. */
    private final boolean truncated;

    private GreedyHistory(List<Double> errors, List<Double> triangularityErrors, StopReason stopReason,
            Double finalError, Integer requestedModes, Integer podModes, boolean truncated) {
        this.errors = List.copyOf(errors);
        this.triangularityErrors = List.copyOf(triangularityErrors);
        this.stopReason = stopReason;
        this.finalError = finalError;
        this.requestedModes = requestedModes;
        this.podModes = podModes;
        this.truncated = truncated;
    }

    static GreedyHistory ofEiGreedy(List<Double> errors, List<Double> triangularityErrors, StopReason reason,
            Double finalError) {
        return new GreedyHistory(errors, triangularityErrors, reason, finalError, null, null, false);
    }

    static GreedyHistory ofDeim(List<Double> errors, StopReason reason, Integer requestedModes, int podModes) {
        int kept = errors.size();
        int wanted = requestedModes != null ? requestedModes : podModes;
        return new GreedyHistory(errors, List.of(), reason, null, requestedModes, podModes, kept < wanted);
    }

    @Override
    public String toString() {
        return "GreedyHistory{stopReason=" + stopReason + ", dofs=" + errors.size() + ", errors=" + errors
                + (finalError != null ? ", finalError=" + finalError : "")
                + (podModes != null ? ", podModes=" + podModes + ", truncated=" + truncated : "") + "}";
    }
}
