package com.rom.ei.util;

import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.StopReason;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the error estimate of every iteration, including the last one that
 * did not lead to an extension, and the stop reason.
 */
public final class ErrorDecayListener implements GreedyListener {
    private final List<Double> estimates = new ArrayList<>();
    private StopReason stopReason;
    private long startNanos = System.nanoTime();
    private long elapsedNanos;

    @Override
    public void onErrorEstimated(int basisSize, double maxError) {
        estimates.add(maxError);
    }

    @Override
    public void onStopped(StopReason reason, int basisSize) {
        this.stopReason = reason;
        this.elapsedNanos = System.nanoTime() - startNanos;
    }

    /** Error estimates in iteration order; entry i belongs to basis size i for EI-Greedy. */
    public List<Double> estimates() {
        return List.copyOf(estimates);
    }

    /** Null while the run is in progress. */
    public StopReason stopReason() {
        return stopReason;
    }

    public double elapsedMillis() {
        return elapsedNanos / 1e6;
    }

    public void reset() {
        estimates.clear();
        stopReason = null;
        startNanos = System.nanoTime();
        elapsedNanos = 0;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-10s | %14s\n", "Basis size", "Max error"));
        sb.append("---------------------------\n");
        for (int i = 0; i < estimates.size(); i++)
            sb.append(String.format("%-10d | %14.6e\n", i, estimates.get(i)));
        sb.append(String.format("Stopped: %s after %.2f ms\n", stopReason, elapsedMillis()));
        return sb.toString();
    }
}
