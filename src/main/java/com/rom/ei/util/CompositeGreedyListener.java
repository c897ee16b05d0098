package com.rom.ei.util;

import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.StopReason;
import com.rom.ei.api.VectorArray;

import java.util.Arrays;

/**
 * Aggregates multiple {@link GreedyListener} instances.
 */
public class CompositeGreedyListener implements GreedyListener {
    private GreedyListener[] listeners = new GreedyListener[0];

    public CompositeGreedyListener(GreedyListener... listeners) {
        for (GreedyListener l : listeners)
            add(l);
    }

    public CompositeGreedyListener add(GreedyListener listener) {
        GreedyListener[] old = listeners;
        GreedyListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    @Override
    public void onErrorEstimated(int basisSize, double maxError) {
        for (GreedyListener l : listeners)
            l.onErrorEstimated(basisSize, maxError);
    }

    @Override
    public void onExtended(int[] dofs, VectorArray basis, double triangularityError) {
        for (GreedyListener l : listeners)
            l.onExtended(dofs, basis, triangularityError);
    }

    @Override
    public void onStopped(StopReason reason, int basisSize) {
        for (GreedyListener l : listeners)
            l.onStopped(reason, basisSize);
    }
}
