package com.rom.ei.algorithms;

import com.rom.ei.api.VectorArray;

/**
 * Result of one error sweep over all evaluations.
 *
 * @param maxError  the largest approximation error found.
 * @param candidate private single-vector array proposed as next basis vector;
 *                  the caller owns it and may modify it.
 */
public record ProjectionError(double maxError, VectorArray candidate) {
}
