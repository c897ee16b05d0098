package com.rom.ei.interpolation;

import com.rom.ei.api.CacheRegion;
import com.rom.ei.api.Discretization;
import com.rom.ei.api.InvalidConfigurationException;
import com.rom.ei.api.Operator;
import com.rom.ei.api.Parameter;
import com.rom.ei.api.VectorArray;
import com.rom.ei.cache.CacheKey;
import com.rom.ei.cache.CacheRegions;

import java.util.AbstractList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Lazily computed, cached operator evaluations on solution snapshots, one
 * {@link VectorArray} per sample parameter.
 *
 * Element {@code i} is computed on first access: solve the discretization at
 * {@code sample[i]}, apply every operator to the solution and append the
 * results (in operator order) into one array. The result is stored in the
 * cache region under {@code (provider id, i)}; later accesses return the cached
 * array without solving again.
 *
 * The list is read only. Callers must not modify the arrays they get back,
 * they are the cached entries. Intended to be driven by one consumer at a time.
 *
 * Cached entries live as long as the provider: {@link #close()} drops them
 * from the region. Arrays obtained before closing stay valid.
 */
@Log4j2
public final class EvaluationProvider extends AbstractList<VectorArray> implements AutoCloseable {
    private static long nextId;

    private final long id = nextId++;
    private final Discretization discretization;
    private final List<Operator> operators;
    private final List<Parameter> sample;
    private final CacheRegion cacheRegion;

    public EvaluationProvider(Discretization discretization, List<Operator> operators, List<Parameter> sample) {
        this(discretization, operators, sample, CacheRegions.get(CacheRegions.MEMORY));
    }

    public EvaluationProvider(Discretization discretization, List<Operator> operators, List<Parameter> sample,
            String cacheRegion) {
        this(discretization, operators, sample, CacheRegions.get(cacheRegion));
    }

    public EvaluationProvider(Discretization discretization, List<Operator> operators, List<Parameter> sample,
            CacheRegion cacheRegion) {
        if (operators == null || operators.isEmpty())
            throw new InvalidConfigurationException("At least one operator is required");
        this.discretization = discretization;
        this.operators = List.copyOf(operators);
        this.sample = List.copyOf(sample);
        this.cacheRegion = cacheRegion;
    }

    @Override
    public int size() {
        return sample.size();
    }

    /**
     * Returns the evaluations for {@code sample[index]}, computing them on first
     * access.
     *
     * @throws IndexOutOfBoundsException if {@code index} is outside {@code [0, size())}.
     */
    @Override
    public VectorArray get(int index) {
        if (index < 0 || index >= sample.size())
            throw new IndexOutOfBoundsException("Sample index " + index + " out of range for " + sample.size()
                    + " parameters");
        return cacheRegion.getOrCompute(new CacheKey(id, index), () -> compute(index));
    }

    /**
     * Removes this provider's entries from the cache region. Later accesses
     * compute again.
     */
    @Override
    public void close() {
        for (int i = 0; i < sample.size(); i++)
            cacheRegion.invalidate(new CacheKey(id, i));
        log.debug("Released cached evaluations of provider {} ({} parameters)", id, sample.size());
    }

    public List<Parameter> sample() {
        return sample;
    }

    public List<Operator> operators() {
        return operators;
    }

    /**
     * Uncached computation of element {@code index}.
     */
    VectorArray compute(int index) {
        Parameter mu = sample.get(index);
        log.debug("Solving {} for mu = {}", discretization.name(), mu);
        VectorArray u = discretization.solve(mu);
        VectorArray au = operators.get(0).emptyRange(operators.size() * u.len());
        for (Operator op : operators)
            au.append(op.apply(u, mu), true);
        return au;
    }
}
