package com.rom.ei.algorithms;

import com.rom.ei.api.ErrorNorm;
import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.InvalidConfigurationException;

/**
 * Options of the EI-Greedy search. Immutable; create it with {@link #builder()}.
 *
 * At least one of {@code targetError} and {@code maxInterpolationDofs} should
 * normally be set. Without either the search only ends when a DOF would be
 * selected twice or every evaluation is reproduced exactly.
 */
public final class EiGreedyConfig {
    private final ErrorNorm errorNorm;
    private final Double targetError;
    private final Integer maxInterpolationDofs;
    private final Projection projection;
    private final InnerProduct product;
    private final GreedyListener listener;

    private EiGreedyConfig(Builder b) {
        this.errorNorm = b.errorNorm;
        this.targetError = b.targetError;
        this.maxInterpolationDofs = b.maxInterpolationDofs;
        this.projection = b.projection;
        this.product = b.product;
        this.listener = b.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Defaults: Euclidean norm, orthogonal projection, no stopping criteria besides DOF collision. */
    public static EiGreedyConfig defaults() {
        return builder().build();
    }

    /** Null means Euclidean norm. */
    public ErrorNorm errorNorm() {
        return errorNorm;
    }

    public Double targetError() {
        return targetError;
    }

    public Integer maxInterpolationDofs() {
        return maxInterpolationDofs;
    }

    public Projection projection() {
        return projection;
    }

    /** Null means Euclidean inner product. */
    public InnerProduct product() {
        return product;
    }

    /** Never null. */
    public GreedyListener listener() {
        return listener;
    }

    public Builder toBuilder() {
        return new Builder()
                .errorNorm(errorNorm)
                .targetError(targetError)
                .maxInterpolationDofs(maxInterpolationDofs)
                .projection(projection)
                .product(product)
                .listener(listener);
    }

    @Override
    public String toString() {
        return "EiGreedyConfig{projection=" + projection + ", targetError=" + targetError
                + ", maxInterpolationDofs=" + maxInterpolationDofs
                + ", customNorm=" + (errorNorm != null) + ", customProduct=" + (product != null) + "}";
    }

    /**
     * Builder for EiGreedyConfig. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private ErrorNorm errorNorm;
        private Double targetError;
        private Integer maxInterpolationDofs;
        private Projection projection = Projection.ORTHOGONAL;
        private InnerProduct product;
        private GreedyListener listener = new GreedyListener() {
        };

        private Builder() {
        }

        public Builder errorNorm(ErrorNorm errorNorm) {
            this.errorNorm = errorNorm;
            return this;
        }

        public Builder targetError(Double targetError) {
            this.targetError = targetError;
            return this;
        }

        public Builder maxInterpolationDofs(Integer maxInterpolationDofs) {
            this.maxInterpolationDofs = maxInterpolationDofs;
            return this;
        }

        public Builder projection(Projection projection) {
            this.projection = projection;
            return this;
        }

        public Builder projection(String projection) {
            this.projection = Projection.fromString(projection);
            return this;
        }

        public Builder product(InnerProduct product) {
            this.product = product;
            return this;
        }

        public Builder listener(GreedyListener listener) {
            this.listener = listener;
            return this;
        }

        /**
         * @throws InvalidConfigurationException if an option is out of range or
         *                                       an inner product is combined with
         *                                       EI projection.
         */
        public EiGreedyConfig build() {
            if (projection == null)
                throw new InvalidConfigurationException("Projection must not be null");
            if (product != null && projection == Projection.EI)
                throw new InvalidConfigurationException(
                        "An inner product is only used with orthogonal projection, not with 'ei'");
            if (targetError != null && (targetError.isNaN() || targetError < 0.0))
                throw new InvalidConfigurationException("Target error must be non-negative, got " + targetError);
            if (maxInterpolationDofs != null && maxInterpolationDofs < 1)
                throw new InvalidConfigurationException(
                        "Maximum number of interpolation DOFs must be positive, got " + maxInterpolationDofs);
            if (listener == null)
                throw new InvalidConfigurationException("Listener must not be null");
            return new EiGreedyConfig(this);
        }
    }
}
