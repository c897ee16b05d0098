package com.rom.ei.algorithms;

import com.rom.ei.api.ErrorNorm;
import com.rom.ei.api.GreedyListener;
import com.rom.ei.api.InnerProduct;
import com.rom.ei.api.InvalidConfigurationException;

/**
 * Options of the DEIM algorithm. Immutable; create it with {@link #builder()}.
 */
public final class DeimConfig {
    private final Integer modes;
    private final ErrorNorm errorNorm;
    private final InnerProduct product;
    private final GreedyListener listener;

    private DeimConfig(Builder b) {
        this.modes = b.modes;
        this.errorNorm = b.errorNorm;
        this.product = b.product;
        this.listener = b.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DeimConfig defaults() {
        return builder().build();
    }

    /** Requested number of POD modes, null for all modes above the POD tolerance. */
    public Integer modes() {
        return modes;
    }

    public ErrorNorm errorNorm() {
        return errorNorm;
    }

    /** Inner product for POD, null for the Euclidean one. */
    public InnerProduct product() {
        return product;
    }

    public GreedyListener listener() {
        return listener;
    }

    public static final class Builder {
        private Integer modes;
        private ErrorNorm errorNorm;
        private InnerProduct product;
        private GreedyListener listener = new GreedyListener() {
        };

        private Builder() {
        }

        public Builder modes(Integer modes) {
            this.modes = modes;
            return this;
        }

        public Builder errorNorm(ErrorNorm errorNorm) {
            this.errorNorm = errorNorm;
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

        public DeimConfig build() {
            if (modes != null && modes < 1)
                throw new InvalidConfigurationException("Number of modes must be positive, got " + modes);
            if (listener == null)
                throw new InvalidConfigurationException("Listener must not be null");
            return new DeimConfig(this);
        }
    }
}
