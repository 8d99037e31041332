package io.nosqlbench.downscale;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.downscale.folds.CrossValidationMode;
import io.nosqlbench.downscale.folds.FoldPlan;
import io.nosqlbench.downscale.grid.ScaleType;
import io.nosqlbench.downscale.grid.SpatialFrame;
import io.nosqlbench.downscale.method.DownscaleMethod;
import io.nosqlbench.downscale.method.SelectionFunction;

import java.util.Objects;

/// Options of a [Downscaler] run.
///
/// # Usage
///
/// ```java
/// DownscaleOptions options = DownscaleOptions.builder()
///     .method(DownscaleMethod.Kind.GLM)
///     .simulate(false)
///     .wetThreshold(1.0)
///     .nPcs(10)
///     .crossValidation(CrossValidationMode.KFOLD)
///     .folds(new FoldPlan.KFold(3))
///     .build();
/// ```
///
/// | Option | Default | Used by |
/// |--------|---------|---------|
/// | method | analogs | all |
/// | simulate | false | glm, lm |
/// | nAnalogs | 1 | analogs |
/// | selectionFunction | mean | analogs, ignored for one analog |
/// | wetThreshold | 0.1 | glm |
/// | nPcs | none (raw fields) | all |
/// | crossValidation | none | all |
/// | folds | none | kfold, required there |
/// | seed | 0 | simulation |
/// | parallelism | 1 | cross-validation |
/// | scaleType / spatialFrame | standardize / gridbox | all |
public final class DownscaleOptions {

    private final DownscaleMethod.Kind method;
    private final boolean simulate;
    private final int nAnalogs;
    private final SelectionFunction selectionFunction;
    private final double wetThreshold;
    private final Integer nPcs;
    private final CrossValidationMode crossValidation;
    private final FoldPlan folds;
    private final long seed;
    private final int parallelism;
    private final ScaleType scaleType;
    private final SpatialFrame spatialFrame;

    private DownscaleOptions(Builder builder) {
        this.method = builder.method;
        this.simulate = builder.simulate;
        this.nAnalogs = builder.nAnalogs;
        this.selectionFunction = builder.selectionFunction;
        this.wetThreshold = builder.wetThreshold;
        this.nPcs = builder.nPcs;
        this.crossValidation = builder.crossValidation;
        this.folds = builder.folds;
        this.seed = builder.seed;
        this.parallelism = builder.parallelism;
        this.scaleType = builder.scaleType;
        this.spatialFrame = builder.spatialFrame;
    }

    public DownscaleMethod.Kind method() {
        return method;
    }

    public boolean simulate() {
        return simulate;
    }

    public int nAnalogs() {
        return nAnalogs;
    }

    public SelectionFunction selectionFunction() {
        return selectionFunction;
    }

    /// Value at or below which a predictand amount counts as dry.
    public double wetThreshold() {
        return wetThreshold;
    }

    /// @return the number of pooled principal components, or null for raw fields
    public Integer nPcs() {
        return nPcs;
    }

    public CrossValidationMode crossValidation() {
        return crossValidation;
    }

    /// @return the fold argument as given, or null
    public FoldPlan folds() {
        return folds;
    }

    /// Resolves the cross-validation mode and fold argument into one plan.
    ///
    /// @return the plan
    /// @throws DownscaleConfigurationException if k-fold is requested without folds
    public FoldPlan foldPlan() {
        return FoldPlan.resolve(crossValidation, folds);
    }

    public long seed() {
        return seed;
    }

    public int parallelism() {
        return parallelism;
    }

    public ScaleType scaleType() {
        return scaleType;
    }

    public SpatialFrame spatialFrame() {
        return spatialFrame;
    }

    public static DownscaleOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder initialized with these options' values.
    public Builder toBuilder() {
        return new Builder()
            .method(method)
            .simulate(simulate)
            .nAnalogs(nAnalogs)
            .selectionFunction(selectionFunction)
            .wetThreshold(wetThreshold)
            .nPcs(nPcs)
            .crossValidation(crossValidation)
            .folds(folds)
            .seed(seed)
            .parallelism(parallelism)
            .scaleType(scaleType)
            .spatialFrame(spatialFrame);
    }

    @Override
    public String toString() {
        return "DownscaleOptions{" +
            "method=" + method.getLabel() +
            ", simulate=" + simulate +
            ", nAnalogs=" + nAnalogs +
            ", selectionFunction=" + selectionFunction.getLabel() +
            ", wetThreshold=" + wetThreshold +
            ", nPcs=" + nPcs +
            ", crossValidation=" + crossValidation.getLabel() +
            ", folds=" + folds +
            ", seed=" + seed +
            ", parallelism=" + parallelism +
            ", scaleType=" + scaleType +
            ", spatialFrame=" + spatialFrame +
            '}';
    }

    /// Builder for DownscaleOptions.
    public static final class Builder {
        private DownscaleMethod.Kind method = DownscaleMethod.Kind.ANALOGS;
        private boolean simulate = false;
        private int nAnalogs = 1;
        private SelectionFunction selectionFunction = SelectionFunction.MEAN;
        private double wetThreshold = 0.1;
        private Integer nPcs = null;
        private CrossValidationMode crossValidation = CrossValidationMode.NONE;
        private FoldPlan folds = null;
        private long seed = 0L;
        private int parallelism = 1;
        private ScaleType scaleType = ScaleType.STANDARDIZE;
        private SpatialFrame spatialFrame = SpatialFrame.GRIDBOX;

        Builder() {
        }

        public Builder method(DownscaleMethod.Kind method) {
            this.method = Objects.requireNonNull(method, "method cannot be null");
            return this;
        }

        /// Sets the method by name: analogs, glm or lm.
        ///
        /// @throws DownscaleConfigurationException for any other name
        public Builder method(String method) {
            return method(DownscaleMethod.Kind.parse(method));
        }

        public Builder simulate(boolean simulate) {
            this.simulate = simulate;
            return this;
        }

        /// @throws DownscaleConfigurationException if fewer than one analog is requested
        public Builder nAnalogs(int nAnalogs) {
            if (nAnalogs < 1) {
                throw new DownscaleConfigurationException("n.analogs must be at least 1, got " + nAnalogs);
            }
            this.nAnalogs = nAnalogs;
            return this;
        }

        public Builder selectionFunction(SelectionFunction selectionFunction) {
            this.selectionFunction = Objects.requireNonNull(selectionFunction, "selectionFunction cannot be null");
            return this;
        }

        public Builder wetThreshold(double wetThreshold) {
            if (Double.isNaN(wetThreshold)) {
                throw new DownscaleConfigurationException("wet threshold cannot be NaN");
            }
            this.wetThreshold = wetThreshold;
            return this;
        }

        /// @param nPcs pooled principal components, or null to use raw standardized fields
        public Builder nPcs(Integer nPcs) {
            if (nPcs != null && nPcs < 1) {
                throw new DownscaleConfigurationException("n.pcs must be at least 1, got " + nPcs);
            }
            this.nPcs = nPcs;
            return this;
        }

        public Builder crossValidation(CrossValidationMode crossValidation) {
            this.crossValidation = Objects.requireNonNull(crossValidation, "crossValidation cannot be null");
            return this;
        }

        /// @param folds a k-fold count, train fraction or explicit folds; null for none
        public Builder folds(FoldPlan folds) {
            this.folds = folds;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new DownscaleConfigurationException("parallelism must be at least 1, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder scaleType(ScaleType scaleType) {
            this.scaleType = Objects.requireNonNull(scaleType, "scaleType cannot be null");
            return this;
        }

        public Builder spatialFrame(SpatialFrame spatialFrame) {
            this.spatialFrame = Objects.requireNonNull(spatialFrame, "spatialFrame cannot be null");
            return this;
        }

        public DownscaleOptions build() {
            return new DownscaleOptions(this);
        }
    }
}
