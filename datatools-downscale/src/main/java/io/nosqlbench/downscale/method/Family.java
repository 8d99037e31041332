package io.nosqlbench.downscale.method;

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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AhrensDieterMarsagliaTsangGammaSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratNormalizedGaussianSampler;

/// Error distribution and link function of a generalized linear model.
///
/// | Family | Link | Variance V(μ) | Typical predictand |
/// |--------|------|---------------|--------------------|
/// | GAUSSIAN | identity | 1 | unconstrained (temperature) |
/// | BINOMIAL | logit | μ(1 - μ) | 0/1 occurrence |
/// | GAMMA | log | μ² | strictly positive amounts |
///
/// Each family also knows how to draw one value from its conditional law
/// given a mean and a dispersion, which is what simulation uses.
public enum Family {

    GAUSSIAN("gaussian", "identity") {
        @Override
        public double link(double mu) {
            return mu;
        }

        @Override
        public double linkInverse(double eta) {
            return eta;
        }

        @Override
        public double muEta(double eta) {
            return 1.0;
        }

        @Override
        public double variance(double mu) {
            return 1.0;
        }

        @Override
        public double devianceResidual(double y, double mu) {
            return (y - mu) * (y - mu);
        }

        @Override
        public boolean isValidResponse(double y) {
            return Double.isFinite(y);
        }

        @Override
        public double startingMean(double y) {
            return y;
        }

        @Override
        public double sample(UniformRandomProvider rng, double mu, double dispersion) {
            return mu + Math.sqrt(dispersion) * ZigguratNormalizedGaussianSampler.of(rng).sample();
        }
    },

    BINOMIAL("binomial", "logit") {
        @Override
        public double link(double mu) {
            return Math.log(mu / (1.0 - mu));
        }

        @Override
        public double linkInverse(double eta) {
            double mu = 1.0 / (1.0 + Math.exp(-eta));
            return Math.min(Math.max(mu, EPSILON), 1.0 - EPSILON);
        }

        @Override
        public double muEta(double eta) {
            double e = Math.exp(-Math.abs(eta));
            return Math.max(e / ((1.0 + e) * (1.0 + e)), EPSILON);
        }

        @Override
        public double variance(double mu) {
            return mu * (1.0 - mu);
        }

        @Override
        public double devianceResidual(double y, double mu) {
            return 2.0 * (ylogy(y, mu) + ylogy(1.0 - y, 1.0 - mu));
        }

        @Override
        public boolean isValidResponse(double y) {
            return y >= 0.0 && y <= 1.0;
        }

        @Override
        public double startingMean(double y) {
            return (y + 0.5) / 2.0;
        }

        @Override
        public boolean hasFixedDispersion() {
            return true;
        }

        @Override
        public double sample(UniformRandomProvider rng, double mu, double dispersion) {
            return rng.nextDouble() < mu ? 1.0 : 0.0;
        }
    },

    GAMMA("Gamma", "log") {
        @Override
        public double link(double mu) {
            return Math.log(mu);
        }

        @Override
        public double linkInverse(double eta) {
            return Math.max(Math.exp(eta), EPSILON);
        }

        @Override
        public double muEta(double eta) {
            return Math.max(Math.exp(eta), EPSILON);
        }

        @Override
        public double variance(double mu) {
            return mu * mu;
        }

        @Override
        public double devianceResidual(double y, double mu) {
            return -2.0 * (Math.log(y / mu) - (y - mu) / mu);
        }

        @Override
        public boolean isValidResponse(double y) {
            return y > 0.0 && Double.isFinite(y);
        }

        @Override
        public double startingMean(double y) {
            return y;
        }

        @Override
        public double sample(UniformRandomProvider rng, double mu, double dispersion) {
            double shape = 1.0 / dispersion;
            return AhrensDieterMarsagliaTsangGammaSampler.of(rng, shape, mu * dispersion).sample();
        }
    };

    private static final double EPSILON = 2.220446e-16;

    private final String familyName;
    private final String linkName;

    Family(String familyName, String linkName) {
        this.familyName = familyName;
        this.linkName = linkName;
    }

    /// η = g(μ)
    public abstract double link(double mu);

    /// μ = g⁻¹(η)
    public abstract double linkInverse(double eta);

    /// dμ/dη evaluated at η
    public abstract double muEta(double eta);

    /// V(μ)
    public abstract double variance(double mu);

    /// Unit deviance of one observation.
    public abstract double devianceResidual(double y, double mu);

    /// Whether the family can fit this response value.
    public abstract boolean isValidResponse(double y);

    /// Initial mean for the first IRLS iteration.
    public abstract double startingMean(double y);

    /// Draws one value from the family's law with the given mean and dispersion.
    ///
    /// @param rng the random source
    /// @param mu the conditional mean
    /// @param dispersion the dispersion φ (ignored by BINOMIAL)
    /// @return the simulated value
    public abstract double sample(UniformRandomProvider rng, double mu, double dispersion);

    /// Whether the dispersion is fixed at 1 rather than estimated.
    public boolean hasFixedDispersion() {
        return false;
    }

    public String getFamilyName() {
        return familyName;
    }

    public String getLinkName() {
        return linkName;
    }

    private static double ylogy(double y, double mu) {
        return y == 0.0 ? 0.0 : y * Math.log(y / mu);
    }

    @Override
    public String toString() {
        return familyName + "(link = \"" + linkName + "\")";
    }
}
