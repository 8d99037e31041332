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

import io.nosqlbench.downscale.ModelFitException;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratNormalizedGaussianSampler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordinary least squares regression, one fit per predictand point.
///
/// Equivalent to a Gaussian [GlmModel] with identity link. Simulation adds
/// normal noise with the estimated residual variance.
public final class LinearModel implements TrainedModel {

    /// @param coefficients intercept first
    /// @param errorVariance residual variance estimate
    public record LinearFit(double[] coefficients, double errorVariance) {
    }

    private final DownscaleMethod.Lm method;
    private final List<LinearFit> fits;
    private final String predictandVar;
    private final List<String> predictandPoints;

    private LinearModel(DownscaleMethod.Lm method, List<LinearFit> fits, String predictandVar,
                        List<String> predictandPoints) {
        this.method = method;
        this.fits = List.copyOf(fits);
        this.predictandVar = predictandVar;
        this.predictandPoints = predictandPoints;
    }

    static LinearModel fit(DownscaleMethod.Lm method, DesignMatrix design) {
        Objects.requireNonNull(design, "design cannot be null");
        if (!design.hasPredictand()) {
            throw new IllegalArgumentException("a linear model needs a training design with a predictand");
        }
        List<LinearFit> fits = new ArrayList<>();
        for (int p = 0; p < design.getPredictandPoints().size(); p++) {
            double[] y = design.predictand(p);
            List<double[]> rows = new ArrayList<>();
            List<Double> response = new ArrayList<>();
            for (int t = 0; t < y.length; t++) {
                if (!Double.isNaN(y[t])) {
                    rows.add(design.predictorRow(t));
                    response.add(y[t]);
                }
            }
            if (rows.size() <= design.columnCount() + 1) {
                throw new ModelFitException("cannot fit a linear model with " + (design.columnCount() + 1)
                    + " coefficients on " + rows.size() + " rows at point " + design.getPredictandPoints().get(p));
            }
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            try {
                regression.newSampleData(response.stream().mapToDouble(Double::doubleValue).toArray(),
                    rows.toArray(new double[0][]));
                fits.add(new LinearFit(regression.estimateRegressionParameters(), regression.estimateErrorVariance()));
            } catch (MathIllegalArgumentException e) {
                throw new ModelFitException("linear model fit failed at point " + design.getPredictandPoints().get(p), e);
            }
        }
        return new LinearModel(method, fits, design.getPredictandVar(), design.getPredictandPoints());
    }

    @Override
    public DownscaleMethod.Lm getMethod() {
        return method;
    }

    public LinearFit getFit(int point) {
        return fits.get(point);
    }

    @Override
    public Grid predict(DesignMatrix design, boolean simulate, UniformRandomProvider rng) {
        Objects.requireNonNull(design, "design cannot be null");
        NormalizedGaussianSampler noise = null;
        if (simulate) {
            Objects.requireNonNull(rng, "simulation needs a random source");
            noise = ZigguratNormalizedGaussianSampler.of(rng);
        }
        double[][] out = new double[design.rowCount()][fits.size()];
        for (int p = 0; p < fits.size(); p++) {
            LinearFit fit = fits.get(p);
            double[] beta = fit.coefficients();
            for (int t = 0; t < design.rowCount(); t++) {
                double[] row = design.predictorRow(t);
                if (row.length + 1 != beta.length) {
                    throw new IllegalArgumentException("expected " + (beta.length - 1) + " predictors, got " + row.length);
                }
                double value = beta[0];
                for (int i = 0; i < row.length; i++) {
                    value += beta[i + 1] * row[i];
                }
                if (simulate) {
                    value += Math.sqrt(fit.errorVariance()) * noise.sample();
                }
                out[t][p] = value;
            }
        }
        return Grid.of(design.getDates(), predictandVar, predictandPoints, out);
    }
}
