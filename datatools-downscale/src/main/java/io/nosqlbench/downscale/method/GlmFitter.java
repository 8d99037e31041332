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
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Fits a generalized linear model by iteratively reweighted least squares.
///
/// ## Algorithm
///
/// ```
///   μ₀ = family.startingMean(y),  η₀ = g(μ₀)
///   repeat up to maxIterations:
///     z = η + (y - μ) / μ'(η)            working response
///     w = μ'(η)² / V(μ)                  working weights
///     β = argmin Σ w (z - Xβ)²           QR least squares
///     η = Xβ,  μ = g⁻¹(η)
///     stop when |D - D_prev| / (|D| + 0.1) < tolerance
/// ```
///
/// An intercept column is always added. Dispersion is fixed at 1 for the
/// binomial family and otherwise estimated from Pearson residuals as
/// `Σ (y - μ)² / V(μ) / (n - p)`.
///
/// Failures are raised as [ModelFitException]: invalid responses for the
/// family, fewer rows than coefficients, a rank-deficient design, a
/// non-finite deviance, or no convergence.
public final class GlmFitter {

    private static final Logger logger = LogManager.getLogger(GlmFitter.class);

    public static final int DEFAULT_MAX_ITERATIONS = 25;
    public static final double DEFAULT_TOLERANCE = 1e-8;
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final Family family;
    private final int maxIterations;
    private final double tolerance;

    public GlmFitter(Family family) {
        this(family, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public GlmFitter(Family family, int maxIterations, double tolerance) {
        this.family = Objects.requireNonNull(family, "family cannot be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /// Result of fitting one predictand series.
    ///
    /// @param coefficients intercept first, then one coefficient per predictor column
    /// @param dispersion the dispersion φ
    /// @param deviance the residual deviance
    /// @param iterations IRLS iterations used
    /// @param rows training rows used
    public record GlmFit(double[] coefficients, double dispersion, double deviance, int iterations, int rows) {

        /// Linear predictor η for one predictor row.
        public double linearPredictor(double[] row) {
            if (row.length + 1 != coefficients.length) {
                throw new IllegalArgumentException("expected " + (coefficients.length - 1) + " predictors, got " + row.length);
            }
            double eta = coefficients[0];
            for (int i = 0; i < row.length; i++) {
                eta += coefficients[i + 1] * row[i];
            }
            return eta;
        }
    }

    /// Fits the model.
    ///
    /// @param predictors `[row][column]` predictor values
    /// @param response one response per row
    /// @return the fit
    /// @throws ModelFitException if the fit fails
    public GlmFit fit(double[][] predictors, double[] response) {
        Objects.requireNonNull(predictors, "predictors cannot be null");
        Objects.requireNonNull(response, "response cannot be null");
        int n = response.length;
        if (predictors.length != n) {
            throw new IllegalArgumentException("predictors have " + predictors.length + " rows, response has " + n);
        }
        int p = (n == 0 ? 0 : predictors[0].length) + 1;
        if (n <= p) {
            throw new ModelFitException("cannot fit " + family + " with " + p + " coefficients on " + n + " rows");
        }
        for (double y : response) {
            if (!family.isValidResponse(y)) {
                throw new ModelFitException("response value " + y + " is not valid for the " + family + " family");
            }
        }

        double[][] x = new double[n][p];
        for (int i = 0; i < n; i++) {
            x[i][0] = 1.0;
            System.arraycopy(predictors[i], 0, x[i], 1, p - 1);
        }

        double[] mu = new double[n];
        double[] eta = new double[n];
        for (int i = 0; i < n; i++) {
            mu[i] = family.startingMean(response[i]);
            eta[i] = family.link(mu[i]);
        }
        double previousDeviance = deviance(response, mu);
        double[] beta = null;
        double deviance = previousDeviance;
        int iteration = 0;
        boolean converged = false;

        while (iteration < maxIterations && !converged) {
            iteration++;
            double[][] weightedX = new double[n][p];
            double[] weightedZ = new double[n];
            for (int i = 0; i < n; i++) {
                double d = family.muEta(eta[i]);
                double z = eta[i] + (response[i] - mu[i]) / d;
                double w = Math.sqrt(d * d / family.variance(mu[i]));
                for (int j = 0; j < p; j++) {
                    weightedX[i][j] = x[i][j] * w;
                }
                weightedZ[i] = z * w;
            }
            try {
                RealVector solution = new QRDecomposition(new Array2DRowRealMatrix(weightedX, false), SINGULARITY_THRESHOLD)
                    .getSolver().solve(new ArrayRealVector(weightedZ, false));
                beta = solution.toArray();
            } catch (SingularMatrixException e) {
                throw new ModelFitException("design matrix is rank deficient for " + family + " fit", e);
            }
            for (int i = 0; i < n; i++) {
                double value = 0.0;
                for (int j = 0; j < p; j++) {
                    value += x[i][j] * beta[j];
                }
                eta[i] = value;
                mu[i] = family.linkInverse(value);
            }
            deviance = deviance(response, mu);
            if (!Double.isFinite(deviance)) {
                throw new ModelFitException("non-finite deviance in iteration " + iteration + " of " + family + " fit");
            }
            converged = Math.abs(deviance - previousDeviance) / (Math.abs(deviance) + 0.1) < tolerance;
            previousDeviance = deviance;
        }
        if (!converged) {
            throw new ModelFitException(family + " fit did not converge in " + maxIterations + " iterations");
        }

        double dispersion = 1.0;
        if (!family.hasFixedDispersion()) {
            double pearson = 0.0;
            for (int i = 0; i < n; i++) {
                double residual = response[i] - mu[i];
                pearson += residual * residual / family.variance(mu[i]);
            }
            dispersion = pearson / (n - p);
        }
        logger.debug("{} fit converged in {} iterations on {} rows, deviance {}, dispersion {}",
            family, iteration, n, deviance, dispersion);
        return new GlmFit(beta, dispersion, deviance, iteration, n);
    }

    private double deviance(double[] y, double[] mu) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            sum += family.devianceResidual(y[i], mu[i]);
        }
        return sum;
    }

    public Family getFamily() {
        return family;
    }
}
