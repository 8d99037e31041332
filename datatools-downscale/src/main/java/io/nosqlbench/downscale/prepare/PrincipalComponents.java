package io.nosqlbench.downscale.prepare;

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

import io.nosqlbench.downscale.DownscaleConfigurationException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Objects;

/// Empirical orthogonal functions (principal components) of a field.
///
/// ## Algorithm
///
/// 1. Center each column of the training matrix (time × features) on its
///    training mean.
/// 2. Take the singular value decomposition `Xc = U Σ Vᵀ`.
/// 3. Keep the first `n` right singular vectors as loadings.
///
/// Scores for any matrix over the same features are `(X - trainingMean) · V_n`,
/// so new data is always projected with the training means and loadings.
public final class PrincipalComponents {

    private final double[] center;
    private final RealMatrix loadings;
    private final double[] explainedVariance;

    private PrincipalComponents(double[] center, RealMatrix loadings, double[] explainedVariance) {
        this.center = center;
        this.loadings = loadings;
        this.explainedVariance = explainedVariance;
    }

    /// Fits the leading components of a matrix.
    ///
    /// @param matrix training values as `[time][feature]`
    /// @param components how many components to keep
    /// @return the fitted components
    /// @throws DownscaleConfigurationException if more components are requested than the data supports
    public static PrincipalComponents fit(double[][] matrix, int components) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        if (matrix.length == 0) {
            throw new IllegalArgumentException("cannot compute principal components of an empty matrix");
        }
        int rows = matrix.length;
        int cols = matrix[0].length;
        int maxComponents = Math.min(rows, cols);
        if (components < 1 || components > maxComponents) {
            throw new DownscaleConfigurationException("requested " + components + " principal components but a "
                + rows + "x" + cols + " field supports between 1 and " + maxComponents);
        }
        double[] center = new double[cols];
        for (double[] row : matrix) {
            for (int c = 0; c < cols; c++) {
                center[c] += row[c];
            }
        }
        for (int c = 0; c < cols; c++) {
            center[c] /= rows;
        }
        double[][] centered = new double[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                centered[r][c] = matrix[r][c] - center[c];
            }
        }
        SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(centered, false));
        double[] singular = svd.getSingularValues();
        double total = 0.0;
        for (double s : singular) {
            total += s * s;
        }
        double[] explained = new double[components];
        for (int i = 0; i < components; i++) {
            explained[i] = total == 0.0 ? 0.0 : singular[i] * singular[i] / total;
        }
        RealMatrix loadings = svd.getV().getSubMatrix(0, cols - 1, 0, components - 1);
        return new PrincipalComponents(center, loadings, explained);
    }

    /// Projects a matrix over the training features onto the components.
    ///
    /// @param matrix values as `[time][feature]`
    /// @return scores as `[time][component]`
    public double[][] project(double[][] matrix) {
        double[][] centered = new double[matrix.length][];
        for (int r = 0; r < matrix.length; r++) {
            if (matrix[r].length != center.length) {
                throw new IllegalArgumentException("expected " + center.length + " features, got " + matrix[r].length);
            }
            centered[r] = new double[center.length];
            for (int c = 0; c < center.length; c++) {
                centered[r][c] = matrix[r][c] - center[c];
            }
        }
        if (centered.length == 0) {
            return new double[0][loadings.getColumnDimension()];
        }
        return new Array2DRowRealMatrix(centered, false).multiply(loadings).getData();
    }

    public int componentCount() {
        return loadings.getColumnDimension();
    }

    public int featureCount() {
        return center.length;
    }

    /// @return the share of total variance carried by each kept component
    public double[] getExplainedVariance() {
        return explainedVariance.clone();
    }
}
