package io.nosqlbench.downscale.grid;

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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;
import java.util.Objects;

/// Binarization and masking of grids.
///
/// | Operation | Result where value &gt; threshold | Result otherwise |
/// |-----------|--------------------------------|------------------|
/// | [#binaryGrid] | 1 | 0 |
/// | [#partial] | the value | the fill value |
/// | [#calibrated] | 1 | 0 (threshold fitted per point) |
///
/// `NaN` input values stay `NaN` in every operation.
public final class BinaryGrids {

    private BinaryGrids() {
    }

    /// Converts a grid to 0/1 occurrence.
    ///
    /// @param grid the grid
    /// @param threshold values strictly above it become 1
    /// @return the binary grid
    public static Grid binaryGrid(Grid grid, double threshold) {
        double[][][] data = grid.data();
        for (double[][] variable : data) {
            for (double[] row : variable) {
                for (int p = 0; p < row.length; p++) {
                    if (!Double.isNaN(row[p])) {
                        row[p] = row[p] > threshold ? 1.0 : 0.0;
                    }
                }
            }
        }
        return grid.withData(data);
    }

    /// Keeps values above the threshold and replaces the rest with `fill`.
    ///
    /// With `fill = NaN` the values at or below the threshold become masked,
    /// which keeps "dry" distinct from "wet but small". With `fill = 0` the
    /// result is a physical amount series with dry steps at zero.
    ///
    /// @param grid the grid
    /// @param threshold values strictly above it are kept
    /// @param fill the replacement for the other values
    /// @return the masked grid
    public static Grid partial(Grid grid, double threshold, double fill) {
        double[][][] data = grid.data();
        for (double[][] variable : data) {
            for (double[] row : variable) {
                for (int p = 0; p < row.length; p++) {
                    if (!Double.isNaN(row[p]) && !(row[p] > threshold)) {
                        row[p] = fill;
                    }
                }
            }
        }
        return grid.withData(data);
    }

    /// Binarizes a prediction so that its occurrence frequency matches an
    /// observed one.
    ///
    /// For each variable and point, the observed frequency `f` is the share of
    /// ones among the non-missing `refObs` values, and the threshold is the
    /// `1 - f` quantile (type 7) of the non-missing `refPred` values. Values of
    /// `pred` strictly above that threshold become 1.
    ///
    /// @param pred the prediction to binarize
    /// @param refObs observed 0/1 occurrence over the calibration period
    /// @param refPred the prediction over the calibration period
    /// @return the binary prediction
    public static Grid calibrated(Grid pred, Grid refObs, Grid refPred) {
        Objects.requireNonNull(pred, "pred cannot be null");
        Objects.requireNonNull(refObs, "refObs cannot be null");
        Objects.requireNonNull(refPred, "refPred cannot be null");
        if (pred.varCount() != refObs.varCount() || pred.varCount() != refPred.varCount()
            || pred.pointCount() != refObs.pointCount() || pred.pointCount() != refPred.pointCount()) {
            throw new IllegalArgumentException("calibration references do not match the prediction shape");
        }
        double[][][] data = pred.data();
        for (int v = 0; v < pred.varCount(); v++) {
            for (int p = 0; p < pred.pointCount(); p++) {
                double threshold = frequencyThreshold(refObs.series(v, p), refPred.series(v, p));
                for (int t = 0; t < pred.timeCount(); t++) {
                    double value = data[v][t][p];
                    if (!Double.isNaN(value)) {
                        data[v][t][p] = value > threshold ? 1.0 : 0.0;
                    }
                }
            }
        }
        return pred.withData(data);
    }

    /// Computes the prediction threshold that reproduces the observed
    /// occurrence frequency.
    ///
    /// @param observed observed 0/1 values
    /// @param predicted reference predictions
    /// @return the threshold
    static double frequencyThreshold(double[] observed, double[] predicted) {
        double[] obs = Arrays.stream(observed).filter(d -> !Double.isNaN(d)).toArray();
        double[] ref = Arrays.stream(predicted).filter(d -> !Double.isNaN(d)).toArray();
        if (obs.length == 0 || ref.length == 0) {
            throw new IllegalArgumentException("calibration needs at least one observed and one predicted value");
        }
        double frequency = Arrays.stream(obs).filter(d -> d == 1.0).count() / (double) obs.length;
        double quantile = 1.0 - frequency;
        if (quantile <= 0.0) {
            return StatUtils.min(ref);
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        return percentile.evaluate(ref, quantile * 100.0);
    }
}
