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

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Centering and standardization of grids against a base period.
///
/// ## Fit on base, apply anywhere
///
/// ```
///   base (training period) ──► fit() ──► Scaling ──► apply(train)
///                                               └──► apply(test or new data)
/// ```
///
/// The parameters are computed from the base grid only and applied unchanged
/// to any other grid over the same variables and points. A test period must
/// never be scaled with its own statistics.
public final class Scaling {

    private static final Logger logger = LogManager.getLogger(Scaling.class);

    private final ScaleType type;
    private final SpatialFrame frame;
    private final List<String> varNames;
    private final int pointCount;
    /// [variable][point]; with FIELD frame every point of a variable holds the same value
    private final double[][] means;
    private final double[][] deviations;

    private Scaling(ScaleType type, SpatialFrame frame, List<String> varNames, int pointCount,
                    double[][] means, double[][] deviations) {
        this.type = type;
        this.frame = frame;
        this.varNames = varNames;
        this.pointCount = pointCount;
        this.means = means;
        this.deviations = deviations;
    }

    /// Scales `grid` with parameters fitted on `base`, per grid box.
    ///
    /// @param grid the grid to transform
    /// @param base the grid the parameters are computed from
    /// @param type centering or standardization
    /// @return the scaled grid
    public static Grid scaleGrid(Grid grid, Grid base, ScaleType type) {
        return scaleGrid(grid, base, type, SpatialFrame.GRIDBOX);
    }

    /// Scales `grid` with parameters fitted on `base`.
    public static Grid scaleGrid(Grid grid, Grid base, ScaleType type, SpatialFrame frame) {
        return fit(base, type, frame).apply(grid);
    }

    /// Computes scaling parameters from a base grid. Missing values are ignored;
    /// a zero or undefined deviation is replaced by 1.
    ///
    /// @param base the base grid
    /// @param type centering or standardization
    /// @param frame whether points share parameters
    /// @return the fitted scaling
    public static Scaling fit(Grid base, ScaleType type, SpatialFrame frame) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(frame, "frame cannot be null");
        int vars = base.varCount();
        int points = base.pointCount();
        double[][] means = new double[vars][points];
        double[][] deviations = new double[vars][points];
        for (int v = 0; v < vars; v++) {
            if (frame == SpatialFrame.FIELD) {
                SummaryStatistics stats = new SummaryStatistics();
                for (int t = 0; t < base.timeCount(); t++) {
                    for (int p = 0; p < points; p++) {
                        addValue(stats, base.get(v, t, p));
                    }
                }
                for (int p = 0; p < points; p++) {
                    means[v][p] = stats.getMean();
                    deviations[v][p] = usableDeviation(stats);
                }
            } else {
                for (int p = 0; p < points; p++) {
                    SummaryStatistics stats = new SummaryStatistics();
                    for (int t = 0; t < base.timeCount(); t++) {
                        addValue(stats, base.get(v, t, p));
                    }
                    means[v][p] = stats.getMean();
                    deviations[v][p] = usableDeviation(stats);
                }
            }
        }
        logger.debug("fitted {} scaling ({}) on {}", type, frame, base);
        return new Scaling(type, frame, base.getVarNames(), points, means, deviations);
    }

    private static void addValue(SummaryStatistics stats, double value) {
        if (!Double.isNaN(value)) {
            stats.addValue(value);
        }
    }

    private static double usableDeviation(SummaryStatistics stats) {
        double sd = stats.getStandardDeviation();
        return (Double.isNaN(sd) || sd == 0.0) ? 1.0 : sd;
    }

    /// Applies the fitted parameters to a grid over the same variables and points.
    ///
    /// @param grid the grid to transform
    /// @return the scaled grid
    /// @throws IllegalArgumentException if the grid's variables or points differ from the base
    public Grid apply(Grid grid) {
        Objects.requireNonNull(grid, "grid cannot be null");
        if (!grid.getVarNames().equals(varNames) || grid.pointCount() != pointCount) {
            throw new IllegalArgumentException("scaling was fitted on " + varNames + " with " + pointCount
                + " points and cannot be applied to " + grid);
        }
        double[][][] data = grid.data();
        for (int v = 0; v < data.length; v++) {
            for (double[] row : data[v]) {
                for (int p = 0; p < row.length; p++) {
                    double centered = row[p] - means[v][p];
                    row[p] = type == ScaleType.STANDARDIZE ? centered / deviations[v][p] : centered;
                }
            }
        }
        return grid.withData(data);
    }

    public ScaleType getType() {
        return type;
    }

    public SpatialFrame getFrame() {
        return frame;
    }

    /// @return the base-period mean of a variable at a point
    public double mean(int variable, int point) {
        return means[variable][point];
    }

    /// @return the base-period deviation of a variable at a point
    public double deviation(int variable, int point) {
        return deviations[variable][point];
    }
}
