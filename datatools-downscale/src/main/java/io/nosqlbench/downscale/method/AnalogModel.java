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

import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// Analog model: the training design itself.
///
/// For each prediction day the `n` training days closest in predictor space
/// (Euclidean distance) are found, and the predictand values observed on
/// those days are combined with the [SelectionFunction]. Ties are broken by
/// the earlier training day.
public final class AnalogModel implements TrainedModel {

    private static final Logger logger = LogManager.getLogger(AnalogModel.class);

    private final DownscaleMethod.Analogs method;
    private final DesignMatrix training;

    AnalogModel(DownscaleMethod.Analogs method, DesignMatrix training) {
        this.method = Objects.requireNonNull(method, "method cannot be null");
        this.training = Objects.requireNonNull(training, "training cannot be null");
        if (!training.hasPredictand()) {
            throw new IllegalArgumentException("analogs need a training design with a predictand");
        }
        if (training.rowCount() < method.nAnalogs()) {
            throw new IllegalArgumentException("cannot select " + method.nAnalogs() + " analogs from "
                + training.rowCount() + " training days");
        }
    }

    @Override
    public DownscaleMethod.Analogs getMethod() {
        return method;
    }

    /// Pair of training index and distance, ordered by distance then index.
    private record IndexDistancePair(int index, double distance) implements Comparable<IndexDistancePair> {
        @Override
        public int compareTo(IndexDistancePair other) {
            int byDistance = Double.compare(distance, other.distance);
            return byDistance != 0 ? byDistance : Integer.compare(index, other.index);
        }
    }

    /// Finds the nearest training rows of one predictor row.
    ///
    /// @param query the predictor row
    /// @return the analogs, nearest first
    IndexDistancePair[] findAnalogs(double[] query) {
        int rows = training.rowCount();
        IndexDistancePair[] pairs = new IndexDistancePair[rows];
        for (int r = 0; r < rows; r++) {
            pairs[r] = new IndexDistancePair(r, euclidean(query, training.predictorRow(r)));
        }
        Arrays.sort(pairs);
        return Arrays.copyOf(pairs, method.nAnalogs());
    }

    private static double euclidean(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("predictor rows differ in length: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }

    /// Returns the training row indices of the analogs of each prediction row.
    ///
    /// @param design the prediction design
    /// @return `[row][analog]` training indices, nearest first
    public int[][] analogIndices(DesignMatrix design) {
        int[][] out = new int[design.rowCount()][];
        for (int t = 0; t < out.length; t++) {
            out[t] = Arrays.stream(findAnalogs(design.predictorRow(t))).mapToInt(IndexDistancePair::index).toArray();
        }
        return out;
    }

    @Override
    public Grid predict(DesignMatrix design, boolean simulate, UniformRandomProvider rng) {
        Objects.requireNonNull(design, "design cannot be null");
        if (design.columnCount() != training.columnCount()) {
            throw new IllegalArgumentException("prediction design has " + design.columnCount()
                + " columns, training design has " + training.columnCount());
        }
        int points = training.getPredictandPoints().size();
        double[][] observed = new double[points][];
        for (int p = 0; p < points; p++) {
            observed[p] = training.predictand(p);
        }
        double[][] out = new double[design.rowCount()][points];
        for (int t = 0; t < design.rowCount(); t++) {
            IndexDistancePair[] analogs = findAnalogs(design.predictorRow(t));
            double[] distances = new double[analogs.length];
            for (int a = 0; a < analogs.length; a++) {
                distances[a] = analogs[a].distance();
            }
            for (int p = 0; p < points; p++) {
                double[] values = new double[analogs.length];
                for (int a = 0; a < analogs.length; a++) {
                    values[a] = observed[p][analogs[a].index()];
                }
                out[t][p] = method.selectionFunction().apply(values, distances);
            }
        }
        logger.debug("predicted {} days from {} analogs each", design.rowCount(), method.nAnalogs());
        return Grid.of(design.getDates(), training.getPredictandVar(), training.getPredictandPoints(), out);
    }
}
