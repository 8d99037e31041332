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

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/// Predictor columns bound to their dates and, for training data, to the
/// predictand values.
///
/// Training designs come from [PredictorPreparation#prepareData] and carry
/// the predictand; prediction designs come from
/// [PredictorPreparation#prepareNewData] and do not.
public final class DesignMatrix {

    private final List<LocalDate> dates;
    private final double[][] predictors;
    private final double[][] predictand;
    private final String predictandVar;
    private final List<String> predictandPoints;
    private final PredictorTransform transform;

    DesignMatrix(List<LocalDate> dates, double[][] predictors, double[][] predictand, String predictandVar,
                 List<String> predictandPoints, PredictorTransform transform) {
        this.dates = List.copyOf(dates);
        this.predictors = Objects.requireNonNull(predictors, "predictors cannot be null");
        this.predictand = predictand;
        this.predictandVar = Objects.requireNonNull(predictandVar, "predictandVar cannot be null");
        this.predictandPoints = List.copyOf(predictandPoints);
        this.transform = Objects.requireNonNull(transform, "transform cannot be null");
        if (predictors.length != dates.size()) {
            throw new IllegalArgumentException("predictor rows (" + predictors.length + ") do not match dates ("
                + dates.size() + ")");
        }
        if (predictand != null && predictand.length != dates.size()) {
            throw new IllegalArgumentException("predictand rows (" + predictand.length + ") do not match dates ("
                + dates.size() + ")");
        }
    }

    public List<LocalDate> getDates() {
        return dates;
    }

    public int rowCount() {
        return predictors.length;
    }

    public int columnCount() {
        return transform.columnCount();
    }

    /// @return one predictor row, not copied
    public double[] predictorRow(int row) {
        return predictors[row];
    }

    /// @return a copy of the predictor matrix as `[time][column]`
    public double[][] predictors() {
        double[][] copy = new double[predictors.length][];
        for (int t = 0; t < copy.length; t++) {
            copy[t] = predictors[t].clone();
        }
        return copy;
    }

    public boolean hasPredictand() {
        return predictand != null;
    }

    /// Returns the predictand series of one point.
    ///
    /// @param point the predictand point index
    /// @return the observed values, `NaN` where masked
    /// @throws IllegalStateException if this is a prediction design
    public double[] predictand(int point) {
        if (predictand == null) {
            throw new IllegalStateException("a prediction design has no predictand");
        }
        double[] out = new double[predictand.length];
        for (int t = 0; t < out.length; t++) {
            out[t] = predictand[t][point];
        }
        return out;
    }

    public String getPredictandVar() {
        return predictandVar;
    }

    public List<String> getPredictandPoints() {
        return predictandPoints;
    }

    public PredictorTransform getTransform() {
        return transform;
    }

    @Override
    public String toString() {
        return "DesignMatrix[rows=" + rowCount() + ", columns=" + columnCount()
            + ", predictand=" + (predictand == null ? "none" : predictandVar + "@" + predictandPoints.size()) + "]";
    }
}
