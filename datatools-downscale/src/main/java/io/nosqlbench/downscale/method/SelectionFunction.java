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

import io.nosqlbench.downscale.DownscaleConfigurationException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Locale;

/// How the predictand values of several analogs are reduced to one prediction.
public enum SelectionFunction {

    /// Arithmetic mean of the analog values.
    MEAN("mean") {
        @Override
        double reduce(double[] values, double[] distances) {
            return StatUtils.mean(values);
        }
    },

    /// Mean weighted by inverse distance. Analogs at distance zero take all
    /// the weight, shared equally.
    WMEAN("wmean") {
        @Override
        double reduce(double[] values, double[] distances) {
            double exactSum = 0.0;
            int exactCount = 0;
            for (int i = 0; i < values.length; i++) {
                if (distances[i] == 0.0) {
                    exactSum += values[i];
                    exactCount++;
                }
            }
            if (exactCount > 0) {
                return exactSum / exactCount;
            }
            double weighted = 0.0;
            double weights = 0.0;
            for (int i = 0; i < values.length; i++) {
                double w = 1.0 / distances[i];
                weighted += w * values[i];
                weights += w;
            }
            return weighted / weights;
        }
    },

    MAX("max") {
        @Override
        double reduce(double[] values, double[] distances) {
            return StatUtils.max(values);
        }
    },

    MIN("min") {
        @Override
        double reduce(double[] values, double[] distances) {
            return StatUtils.min(values);
        }
    },

    MEDIAN("median") {
        @Override
        double reduce(double[] values, double[] distances) {
            return new Median().evaluate(values);
        }
    };

    private final String label;

    SelectionFunction(String label) {
        this.label = label;
    }

    abstract double reduce(double[] values, double[] distances);

    /// Reduces analog values to one prediction, skipping missing values.
    ///
    /// @param values predictand values of the analogs, nearest first
    /// @param distances predictor-space distances of the analogs
    /// @return the prediction, or NaN if every analog value is missing
    public double apply(double[] values, double[] distances) {
        if (values.length != distances.length) {
            throw new IllegalArgumentException("values and distances differ in length");
        }
        int present = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                present++;
            }
        }
        if (present == 0) {
            return Double.NaN;
        }
        if (present == 1 || values.length == 1) {
            for (double value : values) {
                if (!Double.isNaN(value)) {
                    return value;
                }
            }
        }
        double[] kept = new double[present];
        double[] keptDistances = new double[present];
        int k = 0;
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                kept[k] = values[i];
                keptDistances[k] = distances[i];
                k++;
            }
        }
        return reduce(kept, keptDistances);
    }

    public String getLabel() {
        return label;
    }

    /// Parses "mean", "wmean", "max", "min" or "median", case-insensitively.
    public static SelectionFunction parse(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (SelectionFunction function : values()) {
                if (function.label.equals(normalized)) {
                    return function;
                }
            }
        }
        throw new DownscaleConfigurationException("unknown analog selection function '" + name
            + "', expected one of mean, wmean, max, min, median");
    }
}
