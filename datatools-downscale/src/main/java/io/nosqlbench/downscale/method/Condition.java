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

import java.util.Locale;
import java.util.Objects;

/// Restricts which training rows a model is fitted on, by comparing the
/// predictand with a threshold.
///
/// `Condition.gt(0)` keeps only rows whose predictand exceeds zero, which is
/// how an amount model is fitted on wet days only.
///
/// @param operator the comparison
/// @param threshold the value compared against
public record Condition(Operator operator, double threshold) {

    /// Comparison operators.
    public enum Operator {
        GT, GE, LT, LE;

        /// Parses an operator name such as "GT", case-insensitively.
        public static Operator parse(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new DownscaleConfigurationException("unknown condition '" + name + "', expected one of GT, GE, LT, LE", e);
            }
        }
    }

    public Condition {
        Objects.requireNonNull(operator, "operator cannot be null");
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold cannot be NaN");
        }
    }

    public static Condition gt(double threshold) {
        return new Condition(Operator.GT, threshold);
    }

    /// Tests one predictand value. Missing values never pass.
    ///
    /// @param value the predictand value
    /// @return true if the row is kept
    public boolean test(double value) {
        if (Double.isNaN(value)) {
            return false;
        }
        switch (operator) {
            case GT:
                return value > threshold;
            case GE:
                return value >= threshold;
            case LT:
                return value < threshold;
            case LE:
                return value <= threshold;
            default:
                throw new IllegalStateException("unhandled operator " + operator);
        }
    }
}
