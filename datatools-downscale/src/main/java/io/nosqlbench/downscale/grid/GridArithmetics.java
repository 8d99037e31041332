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

import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/// Elementwise combination of two grids with identical axes.
public final class GridArithmetics {

    /// Elementwise operators.
    public enum Operator {
        ADD((a, b) -> a + b),
        SUBTRACT((a, b) -> a - b),
        MULTIPLY((a, b) -> a * b),
        DIVIDE((a, b) -> a / b);

        private final DoubleBinaryOperator function;

        Operator(DoubleBinaryOperator function) {
            this.function = function;
        }

        public double apply(double a, double b) {
            return function.applyAsDouble(a, b);
        }
    }

    private GridArithmetics() {
    }

    /// Combines two grids value by value. The result takes its axes from `a`.
    ///
    /// @param a the left operand
    /// @param b the right operand
    /// @param operator the elementwise operator
    /// @return the combined grid
    /// @throws IllegalArgumentException if the grids differ in dates, variable count or points
    public static Grid apply(Grid a, Grid b, Operator operator) {
        Objects.requireNonNull(operator, "operator cannot be null");
        requireSameShape(a, b);
        double[][][] out = new double[a.varCount()][a.timeCount()][a.pointCount()];
        for (int v = 0; v < a.varCount(); v++) {
            for (int t = 0; t < a.timeCount(); t++) {
                for (int p = 0; p < a.pointCount(); p++) {
                    out[v][t][p] = operator.apply(a.get(v, t, p), b.get(v, t, p));
                }
            }
        }
        return a.withData(out);
    }

    static void requireSameShape(Grid a, Grid b) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        if (!a.getRefDates().equals(b.getRefDates())) {
            throw new IllegalArgumentException("grids have different dates: " + a + " vs " + b);
        }
        if (a.varCount() != b.varCount() || a.pointCount() != b.pointCount()) {
            throw new IllegalArgumentException("grids have different shapes: " + a + " vs " + b);
        }
    }
}
