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
import io.nosqlbench.downscale.grid.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The mapping from a standardized predictor grid to design-matrix columns,
/// fixed at training time.
///
/// A transform is a sequence of blocks. A raw block contributes every grid
/// point of its variables as a column; an EOF block contributes the scores of
/// its fitted [PrincipalComponents].
public final class PredictorTransform {

    /// One group of design-matrix columns.
    ///
    /// @param variables the variables whose points feed this block
    /// @param components the fitted components, or null for raw columns
    public record Block(List<String> variables, PrincipalComponents components) {
        public Block {
            variables = List.copyOf(variables);
        }

        public boolean isRaw() {
            return components == null;
        }

        int columnCount(int pointCount) {
            return isRaw() ? variables.size() * pointCount : components.componentCount();
        }
    }

    private final List<String> variables;
    private final int pointCount;
    private final List<Block> blocks;

    PredictorTransform(List<String> variables, int pointCount, List<Block> blocks) {
        this.variables = List.copyOf(variables);
        this.pointCount = pointCount;
        this.blocks = List.copyOf(blocks);
    }

    /// Builds the design-matrix columns for a standardized predictor grid.
    ///
    /// @param grid a grid holding at least the transform's variables over the training points
    /// @return the predictor matrix as `[time][column]`
    public double[][] apply(Grid grid) {
        Objects.requireNonNull(grid, "grid cannot be null");
        if (!grid.getVarNames().containsAll(variables)) {
            List<String> missing = new ArrayList<>(variables);
            missing.removeAll(grid.getVarNames());
            throw new DownscaleConfigurationException("predictor data lacks the training variables " + missing);
        }
        if (grid.pointCount() != pointCount) {
            throw new DownscaleConfigurationException("predictor data has " + grid.pointCount()
                + " grid points but the model was trained on " + pointCount);
        }
        int times = grid.timeCount();
        double[][] out = new double[times][columnCount()];
        int offset = 0;
        for (Block block : blocks) {
            double[][] features = features(grid, block.variables());
            double[][] columns = block.isRaw() ? features : block.components().project(features);
            int width = block.columnCount(pointCount);
            for (int t = 0; t < times; t++) {
                System.arraycopy(columns[t], 0, out[t], offset, width);
            }
            offset += width;
        }
        return out;
    }

    /// Concatenates the points of the given variables into one feature row per time step.
    static double[][] features(Grid grid, List<String> vars) {
        int points = grid.pointCount();
        double[][] features = new double[grid.timeCount()][vars.size() * points];
        for (int i = 0; i < vars.size(); i++) {
            int v = grid.varIndex(vars.get(i));
            for (int t = 0; t < grid.timeCount(); t++) {
                for (int p = 0; p < points; p++) {
                    double value = grid.get(v, t, p);
                    if (Double.isNaN(value)) {
                        throw new DownscaleConfigurationException("predictor " + vars.get(i) + " is missing at "
                            + grid.getRefDates().get(t) + ", point " + grid.getPointIds().get(p));
                    }
                    features[t][i * points + p] = value;
                }
            }
        }
        return features;
    }

    public int columnCount() {
        return blocks.stream().mapToInt(b -> b.columnCount(pointCount)).sum();
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<Block> getBlocks() {
        return blocks;
    }

    public boolean usesPrincipalComponents() {
        return blocks.stream().anyMatch(b -> !b.isRaw());
    }
}
