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

import io.nosqlbench.downscale.grid.ScaleType;
import io.nosqlbench.downscale.grid.SpatialFrame;

import java.util.List;
import java.util.Objects;

/// How predictor grids are scaled and turned into design matrices.
///
/// @param variables predictor variables to use; empty means all
/// @param spatialPredictors EOF reduction, or null for raw standardized fields
/// @param scaleType the scaling applied before preparation
/// @param spatialFrame whether grid points share scaling parameters
public record PreparationSettings(List<String> variables, SpatialPredictors spatialPredictors,
                                  ScaleType scaleType, SpatialFrame spatialFrame) {

    public PreparationSettings {
        variables = variables == null ? List.of() : List.copyOf(variables);
        Objects.requireNonNull(scaleType, "scaleType cannot be null");
        Objects.requireNonNull(spatialFrame, "spatialFrame cannot be null");
    }

    /// All variables, standardized per grid box, with optional EOF reduction.
    public static PreparationSettings standardized(SpatialPredictors spatialPredictors) {
        return new PreparationSettings(List.of(), spatialPredictors, ScaleType.STANDARDIZE, SpatialFrame.GRIDBOX);
    }
}
