package io.nosqlbench.downscale.cv;

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

import io.nosqlbench.downscale.folds.Fold;
import io.nosqlbench.downscale.grid.Grid;

import java.util.List;
import java.util.Objects;

/// Output of a cross-validation run.
///
/// @param prediction predictions for every test step, in chronological order
/// @param binary calibrated 0/1 occurrence for binomial models, otherwise null
/// @param folds the folds that were run
public record CrossValidationResult(Grid prediction, Grid binary, List<Fold> folds) {
    public CrossValidationResult {
        Objects.requireNonNull(prediction, "prediction cannot be null");
        folds = List.copyOf(folds);
    }

    public boolean hasBinary() {
        return binary != null;
    }
}
