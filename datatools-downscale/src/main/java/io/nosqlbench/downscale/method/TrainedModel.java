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

/// A downscaling model fitted on one training design.
///
/// Models hold one fit per predictand point and predict every point of the
/// training predictand. They are not persisted.
public interface TrainedModel {

    /// @return the method and hyperparameters this model was trained with
    DownscaleMethod getMethod();

    /// Predicts the predictand for a design built with the training transform.
    ///
    /// @param design the prediction design
    /// @param simulate whether to draw from the fitted law instead of returning its mean;
    ///                 methods without a predictive law ignore it
    /// @param rng the random source used when simulating
    /// @return a one-variable grid on the design's dates and the training predictand points
    Grid predict(DesignMatrix design, boolean simulate, UniformRandomProvider rng);
}
