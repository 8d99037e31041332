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

import java.util.Objects;

/// Entry points for training a downscaling model and predicting with it.
///
/// ```java
/// TrainedModel model = DownscaleTrainer.train(trainingDesign, new DownscaleMethod.Analogs(1, SelectionFunction.MEAN));
/// Grid prediction = DownscaleTrainer.predict(model, predictionDesign, false, RandomStreams.create(42));
/// ```
public final class DownscaleTrainer {

    private static final Logger logger = LogManager.getLogger(DownscaleTrainer.class);

    private DownscaleTrainer() {
    }

    /// Trains a model.
    ///
    /// @param design the training design, carrying the predictand
    /// @param method the method and its hyperparameters
    /// @return the trained model
    public static TrainedModel train(DesignMatrix design, DownscaleMethod method) {
        Objects.requireNonNull(design, "design cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        logger.debug("training {} on {}", method, design);
        return method.train(design);
    }

    /// Predicts with a trained model.
    ///
    /// @param model the trained model
    /// @param design the prediction design, built with the model's training transform
    /// @param simulate whether to simulate from the fitted law
    /// @param rng random source for simulation
    /// @return the prediction on the design's dates
    public static Grid predict(TrainedModel model, DesignMatrix design, boolean simulate, UniformRandomProvider rng) {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(design, "design cannot be null");
        logger.debug("predicting {} with {}{}", design, model.getMethod(), simulate ? " (simulated)" : "");
        return model.predict(design, simulate, rng);
    }
}
