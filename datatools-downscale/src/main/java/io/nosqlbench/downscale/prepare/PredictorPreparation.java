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

import io.nosqlbench.downscale.DateMismatchException;
import io.nosqlbench.downscale.DownscaleConfigurationException;
import io.nosqlbench.downscale.grid.Grid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Builds design matrices from (already standardized) predictor grids.
///
/// ## Training and prediction
///
/// ```
///   x (train), y ──► prepareData ──► DesignMatrix ──┐ transform fitted here
///                                                   │
///   newdata ────────────────────────► prepareNewData ──► DesignMatrix (no predictand)
/// ```
///
/// Principal components are fitted in [#prepareData] only. [#prepareNewData]
/// projects onto the training components with the training centering, so a
/// prediction period never influences the transform.
public final class PredictorPreparation {

    private static final Logger logger = LogManager.getLogger(PredictorPreparation.class);

    private PredictorPreparation() {
    }

    /// Builds a training design.
    ///
    /// @param x the standardized predictor grid
    /// @param y the predictand grid (one variable, one or more points) on the same dates as x
    /// @param variables the predictor variables to use; empty means all variables of x
    /// @param spatialPredictors EOF reduction spec, or null for raw fields
    /// @return the training design
    /// @throws DateMismatchException if x and y dates differ
    /// @throws DownscaleConfigurationException if variables are unknown or do not match the spec
    public static DesignMatrix prepareData(Grid x, Grid y, List<String> variables, SpatialPredictors spatialPredictors) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        if (!x.getRefDates().equals(y.getRefDates())) {
            throw new DateMismatchException(x.getRefDates(), y.getRefDates());
        }
        if (y.varCount() != 1) {
            throw new DownscaleConfigurationException("the predictand must hold exactly one variable, found "
                + y.getVarNames());
        }
        List<String> selected = (variables == null || variables.isEmpty()) ? x.getVarNames() : variables;
        if (!x.getVarNames().containsAll(selected)) {
            List<String> unknown = new ArrayList<>(selected);
            unknown.removeAll(x.getVarNames());
            throw new DownscaleConfigurationException("predictor variables " + unknown + " are not in " + x.getVarNames());
        }

        List<PredictorTransform.Block> blocks = new ArrayList<>();
        if (spatialPredictors == null) {
            for (String var : selected) {
                blocks.add(new PredictorTransform.Block(List.of(var), null));
            }
        } else {
            spatialPredictors.requireVariables(selected);
            for (String var : selected) {
                if (!spatialPredictors.isCombined(var)) {
                    int n = spatialPredictors.getPerVariable().get(var);
                    PrincipalComponents pcs = PrincipalComponents.fit(PredictorTransform.features(x, List.of(var)), n);
                    blocks.add(new PredictorTransform.Block(List.of(var), pcs));
                }
            }
            List<String> combined = new ArrayList<>();
            for (String var : selected) {
                if (spatialPredictors.isCombined(var)) {
                    combined.add(var);
                }
            }
            if (!combined.isEmpty()) {
                PrincipalComponents pcs = PrincipalComponents.fit(PredictorTransform.features(x, combined),
                    spatialPredictors.getCombinedCount());
                logger.debug("combined EOFs of {} explain {}", combined, pcs.getExplainedVariance());
                blocks.add(new PredictorTransform.Block(combined, pcs));
            }
        }

        PredictorTransform transform = new PredictorTransform(selected, x.pointCount(), blocks);
        DesignMatrix design = new DesignMatrix(x.getRefDates(), transform.apply(x), y.values(0),
            y.getVarNames().get(0), y.getPointIds(), transform);
        logger.debug("prepared training {}", design);
        return design;
    }

    /// Builds a prediction design by applying a training design's transform.
    ///
    /// @param newdata the standardized predictor grid to predict for
    /// @param training the training design
    /// @return the prediction design, aligned on newdata's dates
    public static DesignMatrix prepareNewData(Grid newdata, DesignMatrix training) {
        Objects.requireNonNull(newdata, "newdata cannot be null");
        Objects.requireNonNull(training, "training cannot be null");
        PredictorTransform transform = training.getTransform();
        DesignMatrix design = new DesignMatrix(newdata.getRefDates(), transform.apply(newdata), null,
            training.getPredictandVar(), training.getPredictandPoints(), transform);
        logger.debug("prepared prediction {}", design);
        return design;
    }
}
