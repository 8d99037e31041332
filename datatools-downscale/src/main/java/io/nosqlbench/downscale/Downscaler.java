package io.nosqlbench.downscale;

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

import io.nosqlbench.downscale.cv.CrossValidationResult;
import io.nosqlbench.downscale.cv.CrossValidator;
import io.nosqlbench.downscale.folds.Fold;
import io.nosqlbench.downscale.folds.FoldPlan;
import io.nosqlbench.downscale.folds.FoldPlanner;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.grid.Scaling;
import io.nosqlbench.downscale.method.Condition;
import io.nosqlbench.downscale.method.DownscaleMethod;
import io.nosqlbench.downscale.method.DownscaleTrainer;
import io.nosqlbench.downscale.method.Family;
import io.nosqlbench.downscale.method.RandomStreams;
import io.nosqlbench.downscale.method.TrainedModel;
import io.nosqlbench.downscale.occurrence.OccurrenceAmountCombiner;
import io.nosqlbench.downscale.occurrence.OccurrenceDecomposer;
import io.nosqlbench.downscale.occurrence.OccurrenceSplit;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import io.nosqlbench.downscale.prepare.PreparationSettings;
import io.nosqlbench.downscale.prepare.PredictorPreparation;
import io.nosqlbench.downscale.prepare.SpatialPredictors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/// Perfect-prog downscaling of a local predictand from large-scale predictors.
///
/// # Pipeline
///
/// ```
///   validate dates, variables, fold plan
///        │
///        ├── nPcs set ──► pooled principal components of all variables
///        │
///        ├── glm ──► split y into occurrence (0/1) and amount (NaN when dry)
///        │
///        ├── no cross-validation:
///        │      scale x and newdata on x ──► prepare ──► train ──► predict newdata
///        │
///        └── cross-validation:
///               per fold: scale on the training years ──► prepare ──► train ──► predict test years
/// ```
///
/// For `glm` the occurrence is a binomial/logit model and the amount a
/// gamma/log model fitted on wet steps only. The two predictions are
/// recombined by [OccurrenceAmountCombiner].
///
/// Validation runs before any fitting: a date mismatch between `x` and `y`
/// raises a [DateMismatchException] and nothing is trained.
public final class Downscaler {

    private static final Logger logger = LogManager.getLogger(Downscaler.class);

    private Downscaler() {
    }

    /// Downscales `y` from `x`.
    ///
    /// Without cross-validation the model is trained on all of `x` and `y`
    /// and predicts `newdata`. With cross-validation `newdata` must be `x`
    /// itself, and the result covers the union of the test folds.
    ///
    /// @param y the predictand, one variable, on the dates of `x`
    /// @param x the predictor fields
    /// @param newdata the predictor fields to predict from, with the variables of `x`
    /// @param options method and run options
    /// @return the predicted series, one point per predictand point
    /// @throws DateMismatchException if `x` and `y` are not on the same dates
    /// @throws DownscaleConfigurationException for invalid options or inputs
    /// @throws ModelFitException if a model cannot be fitted
    public static Grid downscale(Grid y, Grid x, Grid newdata, DownscaleOptions options) {
        Objects.requireNonNull(y, "y cannot be null");
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(newdata, "newdata cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        if (!x.getRefDates().equals(y.getRefDates())) {
            throw new DateMismatchException(x.getRefDates(), y.getRefDates());
        }
        if (!newdata.getVarNames().equals(x.getVarNames())) {
            throw new DownscaleConfigurationException("newdata variables " + newdata.getVarNames()
                + " do not match predictor variables " + x.getVarNames());
        }
        FoldPlan plan = options.foldPlan();
        boolean crossValidating = !(plan instanceof FoldPlan.None);
        if (crossValidating && !newdata.equals(x)) {
            throw new DownscaleConfigurationException(
                "cross-validation predicts the training predictors; newdata must be the same grid as x");
        }

        SpatialPredictors spatial = options.nPcs() == null
            ? null
            : SpatialPredictors.combined(x.getVarNames(), options.nPcs());
        PreparationSettings settings = new PreparationSettings(List.of(), spatial, options.scaleType(),
            options.spatialFrame());

        logger.info("downscaling {} from {} with {}", y, x, options);
        Grid prediction = crossValidating
            ? crossValidate(y, x, FoldPlanner.plan(plan, x.getRefDates()), settings, options)
            : trainAndPredict(y, x, newdata, settings, options);
        logger.info("downscaling produced {}", prediction);
        return prediction;
    }

    /// The method used for analogs and lm runs.
    static DownscaleMethod singleMethod(DownscaleOptions options) {
        switch (options.method()) {
            case ANALOGS:
                return new DownscaleMethod.Analogs(options.nAnalogs(), options.selectionFunction());
            case LM:
                return new DownscaleMethod.Lm();
            default:
                throw new IllegalStateException("no single model for " + options.method().getLabel());
        }
    }

    /// Binomial/logit model of the 0/1 occurrence.
    static DownscaleMethod.Glm occurrenceMethod() {
        return new DownscaleMethod.Glm(Family.BINOMIAL);
    }

    /// Gamma/log model of the amount, fitted on positive amounts.
    static DownscaleMethod.Glm amountMethod() {
        return new DownscaleMethod.Glm(Family.GAMMA, Condition.gt(0.0));
    }

    private static Grid trainAndPredict(Grid y, Grid x, Grid newdata, PreparationSettings settings,
                                        DownscaleOptions options) {
        Scaling scaling = Scaling.fit(x, settings.scaleType(), settings.spatialFrame());
        Grid xScaled = scaling.apply(x);
        Grid newScaled = scaling.apply(newdata);

        if (options.method() != DownscaleMethod.Kind.GLM) {
            return fitAndPredict(xScaled, y, newScaled, settings, singleMethod(options), options.simulate(),
                options.seed());
        }

        OccurrenceSplit split = OccurrenceDecomposer.decompose(y, options.wetThreshold(), options.simulate());
        logger.info("occurrence model on threshold {}", split.threshold());
        Grid occurrence = fitAndPredict(xScaled, split.occurrence(), newScaled, settings, occurrenceMethod(),
            options.simulate(), options.seed());
        logger.info("amount model on wet steps");
        Grid amount = fitAndPredict(xScaled, split.amount(), newScaled, settings, amountMethod(),
            options.simulate(), options.seed() + 1);
        return OccurrenceAmountCombiner.combine(occurrence, amount, split.occurrence(), occurrence,
            options.wetThreshold(), options.simulate());
    }

    private static Grid fitAndPredict(Grid xScaled, Grid y, Grid newScaled, PreparationSettings settings,
                                      DownscaleMethod method, boolean simulate, long seed) {
        DesignMatrix training = PredictorPreparation.prepareData(xScaled, y, settings.variables(),
            settings.spatialPredictors());
        DesignMatrix prediction = PredictorPreparation.prepareNewData(newScaled, training);
        TrainedModel model = DownscaleTrainer.train(training, method);
        return DownscaleTrainer.predict(model, prediction, simulate, RandomStreams.stream(seed, 0));
    }

    private static Grid crossValidate(Grid y, Grid x, List<Fold> folds, PreparationSettings settings,
                                      DownscaleOptions options) {
        logger.info("cross-validating over {} folds", folds.size());
        if (options.method() != DownscaleMethod.Kind.GLM) {
            return new CrossValidator(options.parallelism(), options.seed())
                .crossValidate(x, y, folds, settings, singleMethod(options), options.simulate())
                .prediction();
        }

        OccurrenceSplit split = OccurrenceDecomposer.decompose(y, options.wetThreshold(), options.simulate());
        CrossValidationResult occurrence = new CrossValidator(options.parallelism(), options.seed())
            .crossValidate(x, split.occurrence(), folds, settings, occurrenceMethod(), options.simulate());
        CrossValidationResult amount = new CrossValidator(options.parallelism(), options.seed() + 1)
            .crossValidate(x, split.amount(), folds, settings, amountMethod(), options.simulate());
        return OccurrenceAmountCombiner.gate(occurrence.binary(), amount.prediction(), options.wetThreshold(),
            options.simulate());
    }
}
