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

import io.nosqlbench.downscale.DateMismatchException;
import io.nosqlbench.downscale.folds.Fold;
import io.nosqlbench.downscale.grid.BinaryGrids;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.grid.Scaling;
import io.nosqlbench.downscale.method.DownscaleMethod;
import io.nosqlbench.downscale.method.DownscaleTrainer;
import io.nosqlbench.downscale.method.Family;
import io.nosqlbench.downscale.method.RandomStreams;
import io.nosqlbench.downscale.method.TrainedModel;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import io.nosqlbench.downscale.prepare.PreparationSettings;
import io.nosqlbench.downscale.prepare.PredictorPreparation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Runs a downscaling method over cross-validation folds.
///
/// ## Per-fold cycle
///
/// ```
///   x[train] ──► Scaling.fit ──► scale x[train], x[test]
///                                     │
///   y[train] ──► prepareData(x[train]) ──► train ──► predict(prepareNewData(x[test]))
/// ```
///
/// Everything fitted from data (scaling, principal components, the model)
/// is fitted on the fold's training period only. For binomial models the
/// fold also calibrates a 0/1 occurrence: the threshold reproduces the
/// training-period wet frequency on the model's own training-period
/// prediction.
///
/// ## Concurrency
///
/// With a parallelism above 1 the folds run on a fixed thread pool. Each
/// fold draws from its own random stream derived from the seed and the fold
/// number, and results are collected in fold order, so the output does not
/// depend on the parallelism. The first failing fold aborts the run and its
/// exception is rethrown.
public final class CrossValidator {

    private static final Logger logger = LogManager.getLogger(CrossValidator.class);

    private final int parallelism;
    private final long seed;

    /// @param parallelism number of folds run at once, at least 1
    /// @param seed base seed of the per-fold random streams
    public CrossValidator(int parallelism, long seed) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.seed = seed;
    }

    /// Output of one fold.
    private record FoldOutput(Fold fold, Grid prediction, Grid binary) {
    }

    /// Cross-validates a method.
    ///
    /// @param x the raw (unscaled) predictor grid
    /// @param y the predictand on the same dates
    /// @param folds the folds, from [io.nosqlbench.downscale.folds.FoldPlanner]
    /// @param settings scaling and predictor preparation
    /// @param method the downscaling method
    /// @param simulate whether predictions are simulated
    /// @return predictions over the union of the test periods
    public CrossValidationResult crossValidate(Grid x, Grid y, List<Fold> folds, PreparationSettings settings,
                                               DownscaleMethod method, boolean simulate) {
        Objects.requireNonNull(x, "x cannot be null");
        Objects.requireNonNull(y, "y cannot be null");
        Objects.requireNonNull(folds, "folds cannot be null");
        Objects.requireNonNull(settings, "settings cannot be null");
        Objects.requireNonNull(method, "method cannot be null");
        if (!x.getRefDates().equals(y.getRefDates())) {
            throw new DateMismatchException(x.getRefDates(), y.getRefDates());
        }
        if (folds.isEmpty()) {
            throw new IllegalArgumentException("cross-validation needs at least one fold");
        }
        logger.info("cross-validating {} over {} folds{}", method, folds.size(),
            parallelism > 1 ? " with parallelism " + parallelism : "");

        List<FoldOutput> outputs = parallelism == 1 || folds.size() == 1
            ? runSequentially(x, y, folds, settings, method, simulate)
            : runInParallel(x, y, folds, settings, method, simulate);
        return assemble(y, outputs);
    }

    private List<FoldOutput> runSequentially(Grid x, Grid y, List<Fold> folds, PreparationSettings settings,
                                             DownscaleMethod method, boolean simulate) {
        List<FoldOutput> outputs = new ArrayList<>(folds.size());
        for (Fold fold : folds) {
            outputs.add(runFold(x, y, fold, settings, method, simulate));
        }
        return outputs;
    }

    private List<FoldOutput> runInParallel(Grid x, Grid y, List<Fold> folds, PreparationSettings settings,
                                           DownscaleMethod method, boolean simulate) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, folds.size()));
        try {
            List<Future<FoldOutput>> futures = new ArrayList<>(folds.size());
            for (Fold fold : folds) {
                futures.add(executor.submit(() -> runFold(x, y, fold, settings, method, simulate)));
            }
            List<FoldOutput> outputs = new ArrayList<>(folds.size());
            for (Future<FoldOutput> future : futures) {
                outputs.add(future.get());
            }
            return outputs;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("cross-validation fold failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("cross-validation was interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private FoldOutput runFold(Grid x, Grid y, Fold fold, PreparationSettings settings,
                               DownscaleMethod method, boolean simulate) {
        logger.debug("running {}", fold);
        Grid xTrain = x.subsetIndices(fold.trainIndices());
        Grid xTest = x.subsetIndices(fold.testIndices());
        Grid yTrain = y.subsetIndices(fold.trainIndices());

        Scaling scaling = Scaling.fit(xTrain, settings.scaleType(), settings.spatialFrame());
        Grid xTrainScaled = scaling.apply(xTrain);
        DesignMatrix training = PredictorPreparation.prepareData(xTrainScaled, yTrain, settings.variables(),
            settings.spatialPredictors());
        DesignMatrix testing = PredictorPreparation.prepareNewData(scaling.apply(xTest), training);

        TrainedModel model = DownscaleTrainer.train(training, method);
        Grid prediction = DownscaleTrainer.predict(model, testing, simulate, RandomStreams.stream(seed, fold.number()));

        Grid binary = null;
        if (method instanceof DownscaleMethod.Glm && ((DownscaleMethod.Glm) method).family() == Family.BINOMIAL) {
            if (simulate) {
                binary = prediction;
            } else {
                DesignMatrix reference = PredictorPreparation.prepareNewData(xTrainScaled, training);
                Grid referencePrediction = DownscaleTrainer.predict(model, reference, false, null);
                binary = BinaryGrids.calibrated(prediction, yTrain, referencePrediction);
            }
        }
        return new FoldOutput(fold, prediction, binary);
    }

    private static CrossValidationResult assemble(Grid y, List<FoldOutput> outputs) {
        TreeSet<Integer> covered = new TreeSet<>();
        for (FoldOutput output : outputs) {
            for (int index : output.fold().testIndices()) {
                covered.add(index);
            }
        }
        int[] order = covered.stream().mapToInt(Integer::intValue).toArray();
        int[] position = new int[y.timeCount()];
        for (int i = 0; i < order.length; i++) {
            position[order[i]] = i;
        }
        List<LocalDate> dates = new ArrayList<>(order.length);
        for (int index : order) {
            dates.add(y.getRefDates().get(index));
        }

        boolean hasBinary = outputs.get(0).binary() != null;
        double[][] predicted = new double[order.length][];
        double[][] binary = hasBinary ? new double[order.length][] : null;
        for (FoldOutput output : outputs) {
            int[] test = output.fold().testIndices();
            double[][] foldValues = output.prediction().values(0);
            double[][] foldBinary = hasBinary ? output.binary().values(0) : null;
            for (int i = 0; i < test.length; i++) {
                predicted[position[test[i]]] = foldValues[i];
                if (hasBinary) {
                    binary[position[test[i]]] = foldBinary[i];
                }
            }
        }
        String var = y.getVarNames().get(0);
        Grid prediction = Grid.of(dates, var, y.getPointIds(), predicted);
        Grid binaryGrid = hasBinary ? Grid.of(dates, var, y.getPointIds(), binary) : null;
        return new CrossValidationResult(prediction, binaryGrid, outputs.stream().map(FoldOutput::fold).toList());
    }
}
