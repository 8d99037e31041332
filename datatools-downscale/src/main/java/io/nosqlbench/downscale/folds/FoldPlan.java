package io.nosqlbench.downscale.folds;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// How a series is partitioned for cross-validation.
///
/// | Plan | Folds |
/// |------|-------|
/// | [None] | one fold: train and test on the full period |
/// | [LeaveOneYearOut] | one fold per calendar year |
/// | [KFold] | `count` contiguous groups of years |
/// | [KFoldFraction] | two folds: the first `fraction` of the years, then the rest |
/// | [Explicit] | the given year sets, in the given order |
public sealed interface FoldPlan
    permits FoldPlan.None, FoldPlan.LeaveOneYearOut, FoldPlan.KFold, FoldPlan.KFoldFraction, FoldPlan.Explicit {

    /// No resampling.
    record None() implements FoldPlan {
    }

    /// One fold per year present in the data, in chronological order.
    record LeaveOneYearOut() implements FoldPlan {
    }

    /// Chronological k-fold over the years present.
    ///
    /// @param count the number of folds, at least 2
    record KFold(int count) implements FoldPlan {
        public KFold {
            if (count < 2) {
                throw new DownscaleConfigurationException("k-fold needs at least 2 folds, got " + count);
            }
        }
    }

    /// Chronological train/test split.
    ///
    /// @param fraction share of the years in the first fold, strictly between 0 and 1
    record KFoldFraction(double fraction) implements FoldPlan {
        public KFoldFraction {
            if (!(fraction > 0.0 && fraction < 1.0)) {
                throw new DownscaleConfigurationException("fold fraction must lie strictly between 0 and 1, got " + fraction);
            }
        }
    }

    /// User-supplied folds, each a set of years.
    ///
    /// @param folds the year sets, in fold order
    record Explicit(List<List<Integer>> folds) implements FoldPlan {
        public Explicit {
            Objects.requireNonNull(folds, "folds cannot be null");
            if (folds.isEmpty()) {
                throw new DownscaleConfigurationException("explicit folds cannot be empty");
            }
            List<List<Integer>> copy = new ArrayList<>();
            for (List<Integer> fold : folds) {
                if (fold == null || fold.isEmpty()) {
                    throw new DownscaleConfigurationException("explicit folds cannot contain an empty fold");
                }
                copy.add(List.copyOf(fold));
            }
            folds = List.copyOf(copy);
        }
    }

    /// Interprets a numeric fold argument: a value in (0, 1) is a train
    /// fraction, a whole number of at least 2 is a fold count.
    ///
    /// @param value the fold argument
    /// @return the plan
    /// @throws DownscaleConfigurationException for any other value
    static FoldPlan ofNumber(double value) {
        if (value > 0.0 && value < 1.0) {
            return new KFoldFraction(value);
        }
        if (value >= 2.0 && value == Math.rint(value)) {
            return new KFold((int) value);
        }
        throw new DownscaleConfigurationException("folds must be a fraction in (0,1) or a whole number of at least 2, got "
            + value);
    }

    /// Resolves the cross-validation mode and fold argument into one plan.
    ///
    /// @param mode the cross-validation mode
    /// @param folds the fold argument; ignored for NONE and LOOCV, required for KFOLD
    /// @return the plan
    /// @throws DownscaleConfigurationException if k-fold is requested without folds
    static FoldPlan resolve(CrossValidationMode mode, FoldPlan folds) {
        Objects.requireNonNull(mode, "mode cannot be null");
        switch (mode) {
            case NONE:
                return new None();
            case LOOCV:
                return new LeaveOneYearOut();
            case KFOLD:
                if (folds == null) {
                    throw new DownscaleConfigurationException(
                        "k-fold cross-validation needs a fold count, a train fraction or explicit folds");
                }
                if (folds instanceof None || folds instanceof LeaveOneYearOut) {
                    throw new DownscaleConfigurationException("k-fold cross-validation cannot use a " + folds + " fold plan");
                }
                return folds;
            default:
                throw new IllegalStateException("unhandled cross-validation mode " + mode);
        }
    }
}
