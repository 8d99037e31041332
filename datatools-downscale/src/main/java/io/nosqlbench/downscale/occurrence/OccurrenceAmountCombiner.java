package io.nosqlbench.downscale.occurrence;

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

import io.nosqlbench.downscale.ModelFitException;
import io.nosqlbench.downscale.grid.BinaryGrids;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.grid.GridArithmetics;

import java.util.Objects;

/// Reassembles occurrence and amount predictions into one predicted series.
///
/// ```
///   deterministic:  occurrence probability ──► calibrated 0/1 ──┐
///                                                               ×  amount mean  ──► prediction
///   simulated:      occurrence draw (0/1) ──────────────────────┘
///                                                               ×  amount draw  ──► mask(wet threshold, 0) ──► prediction
/// ```
///
/// The occurrence gates the amount. An amount model predicting a value at or
/// below zero on a wet step is reported as a [ModelFitException] rather than
/// clamped.
public final class OccurrenceAmountCombiner {

    private OccurrenceAmountCombiner() {
    }

    /// Combines occurrence and amount predictions.
    ///
    /// @param occurrence occurrence probabilities, or 0/1 draws when simulating
    /// @param amount amount predictions on the same dates
    /// @param observedOccurrence observed 0/1 occurrence used as calibration reference
    /// @param referencePrediction occurrence prediction over the calibration period
    /// @param wetThreshold the caller's wet threshold
    /// @param simulate whether the predictions are simulated
    /// @return the combined prediction
    public static Grid combine(Grid occurrence, Grid amount, Grid observedOccurrence, Grid referencePrediction,
                               double wetThreshold, boolean simulate) {
        Objects.requireNonNull(occurrence, "occurrence cannot be null");
        Grid binary = simulate ? occurrence : BinaryGrids.calibrated(occurrence, observedOccurrence, referencePrediction);
        return gate(binary, amount, wetThreshold, simulate);
    }

    /// Multiplies a 0/1 occurrence with an amount prediction.
    ///
    /// @param binaryOccurrence 0/1 occurrence
    /// @param amount amount predictions on the same dates
    /// @param wetThreshold the caller's wet threshold, applied when simulating
    /// @param simulate whether to re-mask the product with the wet threshold
    /// @return the combined prediction, with dry steps at 0
    public static Grid gate(Grid binaryOccurrence, Grid amount, double wetThreshold, boolean simulate) {
        Objects.requireNonNull(binaryOccurrence, "binaryOccurrence cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
        if (!binaryOccurrence.getRefDates().equals(amount.getRefDates())) {
            throw new IllegalArgumentException("occurrence and amount predictions are not on the same dates");
        }
        for (int v = 0; v < amount.varCount(); v++) {
            for (int t = 0; t < amount.timeCount(); t++) {
                for (int p = 0; p < amount.pointCount(); p++) {
                    double wet = binaryOccurrence.get(v, t, p);
                    double value = amount.get(v, t, p);
                    if (wet == 1.0 && !(value > 0.0)) {
                        throw new ModelFitException("amount model predicted " + value + " on a wet step at "
                            + amount.getRefDates().get(t) + ", point " + amount.getPointIds().get(p));
                    }
                }
            }
        }
        Grid product = GridArithmetics.apply(amount, binaryOccurrence, GridArithmetics.Operator.MULTIPLY);
        return simulate ? BinaryGrids.partial(product, wetThreshold, 0.0) : product;
    }
}
