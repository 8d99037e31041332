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

import io.nosqlbench.downscale.grid.BinaryGrids;
import io.nosqlbench.downscale.grid.Grid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Splits a precipitation-like predictand into occurrence and amount.
///
/// ## Threshold policy
///
/// | simulate | threshold used |
/// |----------|----------------|
/// | false | the caller's wet threshold |
/// | true  | [#SIMULATION_THRESHOLD], whatever the wet threshold |
///
/// Simulated series are re-masked with the caller's wet threshold after the
/// occurrence and amount draws are combined, so the split itself uses a
/// near-zero threshold that counts almost every wet day as an occurrence.
public final class OccurrenceDecomposer {

    private static final Logger logger = LogManager.getLogger(OccurrenceDecomposer.class);

    /// Occurrence threshold used whenever simulation is requested.
    public static final double SIMULATION_THRESHOLD = 0.01;

    private OccurrenceDecomposer() {
    }

    /// Returns the threshold the split uses.
    ///
    /// @param wetThreshold the caller's wet threshold
    /// @param simulate whether the run simulates
    /// @return the occurrence threshold
    public static double occurrenceThreshold(double wetThreshold, boolean simulate) {
        return simulate ? SIMULATION_THRESHOLD : wetThreshold;
    }

    /// Splits a predictand.
    ///
    /// @param y the predictand
    /// @param wetThreshold the caller's wet threshold
    /// @param simulate whether the run simulates
    /// @return occurrence and amount series
    public static OccurrenceSplit decompose(Grid y, double wetThreshold, boolean simulate) {
        Objects.requireNonNull(y, "y cannot be null");
        if (Double.isNaN(wetThreshold)) {
            throw new IllegalArgumentException("wet threshold cannot be NaN");
        }
        double threshold = occurrenceThreshold(wetThreshold, simulate);
        logger.debug("splitting {} into occurrence and amount at threshold {}", y, threshold);
        return new OccurrenceSplit(
            BinaryGrids.binaryGrid(y, threshold),
            BinaryGrids.partial(y, threshold, Double.NaN),
            threshold);
    }
}
