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

import io.nosqlbench.downscale.grid.Grid;

import java.util.Objects;

/// A predictand split into occurrence and amount.
///
/// Both grids share the predictand's dates, variable and points. They differ
/// only in what happens at or below the threshold: occurrence holds 0 there,
/// amount holds `NaN` (masked).
///
/// @param occurrence 1 where the value exceeds the threshold, 0 otherwise
/// @param amount the value where it exceeds the threshold, masked otherwise
/// @param threshold the wet/dry threshold that was applied
public record OccurrenceSplit(Grid occurrence, Grid amount, double threshold) {
    public OccurrenceSplit {
        Objects.requireNonNull(occurrence, "occurrence cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
        if (!occurrence.getRefDates().equals(amount.getRefDates())) {
            throw new IllegalArgumentException("occurrence and amount must share dates");
        }
    }
}
