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

import java.time.LocalDate;
import java.util.List;

/// Thrown when the predictor and predictand reference dates differ.
///
/// The core never aligns dates itself; the caller has to intersect the two
/// series before calling in.
public class DateMismatchException extends DownscaleConfigurationException {

    private final int predictorLength;
    private final int predictandLength;
    private final LocalDate firstMismatch;

    public DateMismatchException(List<LocalDate> predictorDates, List<LocalDate> predictandDates) {
        super(describe(predictorDates, predictandDates));
        this.predictorLength = predictorDates.size();
        this.predictandLength = predictandDates.size();
        this.firstMismatch = firstMismatch(predictorDates, predictandDates);
    }

    private static String describe(List<LocalDate> x, List<LocalDate> y) {
        LocalDate mismatch = firstMismatch(x, y);
        return String.format("Dates of x and y do not match (x has %d dates, y has %d, first difference at %s). "
                + "Align the predictor and predictand to their common dates before downscaling.",
            x.size(), y.size(), mismatch == null ? "the end of the shorter series" : mismatch);
    }

    private static LocalDate firstMismatch(List<LocalDate> x, List<LocalDate> y) {
        int n = Math.min(x.size(), y.size());
        for (int i = 0; i < n; i++) {
            if (!x.get(i).equals(y.get(i))) {
                return x.get(i).isBefore(y.get(i)) ? x.get(i) : y.get(i);
            }
        }
        return null;
    }

    public int getPredictorLength() {
        return predictorLength;
    }

    public int getPredictandLength() {
        return predictandLength;
    }

    /// @return the earliest date at which the sequences differ, or null when one
    /// sequence is a prefix of the other
    public LocalDate getFirstMismatch() {
        return firstMismatch;
    }
}
