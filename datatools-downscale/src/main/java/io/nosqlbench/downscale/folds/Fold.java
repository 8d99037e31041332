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

import java.util.Arrays;
import java.util.List;

/// One train/test cycle of a cross-validation.
///
/// @param number position of the fold in the plan, from 0
/// @param years the years held out for testing, sorted
/// @param testIndices time indices of the test period, increasing
/// @param trainIndices time indices of the training period, increasing
public record Fold(int number, List<Integer> years, int[] testIndices, int[] trainIndices) {

    public Fold {
        years = List.copyOf(years);
        testIndices = testIndices.clone();
        trainIndices = trainIndices.clone();
    }

    @Override
    public int[] testIndices() {
        return testIndices.clone();
    }

    @Override
    public int[] trainIndices() {
        return trainIndices.clone();
    }

    /// @return true when train and test are the same full period
    public boolean isWholePeriod() {
        return Arrays.equals(testIndices, trainIndices);
    }

    @Override
    public String toString() {
        return "Fold[" + number + ", years=" + years + ", test=" + testIndices.length + ", train=" + trainIndices.length + "]";
    }
}
