package io.nosqlbench.downscale.grid;

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

import io.nosqlbench.downscale.TestGrids;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class BinaryGridsTest {

    private static final List<LocalDate> FOUR_DAYS = TestGrids.dates(2000, 2000, 4);

    @Test
    @DisplayName("binaryGrid marks values strictly above the threshold and keeps NaN")
    void binaryGridUsesStrictThreshold() {
        Grid grid = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.0, 1.0, 1.5, Double.NaN});
        double[] binary = BinaryGrids.binaryGrid(grid, 1.0).series(0, 0);
        assertThat(binary[0]).isEqualTo(0.0);
        assertThat(binary[1]).isEqualTo(0.0);
        assertThat(binary[2]).isEqualTo(1.0);
        assertThat(binary[3]).isNaN();
    }

    @Test
    @DisplayName("partial replaces values at or below the threshold with the fill value")
    void partialFillsDryValues() {
        Grid grid = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.0, 0.01, 0.5, 3.0});
        assertThat(BinaryGrids.partial(grid, 0.01, 0.0).series(0, 0)).containsExactly(0.0, 0.0, 0.5, 3.0);
        double[] masked = BinaryGrids.partial(grid, 0.01, Double.NaN).series(0, 0);
        assertThat(masked[0]).isNaN();
        assertThat(masked[1]).isNaN();
        assertThat(masked[3]).isEqualTo(3.0);
    }

    @Test
    @DisplayName("calibrated uses the (1 - frequency) quantile of the reference prediction")
    void calibratedUsesFrequencyQuantile() {
        Grid obs = Grid.series(FOUR_DAYS, "pr", "s", new double[]{1, 0, 1, 0});
        Grid refPred = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.1, 0.2, 0.3, 0.4});
        Grid pred = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.1, 0.3, 0.26, 0.2});

        assertThat(BinaryGrids.frequencyThreshold(obs.series(0, 0), refPred.series(0, 0)))
            .isCloseTo(0.25, within(1e-12));
        assertThat(BinaryGrids.calibrated(pred, obs, refPred).series(0, 0)).containsExactly(0, 1, 1, 0);
    }

    @Test
    @DisplayName("calibrated reproduces the observed wet frequency on the reference period")
    void calibratedReproducesFrequency() {
        List<LocalDate> dates = TestGrids.dates(2000, 2000, 100);
        double[] observed = new double[100];
        double[] predicted = new double[100];
        for (int t = 0; t < 100; t++) {
            observed[t] = t % 10 < 3 ? 1.0 : 0.0;
            predicted[t] = (t * 37) % 100 + 1;
        }
        Grid obs = Grid.series(dates, "pr", "s", observed);
        Grid ref = Grid.series(dates, "pr", "s", predicted);
        double wet = Arrays.stream(BinaryGrids.calibrated(ref, obs, ref).series(0, 0)).sum();
        assertThat(wet).isEqualTo(30.0);
    }

    @Test
    @DisplayName("calibrated with an always-wet reference uses the reference minimum")
    void calibratedAlwaysWet() {
        Grid obs = Grid.series(FOUR_DAYS, "pr", "s", new double[]{1, 1, 1, 1});
        Grid ref = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.4, 0.2, 0.3, 0.5});
        Grid pred = Grid.series(FOUR_DAYS, "pr", "s", new double[]{0.2, 0.21, 0.1, 0.9});
        assertThat(BinaryGrids.calibrated(pred, obs, ref).series(0, 0)).containsExactly(0, 1, 0, 1);
    }
}
