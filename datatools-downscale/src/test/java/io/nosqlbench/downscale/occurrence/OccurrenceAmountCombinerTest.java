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
import io.nosqlbench.downscale.TestGrids;
import io.nosqlbench.downscale.grid.Grid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("OccurrenceAmountCombiner")
class OccurrenceAmountCombinerTest {

    private static final List<LocalDate> DATES = TestGrids.dates(2000, 2000, 4);

    private static Grid series(double... values) {
        return Grid.series(DATES, "pr", "station", values);
    }

    @Test
    @DisplayName("should calibrate probabilities and gate the amount")
    void shouldCalibrateWhenDeterministic() {
        Grid probabilities = series(0.9, 0.2, 0.6, 0.1);
        Grid amount = series(4.0, 1.0, 2.0, 0.5);
        Grid observed = series(1, 0, 1, 0);
        Grid combined = OccurrenceAmountCombiner.combine(probabilities, amount, observed, probabilities, 1.0, false);
        assertThat(combined.series(0, 0)).containsExactly(4.0, 0.0, 2.0, 0.0);
        assertThat(combined.getVarNames()).containsExactly("pr");
    }

    @Test
    @DisplayName("should re-mask simulated products with the wet threshold")
    void shouldMaskWhenSimulating() {
        Grid draws = series(1, 1, 0, 1);
        Grid amount = series(0.5, 3.0, 7.0, 1.0);
        Grid combined = OccurrenceAmountCombiner.combine(draws, amount, null, null, 1.0, true);
        assertThat(combined.series(0, 0)).containsExactly(0.0, 3.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("should report a non-positive amount on a wet step as a fit error")
    void shouldRejectNonPositiveWetAmounts() {
        assertThatThrownBy(() -> OccurrenceAmountCombiner.gate(series(1, 0, 1, 0), series(2.0, -1.0, -0.5, 1.0), 0.1, false))
            .isInstanceOf(ModelFitException.class)
            .hasMessageContaining("2000-01-03");
    }

    @Test
    @DisplayName("should require both predictions on the same dates")
    void shouldRejectMisalignedDates() {
        Grid shorter = Grid.series(DATES.subList(0, 3), "pr", "station", new double[]{1, 1, 1});
        assertThatThrownBy(() -> OccurrenceAmountCombiner.gate(shorter, series(1, 1, 1, 1), 0.1, false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
