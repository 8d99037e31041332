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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("Grid")
class GridTest {

    private static final List<LocalDate> DATES = List.of(
        LocalDate.of(1990, 12, 30), LocalDate.of(1990, 12, 31),
        LocalDate.of(1991, 1, 1), LocalDate.of(1991, 1, 2),
        LocalDate.of(1992, 6, 1));

    private static Grid sample() {
        double[][][] data = new double[2][5][2];
        for (int v = 0; v < 2; v++) {
            for (int t = 0; t < 5; t++) {
                for (int p = 0; p < 2; p++) {
                    data[v][t][p] = 100 * v + 10 * t + p;
                }
            }
        }
        return new Grid(DATES, List.of("a", "b"), List.of("p0", "p1"), data);
    }

    @Test
    @DisplayName("should reject dates that are not strictly increasing")
    void shouldRejectUnorderedDates() {
        List<LocalDate> dates = List.of(LocalDate.of(2000, 1, 2), LocalDate.of(2000, 1, 1));
        assertThatThrownBy(() -> Grid.series(dates, "v", "p", new double[]{1, 2}))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("should reject data that does not match its axes")
    void shouldRejectMisshapenData() {
        assertThatThrownBy(() -> Grid.of(DATES, "v", List.of("p0", "p1"), new double[5][3]))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected 2");
    }

    @Test
    @DisplayName("should not expose its internal arrays")
    void shouldCopyValues() {
        Grid grid = sample();
        double[][] values = grid.values(0);
        values[0][0] = -1;
        assertThat(grid.get(0, 0, 0)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("should list years in order and select time steps by year")
    void shouldSubsetByYear() {
        Grid grid = sample();
        assertThat(grid.years()).containsExactly(1990, 1991, 1992);
        Grid sub = grid.subsetYears(List.of(1991));
        assertThat(sub.getRefDates()).containsExactly(LocalDate.of(1991, 1, 1), LocalDate.of(1991, 1, 2));
        assertThat(sub.get(1, 1, 1)).isEqualTo(131.0);
    }

    @Test
    @DisplayName("should select one variable")
    void shouldSubsetVariable() {
        Grid b = sample().subsetVariable("b");
        assertThat(b.getVarNames()).containsExactly("b");
        assertThat(b.series(0, 0)).containsExactly(100, 110, 120, 130, 140);
        assertThatThrownBy(() -> sample().subsetVariable("c")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should require increasing indices when subsetting")
    void shouldRejectUnorderedIndices() {
        assertThatThrownBy(() -> sample().subsetIndices(new int[]{2, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(sample().subsetIndices(new int[]{0, 4}).getRefDates())
            .containsExactly(LocalDate.of(1990, 12, 30), LocalDate.of(1992, 6, 1));
    }

    @Test
    @DisplayName("should compare by axes and values")
    void shouldCompareByValue() {
        assertThat(sample()).isEqualTo(sample()).hasSameHashCodeAs(sample());
        assertThat(sample()).isNotEqualTo(sample().subsetVariable("a"));
    }

    @Test
    @DisplayName("should apply element-wise arithmetic on equal shapes")
    void shouldApplyArithmetic() {
        Grid a = Grid.series(DATES, "a", "p", new double[]{1, 2, 3, 4, 5});
        Grid b = Grid.series(DATES, "b", "p", new double[]{2, 2, 0, 1, Double.NaN});
        Grid product = GridArithmetics.apply(a, b, GridArithmetics.Operator.MULTIPLY);
        assertThat(product.getVarNames()).containsExactly("a");
        double[] values = product.series(0, 0);
        assertThat(values).startsWith(2, 4, 0, 4);
        assertThat(values[4]).isNaN();
        Grid shorter = Grid.series(DATES.subList(0, 2), "b", "p", new double[]{1, 1});
        assertThatThrownBy(() -> GridArithmetics.apply(a, shorter, GridArithmetics.Operator.ADD))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
