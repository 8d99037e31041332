package io.nosqlbench.downscale.prepare;

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
import io.nosqlbench.downscale.DownscaleConfigurationException;
import io.nosqlbench.downscale.TestGrids;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.grid.ScaleType;
import io.nosqlbench.downscale.grid.Scaling;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("PredictorPreparation")
class PredictorPreparationTest {

    private static final List<LocalDate> DATES = TestGrids.dates(1990, 1993, 40);
    private static final Grid X = Scaling.scaleGrid(TestGrids.predictors(DATES, 11L),
        TestGrids.predictors(DATES, 11L), ScaleType.STANDARDIZE);
    private static final Grid Y = TestGrids.precipitation(TestGrids.predictors(DATES, 11L), 12L);

    @Nested
    @DisplayName("raw fields")
    class RawFields {

        @Test
        @DisplayName("should use one column per variable and point")
        void shouldUseAllGridBoxes() {
            DesignMatrix design = PredictorPreparation.prepareData(X, Y, List.of(), null);
            assertThat(design.rowCount()).isEqualTo(DATES.size());
            assertThat(design.columnCount()).isEqualTo(6);
            assertThat(design.getTransform().usesPrincipalComponents()).isFalse();
            assertThat(design.predictorRow(3)[4]).isEqualTo(X.get(1, 3, 1));
            assertThat(design.predictand(0)).containsExactly(Y.series(0, 0));
        }

        @Test
        @DisplayName("should restrict columns to the selected variables")
        void shouldSelectVariables() {
            DesignMatrix design = PredictorPreparation.prepareData(X, Y, List.of("ta850"), null);
            assertThat(design.columnCount()).isEqualTo(3);
            assertThat(design.getTransform().getVariables()).containsExactly("ta850");
        }

        @Test
        @DisplayName("should reject unknown variables")
        void shouldRejectUnknownVariables() {
            assertThatThrownBy(() -> PredictorPreparation.prepareData(X, Y, List.of("hus850"), null))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("hus850");
        }
    }

    @Nested
    @DisplayName("principal components")
    class Components {

        @Test
        @DisplayName("should keep only pooled components for combined variables")
        void shouldPoolCombinedVariables() {
            DesignMatrix design = PredictorPreparation.prepareData(X, Y, List.of(),
                SpatialPredictors.combined(X.getVarNames(), 4));
            assertThat(design.columnCount()).isEqualTo(4);
            assertThat(design.getTransform().getBlocks()).hasSize(1);
            assertThat(design.getTransform().getBlocks().get(0).variables()).containsExactly("psl", "ta850");
        }

        @Test
        @DisplayName("should mix per-variable and pooled blocks")
        void shouldMixBlocks() {
            SpatialPredictors spec = new SpatialPredictors(Map.of("psl", 2, "ta850", 1), List.of("ta850"), 1);
            DesignMatrix design = PredictorPreparation.prepareData(X, Y, List.of(), spec);
            assertThat(design.columnCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("should reject specs that do not name the predictor variables")
        void shouldRejectMismatchedSpec() {
            SpatialPredictors spec = new SpatialPredictors(Map.of("psl", 2), List.of(), 0);
            assertThatThrownBy(() -> PredictorPreparation.prepareData(X, Y, List.of(), spec))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("ta850");
        }

        @Test
        @DisplayName("should project new data on the training components")
        void shouldProjectNewData() {
            DesignMatrix training = PredictorPreparation.prepareData(X, Y, List.of(),
                SpatialPredictors.combined(X.getVarNames(), 3));
            Grid newdata = X.subsetYears(List.of(1991));
            DesignMatrix prediction = PredictorPreparation.prepareNewData(newdata, training);
            assertThat(prediction.hasPredictand()).isFalse();
            assertThat(prediction.getDates()).isEqualTo(newdata.getRefDates());
            int offset = DATES.indexOf(newdata.getRefDates().get(0));
            for (int c = 0; c < 3; c++) {
                assertThat(prediction.predictorRow(5)[c])
                    .isCloseTo(training.predictorRow(offset + 5)[c], within(1e-9));
            }
        }
    }

    @Test
    @DisplayName("should reject predictand dates that differ from predictor dates")
    void shouldRejectDateMismatch() {
        Grid shifted = Grid.series(TestGrids.dates(1990, 1993, 40).stream().map(d -> d.plusDays(1)).toList(),
            "pr", "station", Y.series(0, 0));
        assertThatThrownBy(() -> PredictorPreparation.prepareData(X, shifted, List.of(), null))
            .isInstanceOf(DateMismatchException.class)
            .hasMessageContaining("Align");
    }

    @Test
    @DisplayName("should reject NaN predictors")
    void shouldRejectMissingPredictors() {
        double[][][] data = X.data();
        data[0][2][1] = Double.NaN;
        assertThatThrownBy(() -> PredictorPreparation.prepareData(X.withData(data), Y, List.of(), null))
            .isInstanceOf(DownscaleConfigurationException.class);
    }
}
