package io.nosqlbench.downscale.method;

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
import io.nosqlbench.downscale.ModelFitException;
import io.nosqlbench.downscale.TestGrids;
import io.nosqlbench.downscale.grid.BinaryGrids;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.grid.ScaleType;
import io.nosqlbench.downscale.grid.Scaling;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import io.nosqlbench.downscale.prepare.PredictorPreparation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("DownscaleMethod")
class DownscaleMethodTest {

    @Nested
    @DisplayName("method names")
    class Names {

        @ParameterizedTest
        @ValueSource(strings = {"analogs", "GLM", " lm "})
        @DisplayName("should parse known methods")
        void shouldParseKnownMethods(String name) {
            assertThat(DownscaleMethod.Kind.parse(name).getLabel()).isEqualTo(name.trim().toLowerCase());
        }

        @Test
        @DisplayName("should fail fast on an unknown method")
        void shouldRejectUnknownMethod() {
            assertThatThrownBy(() -> DownscaleMethod.Kind.parse("neural"))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("neural");
        }

        @Test
        @DisplayName("should reject fewer than one analog")
        void shouldRejectZeroAnalogs() {
            assertThatThrownBy(() -> new DownscaleMethod.Analogs(0, SelectionFunction.MEAN))
                .isInstanceOf(DownscaleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("selection functions")
    class Selection {

        @Test
        @DisplayName("should give exact matches all the weight")
        void shouldFavourExactMatches() {
            assertThat(SelectionFunction.WMEAN.apply(new double[]{4, 10, 20}, new double[]{0, 0, 1})).isEqualTo(7.0);
            assertThat(SelectionFunction.WMEAN.apply(new double[]{2, 8}, new double[]{1, 3})).isCloseTo(3.5, within(1e-12));
        }

        @Test
        @DisplayName("should skip missing analog values")
        void shouldSkipMissingValues() {
            double[] distances = {1, 2, 3};
            assertThat(SelectionFunction.MEAN.apply(new double[]{1, Double.NaN, 3}, distances)).isEqualTo(2.0);
            assertThat(SelectionFunction.MEDIAN.apply(new double[]{Double.NaN, 5, Double.NaN}, distances)).isEqualTo(5.0);
            assertThat(SelectionFunction.MAX.apply(new double[]{Double.NaN, Double.NaN, Double.NaN}, distances)).isNaN();
        }

        @Test
        @DisplayName("should parse labels")
        void shouldParseLabels() {
            assertThat(SelectionFunction.parse("WMean")).isEqualTo(SelectionFunction.WMEAN);
            assertThatThrownBy(() -> SelectionFunction.parse("mode")).isInstanceOf(DownscaleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("conditioned GLM")
    class ConditionedGlm {

        private final List<LocalDate> dates = TestGrids.dates(1990, 1999, 60);
        private final Grid raw = TestGrids.predictors(dates, 21L);
        private final Grid x = Scaling.scaleGrid(raw, raw, ScaleType.STANDARDIZE);
        private final Grid y = TestGrids.precipitation(raw, 22L);

        @Test
        @DisplayName("should fit only the rows the condition keeps")
        void shouldFitConditionedRows() {
            DesignMatrix design = PredictorPreparation.prepareData(x, y, List.of(), null);
            GlmModel model = (GlmModel) new DownscaleMethod.Glm(Family.GAMMA, Condition.gt(0.0)).train(design);
            long wet = Arrays.stream(y.series(0, 0)).filter(v -> v > 0.0).count();
            assertThat(model.getFit(0).rows()).isEqualTo((int) wet);

            double[] predicted = model.predict(PredictorPreparation.prepareNewData(x, design), false, null).series(0, 0);
            assertThat(Arrays.stream(predicted).allMatch(v -> v > 0.0)).isTrue();
        }

        @Test
        @DisplayName("should reject zero amounts without a condition")
        void shouldRejectZeroAmountsWithoutCondition() {
            DesignMatrix design = PredictorPreparation.prepareData(x, y, List.of(), null);
            assertThatThrownBy(() -> new DownscaleMethod.Glm(Family.GAMMA).train(design))
                .isInstanceOf(ModelFitException.class)
                .hasMessageContaining("station");
        }

        @Test
        @DisplayName("should simulate reproducibly from a seed")
        void shouldSimulateReproducibly() {
            Grid occurrence = BinaryGrids.binaryGrid(y, 0.0);
            DesignMatrix design = PredictorPreparation.prepareData(x, occurrence, List.of(), null);
            TrainedModel model = DownscaleTrainer.train(design, new DownscaleMethod.Glm(Family.BINOMIAL));
            DesignMatrix query = PredictorPreparation.prepareNewData(x, design);

            double[] first = model.predict(query, true, RandomStreams.stream(9L, 0)).series(0, 0);
            double[] second = model.predict(query, true, RandomStreams.stream(9L, 0)).series(0, 0);
            double[] other = model.predict(query, true, RandomStreams.stream(9L, 1)).series(0, 0);
            assertThat(first).containsExactly(second);
            assertThat(first).isNotEqualTo(other);
            assertThat(Arrays.stream(first).allMatch(v -> v == 0.0 || v == 1.0)).isTrue();
        }
    }
}
