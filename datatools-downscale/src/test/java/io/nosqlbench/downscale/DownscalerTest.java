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

import io.nosqlbench.downscale.folds.CrossValidationMode;
import io.nosqlbench.downscale.folds.FoldPlan;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.method.DownscaleMethod;
import io.nosqlbench.downscale.method.SelectionFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@DisplayName("Downscaler")
class DownscalerTest {

    private static final List<LocalDate> DATES = TestGrids.dates(1985, 1993, 45);
    private static final Grid X = TestGrids.predictors(DATES, 101L);
    private static final Grid Y = TestGrids.precipitation(X, 102L);
    private static final Grid NEWDATA = TestGrids.predictors(TestGrids.dates(1994, 1995, 45), 103L);

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject predictors shifted by one day before fitting anything")
        void shouldRejectShiftedDates() {
            Grid shifted = new Grid(DATES.stream().map(d -> d.plusDays(1)).toList(), X.getVarNames(),
                X.getPointIds(), X.data());
            DownscaleOptions unusable = DownscaleOptions.builder()
                .method(DownscaleMethod.Kind.GLM)
                .crossValidation(CrossValidationMode.KFOLD)
                .build();

            assertThatThrownBy(() -> Downscaler.downscale(Y, shifted, shifted, unusable))
                .isInstanceOf(DateMismatchException.class)
                .hasMessageContaining("Align the predictor and predictand")
                .extracting(e -> ((DateMismatchException) e).getFirstMismatch())
                .isEqualTo(DATES.get(0));
        }

        @Test
        @DisplayName("should require folds for k-fold cross-validation")
        void shouldRequireFoldsForKFold() {
            DownscaleOptions options = DownscaleOptions.builder().crossValidation(CrossValidationMode.KFOLD).build();
            assertThatThrownBy(() -> Downscaler.downscale(Y, X, X, options))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("k-fold");
        }

        @Test
        @DisplayName("should require newdata to be x when cross-validating")
        void shouldRejectNewdataUnderCrossValidation() {
            DownscaleOptions options = DownscaleOptions.builder().crossValidation(CrossValidationMode.LOOCV).build();
            assertThatThrownBy(() -> Downscaler.downscale(Y, X, NEWDATA, options))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("newdata");
        }

        @Test
        @DisplayName("should require newdata to hold the predictor variables")
        void shouldRejectNewdataVariables() {
            Grid partial = NEWDATA.subsetVariable("psl");
            assertThatThrownBy(() -> Downscaler.downscale(Y, X, partial, DownscaleOptions.defaults()))
                .isInstanceOf(DownscaleConfigurationException.class)
                .hasMessageContaining("ta850");
        }

        @Test
        @DisplayName("should reject unknown methods by name")
        void shouldRejectUnknownMethod() {
            assertThatThrownBy(() -> DownscaleOptions.builder().method("kriging"))
                .isInstanceOf(DownscaleConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("analogs")
    class Analogs {

        @Test
        @DisplayName("should draw every prediction from the predictand history")
        void shouldDrawFromHistory() {
            Grid prediction = Downscaler.downscale(Y, X, NEWDATA, DownscaleOptions.defaults());

            assertThat(prediction.getRefDates()).isEqualTo(NEWDATA.getRefDates());
            Set<Double> history = Arrays.stream(Y.series(0, 0)).boxed().collect(Collectors.toSet());
            assertThat(Arrays.stream(prediction.series(0, 0)).boxed().toList()).allMatch(history::contains);
        }

        @Test
        @DisplayName("should reproduce the predictand when predicting its own predictors")
        void shouldReproduceTrainingPeriod() {
            Grid prediction = Downscaler.downscale(Y, X, X, DownscaleOptions.defaults());
            assertThat(prediction).isEqualTo(Y);
        }

        @Test
        @DisplayName("should aggregate several analogs on pooled components")
        void shouldUsePrincipalComponents() {
            DownscaleOptions options = DownscaleOptions.builder()
                .nAnalogs(5)
                .selectionFunction(SelectionFunction.MEDIAN)
                .nPcs(2)
                .build();
            Grid prediction = Downscaler.downscale(Y, X, NEWDATA, options);
            double max = Arrays.stream(Y.series(0, 0)).max().orElseThrow();
            assertThat(Arrays.stream(prediction.series(0, 0)).boxed().toList()).allSatisfy(v -> assertThat(v).isBetween(0.0, max));
        }
    }

    @Nested
    @DisplayName("train fraction")
    class TrainFraction {

        @Test
        @DisplayName("should predict only the years after the training fraction")
        void shouldPredictOnlyTestYears() {
            DownscaleOptions options = DownscaleOptions.builder()
                .crossValidation(CrossValidationMode.KFOLD)
                .folds(new FoldPlan.KFoldFraction(0.75))
                .build();
            Grid prediction = Downscaler.downscale(Y, X, X, options);

            assertThat(prediction.getRefDates().get(0)).isEqualTo(LocalDate.of(1992, 1, 1));
            assertThat(prediction.getRefDates()).isEqualTo(X.subsetYears(List.of(1992, 1993)).getRefDates());
            Set<Double> trainingHistory = Arrays.stream(Y.subsetYears(List.of(1985, 1986, 1987, 1988, 1989, 1990, 1991))
                .series(0, 0)).boxed().collect(Collectors.toSet());
            assertThat(Arrays.stream(prediction.series(0, 0)).boxed().toList()).allMatch(trainingHistory::contains);
        }
    }

    @Nested
    @DisplayName("glm")
    class Glm {

        @Test
        @DisplayName("should reproduce the observed wet frequency with calibrated occurrence")
        void shouldCalibrateOccurrence() {
            DownscaleOptions options = DownscaleOptions.builder()
                .method(DownscaleMethod.Kind.GLM)
                .wetThreshold(0.1)
                .build();
            Grid prediction = Downscaler.downscale(Y, X, NEWDATA, options);

            double[] values = prediction.series(0, 0);
            assertThat(prediction.getRefDates()).isEqualTo(NEWDATA.getRefDates());
            assertThat(Arrays.stream(values).boxed().toList()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
            double observedFrequency = Arrays.stream(Y.series(0, 0)).filter(v -> v > 0.1).count() / (double) Y.timeCount();
            long predictedWet = Arrays.stream(values).filter(v -> v > 0.0).count();
            assertThat((double) predictedWet).isCloseTo(observedFrequency * values.length, within(2.0));
        }

        @Test
        @DisplayName("should keep simulated values dry or above the wet threshold")
        void shouldMaskSimulation() {
            DownscaleOptions options = DownscaleOptions.builder()
                .method(DownscaleMethod.Kind.GLM)
                .simulate(true)
                .wetThreshold(1.0)
                .seed(2024L)
                .build();
            Grid first = Downscaler.downscale(Y, X, NEWDATA, options);
            Grid second = Downscaler.downscale(Y, X, NEWDATA, options);

            assertThat(first).isEqualTo(second);
            assertThat(Arrays.stream(first.series(0, 0)).boxed().toList()).allSatisfy(v -> assertThat(v == 0.0 || v > 1.0).isTrue());
        }

        @Test
        @DisplayName("should keep cross-validated simulations dry or above the wet threshold")
        void shouldMaskSimulationUnderCrossValidation() {
            DownscaleOptions options = DownscaleOptions.builder()
                .method(DownscaleMethod.Kind.GLM)
                .simulate(true)
                .wetThreshold(1.0)
                .crossValidation(CrossValidationMode.KFOLD)
                .folds(new FoldPlan.KFold(3))
                .seed(11L)
                .build();
            Grid prediction = Downscaler.downscale(Y, X, X, options);

            assertThat(prediction.getRefDates()).isEqualTo(DATES);
            assertThat(Arrays.stream(prediction.series(0, 0)).boxed().toList())
                .allSatisfy(v -> assertThat(v == 0.0 || v > 1.0).isTrue());
            assertThat(Arrays.stream(prediction.series(0, 0)).anyMatch(v -> v > 1.0)).isTrue();
        }

        @Test
        @DisplayName("should cross-validate occurrence and amount over the same folds")
        void shouldCrossValidate() {
            DownscaleOptions options = DownscaleOptions.builder()
                .method(DownscaleMethod.Kind.GLM)
                .crossValidation(CrossValidationMode.KFOLD)
                .folds(new FoldPlan.KFold(3))
                .nPcs(3)
                .parallelism(2)
                .build();
            Grid prediction = Downscaler.downscale(Y, X, X, options);
            assertThat(prediction.getRefDates()).isEqualTo(DATES);
            assertThat(Arrays.stream(prediction.series(0, 0)).boxed().toList()).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0));
        }
    }

    @Test
    @DisplayName("lm under leave-one-year-out predicts the whole series")
    void linearModelUnderLoocv() {
        DownscaleOptions options = DownscaleOptions.builder()
            .method("lm")
            .crossValidation(CrossValidationMode.LOOCV)
            .build();
        Grid prediction = Downscaler.downscale(Y, X, X, options);
        assertThat(prediction.getRefDates()).isEqualTo(DATES);
        assertThat(prediction.getVarNames()).containsExactly("pr");
    }

    @Test
    @DisplayName("options carry their defaults into a builder")
    void optionsRoundTripThroughBuilder() {
        DownscaleOptions options = DownscaleOptions.builder().nAnalogs(4).seed(9L).build();
        DownscaleOptions copy = options.toBuilder().build();
        assertThat(copy.toString()).isEqualTo(options.toString());
        assertThat(DownscaleOptions.defaults().wetThreshold()).isEqualTo(0.1);
        assertThat(DownscaleOptions.defaults().foldPlan()).isInstanceOf(FoldPlan.None.class);
    }
}
