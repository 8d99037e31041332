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

import io.nosqlbench.downscale.ModelFitException;
import io.nosqlbench.downscale.TestGrids;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import io.nosqlbench.downscale.prepare.PredictorPreparation;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class LinearModelTest {

    private static final List<LocalDate> DATES = TestGrids.consecutive(LocalDate.of(1980, 1, 1), 400);

    private static DesignMatrix design(double noise) {
        double[][] rows = new double[DATES.size()][2];
        double[] y = new double[DATES.size()];
        for (int t = 0; t < rows.length; t++) {
            rows[t][0] = Math.sin(t * 0.1);
            rows[t][1] = Math.cos(t * 0.037);
            y[t] = 0.5 + 3.0 * rows[t][0] - 1.0 * rows[t][1] + noise * ((t * 7919) % 13 - 6);
        }
        y[17] = Double.NaN;
        return PredictorPreparation.prepareData(TestGrids.columns(DATES, rows),
            Grid.series(DATES, "tas", "station", y), List.of(), null);
    }

    @Test
    void recoversExactCoefficientsSkippingMissingValues() {
        LinearModel model = (LinearModel) new DownscaleMethod.Lm().train(design(0.0));
        assertThat(model.getFit(0).coefficients()).containsExactly(new double[]{0.5, 3.0, -1.0}, within(1e-9));
        assertThat(model.getFit(0).errorVariance()).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void simulationAddsResidualNoise() {
        DesignMatrix training = design(0.1);
        TrainedModel model = DownscaleTrainer.train(training, new DownscaleMethod.Lm());
        DesignMatrix query = PredictorPreparation.prepareNewData(TestGrids.columns(DATES, training.predictors()), training);
        double[] mean = model.predict(query, false, null).series(0, 0);
        double[] simulated = model.predict(query, true, RandomStreams.create(5L)).series(0, 0);

        SummaryStatistics residuals = new SummaryStatistics();
        for (int t = 0; t < mean.length; t++) {
            residuals.addValue(simulated[t] - mean[t]);
        }
        double sigma = Math.sqrt(((LinearModel) model).getFit(0).errorVariance());
        assertThat(residuals.getStandardDeviation()).isCloseTo(sigma, within(sigma * 0.25));
        assertThat(model.predict(query, true, RandomStreams.create(5L)).series(0, 0)).containsExactly(simulated);
    }

    @Test
    void rejectsTooFewRows() {
        List<LocalDate> dates = DATES.subList(0, 3);
        DesignMatrix tiny = PredictorPreparation.prepareData(
            TestGrids.columns(dates, new double[][]{{1, 2}, {2, 1}, {3, 3}}),
            Grid.series(dates, "tas", "station", new double[]{1, 2, 3}), List.of(), null);
        assertThatThrownBy(() -> new DownscaleMethod.Lm().train(tiny))
            .isInstanceOf(ModelFitException.class)
            .hasMessageContaining("station");
    }
}
