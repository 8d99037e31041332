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

import io.nosqlbench.downscale.grid.Grid;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.AhrensDieterMarsagliaTsangGammaSampler;
import org.apache.commons.rng.sampling.distribution.NormalizedGaussianSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratNormalizedGaussianSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/// Synthetic predictor and predictand grids for tests.
///
/// Predictors are standard normal fields. The predictand is a
/// precipitation-like series driven by the first variable at the first
/// point: wet with probability `logistic(0.3 + 1.5 s)` and, when wet, a gamma
/// amount with mean `exp(0.8 + 0.4 s)`.
public final class TestGrids {

    public static final List<String> VARIABLES = List.of("psl", "ta850");
    public static final List<String> POINTS = List.of("g1", "g2", "g3");

    private TestGrids() {
    }

    /// `daysPerYear` consecutive days starting on January 1st of each year.
    public static List<LocalDate> dates(int fromYear, int toYear, int daysPerYear) {
        List<LocalDate> dates = new ArrayList<>();
        for (int year = fromYear; year <= toYear; year++) {
            LocalDate start = LocalDate.of(year, 1, 1);
            for (int d = 0; d < daysPerYear; d++) {
                dates.add(start.plusDays(d));
            }
        }
        return dates;
    }

    /// `count` consecutive days from `start`.
    public static List<LocalDate> consecutive(LocalDate start, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        for (int d = 0; d < count; d++) {
            dates.add(start.plusDays(d));
        }
        return dates;
    }

    /// A one-variable grid with one point per predictor column, for fitting
    /// models on hand-made designs.
    public static Grid columns(List<LocalDate> dates, double[][] rows) {
        int width = rows[0].length;
        List<String> points = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            points.add("c" + c);
        }
        return Grid.of(dates, "x", points, rows);
    }

    public static Grid predictors(List<LocalDate> dates, long seed) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        NormalizedGaussianSampler gaussian = ZigguratNormalizedGaussianSampler.of(rng);
        double[][][] data = new double[VARIABLES.size()][dates.size()][POINTS.size()];
        for (int v = 0; v < data.length; v++) {
            for (int t = 0; t < dates.size(); t++) {
                for (int p = 0; p < POINTS.size(); p++) {
                    data[v][t][p] = 10.0 * v + gaussian.sample();
                }
            }
        }
        return new Grid(dates, VARIABLES, POINTS, data);
    }

    public static Grid precipitation(Grid x, long seed) {
        UniformRandomProvider rng = RandomSource.XO_SHI_RO_256_PP.create(seed);
        double[] values = new double[x.timeCount()];
        for (int t = 0; t < values.length; t++) {
            double s = x.get(0, t, 0);
            double wetProbability = 1.0 / (1.0 + Math.exp(-(0.3 + 1.5 * s)));
            if (rng.nextDouble() < wetProbability) {
                double mean = Math.exp(0.8 + 0.4 * s);
                double shape = 2.0;
                values[t] = 0.2 + AhrensDieterMarsagliaTsangGammaSampler.of(rng, shape, mean / shape).sample();
            }
        }
        return Grid.series(x.getRefDates(), "pr", "station", values);
    }
}
