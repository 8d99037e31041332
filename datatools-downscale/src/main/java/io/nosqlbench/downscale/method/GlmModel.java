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
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.prepare.DesignMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Generalized linear model with one [GlmFitter.GlmFit] per predictand point.
///
/// Training rows whose predictand is missing are always dropped. When the
/// method carries a [Condition], rows failing it are dropped as well, so an
/// amount model conditioned on `GT 0` sees wet days only while still
/// predicting every day.
public final class GlmModel implements TrainedModel {

    private static final Logger logger = LogManager.getLogger(GlmModel.class);

    private final DownscaleMethod.Glm method;
    private final List<GlmFitter.GlmFit> fits;
    private final String predictandVar;
    private final List<String> predictandPoints;
    private final int columns;

    private GlmModel(DownscaleMethod.Glm method, List<GlmFitter.GlmFit> fits, String predictandVar,
                     List<String> predictandPoints, int columns) {
        this.method = method;
        this.fits = List.copyOf(fits);
        this.predictandVar = predictandVar;
        this.predictandPoints = predictandPoints;
        this.columns = columns;
    }

    static GlmModel fit(DownscaleMethod.Glm method, DesignMatrix design) {
        Objects.requireNonNull(design, "design cannot be null");
        if (!design.hasPredictand()) {
            throw new IllegalArgumentException("a GLM needs a training design with a predictand");
        }
        GlmFitter fitter = new GlmFitter(method.family());
        List<GlmFitter.GlmFit> fits = new ArrayList<>();
        for (int p = 0; p < design.getPredictandPoints().size(); p++) {
            double[] y = design.predictand(p);
            List<double[]> rows = new ArrayList<>();
            List<Double> response = new ArrayList<>();
            for (int t = 0; t < y.length; t++) {
                boolean keep = method.condition() == null ? !Double.isNaN(y[t]) : method.condition().test(y[t]);
                if (keep) {
                    rows.add(design.predictorRow(t));
                    response.add(y[t]);
                }
            }
            String point = design.getPredictandPoints().get(p);
            logger.debug("fitting {} at {} on {} of {} rows", method.family(), point, rows.size(), y.length);
            try {
                fits.add(fitter.fit(rows.toArray(new double[0][]), response.stream().mapToDouble(Double::doubleValue).toArray()));
            } catch (ModelFitException e) {
                throw new ModelFitException("GLM fit failed at point " + point + ": " + e.getMessage(), e);
            }
        }
        return new GlmModel(method, fits, design.getPredictandVar(), design.getPredictandPoints(), design.columnCount());
    }

    @Override
    public DownscaleMethod.Glm getMethod() {
        return method;
    }

    /// @return the fit of one predictand point
    public GlmFitter.GlmFit getFit(int point) {
        return fits.get(point);
    }

    @Override
    public Grid predict(DesignMatrix design, boolean simulate, UniformRandomProvider rng) {
        Objects.requireNonNull(design, "design cannot be null");
        if (design.columnCount() != columns) {
            throw new IllegalArgumentException("prediction design has " + design.columnCount()
                + " columns, model was trained on " + columns);
        }
        if (simulate) {
            Objects.requireNonNull(rng, "simulation needs a random source");
        }
        Family family = method.family();
        double[][] out = new double[design.rowCount()][fits.size()];
        for (int p = 0; p < fits.size(); p++) {
            GlmFitter.GlmFit fit = fits.get(p);
            if (simulate && !(fit.dispersion() > 0.0 && Double.isFinite(fit.dispersion()))) {
                throw new ModelFitException("cannot simulate from " + family + " with dispersion " + fit.dispersion()
                    + " at point " + predictandPoints.get(p));
            }
            for (int t = 0; t < design.rowCount(); t++) {
                double mu = family.linkInverse(fit.linearPredictor(design.predictorRow(t)));
                out[t][p] = simulate ? family.sample(rng, mu, fit.dispersion()) : mu;
            }
        }
        return Grid.of(design.getDates(), predictandVar, predictandPoints, out);
    }
}
