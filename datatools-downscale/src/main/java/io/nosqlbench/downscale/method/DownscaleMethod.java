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
import io.nosqlbench.downscale.prepare.DesignMatrix;

import java.util.Locale;
import java.util.Objects;

/// The closed set of downscaling methods.
///
/// ## Variants
///
/// | Variant | Training | Prediction |
/// |---------|----------|------------|
/// | [Analogs] | keeps the training design | aggregates the predictand of the nearest training days |
/// | [Glm] | IRLS fit of a [Family], optionally on conditioned rows | conditional mean, or a draw from the fitted law |
/// | [Lm] | ordinary least squares | fitted value, or fitted value plus normal noise |
///
/// Each variant trains itself into a [TrainedModel]; there is no string
/// dispatch below [Kind#parse].
public sealed interface DownscaleMethod permits DownscaleMethod.Analogs, DownscaleMethod.Glm, DownscaleMethod.Lm {

    /// Fits this method on a training design.
    ///
    /// @param design a design carrying the predictand
    /// @return the trained model
    TrainedModel train(DesignMatrix design);

    /// @return the method's kind
    Kind kind();

    /// Method names as accepted from configuration.
    enum Kind {
        ANALOGS("analogs"),
        GLM("glm"),
        LM("lm");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        /// Parses "analogs", "glm" or "lm", case-insensitively.
        ///
        /// @param name the method name
        /// @return the kind
        /// @throws DownscaleConfigurationException for any other name
        public static Kind parse(String name) {
            if (name != null) {
                String normalized = name.trim().toLowerCase(Locale.ROOT);
                for (Kind kind : values()) {
                    if (kind.label.equals(normalized)) {
                        return kind;
                    }
                }
            }
            throw new DownscaleConfigurationException("unknown downscaling method '" + name
                + "', expected one of analogs, glm, lm");
        }
    }

    /// Analog (nearest neighbour) downscaling.
    ///
    /// @param nAnalogs how many nearest training days to use, at least 1
    /// @param selectionFunction how their values are combined; irrelevant for one analog
    record Analogs(int nAnalogs, SelectionFunction selectionFunction) implements DownscaleMethod {
        public Analogs {
            if (nAnalogs < 1) {
                throw new DownscaleConfigurationException("n.analogs must be at least 1, got " + nAnalogs);
            }
            Objects.requireNonNull(selectionFunction, "selectionFunction cannot be null");
        }

        @Override
        public TrainedModel train(DesignMatrix design) {
            return new AnalogModel(this, design);
        }

        @Override
        public Kind kind() {
            return Kind.ANALOGS;
        }
    }

    /// Generalized linear model.
    ///
    /// @param family the error distribution and link
    /// @param condition the training row filter, or null to use every row
    record Glm(Family family, Condition condition) implements DownscaleMethod {
        public Glm {
            Objects.requireNonNull(family, "family cannot be null");
        }

        public Glm(Family family) {
            this(family, null);
        }

        @Override
        public TrainedModel train(DesignMatrix design) {
            return GlmModel.fit(this, design);
        }

        @Override
        public Kind kind() {
            return Kind.GLM;
        }
    }

    /// Ordinary least squares linear regression.
    record Lm() implements DownscaleMethod {
        @Override
        public TrainedModel train(DesignMatrix design) {
            return LinearModel.fit(this, design);
        }

        @Override
        public Kind kind() {
            return Kind.LM;
        }
    }
}
