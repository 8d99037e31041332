package io.nosqlbench.downscale.folds;

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

import java.util.Locale;

/// Cross-validation modes accepted from configuration.
public enum CrossValidationMode {
    NONE("none"),
    /// Leave one year out.
    LOOCV("loocv"),
    /// Chronological k-fold, or user-supplied folds.
    KFOLD("kfold");

    private final String label;

    CrossValidationMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /// Parses "none", "loocv" or "kfold", case-insensitively.
    public static CrossValidationMode parse(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (CrossValidationMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new DownscaleConfigurationException("unknown cross-validation mode '" + name
            + "', expected one of none, loocv, kfold");
    }
}
