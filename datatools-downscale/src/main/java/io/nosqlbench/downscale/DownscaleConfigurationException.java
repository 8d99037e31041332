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

/// Thrown when a downscaling run is configured in a way that cannot work:
/// an unknown method, k-fold cross-validation without folds, fold arguments
/// out of range, or predictor variable sets that do not match.
///
/// Configuration errors are fatal and reported before any model is fitted.
public class DownscaleConfigurationException extends RuntimeException {

    public DownscaleConfigurationException(String message) {
        super(message);
    }

    public DownscaleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
