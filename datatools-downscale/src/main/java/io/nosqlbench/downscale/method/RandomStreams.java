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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/// Seeded random sources for simulation.
///
/// Every stream is created from a base seed and a stream index, so that a
/// run gives the same draws whether its folds run one after another or on a
/// worker pool.
public final class RandomStreams {

    /// Algorithm used for all streams: XorShiro256++.
    public static final RandomSource SOURCE = RandomSource.XO_SHI_RO_256_PP;

    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private RandomStreams() {
    }

    /// Creates a random source.
    ///
    /// @param seed the seed
    /// @return the random source
    public static UniformRandomProvider create(long seed) {
        return SOURCE.create(seed);
    }

    /// Creates the random source of one numbered stream derived from a base seed.
    ///
    /// @param seed the base seed
    /// @param stream the stream index, such as a fold number
    /// @return the random source
    public static UniformRandomProvider stream(long seed, int stream) {
        return SOURCE.create(seed + GOLDEN_GAMMA * (stream + 1L));
    }
}
