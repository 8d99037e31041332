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

import io.nosqlbench.downscale.DownscaleConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/// Describes how predictor fields are reduced to principal components.
///
/// ## Structure
///
/// ```
///   perVariable:   [(var1, n1), (var2, n2), ...]   EOFs of each field on its own
///   whichCombine:  [varA, varB, ...]               fields pooled into one EOF analysis
///   combinedCount: m                               components kept from the pooled analysis
/// ```
///
/// Every predictor variable has one entry in `perVariable`. Variables listed
/// in `whichCombine` contribute to the design matrix only through the pooled
/// components; the others contribute their own leading components.
///
/// When no spatial predictors are given at all, the design matrix holds the
/// raw standardized fields.
public final class SpatialPredictors {

    private final Map<String, Integer> perVariable;
    private final List<String> whichCombine;
    private final int combinedCount;

    /// @param perVariable component count per variable, in predictor order
    /// @param whichCombine the variables pooled into the combined analysis, may be empty
    /// @param combinedCount components kept from the combined analysis; ignored when nothing is combined
    public SpatialPredictors(Map<String, Integer> perVariable, Collection<String> whichCombine, int combinedCount) {
        Objects.requireNonNull(perVariable, "perVariable cannot be null");
        Objects.requireNonNull(whichCombine, "whichCombine cannot be null");
        if (perVariable.isEmpty()) {
            throw new DownscaleConfigurationException("spatial predictors need at least one variable");
        }
        perVariable.forEach((name, count) -> {
            if (count == null || count < 1) {
                throw new DownscaleConfigurationException("component count for '" + name + "' must be at least 1, got " + count);
            }
        });
        if (!perVariable.keySet().containsAll(whichCombine)) {
            List<String> unknown = new ArrayList<>(whichCombine);
            unknown.removeAll(perVariable.keySet());
            throw new DownscaleConfigurationException("combined variables " + unknown + " have no component count");
        }
        if (!whichCombine.isEmpty() && combinedCount < 1) {
            throw new DownscaleConfigurationException("combined component count must be at least 1, got " + combinedCount);
        }
        this.perVariable = Collections.unmodifiableMap(new LinkedHashMap<>(perVariable));
        this.whichCombine = List.copyOf(new LinkedHashSet<>(whichCombine));
        this.combinedCount = combinedCount;
    }

    /// One component per variable and `nPcs` components from all variables
    /// pooled together.
    ///
    /// @param varNames the predictor variables
    /// @param nPcs the number of pooled components
    /// @return the spatial predictor spec
    public static SpatialPredictors combined(List<String> varNames, int nPcs) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : varNames) {
            counts.put(name, 1);
        }
        return new SpatialPredictors(counts, varNames, nPcs);
    }

    /// Checks that this spec names exactly the given predictor variables.
    ///
    /// @param variables the variables in the predictor data
    /// @throws DownscaleConfigurationException if the sets differ
    public void requireVariables(Collection<String> variables) {
        TreeSet<String> expected = new TreeSet<>(perVariable.keySet());
        TreeSet<String> actual = new TreeSet<>(variables);
        if (!expected.equals(actual)) {
            TreeSet<String> missingFromData = new TreeSet<>(expected);
            missingFromData.removeAll(actual);
            TreeSet<String> missingFromSpec = new TreeSet<>(actual);
            missingFromSpec.removeAll(expected);
            throw new DownscaleConfigurationException("spatial predictor variables do not match the predictor data:"
                + " missing from data " + missingFromData + ", missing from spec " + missingFromSpec);
        }
    }

    public Map<String, Integer> getPerVariable() {
        return perVariable;
    }

    public List<String> getWhichCombine() {
        return whichCombine;
    }

    public int getCombinedCount() {
        return combinedCount;
    }

    public boolean isCombined(String varName) {
        return whichCombine.contains(varName);
    }

    @Override
    public String toString() {
        return "SpatialPredictors[perVariable=" + perVariable + ", combine=" + whichCombine
            + (whichCombine.isEmpty() ? "" : ", n=" + combinedCount) + "]";
    }
}
