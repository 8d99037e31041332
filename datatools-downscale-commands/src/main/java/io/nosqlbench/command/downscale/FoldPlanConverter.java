package io.nosqlbench.command.downscale;

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
import io.nosqlbench.downscale.folds.FoldPlan;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/// Parses a fold argument.
///
/// | Form | Plan |
/// |------|------|
/// | `3` | three chronological folds |
/// | `0.75` | first 75% of the years, then the rest |
/// | `1985,1986;1987;1988,1989` | explicit year folds, separated by `;` |
/// | `1990,` | one explicit fold holding a single year |
public class FoldPlanConverter implements CommandLine.ITypeConverter<FoldPlan> {

    @Override
    public FoldPlan convert(String value) {
        return parse(value);
    }

    /// @throws DownscaleConfigurationException if the value is not a count, fraction or fold list
    public static FoldPlan parse(String value) {
        if (value == null || value.isBlank()) {
            throw new DownscaleConfigurationException("empty fold argument");
        }
        String trimmed = value.trim();
        if (trimmed.contains(";") || trimmed.contains(",")) {
            List<List<Integer>> folds = new ArrayList<>();
            for (String fold : trimmed.split(";")) {
                List<Integer> years = new ArrayList<>();
                for (String year : fold.split(",")) {
                    if (!year.isBlank()) {
                        years.add(parseYear(year.trim()));
                    }
                }
                folds.add(years);
            }
            return new FoldPlan.Explicit(folds);
        }
        try {
            return FoldPlan.ofNumber(Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            throw new DownscaleConfigurationException("invalid fold argument '" + value + "'", e);
        }
    }

    private static int parseYear(String year) {
        try {
            return Integer.parseInt(year);
        } catch (NumberFormatException e) {
            throw new DownscaleConfigurationException("invalid fold year '" + year + "'", e);
        }
    }
}
