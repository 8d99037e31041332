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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/// Turns a [FoldPlan] into concrete train/test folds over a date sequence.
///
/// ## Fold construction
///
/// Folds are built over calendar years, never across them:
///
/// ```
///   years:   1985 1986 1987 1988 1989 1990 1991 1992 1993
///   KFold(3): [1985 1986 1987][1988 1989 1990][1991 1992 1993]
///   KFoldFraction(0.75): train [1985 .. 1991], test [1992 1993]   round(0.75 × 9) = 7
///   LeaveOneYearOut: [1985][1986] ... [1993]
/// ```
///
/// Contiguous folds differ in size by at most one year; when the years do
/// not divide evenly the earlier folds hold one more. Explicit folds keep the
/// caller's order but the years inside each fold are sorted.
///
/// The test period of a fold is held out; training uses every other time
/// step. A [FoldPlan.KFoldFraction] is a single train/test cycle, so only
/// the years after the training fraction are ever predicted. The
/// [FoldPlan.None] plan yields a single fold whose training and test periods
/// are both the full series.
public final class FoldPlanner {

    private static final Logger logger = LogManager.getLogger(FoldPlanner.class);

    private FoldPlanner() {
    }

    /// Plans the folds of a series.
    ///
    /// @param plan the fold plan
    /// @param dates the series dates, chronological
    /// @return the folds, in visiting order
    /// @throws DownscaleConfigurationException if the plan does not fit the data
    public static List<Fold> plan(FoldPlan plan, List<LocalDate> dates) {
        Objects.requireNonNull(plan, "plan cannot be null");
        Objects.requireNonNull(dates, "dates cannot be null");
        List<Integer> years = new ArrayList<>(distinctYears(dates));
        List<List<Integer>> yearFolds;
        if (plan instanceof FoldPlan.None) {
            int[] all = IntStream.range(0, dates.size()).toArray();
            return List.of(new Fold(0, years, all, all));
        } else if (plan instanceof FoldPlan.LeaveOneYearOut) {
            yearFolds = chronologicalSplit(years, years.size());
        } else if (plan instanceof FoldPlan.KFold) {
            int count = ((FoldPlan.KFold) plan).count();
            if (count > years.size()) {
                throw new DownscaleConfigurationException("cannot split " + years.size() + " years into " + count + " folds");
            }
            yearFolds = chronologicalSplit(years, count);
        } else if (plan instanceof FoldPlan.KFoldFraction) {
            List<List<Integer>> parts = fractionSplit(years, ((FoldPlan.KFoldFraction) plan).fraction());
            List<Fold> single = List.of(yearFold(0, parts.get(1), dates));
            logger.debug("planned a train/test split for {}: {}", plan, single);
            return single;
        } else if (plan instanceof FoldPlan.Explicit) {
            yearFolds = explicitFolds(((FoldPlan.Explicit) plan).folds(), years);
        } else {
            throw new IllegalStateException("unhandled fold plan " + plan);
        }

        List<Fold> folds = new ArrayList<>(yearFolds.size());
        for (int i = 0; i < yearFolds.size(); i++) {
            folds.add(yearFold(i, yearFolds.get(i), dates));
        }
        logger.debug("planned {} folds for {}: {}", folds.size(), plan, folds);
        return folds;
    }

    private static Fold yearFold(int number, List<Integer> years, List<LocalDate> dates) {
        Set<Integer> testYears = new HashSet<>(years);
        int[] test = IntStream.range(0, dates.size()).filter(t -> testYears.contains(dates.get(t).getYear())).toArray();
        int[] train = IntStream.range(0, dates.size()).filter(t -> !testYears.contains(dates.get(t).getYear())).toArray();
        return new Fold(number, years, test, train);
    }

    /// Splits an ordered sequence into `count` contiguous groups whose sizes
    /// differ by at most one, earlier groups taking the remainder.
    ///
    /// @param units the ordered units
    /// @param count the number of groups, between 1 and the number of units
    /// @param <T> the unit type
    /// @return the groups, in order; their concatenation is `units`
    public static <T> List<List<T>> chronologicalSplit(List<T> units, int count) {
        Objects.requireNonNull(units, "units cannot be null");
        if (count < 1 || count > units.size()) {
            throw new DownscaleConfigurationException("cannot split " + units.size() + " units into " + count + " folds");
        }
        int base = units.size() / count;
        int remainder = units.size() % count;
        List<List<T>> groups = new ArrayList<>(count);
        int start = 0;
        for (int g = 0; g < count; g++) {
            int size = base + (g < remainder ? 1 : 0);
            groups.add(List.copyOf(units.subList(start, start + size)));
            start += size;
        }
        return groups;
    }

    /// Splits an ordered sequence in two, the first part holding
    /// `round(fraction × size)` units. The first part is the training period
    /// of a fraction plan, the second its test period.
    ///
    /// @param units the ordered units
    /// @param fraction the share of the first part, in (0, 1)
    /// @param <T> the unit type
    /// @return the two parts
    /// @throws DownscaleConfigurationException if either part would be empty
    public static <T> List<List<T>> fractionSplit(List<T> units, double fraction) {
        Objects.requireNonNull(units, "units cannot be null");
        int first = (int) Math.round(fraction * units.size());
        if (first < 1 || first >= units.size()) {
            throw new DownscaleConfigurationException("a train fraction of " + fraction + " over " + units.size()
                + " years leaves an empty fold");
        }
        return List.of(List.copyOf(units.subList(0, first)), List.copyOf(units.subList(first, units.size())));
    }

    private static List<List<Integer>> explicitFolds(List<List<Integer>> given, List<Integer> available) {
        Set<Integer> seen = new HashSet<>();
        List<List<Integer>> folds = new ArrayList<>(given.size());
        for (List<Integer> fold : given) {
            SortedSet<Integer> sorted = new TreeSet<>(fold);
            for (Integer year : sorted) {
                if (!available.contains(year)) {
                    throw new DownscaleConfigurationException("fold year " + year + " is not in the data " + available);
                }
                if (!seen.add(year)) {
                    throw new DownscaleConfigurationException("year " + year + " appears in more than one fold");
                }
            }
            folds.add(List.copyOf(sorted));
        }
        return folds;
    }

    private static SortedSet<Integer> distinctYears(List<LocalDate> dates) {
        SortedSet<Integer> years = new TreeSet<>();
        for (LocalDate date : dates) {
            years.add(date.getYear());
        }
        return years;
    }
}
