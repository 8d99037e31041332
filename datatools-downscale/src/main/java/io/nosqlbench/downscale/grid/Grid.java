package io.nosqlbench.downscale.grid;

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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

/// Time-indexed, multi-variable, multi-point numeric series.
///
/// ## Layout
///
/// ```
///   data[variable][time][point]
///
///   variable: one entry per name in getVarNames()
///   time:     one entry per date in getRefDates(), strictly increasing
///   point:    one entry per grid box or station in getPointIds()
/// ```
///
/// A predictor field is a grid with several variables and many points; a
/// station predictand is a grid with one variable and one point per station.
/// `NaN` marks a masked value, one that is structurally absent rather than
/// zero.
///
/// ## Immutability
///
/// Grids are immutable. The constructor copies the data it is given and
/// every accessor that returns an array returns a copy, so a grid handed to
/// the downscaling core is never modified by it. All transformations return
/// new grids.
public final class Grid {

    private final List<LocalDate> dates;
    private final List<String> varNames;
    private final List<String> pointIds;
    private final double[][][] data;

    /// Creates a grid, copying the supplied data.
    ///
    /// @param dates reference dates, strictly increasing
    /// @param varNames variable names, unique
    /// @param pointIds point identifiers, unique
    /// @param data values indexed as `[variable][time][point]`
    /// @throws IllegalArgumentException if the data shape does not match the axes
    public Grid(List<LocalDate> dates, List<String> varNames, List<String> pointIds, double[][][] data) {
        Objects.requireNonNull(dates, "dates cannot be null");
        Objects.requireNonNull(varNames, "varNames cannot be null");
        Objects.requireNonNull(pointIds, "pointIds cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        if (varNames.isEmpty()) {
            throw new IllegalArgumentException("a grid needs at least one variable");
        }
        if (pointIds.isEmpty()) {
            throw new IllegalArgumentException("a grid needs at least one point");
        }
        if (new TreeSet<>(varNames).size() != varNames.size()) {
            throw new IllegalArgumentException("variable names must be unique: " + varNames);
        }
        if (new TreeSet<>(pointIds).size() != pointIds.size()) {
            throw new IllegalArgumentException("point ids must be unique: " + pointIds);
        }
        for (int t = 1; t < dates.size(); t++) {
            if (!dates.get(t).isAfter(dates.get(t - 1))) {
                throw new IllegalArgumentException("dates must be strictly increasing, found "
                    + dates.get(t - 1) + " followed by " + dates.get(t));
            }
        }
        if (data.length != varNames.size()) {
            throw new IllegalArgumentException("expected " + varNames.size() + " variables, got " + data.length);
        }
        this.data = new double[data.length][][];
        for (int v = 0; v < data.length; v++) {
            if (data[v].length != dates.size()) {
                throw new IllegalArgumentException("variable " + varNames.get(v) + " has " + data[v].length
                    + " time steps, expected " + dates.size());
            }
            this.data[v] = new double[data[v].length][];
            for (int t = 0; t < data[v].length; t++) {
                if (data[v][t].length != pointIds.size()) {
                    throw new IllegalArgumentException("variable " + varNames.get(v) + " at " + dates.get(t)
                        + " has " + data[v][t].length + " points, expected " + pointIds.size());
                }
                this.data[v][t] = data[v][t].clone();
            }
        }
        this.dates = List.copyOf(dates);
        this.varNames = List.copyOf(varNames);
        this.pointIds = List.copyOf(pointIds);
    }

    /// Creates a single-variable grid from a `[time][point]` matrix.
    ///
    /// @param dates reference dates
    /// @param varName the variable name
    /// @param pointIds point identifiers
    /// @param values values indexed as `[time][point]`
    /// @return the grid
    public static Grid of(List<LocalDate> dates, String varName, List<String> pointIds, double[][] values) {
        return new Grid(dates, List.of(varName), pointIds, new double[][][]{values});
    }

    /// Creates a single-variable, single-point series.
    ///
    /// @param dates reference dates
    /// @param varName the variable name
    /// @param pointId the point (station) identifier
    /// @param values one value per date
    /// @return the grid
    public static Grid series(List<LocalDate> dates, String varName, String pointId, double[] values) {
        double[][] matrix = new double[values.length][1];
        for (int t = 0; t < values.length; t++) {
            matrix[t][0] = values[t];
        }
        return of(dates, varName, List.of(pointId), matrix);
    }

    /// @return the reference dates
    public List<LocalDate> getRefDates() {
        return dates;
    }

    /// @return the variable names
    public List<String> getVarNames() {
        return varNames;
    }

    /// @return the point identifiers
    public List<String> getPointIds() {
        return pointIds;
    }

    public int timeCount() {
        return dates.size();
    }

    public int pointCount() {
        return pointIds.size();
    }

    public int varCount() {
        return varNames.size();
    }

    /// Returns a single value.
    public double get(int variable, int time, int point) {
        return data[variable][time][point];
    }

    /// Returns a copy of one variable as a `[time][point]` matrix.
    ///
    /// @param variable the variable index
    /// @return a copy of the variable's values
    public double[][] values(int variable) {
        double[][] copy = new double[data[variable].length][];
        for (int t = 0; t < copy.length; t++) {
            copy[t] = data[variable][t].clone();
        }
        return copy;
    }

    /// Returns a copy of one point of a variable as a series over time.
    public double[] series(int variable, int point) {
        double[] out = new double[timeCount()];
        for (int t = 0; t < out.length; t++) {
            out[t] = data[variable][t][point];
        }
        return out;
    }

    /// Returns the index of a variable.
    ///
    /// @param varName the variable name
    /// @return the index
    /// @throws IllegalArgumentException if the variable does not exist
    public int varIndex(String varName) {
        int index = varNames.indexOf(varName);
        if (index < 0) {
            throw new IllegalArgumentException("no variable '" + varName + "' in " + varNames);
        }
        return index;
    }

    /// Returns the distinct calendar years covered, in chronological order.
    public SortedSet<Integer> years() {
        SortedSet<Integer> years = new TreeSet<>();
        for (LocalDate date : dates) {
            years.add(date.getYear());
        }
        return years;
    }

    /// Returns the time indices whose year is one of the given years, in
    /// chronological order.
    public int[] indicesOfYears(Collection<Integer> years) {
        return IntStream.range(0, dates.size())
            .filter(t -> years.contains(dates.get(t).getYear()))
            .toArray();
    }

    /// Selects time steps by index. Indices must be strictly increasing so that
    /// the result keeps chronological order.
    ///
    /// @param indices the time indices to keep
    /// @return the sub-grid
    public Grid subsetIndices(int[] indices) {
        for (int i = 1; i < indices.length; i++) {
            if (indices[i] <= indices[i - 1]) {
                throw new IllegalArgumentException("indices must be strictly increasing: " + Arrays.toString(indices));
            }
        }
        List<LocalDate> subDates = new ArrayList<>(indices.length);
        for (int index : indices) {
            subDates.add(dates.get(index));
        }
        double[][][] sub = new double[varCount()][indices.length][];
        for (int v = 0; v < varCount(); v++) {
            for (int i = 0; i < indices.length; i++) {
                sub[v][i] = data[v][indices[i]];
            }
        }
        return new Grid(subDates, varNames, pointIds, sub);
    }

    /// Selects the time steps falling in the given years.
    public Grid subsetYears(Collection<Integer> years) {
        return subsetIndices(indicesOfYears(years));
    }

    /// Selects one variable.
    public Grid subsetVariable(String varName) {
        int v = varIndex(varName);
        return new Grid(dates, List.of(varName), pointIds, new double[][][]{data[v]});
    }

    /// Returns a grid with the same axes as this one and new values.
    ///
    /// @param values new values indexed as `[variable][time][point]`
    /// @return the new grid
    public Grid withData(double[][][] values) {
        return new Grid(dates, varNames, pointIds, values);
    }

    /// Returns a single-variable grid with the same dates and points as this
    /// one and new `[time][point]` values.
    public Grid withValues(String varName, double[][] values) {
        return new Grid(dates, List.of(varName), pointIds, new double[][][]{values});
    }

    /// Returns a copy of all data as `[variable][time][point]`.
    public double[][][] data() {
        double[][][] copy = new double[varCount()][][];
        for (int v = 0; v < copy.length; v++) {
            copy[v] = values(v);
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        Grid that = (Grid) o;
        return dates.equals(that.dates) && varNames.equals(that.varNames)
            && pointIds.equals(that.pointIds) && Arrays.deepEquals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dates, varNames, pointIds, Arrays.deepHashCode(data));
    }

    @Override
    public String toString() {
        String range = dates.isEmpty() ? "empty" : dates.get(0) + ".." + dates.get(dates.size() - 1);
        return "Grid[vars=" + varNames + ", points=" + pointIds.size() + ", times=" + dates.size()
            + " (" + range + ")]";
    }
}
