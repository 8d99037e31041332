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

import io.nosqlbench.downscale.grid.Grid;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads and writes grids as comma-separated text.
///
/// ```
///   date,psl:g1,psl:g2,ta850:g1,ta850:g2
///   1985-01-01,1012.5,1010.1,271.3,270.9
///   1985-01-02,1009.8,NA,272.0,271.4
/// ```
///
/// Columns are named `variable:point`. Every variable must carry the same
/// points in the same order. Empty cells and `NA` read as `NaN`; `NaN` is
/// written as `NA`.
public final class GridCsv {

    static final String MISSING = "NA";

    private GridCsv() {
    }

    /// Reads a grid.
    ///
    /// @param path the CSV file
    /// @return the grid
    /// @throws IOException if the file cannot be read or is malformed
    public static Grid read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null) {
                throw new IOException(path + " is empty");
            }
            String[] columns = header.trim().split(",", -1);
            if (columns.length < 2 || !columns[0].trim().equalsIgnoreCase("date")) {
                throw new IOException(path + ": header must start with 'date' followed by variable:point columns");
            }

            Map<String, List<String>> pointsByVar = new LinkedHashMap<>();
            for (int c = 1; c < columns.length; c++) {
                String column = columns[c].trim();
                int colon = column.lastIndexOf(':');
                if (colon <= 0 || colon == column.length() - 1) {
                    throw new IOException(path + ": column '" + column + "' is not of the form variable:point");
                }
                pointsByVar.computeIfAbsent(column.substring(0, colon), k -> new ArrayList<>())
                    .add(column.substring(colon + 1));
            }
            List<String> varNames = new ArrayList<>(pointsByVar.keySet());
            List<String> pointIds = pointsByVar.get(varNames.get(0));
            for (Map.Entry<String, List<String>> entry : pointsByVar.entrySet()) {
                if (!entry.getValue().equals(pointIds)) {
                    throw new IOException(path + ": variable " + entry.getKey() + " has points " + entry.getValue()
                        + ", expected " + pointIds);
                }
            }

            List<LocalDate> dates = new ArrayList<>();
            List<double[]> rows = new ArrayList<>();
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] cells = line.split(",", -1);
                if (cells.length != columns.length) {
                    throw new IOException(path + ":" + lineNumber + ": expected " + columns.length + " cells, found "
                        + cells.length);
                }
                try {
                    dates.add(LocalDate.parse(cells[0].trim()));
                } catch (DateTimeParseException e) {
                    throw new IOException(path + ":" + lineNumber + ": invalid date '" + cells[0] + "'", e);
                }
                double[] row = new double[cells.length - 1];
                for (int c = 1; c < cells.length; c++) {
                    row[c - 1] = parseCell(cells[c], path, lineNumber);
                }
                rows.add(row);
            }

            int points = pointIds.size();
            double[][][] data = new double[varNames.size()][rows.size()][points];
            for (int t = 0; t < rows.size(); t++) {
                for (int v = 0; v < varNames.size(); v++) {
                    System.arraycopy(rows.get(t), v * points, data[v][t], 0, points);
                }
            }
            try {
                return new Grid(dates, varNames, pointIds, data);
            } catch (IllegalArgumentException e) {
                throw new IOException(path + ": " + e.getMessage(), e);
            }
        }
    }

    private static double parseCell(String cell, Path path, int lineNumber) throws IOException {
        String value = cell.trim();
        if (value.isEmpty() || value.equalsIgnoreCase(MISSING)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IOException(path + ":" + lineNumber + ": invalid number '" + value + "'", e);
        }
    }

    /// Writes a grid, replacing any existing file.
    ///
    /// @param grid the grid
    /// @param path the target file
    /// @throws IOException if the file cannot be written
    public static void write(Grid grid, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            StringBuilder header = new StringBuilder("date");
            for (String var : grid.getVarNames()) {
                for (String point : grid.getPointIds()) {
                    header.append(',').append(var).append(':').append(point);
                }
            }
            writer.write(header.toString());
            writer.newLine();
            for (int t = 0; t < grid.timeCount(); t++) {
                StringBuilder row = new StringBuilder(grid.getRefDates().get(t).toString());
                for (int v = 0; v < grid.varCount(); v++) {
                    for (int p = 0; p < grid.pointCount(); p++) {
                        row.append(',').append(format(grid.get(v, t, p)));
                    }
                }
                writer.write(row.toString());
                writer.newLine();
            }
        }
    }

    private static String format(double value) {
        return Double.isNaN(value) ? MISSING : Double.toString(value);
    }
}
