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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.downscale.DownscaleConfigurationException;
import io.nosqlbench.downscale.DownscaleOptions;
import io.nosqlbench.downscale.folds.CrossValidationMode;
import io.nosqlbench.downscale.folds.FoldPlan;
import io.nosqlbench.downscale.grid.ScaleType;
import io.nosqlbench.downscale.grid.SpatialFrame;
import io.nosqlbench.downscale.method.SelectionFunction;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * JSON-serializable downscaling options.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "method": "glm",
 *   "simulate": false,
 *   "n_analogs": 1,
 *   "sel_fun": "mean",
 *   "wet_threshold": 1.0,
 *   "n_pcs": 15,
 *   "cross_val": "kfold",
 *   "folds": 3,               // or 0.75, or [[1985, 1986], [1987], [1988, 1989]]
 *   "seed": 42,
 *   "threads": 4,
 *   "scale_type": "standardize",
 *   "spatial_frame": "gridbox"
 * }
 * }</pre>
 *
 * <p>Every field is optional; absent fields keep the {@link DownscaleOptions} defaults.
 */
public class DownscaleConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("method")
    private String method;

    @SerializedName("simulate")
    private Boolean simulate;

    @SerializedName("n_analogs")
    private Integer nAnalogs;

    @SerializedName("sel_fun")
    private String selFun;

    @SerializedName("wet_threshold")
    private Double wetThreshold;

    /** Pooled principal components; absent means raw standardized fields */
    @SerializedName("n_pcs")
    private Integer nPcs;

    @SerializedName("cross_val")
    private String crossVal;

    /** A fold count, a train fraction, or an array of year arrays */
    @SerializedName("folds")
    private JsonElement folds;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("threads")
    private Integer threads;

    @SerializedName("scale_type")
    private String scaleType;

    @SerializedName("spatial_frame")
    private String spatialFrame;

    public DownscaleConfig() {
    }

    public static DownscaleConfig fromJson(String json) {
        return parse(() -> GSON.fromJson(json, DownscaleConfig.class));
    }

    public static DownscaleConfig fromJson(Reader reader) {
        return parse(() -> GSON.fromJson(reader, DownscaleConfig.class));
    }

    /**
     * Loads a configuration file.
     *
     * @param path the JSON file
     * @return the configuration
     * @throws IOException if the file cannot be read
     * @throws DownscaleConfigurationException if the file is not valid JSON for this schema
     */
    public static DownscaleConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private interface JsonSource {
        DownscaleConfig read();
    }

    private static DownscaleConfig parse(JsonSource source) {
        try {
            DownscaleConfig config = source.read();
            return config == null ? new DownscaleConfig() : config;
        } catch (JsonParseException e) {
            throw new DownscaleConfigurationException("invalid downscaling configuration: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Copies the fields present in this configuration onto a builder.
     *
     * @param builder the options builder
     * @return the same builder
     * @throws DownscaleConfigurationException if a field holds an invalid value
     */
    public DownscaleOptions.Builder applyTo(DownscaleOptions.Builder builder) {
        if (method != null) {
            builder.method(method);
        }
        if (simulate != null) {
            builder.simulate(simulate);
        }
        if (nAnalogs != null) {
            builder.nAnalogs(nAnalogs);
        }
        if (selFun != null) {
            builder.selectionFunction(SelectionFunction.parse(selFun));
        }
        if (wetThreshold != null) {
            builder.wetThreshold(wetThreshold);
        }
        if (nPcs != null) {
            builder.nPcs(nPcs);
        }
        if (crossVal != null) {
            builder.crossValidation(CrossValidationMode.parse(crossVal));
        }
        if (folds != null && !folds.isJsonNull()) {
            builder.folds(foldPlan(folds));
        }
        if (seed != null) {
            builder.seed(seed);
        }
        if (threads != null) {
            builder.parallelism(threads);
        }
        if (scaleType != null) {
            builder.scaleType(parseEnum(ScaleType.class, scaleType, "scale_type"));
        }
        if (spatialFrame != null) {
            builder.spatialFrame(parseEnum(SpatialFrame.class, spatialFrame, "spatial_frame"));
        }
        return builder;
    }

    static FoldPlan foldPlan(JsonElement element) {
        if (element.isJsonPrimitive()) {
            if (element.getAsJsonPrimitive().isNumber()) {
                return FoldPlan.ofNumber(element.getAsDouble());
            }
            return FoldPlanConverter.parse(element.getAsString());
        }
        if (element.isJsonArray()) {
            List<List<Integer>> plan = new ArrayList<>();
            for (JsonElement fold : element.getAsJsonArray()) {
                if (!fold.isJsonArray()) {
                    throw new DownscaleConfigurationException("explicit folds must be arrays of years, got " + fold);
                }
                List<Integer> years = new ArrayList<>();
                for (JsonElement year : (JsonArray) fold) {
                    years.add(year.getAsInt());
                }
                plan.add(years);
            }
            return new FoldPlan.Explicit(plan);
        }
        throw new DownscaleConfigurationException("folds must be a number, a string or an array of year arrays, got "
            + element);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String field) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DownscaleConfigurationException("invalid " + field + " '" + value + "'", e);
        }
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public Boolean getSimulate() {
        return simulate;
    }

    public void setSimulate(Boolean simulate) {
        this.simulate = simulate;
    }

    public Integer getNAnalogs() {
        return nAnalogs;
    }

    public void setNAnalogs(Integer nAnalogs) {
        this.nAnalogs = nAnalogs;
    }

    public Double getWetThreshold() {
        return wetThreshold;
    }

    public void setWetThreshold(Double wetThreshold) {
        this.wetThreshold = wetThreshold;
    }

    public Integer getNPcs() {
        return nPcs;
    }

    public void setNPcs(Integer nPcs) {
        this.nPcs = nPcs;
    }

    public String getCrossVal() {
        return crossVal;
    }

    public void setCrossVal(String crossVal) {
        this.crossVal = crossVal;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }
}
