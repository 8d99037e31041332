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
import io.nosqlbench.downscale.DownscaleOptions;
import io.nosqlbench.downscale.Downscaler;
import io.nosqlbench.downscale.ModelFitException;
import io.nosqlbench.downscale.folds.CrossValidationMode;
import io.nosqlbench.downscale.folds.FoldPlan;
import io.nosqlbench.downscale.grid.Grid;
import io.nosqlbench.downscale.method.SelectionFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Downscale a local predictand from large-scale predictor fields.
///
/// Inputs and output are CSV grids (see [GridCsv]). Options come from an
/// optional JSON file (see [DownscaleConfig]); options given on the command
/// line override the file.
///
/// ```
/// downscale --x era_psl_ta.csv --y station_pr.csv --newdata gcm_psl_ta.csv \
///   --method glm --wet-threshold 1 --n-pcs 15 --output pr_downscaled.csv
///
/// downscale --x era.csv --y pr.csv --method analogs --cross-val kfold --folds 0.75 --output cv.csv
/// ```
@CommandLine.Command(name = "downscale",
    header = "Perfect-prog statistical downscaling",
    description = """
        Trains an analog, generalized linear or linear model relating the predictor
        fields in --x to the predictand in --y and predicts the predictand for --newdata.
        With --cross-val the model is instead evaluated over chronological folds of
        the training period.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:configuration error", "2:I/O or model fit error"},
    exitCodeOnInvalidInput = 1,
    exitCodeOnExecutionException = 2,
    mixinStandardHelpOptions = true)
public class CMD_downscale implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_downscale.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_CONFIG_ERROR = 1;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"--x"}, description = "Predictor fields CSV", required = true)
    private Path xPath;

    @CommandLine.Option(names = {"--y"}, description = "Predictand CSV, one variable, on the dates of --x", required = true)
    private Path yPath;

    @CommandLine.Option(names = {"--newdata"}, description = "Predictor fields to predict from (default: --x)")
    private Path newdataPath;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Prediction CSV", required = true)
    private Path outputPath;

    @CommandLine.Option(names = {"-f", "--force"}, description = "Overwrite the output file if it exists")
    private boolean force;

    @CommandLine.Option(names = {"--config"}, description = "JSON options file")
    private Path configPath;

    @CommandLine.Option(names = {"--method"}, description = "analogs, glm or lm")
    private String method;

    @CommandLine.Option(names = {"--simulate"}, arity = "0..1", fallbackValue = "true",
        description = "Simulate from the fitted distributions (glm and lm)")
    private Boolean simulate;

    @CommandLine.Option(names = {"--n-analogs"}, description = "Number of analogs")
    private Integer nAnalogs;

    @CommandLine.Option(names = {"--sel-fun"}, description = "Analog selection function: mean, wmean, max, min, median")
    private String selFun;

    @CommandLine.Option(names = {"--wet-threshold"}, description = "Wet/dry threshold of the predictand (glm)")
    private Double wetThreshold;

    @CommandLine.Option(names = {"--n-pcs"}, description = "Pooled principal components of the predictors")
    private Integer nPcs;

    @CommandLine.Option(names = {"--cross-val"}, description = "none, loocv or kfold")
    private String crossVal;

    @CommandLine.Option(names = {"--folds"}, converter = FoldPlanConverter.class,
        description = "Fold count (3), train fraction (0.75) or year folds (1985,1986;1987,1988)")
    private FoldPlan folds;

    @CommandLine.Option(names = {"--seed"}, description = "Random seed for simulation")
    private Long seed;

    @CommandLine.Option(names = {"--threads"}, description = "Folds run in parallel during cross-validation")
    private Integer threads;

    public static void main(String[] args) {
        CMD_downscale cmd = new CMD_downscale();
        int exitCode = new CommandLine(cmd).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (Files.exists(outputPath) && !force) {
            System.err.println("Error: output file " + outputPath + " exists; use --force to overwrite");
            return EXIT_CONFIG_ERROR;
        }

        DownscaleOptions options;
        try {
            options = buildOptions();
        } catch (DownscaleConfigurationException e) {
            logger.error("invalid options: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (IOException e) {
            logger.error("cannot read config {}", configPath, e);
            System.err.println("Error: cannot read " + configPath + ": " + e.getMessage());
            return EXIT_ERROR;
        }

        Grid x;
        Grid y;
        Grid newdata;
        try {
            x = GridCsv.read(xPath);
            y = GridCsv.read(yPath);
            newdata = newdataPath == null ? x : GridCsv.read(newdataPath);
        } catch (IOException e) {
            logger.error("cannot read input grids", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        Grid prediction;
        try {
            prediction = Downscaler.downscale(y, x, newdata, options);
        } catch (DownscaleConfigurationException e) {
            logger.error("invalid downscaling setup: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        } catch (ModelFitException e) {
            logger.error("model fit failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            GridCsv.write(prediction, outputPath);
        } catch (IOException e) {
            logger.error("cannot write {}", outputPath, e);
            System.err.println("Error: cannot write " + outputPath + ": " + e.getMessage());
            return EXIT_ERROR;
        }
        logger.info("wrote {} to {}", prediction, outputPath);
        System.out.println("Wrote " + prediction.timeCount() + " predictions for " + prediction.pointCount()
            + " point(s) to " + outputPath);
        return EXIT_SUCCESS;
    }

    DownscaleOptions buildOptions() throws IOException {
        DownscaleOptions.Builder builder = DownscaleOptions.builder();
        if (configPath != null) {
            DownscaleConfig.loadFromFile(configPath).applyTo(builder);
        }
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
        if (folds != null) {
            builder.folds(folds);
        }
        if (seed != null) {
            builder.seed(seed);
        }
        if (threads != null) {
            builder.parallelism(threads);
        }
        return builder.build();
    }
}
