package io.nosqlbench.command.regimes;

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

import io.nosqlbench.command.regimes.subcommands.CMD_regimes_bands;
import io.nosqlbench.command.regimes.subcommands.CMD_regimes_check;
import io.nosqlbench.command.regimes.subcommands.CMD_regimes_detect;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Regime analysis of performance time series
///
/// This command finds level shifts (regimes) in benchmark timings and flags
/// regressions. It includes subcommands for:
///
/// - `detect`: list the changepoints of each series
/// - `check`: pass, warn or fail the newest observation of each series
/// - `bands`: emit per-observation regime means and bounds as JSON
///
/// Input is either ctest JSON result files, grouped by case, process count and
/// timer, or plain files with one value per line.
@CommandLine.Command(name = "regimes",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n",
    optionListHeading = "%nOptions:%n",
    header = "Regime detection and regression checks for performance time series",
    description = """
        Detects level shifts in benchmark time series with a robust sequential
        shift test, summarizes each regime, and checks the newest observation of
        each series for a regression.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:regression or warning found", "2:error"},
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_regimes_detect.class,
        CMD_regimes_check.class,
        CMD_regimes_bands.class,
        CommandLine.HelpCommand.class
    })
public class CMD_regimes {
    private static final Logger logger = LogManager.getLogger(CMD_regimes.class);

    /// Create the default CMD_regimes command
    public CMD_regimes() {
    }

    /// Creates a command line for this command with the parser settings shared by all entry points.
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_regimes())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Run a regimes command
    ///
    /// @param args Command line arguments passed to the regimes command
    public static void main(String[] args) {
        logger.debug("Executing command line");
        int exitCode = commandLine().execute(args);
        logger.debug("Exiting main with code: {}", exitCode);
        System.exit(exitCode);
    }
}
