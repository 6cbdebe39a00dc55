/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.oes.fit;

import com.twentyn.oes.db.LineDatabase;
import com.twentyn.oes.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class FitSpectra {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FitSpectra.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_DELIMITER = "d";
  public static final String OPTION_LINE_LISTS = "l";
  public static final String OPTION_SPECIES = "s";
  public static final String OPTION_METHOD = "m";
  public static final String OPTION_MAX_ITERATIONS = "n";
  public static final String OPTION_POINTS_PER_NM = "p";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_JSON_OUTPUT = "j";

  public static final String DEFAULT_LINE_LIST_DIR = ".";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Fits simulated emission spectra of the given species to every measured spectrum in a delimited text file ",
      "and reports temperatures, intensities and their standard errors per spectrum."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input file")
        .desc("A delimited text file: a wavelength column followed by one column per measured spectrum")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_DELIMITER)
        .argName("delimiter")
        .desc("The column delimiter of the input file (default: ',')")
        .hasArg()
        .longOpt("delimiter")
    );
    add(Option.builder(OPTION_LINE_LISTS)
        .argName("directory")
        .desc(String.format("The directory holding the line list databases (default: %s)", DEFAULT_LINE_LIST_DIR))
        .hasArg()
        .longOpt("line-lists")
    );
    add(Option.builder(OPTION_SPECIES)
        .argName("file names")
        .desc("A comma separated list of line list files to fit with, like OH.db,N2.db")
        .hasArgs().valueSeparator(',').required()
        .longOpt("species")
    );
    add(Option.builder(OPTION_METHOD)
        .argName("method")
        .desc("The optimization method: leastsq, nelder or powell (default: leastsq)")
        .hasArg()
        .longOpt("method")
    );
    add(Option.builder(OPTION_MAX_ITERATIONS)
        .argName("count")
        .desc(String.format("The maximum number of function evaluations (default: %d)",
            FitOptions.DEFAULT_MAX_ITERATIONS))
        .hasArg()
        .longOpt("max-iterations")
    );
    add(Option.builder(OPTION_POINTS_PER_NM)
        .argName("density")
        .desc("The density of the simulation mesh in points per nm")
        .hasArg()
        .longOpt("points-per-nm")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("A JSON file with fit settings and parameter overrides; command line options take precedence")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output file")
        .desc("Write the fit results as CSV to this file")
        .hasArg()
        .longOpt("output")
    );
    add(Option.builder(OPTION_JSON_OUTPUT)
        .argName("json file")
        .desc("Write the whole session (data and fitted parameters) as JSON to this file")
        .hasArg()
        .longOpt("json")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(FitSpectra.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.isFile()) {
      CLI_UTIL.failWithMessage("Input file %s does not exist", inputFile.getAbsolutePath());
    }
    Path lineListDir = Paths.get(cl.getOptionValue(OPTION_LINE_LISTS, DEFAULT_LINE_LIST_DIR));
    String delimiter = cl.getOptionValue(OPTION_DELIMITER, ",");
    if (delimiter.length() != 1) {
      CLI_UTIL.failWithMessage("The delimiter must be a single character, got '%s'", delimiter);
    }

    FitConfiguration config = cl.hasOption(OPTION_CONFIG) ?
        FitConfiguration.readFromFile(new File(cl.getOptionValue(OPTION_CONFIG))) : new FitConfiguration();
    if (cl.hasOption(OPTION_METHOD)) {
      config.setMethod(cl.getOptionValue(OPTION_METHOD));
    }
    if (cl.hasOption(OPTION_MAX_ITERATIONS)) {
      config.setMaxIterations(Integer.parseInt(cl.getOptionValue(OPTION_MAX_ITERATIONS)));
    }
    if (cl.hasOption(OPTION_POINTS_PER_NM)) {
      config.setPointsPerNm(Integer.parseInt(cl.getOptionValue(OPTION_POINTS_PER_NM)));
    }
    FitOptions options = config.toFitOptions();

    try (FitSession session = FitSession.fromCsv(inputFile, delimiter.charAt(0))) {
      for (String fileName : cl.getOptionValues(OPTION_SPECIES)) {
        LineDatabase db = LineDatabase.open(lineListDir, fileName.trim());
        if (!db.isUsable()) {
          CLI_UTIL.failWithMessage("Unable to use line list %s in %s", fileName, lineListDir.toString());
        }
        for (String id : session.getSpectrumIds()) {
          session.addSpecies(db, id);
        }
      }
      for (String id : session.getSpectrumIds()) {
        config.applyTo(session.getParameters(id));
      }

      int failures = 0;
      for (Map.Entry<String, FitOutcome> entry : session.fitAll(options).entrySet()) {
        if (!entry.getValue().isSuccess()) {
          failures++;
        }
      }
      LOGGER.info("Fitted %d spectra, %d did not converge", session.getSpectrumIds().size(), failures);

      if (cl.hasOption(OPTION_OUTPUT)) {
        session.exportResults(new File(cl.getOptionValue(OPTION_OUTPUT)));
      }
      if (cl.hasOption(OPTION_JSON_OUTPUT)) {
        File jsonFile = new File(cl.getOptionValue(OPTION_JSON_OUTPUT));
        session.writeJson(jsonFile);
        LOGGER.info("Wrote session to %s", jsonFile.getAbsolutePath());
      }
    }
  }
}
