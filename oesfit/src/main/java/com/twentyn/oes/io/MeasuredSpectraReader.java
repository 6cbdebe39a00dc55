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

package com.twentyn.oes.io;

import com.twentyn.oes.spectrum.AxisMismatchException;
import com.twentyn.oes.spectrum.Spectrum;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads measured spectra from delimited text: the first column is the wavelength axis shared by all spectra, every
 * further column one spectrum.  If the first cell is not a number the first row is a header naming the spectra,
 * otherwise they are named 1, 2, ... by column.
 */
public class MeasuredSpectraReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MeasuredSpectraReader.class);

  public static final char DEFAULT_DELIMITER = ',';

  private final CSVFormat format;

  public MeasuredSpectraReader(char delimiter) {
    this.format = CSVFormat.newFormat(delimiter).
        withQuote('"').withCommentMarker('#').withIgnoreEmptyLines(true).withIgnoreSurroundingSpaces(true);
  }

  public MeasuredSpectraReader() {
    this(DEFAULT_DELIMITER);
  }

  public LinkedHashMap<String, Spectrum> read(File file) throws IOException {
    try (InputStream is = new FileInputStream(file)) {
      return read(is);
    }
  }

  /**
   * @return Spectra by name, in column order.
   * @throws AxisMismatchException If the wavelength axis is not strictly ascending.
   * @throws IOException If a row is ragged or a cell is not a number.
   */
  public LinkedHashMap<String, Spectrum> read(InputStream inStream) throws IOException {
    List<String> names = null;
    List<List<Double>> columns = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), format)) {
      Iterator<CSVRecord> iter = parser.iterator();
      while (iter.hasNext()) {
        CSVRecord r = iter.next();
        if (names == null) {
          names = new ArrayList<>(r.size());
          if (!isNumber(r.get(0))) {
            for (int i = 1; i < r.size(); i++) {
              if (names.contains(r.get(i))) {
                throw new IOException(String.format("Spectrum name '%s' appears more than once in the header",
                    r.get(i)));
              }
              names.add(r.get(i));
            }
            continue;
          }
          for (int i = 1; i < r.size(); i++) {
            names.add(Integer.toString(i));
          }
        }
        if (r.size() != names.size() + 1) {
          throw new IOException(String.format("Line %d has %d columns, expected %d",
              r.getRecordNumber(), r.size(), names.size() + 1));
        }
        for (int i = 0; i < r.size(); i++) {
          if (columns.size() <= i) {
            columns.add(new ArrayList<>());
          }
          columns.get(i).add(parseNumber(r.get(i), r.getRecordNumber()));
        }
      }
    }

    LinkedHashMap<String, Spectrum> spectra = new LinkedHashMap<>();
    if (names == null || columns.isEmpty()) {
      LOGGER.warn("No measured data found");
      return spectra;
    }
    double[] x = toArray(columns.get(0));
    for (int i = 1; i < x.length; i++) {
      if (x[i] <= x[i - 1]) {
        throw new AxisMismatchException(String.format(
            "The wavelength axis must be ordered ascendingly, but %f follows %f", x[i], x[i - 1]));
      }
    }
    for (int i = 0; i < names.size(); i++) {
      spectra.put(names.get(i), new Spectrum(x.clone(), toArray(columns.get(i + 1))));
    }
    LOGGER.info("Read %d spectra of %d points", spectra.size(), x.length);
    return spectra;
  }

  private static boolean isNumber(String value) {
    try {
      Double.parseDouble(value);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static double parseNumber(String value, long recordNumber) throws IOException {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IOException(String.format("Line %d: '%s' is not a number", recordNumber, value), e);
    }
  }

  private static double[] toArray(List<Double> values) {
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i);
    }
    return result;
  }
}
