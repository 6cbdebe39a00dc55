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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row per spectrum: its id, the normalized residual and the temperatures and intensities of every species known
 * to the session, with their standard errors.  Missing values are NaN.
 */
public class FitResultsTable {
  public static final String SPECTRUM_COLUMN = "spectrum";
  public static final String REDUCED_SUMSQ_COLUMN = "reduced_sumsq";
  public static final String DEVIATION_SUFFIX = "_dev";

  private final List<String> header;
  private final List<Map<String, Object>> rows = new ArrayList<>();

  public FitResultsTable(List<String> header) {
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
  }

  public List<String> getHeader() {
    return header;
  }

  public void addRow(Map<String, Object> row) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (String column : header) {
      copy.put(column, row.get(column));
    }
    rows.add(copy);
  }

  public List<Map<String, Object>> getRows() {
    return Collections.unmodifiableList(rows);
  }

  public Map<String, Object> getRow(String spectrumId) {
    for (Map<String, Object> row : rows) {
      if (spectrumId.equals(row.get(SPECTRUM_COLUMN))) {
        return row;
      }
    }
    return null;
  }

  public double getDouble(String spectrumId, String column) {
    Map<String, Object> row = getRow(spectrumId);
    if (row == null) {
      throw new IllegalArgumentException(String.format("No results for spectrum %s", spectrumId));
    }
    Object value = row.get(column);
    if (!(value instanceof Double)) {
      throw new IllegalArgumentException(String.format("Column %s is not numeric", column));
    }
    return (Double) value;
  }

  public int size() {
    return rows.size();
  }
}
