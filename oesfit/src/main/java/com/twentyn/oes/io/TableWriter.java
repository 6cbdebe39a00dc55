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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rows keyed by column to UTF-8 delimited text, with the header as the first line.  Cells missing from a row
 * are left empty.
 */
public class TableWriter<K, V> implements AutoCloseable {
  public static final CSVFormat CSV_FORMAT = CSVFormat.newFormat(',').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<K> header;
  private final CSVFormat format;
  private CSVPrinter printer;

  public TableWriter(List<K> header, CSVFormat format) {
    this.header = header;
    this.format = format;
  }

  public TableWriter(List<K> header) {
    this(header, CSV_FORMAT);
  }

  public void open(File f) throws IOException {
    String[] columnNames = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      columnNames[i] = header.get(i).toString();
    }
    printer = new CSVPrinter(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8),
        format.withHeader(columnNames));
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<K, V> row) throws IOException {
    List<V> cells = new ArrayList<>(header.size());
    for (K column : header) {
      cells.add(row.get(column));
    }
    printer.printRecord(cells);
  }

  public void append(List<Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    printer.flush();
  }
}
