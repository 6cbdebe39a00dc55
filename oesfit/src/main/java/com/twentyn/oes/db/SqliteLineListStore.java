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

package com.twentyn.oes.db;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A line list kept in an SQLite file with the tables
 * <pre>
 *   upper_states(id, J, E_J, E_v, v, component)
 *   lines(id, air_wavelength, vacuum_wavelength, A, wavenumber, upper_state, lower_state, branch)
 * </pre>
 */
public class SqliteLineListStore implements LineListStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SqliteLineListStore.class);

  public static final String STATES_TABLE = "upper_states";
  public static final String LINES_TABLE = "lines";

  // The SQLite file header is 100 bytes and starts with this magic string.
  public static final int SQLITE_HEADER_SIZE = 100;
  public static final byte[] SQLITE_MAGIC = "SQLite format 3\u0000".getBytes(StandardCharsets.US_ASCII);

  public static final String QUERY_GET_UPPER_STATES = StringUtils.join(new String[]{
      "SELECT J, E_J, E_v",
      "FROM", STATES_TABLE,
  }, " ");

  public static final String QUERY_GET_STATE_LINES = StringUtils.join(new String[]{
      "SELECT", StringUtils.join(new String[]{
          LINES_TABLE + ".id", "A", "%1$s", "upper_state", "branch", "wavenumber", "lower_state",
          "E_J", "J", "component", "E_v", "v"}, ", "),
      "FROM", LINES_TABLE,
      "INNER JOIN", STATES_TABLE, "ON upper_state =", STATES_TABLE + ".id",
      "WHERE", LINES_TABLE + ".%1$s BETWEEN ? AND ?",
  }, " ");

  private final Path path;
  private Connection conn;

  protected SqliteLineListStore(Path path, Connection conn) {
    this.path = path;
    this.conn = conn;
  }

  /**
   * Opens the store at path.
   * @throws DataSourceException If the file is not an SQLite database or cannot be opened.
   */
  public static SqliteLineListStore open(Path path) {
    if (!isSQLite3(path)) {
      throw new DataSourceException(String.format("The file %s is not a valid database!", path));
    }
    try {
      Connection conn = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
      LOGGER.debug("Opened line list store at %s", path);
      return new SqliteLineListStore(path, conn);
    } catch (SQLException e) {
      throw new DataSourceException(String.format("Unable to open line list store %s", path), e);
    }
  }

  /**
   * Checks the file exists and carries the SQLite 3 header signature.
   */
  public static boolean isSQLite3(Path path) {
    if (!Files.isRegularFile(path)) {
      return false;
    }
    try {
      if (Files.size(path) < SQLITE_HEADER_SIZE) {
        return false;
      }
      byte[] header = new byte[SQLITE_MAGIC.length];
      try (InputStream is = Files.newInputStream(path)) {
        if (is.read(header) != header.length) {
          return false;
        }
      }
      return Arrays.equals(header, SQLITE_MAGIC);
    } catch (IOException e) {
      LOGGER.warn("Unable to read header of %s: %s", path, e.getMessage());
      return false;
    }
  }

  public Path getPath() {
    return path;
  }

  @Override
  public List<UpperState> fetchUpperStates() {
    List<UpperState> states = new ArrayList<>();
    try (PreparedStatement stmt = conn.prepareStatement(QUERY_GET_UPPER_STATES);
         ResultSet resultSet = stmt.executeQuery()) {
      while (resultSet.next()) {
        states.add(new UpperState(resultSet.getDouble(1), resultSet.getDouble(2), resultSet.getDouble(3)));
      }
    } catch (SQLException e) {
      throw new DataSourceException(String.format("Unable to read upper states from %s", path), e);
    }
    return states;
  }

  protected static String makeLinesQuery(Double wmin, Double wmax, WavelengthMedium medium) {
    String column = medium.getColumn();
    List<String> conditions = new ArrayList<>(2);
    if (wmin != null) {
      conditions.add(column + " >= ?");
    }
    if (wmax != null) {
      conditions.add(column + " <= ?");
    }
    String linesSource = conditions.isEmpty() ? LINES_TABLE :
        StringUtils.join(new String[]{
            "(SELECT * FROM", LINES_TABLE, "WHERE", StringUtils.join(conditions, " AND "), ")"}, " ");
    return StringUtils.join(new String[]{
        "SELECT air_wavelength, vacuum_wavelength, A, J, E_J, E_v, wavenumber",
        "FROM", linesSource,
        "INNER JOIN", STATES_TABLE, "ON upper_state =", STATES_TABLE + ".id",
        "ORDER BY", column,
    }, " ");
  }

  @Override
  public List<LineRecord> fetchLines(Double wmin, Double wmax, WavelengthMedium medium) {
    List<LineRecord> lines = new ArrayList<>();
    try (PreparedStatement stmt = conn.prepareStatement(makeLinesQuery(wmin, wmax, medium))) {
      int paramIndex = 1;
      if (wmin != null) {
        stmt.setDouble(paramIndex++, wmin);
      }
      if (wmax != null) {
        stmt.setDouble(paramIndex, wmax);
      }
      try (ResultSet resultSet = stmt.executeQuery()) {
        while (resultSet.next()) {
          UpperState state = new UpperState(resultSet.getDouble(4), resultSet.getDouble(5), resultSet.getDouble(6));
          lines.add(new LineRecord(resultSet.getDouble(1), resultSet.getDouble(2), resultSet.getDouble(3),
              resultSet.getDouble(7), state));
        }
      }
    } catch (SQLException e) {
      throw new DataSourceException(String.format("Unable to read lines from %s", path), e);
    }
    LOGGER.debug("Fetched %d lines in [%s, %s] from %s", lines.size(), wmin, wmax, path);
    return lines;
  }

  @Override
  public List<StateLine> fetchStateLines(double wmin, double wmax, WavelengthMedium medium,
                                         Integer maxJ, Integer maxV) {
    StringBuilder query = new StringBuilder(String.format(QUERY_GET_STATE_LINES, medium.getColumn()));
    if (maxV != null) {
      query.append(" AND v <= ?");
    }
    if (maxJ != null) {
      query.append(" AND J <= ?");
    }

    List<StateLine> lines = new ArrayList<>();
    try (PreparedStatement stmt = conn.prepareStatement(query.toString())) {
      int paramIndex = 1;
      stmt.setDouble(paramIndex++, wmin);
      stmt.setDouble(paramIndex++, wmax);
      if (maxV != null) {
        stmt.setInt(paramIndex++, maxV);
      }
      if (maxJ != null) {
        stmt.setInt(paramIndex, maxJ);
      }
      try (ResultSet resultSet = stmt.executeQuery()) {
        while (resultSet.next()) {
          Long lowerState = resultSet.getLong(7);
          if (resultSet.wasNull()) {
            lowerState = null;
          }
          lines.add(new StateLine(resultSet.getLong(1), resultSet.getDouble(3), resultSet.getDouble(2),
              resultSet.getDouble(6), resultSet.getLong(4), lowerState, resultSet.getString(5),
              resultSet.getDouble(9), resultSet.getDouble(8), resultSet.getInt(12), resultSet.getDouble(11),
              resultSet.getString(10)));
        }
      }
    } catch (SQLException e) {
      throw new DataSourceException(String.format("Unable to read lines by state from %s", path), e);
    }
    return lines;
  }

  @Override
  public void close() {
    if (conn == null) {
      return;
    }
    try {
      if (!conn.isClosed()) {
        conn.close();
      }
    } catch (SQLException e) {
      throw new DataSourceException(String.format("Unable to close line list store %s", path), e);
    } finally {
      conn = null;
    }
  }
}
