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

import com.twentyn.oes.spectrum.Spectrum;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The tabulated transitions of one species, turned into a Boltzmann-weighted line spectrum on request.
 *
 * Every request updates an explicit {@link LineCache}: the transitions of the last (enlarged) window are kept until a
 * request leaves that window, and the population weights are kept until either temperature changes.  Instances are
 * meant to be shared by all spectra referencing the species, but are not thread safe.
 */
public class LineDatabase implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(LineDatabase.class);

  private final String speciesName;
  private final String fileName;
  private final LineListStore store;
  private final List<UpperState> states;
  private final String unusableReason;

  private LineCache cache = null;

  public LineDatabase(String speciesName, String fileName, LineListStore store) {
    this.speciesName = speciesName;
    this.fileName = fileName;
    this.store = store;
    this.states = Collections.unmodifiableList(store.fetchUpperStates());
    this.unusableReason = null;
  }

  public LineDatabase(String speciesName, LineListStore store) {
    this(speciesName, speciesName + ".db", store);
  }

  private LineDatabase(String speciesName, String fileName, String unusableReason) {
    this.speciesName = speciesName;
    this.fileName = fileName;
    this.store = null;
    this.states = Collections.emptyList();
    this.unusableReason = unusableReason;
  }

  /**
   * Opens the line list dataDir/fileName.  The species is named after the file, up to its first '.'.  A file that is
   * missing or not an SQLite database yields an unusable instance whose spectrum requests all fail.
   */
  public static LineDatabase open(Path dataDir, String fileName) {
    String speciesName = speciesNameFromFileName(fileName);
    Path path = dataDir.resolve(fileName);
    if (!SqliteLineListStore.isSQLite3(path)) {
      String reason = String.format("The file %s is not a valid database!", path);
      LOGGER.warn("%s", reason);
      return new LineDatabase(speciesName, fileName, reason);
    }
    return new LineDatabase(speciesName, fileName, SqliteLineListStore.open(path));
  }

  public static String speciesNameFromFileName(String fileName) {
    int nameStop = fileName.indexOf('.');
    return nameStop < 0 ? fileName : fileName.substring(0, nameStop);
  }

  public String getSpeciesName() {
    return speciesName;
  }

  public String getFileName() {
    return fileName;
  }

  public boolean isUsable() {
    return store != null;
  }

  private void ensureUsable() {
    if (!isUsable()) {
      throw new DataSourceException(String.format("Line list for %s is unusable: %s", speciesName, unusableReason));
    }
  }

  public List<UpperState> getStates() {
    return states;
  }

  /**
   * @return The partition function: the sum of Boltzmann weights over all distinct upper states.
   */
  public double calculateNorm(double trot, double tvib) {
    ensureUsable();
    double norm = 0.0;
    for (UpperState state : states) {
      norm += state.boltzmannWeight(trot, tvib);
    }
    return norm;
  }

  /**
   * @return The occupation probability of every upper state, in the order of {@link #getStates()}.
   */
  public double[] getPopulations(double trot, double tvib) {
    double norm = calculateNorm(trot, tvib);
    double[] populations = new double[states.size()];
    for (int i = 0; i < populations.length; i++) {
      populations[i] = states.get(i).boltzmannWeight(trot, tvib) / norm;
    }
    return populations;
  }

  /**
   * @return True if a request for this window and these temperatures would be served without fetching lines or
   * recomputing populations.
   */
  public boolean isCacheValid(double wmin, double wmax, double trot, double tvib, WavelengthMedium medium) {
    return cache != null && cache.coversWindow(wmin, wmax, medium) && cache.hasPopulationsFor(trot, tvib);
  }

  public boolean isCacheValid(double wmin, double wmax, double trot, double tvib) {
    return isCacheValid(wmin, wmax, trot, tvib, WavelengthMedium.AIR);
  }

  /**
   * @return The (enlarged) window of the cached lines, or null before the first request.
   */
  public Pair<Double, Double> getCachedWindow() {
    return cache == null ? null : Pair.of(cache.getWmin(), cache.getWmax());
  }

  /**
   * @return The partition function of the last request, or null before the first request.
   */
  public Double getCachedNorm() {
    return cache == null ? null : cache.getNorm();
  }

  public Spectrum getSpectrum(double trot, double tvib, Double wmin, Double wmax) {
    return getSpectrum(trot, tvib, wmin, wmax, SpectrumRequest.DEFAULT);
  }

  /**
   * Computes the emission of every transition within [wmin, wmax] (plus the reserve) at the given temperatures.
   *
   * @param trot Rotational temperature in K.
   * @param tvib Vibrational temperature in K.
   * @param wmin Lower end of the window, or null for unbounded.
   * @param wmax Upper end of the window, or null for unbounded.
   * @param request Wavelength medium, y quantity and window reserve.
   * @return An unsorted scatter with one point per transition, not on a uniform grid.
   * @throws DataSourceException If the line list is unusable.
   */
  public Spectrum getSpectrum(double trot, double tvib, Double wmin, Double wmax, SpectrumRequest request) {
    ensureUsable();
    WavelengthMedium medium = request.getMedium();
    double lo = wmin == null ? Double.NEGATIVE_INFINITY : wmin;
    double hi = wmax == null ? Double.POSITIVE_INFINITY : wmax;

    if (cache == null || !cache.coversWindow(lo, hi, medium)) {
      double cacheMin = lo - request.getWavelengthReserve();
      double cacheMax = hi + request.getWavelengthReserve();
      List<LineRecord> lines = store.fetchLines(finiteOrNull(cacheMin), finiteOrNull(cacheMax), medium);
      LOGGER.debug("%s: fetched %d lines for window [%f, %f]", speciesName, lines.size(), cacheMin, cacheMax);
      cache = new LineCache(cacheMin, cacheMax, medium, lines);
    }

    if (!cache.hasPopulationsFor(trot, tvib)) {
      double norm = calculateNorm(trot, tvib);
      List<LineRecord> lines = cache.getLines();
      double[] populations = new double[lines.size()];
      for (int i = 0; i < populations.length; i++) {
        populations[i] = lines.get(i).getUpperState().boltzmannWeight(trot, tvib) / norm;
      }
      cache.setPopulations(trot, tvib, norm, populations);
    }

    List<LineRecord> lines = cache.getLines();
    double[] populations = cache.getPopulations();
    double[] x = new double[lines.size()];
    double[] y = new double[lines.size()];
    for (int i = 0; i < x.length; i++) {
      LineRecord line = lines.get(i);
      x[i] = line.getWavelength(medium);
      y[i] = populations[i] * line.getEmissionCoefficient();
      if (request.getQuantity() == OutputQuantity.INTENSITY) {
        y[i] *= line.getWavenumber();
      }
    }
    return new Spectrum(x, y);
  }

  /**
   * Groups the lines within [wmin, wmax] by the state they are emitted from, e.g. for Boltzmann plots.
   */
  public List<StateLines> getLinesByStates(double wmin, double wmax, LinesByStateRequest request) {
    ensureUsable();
    List<StateLine> lines =
        store.fetchStateLines(wmin, wmax, request.getMedium(), request.getMaxJ(), request.getMaxV());

    Map<String, List<StateLine>> groups;
    if (request.isSingletLike()) {
      groups = new TreeMap<>(Comparator
          .comparingInt((String k) -> Integer.parseInt(k.substring(0, k.indexOf(','))))
          .thenComparingDouble(k -> Double.parseDouble(k.substring(k.indexOf(',') + 1))));
    } else {
      groups = new TreeMap<>(Comparator.comparingLong(Long::parseLong));
    }
    for (StateLine line : lines) {
      String key = request.isSingletLike() ?
          String.format("%d,%s", line.getV(), Double.toString(line.getJ())) :
          Long.toString(line.getUpperStateId());
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(line);
    }

    List<StateLines> result = new ArrayList<>();
    for (Map.Entry<String, List<StateLine>> entry : groups.entrySet()) {
      List<StateLine> group = entry.getValue();
      if (group.size() < request.getMinLines()) {
        continue;
      }
      List<Pair<Double, Double>> wavelengthAndA = new ArrayList<>(group.size());
      for (StateLine line : group) {
        wavelengthAndA.add(Pair.of(line.getWavelength(), line.getEmissionCoefficient()));
      }
      StateLine first = group.get(0);
      if (request.isSingletLike()) {
        // Average the energies over the distinct fine-structure states sharing this (v, J).
        Map<Long, StateLine> distinctStates = new LinkedHashMap<>();
        for (StateLine line : group) {
          distinctStates.putIfAbsent(line.getUpperStateId(), line);
        }
        double meanRotational = 0.0;
        double meanVibrational = 0.0;
        for (StateLine state : distinctStates.values()) {
          meanRotational += state.getRotationalEnergy() / distinctStates.size();
          meanVibrational += state.getVibrationalEnergy() / distinctStates.size();
        }
        result.add(new StateLines(entry.getKey(), first.getJ(), meanRotational, first.getV(), meanVibrational,
            null, wavelengthAndA));
      } else {
        result.add(new StateLines(entry.getKey(), first.getJ(), first.getRotationalEnergy(), first.getV(),
            first.getVibrationalEnergy(), first.getComponent(), wavelengthAndA));
      }
    }
    LOGGER.debug("%s: %d states with at least %d lines in [%f, %f]",
        speciesName, result.size(), request.getMinLines(), wmin, wmax);
    return result;
  }

  private static Double finiteOrNull(double value) {
    return Double.isInfinite(value) ? null : value;
  }

  @Override
  public void close() {
    if (store != null) {
      store.close();
    }
  }
}
