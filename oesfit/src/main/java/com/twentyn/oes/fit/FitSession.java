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
import com.twentyn.oes.io.FitSessionModel;
import com.twentyn.oes.io.MeasuredSpectraReader;
import com.twentyn.oes.io.TableWriter;
import com.twentyn.oes.params.BoundedParameter;
import com.twentyn.oes.params.GlobalParameter;
import com.twentyn.oes.params.SpeciesParameter;
import com.twentyn.oes.params.SpeciesParameterSet;
import com.twentyn.oes.params.SpeciesResult;
import com.twentyn.oes.spectrum.AxisMismatchException;
import com.twentyn.oes.spectrum.Spectra;
import com.twentyn.oes.spectrum.Spectrum;
import com.twentyn.oes.synth.SpectrumSynthesizer;
import com.twentyn.oes.utils.JsonUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A set of measured spectra, each paired with the parameters of its model, and the line lists of every species
 * used by any of those models.  Fitting a spectrum adjusts its parameters until the synthesized spectrum matches
 * the measurement.
 */
public class FitSession implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FitSession.class);

  public static final String LINE_LIST_EXTENSION = ".db";

  private static class Entry {
    private final Spectrum measured;
    private SpeciesParameterSet params;

    private Entry(Spectrum measured, SpeciesParameterSet params) {
      this.measured = measured;
      this.params = params;
    }
  }

  private final LinkedHashMap<String, Entry> spectra = new LinkedHashMap<>();
  private final LinkedHashMap<String, LineDatabase> databases = new LinkedHashMap<>();
  private final ResidualMinimizer minimizer;
  private String sourceFile = null;
  private FitOutcome lastOutcome = null;

  public FitSession(ResidualMinimizer minimizer) {
    this.minimizer = minimizer;
  }

  public FitSession() {
    this(new CommonsMathMinimizer());
  }

  /**
   * Loads every spectrum of a delimited text file, see {@link MeasuredSpectraReader}.
   */
  public static FitSession fromCsv(File file, char delimiter) throws IOException {
    FitSession session = new FitSession();
    session.sourceFile = file.getPath();
    for (Map.Entry<String, Spectrum> entry : new MeasuredSpectraReader(delimiter).read(file).entrySet()) {
      session.addSpectrum(entry.getKey(), entry.getValue());
    }
    return session;
  }

  public static FitSession fromCsv(File file) throws IOException {
    return fromCsv(file, MeasuredSpectraReader.DEFAULT_DELIMITER);
  }

  /**
   * Adds a measured spectrum with a fresh parameter set: number_of_pixels is the spectrum's length and wav_step
   * its mean x step.
   * @throws AxisMismatchException If x is not strictly ascending.
   * @throws IllegalArgumentException If the id is already taken.
   */
  public SpeciesParameterSet addSpectrum(String id, Spectrum measured) {
    if (spectra.containsKey(id)) {
      throw new IllegalArgumentException(String.format("Spectrum %s is already present", id));
    }
    double[] x = measured.getX();
    for (int i = 1; i < x.length; i++) {
      if (x[i] <= x[i - 1]) {
        throw new AxisMismatchException(
            String.format("Spectrum %s: the x axis must be ordered ascendingly", id));
      }
    }
    SpeciesParameterSet params = new SpeciesParameterSet(measured.size());
    if (x.length > 1) {
      params.get(GlobalParameter.WAV_STEP).setValue((x[x.length - 1] - x[0]) / (x.length - 1));
    }
    spectra.put(id, new Entry(Spectrum.copyOf(measured), params));
    return params;
  }

  public List<String> getSpectrumIds() {
    return Collections.unmodifiableList(new ArrayList<>(spectra.keySet()));
  }

  private Entry entry(String id) {
    Entry entry = spectra.get(id);
    if (entry == null) {
      throw new IllegalArgumentException(String.format("No spectrum with id %s", id));
    }
    return entry;
  }

  public SpeciesParameterSet getParameters(String id) {
    return entry(id).params;
  }

  public void setParameters(String id, SpeciesParameterSet params) {
    entry(id).params = params;
  }

  /**
   * @return The measurement as stored, without the wavelength shift.
   */
  public Spectrum getRawSpectrum(String id) {
    return entry(id).measured;
  }

  /**
   * @return A copy of the measurement with x shifted by the spectrum's wav_shift.
   */
  public Spectrum getMeasuredSpectrum(String id) {
    return shifted(entry(id).measured, entry(id).params);
  }

  private static Spectrum shifted(Spectrum measured, SpeciesParameterSet params) {
    double shift = params.getValue(GlobalParameter.WAV_SHIFT);
    double[] x = Arrays.copyOf(measured.getX(), measured.size());
    for (int i = 0; i < x.length; i++) {
      x[i] += shift;
    }
    return new Spectrum(x, Arrays.copyOf(measured.getY(), measured.size()));
  }

  public Map<String, LineDatabase> getDatabases() {
    return Collections.unmodifiableMap(databases);
  }

  /**
   * Makes a line list available to every spectrum.  A line list already registered under the same species name is
   * kept.
   */
  public LineDatabase registerDatabase(LineDatabase database) {
    LineDatabase existing = databases.get(database.getSpeciesName());
    if (existing != null) {
      if (existing != database) {
        LOGGER.debug("Species %s already has a line list, keeping %s", existing.getSpeciesName(),
            existing.getFileName());
      }
      return existing;
    }
    databases.put(database.getSpeciesName(), database);
    return database;
  }

  public SpeciesResult addSpecies(LineDatabase database, String id, double trot, double tvib, double intensity) {
    Entry entry = entry(id);
    registerDatabase(database);
    return entry.params.addSpecies(database.getSpeciesName(), trot, tvib, intensity);
  }

  public SpeciesResult addSpecies(LineDatabase database, String id) {
    return addSpecies(database, id, SpeciesParameter.TROT.getDefaultValue(),
        SpeciesParameter.TVIB.getDefaultValue(), SpeciesParameter.INTENSITY.getDefaultValue());
  }

  public Map<String, SpeciesResult> addSpeciesToAll(LineDatabase database, double trot, double tvib,
                                                    double intensity) {
    Map<String, SpeciesResult> results = new LinkedHashMap<>();
    for (String id : spectra.keySet()) {
      results.put(id, addSpecies(database, id, trot, tvib, intensity));
    }
    return results;
  }

  /**
   * Detaches a species from one spectrum.  Its line list stays registered.
   */
  public SpeciesResult removeSpecies(String id, String speciesName) {
    return entry(id).params.removeSpecies(speciesName);
  }

  /**
   * Synthesizes the model of a spectrum over the range of its shifted measurement.
   */
  public Spectrum getSimulatedSpectrum(String id, SpeciesParameterSet params, int pointsPerNm) {
    Spectrum measured = shifted(entry(id).measured, params);
    if (measured.isEmpty()) {
      return new Spectrum();
    }
    return SpectrumSynthesizer.synthesize(params, databases, measured.minX(), measured.maxX(),
        params.getValue(GlobalParameter.WAV_STEP), pointsPerNm);
  }

  /**
   * @return simulated - measured on the measured grid, for the given parameters rather than the stored ones.
   */
  public double[] getResiduals(String id, SpeciesParameterSet params, int pointsPerNm, boolean weighted) {
    Spectrum measured = shifted(entry(id).measured, params);
    Spectrum simulated = getSimulatedSpectrum(id, params, pointsPerNm);
    return weighted ? Spectra.compareWeighted(measured, simulated) : Spectra.compare(measured, simulated);
  }

  public double[] getResiduals(String id) {
    return getResiduals(id, entry(id).params, SpectrumSynthesizer.DEFAULT_POINTS_PER_NM, false);
  }

  /**
   * Fits the model of one spectrum.  The best values found are written into its parameter set whether or not the
   * optimizer converged, along with their standard errors where the method provides them.
   */
  public FitOutcome fit(String id, FitOptions options) {
    final Entry entry = entry(id);
    final SpeciesParameterSet working = new SpeciesParameterSet(entry.params);
    final List<BoundedParameter> varying = working.getVaryingParameters();
    final int pointsPerNm = options.getPointsPerNm();
    final boolean weighted = options.isWeighted();

    List<String> names = new ArrayList<>(varying.size());
    double[] start = new double[varying.size()];
    double[] lower = new double[varying.size()];
    double[] upper = new double[varying.size()];
    for (int i = 0; i < varying.size(); i++) {
      BoundedParameter p = varying.get(i);
      names.add(p.getName());
      start[i] = p.getValue();
      lower[i] = p.getMin();
      upper[i] = p.getMax();
    }

    LOGGER.info("Fitting spectrum %s: %d varying parameters, %s", id, varying.size(), options);
    MinimizerResult result;
    if (varying.isEmpty()) {
      double[] residuals = getResiduals(id, working, pointsPerNm, weighted);
      double sumsq = 0.0;
      for (double r : residuals) {
        sumsq += r * r;
      }
      result = new MinimizerResult(new double[0], null, true, "No parameters to vary", sumsq, 1,
          Collections.singletonList(sumsq));
    } else {
      result = minimizer.minimize(new ResidualFunction() {
        @Override
        public double[] value(double[] parameters) {
          for (int i = 0; i < parameters.length; i++) {
            varying.get(i).setValue(parameters[i]);
          }
          return getResiduals(id, working, pointsPerNm, weighted);
        }
      }, start, lower, upper, options);
    }

    double[] values = result.getValues();
    double[] stderr = result.getStandardErrors();
    for (int i = 0; i < names.size(); i++) {
      BoundedParameter p = entry.params.get(names.get(i));
      p.setValue(values[i]);
      p.setStderr(stderr == null ? null : stderr[i]);
    }

    lastOutcome = new FitOutcome(id, options.getMethod(), Collections.unmodifiableList(names), result);
    if (result.isSuccess()) {
      LOGGER.info("%s", lastOutcome);
    } else {
      LOGGER.warn("%s", lastOutcome);
    }
    return lastOutcome;
  }

  public FitOutcome fit(String id) {
    return fit(id, FitOptions.DEFAULT);
  }

  public Map<String, FitOutcome> fitAll(FitOptions options) {
    Map<String, FitOutcome> outcomes = new LinkedHashMap<>();
    for (String id : spectra.keySet()) {
      outcomes.put(id, fit(id, options));
    }
    return outcomes;
  }

  /**
   * @return The outcome of the most recent fit, or null if nothing was fitted yet.
   */
  public FitOutcome getLastOutcome() {
    return lastOutcome;
  }

  public String getSourceFile() {
    return sourceFile;
  }

  public FitResultsTable exportResults() {
    return exportResults(SpectrumSynthesizer.DEFAULT_POINTS_PER_NM);
  }

  /**
   * Tabulates the current parameters of every spectrum, see {@link FitResultsTable}.  reduced_sumsq is the sum of
   * squared finite residuals divided by the sum of the baseline-corrected measured signal.
   */
  public FitResultsTable exportResults(int pointsPerNm) {
    List<String> header = new ArrayList<>();
    header.add(FitResultsTable.SPECTRUM_COLUMN);
    header.add(FitResultsTable.REDUCED_SUMSQ_COLUMN);
    for (String species : databases.keySet()) {
      for (SpeciesParameter kind : SpeciesParameter.values()) {
        header.add(kind.parameterName(species));
        header.add(kind.parameterName(species) + FitResultsTable.DEVIATION_SUFFIX);
      }
    }

    FitResultsTable table = new FitResultsTable(header);
    for (Map.Entry<String, Entry> e : spectra.entrySet()) {
      SpeciesParameterSet params = e.getValue().params;
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(FitResultsTable.SPECTRUM_COLUMN, e.getKey());
      row.put(FitResultsTable.REDUCED_SUMSQ_COLUMN, reducedSumOfSquares(e.getKey(), params, pointsPerNm));
      for (String species : databases.keySet()) {
        for (SpeciesParameter kind : SpeciesParameter.values()) {
          BoundedParameter p = params.get(species, kind);
          Double stderr = p == null ? null : p.getStderr();
          row.put(kind.parameterName(species), p == null ? Double.NaN : p.getValue());
          row.put(kind.parameterName(species) + FitResultsTable.DEVIATION_SUFFIX,
              stderr == null ? Double.NaN : stderr);
        }
      }
      table.addRow(row);
    }
    return table;
  }

  private double reducedSumOfSquares(String id, SpeciesParameterSet params, int pointsPerNm) {
    if (params.getSpecies().isEmpty()) {
      return Double.NaN;
    }
    double sumsq = 0.0;
    for (double r : getResiduals(id, params, pointsPerNm, false)) {
      if (!Double.isInfinite(r) && !Double.isNaN(r)) {
        sumsq += r * r;
      }
    }
    Spectrum measured = entry(id).measured;
    if (measured.isEmpty()) {
      return Double.NaN;
    }
    double baseline = params.getValue(GlobalParameter.BASELINE);
    double slope = params.getValue(GlobalParameter.BASELINE_SLOPE);
    double xmin = measured.minX();
    double[] x = measured.getX();
    double[] y = measured.getY();
    double signal = 0.0;
    for (int i = 0; i < y.length; i++) {
      signal += y[i] - baseline - slope * (x[i] - xmin);
    }
    if (!(signal > 0.0) || Double.isInfinite(signal)) {
      LOGGER.warn("Spectrum %s: baseline-corrected signal sums to %f, reduced_sumsq undefined", id, signal);
      return Double.NaN;
    }
    return sumsq / signal;
  }

  public void exportResults(File outputFile) throws IOException {
    FitResultsTable table = exportResults();
    try (TableWriter<String, Object> writer = new TableWriter<>(table.getHeader())) {
      writer.open(outputFile);
      writer.append(table.getRows());
    }
    LOGGER.info("Wrote results of %d spectra to %s", table.size(), outputFile.getAbsolutePath());
  }

  public void writeJson(File outputFile) throws IOException {
    FitSessionModel model = new FitSessionModel();
    model.setSourceFile(sourceFile);
    for (Map.Entry<String, Entry> e : spectra.entrySet()) {
      Spectrum measured = e.getValue().measured;
      model.getSpectra().put(e.getKey(), new FitSessionModel.MeasuredData(measured.getX(), measured.getY()));
      model.getParams().put(e.getKey(), e.getValue().params.toModel());
    }
    model.getSimulations().addAll(databases.keySet());
    JsonUtils.OBJECT_MAPPER.writeValue(outputFile, model);
  }

  /**
   * Restores a session written by {@link #writeJson(File)}, reopening each species' line list as
   * lineListDir/species.db.
   */
  public static FitSession readJson(File inputFile, Path lineListDir) throws IOException {
    FitSessionModel model = JsonUtils.OBJECT_MAPPER.readValue(inputFile, FitSessionModel.class);
    FitSession session = new FitSession();
    session.sourceFile = model.getSourceFile();
    for (Map.Entry<String, FitSessionModel.MeasuredData> e : model.getSpectra().entrySet()) {
      Spectrum measured = new Spectrum(e.getValue().getX(), e.getValue().getY());
      SpeciesParameterSet.Model params = model.getParams().get(e.getKey());
      session.spectra.put(e.getKey(), new Entry(measured,
          params == null ? new SpeciesParameterSet(measured.size()) : SpeciesParameterSet.fromModel(params)));
    }
    for (String species : model.getSimulations()) {
      session.registerDatabase(LineDatabase.open(lineListDir, species + LINE_LIST_EXTENSION));
    }
    return session;
  }

  @Override
  public void close() {
    for (LineDatabase db : databases.values()) {
      db.close();
    }
    databases.clear();
  }
}
