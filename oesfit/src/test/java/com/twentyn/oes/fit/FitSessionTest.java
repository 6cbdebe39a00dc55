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
import com.twentyn.oes.db.LineListFixtures;
import com.twentyn.oes.params.BoundedParameter;
import com.twentyn.oes.params.GlobalParameter;
import com.twentyn.oes.params.SpeciesParameter;
import com.twentyn.oes.params.SpeciesParameterSet;
import com.twentyn.oes.params.SpeciesResult;
import com.twentyn.oes.spectrum.AxisMismatchException;
import com.twentyn.oes.spectrum.Spectra;
import com.twentyn.oes.spectrum.Spectrum;
import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FitSessionTest {
  private static final double FP_TOLERANCE = 1e-9;
  private static final int POINTS_PER_NM = 100;
  private static final double GRID_START = 299.5;
  private static final double GRID_STEP = 0.02;
  private static final int GRID_POINTS = 551;
  private static final double SLIT_HWHM = 0.05;
  private static final double TRUE_TROT = 5000.0;
  private static final double TRUE_TVIB = 5000.0;

  private static final String TROT = SpeciesParameter.TROT.parameterName(LineListFixtures.SPECIES);
  private static final String TVIB = SpeciesParameter.TVIB.parameterName(LineListFixtures.SPECIES);
  private static final String INTENSITY = SpeciesParameter.INTENSITY.parameterName(LineListFixtures.SPECIES);

  private Path tempDirPath;
  private LineDatabase db;
  private FitSession session;

  @Before
  public void setUp() throws Exception {
    tempDirPath = Files.createTempDirectory(FitSessionTest.class.getName());
    LineListFixtures.writeLineList(tempDirPath);
    db = LineDatabase.open(tempDirPath, LineListFixtures.FILE_NAME);
    session = new FitSession();
  }

  @After
  public void tearDown() throws Exception {
    session.close();
    db.close();
    LineListFixtures.deleteRecursively(tempDirPath);
  }

  private static double[] grid() {
    double[] x = new double[GRID_POINTS];
    for (int i = 0; i < x.length; i++) {
      x[i] = GRID_START + i * GRID_STEP;
    }
    return x;
  }

  private static void prepareModel(SpeciesParameterSet params) {
    params.get(GlobalParameter.SLITF_GAUSS).setValue(SLIT_HWHM);
    for (GlobalParameter g : GlobalParameter.values()) {
      params.get(g).setVary(false);
    }
  }

  /**
   * A measurement that the model reproduces exactly at the true temperatures and unit intensity.
   */
  private Spectrum syntheticMeasurement() {
    FitSession generator = new FitSession();
    SpeciesParameterSet params = generator.addSpectrum("truth", new Spectrum(grid(), new double[GRID_POINTS]));
    generator.addSpecies(db, "truth", TRUE_TROT, TRUE_TVIB, 1.0);
    prepareModel(params);
    Spectrum simulated = generator.getSimulatedSpectrum("truth", params, POINTS_PER_NM);
    double[] y = Spectra.matchSpectra(simulated, generator.getMeasuredSpectrum("truth")).getLeft().getY();
    return new Spectrum(grid(), y);
  }

  private SpeciesParameterSet addSyntheticSpectrum(String id, double trot, double tvib) {
    SpeciesParameterSet params = session.addSpectrum(id, syntheticMeasurement());
    session.addSpecies(db, id, trot, tvib, 1.0);
    prepareModel(params);
    return params;
  }

  private static void assertNonIncreasing(List<Double> sums) {
    for (int i = 1; i < sums.size(); i++) {
      assertTrue(String.format("Sum of squares does not grow at iteration %d", i),
          sums.get(i) <= sums.get(i - 1) * (1.0 + 1e-9));
    }
  }

  @Test
  public void testAddSpectrum() throws Exception {
    SpeciesParameterSet params = session.addSpectrum("a",
        new Spectrum(new double[]{1.0, 2.0, 4.0}, new double[]{0.0, 1.0, 0.0}));
    assertEquals("Pixel count is the spectrum length", 3, params.getNumberOfPixels());
    assertEquals("wav_step is the mean step", 1.5, params.getValue(GlobalParameter.WAV_STEP), FP_TOLERANCE);
    assertEquals("Ids are kept", Arrays.asList("a"), session.getSpectrumIds());
    assertTrue("The session owns the parameter set", params == session.getParameters("a"));
  }

  @Test
  public void testAddedSpectrumIsDetachedFromCaller() throws Exception {
    double[] x = new double[]{1.0, 2.0, 3.0};
    double[] y = new double[]{5.0, 6.0, 7.0};
    session.addSpectrum("a", new Spectrum(x, y));
    x[0] = 0.5;
    y[1] = -1.0;
    assertArrayEquals("Later changes to the caller's x do not reach the session", new double[]{1.0, 2.0, 3.0},
        session.getRawSpectrum("a").getX(), 0.0);
    assertArrayEquals("Later changes to the caller's y do not reach the session", new double[]{5.0, 6.0, 7.0},
        session.getRawSpectrum("a").getY(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateSpectrumId() throws Exception {
    session.addSpectrum("a", new Spectrum(new double[]{1.0}, new double[]{1.0}));
    session.addSpectrum("a", new Spectrum(new double[]{1.0}, new double[]{1.0}));
  }

  @Test(expected = AxisMismatchException.class)
  public void testDescendingAxisIsRejected() throws Exception {
    session.addSpectrum("a", new Spectrum(new double[]{2.0, 1.0}, new double[]{1.0, 1.0}));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownSpectrum() throws Exception {
    session.getParameters("missing");
  }

  @Test
  public void testMeasuredSpectrumIsShifted() throws Exception {
    SpeciesParameterSet params = session.addSpectrum("a",
        new Spectrum(new double[]{1.0, 2.0}, new double[]{3.0, 4.0}));
    params.get(GlobalParameter.WAV_SHIFT).setValue(0.1);
    assertArrayEquals("x is shifted", new double[]{1.1, 2.1}, session.getMeasuredSpectrum("a").getX(),
        FP_TOLERANCE);
    assertArrayEquals("y is untouched", new double[]{3.0, 4.0}, session.getMeasuredSpectrum("a").getY(), 0.0);
    assertArrayEquals("Raw data is untouched", new double[]{1.0, 2.0}, session.getRawSpectrum("a").getX(), 0.0);
  }

  @Test
  public void testAddAndRemoveSpecies() throws Exception {
    session.addSpectrum("a", new Spectrum(grid(), new double[GRID_POINTS]));
    session.addSpectrum("b", new Spectrum(grid(), new double[GRID_POINTS]));
    Map<String, SpeciesResult> results = session.addSpeciesToAll(db, 2000.0, 2500.0, 1.0);
    assertEquals("Every spectrum gets the species", 2, results.size());
    assertTrue("Attached to a", results.get("a").isSuccess());
    assertEquals("Line list is registered once", 1, session.getDatabases().size());
    assertEquals("Temperatures are set", 2500.0,
        session.getParameters("b").getValue(LineListFixtures.SPECIES, SpeciesParameter.TVIB), FP_TOLERANCE);
    assertEquals("Second attachment is refused", SpeciesResult.STATUS.ALREADY_PRESENT,
        session.addSpecies(db, "a").getStatus());

    assertTrue("Detaching succeeds", session.removeSpecies("a", LineListFixtures.SPECIES).isSuccess());
    assertFalse("a no longer carries the species", session.getParameters("a").hasSpecies(LineListFixtures.SPECIES));
    assertTrue("b still does", session.getParameters("b").hasSpecies(LineListFixtures.SPECIES));
    assertTrue("The line list stays registered", session.getDatabases().containsKey(LineListFixtures.SPECIES));
  }

  @Test
  public void testResidualsVanishAtTheTruth() throws Exception {
    addSyntheticSpectrum("s1", TRUE_TROT, TRUE_TVIB);
    SpeciesParameterSet params = session.getParameters("s1");
    double[] residuals = session.getResiduals("s1", params, POINTS_PER_NM, false);
    assertEquals("One residual per measured point", GRID_POINTS, residuals.length);
    for (double r : residuals) {
      assertEquals("Model reproduces the measurement", 0.0, r, 1e-9);
    }
  }

  @Test
  public void testExportResults() throws Exception {
    addSyntheticSpectrum("s1", TRUE_TROT, TRUE_TVIB);
    addSyntheticSpectrum("s2", 3000.0, TRUE_TVIB);
    session.addSpectrum("bare", new Spectrum(grid(), new double[GRID_POINTS]));

    FitResultsTable table = session.exportResults(POINTS_PER_NM);
    assertEquals("Columns", Arrays.asList("spectrum", "reduced_sumsq", TROT, TROT + "_dev", TVIB, TVIB + "_dev",
        INTENSITY, INTENSITY + "_dev"), table.getHeader());
    assertEquals("One row per spectrum", 3, table.size());
    assertEquals("Perfect model", 0.0, table.getDouble("s1", FitResultsTable.REDUCED_SUMSQ_COLUMN), 1e-12);
    assertTrue("Perturbed model", table.getDouble("s2", FitResultsTable.REDUCED_SUMSQ_COLUMN) > 0.0);
    assertEquals("Temperature is reported", 3000.0, table.getDouble("s2", TROT), FP_TOLERANCE);
    assertTrue("No error before a fit", Double.isNaN(table.getDouble("s1", TROT + "_dev")));
    assertTrue("No species, no reduced sum of squares",
        Double.isNaN(table.getDouble("bare", FitResultsTable.REDUCED_SUMSQ_COLUMN)));
    assertTrue("Missing species are NaN", Double.isNaN(table.getDouble("bare", TVIB)));
  }

  @Test
  public void testReducedSumOfSquaresNeedsSignal() throws Exception {
    SpeciesParameterSet params = session.addSpectrum("flat", new Spectrum(grid(), new double[GRID_POINTS]));
    session.addSpecies(db, "flat");
    prepareModel(params);
    assertTrue("A measurement without signal has no reduced sum of squares",
        Double.isNaN(session.exportResults(POINTS_PER_NM).getDouble("flat", FitResultsTable.REDUCED_SUMSQ_COLUMN)));
  }

  @Test
  public void testExportResultsToFile() throws Exception {
    addSyntheticSpectrum("s1", TRUE_TROT, TRUE_TVIB);
    File output = tempDirPath.resolve("results.csv").toFile();
    session.exportResults(output);
    List<String> lines = Files.readAllLines(output.toPath(), StandardCharsets.UTF_8);
    assertEquals("Header and one row", 2, lines.size());
    assertEquals("Header", StringUtils.join(new String[]{"spectrum", "reduced_sumsq", TROT, TROT + "_dev",
        TVIB, TVIB + "_dev", INTENSITY, INTENSITY + "_dev"}, ","), lines.get(0));
    assertTrue("Row starts with the id", lines.get(1).startsWith("s1,"));
  }

  @Test
  public void testJsonRoundTrip() throws Exception {
    SpeciesParameterSet params = addSyntheticSpectrum("s1", 4200.0, TRUE_TVIB);
    params.get(TROT).setStderr(42.0);
    File json = tempDirPath.resolve("session.json").toFile();
    session.writeJson(json);

    try (FitSession restored = FitSession.readJson(json, tempDirPath)) {
      assertEquals("Spectra are restored", Arrays.asList("s1"), restored.getSpectrumIds());
      assertArrayEquals("Measured data is restored", session.getRawSpectrum("s1").getY(),
          restored.getRawSpectrum("s1").getY(), 0.0);
      SpeciesParameterSet restoredParams = restored.getParameters("s1");
      assertEquals("Parameters are restored", 4200.0, restoredParams.get(TROT).getValue(), FP_TOLERANCE);
      assertEquals("Errors are restored", 42.0, restoredParams.get(TROT).getStderr(), FP_TOLERANCE);
      assertEquals("Slit function is restored", SLIT_HWHM, restoredParams.getValue(GlobalParameter.SLITF_GAUSS),
          FP_TOLERANCE);
      assertTrue("Line list is reopened", restored.getDatabases().get(LineListFixtures.SPECIES).isUsable());
      assertArrayEquals("The restored session simulates the same spectrum",
          session.getResiduals("s1", params, POINTS_PER_NM, false),
          restored.getResiduals("s1", restoredParams, POINTS_PER_NM, false), 1e-12);
    }
  }

  @Test
  public void testFitWithoutVaryingParameters() throws Exception {
    SpeciesParameterSet params = addSyntheticSpectrum("s1", 4000.0, TRUE_TVIB);
    for (BoundedParameter p : params.getAllParameters().values()) {
      p.setVary(false);
    }
    FitOutcome outcome = session.fit("s1", FitOptions.DEFAULT.withPointsPerNm(POINTS_PER_NM));
    assertTrue("Nothing to do is a success", outcome.isSuccess());
    assertEquals("One evaluation", 1, outcome.getEvaluations());
    assertTrue("No parameters were varied", outcome.getParameterNames().isEmpty());
    assertTrue("The misfit is reported", outcome.getSumOfSquares() > 0.0);
    assertEquals("Values are unchanged", 4000.0, params.getValue(LineListFixtures.SPECIES, SpeciesParameter.TROT),
        FP_TOLERANCE);
    assertTrue("The outcome is remembered", outcome == session.getLastOutcome());
  }

  @Test
  public void testLeastSquaresRecoversTemperatures() throws Exception {
    SpeciesParameterSet params = addSyntheticSpectrum("s1", 3000.0, 3000.0);
    FitOutcome outcome = session.fit("s1", FitOptions.DEFAULT.withPointsPerNm(POINTS_PER_NM));

    assertTrue(String.format("Fit converges: %s", outcome.getMessage()), outcome.isSuccess());
    assertEquals("Only the species parameters vary", Arrays.asList(TROT, TVIB, INTENSITY),
        outcome.getParameterNames());
    assertEquals("Rotational temperature", TRUE_TROT, params.get(TROT).getValue(), 0.05 * TRUE_TROT);
    assertEquals("Vibrational temperature", TRUE_TVIB, params.get(TVIB).getValue(), 0.05 * TRUE_TVIB);
    assertEquals("Intensity", 1.0, params.get(INTENSITY).getValue(), 0.05);
    assertNonIncreasing(outcome.getIterationSumsOfSquares());
    List<Double> sums = outcome.getIterationSumsOfSquares();
    assertTrue("The misfit decreases", sums.get(sums.size() - 1) < sums.get(0));
    assertNotNull("The fit has a message", outcome.getMessage());
  }

  @Test
  public void testNelderMeadRecoversRotationalTemperature() throws Exception {
    SpeciesParameterSet params = addSyntheticSpectrum("s1", 3000.0, TRUE_TVIB);
    params.get(TVIB).setVary(false);
    params.get(INTENSITY).setVary(false);
    FitOutcome outcome = session.fit("s1", FitOptions.DEFAULT.withMethod(FitMethod.NELDER)
        .withPointsPerNm(POINTS_PER_NM));

    assertEquals("Method is reported", FitMethod.NELDER, outcome.getMethod());
    assertEquals("Rotational temperature", TRUE_TROT, params.get(TROT).getValue(), 0.02 * TRUE_TROT);
    assertNull("The simplex does not estimate errors", params.get(TROT).getStderr());
    assertEquals("Fixed parameters are untouched", TRUE_TVIB, params.get(TVIB).getValue(), FP_TOLERANCE);
  }

  @Test
  public void testFitAll() throws Exception {
    addSyntheticSpectrum("s1", TRUE_TROT, TRUE_TVIB);
    addSyntheticSpectrum("s2", TRUE_TROT, TRUE_TVIB);
    for (String id : session.getSpectrumIds()) {
      for (BoundedParameter p : session.getParameters(id).getAllParameters().values()) {
        p.setVary(false);
      }
    }
    Map<String, FitOutcome> outcomes = session.fitAll(FitOptions.DEFAULT.withPointsPerNm(POINTS_PER_NM));
    assertEquals("Every spectrum is fitted", Arrays.asList("s1", "s2"), Arrays.asList(
        outcomes.keySet().toArray(new String[0])));
    assertEquals("The last outcome is the last spectrum", "s2", session.getLastOutcome().getSpectrumId());
  }
}
