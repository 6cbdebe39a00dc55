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
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class LineDatabaseTest {
  private static final double FP_TOLERANCE = 1e-9;

  private Path tempDirPath;
  private LineDatabase db;

  @Before
  public void setUp() throws Exception {
    tempDirPath = Files.createTempDirectory(LineDatabaseTest.class.getName());
    LineListFixtures.writeLineList(tempDirPath);
    db = LineDatabase.open(tempDirPath, LineListFixtures.FILE_NAME);
  }

  @After
  public void tearDown() throws Exception {
    db.close();
    LineListFixtures.deleteRecursively(tempDirPath);
  }

  @Test
  public void testOpen() throws Exception {
    assertTrue("Fixture line list is usable", db.isUsable());
    assertEquals("Species is named after the file", LineListFixtures.SPECIES, db.getSpeciesName());
    assertEquals("File name is kept", LineListFixtures.FILE_NAME, db.getFileName());
    assertEquals("State table is loaded", LineListFixtures.NUM_STATES, db.getStates().size());
    assertEquals("Name stops at the first dot", "OH", LineDatabase.speciesNameFromFileName("OH.A-X.db"));
  }

  @Test(expected = DataSourceException.class)
  public void testUnusableDatabaseFailsOnRequest() throws Exception {
    LineDatabase missing = LineDatabase.open(tempDirPath, "N2.db");
    assertFalse("Missing file yields an unusable line list", missing.isUsable());
    assertEquals("Unusable line lists are still named", "N2", missing.getSpeciesName());
    missing.getSpectrum(1000.0, 1000.0, 300.0, 310.0);
  }

  @Test
  public void testPopulationsSumToOne() throws Exception {
    double[] populations = db.getPopulations(3000.0, 5000.0);
    double sum = 0.0;
    for (double p : populations) {
      sum += p;
    }
    assertEquals("State populations are normalized", 1.0, sum, FP_TOLERANCE);
  }

  @Test
  public void testCalculateNorm() throws Exception {
    double expected = 0.0;
    for (int v = 0; v <= LineListFixtures.MAX_V; v++) {
      for (int j = 0; j <= LineListFixtures.MAX_J; j++) {
        expected += (2 * j + 1) * Math.exp(
            -LineListFixtures.rotationalEnergy(j) / (PhysicalConstants.BOLTZMANN_WAVENUMBER * 2000.0)
                - LineListFixtures.vibrationalEnergy(v) / (PhysicalConstants.BOLTZMANN_WAVENUMBER * 4000.0));
      }
    }
    assertEquals("Partition function sums over the state table", expected, db.calculateNorm(2000.0, 4000.0),
        expected * 1e-12);
  }

  @Test
  public void testBoltzmannConstant() throws Exception {
    assertEquals("k in cm-1/K", 0.6950348, PhysicalConstants.BOLTZMANN_WAVENUMBER, 1e-6);
  }

  @Test
  public void testGetSpectrum() throws Exception {
    Spectrum spectrum = db.getSpectrum(5000.0, 5000.0, 300.0, 301.0);
    double norm = db.calculateNorm(5000.0, 5000.0);

    int origin = indexOf(spectrum.getX(), LineListFixtures.BAND_ORIGIN);
    // J = 0, v = 0 has unit weight.
    assertEquals("Ground state line carries A / Z", LineListFixtures.A_P / norm, spectrum.getY()[origin],
        FP_TOLERANCE);

    double j5 = LineListFixtures.airWavelength(0, 5);
    int index = indexOf(spectrum.getX(), j5);
    double expected = 11 * Math.exp(-LineListFixtures.rotationalEnergy(5) /
        (PhysicalConstants.BOLTZMANN_WAVENUMBER * 5000.0)) / norm * LineListFixtures.A_P;
    assertEquals("Line carries its population times A", expected, spectrum.getY()[index], 1e-12);
  }

  @Test
  public void testGetSpectrumIntensity() throws Exception {
    Spectrum flux = db.getSpectrum(4000.0, 4000.0, 300.0, 301.0);
    Spectrum intensity = db.getSpectrum(4000.0, 4000.0, 300.0, 301.0,
        SpectrumRequest.DEFAULT.withQuantity(OutputQuantity.INTENSITY));
    int origin = indexOf(flux.getX(), LineListFixtures.BAND_ORIGIN);
    double wavenumber = 1e7 / (LineListFixtures.BAND_ORIGIN * LineListFixtures.AIR_TO_VACUUM);
    assertEquals("Intensity is photon flux times wavenumber", flux.getY()[origin] * wavenumber,
        intensity.getY()[origin], 1e-9);
  }

  @Test
  public void testGetSpectrumVacuum() throws Exception {
    Spectrum vacuum = db.getSpectrum(4000.0, 4000.0, 300.0, 301.0,
        SpectrumRequest.DEFAULT.withMedium(WavelengthMedium.VACUUM));
    assertTrue("Vacuum wavelengths are reported",
        indexOf(vacuum.getX(), LineListFixtures.BAND_ORIGIN * LineListFixtures.AIR_TO_VACUUM) >= 0);
  }

  @Test
  public void testCacheValidity() throws Exception {
    assertFalse("Nothing is cached initially", db.isCacheValid(300.0, 301.0, 5000.0, 5000.0));
    assertNull("No window is cached initially", db.getCachedWindow());

    db.getSpectrum(5000.0, 5000.0, 300.0, 301.0);
    assertTrue("Same request is cached", db.isCacheValid(300.0, 301.0, 5000.0, 5000.0));
    assertTrue("Request within the reserve is cached", db.isCacheValid(298.5, 302.5, 5000.0, 5000.0));
    assertFalse("Request beyond the reserve is not cached", db.isCacheValid(297.0, 301.0, 5000.0, 5000.0));
    assertFalse("Changed Trot invalidates", db.isCacheValid(300.0, 301.0, 4000.0, 5000.0));
    assertFalse("Changed Tvib invalidates", db.isCacheValid(300.0, 301.0, 5000.0, 4000.0));
    assertFalse("Changed medium invalidates",
        db.isCacheValid(300.0, 301.0, 5000.0, 5000.0, WavelengthMedium.VACUUM));

    Pair<Double, Double> window = db.getCachedWindow();
    assertEquals("Window is enlarged below", 298.0, window.getLeft(), FP_TOLERANCE);
    assertEquals("Window is enlarged above", 303.0, window.getRight(), FP_TOLERANCE);
    assertEquals("Norm is cached", db.calculateNorm(5000.0, 5000.0), db.getCachedNorm(), 1e-12);
  }

  @Test
  public void testRepeatedRequestsAgree() throws Exception {
    Spectrum first = db.getSpectrum(4500.0, 6000.0, 300.0, 310.0);
    Spectrum second = db.getSpectrum(4500.0, 6000.0, 300.0, 310.0);
    assertArrayEquals("Same lines", first.getX(), second.getX(), 0.0);
    assertArrayEquals("Same intensities", first.getY(), second.getY(), 0.0);
  }

  @Test
  public void testVibrationalTemperatureChangeMatchesFreshLineList() throws Exception {
    Spectrum before = db.getSpectrum(5000.0, 5000.0, 300.0, 310.0);
    Spectrum cached = db.getSpectrum(5000.0, 3000.0, 300.0, 310.0);
    Spectrum fresh;
    try (LineDatabase other = LineDatabase.open(tempDirPath, LineListFixtures.FILE_NAME)) {
      fresh = other.getSpectrum(5000.0, 3000.0, 300.0, 310.0);
    }
    assertArrayEquals("Same lines", fresh.getX(), cached.getX(), 0.0);
    for (int i = 0; i < fresh.size(); i++) {
      assertEquals(String.format("Line %d matches a fresh line list", i), fresh.getY()[i], cached.getY()[i],
          Math.abs(fresh.getY()[i]) * 1e-12);
    }
    int hotBand = indexOf(cached.getX(), LineListFixtures.airWavelength(2, 0));
    assertTrue("A colder vibration empties v = 2", cached.getY()[hotBand] < before.getY()[hotBand]);
  }

  @Test
  public void testWindowExtensionPolicy() throws Exception {
    LineListStore store = Mockito.mock(LineListStore.class);
    UpperState ground = new UpperState(0.0, 0.0, 0.0);
    UpperState excited = new UpperState(1.0, 30.0, 0.0);
    Mockito.when(store.fetchUpperStates()).thenReturn(Arrays.asList(ground, excited));
    List<LineRecord> lines = new ArrayList<>();
    lines.add(new LineRecord(300.0, 300.1, 10.0, 33322.0, ground));
    lines.add(new LineRecord(300.2, 300.3, 20.0, 33300.0, excited));
    Mockito.when(store.fetchLines(any(), any(), eq(WavelengthMedium.AIR))).thenReturn(lines);

    LineDatabase mocked = new LineDatabase("MOCK", store);
    Spectrum first = mocked.getSpectrum(1000.0, 1000.0, 299.0, 301.0);
    verify(store, times(1)).fetchLines(297.0, 303.0, WavelengthMedium.AIR);
    assertEquals("One point per line", 2, first.size());

    mocked.getSpectrum(2000.0, 1000.0, 299.5, 302.5);
    verify(store, times(1)).fetchLines(any(), any(), eq(WavelengthMedium.AIR));

    Spectrum hot = mocked.getSpectrum(3000.0, 1000.0, 299.0, 301.0);
    assertTrue("Hotter rotation populates the excited state more",
        hot.getY()[1] / hot.getY()[0] > first.getY()[1] / first.getY()[0]);

    mocked.getSpectrum(3000.0, 1000.0, 299.0, 305.0);
    verify(store, times(1)).fetchLines(297.0, 307.0, WavelengthMedium.AIR);

    mocked.getSpectrum(3000.0, 1000.0, null, null);
    verify(store, times(1)).fetchLines(null, null, WavelengthMedium.AIR);
    assertTrue("Unbounded window is cached", mocked.isCacheValid(-1e9, 1e9, 3000.0, 1000.0));

    mocked.close();
    verify(store).close();
  }

  @Test
  public void testGetLinesByStates() throws Exception {
    List<StateLines> states = db.getLinesByStates(299.99, 300.52, new LinesByStateRequest().setMinLines(2));
    assertEquals("States with both a P and a Q line in the window", 4, states.size());
    for (int i = 0; i < states.size(); i++) {
      StateLines state = states.get(i);
      assertEquals("Each state has two lines", 2, state.getNumLines());
      assertEquals("States are ordered by id", i + 1.0, state.getJ(), FP_TOLERANCE);
      assertEquals("Rotational energy is reported", LineListFixtures.rotationalEnergy(i + 1),
          state.getRotationalEnergy(), FP_TOLERANCE);
      assertEquals("Component is reported", "X", state.getComponent());
    }

    List<StateLines> all = db.getLinesByStates(299.99, 300.52, new LinesByStateRequest());
    assertEquals("Every state emitting in the window", 6, all.size());

    List<StateLines> singlet = db.getLinesByStates(299.99, 300.52,
        new LinesByStateRequest().setMinLines(2).setSingletLike(true));
    assertEquals("Singlet-like grouping merges by (v, J)", 4, singlet.size());
    assertEquals("Singlet-like key", "0,1.0", singlet.get(0).getStateKey());
    assertNull("Singlet-like groups have no component", singlet.get(0).getComponent());
  }

  private static int indexOf(double[] values, double target) {
    for (int i = 0; i < values.length; i++) {
      if (Math.abs(values[i] - target) < 1e-9) {
        return i;
      }
    }
    assertNotNull("Value not found: " + target, null);
    return -1;
  }
}
