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

import com.twentyn.oes.fit.FitSession;
import com.twentyn.oes.params.GlobalParameter;
import com.twentyn.oes.spectrum.AxisMismatchException;
import com.twentyn.oes.spectrum.Spectrum;
import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MeasuredSpectraReaderTest {
  private static final double FP_TOLERANCE = 1e-12;

  private Path tempDirPath;

  @Before
  public void setUp() throws Exception {
    tempDirPath = Files.createTempDirectory(MeasuredSpectraReaderTest.class.getName());
  }

  @After
  public void tearDown() throws Exception {
    for (File f : tempDirPath.toFile().listFiles()) {
      Files.delete(f.toPath());
    }
    Files.delete(tempDirPath);
  }

  private static LinkedHashMap<String, Spectrum> read(char delimiter, String... lines) throws IOException {
    String text = StringUtils.join(lines, "\n");
    return new MeasuredSpectraReader(delimiter).read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testHeaderNamesSpectra() throws Exception {
    LinkedHashMap<String, Spectrum> spectra = read(',',
        "wavelength,first,second",
        "300.0,1.0,2.0",
        "300.1,3.0,4.0");
    assertEquals("Spectra are named by the header, in order", Arrays.asList("first", "second"),
        Arrays.asList(spectra.keySet().toArray(new String[0])));
    assertArrayEquals("Shared x axis", new double[]{300.0, 300.1}, spectra.get("second").getX(), FP_TOLERANCE);
    assertArrayEquals("Second column", new double[]{1.0, 3.0}, spectra.get("first").getY(), FP_TOLERANCE);
    assertArrayEquals("Third column", new double[]{2.0, 4.0}, spectra.get("second").getY(), FP_TOLERANCE);
  }

  @Test
  public void testWithoutHeaderSpectraAreNumbered() throws Exception {
    LinkedHashMap<String, Spectrum> spectra = read(';',
        "# exported by the spectrometer",
        "300.0; 1.0; 2.0",
        "",
        "300.1; 3.0; 4.0");
    assertEquals("Columns are numbered from one", Arrays.asList("1", "2"),
        Arrays.asList(spectra.keySet().toArray(new String[0])));
    assertArrayEquals("Comments and blank lines are skipped", new double[]{2.0, 4.0}, spectra.get("2").getY(),
        FP_TOLERANCE);
  }

  @Test
  public void testEmptyInput() throws Exception {
    assertTrue("No data, no spectra", read(',', "").isEmpty());
    assertTrue("A header alone gives no spectra", read(',', "wavelength,a").isEmpty());
  }

  @Test(expected = IOException.class)
  public void testRaggedRow() throws Exception {
    read(',', "300.0,1.0,2.0", "300.1,3.0");
  }

  @Test(expected = IOException.class)
  public void testNonNumericCell() throws Exception {
    read(',', "300.0,1.0", "300.1,bright");
  }

  @Test(expected = IOException.class)
  public void testRepeatedHeaderName() throws Exception {
    read(',', "wl,a,a", "1,1,2", "2,3,4");
  }

  @Test(expected = AxisMismatchException.class)
  public void testDescendingAxis() throws Exception {
    read(',', "300.1,1.0", "300.0,2.0");
  }

  @Test
  public void testSessionFromFile() throws Exception {
    File input = tempDirPath.resolve("measured.csv").toFile();
    Files.write(input.toPath(), Arrays.asList("nm,a", "300.0,1.0", "300.5,2.0", "301.0,1.0"), StandardCharsets.UTF_8);
    try (FitSession session = FitSession.fromCsv(input)) {
      assertEquals("Source file is remembered", input.getPath(), session.getSourceFile());
      assertEquals("One spectrum", Arrays.asList("a"), session.getSpectrumIds());
      assertEquals("wav_step is taken from the data", 0.5,
          session.getParameters("a").getValue(GlobalParameter.WAV_STEP), FP_TOLERANCE);
    }
  }
}
