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

import com.twentyn.oes.params.GlobalParameter;
import com.twentyn.oes.params.SpeciesParameterSet;
import org.apache.commons.lang3.StringUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FitConfigurationTest {
  private static final double FP_TOLERANCE = 1e-12;

  private Path configPath;

  @Before
  public void setUp() throws Exception {
    configPath = Files.createTempFile(FitConfigurationTest.class.getName(), ".json");
  }

  @After
  public void tearDown() throws Exception {
    Files.deleteIfExists(configPath);
  }

  private FitConfiguration read(String... lines) throws Exception {
    Files.write(configPath, StringUtils.join(lines, "\n").getBytes(StandardCharsets.UTF_8));
    return FitConfiguration.readFromFile(configPath.toFile());
  }

  @Test
  public void testDefaults() throws Exception {
    FitOptions options = read("{}").toFitOptions();
    assertEquals("Least squares by default", FitMethod.LEASTSQ, options.getMethod());
    assertEquals("Default budget", FitOptions.DEFAULT_MAX_ITERATIONS, options.getMaxIterations());
    assertEquals("Default tolerance", FitOptions.DEFAULT_XTOL, options.getXtol(), FP_TOLERANCE);
    assertFalse("Unweighted by default", options.isWeighted());
  }

  @Test
  public void testSettings() throws Exception {
    FitConfiguration config = read(
        "{",
        "  \"method\": \"nelder-mead\",",
        "  \"max_iterations\": 300,",
        "  \"xtol\": 0.001,",
        "  \"points_per_nm\": 250,",
        "  \"weighted\": true,",
        "  \"comment\": \"unknown keys are ignored\"",
        "}");
    FitOptions options = config.toFitOptions();
    assertEquals("Method aliases are accepted", FitMethod.NELDER, options.getMethod());
    assertEquals("Budget", 300, options.getMaxIterations());
    assertEquals("Tolerance", 0.001, options.getXtol(), FP_TOLERANCE);
    assertEquals("Mesh density", 250, options.getPointsPerNm());
    assertTrue("Weighting", options.isWeighted());

    config.setMethod("powell");
    config.setMaxIterations(10);
    assertEquals("Setters override the file", FitMethod.POWELL, config.toFitOptions().getMethod());
    assertEquals("Setters override the budget", 10, config.toFitOptions().getMaxIterations());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownMethod() throws Exception {
    read("{\"method\": \"annealing\"}").toFitOptions();
  }

  @Test
  public void testParameterOverrides() throws Exception {
    FitConfiguration config = read(
        "{",
        "  \"parameters\": {",
        "    \"slitf_gauss\": {\"value\": 0.05, \"vary\": false},",
        "    \"OH_Trot\": {\"value\": 3000, \"min\": 1000, \"max\": 6000},",
        "    \"N2_Tvib\": {\"value\": 1234}",
        "  }",
        "}");
    SpeciesParameterSet params = new SpeciesParameterSet();
    params.addSpecies("OH");
    config.applyTo(params);

    assertEquals("Global value", 0.05, params.getValue(GlobalParameter.SLITF_GAUSS), FP_TOLERANCE);
    assertFalse("Global vary flag", params.get(GlobalParameter.SLITF_GAUSS).isVary());
    assertEquals("Species value", 3000.0, params.get("OH_Trot").getValue(), FP_TOLERANCE);
    assertEquals("Lower bound", 1000.0, params.get("OH_Trot").getMin(), FP_TOLERANCE);
    assertEquals("Upper bound", 6000.0, params.get("OH_Trot").getMax(), FP_TOLERANCE);
    assertTrue("Vary flag is kept when not overridden", params.get("OH_Trot").isVary());
    assertFalse("Overrides for absent species are ignored", params.containsParameter("N2_Tvib"));
  }

  @Test
  public void testBoundsClampOverriddenValue() throws Exception {
    FitConfiguration config = read("{\"parameters\": {\"OH_Tvib\": {\"value\": 9000, \"max\": 5000}}}");
    SpeciesParameterSet params = new SpeciesParameterSet();
    params.addSpecies("OH");
    config.applyTo(params);
    assertEquals("Value is clamped to the new bound", 5000.0, params.get("OH_Tvib").getValue(), FP_TOLERANCE);
    assertEquals("Unchanged lower bound", 300.0, params.get("OH_Tvib").getMin(), FP_TOLERANCE);
  }
}
