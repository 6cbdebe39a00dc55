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

package com.twentyn.oes.synth;

import com.twentyn.oes.db.DataSourceException;
import com.twentyn.oes.db.LineDatabase;
import com.twentyn.oes.db.SpectrumRequest;
import com.twentyn.oes.params.GlobalParameter;
import com.twentyn.oes.params.SpeciesParameter;
import com.twentyn.oes.params.SpeciesParameterSet;
import com.twentyn.oes.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds the simulated spectrum of a parameter set: the weighted line spectra of all attached species, put onto a
 * uniform mesh, broadened by the slit function and lifted by the baseline.
 */
public class SpectrumSynthesizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumSynthesizer.class);

  public static final int DEFAULT_POINTS_PER_NM = 1000;

  private SpectrumSynthesizer() {
  }

  public static Spectrum synthesize(SpeciesParameterSet params, Map<String, LineDatabase> databases,
                                    double wmin, double wmax, Double step, int pointsPerNm) {
    return synthesize(params, databases, wmin, wmax, step, pointsPerNm, SpectrumRequest.DEFAULT);
  }

  /**
   * @param params Temperatures, intensities, slit function and baseline.
   * @param databases Line lists by species name; every species attached to params must be present.
   * @param wmin Lower end of the simulated window.
   * @param wmax Upper end of the simulated window.
   * @param step Instrumental pixel width used to widen the slit function, or null for params' wav_step.
   * @param pointsPerNm Density of the mesh the lines are put onto.
   * @param request Wavelength medium and output quantity passed to each line list.
   * @return The simulated spectrum, empty if params has no species.
   * @throws DataSourceException If a line list is missing or unusable.
   */
  public static Spectrum synthesize(SpeciesParameterSet params, Map<String, LineDatabase> databases,
                                    double wmin, double wmax, Double step, int pointsPerNm,
                                    SpectrumRequest request) {
    List<String> species = params.getSpecies();
    if (species.isEmpty()) {
      LOGGER.warn("No species attached, the simulated spectrum is empty");
      return new Spectrum();
    }

    List<double[]> xs = new ArrayList<>(species.size());
    List<double[]> ys = new ArrayList<>(species.size());
    int total = 0;
    for (String name : species) {
      LineDatabase db = databases.get(name);
      if (db == null) {
        throw new DataSourceException(String.format("No line list registered for species %s", name));
      }
      Spectrum lines = db.getSpectrum(params.getValue(name, SpeciesParameter.TROT),
          params.getValue(name, SpeciesParameter.TVIB), wmin, wmax, request);
      double intensity = params.getValue(name, SpeciesParameter.INTENSITY);
      double[] y = Arrays.copyOf(lines.getY(), lines.size());
      for (int i = 0; i < y.length; i++) {
        y[i] *= intensity;
      }
      xs.add(lines.getX());
      ys.add(y);
      total += y.length;
    }

    double[] x = new double[total];
    double[] y = new double[total];
    int offset = 0;
    for (int i = 0; i < xs.size(); i++) {
      System.arraycopy(xs.get(i), 0, x, offset, xs.get(i).length);
      System.arraycopy(ys.get(i), 0, y, offset, ys.get(i).length);
      offset += xs.get(i).length;
    }

    // Object sort is stable, so lines at equal wavelengths keep their species order.
    Integer[] order = new Integer[total];
    for (int i = 0; i < total; i++) {
      order[i] = i;
    }
    Arrays.sort(order, Comparator.comparingDouble(i -> x[i]));
    double[] sortedX = new double[total];
    double[] sortedY = new double[total];
    for (int i = 0; i < total; i++) {
      sortedX[i] = x[order[i]];
      sortedY[i] = y[order[i]];
    }

    Spectrum spectrum = new Spectrum(sortedX, sortedY);
    spectrum.refineMesh(pointsPerNm);
    spectrum.convolveWithSlitFunction(params.getValue(GlobalParameter.SLITF_GAUSS),
        params.getValue(GlobalParameter.SLITF_LORENTZ),
        step == null ? params.getValue(GlobalParameter.WAV_STEP) : step);

    if (!spectrum.isEmpty()) {
      double baseline = params.getValue(GlobalParameter.BASELINE);
      double slope = params.getValue(GlobalParameter.BASELINE_SLOPE);
      double[] meshX = spectrum.getX();
      double[] meshY = spectrum.getY();
      for (int i = 0; i < meshY.length; i++) {
        meshY[i] += baseline + slope * (meshX[i] - wmin);
      }
    }
    LOGGER.debug("Synthesized %d points for %d species in [%f, %f]", spectrum.size(), species.size(), wmin, wmax);
    return spectrum;
  }
}
