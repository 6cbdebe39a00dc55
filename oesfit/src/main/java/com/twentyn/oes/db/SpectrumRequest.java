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

/**
 * Options for {@link LineDatabase#getSpectrum(double, double, Double, Double, SpectrumRequest)}.
 */
public class SpectrumRequest {
  public static final double DEFAULT_WAVELENGTH_RESERVE = 2.0;
  public static final SpectrumRequest DEFAULT = new SpectrumRequest();

  private final WavelengthMedium medium;
  private final OutputQuantity quantity;
  private final double wavelengthReserve;

  public SpectrumRequest(WavelengthMedium medium, OutputQuantity quantity, double wavelengthReserve) {
    this.medium = medium;
    this.quantity = quantity;
    this.wavelengthReserve = wavelengthReserve;
  }

  public SpectrumRequest() {
    this(WavelengthMedium.AIR, OutputQuantity.PHOTON_FLUX, DEFAULT_WAVELENGTH_RESERVE);
  }

  public WavelengthMedium getMedium() {
    return medium;
  }

  public OutputQuantity getQuantity() {
    return quantity;
  }

  /**
   * @return How many nm to fetch beyond each side of a requested window, so that marginally larger follow-up
   * requests are served from the cache.
   */
  public double getWavelengthReserve() {
    return wavelengthReserve;
  }

  public SpectrumRequest withMedium(WavelengthMedium newMedium) {
    return new SpectrumRequest(newMedium, quantity, wavelengthReserve);
  }

  public SpectrumRequest withQuantity(OutputQuantity newQuantity) {
    return new SpectrumRequest(medium, newQuantity, wavelengthReserve);
  }

  public SpectrumRequest withWavelengthReserve(double newReserve) {
    return new SpectrumRequest(medium, quantity, newReserve);
  }
}
