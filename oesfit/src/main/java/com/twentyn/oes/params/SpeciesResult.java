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

package com.twentyn.oes.params;

/**
 * Outcome of attaching a species to or detaching it from a {@link SpeciesParameterSet}.  Failures are ordinary
 * results: the parameter set is left untouched.
 */
public class SpeciesResult {
  public enum STATUS {
    ADDED,
    REMOVED,
    INVALID_NAME,
    ALREADY_PRESENT,
    NOT_PRESENT,
  }

  private final String species;
  private final STATUS status;

  public SpeciesResult(String species, STATUS status) {
    this.species = species;
    this.status = status;
  }

  public String getSpecies() {
    return species;
  }

  public STATUS getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return status == STATUS.ADDED || status == STATUS.REMOVED;
  }

  public String getMessage() {
    switch (status) {
      case ADDED:
        return String.format("Species '%s' added", species);
      case REMOVED:
        return String.format("Species '%s' removed", species);
      case INVALID_NAME:
        return String.format("Species '%s' not added: invalid name", species);
      case ALREADY_PRESENT:
        return String.format("Species '%s' not added: already added", species);
      case NOT_PRESENT:
        return String.format("Species '%s' not removed: not present", species);
      default:
        return status.name();
    }
  }

  @Override
  public String toString() {
    return getMessage();
  }
}
