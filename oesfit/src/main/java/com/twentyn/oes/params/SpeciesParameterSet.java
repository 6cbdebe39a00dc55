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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.oes.utils.JsonUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The fit parameters of one measured spectrum: a block of global parameters (calibration, slit function, baseline)
 * and one block of temperatures and intensity per attached species.  The order in which species were attached is
 * authoritative; flat parameter names such as "OH_Trot" are derived from it.
 */
public class SpeciesParameterSet {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpeciesParameterSet.class);

  public static final int DEFAULT_NUMBER_OF_PIXELS = 1024;
  public static final Pattern VALID_SPECIES_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private int numberOfPixels;
  private final EnumMap<GlobalParameter, BoundedParameter> globals = new EnumMap<>(GlobalParameter.class);
  private final LinkedHashMap<String, EnumMap<SpeciesParameter, BoundedParameter>> species = new LinkedHashMap<>();

  public SpeciesParameterSet(int numberOfPixels, Map<GlobalParameter, Double> initialValues) {
    this.numberOfPixels = numberOfPixels;
    for (GlobalParameter p : GlobalParameter.values()) {
      Double value = initialValues.get(p);
      globals.put(p, p.create(value == null ? p.getDefaultValue() : value));
    }
  }

  public SpeciesParameterSet(int numberOfPixels) {
    this(numberOfPixels, Collections.emptyMap());
  }

  public SpeciesParameterSet() {
    this(DEFAULT_NUMBER_OF_PIXELS);
  }

  /**
   * Deep copy.
   */
  public SpeciesParameterSet(SpeciesParameterSet other) {
    this.numberOfPixels = other.numberOfPixels;
    for (Map.Entry<GlobalParameter, BoundedParameter> entry : other.globals.entrySet()) {
      globals.put(entry.getKey(), new BoundedParameter(entry.getValue()));
    }
    for (Map.Entry<String, EnumMap<SpeciesParameter, BoundedParameter>> entry : other.species.entrySet()) {
      EnumMap<SpeciesParameter, BoundedParameter> block = new EnumMap<>(SpeciesParameter.class);
      for (Map.Entry<SpeciesParameter, BoundedParameter> p : entry.getValue().entrySet()) {
        block.put(p.getKey(), new BoundedParameter(p.getValue()));
      }
      species.put(entry.getKey(), block);
    }
  }

  public int getNumberOfPixels() {
    return numberOfPixels;
  }

  public void setNumberOfPixels(int numberOfPixels) {
    this.numberOfPixels = numberOfPixels;
  }

  /**
   * @return The attached species in the order they were added.
   */
  public List<String> getSpecies() {
    return Collections.unmodifiableList(new ArrayList<>(species.keySet()));
  }

  public boolean hasSpecies(String name) {
    return species.containsKey(name);
  }

  public SpeciesResult addSpecies(String name, double trot, double tvib, double intensity) {
    SpeciesResult result;
    if (name == null || !VALID_SPECIES_NAME.matcher(name).matches()) {
      result = new SpeciesResult(name, SpeciesResult.STATUS.INVALID_NAME);
    } else if (species.containsKey(name)) {
      result = new SpeciesResult(name, SpeciesResult.STATUS.ALREADY_PRESENT);
    } else {
      EnumMap<SpeciesParameter, BoundedParameter> block = new EnumMap<>(SpeciesParameter.class);
      block.put(SpeciesParameter.TROT, SpeciesParameter.TROT.create(name, trot));
      block.put(SpeciesParameter.TVIB, SpeciesParameter.TVIB.create(name, tvib));
      block.put(SpeciesParameter.INTENSITY, SpeciesParameter.INTENSITY.create(name, intensity));
      species.put(name, block);
      return new SpeciesResult(name, SpeciesResult.STATUS.ADDED);
    }
    LOGGER.warn("%s", result.getMessage());
    return result;
  }

  public SpeciesResult addSpecies(String name) {
    return addSpecies(name, SpeciesParameter.TROT.getDefaultValue(), SpeciesParameter.TVIB.getDefaultValue(),
        SpeciesParameter.INTENSITY.getDefaultValue());
  }

  public SpeciesResult removeSpecies(String name) {
    if (species.remove(name) == null) {
      SpeciesResult result = new SpeciesResult(name, SpeciesResult.STATUS.NOT_PRESENT);
      LOGGER.warn("%s", result.getMessage());
      return result;
    }
    return new SpeciesResult(name, SpeciesResult.STATUS.REMOVED);
  }

  public BoundedParameter get(GlobalParameter parameter) {
    return globals.get(parameter);
  }

  public double getValue(GlobalParameter parameter) {
    return globals.get(parameter).getValue();
  }

  /**
   * @return The parameter, or null if the species is not attached.
   */
  public BoundedParameter get(String speciesName, SpeciesParameter parameter) {
    EnumMap<SpeciesParameter, BoundedParameter> block = species.get(speciesName);
    return block == null ? null : block.get(parameter);
  }

  public double getValue(String speciesName, SpeciesParameter parameter) {
    BoundedParameter p = get(speciesName, parameter);
    if (p == null) {
      throw new IllegalArgumentException(String.format("Species %s is not attached", speciesName));
    }
    return p.getValue();
  }

  /**
   * Looks a parameter up by its flat name, e.g. "wav_shift" or "OH_Trot".
   * @throws IllegalArgumentException If there is no such parameter.
   */
  public BoundedParameter get(String parameterName) {
    BoundedParameter p = getAllParameters().get(parameterName);
    if (p == null) {
      throw new IllegalArgumentException(String.format("No parameter named %s", parameterName));
    }
    return p;
  }

  public boolean containsParameter(String parameterName) {
    return getAllParameters().containsKey(parameterName);
  }

  /**
   * @return Every parameter keyed by its flat name: globals first, then each species block in order.
   */
  public LinkedHashMap<String, BoundedParameter> getAllParameters() {
    LinkedHashMap<String, BoundedParameter> all = new LinkedHashMap<>();
    for (BoundedParameter p : globals.values()) {
      all.put(p.getName(), p);
    }
    for (Map.Entry<String, EnumMap<SpeciesParameter, BoundedParameter>> entry : species.entrySet()) {
      for (SpeciesParameter kind : SpeciesParameter.values()) {
        all.put(kind.parameterName(entry.getKey()), entry.getValue().get(kind));
      }
    }
    return all;
  }

  public List<String> getParameterNames() {
    return new ArrayList<>(getAllParameters().keySet());
  }

  /**
   * @return The parameters the optimizer may change, in flat-name order.
   */
  public List<BoundedParameter> getVaryingParameters() {
    List<BoundedParameter> varying = new ArrayList<>();
    for (BoundedParameter p : getAllParameters().values()) {
      if (p.isVary()) {
        varying.add(p);
      }
    }
    return varying;
  }

  /**
   * Portable form: flat parameters plus the species order.
   */
  public static class Model {
    @JsonProperty("number_of_pixels")
    int numberOfPixels;

    @JsonProperty("species")
    List<String> species = new ArrayList<>();

    @JsonProperty("parameters")
    List<BoundedParameter> parameters = new ArrayList<>();
  }

  public Model toModel() {
    Model model = new Model();
    model.numberOfPixels = numberOfPixels;
    model.species.addAll(species.keySet());
    model.parameters.addAll(getAllParameters().values());
    return model;
  }

  public static SpeciesParameterSet fromModel(Model model) {
    Map<String, BoundedParameter> byName = new LinkedHashMap<>();
    for (BoundedParameter p : model.parameters) {
      byName.put(p.getName(), p);
    }

    SpeciesParameterSet result = new SpeciesParameterSet(model.numberOfPixels);
    for (GlobalParameter g : GlobalParameter.values()) {
      BoundedParameter p = byName.get(g.getParameterName());
      if (p != null) {
        result.globals.put(g, new BoundedParameter(p));
      }
    }
    for (String name : model.species) {
      EnumMap<SpeciesParameter, BoundedParameter> block = new EnumMap<>(SpeciesParameter.class);
      for (SpeciesParameter kind : SpeciesParameter.values()) {
        BoundedParameter p = byName.get(kind.parameterName(name));
        block.put(kind, p != null ? new BoundedParameter(p) : kind.create(name, kind.getDefaultValue()));
      }
      result.species.put(name, block);
    }
    return result;
  }

  public String toJson() throws IOException {
    return JsonUtils.OBJECT_MAPPER.writeValueAsString(toModel());
  }

  public static SpeciesParameterSet fromJson(String json) throws IOException {
    return fromModel(JsonUtils.OBJECT_MAPPER.readValue(json, Model.class));
  }

  public void writeToFile(File outputFile) throws IOException {
    JsonUtils.OBJECT_MAPPER.writeValue(outputFile, toModel());
  }

  public static SpeciesParameterSet readFromFile(File inputFile) throws IOException {
    return fromModel(JsonUtils.OBJECT_MAPPER.readValue(inputFile, Model.class));
  }
}
