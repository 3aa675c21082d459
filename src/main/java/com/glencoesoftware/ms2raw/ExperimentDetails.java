/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values read from the ExperimentDetails group of an ION export.
 */
public class ExperimentDetails {

  public static final String LAYERS = "Layers";
  public static final String LAYER_DIMENSION_X = "LayerDimensionX";
  public static final String LAYER_DIMENSION_Y = "LayerDimensionY";
  public static final String SPECTRUM_LENGTH = "SpectrumLength";
  public static final String IMAGE_MICRONS_X = "ImageMicronsX";
  public static final String IMAGE_MICRONS_Y = "ImageMicronsY";

  private final Extents extents;
  private final double micronsX;
  private final double micronsY;
  private final Map<String, Object> attributes;

  /**
   * @param extents declared extents
   * @param micronsX physical pixel size along X
   * @param micronsY physical pixel size along Y
   * @param attributes every attribute of the group
   */
  public ExperimentDetails(Extents extents, double micronsX, double micronsY,
    Map<String, Object> attributes)
  {
    this.extents = extents;
    this.micronsX = micronsX;
    this.micronsY = micronsY;
    this.attributes = Collections.unmodifiableMap(
      new LinkedHashMap<String, Object>(attributes));
  }

  /**
   * Parse the group attributes.  Values may be stored as numbers or as
   * one-element lists.
   *
   * @param attributes ExperimentDetails attributes
   * @return parsed details
   * @throws SourceFormatException if a required value is missing or invalid
   */
  public static ExperimentDetails fromAttributes(Map<String, Object> attributes)
    throws SourceFormatException
  {
    int layers = getNumber(attributes, LAYERS).intValue();
    // LayerDimensionX is the image height, LayerDimensionY the width
    int height = getNumber(attributes, LAYER_DIMENSION_X).intValue();
    int width = getNumber(attributes, LAYER_DIMENSION_Y).intValue();
    int bins = getNumber(attributes, SPECTRUM_LENGTH).intValue();
    double x = getNumber(attributes, IMAGE_MICRONS_X).doubleValue();
    double y = getNumber(attributes, IMAGE_MICRONS_Y).doubleValue();
    Extents extents;
    try {
      extents = new Extents(layers, width, height, bins);
    }
    catch (IllegalArgumentException e) {
      throw new SourceFormatException(
        "Invalid extents in " + IonPaths.DETAILS, e);
    }
    return new ExperimentDetails(extents, x, y, attributes);
  }

  private static Number getNumber(Map<String, Object> attributes, String key)
    throws SourceFormatException
  {
    Object value = attributes.get(key);
    if (value instanceof List && ((List<?>) value).size() == 1) {
      value = ((List<?>) value).get(0);
    }
    if (value instanceof Number) {
      return (Number) value;
    }
    throw new SourceFormatException(
      "Missing or invalid attribute " + IonPaths.DETAILS + "/" + key +
      ": " + value);
  }

  public Extents getExtents() {
    return extents;
  }

  public double getMicronsX() {
    return micronsX;
  }

  public double getMicronsY() {
    return micronsY;
  }

  /**
   * @return every attribute of the ExperimentDetails group
   */
  public Map<String, Object> getAttributes() {
    return attributes;
  }

}
