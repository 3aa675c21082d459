/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Arrays;

/**
 * Extents of the 4D dataset, in (layer, x, y, bin) order.
 * Fixed for the lifetime of a conversion run.
 */
public class Extents {

  /** Axis names in target order. */
  public static final String[] AXES = {"layer", "x", "y", "mass"};

  /** Number of dimensions of the target array. */
  public static final int DIMENSIONS = 4;

  private final int layers;
  private final int width;
  private final int height;
  private final int bins;

  /**
   * Create new extents.  All values must be positive.
   *
   * @param layerCount number of layers
   * @param layerWidth image width in pixels
   * @param layerHeight image height in pixels
   * @param spectrumLength number of spectrum bins
   */
  public Extents(int layerCount, int layerWidth, int layerHeight,
    int spectrumLength)
  {
    if (layerCount <= 0 || layerWidth <= 0 || layerHeight <= 0 ||
      spectrumLength <= 0)
    {
      throw new IllegalArgumentException(String.format(
        "Invalid extents: %d x %d x %d x %d",
        layerCount, layerWidth, layerHeight, spectrumLength));
    }
    layers = layerCount;
    width = layerWidth;
    height = layerHeight;
    bins = spectrumLength;
  }

  /**
   * @param extents array of length 4 in (layer, x, y, bin) order
   * @return corresponding extents
   */
  public static Extents fromArray(int[] extents) {
    if (extents == null || extents.length != DIMENSIONS) {
      throw new IllegalArgumentException(
        "Expected 4 extents, found " + Arrays.toString(extents));
    }
    return new Extents(extents[0], extents[1], extents[2], extents[3]);
  }

  /**
   * @return number of layers
   */
  public int getLayers() {
    return layers;
  }

  /**
   * @return image width
   */
  public int getWidth() {
    return width;
  }

  /**
   * @return image height
   */
  public int getHeight() {
    return height;
  }

  /**
   * @return number of spectrum bins
   */
  public int getBins() {
    return bins;
  }

  /**
   * @param axis axis index in (layer, x, y, bin) order
   * @return the extent along the given axis
   */
  public int get(int axis) {
    switch (axis) {
      case 0:
        return layers;
      case 1:
        return width;
      case 2:
        return height;
      case 3:
        return bins;
      default:
        throw new IllegalArgumentException("Invalid axis: " + axis);
    }
  }

  /**
   * @return total number of cells
   */
  public long getCellCount() {
    return (long) layers * width * height * bins;
  }

  /**
   * @return extents as a new array in (layer, x, y, bin) order
   */
  public int[] toArray() {
    return new int[] {layers, width, height, bins};
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Extents)) {
      return false;
    }
    return Arrays.equals(toArray(), ((Extents) o).toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(toArray());
  }

  @Override
  public String toString() {
    return String.format("%d x %d x %d x %d", layers, width, height, bins);
  }

}
