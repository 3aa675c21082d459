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
 * A block of source samples as physically stored, tagged with the part of
 * the (layer, x, y, bin) index space it covers.  Samples are row-major over
 * the tile shape, with the bin axis varying fastest.
 */
public final class SourceTile {

  private final int[] offset;
  private final int[] shape;
  private final int[] data;

  /**
   * @param offset first covered index in (layer, x, y, bin) order
   * @param shape number of covered indexes along each axis
   * @param data samples, one per covered cell
   */
  public SourceTile(int[] offset, int[] shape, int[] data) {
    if (offset.length != Extents.DIMENSIONS ||
      shape.length != Extents.DIMENSIONS)
    {
      throw new IllegalArgumentException("Tiles must be 4-dimensional");
    }
    long cells = 1;
    for (int s : shape) {
      cells *= s;
    }
    if (cells != data.length) {
      throw new IllegalArgumentException("Tile of shape " +
        Arrays.toString(shape) + " cannot hold " + data.length + " samples");
    }
    this.offset = offset.clone();
    this.shape = shape.clone();
    this.data = data;
  }

  /**
   * @param axis axis index
   * @return first covered index along the axis
   */
  public int getOffset(int axis) {
    return offset[axis];
  }

  /**
   * @param axis axis index
   * @return number of covered indexes along the axis
   */
  public int getShape(int axis) {
    return shape[axis];
  }

  /**
   * The returned array must not be modified.
   *
   * @return samples in row-major order
   */
  public int[] getData() {
    return data;
  }

  /**
   * @return number of covered cells
   */
  public int getCellCount() {
    return data.length;
  }

  @Override
  public String toString() {
    return "offset=" + Arrays.toString(offset) +
      " shape=" + Arrays.toString(shape);
  }

}
