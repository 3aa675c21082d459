/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Arrays;
import java.util.List;

/**
 * Shape of one chunk of the target array, in (layer, x, y, bin) order.
 */
public class ChunkShape {

  private final int[] shape;

  /**
   * @param layers chunk size along the layer axis
   * @param width chunk size along X
   * @param height chunk size along Y
   * @param bins chunk size along the spectrum axis
   */
  public ChunkShape(int layers, int width, int height, int bins) {
    this(new int[] {layers, width, height, bins});
  }

  private ChunkShape(int[] sizes) {
    for (int size : sizes) {
      if (size <= 0) {
        throw new IllegalArgumentException(
          "Invalid chunk shape: " + Arrays.toString(sizes));
      }
    }
    shape = sizes;
  }

  /**
   * Build a chunk shape from a parsed command line list.
   *
   * @param sizes exactly four positive sizes
   * @return corresponding chunk shape
   */
  public static ChunkShape fromList(List<Integer> sizes) {
    if (sizes == null || sizes.size() != Extents.DIMENSIONS) {
      throw new IllegalArgumentException(
        "Chunk shape needs 4 values (layer,x,y,bin), found " + sizes);
    }
    return new ChunkShape(
      sizes.get(0), sizes.get(1), sizes.get(2), sizes.get(3));
  }

  /**
   * @param axis axis index in (layer, x, y, bin) order
   * @return chunk size along the axis
   */
  public int get(int axis) {
    return shape[axis];
  }

  /**
   * Reduce each chunk dimension that is larger than the extents.
   *
   * @param extents dataset extents
   * @return a chunk shape no larger than the extents
   */
  public ChunkShape clampTo(Extents extents) {
    int[] clamped = new int[Extents.DIMENSIONS];
    for (int axis=0; axis<clamped.length; axis++) {
      clamped[axis] = Math.min(shape[axis], extents.get(axis));
    }
    return new ChunkShape(clamped);
  }

  /**
   * @return number of cells in a full (non-edge) chunk
   */
  public long getCellCount() {
    long cells = 1;
    for (int size : shape) {
      cells *= size;
    }
    return cells;
  }

  /**
   * @return shape as a new array
   */
  public int[] toArray() {
    return shape.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChunkShape &&
      Arrays.equals(shape, ((ChunkShape) o).shape);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(shape);
  }

  @Override
  public String toString() {
    return String.format("%d x %d x %d x %d",
      shape[0], shape[1], shape[2], shape[3]);
  }

}
