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
 * Position of a chunk in the chunk grid, in (layer, x, y, bin) order.
 * Ordered row-major, with the bin axis varying fastest.
 */
public final class ChunkCoordinate implements Comparable<ChunkCoordinate> {

  private final int[] indexes;

  /**
   * @param layer chunk index along the layer axis
   * @param x chunk index along X
   * @param y chunk index along Y
   * @param bin chunk index along the spectrum axis
   */
  public ChunkCoordinate(int layer, int x, int y, int bin) {
    indexes = new int[] {layer, x, y, bin};
  }

  /**
   * @param axis axis index
   * @return grid index along the axis
   */
  public int get(int axis) {
    return indexes[axis];
  }

  /**
   * @return grid indexes as a new array
   */
  public int[] toArray() {
    return indexes.clone();
  }

  @Override
  public int compareTo(ChunkCoordinate o) {
    for (int axis=0; axis<indexes.length; axis++) {
      int c = Integer.compare(indexes[axis], o.indexes[axis]);
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ChunkCoordinate &&
      Arrays.equals(indexes, ((ChunkCoordinate) o).indexes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indexes);
  }

  @Override
  public String toString() {
    return Arrays.toString(indexes);
  }

}
