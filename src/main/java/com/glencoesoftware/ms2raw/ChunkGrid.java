/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.math.RoundingMode;

import com.google.common.math.IntMath;
import com.google.common.math.LongMath;

/**
 * Regular chunk grid over the target array.  Chunks on the upper edge of
 * an axis are truncated when the extent is not a multiple of the chunk size.
 */
public class ChunkGrid {

  /** Bytes used to buffer one sample. */
  public static final int BYTES_PER_CELL = 4;

  /** Largest number of cells a chunk can hold; one Java array. */
  public static final int MAX_CHUNK_CELLS = Integer.MAX_VALUE - 8;

  private final Extents extents;
  private final ChunkShape chunkShape;
  private final int[] gridSize = new int[Extents.DIMENSIONS];
  private final int chunkCount;

  /**
   * Create a grid.  The chunk shape is clamped to the extents.
   *
   * @param extents dataset extents
   * @param shape requested chunk shape
   */
  public ChunkGrid(Extents extents, ChunkShape shape) {
    this.extents = extents;
    this.chunkShape = shape.clampTo(extents);
    int count = 1;
    for (int axis=0; axis<gridSize.length; axis++) {
      gridSize[axis] = IntMath.divide(
        extents.get(axis), chunkShape.get(axis), RoundingMode.CEILING);
      count = IntMath.checkedMultiply(count, gridSize[axis]);
    }
    chunkCount = count;
  }

  /**
   * @return dataset extents
   */
  public Extents getExtents() {
    return extents;
  }

  /**
   * @return the (clamped) chunk shape
   */
  public ChunkShape getChunkShape() {
    return chunkShape;
  }

  /**
   * @param axis axis index
   * @return number of chunks along the axis
   */
  public int getGridSize(int axis) {
    return gridSize[axis];
  }

  /**
   * @return total number of chunks
   */
  public int getChunkCount() {
    return chunkCount;
  }

  /**
   * @param coordinate chunk position
   * @return offset of the chunk's first cell in the target array
   */
  public int[] getOrigin(ChunkCoordinate coordinate) {
    int[] origin = new int[Extents.DIMENSIONS];
    for (int axis=0; axis<origin.length; axis++) {
      origin[axis] = coordinate.get(axis) * chunkShape.get(axis);
    }
    return origin;
  }

  /**
   * @param coordinate chunk position
   * @return shape of the chunk, truncated at the array edge
   */
  public int[] getShape(ChunkCoordinate coordinate) {
    int[] shape = new int[Extents.DIMENSIONS];
    for (int axis=0; axis<shape.length; axis++) {
      shape[axis] = getLength(axis, coordinate.get(axis));
    }
    return shape;
  }

  /**
   * @param axis axis index
   * @param index chunk index along the axis
   * @return length of that chunk along the axis
   */
  public int getLength(int axis, int index) {
    int start = index * chunkShape.get(axis);
    return Math.min(chunkShape.get(axis), extents.get(axis) - start);
  }

  /**
   * @return number of cells in a chunk that is not truncated
   */
  public long getMaxChunkCellCount() {
    long cells = 1;
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      cells = LongMath.saturatedMultiply(cells, chunkShape.get(axis));
    }
    return cells;
  }

  /**
   * @param coordinate chunk position
   * @return number of cells in the chunk
   * @throws ArithmeticException if the chunk has more than
   *         {@link Integer#MAX_VALUE} cells
   */
  public int getCellCount(ChunkCoordinate coordinate) {
    int cells = 1;
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      cells = IntMath.checkedMultiply(
        cells, getLength(axis, coordinate.get(axis)));
    }
    return cells;
  }

  /**
   * @param coordinate chunk position
   * @return bytes needed to buffer the chunk
   */
  public long getByteCount(ChunkCoordinate coordinate) {
    return (long) getCellCount(coordinate) * BYTES_PER_CELL;
  }

  /**
   * @param coordinate chunk position
   * @return row-major index of the chunk in the grid
   */
  public int linearIndex(ChunkCoordinate coordinate) {
    int index = 0;
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      int value = coordinate.get(axis);
      if (value < 0 || value >= gridSize[axis]) {
        throw new IllegalArgumentException(
          "Chunk " + coordinate + " is outside of the grid");
      }
      index = index * gridSize[axis] + value;
    }
    return index;
  }

  /**
   * @param index row-major chunk index
   * @return chunk position
   */
  public ChunkCoordinate coordinate(int index) {
    int[] c = new int[Extents.DIMENSIONS];
    int remaining = index;
    for (int axis=Extents.DIMENSIONS - 1; axis>=0; axis--) {
      c[axis] = remaining % gridSize[axis];
      remaining /= gridSize[axis];
    }
    return new ChunkCoordinate(c[0], c[1], c[2], c[3]);
  }

  /**
   * @param layer cell layer
   * @param x cell X
   * @param y cell Y
   * @param bin cell bin
   * @return position of the chunk that owns the cell
   */
  public ChunkCoordinate chunkOf(int layer, int x, int y, int bin) {
    return new ChunkCoordinate(layer / chunkShape.get(0),
      x / chunkShape.get(1), y / chunkShape.get(2), bin / chunkShape.get(3));
  }

  @Override
  public String toString() {
    return "extents " + extents + ", chunks " + chunkShape;
  }

}
