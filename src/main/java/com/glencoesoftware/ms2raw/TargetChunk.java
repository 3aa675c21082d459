/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Arrays;
import java.util.BitSet;

/**
 * A target chunk being assembled.  The buffer is dense and row-major over
 * the (possibly truncated) chunk shape; a mask records which cells have
 * been written.
 */
public class TargetChunk {

  private final ChunkCoordinate coordinate;
  private final int[] origin;
  private final int[] shape;
  private final int cellCount;
  private final BitSet written;
  private int writtenCount = 0;
  private int[] data;

  /**
   * Allocate an empty chunk.
   *
   * @param grid chunk grid the chunk belongs to
   * @param coordinate position of the chunk in the grid
   */
  public TargetChunk(ChunkGrid grid, ChunkCoordinate coordinate) {
    this.coordinate = coordinate;
    this.origin = grid.getOrigin(coordinate);
    this.shape = grid.getShape(coordinate);
    this.cellCount = grid.getCellCount(coordinate);
    this.written = new BitSet(cellCount);
    this.data = new int[cellCount];
  }

  public ChunkCoordinate getCoordinate() {
    return coordinate;
  }

  /**
   * @return index of the chunk's first cell in the target array
   */
  public int[] getOrigin() {
    return origin.clone();
  }

  /**
   * @return chunk shape, truncated at the array edge
   */
  public int[] getShape() {
    return shape.clone();
  }

  public int getCellCount() {
    return cellCount;
  }

  public int getWrittenCount() {
    return writtenCount;
  }

  /**
   * @return bytes held by the buffer
   */
  public long getByteCount() {
    return (long) cellCount * ChunkGrid.BYTES_PER_CELL;
  }

  /**
   * @return true once every cell has been written
   */
  public boolean isComplete() {
    return writtenCount == cellCount;
  }

  /**
   * @return the buffer, or null once released
   */
  public int[] getData() {
    return data;
  }

  /**
   * Drop the buffer after it has been written out.
   */
  public void release() {
    data = null;
  }

  /**
   * Copy a run of consecutive cells into the buffer.
   *
   * @param position local row-major index of the first cell
   * @param source samples to copy
   * @param sourcePosition index of the first sample in <code>source</code>
   * @param length number of cells
   * @throws DuplicateCellException if any of the cells was already written
   */
  void write(int position, int[] source, int sourcePosition, int length)
    throws DuplicateCellException
  {
    int duplicate = written.nextSetBit(position);
    if (duplicate >= 0 && duplicate < position + length) {
      throw new DuplicateCellException("Cell " +
        Arrays.toString(cellIndex(duplicate)) + " was written more than once");
    }
    System.arraycopy(source, sourcePosition, data, position, length);
    written.set(position, position + length);
    writtenCount += length;
  }

  /**
   * @param position local row-major index
   * @return global (layer, x, y, bin) index of the cell
   */
  int[] cellIndex(int position) {
    int[] index = new int[shape.length];
    int remaining = position;
    for (int axis=shape.length - 1; axis>=0; axis--) {
      index[axis] = origin[axis] + remaining % shape[axis];
      remaining /= shape[axis];
    }
    return index;
  }

  @Override
  public String toString() {
    return "chunk " + coordinate + " (" + writtenCount + "/" + cellCount +
      " cells)";
  }

}
