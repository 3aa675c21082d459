/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the target chunks that have received some but not all of their
 * cells.  Tiles are scattered into every chunk they intersect; chunks are
 * handed back as soon as their last cell arrives.
 * <p>
 * Memory is accounted in two parts.  Live bytes belong to open chunks.
 * Pending bytes belong to completed chunks that were handed to the writer
 * and not yet released.  The sum never exceeds the memory budget: creating
 * a chunk waits for pending writes when they are what holds the budget,
 * and fails when the open chunks alone would exceed it.
 * </p>
 * {@link #scatter(SourceTile)} must be called from a single thread;
 * {@link #release(TargetChunk)} may be called from any thread.
 */
public class AssemblyBuffer {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(AssemblyBuffer.class);

  private final ChunkGrid grid;
  private final long memoryBudget;
  private final Map<ChunkCoordinate, TargetChunk> open =
    new HashMap<ChunkCoordinate, TargetChunk>();
  private final BitSet flushed;
  private int flushedCount = 0;
  private int peakOpenChunks = 0;

  private final Object lock = new Object();
  private long liveBytes = 0;
  private long pendingBytes = 0;
  private long peakBytes = 0;

  /**
   * @param grid target chunk grid
   * @param memoryBudget maximum number of buffered bytes
   */
  public AssemblyBuffer(ChunkGrid grid, long memoryBudget) {
    this.grid = grid;
    this.memoryBudget = memoryBudget;
    this.flushed = new BitSet(grid.getChunkCount());
  }

  public ChunkGrid getGrid() {
    return grid;
  }

  /**
   * Copy a tile's samples into the chunks it intersects.
   *
   * @param tile source tile; must lie inside the grid's extents
   * @return chunks completed by this tile, in row-major grid order
   * @throws DuplicateCellException if a cell was already written
   * @throws TooManyOpenChunksException if a new chunk does not fit
   * @throws ConversionCancelledException if interrupted while waiting for
   *         pending writes
   */
  public List<TargetChunk> scatter(SourceTile tile)
    throws DuplicateCellException, TooManyOpenChunksException,
      ConversionCancelledException
  {
    int[] lo = new int[Extents.DIMENSIONS];
    int[] hi = new int[Extents.DIMENSIONS];
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      int start = tile.getOffset(axis);
      int end = start + tile.getShape(axis);
      if (start < 0 || end > grid.getExtents().get(axis)) {
        throw new IllegalArgumentException(
          "Tile " + tile + " is outside of " + grid.getExtents());
      }
      int size = grid.getChunkShape().get(axis);
      lo[axis] = start / size;
      hi[axis] = (end - 1) / size + 1;
    }

    List<TargetChunk> touched = new ArrayList<TargetChunk>();
    int[] c = lo.clone();
    do {
      ChunkCoordinate coordinate = new ChunkCoordinate(c[0], c[1], c[2], c[3]);
      if (flushed.get(grid.linearIndex(coordinate))) {
        throw new DuplicateCellException("Tile " + tile +
          " writes to chunk " + coordinate + " which was already flushed");
      }
      TargetChunk chunk = open.get(coordinate);
      if (chunk == null) {
        reserve(grid.getByteCount(coordinate), coordinate);
        chunk = new TargetChunk(grid, coordinate);
        open.put(coordinate, chunk);
        peakOpenChunks = Math.max(peakOpenChunks, open.size());
        LOGGER.trace("Opened {}", chunk);
      }
      touched.add(chunk);
    } while (next(c, lo, hi));

    List<TargetChunk> completed = new ArrayList<TargetChunk>();
    for (TargetChunk chunk : touched) {
      copy(tile, chunk);
      if (chunk.isComplete()) {
        open.remove(chunk.getCoordinate());
        flushed.set(grid.linearIndex(chunk.getCoordinate()));
        flushedCount++;
        synchronized (lock) {
          liveBytes -= chunk.getByteCount();
          pendingBytes += chunk.getByteCount();
        }
        LOGGER.debug("Completed {}", chunk);
        completed.add(chunk);
      }
    }
    return completed;
  }

  /**
   * Return the bytes of a completed chunk to the budget once it has been
   * written (or discarded) and drop its buffer.
   *
   * @param chunk chunk previously returned by {@link #scatter(SourceTile)}
   */
  public void release(TargetChunk chunk) {
    chunk.release();
    synchronized (lock) {
      pendingBytes -= chunk.getByteCount();
      lock.notifyAll();
    }
  }

  /**
   * Drop every open chunk without writing it.
   */
  public void clear() {
    synchronized (lock) {
      liveBytes = 0;
      lock.notifyAll();
    }
    open.clear();
  }

  /**
   * @return coordinates of the open chunks, in row-major grid order
   */
  public List<ChunkCoordinate> getOpenChunks() {
    return new ArrayList<ChunkCoordinate>(
      new TreeSet<ChunkCoordinate>(open.keySet()));
  }

  public int getOpenChunkCount() {
    return open.size();
  }

  public int getFlushedCount() {
    return flushedCount;
  }

  public int getPeakOpenChunks() {
    return peakOpenChunks;
  }

  public long getLiveBytes() {
    synchronized (lock) {
      return liveBytes;
    }
  }

  public long getPendingBytes() {
    synchronized (lock) {
      return pendingBytes;
    }
  }

  /**
   * @return highest sum of live and pending bytes seen so far
   */
  public long getPeakBytes() {
    synchronized (lock) {
      return peakBytes;
    }
  }

  private void reserve(long bytes, ChunkCoordinate coordinate)
    throws TooManyOpenChunksException, ConversionCancelledException
  {
    synchronized (lock) {
      while (liveBytes + pendingBytes + bytes > memoryBudget) {
        if (pendingBytes == 0) {
          throw new TooManyOpenChunksException(String.format(
            "Opening chunk %s (%d bytes) with %d chunks (%d bytes) open " +
            "exceeds the memory budget of %d bytes",
            coordinate, bytes, open.size(), liveBytes, memoryBudget));
        }
        LOGGER.trace("Waiting for {} pending bytes", pendingBytes);
        try {
          lock.wait();
        }
        catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new ConversionCancelledException(
            "Interrupted while waiting for pending writes");
        }
      }
      liveBytes += bytes;
      peakBytes = Math.max(peakBytes, liveBytes + pendingBytes);
    }
  }

  private void copy(SourceTile tile, TargetChunk chunk)
    throws DuplicateCellException
  {
    int[] origin = chunk.getOrigin();
    int[] shape = chunk.getShape();
    int[] from = new int[Extents.DIMENSIONS];
    int[] to = new int[Extents.DIMENSIONS];
    int[] tileShape = new int[Extents.DIMENSIONS];
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      tileShape[axis] = tile.getShape(axis);
      from[axis] = Math.max(tile.getOffset(axis), origin[axis]);
      to[axis] = Math.min(tile.getOffset(axis) + tileShape[axis],
        origin[axis] + shape[axis]);
    }
    int run = to[3] - from[3];
    int[] data = tile.getData();
    for (int l=from[0]; l<to[0]; l++) {
      for (int x=from[1]; x<to[1]; x++) {
        for (int y=from[2]; y<to[2]; y++) {
          int source = (((l - tile.getOffset(0)) * tileShape[1] +
            (x - tile.getOffset(1))) * tileShape[2] +
            (y - tile.getOffset(2))) * tileShape[3] +
            (from[3] - tile.getOffset(3));
          int target = (((l - origin[0]) * shape[1] +
            (x - origin[1])) * shape[2] +
            (y - origin[2])) * shape[3] +
            (from[3] - origin[3]);
          chunk.write(target, data, source, run);
        }
      }
    }
  }

  private static boolean next(int[] c, int[] lo, int[] hi) {
    for (int axis=c.length - 1; axis>=0; axis--) {
      c[axis]++;
      if (c[axis] < hi[axis]) {
        return true;
      }
      c[axis] = lo[axis];
    }
    return false;
  }

}
