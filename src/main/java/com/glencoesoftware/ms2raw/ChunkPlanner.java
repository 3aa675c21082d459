/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the order in which target chunks complete while a layout is
 * streamed, and the worst-case memory needed to hold the chunks that are
 * open at the same time.
 * <p>
 * Tiles arrive as a lexicographic sweep over the layout's tile axes.  All
 * chunks sharing the same grid indexes on those axes receive their first
 * and last cells from the same tiles, so they open and close together.
 * The peak is the maximum over the sweep of the bytes held by the groups
 * that are open at one time, with a group counted open from its first tile
 * to its last tile inclusive.
 * </p>
 * Planning is a pure function of its arguments.
 */
public class ChunkPlanner {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ChunkPlanner.class);

  private static final int X = 1;
  private static final int Y = 2;

  /**
   * Plan a single-pass conversion.
   *
   * @param layout layout that will be read
   * @param extents dataset extents
   * @param chunkShape requested chunk shape
   * @param memoryBudget maximum number of bytes of buffered chunks
   * @return the plan
   * @throws BudgetExceededException if the peak exceeds the budget
   */
  public ConversionPlan plan(Layout layout, Extents extents,
    ChunkShape chunkShape, long memoryBudget)
    throws BudgetExceededException
  {
    return plan(layout, extents, chunkShape, memoryBudget, false);
  }

  /**
   * Plan a conversion, splitting it into several passes over the source
   * when a single pass does not fit and that is allowed.
   *
   * @param layout layout that will be read
   * @param extents dataset extents
   * @param chunkShape requested chunk shape
   * @param memoryBudget maximum number of bytes of buffered chunks
   * @param allowMultiPass true if the source may be read more than once
   * @return the plan
   * @throws BudgetExceededException if no allowed plan fits in the budget,
   *         or if one chunk holds more cells than an array can
   */
  public ConversionPlan plan(Layout layout, Extents extents,
    ChunkShape chunkShape, long memoryBudget, boolean allowMultiPass)
    throws BudgetExceededException
  {
    if (memoryBudget <= 0) {
      throw new IllegalArgumentException(
        "Memory budget must be positive: " + memoryBudget);
    }
    Slf4JStopWatch t0 = stopWatch();
    try {
      ChunkGrid grid = new ChunkGrid(extents, chunkShape);
      if (grid.getMaxChunkCellCount() > ChunkGrid.MAX_CHUNK_CELLS) {
        throw new BudgetExceededException(String.format(
          "Chunks %s hold %d cells; a chunk can hold at most %d",
          grid.getChunkShape(), grid.getMaxChunkCellCount(),
          ChunkGrid.MAX_CHUNK_CELLS));
      }
      int gridX = grid.getGridSize(X);
      int gridY = grid.getGridSize(Y);

      Estimate single = estimateBands(layout, grid, gridX, gridY);
      LOGGER.debug("{} single pass peak: {} open chunks, {} bytes",
        layout, single.chunks, single.bytes);
      if (single.bytes <= memoryBudget) {
        return buildPlan(layout, grid, memoryBudget, gridX, gridY);
      }
      if (!allowMultiPass) {
        throw new BudgetExceededException(String.format(
          "Converting the %s layout with chunks %s needs %d open chunks " +
          "(%d bytes); the memory budget is %d bytes",
          layout, grid.getChunkShape(), single.chunks, single.bytes,
          memoryBudget));
      }

      int bandX = widestBand(layout, grid, memoryBudget, true);
      if (bandX > 0) {
        return buildPlan(layout, grid, memoryBudget, bandX, gridY);
      }
      int bandY = widestBand(layout, grid, memoryBudget, false);
      if (bandY > 0) {
        return buildPlan(layout, grid, memoryBudget, 1, bandY);
      }
      Estimate smallest = estimateBands(layout, grid, 1, 1);
      throw new BudgetExceededException(String.format(
        "A single spatial chunk of the %s layout with chunks %s needs " +
        "%d bytes; the memory budget is %d bytes",
        layout, grid.getChunkShape(), smallest.bytes, memoryBudget));
    }
    finally {
      t0.stop("plan");
    }
  }

  /**
   * Find the widest band of chunk columns (or, with single columns, rows)
   * whose passes fit in the budget.
   *
   * @return band width in chunks, or 0 if a band of one does not fit
   */
  private int widestBand(Layout layout, ChunkGrid grid, long memoryBudget,
    boolean columns)
  {
    int n = columns ? grid.getGridSize(X) : grid.getGridSize(Y);
    if (!fits(layout, grid, memoryBudget, columns, 1)) {
      return 0;
    }
    int low = 1;
    int high = n;
    while (low < high) {
      int mid = low + (high - low + 1) / 2;
      if (fits(layout, grid, memoryBudget, columns, mid)) {
        low = mid;
      }
      else {
        high = mid - 1;
      }
    }
    return low;
  }

  private boolean fits(Layout layout, ChunkGrid grid, long memoryBudget,
    boolean columns, int band)
  {
    Estimate e = columns ?
      estimateBands(layout, grid, band, grid.getGridSize(Y)) :
      estimateBands(layout, grid, 1, band);
    return e.bytes <= memoryBudget;
  }

  /**
   * Worst case over all passes when the spatial chunk grid is cut into
   * bands of the given size.
   */
  private Estimate estimateBands(Layout layout, ChunkGrid grid,
    int bandX, int bandY)
  {
    Estimate worst = new Estimate(0, 0);
    for (int[][] range : passRanges(grid, bandX, bandY)) {
      Estimate e = sweep(layout, grid, range[0], range[1]);
      if (e.bytes > worst.bytes ||
        (e.bytes == worst.bytes && e.chunks > worst.chunks))
      {
        worst = e;
      }
    }
    return worst;
  }

  private ConversionPlan buildPlan(Layout layout, ChunkGrid grid,
    long memoryBudget, int bandX, int bandY)
  {
    int[] shape = grid.getChunkShape().toArray();
    Extents extents = grid.getExtents();
    List<ConversionPass> passes = new ArrayList<ConversionPass>();
    for (int[][] range : passRanges(grid, bandX, bandY)) {
      int[] lo = range[0];
      int[] hi = range[1];
      int x = lo[X] * shape[X];
      int y = lo[Y] * shape[Y];
      int width = Math.min(hi[X] * shape[X], extents.getWidth()) - x;
      int height = Math.min(hi[Y] * shape[Y], extents.getHeight()) - y;
      Estimate e = sweep(layout, grid, lo, hi);
      ConversionPass pass = new ConversionPass(
        new SpatialRegion(x, y, width, height),
        flushOrder(layout, grid, lo, hi), e.chunks, e.bytes);
      LOGGER.debug("{} pass {}: {}", layout, passes.size(), pass);
      passes.add(pass);
    }
    ConversionPlan plan =
      new ConversionPlan(layout, grid, memoryBudget, passes);
    LOGGER.info("Planned {}", plan);
    return plan;
  }

  /**
   * Chunk index ranges [lo, hi) of every pass, columns outermost.
   */
  private List<int[][]> passRanges(ChunkGrid grid, int bandX, int bandY) {
    List<int[][]> ranges = new ArrayList<int[][]>();
    int gridX = grid.getGridSize(X);
    int gridY = grid.getGridSize(Y);
    for (int x=0; x<gridX; x+=bandX) {
      for (int y=0; y<gridY; y+=bandY) {
        int[] lo = new int[Extents.DIMENSIONS];
        int[] hi = new int[Extents.DIMENSIONS];
        for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
          hi[axis] = grid.getGridSize(axis);
        }
        lo[X] = x;
        hi[X] = Math.min(x + bandX, gridX);
        lo[Y] = y;
        hi[Y] = Math.min(y + bandY, gridY);
        ranges.add(new int[][] {lo, hi});
      }
    }
    return ranges;
  }

  /**
   * Sweep the open and close events of every chunk group in the range.
   */
  private Estimate sweep(Layout layout, ChunkGrid grid, int[] lo, int[] hi) {
    int[] tileAxes = layout.getTileAxes();
    int[] innerAxes = innerAxes(tileAxes);

    int innerChunks = 1;
    long innerCells = 1;
    for (int axis : innerAxes) {
      innerChunks *= hi[axis] - lo[axis];
      innerCells *= span(grid, axis, lo[axis], hi[axis]);
    }

    List<Group> groups = new ArrayList<Group>();
    int[] index = new int[tileAxes.length];
    for (int i=0; i<tileAxes.length; i++) {
      index[i] = lo[tileAxes[i]];
    }
    do {
      long cells = innerCells;
      for (int i=0; i<tileAxes.length; i++) {
        cells *= grid.getLength(tileAxes[i], index[i]);
      }
      groups.add(new Group(firstTime(grid, tileAxes, index),
        lastTime(grid, tileAxes, index),
        cells * ChunkGrid.BYTES_PER_CELL));
    } while (increment(index, tileAxes, lo, hi));

    Group[] byOpen = groups.toArray(new Group[groups.size()]);
    Group[] byClose = byOpen.clone();
    Arrays.sort(byOpen, Comparator.comparingLong(g -> g.first));
    Arrays.sort(byClose, Comparator.comparingLong(g -> g.last));

    long bytes = 0;
    int open = 0;
    long peakBytes = 0;
    int peakGroups = 0;
    int closed = 0;
    for (int opened=0; opened<byOpen.length;) {
      long time = byOpen[opened].first;
      while (closed < byClose.length && byClose[closed].last < time) {
        bytes -= byClose[closed].bytes;
        open--;
        closed++;
      }
      while (opened < byOpen.length && byOpen[opened].first == time) {
        bytes += byOpen[opened].bytes;
        open++;
        opened++;
      }
      if (bytes > peakBytes) {
        peakBytes = bytes;
      }
      if (open > peakGroups) {
        peakGroups = open;
      }
    }
    return new Estimate(peakGroups * innerChunks, peakBytes);
  }

  /**
   * Every chunk of the range ordered by the tile that completes it,
   * ties in row-major grid order.
   */
  private List<ChunkCoordinate> flushOrder(Layout layout, ChunkGrid grid,
    int[] lo, int[] hi)
  {
    final int[] tileAxes = layout.getTileAxes();
    List<ChunkCoordinate> order = new ArrayList<ChunkCoordinate>();
    int[] all = {0, 1, 2, 3};
    int[] c = lo.clone();
    do {
      order.add(new ChunkCoordinate(c[0], c[1], c[2], c[3]));
    } while (increment(c, all, lo, hi));

    final long[] close = new long[order.size()];
    List<Integer> positions = new ArrayList<Integer>();
    for (int i=0; i<order.size(); i++) {
      ChunkCoordinate coord = order.get(i);
      int[] index = new int[tileAxes.length];
      for (int a=0; a<tileAxes.length; a++) {
        index[a] = coord.get(tileAxes[a]);
      }
      close[i] = lastTime(grid, tileAxes, index);
      positions.add(i);
    }
    // stable, so ties stay in row-major order
    Collections.sort(positions, Comparator.comparingLong(i -> close[i]));
    List<ChunkCoordinate> sorted = new ArrayList<ChunkCoordinate>();
    for (Integer i : positions) {
      sorted.add(order.get(i));
    }
    return sorted;
  }

  /**
   * Advance a row-major odometer over the given axes.
   *
   * @return false once every position has been visited
   */
  private static boolean increment(int[] index, int[] axes, int[] lo,
    int[] hi)
  {
    for (int i=index.length - 1; i>=0; i--) {
      index[i]++;
      if (index[i] < hi[axes[i]]) {
        return true;
      }
      index[i] = lo[axes[i]];
    }
    return false;
  }

  private static int[] innerAxes(int[] tileAxes) {
    int[] inner = new int[Extents.DIMENSIONS - tileAxes.length];
    int n = 0;
    for (int axis=0; axis<Extents.DIMENSIONS; axis++) {
      if (Arrays.binarySearch(tileAxes, axis) < 0) {
        inner[n++] = axis;
      }
    }
    return inner;
  }

  private static int span(ChunkGrid grid, int axis, int lo, int hi) {
    int size = grid.getChunkShape().get(axis);
    return Math.min(hi * size, grid.getExtents().get(axis)) - lo * size;
  }

  /**
   * Position in the tile sequence of the first tile of a group.
   */
  private static long firstTime(ChunkGrid grid, int[] tileAxes, int[] index) {
    long time = 0;
    for (int i=0; i<tileAxes.length; i++) {
      int axis = tileAxes[i];
      time = time * grid.getExtents().get(axis) +
        (long) index[i] * grid.getChunkShape().get(axis);
    }
    return time;
  }

  /**
   * Position in the tile sequence of the last tile of a group.
   */
  private static long lastTime(ChunkGrid grid, int[] tileAxes, int[] index) {
    long time = 0;
    for (int i=0; i<tileAxes.length; i++) {
      int axis = tileAxes[i];
      int start = index[i] * grid.getChunkShape().get(axis);
      time = time * grid.getExtents().get(axis) +
        start + grid.getLength(axis, index[i]) - 1;
    }
    return time;
  }

  private static class Group {
    final long first;
    final long last;
    final long bytes;

    Group(long first, long last, long bytes) {
      this.first = first;
      this.last = last;
      this.bytes = bytes;
    }
  }

  private static class Estimate {
    final int chunks;
    final long bytes;

    Estimate(int chunks, long bytes) {
      this.chunks = chunks;
      this.bytes = bytes;
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
