/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable plan for one conversion run: the passes over the source and,
 * for each pass, the order in which target chunks are opened and flushed.
 */
public class ConversionPlan {

  private final Layout layout;
  private final ChunkGrid grid;
  private final long memoryBudget;
  private final List<ConversionPass> passes;

  /**
   * @param layout stored copy that will be read
   * @param grid target chunk grid
   * @param budget memory budget the plan was validated against
   * @param passes passes over the source, in execution order
   */
  public ConversionPlan(Layout layout, ChunkGrid grid, long budget,
    List<ConversionPass> passes)
  {
    this.layout = layout;
    this.grid = grid;
    this.memoryBudget = budget;
    this.passes = Collections.unmodifiableList(
      new ArrayList<ConversionPass>(passes));
  }

  public Layout getLayout() {
    return layout;
  }

  public ChunkGrid getGrid() {
    return grid;
  }

  public long getMemoryBudget() {
    return memoryBudget;
  }

  public List<ConversionPass> getPasses() {
    return passes;
  }

  /**
   * @return true if the source is scanned more than once
   */
  public boolean isMultiPass() {
    return passes.size() > 1;
  }

  /**
   * @return every chunk of the grid, in predicted flush order
   */
  public List<ChunkCoordinate> getChunkOrder() {
    List<ChunkCoordinate> order = new ArrayList<ChunkCoordinate>();
    for (ConversionPass pass : passes) {
      order.addAll(pass.getFlushOrder());
    }
    return order;
  }

  /**
   * @return worst-case number of concurrently open chunks over all passes
   */
  public int getMaxOpenChunks() {
    int max = 0;
    for (ConversionPass pass : passes) {
      max = Math.max(max, pass.getPeakOpenChunks());
    }
    return max;
  }

  /**
   * @return worst-case buffered bytes over all passes
   */
  public long getPeakBytes() {
    long max = 0;
    for (ConversionPass pass : passes) {
      max = Math.max(max, pass.getPeakBytes());
    }
    return max;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ConversionPlan)) {
      return false;
    }
    ConversionPlan p = (ConversionPlan) o;
    return layout == p.layout && memoryBudget == p.memoryBudget &&
      grid.getExtents().equals(p.grid.getExtents()) &&
      grid.getChunkShape().equals(p.grid.getChunkShape()) &&
      passes.equals(p.passes);
  }

  @Override
  public int hashCode() {
    return (layout.hashCode() * 31 + grid.getChunkShape().hashCode()) * 31 +
      passes.hashCode();
  }

  @Override
  public String toString() {
    return String.format(
      "%s plan over %s: %d pass(es), peak %d open chunks (%d bytes)",
      layout, grid, passes.size(), getMaxOpenChunks(), getPeakBytes());
  }

}
