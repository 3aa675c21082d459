/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw.test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.glencoesoftware.ms2raw.BudgetExceededException;
import com.glencoesoftware.ms2raw.ChunkCoordinate;
import com.glencoesoftware.ms2raw.ChunkGrid;
import com.glencoesoftware.ms2raw.ChunkPlanner;
import com.glencoesoftware.ms2raw.ChunkShape;
import com.glencoesoftware.ms2raw.ConversionPlan;
import com.glencoesoftware.ms2raw.Extents;
import com.glencoesoftware.ms2raw.Layout;
import com.glencoesoftware.ms2raw.SpatialRegion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChunkPlannerTest {

  private ChunkPlanner planner;

  @BeforeEach
  public void setup() {
    planner = new ChunkPlanner();
  }

  private static ChunkCoordinate c(int l, int x, int y, int b) {
    return new ChunkCoordinate(l, x, y, b);
  }

  /**
   * One chunk per layer: each chunk closes before the next layer starts.
   */
  @Test
  public void testSpectrumOneChunkPerLayer() throws Exception {
    ConversionPlan plan = planner.plan(Layout.spectrum,
      new Extents(2, 3, 3, 4), new ChunkShape(1, 3, 3, 4), 1024);
    assertEquals(Arrays.asList(c(0, 0, 0, 0), c(1, 0, 0, 0)),
      plan.getChunkOrder());
    assertEquals(1, plan.getMaxOpenChunks());
    assertEquals(144, plan.getPeakBytes());
    assertFalse(plan.isMultiPass());
    assertEquals(2, plan.getGrid().getChunkCount());
  }

  /**
   * Image-major tiles touch every spatial chunk of their layer.
   */
  @Test
  public void testImageWorstCase() throws Exception {
    Extents extents = new Extents(1, 4, 4, 8);
    ChunkShape shape = new ChunkShape(1, 2, 2, 8);
    ConversionPlan image = planner.plan(Layout.image, extents, shape, 1024);
    assertEquals(4, image.getMaxOpenChunks());
    assertEquals(512, image.getPeakBytes());

    ConversionPlan spectrum =
      planner.plan(Layout.spectrum, extents, shape, 1024);
    assertEquals(2, spectrum.getMaxOpenChunks());
    assertEquals(256, spectrum.getPeakBytes());
    assertEquals(
      Arrays.asList(c(0, 0, 0, 0), c(0, 0, 1, 0), c(0, 1, 0, 0), c(0, 1, 1, 0)),
      spectrum.getChunkOrder());
  }

  /**
   * Image-major chunks complete bin range by bin range, not in grid order.
   */
  @Test
  public void testImageFlushOrder() throws Exception {
    ConversionPlan plan = planner.plan(Layout.image,
      new Extents(1, 4, 4, 8), new ChunkShape(1, 2, 2, 4), 256);
    assertEquals(Arrays.asList(
      c(0, 0, 0, 0), c(0, 0, 1, 0), c(0, 1, 0, 0), c(0, 1, 1, 0),
      c(0, 0, 0, 1), c(0, 0, 1, 1), c(0, 1, 0, 1), c(0, 1, 1, 1)),
      plan.getChunkOrder());
    assertEquals(4, plan.getMaxOpenChunks());
    assertEquals(256, plan.getPeakBytes());
  }

  @Test
  public void testBudgetExceeded() throws Exception {
    Extents extents = new Extents(1, 4, 4, 8);
    ChunkShape shape = new ChunkShape(1, 2, 2, 8);
    assertThrows(BudgetExceededException.class, () -> {
      planner.plan(Layout.image, extents, shape, 511);
    });
    assertEquals(4,
      planner.plan(Layout.image, extents, shape, 512).getMaxOpenChunks());
    // the spectrum-major copy of the same data fits
    assertEquals(2,
      planner.plan(Layout.spectrum, extents, shape, 511).getMaxOpenChunks());
  }

  /**
   * One 256x256 image with 40000 bins fits in 16 GiB, but not in a
   * single Java array.
   */
  @Test
  public void testChunkLargerThanArray() throws Exception {
    Extents extents = new Extents(1, 256, 256, 40000);
    ChunkShape shape = new ChunkShape(1, 256, 256, 40000);
    long budget = 16L * 1024 * 1024 * 1024;
    ChunkGrid grid = new ChunkGrid(extents, shape);
    assertEquals(2621440000L, grid.getMaxChunkCellCount());
    assertThrows(ArithmeticException.class, () -> {
      grid.getCellCount(new ChunkCoordinate(0, 0, 0, 0));
    });
    for (Layout layout : Layout.values()) {
      assertThrows(BudgetExceededException.class, () -> {
        planner.plan(layout, extents, shape, budget);
      });
      assertThrows(BudgetExceededException.class, () -> {
        planner.plan(layout, extents, shape, budget, true);
      });
    }

    // halving the bins brings each chunk under the limit
    ConversionPlan plan = planner.plan(Layout.spectrum, extents,
      new ChunkShape(1, 256, 256, 20000), budget);
    assertEquals(2, plan.getGrid().getChunkCount());
    assertEquals(1310720000,
      plan.getGrid().getCellCount(new ChunkCoordinate(0, 0, 0, 1)));
  }

  @Test
  public void testInvalidBudget() {
    assertThrows(IllegalArgumentException.class, () -> {
      planner.plan(Layout.spectrum, new Extents(1, 1, 1, 1),
        new ChunkShape(1, 1, 1, 1), 0);
    });
  }

  @Test
  public void testPlanningIsIdempotent() throws Exception {
    Extents extents = new Extents(3, 7, 5, 11);
    ChunkShape shape = new ChunkShape(2, 3, 2, 4);
    for (Layout layout : Layout.values()) {
      ConversionPlan first = planner.plan(layout, extents, shape, 1 << 20);
      ConversionPlan second =
        new ChunkPlanner().plan(layout, extents, shape, 1 << 20);
      assertEquals(first, second);
      assertEquals(first.hashCode(), second.hashCode());
      assertEquals(first.getChunkOrder(), second.getChunkOrder());
    }
    ConversionPlan first =
      planner.plan(Layout.image, extents, shape, 2048, true);
    ConversionPlan second =
      planner.plan(Layout.image, extents, shape, 2048, true);
    assertTrue(first.isMultiPass());
    assertEquals(first, second);
  }

  /**
   * Columns of chunks are converted one band at a time when the whole
   * image does not fit.
   */
  @Test
  public void testMultiPassColumns() throws Exception {
    Extents extents = new Extents(1, 4, 4, 8);
    ChunkShape shape = new ChunkShape(1, 2, 2, 8);
    assertThrows(BudgetExceededException.class, () -> {
      planner.plan(Layout.image, extents, shape, 256, false);
    });

    ConversionPlan plan = planner.plan(Layout.image, extents, shape, 256, true);
    assertTrue(plan.isMultiPass());
    assertEquals(2, plan.getPasses().size());
    assertEquals(new SpatialRegion(0, 0, 2, 4),
      plan.getPasses().get(0).getRegion());
    assertEquals(new SpatialRegion(2, 0, 2, 4),
      plan.getPasses().get(1).getRegion());
    assertEquals(2, plan.getMaxOpenChunks());
    assertEquals(256, plan.getPeakBytes());
    assertEquals(
      Arrays.asList(c(0, 0, 0, 0), c(0, 0, 1, 0), c(0, 1, 0, 0), c(0, 1, 1, 0)),
      plan.getChunkOrder());
  }

  /**
   * Single columns are split into rows when a full column does not fit.
   */
  @Test
  public void testMultiPassRows() throws Exception {
    Extents extents = new Extents(1, 4, 4, 8);
    ChunkShape shape = new ChunkShape(1, 2, 2, 8);
    ConversionPlan plan = planner.plan(Layout.image, extents, shape, 128, true);
    assertEquals(4, plan.getPasses().size());
    assertEquals(new SpatialRegion(0, 0, 2, 2),
      plan.getPasses().get(0).getRegion());
    assertEquals(new SpatialRegion(0, 2, 2, 2),
      plan.getPasses().get(1).getRegion());
    assertEquals(new SpatialRegion(2, 0, 2, 2),
      plan.getPasses().get(2).getRegion());
    assertEquals(new SpatialRegion(2, 2, 2, 2),
      plan.getPasses().get(3).getRegion());
    assertEquals(1, plan.getMaxOpenChunks());
    assertEquals(128, plan.getPeakBytes());

    assertThrows(BudgetExceededException.class, () -> {
      planner.plan(Layout.image, extents, shape, 127, true);
    });
  }

  /**
   * Extents that are not multiples of the chunk shape give truncated edge
   * chunks that are still planned exactly once.
   */
  @Test
  public void testUnevenExtents() throws Exception {
    Extents extents = new Extents(1, 5, 3, 7);
    ConversionPlan plan = planner.plan(Layout.spectrum, extents,
      new ChunkShape(1, 2, 2, 3), 1024);
    ChunkGrid grid = plan.getGrid();
    assertEquals(18, grid.getChunkCount());
    assertArrayEquals(new int[] {1, 1, 1, 1}, grid.getShape(c(0, 2, 1, 2)));
    assertArrayEquals(new int[] {1, 2, 2, 3}, grid.getShape(c(0, 0, 0, 0)));
    assertEquals(6, plan.getMaxOpenChunks());
    assertEquals(168, plan.getPeakBytes());

    List<ChunkCoordinate> order = plan.getChunkOrder();
    assertEquals(18, order.size());
    Set<ChunkCoordinate> unique = new HashSet<ChunkCoordinate>(order);
    assertEquals(18, unique.size());
    for (int i=0; i<grid.getChunkCount(); i++) {
      assertTrue(unique.contains(grid.coordinate(i)));
    }
  }

  /**
   * Chunk shapes larger than the dataset are clamped to the extents.
   */
  @Test
  public void testOversizedChunkShape() throws Exception {
    ConversionPlan plan = planner.plan(Layout.image, new Extents(2, 3, 3, 4),
      new ChunkShape(8, 8, 8, 8), 1024);
    assertEquals(new ChunkShape(2, 3, 3, 4), plan.getGrid().getChunkShape());
    assertEquals(1, plan.getGrid().getChunkCount());
    assertEquals(288, plan.getPeakBytes());
  }

}
