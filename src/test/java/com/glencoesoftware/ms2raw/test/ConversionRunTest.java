/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw.test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;
import com.glencoesoftware.ms2raw.BudgetExceededException;
import com.glencoesoftware.ms2raw.ChunkCoordinate;
import com.glencoesoftware.ms2raw.ChunkGrid;
import com.glencoesoftware.ms2raw.ChunkPlanner;
import com.glencoesoftware.ms2raw.ChunkShape;
import com.glencoesoftware.ms2raw.ConversionCancelledException;
import com.glencoesoftware.ms2raw.ConversionPlan;
import com.glencoesoftware.ms2raw.ConversionReport;
import com.glencoesoftware.ms2raw.ConversionRun;
import com.glencoesoftware.ms2raw.DuplicateCellException;
import com.glencoesoftware.ms2raw.Extents;
import com.glencoesoftware.ms2raw.IncompleteOutputException;
import com.glencoesoftware.ms2raw.IonSource;
import com.glencoesoftware.ms2raw.Layout;
import com.glencoesoftware.ms2raw.OutputValidator;
import com.glencoesoftware.ms2raw.RunState;
import com.glencoesoftware.ms2raw.SourceReadException;
import com.glencoesoftware.ms2raw.TargetChunk;
import com.glencoesoftware.ms2raw.TargetWriteException;
import com.glencoesoftware.ms2raw.TargetWriter;
import com.glencoesoftware.ms2raw.TooManyOpenChunksException;
import com.glencoesoftware.ms2raw.ZarrCompression;
import com.glencoesoftware.ms2raw.ZarrTargetWriter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversionRunTest extends AbstractConversionTest {

  private static final Extents SMALL = new Extents(2, 3, 3, 4);
  private static final Extents SQUARE = new Extents(1, 4, 4, 8);

  private static ChunkCoordinate c(int l, int x, int y, int b) {
    return new ChunkCoordinate(l, x, y, b);
  }

  private ConversionRun run(MemorySource source, Layout layout,
    ChunkShape shape, long budget, Path destination)
  {
    ConversionRun run =
      new ConversionRun(source, layout, shape, budget, destination);
    run.setCompression(ZarrCompression.raw);
    return run;
  }

  /**
   * Spectrum-major conversion with one chunk per layer.
   */
  @Test
  public void testSpectrumOneChunkPerLayer() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    TestProgressListener listener = new TestProgressListener();
    ConversionRun run = run(source, Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    run.setProgressListener(listener);
    ConversionReport report = run.call();

    assertEquals(RunState.FINALIZED, run.getState());
    assertEquals(2, report.getChunksFlushed());
    assertEquals(SMALL.getCellCount(), report.getCellsWritten());
    assertEquals(18, report.getTilesRead());
    assertEquals(1, report.getPassCount());
    assertEquals(Arrays.asList(c(0, 0, 0, 0), c(1, 0, 0, 0)),
      listener.getChunks(Layout.spectrum));
    assertEquals(run.getPlan().getChunkOrder(),
      listener.getChunks(Layout.spectrum));
    assertEquals(2, listener.getExpectedChunkCount(Layout.spectrum));

    assertTrue(ZarrTargetWriter.isFinalized(output));
    assertSignal(output, SMALL);
  }

  /**
   * Image-major conversion produces the same array as spectrum-major.
   */
  @Test
  public void testImageMatchesSpectrum() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    ChunkShape shape = new ChunkShape(1, 3, 3, 4);
    Path spectra = output.resolve("spectra");
    Path images = output.resolve("images");
    run(source, Layout.spectrum, shape, 1024, spectra).call();
    ConversionReport report =
      run(source, Layout.image, shape, 1024, images).call();

    assertEquals(2, report.getChunksFlushed());
    assertEquals(8, report.getTilesRead());
    assertArrayEquals(readSignal(spectra), readSignal(images));
    assertSignal(images, SMALL);
    assertEquals(SMALL.getCellCount(),
      new OutputValidator().validate(spectra, images));
  }

  /**
   * Chunks are written in the order predicted by the plan.
   */
  @Test
  public void testImageFlushOrder() throws Exception {
    MemorySource source = new MemorySource(SQUARE);
    TestProgressListener listener = new TestProgressListener();
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 2, 2, 4), 256, output);
    run.setProgressListener(listener);
    run.call();

    List<ChunkCoordinate> written = listener.getChunks(Layout.image);
    assertEquals(8, written.size());
    assertEquals(run.getPlan().getChunkOrder(), written);
    assertEquals(Arrays.asList(c(0, 0, 0, 0), c(0, 0, 1, 0), c(0, 1, 0, 0)),
      written.subList(0, 3));
    assertSignal(output, SQUARE);
  }

  /**
   * A cell contributed twice by image-major tiles fails the run and
   * leaves no output.
   */
  @Test
  public void testDuplicateCell() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    source.setDuplicate(0);
    TestProgressListener listener = new TestProgressListener();
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    run.setProgressListener(listener);
    assertThrows(DuplicateCellException.class, () -> {
      run.call();
    });
    assertEquals(RunState.FAILED, run.getState());
    assertFalse(Files.exists(output));
    assertEquals(Arrays.asList(Layout.image), listener.getFinishedRuns());
  }

  /**
   * A duplicate arriving after its chunk was flushed is also detected.
   */
  @Test
  public void testDuplicateAfterFlush() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    source.setDuplicate(8);
    ConversionRun run = run(source, Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    assertThrows(DuplicateCellException.class, () -> {
      run.call();
    });
    assertFalse(Files.exists(output));
  }

  /**
   * A budget below the image-major worst case fails during planning,
   * before any tile is read or any output created.
   */
  @Test
  public void testBudgetExceededBeforeReading() throws Exception {
    MemorySource source = new MemorySource(SQUARE);
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 2, 2, 8), 511, output);
    assertThrows(BudgetExceededException.class, () -> {
      run.call();
    });
    assertEquals(RunState.FAILED, run.getState());
    assertEquals(0, source.getReadersOpened());
    assertEquals(0, source.getTilesRead());
    assertFalse(Files.exists(output));
  }

  /**
   * A chunk with more cells than an array can hold is rejected while
   * planning, even when the budget would cover it.
   */
  @Test
  public void testChunkLargerThanArray() throws Exception {
    Extents extents = new Extents(1, 256, 256, 40000);
    MemorySource source = new MemorySource(extents);
    ConversionRun run = run(source, Layout.spectrum,
      new ChunkShape(1, 256, 256, 40000), 16L * 1024 * 1024 * 1024, output);
    assertThrows(BudgetExceededException.class, () -> {
      run.call();
    });
    assertEquals(RunState.FAILED, run.getState());
    assertEquals(0, source.getReadersOpened());
    assertFalse(Files.exists(output));
  }

  /**
   * With several passes allowed, a budget too small for one pass still
   * gives the same output.
   */
  @Test
  public void testMultiPass() throws Exception {
    MemorySource source = new MemorySource(SQUARE);
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 2, 2, 8), 256, output);
    run.setAllowMultiPass(true);
    ConversionReport report = run.call();

    assertEquals(2, report.getPassCount());
    assertEquals(2, source.getReadersOpened());
    assertEquals(16, report.getTilesRead());
    assertEquals(4, report.getChunksFlushed());
    assertTrue(report.getPeakBufferedBytes() <= 256);
    assertSignal(output, SQUARE);
  }

  /**
   * Buffered bytes never exceed the budget, with the budget set to the
   * planned peak and a single-entry write queue.
   */
  @Test
  public void testMemoryBound() throws Exception {
    Extents extents = new Extents(2, 5, 3, 7);
    ChunkShape shape = new ChunkShape(1, 2, 2, 3);
    for (Layout layout : Layout.values()) {
      long budget = new ChunkPlanner()
        .plan(layout, extents, shape, Long.MAX_VALUE).getPeakBytes();
      Path destination = output.resolve(layout.getOutputName());
      ConversionRun run =
        run(new MemorySource(extents), layout, shape, budget, destination);
      run.setWriteQueueSize(1);
      ConversionReport report = run.call();
      assertTrue(report.getPeakBufferedBytes() <= budget,
        layout + " peak " + report.getPeakBufferedBytes() + " > " + budget);
      assertTrue(report.getPeakBufferedBytes() > 0);
      assertSignal(destination, extents);
    }
  }

  /**
   * Extents that are not multiples of the chunk shape.
   */
  @Test
  public void testUnevenExtents() throws Exception {
    Extents extents = new Extents(3, 5, 3, 7);
    ChunkShape shape = new ChunkShape(2, 2, 2, 3);
    ConversionReport report = run(new MemorySource(extents), Layout.image,
      shape, 1 << 20, output).call();

    ChunkGrid grid = new ChunkGrid(extents, shape);
    assertEquals(grid.getChunkCount(), report.getChunksFlushed());
    assertEquals(extents.getCellCount(), report.getCellsWritten());
    ZarrArray array =
      ZarrArray.open(output.resolve(ZarrTargetWriter.ARRAY_NAME));
    assertArrayEquals(new int[] {3, 5, 3, 7}, array.getShape());
    assertArrayEquals(new int[] {2, 2, 2, 3}, array.getChunks());
    assertSignal(output, extents);

    ZarrGroup group = ZarrGroup.open(output);
    assertEquals(Arrays.asList(3, 5, 3, 7),
      group.getAttributes().get(ZarrTargetWriter.EXTENTS_KEY));
    assertEquals(Arrays.asList(2, 2, 2, 3),
      group.getAttributes().get(ZarrTargetWriter.CHUNKS_KEY));
    assertEquals("image",
      group.getAttributes().get(ZarrTargetWriter.SOURCE_LAYOUT_KEY));
  }

  @Test
  public void testCancel() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    final ConversionRun run = run(source, Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    source.setListener((position, tile) -> {
      if (position == 10) {
        run.cancel();
      }
    });
    assertThrows(ConversionCancelledException.class, () -> {
      run.call();
    });
    assertTrue(run.isCancelled());
    assertEquals(RunState.FAILED, run.getState());
    assertFalse(Files.exists(output));
  }

  @Test
  public void testReadFailure() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    source.setFailure(5);
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    assertThrows(SourceReadException.class, () -> {
      run.call();
    });
    assertFalse(Files.exists(output));
  }

  /**
   * A missing tile leaves a chunk open when the source is exhausted.
   */
  @Test
  public void testIncompleteSource() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    source.setDropped(4);
    ConversionRun run = run(source, Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    assertThrows(IncompleteOutputException.class, () -> {
      run.call();
    });
    assertEquals(RunState.FAILED, run.getState());
    assertFalse(Files.exists(output));
  }

  /**
   * The buffer enforces the budget even when the plan does not.
   */
  @Test
  public void testTooManyOpenChunks() throws Exception {
    MemorySource source = new MemorySource(SQUARE);
    ConversionRun run = run(source, Layout.image,
      new ChunkShape(1, 2, 2, 8), 256, output);
    run.setPlanner(new ChunkPlanner() {
      @Override
      public ConversionPlan plan(Layout layout, Extents extents,
        ChunkShape chunkShape, long memoryBudget, boolean allowMultiPass)
        throws BudgetExceededException
      {
        return super.plan(
          layout, extents, chunkShape, Long.MAX_VALUE, allowMultiPass);
      }
    });
    assertThrows(TooManyOpenChunksException.class, () -> {
      run.call();
    });
    assertEquals(1, source.getTilesRead());
    assertFalse(Files.exists(output));
  }

  @Test
  public void testWriteFailure() throws Exception {
    MemorySource source = new MemorySource(SMALL);
    ConversionRun run = new ConversionRun(source, Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output) {
      @Override
      protected TargetWriter createWriter(ChunkGrid grid)
        throws TargetWriteException
      {
        return new FailingWriter(super.createWriter(grid));
      }
    };
    run.setCompression(ZarrCompression.raw);
    assertThrows(TargetWriteException.class, () -> {
      run.call();
    });
    assertEquals(RunState.FAILED, run.getState());
    assertFalse(Files.exists(output));
  }

  /**
   * An existing destination is neither overwritten nor removed.
   */
  @Test
  public void testExistingDestination() throws Exception {
    Files.createDirectories(output);
    Path marker = Files.createFile(output.resolve("marker"));
    ConversionRun run = run(new MemorySource(SMALL), Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    assertThrows(TargetWriteException.class, () -> {
      run.call();
    });
    assertTrue(Files.exists(marker));
  }

  @Test
  public void testRunOnlyOnce() throws Exception {
    ConversionRun run = run(new MemorySource(SMALL), Layout.spectrum,
      new ChunkShape(1, 3, 3, 4), 1024, output);
    run.call();
    assertThrows(IllegalStateException.class, () -> {
      run.call();
    });
    assertTrue(ZarrTargetWriter.isFinalized(output));
  }

  /**
   * Both stored copies of an export on disk give the same array.
   */
  @Test
  public void testExportRoundTrip() throws Exception {
    Extents extents = new Extents(2, 4, 3, 5);
    writeExport(input, extents);
    IonSource source = IonSource.open(input);
    ChunkShape shape = new ChunkShape(1, 3, 2, 2);
    for (Layout layout : Layout.values()) {
      Path destination = output.resolve(layout.getOutputName());
      ConversionReport report = ConversionRun.convert(
        source, layout, shape, 1 << 20, destination);
      assertEquals(extents.getCellCount(), report.getCellsWritten());
      assertSignal(destination, extents);
    }
  }

  /**
   * Fails the first chunk write.
   */
  static class FailingWriter implements TargetWriter {
    private final TargetWriter delegate;

    FailingWriter(TargetWriter delegate) {
      this.delegate = delegate;
    }

    @Override
    public void write(TargetChunk chunk) throws TargetWriteException {
      throw new TargetWriteException("Simulated failure writing " + chunk);
    }

    @Override
    public int getWrittenCount() {
      return delegate.getWrittenCount();
    }

    @Override
    public void finish()
      throws IncompleteOutputException, TargetWriteException
    {
      delegate.finish();
    }

    @Override
    public void abort() throws TargetWriteException {
      delegate.abort();
    }

    @Override
    public void close() {
      delegate.close();
    }
  }

}
