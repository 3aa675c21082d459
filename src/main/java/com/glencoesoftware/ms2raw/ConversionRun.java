/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts one stored layout of a source into a consolidated chunked array.
 * <p>
 * The calling thread plans the conversion, reads tiles and assembles
 * chunks; completed chunks are written by a single worker thread fed
 * through a bounded queue.  Any error or cancellation removes the output.
 * </p>
 * A run can only be executed once.
 */
public class ConversionRun implements Callable<ConversionReport> {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ConversionRun.class);

  /** Default number of completed chunks waiting to be written. */
  public static final int DEFAULT_WRITE_QUEUE_SIZE = 4;

  private final ConversionSource source;
  private final Layout layout;
  private final ChunkShape chunkShape;
  private final long memoryBudget;
  private final Path destination;

  private ZarrCompression compression = ZarrCompression.zlib;
  private Map<String, Object> compressionProperties =
    new HashMap<String, Object>();
  private boolean nested = true;
  private int writeQueueSize = DEFAULT_WRITE_QUEUE_SIZE;
  private boolean allowMultiPass = false;
  private IProgressListener progressListener = new NoOpProgressListener();
  private ChunkPlanner planner = new ChunkPlanner();

  private volatile RunState state = RunState.CREATED;
  private volatile boolean cancelled = false;

  private ConversionPlan plan;
  private AssemblyBuffer buffer;
  private TargetWriter writer;
  private ThreadPoolExecutor executor;
  private final AtomicReference<Throwable> writeFailure =
    new AtomicReference<Throwable>();
  private final AtomicInteger chunksFlushed = new AtomicInteger();
  private final AtomicLong cellsWritten = new AtomicLong();
  private long tilesRead = 0;

  /**
   * @param source input data
   * @param layout stored layout to read
   * @param chunkShape target chunk shape
   * @param memoryBudget maximum number of bytes of buffered chunks
   * @param destination output group; must not exist
   */
  public ConversionRun(ConversionSource source, Layout layout,
    ChunkShape chunkShape, long memoryBudget, Path destination)
  {
    this.source = source;
    this.layout = layout;
    this.chunkShape = chunkShape;
    this.memoryBudget = memoryBudget;
    this.destination = destination;
  }

  /**
   * Convert one layout with default options.
   *
   * @param source input data
   * @param layout stored layout to read
   * @param chunkShape target chunk shape
   * @param memoryBudget maximum number of bytes of buffered chunks
   * @param destination output group; must not exist
   * @return summary of the conversion
   * @throws ConversionException if the conversion failed; the output
   *         has then been removed
   */
  public static ConversionReport convert(ConversionSource source,
    Layout layout, ChunkShape chunkShape, long memoryBudget,
    Path destination)
    throws ConversionException
  {
    return new ConversionRun(
      source, layout, chunkShape, memoryBudget, destination).call();
  }

  /**
   * @param compressionType codec used for the output chunks
   */
  public void setCompression(ZarrCompression compressionType) {
    compression = compressionType;
  }

  /**
   * @param properties codec options, e.g. "clevel" for blosc
   */
  public void setCompressionProperties(Map<String, Object> properties) {
    compressionProperties = properties == null ?
      new HashMap<String, Object>() :
      new HashMap<String, Object>(properties);
  }

  /**
   * @param nestedStorage true to store chunks in nested directories
   */
  public void setNested(boolean nestedStorage) {
    nested = nestedStorage;
  }

  /**
   * @param size maximum number of completed chunks waiting to be written
   */
  public void setWriteQueueSize(int size) {
    if (size < 1) {
      throw new IllegalArgumentException(
        "Write queue size must be positive: " + size);
    }
    writeQueueSize = size;
  }

  /**
   * @param allow true if the source may be read more than once when a
   *              single pass does not fit in the memory budget
   */
  public void setAllowMultiPass(boolean allow) {
    allowMultiPass = allow;
  }

  /**
   * @param listener receives chunk notifications; null for none
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener =
      listener == null ? new NoOpProgressListener() : listener;
  }

  /**
   * @param chunkPlanner planner used to order the conversion
   */
  public void setPlanner(ChunkPlanner chunkPlanner) {
    planner = chunkPlanner;
  }

  public Layout getLayout() {
    return layout;
  }

  public Path getDestination() {
    return destination;
  }

  public RunState getState() {
    return state;
  }

  /**
   * @return the plan, or null before planning completed
   */
  public ConversionPlan getPlan() {
    return plan;
  }

  /**
   * Request cancellation.  Honored before the next tile is assembled.
   */
  public void cancel() {
    LOGGER.info("Cancelling {} conversion", layout);
    cancelled = true;
  }

  /**
   * @return true if {@link #cancel()} was called
   */
  public boolean isCancelled() {
    return cancelled;
  }

  @Override
  public ConversionReport call() throws ConversionException {
    synchronized (this) {
      if (state != RunState.CREATED) {
        throw new IllegalStateException(
          "Conversion already started, state is " + state);
      }
      setState(RunState.PLANNING);
    }
    long start = System.currentTimeMillis();
    boolean success = false;
    try {
      plan = planner.plan(layout, source.getExtents(), chunkShape,
        memoryBudget, allowMultiPass);
      checkCancelled();
      writer = createWriter(plan.getGrid());
      buffer = new AssemblyBuffer(plan.getGrid(), memoryBudget);
      executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new LimitedQueue<Runnable>(writeQueueSize));
      progressListener.notifyRunStart(layout, plan.getPasses().size(),
        plan.getGrid().getChunkCount());

      setState(RunState.STREAMING);
      for (int p=0; p<plan.getPasses().size(); p++) {
        ConversionPass pass = plan.getPasses().get(p);
        LOGGER.info("{} pass {}/{}: {}", layout, p + 1,
          plan.getPasses().size(), pass);
        stream(pass);
      }

      setState(RunState.DRAINING);
      drain();
      if (buffer.getOpenChunkCount() > 0) {
        throw new IncompleteOutputException(String.format(
          "Source exhausted with %d chunks still incomplete, first %s",
          buffer.getOpenChunkCount(), buffer.getOpenChunks().get(0)));
      }
      writer.finish();
      setState(RunState.FINALIZED);
      progressListener.notifyRunEnd(layout);
      success = true;

      ConversionReport report = new ConversionReport(layout,
        cellsWritten.get(), chunksFlushed.get(), tilesRead,
        plan.getPasses().size(), buffer.getPeakBytes(),
        System.currentTimeMillis() - start);
      LOGGER.info("Converted {}", report);
      return report;
    }
    catch (ConversionException e) {
      fail(e);
      throw e;
    }
    catch (RuntimeException e) {
      fail(e);
      throw e;
    }
    finally {
      if (!success && executor != null) {
        executor.shutdownNow();
      }
      if (writer != null) {
        writer.close();
      }
    }
  }

  /**
   * Create the writer for the output.
   *
   * @param grid target chunk grid
   * @return writer positioned on an empty output
   * @throws TargetWriteException if the output could not be created
   */
  protected TargetWriter createWriter(ChunkGrid grid)
    throws TargetWriteException
  {
    return ZarrTargetWriter.create(destination, layout, grid, compression,
      compressionProperties, nested);
  }

  private void stream(ConversionPass pass) throws ConversionException
  {
    Slf4JStopWatch t0 = stopWatch();
    try (SourceLayoutReader reader =
      source.openReader(layout, pass.getRegion()))
    {
      SourceTile tile = null;
      while ((tile = reader.readNext()) != null) {
        checkCancelled();
        checkWriteFailure();
        tilesRead++;
        for (TargetChunk chunk : buffer.scatter(tile)) {
          submit(chunk);
        }
      }
    }
    finally {
      t0.stop("pass");
    }
  }

  /**
   * Queue a completed chunk for writing.  The first write failure is kept
   * in {@link #writeFailure}; later chunks are then only released.
   */
  private void submit(final TargetChunk chunk)
    throws ConversionCancelledException
  {
    try {
      executor.execute(() -> {
        try {
          if (writeFailure.get() == null && !cancelled) {
            writer.write(chunk);
            chunksFlushed.incrementAndGet();
            cellsWritten.addAndGet(chunk.getCellCount());
            progressListener.notifyChunkEnd(layout, chunk.getCoordinate());
          }
        }
        catch (Throwable t) {
          writeFailure.compareAndSet(null, t);
          LOGGER.error("Failure writing {}", chunk, t);
        }
        finally {
          buffer.release(chunk);
        }
      });
    }
    catch (RejectedExecutionException e) {
      buffer.release(chunk);
      throw new ConversionCancelledException(
        "Interrupted while queueing " + chunk);
    }
  }

  private void drain() throws ConversionException {
    executor.shutdown();
    try {
      executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
    }
    catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConversionCancelledException(
        "Interrupted while waiting for chunk writes");
    }
    checkWriteFailure();
    checkCancelled();
  }

  private void checkCancelled() throws ConversionCancelledException {
    if (cancelled) {
      throw new ConversionCancelledException(
        "Conversion of the " + layout + " layout was cancelled");
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new ConversionCancelledException(
        "Conversion of the " + layout + " layout was interrupted");
    }
  }

  private void checkWriteFailure() throws ConversionException {
    Throwable t = writeFailure.get();
    if (t != null) {
      unwrapException(t);
    }
  }

  private void unwrapException(Throwable t) throws ConversionException {
    if (t instanceof ConversionException) {
      throw (ConversionException) t;
    }
    else if (t instanceof RuntimeException) {
      throw (RuntimeException) t;
    }
    else {
      throw new TargetWriteException(
        "Unexpected failure writing " + destination, t);
    }
  }

  private void fail(Exception e) {
    setState(RunState.FAILED);
    LOGGER.error("Conversion of the {} layout to {} failed",
      layout, destination, e);
    if (executor != null) {
      executor.shutdownNow();
      try {
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
          LOGGER.warn("Chunk writer did not stop");
        }
      }
      catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        e.addSuppressed(ie);
      }
    }
    if (buffer != null) {
      buffer.clear();
    }
    if (writer != null) {
      try {
        writer.abort();
      }
      catch (TargetWriteException abortFailure) {
        e.addSuppressed(abortFailure);
      }
    }
    progressListener.notifyRunEnd(layout);
  }

  private void setState(RunState newState) {
    LOGGER.info("{} conversion: {} -> {}", layout, state, newState);
    state = newState;
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
