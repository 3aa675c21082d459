/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.ArrayParams;
import com.bc.zarr.DataType;
import com.bc.zarr.DimensionSeparator;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrConstants;
import com.bc.zarr.ZarrGroup;

import ucar.ma2.InvalidRangeException;

/**
 * Writes the consolidated (layer, x, y, bin) array as a Zarr v2 group
 * holding a single 32-bit integer array.
 */
public class ZarrTargetWriter implements TargetWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(ZarrTargetWriter.class);

  /** Name of the array inside the output group. */
  public static final String ARRAY_NAME = "signal";

  /** Group attribute holding the array extents, written last. */
  public static final String EXTENTS_KEY = "ms2raw.extents";

  /** Group attribute holding the chunk shape. */
  public static final String CHUNKS_KEY = "ms2raw.chunks";

  /** Group attribute naming the layout the array was read from. */
  public static final String SOURCE_LAYOUT_KEY = "ms2raw.sourceLayout";

  /** Group attribute holding the axis names. */
  public static final String AXES_KEY = "axes";

  private final Path destination;
  private final Layout layout;
  private final ChunkGrid grid;
  private final ZarrArray array;
  private final BitSet manifest;
  private boolean finished = false;

  private ZarrTargetWriter(Path destination, Layout layout, ChunkGrid grid,
    ZarrArray array)
  {
    this.destination = destination;
    this.layout = layout;
    this.grid = grid;
    this.array = array;
    this.manifest = new BitSet(grid.getChunkCount());
  }

  /**
   * Create an empty output.
   *
   * @param destination output group; must not exist
   * @param layout layout the data is read from
   * @param grid target chunk grid
   * @param compression chunk codec
   * @param compressionProperties codec options, may be null
   * @param nested true to store chunks in nested directories
   * @return writer for the new output
   * @throws TargetWriteException if the output could not be created
   */
  public static ZarrTargetWriter create(Path destination, Layout layout,
    ChunkGrid grid, ZarrCompression compression,
    Map<String, Object> compressionProperties, boolean nested)
    throws TargetWriteException
  {
    if (Files.exists(destination)) {
      throw new TargetWriteException(destination + " already exists");
    }
    try {
      Files.createDirectories(destination);
      ZarrGroup.create(destination);
      ArrayParams arrayParams = new ArrayParams()
          .shape(grid.getExtents().toArray())
          .chunks(grid.getChunkShape().toArray())
          .dataType(DataType.i4)
          .dimensionSeparator(
            nested ? DimensionSeparator.SLASH : DimensionSeparator.DOT)
          .compressor(compression.createCompressor(compressionProperties));
      ZarrArray array =
        ZarrArray.create(destination.resolve(ARRAY_NAME), arrayParams);
      LOGGER.info("Created {} ({}, compression {})",
        destination, grid, compression);
      return new ZarrTargetWriter(destination, layout, grid, array);
    }
    catch (IOException | RuntimeException e) {
      TargetWriteException failure = new TargetWriteException(
        "Could not create output " + destination, e);
      if (Files.exists(destination)) {
        try {
          delete(destination);
        }
        catch (IOException deleteFailure) {
          failure.addSuppressed(deleteFailure);
        }
      }
      throw failure;
    }
  }

  /**
   * @param path output group
   * @return true if the path holds a complete output
   */
  public static boolean isFinalized(Path path) {
    if (!Files.exists(path.resolve(ZarrConstants.FILENAME_DOT_ZGROUP)) ||
      !Files.exists(path.resolve(ARRAY_NAME).resolve(
        ZarrConstants.FILENAME_DOT_ZARRAY)))
    {
      return false;
    }
    try {
      return ZarrGroup.open(path).getAttributes().containsKey(EXTENTS_KEY);
    }
    catch (IOException e) {
      LOGGER.debug("Could not read attributes of {}", path, e);
      return false;
    }
  }

  public Path getDestination() {
    return destination;
  }

  public ChunkGrid getGrid() {
    return grid;
  }

  @Override
  public void write(TargetChunk chunk)
    throws TargetWriteException, DuplicateCellException
  {
    int index = grid.linearIndex(chunk.getCoordinate());
    synchronized (manifest) {
      if (manifest.get(index)) {
        throw new DuplicateCellException(
          "Chunk " + chunk.getCoordinate() + " was already written");
      }
    }
    if (!chunk.isComplete() || chunk.getData() == null) {
      throw new IllegalArgumentException(chunk + " is not complete");
    }
    Slf4JStopWatch t0 = stopWatch();
    try {
      array.write(chunk.getData(), chunk.getShape(), chunk.getOrigin());
    }
    catch (IOException | InvalidRangeException e) {
      throw new TargetWriteException(
        "Could not write " + chunk + " to " + destination, e);
    }
    finally {
      t0.stop("writeChunk");
    }
    synchronized (manifest) {
      manifest.set(index);
    }
    LOGGER.trace("Wrote {}", chunk);
  }

  @Override
  public int getWrittenCount() {
    synchronized (manifest) {
      return manifest.cardinality();
    }
  }

  @Override
  public void finish() throws IncompleteOutputException, TargetWriteException
  {
    int missing;
    synchronized (manifest) {
      missing = manifest.nextClearBit(0);
    }
    if (missing < grid.getChunkCount()) {
      throw new IncompleteOutputException(String.format(
        "%d of %d chunks written to %s; chunk %s is missing",
        getWrittenCount(), grid.getChunkCount(), destination,
        grid.coordinate(missing)));
    }
    Map<String, Object> attributes = new HashMap<String, Object>();
    attributes.put(EXTENTS_KEY, toList(grid.getExtents().toArray()));
    attributes.put(CHUNKS_KEY, toList(grid.getChunkShape().toArray()));
    attributes.put(SOURCE_LAYOUT_KEY, layout.name());
    attributes.put(AXES_KEY, Arrays.asList(Extents.AXES));
    try {
      ZarrGroup.open(destination).writeAttributes(attributes);
    }
    catch (IOException e) {
      throw new TargetWriteException(
        "Could not finalize " + destination, e);
    }
    finished = true;
    LOGGER.info("Finalized {} with {} chunks", destination,
      grid.getChunkCount());
  }

  @Override
  public void abort() throws TargetWriteException {
    if (!Files.exists(destination)) {
      return;
    }
    LOGGER.warn("Removing incomplete output {}", destination);
    try {
      delete(destination);
    }
    catch (IOException e) {
      throw new TargetWriteException("Could not remove " + destination, e);
    }
  }

  @Override
  public void close() {
    if (!finished) {
      LOGGER.debug("Closing unfinished output {}", destination);
    }
  }

  /**
   * Recursively delete a directory tree.
   *
   * @param path root of the tree
   * @throws IOException if the tree could not be listed or removed
   */
  public static void delete(Path path) throws IOException {
    Files.walk(path)
      .sorted(Comparator.reverseOrder())
      .map(Path::toFile)
      .forEach(File::delete);
    if (Files.exists(path)) {
      throw new IOException("Could not delete " + path);
    }
  }

  private static List<Integer> toList(int[] values) {
    List<Integer> list = new ArrayList<Integer>();
    for (int v : values) {
      list.add(v);
    }
    return list;
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
