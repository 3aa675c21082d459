/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cursor handling shared by both layout readers.  Subclasses only map a
 * tile index to the record that holds it.
 */
public abstract class AbstractSourceLayoutReader implements SourceLayoutReader {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(AbstractSourceLayoutReader.class);

  protected final Extents extents;
  protected final SpatialRegion region;

  private final long tileCount;
  private long position = 0;
  private boolean closed = false;

  /**
   * @param extents dataset extents
   * @param region part of each image to read
   * @param tiles number of tiles in the sequence
   */
  protected AbstractSourceLayoutReader(
    Extents extents, SpatialRegion region, long tiles)
  {
    if (!region.fitsIn(extents)) {
      throw new IllegalArgumentException(
        "Region " + region + " is outside of " + extents);
    }
    this.extents = extents;
    this.region = region;
    this.tileCount = tiles;
  }

  @Override
  public SpatialRegion getRegion() {
    return region;
  }

  @Override
  public long getTileCount() {
    return tileCount;
  }

  @Override
  public long getPosition() {
    return position;
  }

  @Override
  public final SourceTile readNext()
    throws SourceFormatException, SourceReadException
  {
    if (closed) {
      throw new IllegalStateException("Reader is closed");
    }
    if (position >= tileCount) {
      return null;
    }
    Slf4JStopWatch t0 = stopWatch();
    try {
      SourceTile tile = readTile(position);
      LOGGER.trace("read {} tile {}/{}: {}",
        getLayout(), position + 1, tileCount, tile);
      position++;
      return tile;
    }
    finally {
      t0.stop("readTile");
    }
  }

  /**
   * Read the tile at the given position in the stored order.
   * Called exactly once per index, in increasing order.
   *
   * @param index tile index in [0, tile count)
   * @return the tile
   * @throws SourceFormatException if the record is missing or malformed
   * @throws SourceReadException if the read fails
   */
  protected abstract SourceTile readTile(long index)
    throws SourceFormatException, SourceReadException;

  @Override
  public void close() {
    closed = true;
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

}
