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
 * One scan of the source, restricted to a spatial region, together with
 * the chunks it completes in the order they are expected to complete.
 */
public class ConversionPass {

  private final SpatialRegion region;
  private final List<ChunkCoordinate> flushOrder;
  private final int peakOpenChunks;
  private final long peakBytes;

  /**
   * @param region part of each image read by this pass
   * @param order chunks in predicted flush order
   * @param openChunks worst-case number of concurrently open chunks
   * @param bytes worst-case buffered bytes
   */
  public ConversionPass(SpatialRegion region, List<ChunkCoordinate> order,
    int openChunks, long bytes)
  {
    this.region = region;
    this.flushOrder = Collections.unmodifiableList(
      new ArrayList<ChunkCoordinate>(order));
    this.peakOpenChunks = openChunks;
    this.peakBytes = bytes;
  }

  public SpatialRegion getRegion() {
    return region;
  }

  public List<ChunkCoordinate> getFlushOrder() {
    return flushOrder;
  }

  public int getPeakOpenChunks() {
    return peakOpenChunks;
  }

  public long getPeakBytes() {
    return peakBytes;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ConversionPass)) {
      return false;
    }
    ConversionPass p = (ConversionPass) o;
    return region.equals(p.region) && flushOrder.equals(p.flushOrder) &&
      peakOpenChunks == p.peakOpenChunks && peakBytes == p.peakBytes;
  }

  @Override
  public int hashCode() {
    return region.hashCode() * 31 + flushOrder.hashCode();
  }

  @Override
  public String toString() {
    return String.format(
      "region [%s], %d chunks, peak %d open chunks (%d bytes)",
      region, flushOrder.size(), peakOpenChunks, peakBytes);
  }

}
