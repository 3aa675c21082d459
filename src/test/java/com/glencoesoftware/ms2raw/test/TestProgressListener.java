/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw.test;

import com.glencoesoftware.ms2raw.ChunkCoordinate;
import com.glencoesoftware.ms2raw.IProgressListener;
import com.glencoesoftware.ms2raw.Layout;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TestProgressListener implements IProgressListener {

  private Map<Layout, List<ChunkCoordinate>> chunks =
    new HashMap<Layout, List<ChunkCoordinate>>();
  private Map<Layout, Integer> expectedChunks = new HashMap<Layout, Integer>();
  private List<Layout> finishedRuns = new ArrayList<Layout>();
  private long totalChunks = 0;
  private int runs = 0;

  @Override
  public void notifyStart(int runCount, long chunkCount) {
    runs = runCount;
    totalChunks = chunkCount;
  }

  @Override
  public synchronized void notifyRunStart(Layout layout, int passCount,
    int chunkCount)
  {
    expectedChunks.put(layout, chunkCount);
    chunks.put(layout, new ArrayList<ChunkCoordinate>());
  }

  @Override
  public synchronized void notifyChunkEnd(Layout layout,
    ChunkCoordinate chunk)
  {
    chunks.get(layout).add(chunk);
  }

  @Override
  public synchronized void notifyRunEnd(Layout layout) {
    finishedRuns.add(layout);
  }

  /**
   * @param layout a converted layout
   * @return chunks written for the layout, in write order
   */
  public synchronized List<ChunkCoordinate> getChunks(Layout layout) {
    return chunks.get(layout);
  }

  /**
   * @param layout a converted layout
   * @return chunk count announced when the layout's run started
   */
  public synchronized int getExpectedChunkCount(Layout layout) {
    return expectedChunks.get(layout);
  }

  /**
   * @return layouts whose run ended, successfully or not
   */
  public synchronized List<Layout> getFinishedRuns() {
    return finishedRuns;
  }

  /**
   * @return the total number of chunks announced before any run started
   */
  public long getTotalChunkCount() {
    return totalChunks;
  }

  public int getRunCount() {
    return runs;
  }
}
