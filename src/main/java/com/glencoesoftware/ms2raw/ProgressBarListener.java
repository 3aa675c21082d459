/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import me.tongfei.progressbar.DelegatingProgressBarConsumer;
import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProgressBarListener implements IProgressListener {

  // not a typo - the progress bar consumes Converter's logging output
  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  private final String logLevel;
  private final Map<Layout, ProgressBar> bars =
    new ConcurrentHashMap<Layout, ProgressBar>();

  /**
   * Create a new progress listener that displays one progress bar
   * per converted layout.
   *
   * @param level logging level
   */
  public ProgressBarListener(String level) {
    logLevel = level;
  }

  @Override
  public void notifyStart(int runCount, long chunkCount) {
    LOGGER.debug("Writing {} chunks in {} run(s)", chunkCount, runCount);
  }

  @Override
  public void notifyRunStart(Layout layout, int passCount, int chunkCount) {
    ProgressBarBuilder builder = new ProgressBarBuilder()
      .setInitialMax(chunkCount)
      .setTaskName(String.format("[%s/%d]", layout, passCount));

    if (!(logLevel.equals("OFF") ||
      logLevel.equals("ERROR") ||
      logLevel.equals("WARN")))
    {
      builder.setConsumer(new DelegatingProgressBarConsumer(LOGGER::trace));
    }
    bars.put(layout, builder.build());
  }

  @Override
  public void notifyChunkEnd(Layout layout, ChunkCoordinate chunk) {
    ProgressBar pb = bars.get(layout);
    if (pb != null) {
      pb.step();
    }
  }

  @Override
  public void notifyRunEnd(Layout layout) {
    ProgressBar pb = bars.remove(layout);
    if (pb != null) {
      pb.close();
    }
  }

}
