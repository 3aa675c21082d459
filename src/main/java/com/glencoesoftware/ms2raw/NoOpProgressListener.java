/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

public class NoOpProgressListener implements IProgressListener {

  @Override
  public void notifyStart(int runCount, long chunkCount) {
  }

  @Override
  public void notifyRunStart(Layout layout, int passCount, int chunkCount) {
  }

  @Override
  public void notifyRunEnd(Layout layout) {
  }

  @Override
  public void notifyChunkEnd(Layout layout, ChunkCoordinate chunk) {
  }

}
