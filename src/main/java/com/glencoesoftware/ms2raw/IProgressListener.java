/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.util.EventListener;

public interface IProgressListener extends EventListener {

  /**
   * Indicates the total number of chunks in this conversion operation.
   * Includes every requested layout.
   *
   * @param runCount total number of layouts to convert
   * @param chunkCount total number of chunks
   */
  void notifyStart(int runCount, long chunkCount);

  /**
   * Indicates the beginning of converting one layout.
   *
   * @param layout the layout being read
   * @param passCount number of passes over the source
   * @param chunkCount total number of chunks written by this run
   */
  void notifyRunStart(Layout layout, int passCount, int chunkCount);

  /**
   * Indicates the end of converting one layout.
   *
   * @param layout the layout being read
   */
  void notifyRunEnd(Layout layout);

  /**
   * Indicates that the given chunk has been written.
   *
   * @param layout the layout being read
   * @param chunk position of the chunk in the grid
   */
  void notifyChunkEnd(Layout layout, ChunkCoordinate chunk);

}
