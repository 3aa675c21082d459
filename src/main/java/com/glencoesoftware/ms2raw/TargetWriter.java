/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Destination of completed target chunks.
 */
public interface TargetWriter extends AutoCloseable {

  /**
   * Write one complete chunk.  Each chunk of the grid is written once.
   *
   * @param chunk complete chunk
   * @throws TargetWriteException if the chunk could not be stored
   * @throws DuplicateCellException if the chunk was already written
   */
  void write(TargetChunk chunk)
    throws TargetWriteException, DuplicateCellException;

  /**
   * Check that every chunk was written and record the output's extents,
   * making the output valid.
   *
   * @throws IncompleteOutputException if a chunk is missing
   * @throws TargetWriteException if the metadata could not be stored
   */
  void finish() throws IncompleteOutputException, TargetWriteException;

  /**
   * Remove everything written so far.
   *
   * @throws TargetWriteException if the output could not be removed
   */
  void abort() throws TargetWriteException;

  /**
   * @return number of chunks written
   */
  int getWrittenCount();

  @Override
  void close();

}
