/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Lazy, finite, forward-only sequence of {@link SourceTile}s read from one
 * stored copy of the dataset, in the order the copy is stored on disk.
 * A reader cannot be rewound; open a new one to scan again.
 */
public interface SourceLayoutReader extends AutoCloseable {

  /**
   * @return the stored copy being read
   */
  Layout getLayout();

  /**
   * @return the part of each image that is read
   */
  SpatialRegion getRegion();

  /**
   * @return total number of tiles this reader produces
   */
  long getTileCount();

  /**
   * @return number of tiles produced so far
   */
  long getPosition();

  /**
   * Read the next tile and advance the cursor.
   *
   * @return the next tile, or null once every tile has been read
   * @throws SourceFormatException if a record is missing or malformed
   * @throws SourceReadException if the underlying read fails
   */
  SourceTile readNext() throws SourceFormatException, SourceReadException;

  @Override
  void close();

}
