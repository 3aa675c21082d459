/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Source of tiles for a conversion run.  Implementations open one
 * reader per layout and region; readers are independent of each other.
 */
public interface ConversionSource {

  /**
   * @return extents declared by the source
   */
  Extents getExtents();

  /**
   * Open a new forward-only reader.
   *
   * @param layout stored copy to read
   * @param region part of each image to read
   * @return a reader positioned before the first tile
   * @throws SourceFormatException if the layout cannot be read as declared
   * @throws SourceReadException if the source cannot be accessed
   */
  SourceLayoutReader openReader(Layout layout, SpatialRegion region)
    throws SourceFormatException, SourceReadException;

}
