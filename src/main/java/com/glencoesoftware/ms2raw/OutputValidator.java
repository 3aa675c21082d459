/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.ZarrArray;

import ucar.ma2.InvalidRangeException;

/**
 * Compares two converted outputs cell by cell, one chunk of the first
 * output at a time.
 */
public class OutputValidator {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(OutputValidator.class);

  /**
   * @param first finalized output group
   * @param second finalized output group
   * @return number of cells compared
   * @throws OutputMismatchException if the outputs differ in shape or in
   *         any cell, or if either is not finalized
   * @throws SourceReadException if an output could not be read
   */
  public long validate(Path first, Path second)
    throws OutputMismatchException, SourceReadException
  {
    for (Path p : new Path[] {first, second}) {
      if (!ZarrTargetWriter.isFinalized(p)) {
        throw new OutputMismatchException(p + " is not a complete output");
      }
    }
    ZarrArray a = open(first);
    ZarrArray b = open(second);
    if (!Arrays.equals(a.getShape(), b.getShape())) {
      throw new OutputMismatchException(String.format(
        "%s has shape %s but %s has shape %s", first,
        Arrays.toString(a.getShape()), second,
        Arrays.toString(b.getShape())));
    }

    Extents extents = Extents.fromArray(a.getShape());
    ChunkGrid grid = new ChunkGrid(extents,
      new ChunkShape(a.getChunks()[0], a.getChunks()[1], a.getChunks()[2],
        a.getChunks()[3]));
    long cells = 0;
    for (int i=0; i<grid.getChunkCount(); i++) {
      ChunkCoordinate coordinate = grid.coordinate(i);
      int[] origin = grid.getOrigin(coordinate);
      int[] shape = grid.getShape(coordinate);
      int size = grid.getCellCount(coordinate);
      int[] left = read(a, first, origin, shape, size);
      int[] right = read(b, second, origin, shape, size);
      for (int cell=0; cell<size; cell++) {
        if (left[cell] != right[cell]) {
          TargetChunk position = new TargetChunk(grid, coordinate);
          throw new OutputMismatchException(String.format(
            "Cell %s differs: %d in %s, %d in %s",
            Arrays.toString(position.cellIndex(cell)), left[cell], first,
            right[cell], second));
        }
      }
      cells += size;
    }
    LOGGER.info("{} and {} hold identical data ({} cells)",
      first, second, cells);
    return cells;
  }

  private static ZarrArray open(Path output) throws SourceReadException {
    try {
      return ZarrArray.open(output.resolve(ZarrTargetWriter.ARRAY_NAME));
    }
    catch (IOException e) {
      throw new SourceReadException("Could not open " + output, e);
    }
  }

  private static int[] read(ZarrArray array, Path output, int[] origin,
    int[] shape, int size)
    throws SourceReadException
  {
    int[] data = new int[size];
    try {
      array.read(data, shape, origin);
    }
    catch (IOException | InvalidRangeException e) {
      throw new SourceReadException("Could not read " + output, e);
    }
    return data;
  }

}
