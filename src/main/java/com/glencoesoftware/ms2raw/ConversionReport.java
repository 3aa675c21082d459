/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Summary of a successful conversion run.
 */
public class ConversionReport {

  private final Layout layout;
  private final long cellsWritten;
  private final int chunksFlushed;
  private final long tilesRead;
  private final int passCount;
  private final long peakBufferedBytes;
  private final long elapsedMillis;

  /**
   * @param layout layout that was read
   * @param cellsWritten number of target cells written
   * @param chunksFlushed number of chunks written
   * @param tilesRead number of source tiles consumed
   * @param passCount number of passes over the source
   * @param peakBufferedBytes highest number of bytes held in memory
   * @param elapsedMillis wall clock duration
   */
  public ConversionReport(Layout layout, long cellsWritten, int chunksFlushed,
    long tilesRead, int passCount, long peakBufferedBytes, long elapsedMillis)
  {
    this.layout = layout;
    this.cellsWritten = cellsWritten;
    this.chunksFlushed = chunksFlushed;
    this.tilesRead = tilesRead;
    this.passCount = passCount;
    this.peakBufferedBytes = peakBufferedBytes;
    this.elapsedMillis = elapsedMillis;
  }

  public Layout getLayout() {
    return layout;
  }

  public long getCellsWritten() {
    return cellsWritten;
  }

  public int getChunksFlushed() {
    return chunksFlushed;
  }

  public long getTilesRead() {
    return tilesRead;
  }

  public int getPassCount() {
    return passCount;
  }

  public long getPeakBufferedBytes() {
    return peakBufferedBytes;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override
  public String toString() {
    return String.format("%s: %d cells in %d chunks from %d tiles, " +
      "%d pass(es), peak %d bytes buffered, %d ms", layout, cellsWritten,
      chunksFlushed, tilesRead, passCount, peakBufferedBytes, elapsedMillis);
  }

}
