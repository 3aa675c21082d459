/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Reads the spectrum-major copy: one tile per pixel, holding the pixel's
 * full spectrum.  Tiles come layer by layer, then by X, then by Y.
 */
public class SpectrumMajorReader extends AbstractSourceLayoutReader {

  private final IonSource source;
  private final int[] recordShape;

  /**
   * @param source opened export
   * @param region pixels to read
   */
  public SpectrumMajorReader(IonSource source, SpatialRegion region) {
    super(source.getExtents(), region, (long) source.getExtents().getLayers()
      * region.getWidth() * region.getHeight());
    this.source = source;
    this.recordShape = new int[] {1, extents.getBins()};
  }

  @Override
  public Layout getLayout() {
    return Layout.spectrum;
  }

  @Override
  protected SourceTile readTile(long index)
    throws SourceFormatException, SourceReadException
  {
    long pixelsPerLayer = (long) region.getWidth() * region.getHeight();
    int layer = (int) (index / pixelsPerLayer);
    int pixel = (int) (index % pixelsPerLayer);
    int x = region.getX() + pixel / region.getHeight();
    int y = region.getY() + pixel % region.getHeight();

    int[] data = source.readRecord(source.getPaths().spectrum(layer, x, y),
      recordShape, new int[] {0, 0}, recordShape);
    return new SourceTile(new int[] {layer, x, y, 0},
      new int[] {1, 1, 1, extents.getBins()}, data);
  }

}
