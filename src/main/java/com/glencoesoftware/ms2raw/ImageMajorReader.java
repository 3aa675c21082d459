/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Reads the image-major copy: one tile per (layer, bin), holding the part
 * of the bin's image inside the region.  Tiles come layer by layer, then
 * by bin.
 */
public class ImageMajorReader extends AbstractSourceLayoutReader {

  private final IonSource source;
  private final int[] recordShape;

  /**
   * @param source opened export
   * @param region part of each image to read
   */
  public ImageMajorReader(IonSource source, SpatialRegion region) {
    super(source.getExtents(), region,
      (long) source.getExtents().getLayers() * source.getExtents().getBins());
    this.source = source;
    this.recordShape = new int[] {extents.getWidth(), extents.getHeight()};
  }

  @Override
  public Layout getLayout() {
    return Layout.image;
  }

  @Override
  protected SourceTile readTile(long index)
    throws SourceFormatException, SourceReadException
  {
    int layer = (int) (index / extents.getBins());
    int bin = (int) (index % extents.getBins());

    int[] offset = new int[] {region.getX(), region.getY()};
    int[] shape = new int[] {region.getWidth(), region.getHeight()};
    int[] data = source.readRecord(
      source.getPaths().image(layer, bin), recordShape, offset, shape);
    return new SourceTile(
      new int[] {layer, region.getX(), region.getY(), bin},
      new int[] {1, region.getWidth(), region.getHeight(), 1}, data);
  }

}
