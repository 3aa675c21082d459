/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Rectangular window in the XY plane of every layer.
 */
public class SpatialRegion {

  private final int x;
  private final int y;
  private final int width;
  private final int height;

  /**
   * @param x first column
   * @param y first row
   * @param width number of columns
   * @param height number of rows
   */
  public SpatialRegion(int x, int y, int width, int height) {
    if (x < 0 || y < 0 || width <= 0 || height <= 0) {
      throw new IllegalArgumentException(String.format(
        "Invalid region: x=%d y=%d width=%d height=%d", x, y, width, height));
    }
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  /**
   * @param extents dataset extents
   * @return the region covering the whole image
   */
  public static SpatialRegion full(Extents extents) {
    return new SpatialRegion(0, 0, extents.getWidth(), extents.getHeight());
  }

  public int getX() {
    return x;
  }

  public int getY() {
    return y;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  /**
   * @param extents dataset extents
   * @return true if the region lies inside the image
   */
  public boolean fitsIn(Extents extents) {
    return x + width <= extents.getWidth() && y + height <= extents.getHeight();
  }

  /**
   * @param extents dataset extents
   * @return true if the region is the whole image
   */
  public boolean isFull(Extents extents) {
    return x == 0 && y == 0 && width == extents.getWidth() &&
      height == extents.getHeight();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SpatialRegion)) {
      return false;
    }
    SpatialRegion r = (SpatialRegion) o;
    return x == r.x && y == r.y && width == r.width && height == r.height;
  }

  @Override
  public int hashCode() {
    return ((x * 31 + y) * 31 + width) * 31 + height;
  }

  @Override
  public String toString() {
    return String.format("x=%d y=%d width=%d height=%d", x, y, width, height);
  }

}
