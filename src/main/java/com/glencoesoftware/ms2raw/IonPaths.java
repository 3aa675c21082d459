/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * Names of the groups and records inside an ION export.
 * Indexes are zero padded to the number of digits of the matching extent;
 * layers are numbered from 1.
 */
public class IonPaths {

  public static final String DETAILS = "ExperimentDetails";
  public static final String MASS_ARRAY = DETAILS + "/MassArray";
  public static final String SPECTRA = "Spectra";
  public static final String IMAGES = "MassImages";

  private final String layerFormat;
  private final String pixelFormat;
  private final String binFormat;

  /**
   * @param extents extents of the export
   */
  public IonPaths(Extents extents) {
    layerFormat = "Layer%0" + countDigits(extents.getLayers()) + "d";
    pixelFormat = "Pixel%0" + countDigits(extents.getWidth()) + "d,%0" +
      countDigits(extents.getHeight()) + "d";
    binFormat = "Bin%0" + countDigits(extents.getBins()) + "d";
  }

  /**
   * @param value a non-negative number
   * @return number of decimal digits in the value
   */
  public static int countDigits(int value) {
    int digits = 1;
    int remaining = Math.abs(value) / 10;
    while (remaining > 0) {
      digits++;
      remaining /= 10;
    }
    return digits;
  }

  /**
   * @param layer zero-based layer index
   * @return path of the spectra group for the layer
   */
  public String spectraLayer(int layer) {
    return SPECTRA + "/" + String.format(layerFormat, layer + 1);
  }

  /**
   * @param layer zero-based layer index
   * @return path of the image group for the layer
   */
  public String imagesLayer(int layer) {
    return IMAGES + "/" + String.format(layerFormat, layer + 1);
  }

  /**
   * @param layer zero-based layer index
   * @param x pixel column
   * @param y pixel row
   * @return path of the record holding the pixel's spectrum
   */
  public String spectrum(int layer, int x, int y) {
    return spectraLayer(layer) + "/" + String.format(pixelFormat, x, y);
  }

  /**
   * @param layer zero-based layer index
   * @param bin spectrum bin
   * @return path of the record holding the bin's image
   */
  public String image(int layer, int bin) {
    return imagesLayer(layer) + "/" + String.format(binFormat, bin);
  }

}
