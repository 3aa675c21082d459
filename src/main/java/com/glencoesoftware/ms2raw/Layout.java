/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

/**
 * The two layouts in which the instrument export stores the same data.
 */
public enum Layout {
  /** One record per pixel, holding that pixel's spectrum. */
  spectrum("spectra", new int[] {0, 1, 2}),
  /** One record per (layer, bin), holding the whole image. */
  image("images", new int[] {0, 3});

  private final String outputName;
  private final int[] tileAxes;

  private Layout(String name, int[] axes) {
    outputName = name;
    tileAxes = axes;
  }

  /**
   * @return name of the output group written for this layout
   */
  public String getOutputName() {
    return outputName;
  }

  /**
   * Axes enumerated by the sequence of records, outermost first.
   * The other axes are covered completely by every record.
   *
   * @return axis indexes in (layer, x, y, bin) numbering
   */
  public int[] getTileAxes() {
    return tileAxes.clone();
  }
}
