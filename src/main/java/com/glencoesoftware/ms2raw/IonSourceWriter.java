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
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.ArrayParams;
import com.bc.zarr.DataType;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;

import ucar.ma2.InvalidRangeException;

/**
 * Writes ION exports in the layout read by {@link IonSource}.
 * Both copies are written from the same cell values.
 */
public class IonSourceWriter {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(IonSourceWriter.class);

  /**
   * Supplies the value of every cell of the dataset.
   */
  public interface CellValues {
    /**
     * @param layer layer index
     * @param x pixel column
     * @param y pixel row
     * @param bin spectrum bin
     * @return the sample at that cell
     */
    int valueAt(int layer, int x, int y, int bin);
  }

  private final Path root;
  private final Extents extents;
  private final IonPaths paths;
  private final ZarrCompression compression;

  /**
   * @param root path of the export to create
   * @param extents extents of the dataset
   * @param compression codec for every record
   */
  public IonSourceWriter(Path root, Extents extents,
    ZarrCompression compression)
  {
    this.root = root;
    this.extents = extents;
    this.paths = new IonPaths(extents);
    this.compression = compression;
  }

  /**
   * @return record naming used by this writer
   */
  public IonPaths getPaths() {
    return paths;
  }

  /**
   * Write the ExperimentDetails group and the mass array.
   *
   * @param micronsX physical pixel size along X
   * @param micronsY physical pixel size along Y
   * @param mass mass value of every bin
   * @param instrument additional attributes, may be empty
   * @throws IOException if writing fails
   */
  public void writeMetadata(double micronsX, double micronsY, int[] mass,
    Map<String, Object> instrument)
      throws IOException
  {
    if (mass.length != extents.getBins()) {
      throw new IllegalArgumentException("Expected " + extents.getBins() +
        " mass values, found " + mass.length);
    }
    ZarrGroup.create(root);
    Map<String, Object> attributes = new HashMap<String, Object>(instrument);
    attributes.put(ExperimentDetails.LAYERS,
      Arrays.asList(extents.getLayers()));
    attributes.put(ExperimentDetails.LAYER_DIMENSION_X,
      Arrays.asList(extents.getHeight()));
    attributes.put(ExperimentDetails.LAYER_DIMENSION_Y,
      Arrays.asList(extents.getWidth()));
    attributes.put(ExperimentDetails.SPECTRUM_LENGTH,
      Arrays.asList(extents.getBins()));
    attributes.put(ExperimentDetails.IMAGE_MICRONS_X, Arrays.asList(micronsX));
    attributes.put(ExperimentDetails.IMAGE_MICRONS_Y, Arrays.asList(micronsY));
    ZarrGroup details = ZarrGroup.create(root.resolve(IonPaths.DETAILS));
    details.writeAttributes(attributes);

    writeRecord(IonPaths.MASS_ARRAY, new int[] {1, mass.length}, mass);
  }

  /**
   * Write every record of the spectrum-major copy.
   *
   * @param values cell values
   * @throws IOException if writing fails
   */
  public void writeSpectra(CellValues values) throws IOException {
    ZarrGroup.create(root.resolve(IonPaths.SPECTRA));
    for (int layer=0; layer<extents.getLayers(); layer++) {
      ZarrGroup.create(root.resolve(paths.spectraLayer(layer)));
      for (int x=0; x<extents.getWidth(); x++) {
        for (int y=0; y<extents.getHeight(); y++) {
          int[] spectrum = new int[extents.getBins()];
          for (int bin=0; bin<spectrum.length; bin++) {
            spectrum[bin] = values.valueAt(layer, x, y, bin);
          }
          writeSpectrum(layer, x, y, spectrum);
        }
      }
    }
    LOGGER.debug("wrote {} spectra to {}",
      (long) extents.getLayers() * extents.getWidth() * extents.getHeight(),
      root);
  }

  /**
   * Write every record of the image-major copy.
   *
   * @param values cell values
   * @throws IOException if writing fails
   */
  public void writeImages(CellValues values) throws IOException {
    ZarrGroup.create(root.resolve(IonPaths.IMAGES));
    for (int layer=0; layer<extents.getLayers(); layer++) {
      ZarrGroup.create(root.resolve(paths.imagesLayer(layer)));
      for (int bin=0; bin<extents.getBins(); bin++) {
        int[] image = new int[extents.getWidth() * extents.getHeight()];
        for (int x=0; x<extents.getWidth(); x++) {
          for (int y=0; y<extents.getHeight(); y++) {
            image[x * extents.getHeight() + y] =
              values.valueAt(layer, x, y, bin);
          }
        }
        writeImage(layer, bin, image);
      }
    }
    LOGGER.debug("wrote {} images to {}",
      (long) extents.getLayers() * extents.getBins(), root);
  }

  /**
   * Write or replace a single spectrum record.
   * The layer group must already exist.
   *
   * @param layer layer index
   * @param x pixel column
   * @param y pixel row
   * @param spectrum one value per bin
   * @throws IOException if writing fails
   */
  public void writeSpectrum(int layer, int x, int y, int[] spectrum)
    throws IOException
  {
    writeRecord(paths.spectrum(layer, x, y),
      new int[] {1, spectrum.length}, spectrum);
  }

  /**
   * Write or replace a single image record.
   * The layer group must already exist.
   *
   * @param layer layer index
   * @param bin spectrum bin
   * @param image samples in row-major (x, y) order
   * @throws IOException if writing fails
   */
  public void writeImage(int layer, int bin, int[] image) throws IOException {
    writeRecord(paths.image(layer, bin),
      new int[] {extents.getWidth(), extents.getHeight()}, image);
  }

  private void writeRecord(String path, int[] shape, int[] data)
    throws IOException
  {
    ArrayParams params = new ArrayParams()
      .shape(shape)
      .chunks(shape)
      .dataType(DataType.i4)
      .compressor(compression.createCompressor(null));
    ZarrArray record = ZarrArray.create(root.resolve(path), params);
    try {
      record.write(data, shape, new int[shape.length]);
    }
    catch (InvalidRangeException e) {
      throw new IOException("Could not write " + path, e);
    }
  }

}
