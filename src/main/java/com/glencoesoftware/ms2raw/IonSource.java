/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.DataType;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrConstants;
import com.bc.zarr.ZarrGroup;

import ucar.ma2.InvalidRangeException;

/**
 * An ION export stored as a Zarr hierarchy, holding the same 4D dataset
 * twice: once spectrum-major under {@value IonPaths#SPECTRA} and once
 * image-major under {@value IonPaths#IMAGES}.
 */
public class IonSource implements ConversionSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(IonSource.class);

  private final Path root;
  private final ExperimentDetails details;
  private final IonPaths paths;

  private IonSource(Path root, ExperimentDetails details) {
    this.root = root;
    this.details = details;
    this.paths = new IonPaths(details.getExtents());
  }

  /**
   * Open an export and check that both stored copies match the extents
   * declared in its ExperimentDetails.
   *
   * @param root path to the export
   * @return the opened export
   * @throws SourceFormatException if the export is malformed or the two
   *         copies disagree with the declared extents
   * @throws SourceReadException if the export cannot be read
   */
  public static IonSource open(Path root)
    throws SourceFormatException, SourceReadException
  {
    if (!isGroup(root.resolve(IonPaths.DETAILS))) {
      throw new SourceFormatException(
        "No " + IonPaths.DETAILS + " group found in " + root);
    }
    ExperimentDetails details;
    try {
      ZarrGroup group = ZarrGroup.open(root.resolve(IonPaths.DETAILS));
      details = ExperimentDetails.fromAttributes(group.getAttributes());
    }
    catch (IOException e) {
      throw new SourceReadException(
        "Could not read " + IonPaths.DETAILS + " from " + root, e);
    }
    IonSource source = new IonSource(root, details);
    LOGGER.info("Opened {} with extents {}", root, details.getExtents());
    source.checkSpectra();
    source.checkImages();
    return source;
  }

  @Override
  public Extents getExtents() {
    return details.getExtents();
  }

  /**
   * @return metadata of the export
   */
  public ExperimentDetails getDetails() {
    return details;
  }

  /**
   * @return path to the export
   */
  public Path getRoot() {
    return root;
  }

  /**
   * @return record naming for this export
   */
  public IonPaths getPaths() {
    return paths;
  }

  @Override
  public SourceLayoutReader openReader(Layout layout, SpatialRegion region) {
    switch (layout) {
      case spectrum:
        return new SpectrumMajorReader(this, region);
      case image:
        return new ImageMajorReader(this, region);
      default:
        throw new IllegalArgumentException("Unsupported layout: " + layout);
    }
  }

  /**
   * Read the mass value of every bin.
   *
   * @return one value per bin
   * @throws SourceFormatException if the mass array is missing or malformed
   * @throws SourceReadException if the read fails
   */
  public int[] readMassArray()
    throws SourceFormatException, SourceReadException
  {
    int bins = getExtents().getBins();
    int[] shape = new int[] {1, bins};
    return readRecord(IonPaths.MASS_ARRAY, shape, new int[] {0, 0}, shape);
  }

  /**
   * Read part of one record.
   *
   * @param path record path relative to the export root
   * @param expectedShape shape the record must have
   * @param offset offset of the part to read
   * @param shape shape of the part to read
   * @return the samples, row-major
   * @throws SourceFormatException if the record is missing, has the wrong
   *         shape or an unsupported data type
   * @throws SourceReadException if the read fails
   */
  int[] readRecord(String path, int[] expectedShape, int[] offset, int[] shape)
    throws SourceFormatException, SourceReadException
  {
    ZarrArray record = openRecord(path, expectedShape);
    int size = 1;
    for (int s : shape) {
      size *= s;
    }
    int[] data = new int[size];
    try {
      record.read(data, shape, offset);
    }
    catch (InvalidRangeException e) {
      throw new SourceFormatException("Invalid read range for " + path, e);
    }
    catch (IOException e) {
      throw new SourceReadException("Could not read " + path, e);
    }
    return data;
  }

  private ZarrArray openRecord(String path, int[] expectedShape)
    throws SourceFormatException, SourceReadException
  {
    Path recordPath = root.resolve(path);
    if (!Files.exists(recordPath.resolve(ZarrConstants.FILENAME_DOT_ZARRAY))) {
      throw new SourceFormatException("Missing record " + path);
    }
    ZarrArray record;
    try {
      record = ZarrArray.open(recordPath);
    }
    catch (IOException e) {
      throw new SourceReadException("Could not open " + path, e);
    }
    if (!Arrays.equals(expectedShape, record.getShape())) {
      throw new SourceFormatException(String.format(
        "Record %s has shape %s, expected %s", path,
        Arrays.toString(record.getShape()), Arrays.toString(expectedShape)));
    }
    if (record.getDataType() != DataType.i4) {
      throw new SourceFormatException(
        "Record " + path + " has unsupported type " + record.getDataType());
    }
    return record;
  }

  private void checkSpectra() throws SourceFormatException, SourceReadException
  {
    Extents extents = getExtents();
    int last = extents.getLayers() - 1;
    checkLayerCount(IonPaths.SPECTRA, paths.spectraLayer(last),
      paths.spectraLayer(last + 1));

    int[] shape = new int[] {1, extents.getBins()};
    int lastX = extents.getWidth() - 1;
    int lastY = extents.getHeight() - 1;
    for (int layer : new int[] {0, last}) {
      openRecord(paths.spectrum(layer, 0, 0), shape);
      openRecord(paths.spectrum(layer, lastX, lastY), shape);
    }
    if (isArray(paths.spectrum(0, lastX + 1, 0)) ||
      isArray(paths.spectrum(0, 0, lastY + 1)))
    {
      throw new SourceFormatException(IonPaths.SPECTRA +
        " holds more pixels than the declared " + extents.getWidth() +
        " x " + extents.getHeight());
    }
  }

  private void checkImages() throws SourceFormatException, SourceReadException
  {
    Extents extents = getExtents();
    int last = extents.getLayers() - 1;
    checkLayerCount(IonPaths.IMAGES, paths.imagesLayer(last),
      paths.imagesLayer(last + 1));

    int[] shape = new int[] {extents.getWidth(), extents.getHeight()};
    int lastBin = extents.getBins() - 1;
    for (int layer : new int[] {0, last}) {
      openRecord(paths.image(layer, 0), shape);
      openRecord(paths.image(layer, lastBin), shape);
    }
    if (isArray(paths.image(0, lastBin + 1))) {
      throw new SourceFormatException(IonPaths.IMAGES +
        " holds more bins than the declared " + extents.getBins());
    }
  }

  private void checkLayerCount(String copy, String lastLayer, String extra)
    throws SourceFormatException
  {
    int layers = getExtents().getLayers();
    if (!isGroup(root.resolve(lastLayer))) {
      throw new SourceFormatException(
        copy + " holds fewer layers than the declared " + layers);
    }
    if (isGroup(root.resolve(extra))) {
      throw new SourceFormatException(
        copy + " holds more layers than the declared " + layers);
    }
  }

  private boolean isArray(String path) {
    return Files.exists(
      root.resolve(path).resolve(ZarrConstants.FILENAME_DOT_ZARRAY));
  }

  private static boolean isGroup(Path path) {
    return Files.exists(path.resolve(ZarrConstants.FILENAME_DOT_ZGROUP));
  }

}
