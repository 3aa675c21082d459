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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.ArrayParams;
import com.bc.zarr.DataType;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;

import ucar.ma2.InvalidRangeException;

/**
 * Writes the fileset level metadata of a conversion: the layout version,
 * the instrument attributes copied from the export and the coordinate
 * arrays of each axis.
 */
public class OutputMetadata {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(OutputMetadata.class);

  /** Version of the output layout. */
  public static final int LAYOUT = 1;

  /** Root attribute holding {@link #LAYOUT}. */
  public static final String LAYOUT_KEY = "ms2raw.layout";

  /** Root attribute listing the converted layout groups. */
  public static final String GROUPS_KEY = "groups";

  /** Root attribute holding the ExperimentDetails attributes. */
  public static final String INSTRUMENT_KEY = "instrument";

  /** Root attribute describing the four axes. */
  public static final String AXES_KEY = "axes";

  private final Path root;

  /**
   * @param root output directory
   */
  public OutputMetadata(Path root) {
    this.root = root;
  }

  /**
   * Create the root group and record the layout version.
   *
   * @throws IOException if the group could not be written
   */
  public void createRoot() throws IOException {
    Map<String, Object> attributes = new HashMap<String, Object>();
    attributes.put(LAYOUT_KEY, LAYOUT);
    final ZarrGroup group = ZarrGroup.create(root);
    group.writeAttributes(attributes);
  }

  /**
   * Record the instrument metadata and axes once every layout has been
   * converted.
   *
   * @param source export the data was read from
   * @param layouts converted layouts
   * @throws IOException if the metadata could not be written
   * @throws ConversionException if the export metadata could not be read
   */
  public void write(IonSource source, List<Layout> layouts)
    throws IOException, ConversionException
  {
    ExperimentDetails details = source.getDetails();
    Extents extents = details.getExtents();

    ZarrGroup group = ZarrGroup.open(root);
    Map<String, Object> attributes = group.getAttributes();
    attributes.put(LAYOUT_KEY, LAYOUT);
    List<String> groups = new ArrayList<String>();
    for (Layout layout : layouts) {
      groups.add(layout.getOutputName());
    }
    attributes.put(GROUPS_KEY, groups);
    attributes.put(INSTRUMENT_KEY,
      new LinkedHashMap<String, Object>(details.getAttributes()));

    List<Map<String, Object>> axes = new ArrayList<Map<String, Object>>();
    axes.add(axis("layer", "index", null));
    axes.add(axis("x", "space", "micrometer"));
    axes.add(axis("y", "space", "micrometer"));
    axes.add(axis("mass", "mass", null));
    attributes.put(AXES_KEY, axes);
    group.writeAttributes(attributes);

    double[] layer = new double[extents.getLayers()];
    for (int i=0; i<layer.length; i++) {
      layer[i] = i + 1;
    }
    writeAxis("layer", layer);
    writeAxis("x", scaled(extents.getWidth(), details.getMicronsX()));
    writeAxis("y", scaled(extents.getHeight(), details.getMicronsY()));

    int[] mass = source.readMassArray();
    ZarrArray massArray = ZarrArray.create(root.resolve("mass"),
      new ArrayParams()
        .shape(mass.length)
        .chunks(mass.length)
        .dataType(DataType.i4));
    write(massArray, mass, mass.length);
    LOGGER.info("Wrote metadata for {} to {}", groups, root);
  }

  private static Map<String, Object> axis(String name, String type,
    String unit)
  {
    Map<String, Object> axis = new LinkedHashMap<String, Object>();
    axis.put("name", name);
    axis.put("type", type);
    if (unit != null) {
      axis.put("unit", unit);
    }
    return axis;
  }

  private static double[] scaled(int length, double step) {
    double[] values = new double[length];
    for (int i=0; i<length; i++) {
      values[i] = i * step;
    }
    return values;
  }

  private void writeAxis(String name, double[] values) throws IOException {
    ZarrArray array = ZarrArray.create(root.resolve(name),
      new ArrayParams()
        .shape(values.length)
        .chunks(values.length)
        .dataType(DataType.f8));
    write(array, values, values.length);
  }

  private static void write(ZarrArray array, Object data, int length)
    throws IOException
  {
    try {
      array.write(data, new int[] {length}, new int[] {0});
    }
    catch (InvalidRangeException e) {
      throw new IOException("Could not write " + length + " values", e);
    }
  }

}
