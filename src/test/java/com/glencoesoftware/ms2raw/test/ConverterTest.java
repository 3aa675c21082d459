/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw.test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.bc.zarr.DimensionSeparator;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrConstants;
import com.bc.zarr.ZarrGroup;
import com.glencoesoftware.ms2raw.ChunkShape;
import com.glencoesoftware.ms2raw.ConversionReport;
import com.glencoesoftware.ms2raw.Converter;
import com.glencoesoftware.ms2raw.Extents;
import com.glencoesoftware.ms2raw.Layout;
import com.glencoesoftware.ms2raw.OutputMetadata;
import com.glencoesoftware.ms2raw.ZarrCompression;
import com.glencoesoftware.ms2raw.ZarrTargetWriter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import picocli.CommandLine;
import picocli.CommandLine.ExecutionException;

public class ConverterTest extends AbstractConversionTest {

  private static final Extents EXTENTS = new Extents(2, 3, 3, 4);

  /**
   * Convert both layouts with default options apart from the codec.
   */
  @Test
  public void testDefaults() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "zlib");

    assertEquals(Arrays.asList(Layout.spectrum, Layout.image),
      converter.getLayouts());
    assertEquals(1024L * 1024 * 1024, converter.getMemoryBudget());
    assertNull(converter.getChunkShape());
    assertTrue(converter.getNested());
    assertEquals(ZarrCompression.zlib, converter.getCompression());

    for (Layout layout : Layout.values()) {
      Path group = output.resolve(layout.getOutputName());
      assertTrue(ZarrTargetWriter.isFinalized(group));
      assertSignal(group, EXTENTS);
      ZarrArray array =
        ZarrArray.open(group.resolve(ZarrTargetWriter.ARRAY_NAME));
      assertEquals(DimensionSeparator.SLASH, array.getDimensionSeparator());
    }
    List<ConversionReport> reports = converter.getReports();
    assertEquals(2, reports.size());
    for (ConversionReport report : reports) {
      assertEquals(EXTENTS.getCellCount(), report.getCellsWritten());
    }
  }

  /**
   * Check the root attributes and coordinate arrays.
   */
  @Test
  public void testMetadata() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw");

    ZarrGroup root = ZarrGroup.open(output);
    Map<String, Object> attributes = root.getAttributes();
    assertEquals(OutputMetadata.LAYOUT,
      attributes.get(OutputMetadata.LAYOUT_KEY));
    assertEquals(Arrays.asList("spectra", "images"),
      attributes.get(OutputMetadata.GROUPS_KEY));
    Map<String, Object> instrument =
      (Map<String, Object>) attributes.get(OutputMetadata.INSTRUMENT_KEY);
    assertEquals("test", instrument.get("Instrument"));
    List<Map<String, Object>> axes =
      (List<Map<String, Object>>) attributes.get(OutputMetadata.AXES_KEY);
    assertEquals(4, axes.size());
    assertEquals("x", axes.get(1).get("name"));
    assertEquals("micrometer", axes.get(1).get("unit"));
    assertEquals("mass", axes.get(3).get("name"));

    double[] x = new double[EXTENTS.getWidth()];
    ZarrArray.open(output.resolve("x")).read(
      x, new int[] {x.length}, new int[] {0});
    assertArrayEquals(new double[] {0, 0.5, 1.0}, x, 0.0);
    double[] layer = new double[EXTENTS.getLayers()];
    ZarrArray.open(output.resolve("layer")).read(
      layer, new int[] {layer.length}, new int[] {0});
    assertArrayEquals(new double[] {1, 2}, layer, 0.0);
    int[] mass = new int[EXTENTS.getBins()];
    ZarrArray.open(output.resolve("mass")).read(
      mass, new int[] {mass.length}, new int[] {0});
    assertArrayEquals(new int[] {100, 110, 120, 130}, mass);
  }

  @Test
  public void testNoMetadata() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "--no-metadata");
    assertFalse(
      Files.exists(output.resolve(ZarrConstants.FILENAME_DOT_ZGROUP)));
    assertFalse(Files.exists(output.resolve("mass")));
    assertTrue(ZarrTargetWriter.isFinalized(output.resolve("spectra")));
  }

  @ParameterizedTest
  @EnumSource(Layout.class)
  public void testSingleLayout(Layout layout) throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "-l", layout.name());
    assertEquals(Arrays.asList(layout), converter.getLayouts());
    Path group = output.resolve(layout.getOutputName());
    assertTrue(ZarrTargetWriter.isFinalized(group));
    assertSignal(group, EXTENTS);
    for (Layout other : Layout.values()) {
      if (other != layout) {
        assertFalse(Files.exists(output.resolve(other.getOutputName())));
      }
    }
    assertEquals(Arrays.asList(layout.getOutputName()), ZarrGroup.open(output)
      .getAttributes().get(OutputMetadata.GROUPS_KEY));
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  public void testNestedStorage(boolean nested) throws Exception {
    writeExport(input, EXTENTS);
    if (nested) {
      assertTool("-c", "raw", "--chunk-shape", "1,2,2,3");
    }
    else {
      assertTool("-c", "raw", "--chunk-shape", "1,2,2,3", "--no-nested");
    }
    assertEquals(nested, converter.getNested());
    assertEquals(new ChunkShape(1, 2, 2, 3), converter.getChunkShape());
    for (Layout layout : Layout.values()) {
      Path group = output.resolve(layout.getOutputName());
      ZarrArray array =
        ZarrArray.open(group.resolve(ZarrTargetWriter.ARRAY_NAME));
      assertArrayEquals(new int[] {1, 2, 2, 3}, array.getChunks());
      assertEquals(nested ? DimensionSeparator.SLASH : DimensionSeparator.DOT,
        array.getDimensionSeparator());
      assertSignal(group, EXTENTS);
    }
  }

  /**
   * A chunk shape without four values is a usage error; nothing runs.
   */
  @Test
  public void testInvalidChunkShape() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("--chunk-shape", "1,2,2");
    assertTrue(converter.getReports().isEmpty());
    assertFalse(Files.exists(output));
  }

  /**
   * A chunk count with no explicit shape splits the layers.
   */
  @Test
  public void testChunkCount() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "-k", "2");
    for (Layout layout : Layout.values()) {
      ZarrArray array = ZarrArray.open(output.resolve(
        layout.getOutputName()).resolve(ZarrTargetWriter.ARRAY_NAME));
      assertArrayEquals(new int[] {1, 3, 3, 4}, array.getChunks());
    }
  }

  @Test
  public void testValidate() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "--validate", "--chunk-shape", "2,2,1,3");
    assertTrue(converter.getValidate());
    assertTrue(ZarrTargetWriter.isFinalized(output.resolve("images")));
  }

  @Test
  public void testMemoryBudget() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "-m", "2k", "--chunk-shape", "1,3,3,4");
    assertEquals(2048, converter.getMemoryBudget());
    for (ConversionReport report : converter.getReports()) {
      assertTrue(report.getPeakBufferedBytes() <= 2048);
    }
  }

  /**
   * An image-major chunk needs 144 bytes; the run fails before reading and
   * the output directory is removed.
   */
  @Test
  public void testBudgetExceeded() throws Exception {
    writeExport(input, EXTENTS);
    assertThrows(ExecutionException.class, () -> {
      assertTool("-c", "raw", "-m", "100", "--chunk-shape", "1,3,3,4",
        "-l", "image");
    });
    assertFalse(Files.exists(output));
  }

  @Test
  public void testMultiPass() throws Exception {
    writeExport(input, EXTENTS);
    assertTool("-c", "raw", "-m", "100", "--chunk-shape", "1,1,3,4",
      "-l", "image", "--allow-multi-pass");
    assertEquals(1, converter.getReports().size());
    assertEquals(2, converter.getReports().get(0).getPassCount());
    assertSignal(output.resolve("images"), EXTENTS);
  }

  @Test
  public void testExistingOutput() throws Exception {
    writeExport(input, EXTENTS);
    Files.createDirectories(output);
    assertThrows(ExecutionException.class, () -> {
      assertTool("-c", "raw");
    });
    assertTrue(Files.exists(output));

    assertTool("-c", "raw", "--overwrite");
    assertTrue(ZarrTargetWriter.isFinalized(output.resolve("spectra")));
  }

  @Test
  public void testMissingInput() throws Exception {
    assertThrows(ExecutionException.class, () -> {
      assertTool("-c", "raw");
    });
    assertFalse(Files.exists(output));
  }

  @Test
  public void testProgressListener() throws Exception {
    writeExport(input, EXTENTS);
    Converter progressConverter = new Converter();
    TestProgressListener listener = new TestProgressListener();
    progressConverter.setProgressListener(listener);

    try {
      CommandLine.call(progressConverter, new String[] {"-c", "raw",
        "--chunk-shape", "1,3,3,2", input.toString(), output.toString()});
    }
    catch (RuntimeException rt) {
      throw rt;
    }
    catch (Throwable t) {
      throw new RuntimeException(t);
    }

    assertEquals(2, listener.getRunCount());
    assertEquals(8, listener.getTotalChunkCount());
    for (Layout layout : Layout.values()) {
      assertEquals(4, listener.getExpectedChunkCount(layout));
      assertEquals(4, listener.getChunks(layout).size());
    }
    assertTrue(listener.getFinishedRuns().containsAll(
      Arrays.asList(Layout.values())));
  }

  @Test
  public void testHelp() throws Exception {
    input = tmp.resolve("missing");
    assertTool("--help");
    assertFalse(Files.exists(output));
  }

}
