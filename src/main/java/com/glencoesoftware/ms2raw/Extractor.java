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
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.bc.zarr.ZarrArray;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ucar.ma2.InvalidRangeException;

/**
 * Command line tool that sums part of a converted array and writes the
 * result as CSV: either the total spectrum of a window of one layer, or
 * the image of one layer summed over a range of bins.
 */
public class Extractor implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);

  /** What to extract. */
  public enum Mode {
    /** Sum of the spectra inside a window; one row per bin. */
    spectrum,
    /** Per-pixel sum over a bin range; one row per X. */
    image
  }

  private volatile Path inputPath;
  private volatile Path outputPath;
  private volatile Mode mode;
  private volatile int layer;
  private volatile int xStart;
  private volatile int xEnd;
  private volatile int yStart;
  private volatile int yEnd;
  private volatile int binStart;
  private volatile int binEnd;
  private volatile String logLevel;

  /**
   * @param input converted output group, e.g. "out/spectra"
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "converted output group to read",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    inputPath = input == null ? null : Paths.get(input);
  }

  /**
   * @param output CSV file to write
   */
  @Parameters(
    index = "1",
    arity = "1",
    description = "CSV file to write",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputPath = output == null ? null : Paths.get(output);
  }

  /**
   * @param extractMode what to extract
   */
  @Option(
    names = "--mode",
    description = "What to extract (${COMPLETION-CANDIDATES}; " +
      "default: ${DEFAULT-VALUE})",
    defaultValue = "spectrum"
  )
  public void setMode(Mode extractMode) {
    mode = extractMode;
  }

  /**
   * @param index layer to read, starting from 0
   */
  @Option(
    names = {"-l", "--layer"},
    description = "Layer to read, starting from 0 (default: ${DEFAULT-VALUE})",
    defaultValue = "0"
  )
  public void setLayer(int index) {
    layer = index;
  }

  /**
   * @param start first column of the window
   */
  @Option(
    names = "--x-start",
    description = "First column of the spectrum window " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "0"
  )
  public void setXStart(int start) {
    xStart = start;
  }

  /**
   * @param end column after the window, or -1 for the image width
   */
  @Option(
    names = "--x-end",
    description = "Column after the spectrum window; -1 for the image " +
      "width (default: ${DEFAULT-VALUE})",
    defaultValue = "-1"
  )
  public void setXEnd(int end) {
    xEnd = end;
  }

  /**
   * @param start first row of the window
   */
  @Option(
    names = "--y-start",
    description = "First row of the spectrum window " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "0"
  )
  public void setYStart(int start) {
    yStart = start;
  }

  /**
   * @param end row after the window, or -1 for the image height
   */
  @Option(
    names = "--y-end",
    description = "Row after the spectrum window; -1 for the image " +
      "height (default: ${DEFAULT-VALUE})",
    defaultValue = "-1"
  )
  public void setYEnd(int end) {
    yEnd = end;
  }

  /**
   * @param start first bin summed into the image
   */
  @Option(
    names = "--bin-start",
    description = "First bin summed into the image " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "0"
  )
  public void setBinStart(int start) {
    binStart = start;
  }

  /**
   * @param end bin after the summed range, or -1 for the spectrum length
   */
  @Option(
    names = "--bin-end",
    description = "Bin after the summed range; -1 for the spectrum " +
      "length (default: ${DEFAULT-VALUE})",
    defaultValue = "-1"
  )
  public void setBinEnd(int end) {
    binEnd = end;
  }

  /**
   * Set the slf4j logging level. Defaults to "WARN".
   *
   * @param level logging level
   */
  @Option(
    names = {"--log-level", "--debug"},
    arity = "0..1",
    description = "Change logging level; valid values are " +
      "OFF, ERROR, WARN, INFO, DEBUG, TRACE and ALL. " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "WARN",
    fallbackValue = "DEBUG"
  )
  public void setLogLevel(String level) {
    if (level != null) {
      logLevel = level;
    }
  }

  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (inputPath == null || outputPath == null) {
      throw new IllegalArgumentException("Input and output must be specified");
    }
    if (!ZarrTargetWriter.isFinalized(inputPath)) {
      throw new IllegalArgumentException(
        inputPath + " is not a complete converted output");
    }
    ZarrArray array =
      ZarrArray.open(inputPath.resolve(ZarrTargetWriter.ARRAY_NAME));
    Extents extents = Extents.fromArray(array.getShape());
    if (layer < 0 || layer >= extents.getLayers()) {
      throw new IllegalArgumentException("Invalid layer: " + layer);
    }

    if (mode == Mode.spectrum) {
      long[] spectrum = sumSpectrum(array, extents);
      CsvWriter writer = createWriter();
      try {
        writer.writeHeaders("bin", "intensity");
        for (int b=0; b<spectrum.length; b++) {
          writer.writeRow(b, spectrum[b]);
        }
      }
      finally {
        writer.close();
      }
    }
    else {
      long[][] image = sumImage(array, extents);
      CsvWriter writer = createWriter();
      try {
        for (long[] row : image) {
          Object[] values = new Object[row.length];
          for (int y=0; y<row.length; y++) {
            values[y] = row[y];
          }
          writer.writeRow(values);
        }
      }
      finally {
        writer.close();
      }
    }
    LOGGER.info("Wrote {} of layer {} to {}", mode, layer, outputPath);
    return 0;
  }

  /**
   * @return sum over the window of every bin's value
   */
  private long[] sumSpectrum(ZarrArray array, Extents extents)
    throws IOException, InvalidRangeException
  {
    int x0 = xStart;
    int x1 = end(xEnd, extents.getWidth());
    int y0 = yStart;
    int y1 = end(yEnd, extents.getHeight());
    checkRange("X", x0, x1, extents.getWidth());
    checkRange("Y", y0, y1, extents.getHeight());
    final long[] spectrum = new long[extents.getBins()];
    readBlocks(array, new int[] {layer, x0, y0, 0},
      new int[] {layer + 1, x1, y1, extents.getBins()},
      (offset, shape, data) -> {
        int i = 0;
        for (int x=0; x<shape[1]; x++) {
          for (int y=0; y<shape[2]; y++) {
            for (int b=0; b<shape[3]; b++) {
              spectrum[offset[3] + b] += data[i++];
            }
          }
        }
      });
    return spectrum;
  }

  /**
   * @return per-pixel sum over the bin range, indexed [x][y]
   */
  private long[][] sumImage(ZarrArray array, Extents extents)
    throws IOException, InvalidRangeException
  {
    int b0 = binStart;
    int b1 = end(binEnd, extents.getBins());
    checkRange("bin", b0, b1, extents.getBins());
    final long[][] image = new long[extents.getWidth()][extents.getHeight()];
    readBlocks(array, new int[] {layer, 0, 0, b0},
      new int[] {layer + 1, extents.getWidth(), extents.getHeight(), b1},
      (offset, shape, data) -> {
        int i = 0;
        for (int x=0; x<shape[1]; x++) {
          for (int y=0; y<shape[2]; y++) {
            long sum = 0;
            for (int b=0; b<shape[3]; b++) {
              sum += data[i++];
            }
            image[offset[1] + x][offset[2] + y] += sum;
          }
        }
      });
    return image;
  }

  private interface BlockConsumer {
    void accept(int[] offset, int[] shape, int[] data);
  }

  /**
   * Read the box [lo, hi) one chunk-aligned block at a time.
   */
  private static void readBlocks(ZarrArray array, int[] lo, int[] hi,
    BlockConsumer consumer)
    throws IOException, InvalidRangeException
  {
    int[] chunks = array.getChunks();
    int[] offset = lo.clone();
    while (true) {
      int[] shape = new int[offset.length];
      int size = 1;
      for (int axis=0; axis<offset.length; axis++) {
        int chunkEnd = (offset[axis] / chunks[axis] + 1) * chunks[axis];
        shape[axis] = Math.min(chunkEnd, hi[axis]) - offset[axis];
        size *= shape[axis];
      }
      int[] data = new int[size];
      array.read(data, shape, offset);
      consumer.accept(offset.clone(), shape, data);

      int axis = offset.length - 1;
      for (; axis>=0; axis--) {
        offset[axis] += shape[axis];
        if (offset[axis] < hi[axis]) {
          break;
        }
        offset[axis] = lo[axis];
      }
      if (axis < 0) {
        return;
      }
    }
  }

  private CsvWriter createWriter() {
    CsvWriterSettings settings = new CsvWriterSettings();
    return new CsvWriter(outputPath.toFile(), settings);
  }

  private static int end(int value, int extent) {
    return value < 0 ? extent : value;
  }

  private static void checkRange(String axis, int start, int end, int extent)
  {
    if (start < 0 || start >= end || end > extent) {
      throw new IllegalArgumentException(String.format(
        "Invalid %s range [%d, %d) for extent %d", axis, start, end, extent));
    }
  }

  /**
   * Extract data as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Extractor()).execute(args);
    System.exit(exitCode);
  }

}
