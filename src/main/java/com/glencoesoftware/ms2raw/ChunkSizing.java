/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.math.RoundingMode;

import com.google.common.math.DoubleMath;

/**
 * Derives a target chunk shape from a minimum chunk count and an optional
 * memory ceiling, for use when no chunk shape is given explicitly.
 * <p>
 * Layers are split first.  When more chunks are needed than there are
 * layers, each layer is split further: for spectrum-major conversions the
 * image plane is split before the spectrum, for image-major conversions
 * the spectrum is split before the image plane.
 * </p>
 */
public final class ChunkSizing {

  private static final double BYTES_PER_GIB = 1024.0 * 1024 * 1024;

  private ChunkSizing() {
  }

  /**
   * Size of the whole dataset and the resulting number and size of chunks.
   */
  public static class MemoryInfo {
    private final double totalGib;
    private final double maxChunkGib;
    private final int chunkCount;

    MemoryInfo(double totalGib, double maxChunkGib, int chunkCount) {
      this.totalGib = totalGib;
      this.maxChunkGib = maxChunkGib;
      this.chunkCount = chunkCount;
    }

    /**
     * @param minChunkCount requested minimum number of chunks; values
     *                      below 1 are treated as 1, and the count is
     *                      raised so that no chunk exceeds
     *                      {@link ChunkGrid#MAX_CHUNK_CELLS} cells
     * @param maxGib memory ceiling shared by all workers, or null
     * @param workers number of chunks held at the same time
     * @param extents dataset extents
     * @return the chunk count and size
     */
    public static MemoryInfo calculate(int minChunkCount, Double maxGib,
      int workers, Extents extents)
    {
      if (workers < 1) {
        throw new IllegalArgumentException(
          "Worker count must be positive: " + workers);
      }
      double total = (double) extents.getCellCount() *
        ChunkGrid.BYTES_PER_CELL / BYTES_PER_GIB;
      int count = Math.max(1, minChunkCount);
      // each chunk must fit in one array
      count = Math.max(count, DoubleMath.roundToInt(
        (double) extents.getCellCount() / ChunkGrid.MAX_CHUNK_CELLS,
        RoundingMode.CEILING));

      if (maxGib != null) {
        if (maxGib <= 0) {
          throw new IllegalArgumentException(
            "Memory ceiling must be positive: " + maxGib);
        }
        if ((total / count) * workers > maxGib) {
          count = DoubleMath.roundToInt(
            total / (maxGib / workers), RoundingMode.CEILING);
        }
      }
      return new MemoryInfo(total, total / count, count);
    }

    public double getTotalGib() {
      return totalGib;
    }

    public double getMaxChunkGib() {
      return maxChunkGib;
    }

    public int getChunkCount() {
      return chunkCount;
    }

    @Override
    public String toString() {
      return String.format("%d chunks of at most %.6f GiB (%.6f GiB total)",
        chunkCount, maxChunkGib, totalGib);
    }
  }

  /**
   * Split an image into roughly square tiles.
   *
   * @param width image width
   * @param height image height
   * @param chunksPerImage minimum number of tiles
   * @return {tile width, tile height}
   */
  public static int[] imageDimensions(int width, int height,
    int chunksPerImage)
  {
    if ((long) chunksPerImage > (long) width * height) {
      return new int[] {1, 1};
    }
    int perDimension = DoubleMath.roundToInt(
      Math.sqrt(chunksPerImage), RoundingMode.CEILING);
    if (width < perDimension) {
      int h = floor(height / ((double) chunksPerImage / width));
      return new int[] {1, Math.max(1, h)};
    }
    if (height < perDimension) {
      int w = floor(width / ((double) chunksPerImage / height));
      return new int[] {Math.max(1, w), 1};
    }
    return new int[] {
      Math.max(1, width / perDimension), Math.max(1, height / perDimension)};
  }

  /**
   * Derive a chunk shape for one layout.
   *
   * @param layout layout that will be read
   * @param extents dataset extents
   * @param memory chunk count and size
   * @return chunk shape
   */
  public static ChunkShape chunkShape(Layout layout, Extents extents,
    MemoryInfo memory)
  {
    int layers = extents.getLayers();
    int layersPerChunk;
    int chunksPerLayer;
    if (memory.getChunkCount() < layers) {
      layersPerChunk = Math.max(1, layers / memory.getChunkCount());
      chunksPerLayer = 1;
    }
    else {
      layersPerChunk = 1;
      chunksPerLayer = DoubleMath.roundToInt(
        (double) memory.getChunkCount() / layers, RoundingMode.CEILING);
    }

    int width = extents.getWidth();
    int height = extents.getHeight();
    int bins = extents.getBins();
    int[] image;
    int binsPerChunk;
    if (layout == Layout.spectrum) {
      image = imageDimensions(width, height, chunksPerLayer);
      double chunksPerImage =
        ((double) width / image[0]) * ((double) height / image[1]);
      int chunksPerSpectrum = DoubleMath.roundToInt(
        chunksPerLayer / chunksPerImage, RoundingMode.CEILING);
      binsPerChunk = Math.max(1, bins / chunksPerSpectrum);
    }
    else {
      binsPerChunk = Math.max(1, bins / chunksPerLayer);
      double chunksPerSpectrum = (double) bins / binsPerChunk;
      int chunksPerImage = DoubleMath.roundToInt(
        chunksPerLayer / chunksPerSpectrum, RoundingMode.CEILING);
      image = imageDimensions(width, height, chunksPerImage);
    }
    return new ChunkShape(layersPerChunk, image[0], image[1], binsPerChunk);
  }

  /**
   * Derive a chunk shape for one layout.
   *
   * @param layout layout that will be read
   * @param extents dataset extents
   * @param minChunkCount requested minimum number of chunks
   * @param maxGib memory ceiling shared by all workers, or null
   * @param workers number of chunks held at the same time
   * @return chunk shape
   */
  public static ChunkShape chunkShape(Layout layout, Extents extents,
    int minChunkCount, Double maxGib, int workers)
  {
    return chunkShape(layout, extents,
      MemoryInfo.calculate(minChunkCount, maxGib, workers, extents));
  }

  private static int floor(double value) {
    return DoubleMath.roundToInt(value, RoundingMode.FLOOR);
  }

}
