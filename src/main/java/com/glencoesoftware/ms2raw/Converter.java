/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.ms2raw;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import picocli.CommandLine;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line tool for converting ION exports to a consolidated
 * (layer, x, y, mass) Zarr array.
 */
public class Converter implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  /** Default memory budget of a single layout conversion. */
  public static final String DEFAULT_MEMORY_BUDGET = "1g";

  private static final double BYTES_PER_GIB = 1024.0 * 1024 * 1024;

  private volatile Path inputPath;
  private volatile Path outputPath;

  private volatile List<Layout> layouts;
  private volatile ChunkShape chunkShape;
  private volatile int chunkCount;
  private volatile long memoryBudget;
  private volatile int maxWorkers;
  private volatile int writeQueueSize;
  private volatile boolean allowMultiPass = false;
  private volatile ZarrCompression compressionType;
  private volatile Map<String, Object> compressionProperties;
  private volatile boolean nested = true;
  private volatile boolean overwrite = false;
  private volatile boolean validate = false;
  private volatile boolean noMetadata = false;

  private volatile String logLevel;
  private volatile boolean progressBars = false;
  private volatile boolean printVersion = false;
  private volatile boolean help = false;

  private final List<ConversionRun> runs = new ArrayList<ConversionRun>();
  private final List<ConversionReport> reports =
    new ArrayList<ConversionReport>();

  private IProgressListener progressListener;

  // Option setters

  /**
   * @param input path to the ION export
   */
  @Parameters(
    index = "0",
    arity = "1",
    description = "ION export to convert",
    defaultValue = Option.NULL_VALUE
  )
  public void setInputPath(String input) {
    inputPath = input == null ? null : Paths.get(input);
  }

  /**
   * @param output path to the output directory
   */
  @Parameters(
    index = "1",
    arity = "1",
    description = "path to the output directory; each converted layout " +
      "is written to a subdirectory named after it",
    defaultValue = Option.NULL_VALUE
  )
  public void setOutputPath(String output) {
    outputPath = output == null ? null : Paths.get(output);
  }

  /**
   * Select the stored layouts to convert.  Both are converted by default.
   *
   * @param layoutList layouts to convert
   */
  @Option(
    names = {"-l", "--layout"},
    split = ",",
    description = "Comma-separated list of layouts to convert " +
      "(${COMPLETION-CANDIDATES}; default: ${DEFAULT-VALUE})",
    defaultValue = "spectrum,image"
  )
  public void setLayouts(List<Layout> layoutList) {
    if (layoutList == null || layoutList.isEmpty()) {
      layouts = Arrays.asList(Layout.values());
    }
    else {
      layouts = new ArrayList<Layout>(new LinkedHashSet<Layout>(layoutList));
    }
  }

  /**
   * Set the target chunk shape.  If not set, a shape is derived for each
   * layout from the chunk count and memory budget.
   *
   * @param shape chunk size along the layer, X, Y and mass axes
   */
  @Option(
    names = "--chunk-shape",
    split = ",",
    description = "Chunk shape as layers,width,height,bins " +
      "(default: derived from --chunk-count and --memory-budget)",
    defaultValue = Option.NULL_VALUE
  )
  public void setChunkShape(List<Integer> shape) {
    if (shape == null) {
      chunkShape = null;
    }
    else if (shape.size() != Extents.DIMENSIONS) {
      throw new IllegalArgumentException(
        "Chunk shape must have 4 values: " + shape);
    }
    else {
      chunkShape = ChunkShape.fromList(shape);
    }
  }

  /**
   * @param count minimum number of chunks when deriving a chunk shape
   */
  @Option(
    names = {"-k", "--chunk-count"},
    description = "Minimum number of chunks when no chunk shape is given " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "1"
  )
  public void setChunkCount(int count) {
    if (count > 0) {
      chunkCount = count;
    }
    else {
      LOGGER.warn("Ignoring invalid chunk count: {}", count);
    }
  }

  /**
   * @param budget maximum bytes buffered by each layout conversion
   */
  @Option(
    names = {"-m", "--memory-budget"},
    description = "Maximum memory used to buffer chunks, per layout; " +
      "k, m and g suffixes are accepted (default: ${DEFAULT-VALUE})",
    converter = MemorySizeConverter.class,
    defaultValue = DEFAULT_MEMORY_BUDGET
  )
  public void setMemoryBudget(long budget) {
    memoryBudget = budget;
  }

  /**
   * Set the maximum number of layouts converted at the same time.
   * Defaults to 2 or the number of detected CPUs, whichever is smaller.
   *
   * @param workers maximum worker count
   */
  @Option(
    names = {"--max-workers", "--max_workers"},
    description = "Maximum number of layouts converted in parallel " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "2"
  )
  public void setMaxWorkers(int workers) {
    int availableProcessors = Runtime.getRuntime().availableProcessors();
    if (workers > availableProcessors) {
      maxWorkers = availableProcessors;
    }
    else if (workers > 0) {
      maxWorkers = workers;
    }
    else {
      LOGGER.warn("Ignoring invalid worker count: {}", workers);
    }
  }

  /**
   * @param size completed chunks waiting to be written, per layout
   */
  @Option(
    names = "--write-queue-size",
    description = "Number of completed chunks waiting to be written " +
      "(default: ${DEFAULT-VALUE})",
    defaultValue = "" + ConversionRun.DEFAULT_WRITE_QUEUE_SIZE
  )
  public void setWriteQueueSize(int size) {
    if (size > 0) {
      writeQueueSize = size;
    }
    else {
      LOGGER.warn("Ignoring invalid write queue size: {}", size);
    }
  }

  /**
   * @param allow true to read the input several times when a single pass
   *              does not fit in the memory budget
   */
  @Option(
    names = "--allow-multi-pass",
    description = "Read the input several times, one band of chunks at a " +
      "time, if a single pass needs more than the memory budget",
    defaultValue = "false"
  )
  public void setAllowMultiPass(boolean allow) {
    allowMultiPass = allow;
  }

  /**
   * Set the compression type for the output Zarr. Defaults to blosc.
   *
   * @param compression compression type
   */
  @Option(
    names = {"-c", "--compression"},
    description = "Compression type for Zarr " +
      "(${COMPLETION-CANDIDATES}; default: ${DEFAULT-VALUE})",
    defaultValue = "blosc"
  )
  public void setCompression(ZarrCompression compression) {
    if (compression != null) {
      compressionType = compression;
    }
  }

  /**
   * Compression-specific options as defined by jzarr.
   *
   * @param properties compression properties
   */
  @Option(
    names = {"--compression-properties"},
    description = "Properties for the chosen compression (see " +
      "https://jzarr.readthedocs.io/en/latest/tutorial.html#compressors" +
      " )",
    defaultValue = Option.NULL_VALUE
  )
  public void setCompressionProperties(Map<String, Object> properties) {
    if (properties != null) {
      compressionProperties = properties;
    }
    else {
      compressionProperties = new HashMap<String, Object>();
    }
  }

  /**
   * Set whether or not to use the nested chunk path separator.
   *
   * @param unnested true if '.' should be used instead of '/'
   */
  @Option(
    names = "--no-nested", negatable = true,
    description = "Whether to use '/' as the chunk path separator " +
      "(true by default)",
    defaultValue = "false"
  )
  public void setUnnested(boolean unnested) {
    nested = !unnested;
  }

  /**
   * @param canOverwrite true if an existing output may be replaced
   */
  @Option(
    names = "--overwrite",
    description = "Overwrite the output directory if it exists",
    defaultValue = "false"
  )
  public void setOverwrite(boolean canOverwrite) {
    overwrite = canOverwrite;
  }

  /**
   * @param compare true to compare the outputs of both layouts
   */
  @Option(
    names = "--validate",
    description = "Check that both layouts converted to identical arrays",
    defaultValue = "false"
  )
  public void setValidate(boolean compare) {
    validate = compare;
  }

  /**
   * @param skip true to omit the root metadata
   */
  @Option(
    names = "--no-metadata",
    description = "Do not copy the instrument metadata and axes to the " +
      "output",
    defaultValue = "false"
  )
  public void setNoMetadata(boolean skip) {
    noMetadata = skip;
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

  /**
   * Configure whether or not progress bars are shown during conversion.
   * Progress bars are turned off by default.
   *
   * @param useProgressBars whether or not to show progress bars
   */
  @Option(
    names = {"-p", "--progress"},
    description = "Print progress bars during conversion",
    defaultValue = "false"
  )
  public void setProgressBars(boolean useProgressBars) {
    progressBars = useProgressBars;
  }

  /**
   * @param versionOnly whether or not to print the version and exit
   */
  @Option(
    names = "--version",
    description = "Print version information and exit",
    help = true,
    defaultValue = "false"
  )
  public void setPrintVersionOnly(boolean versionOnly) {
    printVersion = versionOnly;
  }

  /**
   * @param helpOnly whether or not to print help and exit
   */
  @Option(
    names = "--help",
    description = "Print usage information and exit",
    usageHelp = true,
    defaultValue = "false"
  )
  public void setHelp(boolean helpOnly) {
    help = helpOnly;
  }

  // Option getters

  public Path getInputPath() {
    return inputPath;
  }

  public Path getOutputPath() {
    return outputPath;
  }

  public List<Layout> getLayouts() {
    return layouts;
  }

  /**
   * @return the explicit chunk shape, or null if it is derived
   */
  public ChunkShape getChunkShape() {
    return chunkShape;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public long getMemoryBudget() {
    return memoryBudget;
  }

  public int getMaxWorkers() {
    return maxWorkers;
  }

  public int getWriteQueueSize() {
    return writeQueueSize;
  }

  public boolean getAllowMultiPass() {
    return allowMultiPass;
  }

  public ZarrCompression getCompression() {
    return compressionType;
  }

  public Map<String, Object> getCompressionProperties() {
    return compressionProperties;
  }

  public boolean getNested() {
    return nested;
  }

  public boolean getOverwrite() {
    return overwrite;
  }

  public boolean getValidate() {
    return validate;
  }

  public boolean getNoMetadata() {
    return noMetadata;
  }

  public String getLogLevel() {
    return logLevel;
  }

  /**
   * @return reports of the completed layout conversions
   */
  public List<ConversionReport> getReports() {
    synchronized (reports) {
      return new ArrayList<ConversionReport>(reports);
    }
  }

  /**
   * @throws Exception on most conversion errors
   */
  @Override
  public Integer call() throws Exception {
    ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
        LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(logLevel));

    if (help) {
      return -1;
    }

    if (printVersion) {
      String version = Optional.ofNullable(
        this.getClass().getPackage().getImplementationVersion()
        ).orElse("development");
      System.out.println("Version = " + version);
      System.out.println("Output layout version = " + OutputMetadata.LAYOUT);
      return -1;
    }

    if (inputPath == null) {
      throw new IllegalArgumentException("Input path not specified");
    }
    if (outputPath == null) {
      throw new IllegalArgumentException("Output path not specified");
    }

    if (Files.exists(outputPath)) {
      if (!overwrite) {
        throw new IllegalArgumentException(
                "Output path " + outputPath + " already exists");
      }
      LOGGER.warn("Overwriting output path {}", outputPath);
      ZarrTargetWriter.delete(outputPath);
    }

    if (progressBars) {
      setProgressListener(new ProgressBarListener(logLevel));
    }

    IonSource source = IonSource.open(inputPath);
    boolean success = false;
    try {
      Files.createDirectories(outputPath);
      OutputMetadata metadata = new OutputMetadata(outputPath);
      if (!noMetadata) {
        metadata.createRoot();
      }
      convert(source);
      if (validate) {
        validateOutputs();
      }
      if (!noMetadata) {
        metadata.write(source, layouts);
      }
      success = true;
    }
    finally {
      if (!success && Files.exists(outputPath)) {
        LOGGER.warn("Removing output path {} after failure", outputPath);
        ZarrTargetWriter.delete(outputPath);
      }
    }
    return 0;
  }

  /**
   * Convert every requested layout, in parallel up to the worker count.
   *
   * @param source opened export
   * @throws ConversionException if any conversion fails
   * @throws InterruptedException if interrupted while waiting
   */
  public void convert(IonSource source)
    throws ConversionException, InterruptedException
  {
    Extents extents = source.getExtents();
    long totalChunks = 0;
    for (Layout layout : layouts) {
      ChunkShape shape = chunkShapeFor(layout, extents);
      LOGGER.info("Converting the {} layout with chunks {}", layout, shape);
      ConversionRun run = new ConversionRun(source, layout, shape,
        memoryBudget, outputPath.resolve(layout.getOutputName()));
      run.setCompression(compressionType);
      run.setCompressionProperties(compressionProperties);
      run.setNested(nested);
      run.setWriteQueueSize(writeQueueSize);
      run.setAllowMultiPass(allowMultiPass);
      run.setProgressListener(getProgressListener());
      runs.add(run);
      totalChunks += new ChunkGrid(extents, shape).getChunkCount();
    }
    getProgressListener().notifyStart(runs.size(), totalChunks);

    ExecutorService executor = new ThreadPoolExecutor(
      maxWorkers, maxWorkers, 0L, TimeUnit.MILLISECONDS,
      new LimitedQueue<Runnable>(maxWorkers));
    Slf4JStopWatch t0 = stopWatch();
    try {
      List<CompletableFuture<Void>> futures =
        new ArrayList<CompletableFuture<Void>>();
      for (final ConversionRun run : runs) {
        final CompletableFuture<Void> future = new CompletableFuture<Void>();
        futures.add(future);
        executor.execute(() -> {
          try {
            ConversionReport report = run.call();
            synchronized (reports) {
              reports.add(report);
            }
            future.complete(null);
          }
          catch (Throwable t) {
            LOGGER.error("Failure converting the {} layout",
              run.getLayout(), t);
            future.completeExceptionally(t);
            // no point finishing the other layouts
            for (ConversionRun other : runs) {
              other.cancel();
            }
          }
        });
      }
      try {
        CompletableFuture.allOf(
          futures.toArray(new CompletableFuture[futures.size()])).join();
      }
      catch (CompletionException e) {
        unwrapException(firstFailure(futures, e));
      }
    }
    finally {
      executor.shutdown();
      executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
      t0.stop("convert");
    }
  }

  private ChunkShape chunkShapeFor(Layout layout, Extents extents) {
    if (chunkShape != null) {
      return chunkShape;
    }
    return ChunkSizing.chunkShape(layout, extents, chunkCount,
      memoryBudget / BYTES_PER_GIB, maxWorkers);
  }

  private void validateOutputs() throws ConversionException {
    if (!layouts.contains(Layout.spectrum) || !layouts.contains(Layout.image))
    {
      LOGGER.warn("--validate needs both layouts; skipping validation");
      return;
    }
    new OutputValidator().validate(
      outputPath.resolve(Layout.spectrum.getOutputName()),
      outputPath.resolve(Layout.image.getOutputName()));
  }

  /**
   * Prefer the failure that caused the other runs to be cancelled.
   */
  private static Throwable firstFailure(List<CompletableFuture<Void>> futures,
    CompletionException fallback)
  {
    Throwable cancelled = null;
    for (CompletableFuture<Void> future : futures) {
      try {
        future.join();
      }
      catch (CompletionException e) {
        if (!(e.getCause() instanceof ConversionCancelledException)) {
          return e;
        }
        if (cancelled == null) {
          cancelled = e;
        }
      }
    }
    return cancelled == null ? fallback : cancelled;
  }

  private void unwrapException(Throwable t) throws ConversionException {
    if (t instanceof CompletionException) {
      try {
        throw ((CompletionException) t).getCause();
      }
      catch (ConversionException e2) {
        throw e2;
      }
      catch (RuntimeException rt) {
        throw rt;
      }
      catch (Throwable t2) {
        throw new RuntimeException(t);
      }
    }
    else if (t instanceof RuntimeException) {
      throw (RuntimeException) t;
    }
    else {
      throw new RuntimeException(t);
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

  /**
   * Set a listener for chunk processing events.
   * Intended to be used to show a status bar.
   *
   * @param listener a progress event listener
   */
  public void setProgressListener(IProgressListener listener) {
    progressListener = listener;
  }

  /**
   * Get the currrent listener for chunk processing events.
   * If no listener was set, a no-op listener is returned.
   *
   * @return the current progress listener
   */
  public IProgressListener getProgressListener() {
    if (progressListener == null) {
      setProgressListener(new NoOpProgressListener());
    }
    return progressListener;
  }

  /**
   * Perform file conversion as specified by command line arguments.
   * @param args command line arguments
   */
  public static void main(String[] args) {
    int exitCode = new CommandLine(new Converter()).execute(args);
    System.exit(exitCode);
  }

}
