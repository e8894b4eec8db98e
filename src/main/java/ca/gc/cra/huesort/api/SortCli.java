package ca.gc.cra.huesort.api;

import ca.gc.cra.huesort.application.pipeline.HueSortResult;
import ca.gc.cra.huesort.application.pipeline.PipelineProgress;
import ca.gc.cra.huesort.application.pipeline.PipelineTimeoutException;
import ca.gc.cra.huesort.config.CompositionRoot;
import ca.gc.cra.huesort.config.ConfigMerger;
import ca.gc.cra.huesort.config.DefaultsForMode;
import ca.gc.cra.huesort.config.HueSortConfig;
import ca.gc.cra.huesort.config.YamlConfigLoader;
import ca.gc.cra.huesort.logging.LoggingConfigurator;
import ca.gc.cra.huesort.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CLI for the {@code sort} command: orders the images of a directory by dominant hue.
 *
 * <p>Precedence is CLI {@code key=value} &gt; YAML ({@code config=PATH}, default {@code ./huesort.yaml}) &gt;
 * built-in defaults. The report goes to {@code out=FILE} or stdout; logs go to stderr.</p>
 *
 * @since 0.1.0
 */
public final class SortCli {
  private static final Logger log = LoggerFactory.getLogger(SortCli.class);
  private static final String MODE = "sort";
  private static final Path DEFAULT_CONFIG = Path.of("huesort.yaml");
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run", "--allow-overwrite");
  private static final String SUMMARY_USAGE =
      "usage: sort in=DIR [out=FILE] [config=FILE] [extensions=png,jpg,...] [recursive=true|false] "
          + "[sampleStride=1-64] [pollMillis=1-1000] [completionTimeoutSeconds=0-86400] "
          + "[shutdownTimeoutSeconds=1-300] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      huesort sort: order images by the hue of their average colour

      Usage:
        sort in=DIR [options]

      Required:
        in=DIR                        Directory containing the images

      Optional (validated):
        out=FILE                      Report file (default: stdout); one "path<TAB>hue" line per image
        config=FILE                   YAML file with common/sort sections (default ./huesort.yaml if present)
        extensions=LIST               Accepted extensions (default png,jpg,jpeg,bmp,gif)
        recursive=true|false          Scan sub-directories (default false)
        sampleStride=1-64             Sample every Nth pixel in both axes (default 1)
        pollMillis=1-1000             Idle wait of each stage in ms (default 25)
        completionTimeoutSeconds=N    Give up after N seconds; 0 waits without limit (default 0)
        shutdownTimeoutSeconds=1-300  Wait for workers on shutdown (default 5)
        metricsExporter=otlp|none     Metrics exporter (default none)
        otelEndpoint=URL              OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V    Comma-separated OTel resource attributes
        --dry-run                     Validate inputs and print the plan without processing
        --allow-overwrite             Replace an existing report file
        --verbose                     Enable DEBUG logging
        --help                        Show this message
      """;

  private SortCli() {}

  /**
   * Entry point for running the command directly.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the command and returns its exit code without terminating the JVM.
   *
   * @param args CLI arguments (without the {@code sort} token)
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sort CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", String.join(", ", unknownFlags));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig;
    Path yamlPath = kv.containsKey("config") ? Path.of(kv.get("config")) : DEFAULT_CONFIG;
    if (kv.containsKey("config") && !Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    try {
      yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      return ExitCode.IO_ERROR;
    }
    yamlConfig.ifPresent(yaml -> log.debug("Loaded {} setting(s) from {}", yaml.size(), yamlPath));

    HueSortConfig config;
    Path inputDirectory;
    Optional<Path> outputFile;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = HueSortConfig.fromMap(effective);
      inputDirectory = Paths.validateReadableDir(config.inputDirectory());
      outputFile = config.outputFile().map(out -> Paths.validateWritableFile(out, !dryRun, allowOverwrite));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sort arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputDirectory, outputFile, allowOverwrite);
      return ExitCode.SUCCESS;
    }
    return execute(config, outputFile);
  }

  private static ExitCode execute(HueSortConfig config, Optional<Path> outputFile) {
    try (CompositionRoot root = new CompositionRoot(config)) {
      log.info("Ordering images in {} by hue", config.inputDirectory());
      HueSortResult result = root.hueSortUseCase().run();
      if (outputFile.isPresent()) {
        root.reportWriter().write(result.ordering(), outputFile.get());
        log.info("Wrote {} line(s) to {}", result.ordering().size(), outputFile.get());
      } else {
        root.reportWriter().write(result.ordering(), CliPrinter.writer());
      }
      if (result.failedCount() > 0) {
        log.warn("{} of {} image(s) could not be ordered", result.failedCount(), result.ordering().size());
      }
      if (result.discoveryFailure().isPresent()) {
        log.error("Image discovery ended early; ordering is partial: {}",
            result.discoveryFailure().get().getMessage());
        return ExitCode.IO_ERROR;
      }
      return ExitCode.SUCCESS;
    } catch (PipelineTimeoutException ex) {
      PipelineProgress progress = ex.progress();
      log.error("{}; {} of {} image(s) ordered", ex.getMessage(), progress.completed(),
          progress.total().isPresent() ? Long.toString(progress.total().getAsLong()) : "unknown");
      return ExitCode.TIMEOUT;
    } catch (IOException ex) {
      log.error("Unable to write ordering report", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Sort configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Sort interrupted; shutting down workers", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while ordering images", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      HueSortConfig config, Path inputDirectory, Optional<Path> outputFile, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Sort dry-run: no images will be processed.",
        " Input directory   : " + inputDirectory,
        " Recursive         : " + config.recursive(),
        " Extensions        : " + String.join(",", config.extensions().stream().sorted().toList()),
        " Report            : " + outputFile.map(Path::toString).orElse("<stdout>"),
        " Allow overwrite   : " + allowOverwrite,
        " Sample stride     : " + config.sampleStride(),
        " Poll interval (ms): " + config.pollInterval().toMillis(),
        " Completion timeout: " + (config.completionTimeout().isZero()
            ? "unbounded" : config.completionTimeout().toSeconds() + " s"),
        " Shutdown timeout  : " + config.shutdownTimeout().toSeconds() + " s",
        " Metrics exporter  : " + config.metrics().exporter(),
        " Re-run without --dry-run to start processing.");
  }
}
