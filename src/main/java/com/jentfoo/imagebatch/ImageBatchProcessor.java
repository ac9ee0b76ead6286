package com.jentfoo.imagebatch;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.util.ExceptionHandler;
import org.threadly.util.ExceptionUtils;

import com.jentfoo.imagebatch.codec.CodecDescriptor;
import com.jentfoo.imagebatch.codec.CodecDescriptor.Kind;
import com.jentfoo.imagebatch.codec.CodecOption;
import com.jentfoo.imagebatch.codec.CodecRegistry;
import com.jentfoo.imagebatch.codec.StructuredLiteral;
import com.jentfoo.imagebatch.pool.WorkerPoolFactory;
import com.jentfoo.imagebatch.pool.imageio.ImageIoWorkerPool;
import com.jentfoo.imagebatch.progress.ConsoleStyle;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "imagebatch",
         mixinStandardHelpOptions = true,
         sortOptions = false,
         versionProvider = ImageBatchProcessor.VersionProvider.class,
         description = "Convert and optimize images locally. Config accepts JSON/JSON5 or \"auto\".",
         footer = { "",
                    "Examples:",
                    "  $ imagebatch --mozjpeg auto image.png",
                    "  $ imagebatch --oxipng '{}' assets/*.jpg",
                    "  $ imagebatch --resize '{width:1200,method:\"lanczos3\"}' --mozjpeg auto photos/",
                    "  $ imagebatch -d out -s .min --webp auto --avif '{quality:60}' images/",
                    "",
                    "Notes:",
                    "  - Config accepts JSON/JSON5 (single quotes often help avoid shell escaping).",
                    "  - Use your shell for globs (e.g. *.png) or pass directories to process all files within.",
                    "  - Supported encoders: mozjpeg (jpg), webp, avif, jxl, wp2, oxipng (png).",
                    "  - Preprocessors: resize, quant, rotate." })
public class ImageBatchProcessor implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(ImageBatchProcessor.class);
  private static final int CORE_COUNT = Runtime.getRuntime().availableProcessors();
  private static final String VERSION_ENV = "IMAGEBATCH_VERSION";
  // value used when a preprocessor flag is given without configuration
  private static final String EMPTY_CONFIG = "{}";

  @Spec
  private CommandSpec spec;

  @Parameters(arity = "0..*", paramLabel = "files", description = "Images or directories of images to convert")
  private List<String> files = new ArrayList<String>();

  @Option(names = { "-d", "--output-dir" }, paramLabel = "<dir>", defaultValue = ".",
          description = "Output directory (default: ${DEFAULT-VALUE})")
  private File outputDir;

  @Option(names = { "-s", "--suffix" }, paramLabel = "<suffix>", defaultValue = "",
          description = "Append suffix to output files")
  private String suffix;

  @Option(names = { "-c", "--max-concurrent-files" }, paramLabel = "<count>",
          description = "Amount of files to process at once (defaults to CPU cores)")
  private int maxConcurrentFiles = CORE_COUNT;

  @Option(names = "--max-optimizer-rounds", paramLabel = "<rounds>",
          defaultValue = "" + ConversionSettings.DEFAULT_MAX_OPTIMIZER_ROUNDS,
          description = "Maximum number of compressions to use for auto optimizations (default: ${DEFAULT-VALUE})")
  private int maxOptimizerRounds;

  @Option(names = "--optimizer-butteraugli-target", paramLabel = "<butteraugli distance>",
          defaultValue = "" + ConversionSettings.DEFAULT_BUTTERAUGLI_TARGET,
          description = "Target Butteraugli distance for auto optimizer (default: ${DEFAULT-VALUE})")
  private double optimizerButteraugliTarget;

  @Option(names = "--on-error", paramLabel = "<abort|skip>", defaultValue = "abort",
          description = "Abort the batch when a file fails, or skip the file and continue (default: ${DEFAULT-VALUE})")
  private String onError;

  private final WorkerPoolFactory poolFactory;
  private final PrintStream out;
  private final PrintStream err;
  private final ConsoleStyle style;

  public ImageBatchProcessor() {
    this(new ImageIoWorkerPool.Factory(), System.out, System.err, Ansi.AUTO);
  }

  public ImageBatchProcessor(WorkerPoolFactory poolFactory,
                             PrintStream out, PrintStream err, Ansi ansi) {
    this.poolFactory = poolFactory;
    this.out = out;
    this.err = err;
    this.style = new ConsoleStyle(ansi);
  }

  public static void main(String[] args) {
    ExceptionUtils.setDefaultExceptionHandler(new LoggingExceptionHandler());

    System.exit(makeCommandLine(new ImageBatchProcessor()).execute(args));
  }

  public static CommandLine makeCommandLine(ImageBatchProcessor processor) {
    CommandLine cli = new CommandLine(processor);
    CommandSpec commandSpec = cli.getCommandSpec();
    for (CodecDescriptor preprocessor : CodecRegistry.getPreprocessors()) {
      commandSpec.addOption(makeCodecOption(preprocessor));
    }
    for (CodecDescriptor encoder : CodecRegistry.getEncoders()) {
      commandSpec.addOption(makeCodecOption(encoder));
    }

    return cli;
  }

  private static OptionSpec makeCodecOption(CodecDescriptor descriptor) {
    OptionSpec.Builder builder;
    if (descriptor.getExtensionAlias() != null) {
      builder = OptionSpec.builder("--" + descriptor.getName(), "--" + descriptor.getExtensionAlias());
    } else {
      builder = OptionSpec.builder("--" + descriptor.getName());
    }

    return builder.paramLabel("config")
                  .arity("0..1")
                  .type(String.class)
                  .fallbackValue(descriptor.getKind() == Kind.Encoder ? CodecOption.AUTO_LITERAL : EMPTY_CONFIG)
                  .description(descriptor.getDescription())
                  .build();
  }

  @Override
  public Integer call() {
    File resolvedOutputDir = outputDir.getAbsoluteFile();
    try {
      FileUtils.ensureDirectory(resolvedOutputDir);
    } catch (IllegalStateException e) {
      err.println("-> " + e.getMessage());
      return 1;
    }

    if (files.isEmpty()) {
      out.println(style.yellow("No input files specified. Showing help..."));
      spec.commandLine().usage(out, style.isEnabled() ? Ansi.ON : Ansi.OFF);
      return 0;
    }

    ConversionSettings settings = makeSettings(resolvedOutputDir);

    List<File> inputFiles;
    try {
      inputFiles = InputResolver.resolve(files);
    } catch (IllegalStateException e) {
      err.println("-> " + e.getMessage() + (e.getCause() == null ? "" : ": " + e.getCause()));
      return 1;
    }

    try {
      new BatchScheduler(settings, poolFactory, out, style).processAllFiles(inputFiles);
    } catch (StageFailedException e) {
      ExceptionUtils.handleException(e);
    }

    return 0;
  }

  private ConversionSettings makeSettings(File resolvedOutputDir) {
    if (maxConcurrentFiles < 1) {
      throw new ParameterException(spec.commandLine(),
                                   "--max-concurrent-files must be at least 1: " + maxConcurrentFiles);
    }

    FailurePolicy failurePolicy;
    try {
      failurePolicy = FailurePolicy.parse(onError);
    } catch (IllegalArgumentException e) {
      throw new ParameterException(spec.commandLine(), e.getMessage(), e);
    }

    return new ConversionSettings(resolvedOutputDir, suffix, maxConcurrentFiles,
                                  maxOptimizerRounds, optimizerButteraugliTarget, failurePolicy,
                                  collectConfigs(CodecRegistry.getPreprocessors()),
                                  collectConfigs(CodecRegistry.getEncoders()));
  }

  // validates the literals now so a typo is reported before any file is touched
  private Map<String, String> collectConfigs(List<CodecDescriptor> descriptors) {
    Map<String, String> result = new HashMap<String, String>();
    for (CodecDescriptor descriptor : descriptors) {
      OptionSpec option = spec.findOption("--" + descriptor.getName());
      String value = option == null ? null : (String)option.getValue();
      if (value == null) {
        continue;
      }

      try {
        if (descriptor.getKind() == Kind.Encoder) {
          CodecOption.parse(value);
        } else {
          StructuredLiteral.parse(value);
        }
      } catch (IllegalArgumentException e) {
        throw new ParameterException(spec.commandLine(),
                                     "--" + descriptor.getName() + ": " + e.getMessage(), e);
      }
      result.put(descriptor.getName(), value);
    }

    return result;
  }

  public static class VersionProvider implements IVersionProvider {
    @Override
    public String[] getVersion() {
      String version = System.getenv(VERSION_ENV);
      if (version == null || version.isEmpty()) {
        version = ImageBatchProcessor.class.getPackage().getImplementationVersion();
      }
      if (version == null || version.isEmpty()) {
        version = "unknown";
      } else if (! version.startsWith("v")) {
        version = "v" + version;
      }

      return new String[] { "CLI version:  " + version,
                            "Java version: " + System.getProperty("java.version") };
    }
  }

  private static class LoggingExceptionHandler implements ExceptionHandler {
    @Override
    public void handleException(Throwable thrown) {
      log.error("Unhandled exception", thrown);
    }
  }
}
