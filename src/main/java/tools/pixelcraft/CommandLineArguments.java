package tools.pixelcraft;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.converters.PathConverter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parsed command line of {@link PixelCraftApplication}.
 */
public class CommandLineArguments {
  static final String PROGRAM_NAME = "pixelcraft";

  @Parameter(names = "--image", required = true, converter = PathConverter.class,
      description = "Image to filter, or directory of images with --batch")
  private Path image;

  @Parameter(names = "--batch", description = "Filter every image of the --image directory")
  private boolean batch;

  @Parameter(names = "--filter",
      description = "One of average, sharpen, negative, laplacian, logarithm")
  private String filter;

  @Parameter(names = "--sensitivity",
      description = "Similarity sensitivity, higher values tolerate smaller differences")
  private Integer sensitivity;

  @Parameter(names = "--output", description = "Output file, or output directory with --batch",
      converter = PathConverter.class)
  private Path output;

  @Parameter(names = "--compare", description = "Score every batch result against its source")
  private boolean compare;

  @Parameter(names = "--debug", description = "Log at debug level")
  private boolean debug;

  private CommandLineArguments() {}

  /**
   * Parses the command line.
   *
   * @param args The raw arguments.
   * @return The parsed arguments.
   * @throws ParameterException On an unknown option, a missing option value, a non-numeric
   *         sensitivity, or a missing {@code --image}.
   */
  public static CommandLineArguments parse(String... args) {
    var arguments = new CommandLineArguments();
    commanderFor(arguments).parse(args);

    return arguments;
  }

  /**
   * @return The option summary printed on usage errors.
   */
  static String usage() {
    var usage = new StringBuilder();
    commanderFor(new CommandLineArguments()).getUsageFormatter().usage(usage);

    return usage.toString();
  }

  private static JCommander commanderFor(CommandLineArguments arguments) {
    return JCommander.newBuilder().programName(PROGRAM_NAME).addObject(arguments).build();
  }

  public Path getImage() {
    return image;
  }

  public boolean isBatch() {
    return batch;
  }

  public Optional<String> getFilter() {
    return Optional.ofNullable(filter);
  }

  public OptionalInt getSensitivity() {
    return sensitivity == null ? OptionalInt.empty() : OptionalInt.of(sensitivity);
  }

  public Optional<Path> getOutput() {
    return Optional.ofNullable(output);
  }

  public boolean isCompare() {
    return compare;
  }

  public boolean isDebug() {
    return debug;
  }
}
