package tools.pixelcraft;

import ch.qos.logback.classic.Level;
import com.beust.jcommander.ParameterException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.pixelcraft.domain.batch.BatchCoordinator;
import tools.pixelcraft.domain.batch.BatchItem;
import tools.pixelcraft.domain.batch.BatchItemStatus;
import tools.pixelcraft.domain.batch.BatchListener;
import tools.pixelcraft.domain.batch.BatchRequest;
import tools.pixelcraft.domain.batch.BatchRun;
import tools.pixelcraft.domain.batch.BatchSummary;
import tools.pixelcraft.domain.batch.ImageSourceEnumerator;
import tools.pixelcraft.domain.image.FilterKind;
import tools.pixelcraft.domain.image.FilteredImage;
import tools.pixelcraft.domain.image.ImageFilteringService;
import tools.pixelcraft.domain.setting.PropertiesSettingRepository;
import tools.pixelcraft.domain.setting.Setting;
import tools.pixelcraft.domain.setting.SettingRepository;
import tools.pixelcraft.domain.similarity.SimilarityScorer;
import tools.pixelcraft.exceptions.PixelCraftException;
import tools.pixelcraft.io.DiskRasterIo;
import tools.pixelcraft.io.RasterIo;

/**
 * Command line entry point. Filters a single image and reports its similarity, or with
 * {@code --batch} filters every image of a directory.
 */
public class PixelCraftApplication {
  private static final Logger logger = LoggerFactory.getLogger(PixelCraftApplication.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURES = 1;
  static final int EXIT_USAGE = 2;

  private final SettingRepository settings;
  private final RasterIo rasterIo;
  private final SimilarityScorer similarityScorer;

  PixelCraftApplication(SettingRepository settings, RasterIo rasterIo,
      SimilarityScorer similarityScorer) {
    this.settings = settings;
    this.rasterIo = rasterIo;
    this.similarityScorer = similarityScorer;
  }

  public static void main(String[] args) {
    SettingRepository settings = new PropertiesSettingRepository();
    var application =
        new PixelCraftApplication(settings, new DiskRasterIo(settings), new SimilarityScorer());

    System.exit(application.run(args));
  }

  int run(String... args) {
    CommandLineArguments arguments;
    try {
      arguments = CommandLineArguments.parse(args);
    } catch (ParameterException e) {
      logger.error(e.getMessage());
      logger.info(CommandLineArguments.usage());
      return EXIT_USAGE;
    }

    if (arguments.isDebug()) {
      enableDebugLogging();
    }

    String filterName =
        arguments.getFilter().orElseGet(() -> settings.get(Setting.DEFAULT_FILTER, "Average"));
    int sensitivity = arguments.getSensitivity()
        .orElseGet(() -> settings.get(Setting.DEFAULT_SENSITIVITY, 16));

    try {
      FilterKind.fromName(filterName);
      SimilarityScorer.requireValidSensitivity(sensitivity);
    } catch (PixelCraftException e) {
      logger.error(e.getMessage());
      return EXIT_USAGE;
    }

    try {
      return arguments.isBatch() ? runBatch(arguments, filterName, sensitivity)
          : runSingle(arguments, filterName, sensitivity);
    } catch (PixelCraftException e) {
      logger.error(e.getMessage());
      return EXIT_FAILURES;
    }
  }

  private int runSingle(CommandLineArguments arguments, String filterName, int sensitivity) {
    var service = new ImageFilteringService(rasterIo, similarityScorer);
    FilteredImage result = service.apply(arguments.getImage(), filterName, sensitivity);
    logger.info("Similarity: {}% ({})", result.similarity(), result.similarityBand());

    if (arguments.getOutput().isPresent()) {
      service.save(result, arguments.getOutput().get());
    }

    return EXIT_OK;
  }

  private int runBatch(CommandLineArguments arguments, String filterName, int sensitivity) {
    List<Path> sources;
    try {
      sources = ImageSourceEnumerator.enumerate(arguments.getImage());
    } catch (IOException e) {
      logger.error("Could not list images in {}", arguments.getImage(), e);
      return EXIT_FAILURES;
    }
    if (sources.isEmpty()) {
      logger.error("No images found in {}", arguments.getImage());
      return EXIT_USAGE;
    }

    Path outputDirectory = arguments.getOutput()
        .orElseGet(() -> settings.get(Setting.OUTPUT_PATH, Path.of("output")));
    BatchRequest request = BatchRequest.builder().sources(sources).filter(filterName)
        .sensitivity(sensitivity).outputDirectory(outputDirectory)
        .compareWithSource(arguments.isCompare()).build();
    var run = new BatchRun(request);

    try (var coordinator = new BatchCoordinator(rasterIo, similarityScorer)) {
      BatchSummary summary = coordinator.submit(run, new LoggingBatchListener()).get();
      return summary.hasFailures() ? EXIT_FAILURES : EXIT_OK;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      run.cancel();
      return EXIT_FAILURES;
    } catch (ExecutionException e) {
      logger.error("Batch run aborted", e.getCause());
      return EXIT_FAILURES;
    }
  }

  private static void enableDebugLogging() {
    var pixelcraftLogger = LoggerFactory.getLogger("tools.pixelcraft");
    if (pixelcraftLogger instanceof ch.qos.logback.classic.Logger) {
      ((ch.qos.logback.classic.Logger) pixelcraftLogger).setLevel(Level.DEBUG);
    }
  }

  private static class LoggingBatchListener implements BatchListener {
    @Override
    public void onProgress(int percent) {
      logger.info("Progress: {}%", percent);
    }

    @Override
    public void onItemDone(BatchItem item) {
      if (item.getStatus() == BatchItemStatus.SUCCEEDED) {
        if (item.getSimilarity().isPresent()) {
          logger.info("Processed: {} (similarity {}%)", item.getOutput().getFileName(),
              item.getSimilarity().getAsInt());
        } else {
          logger.info("Processed: {}", item.getOutput().getFileName());
        }
      } else {
        logger.error("Error processing {}: {}", item.getSource(),
            item.getFailureReason().orElse("unknown error"));
      }
    }

    @Override
    public void onFinished(BatchSummary summary) {
      logger.info("Processing complete - {} of {} images processed", summary.succeeded(),
          summary.total());
    }
  }
}
