package tools.pixelcraft.domain.image;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.pixelcraft.domain.similarity.SimilarityScorer;
import tools.pixelcraft.exceptions.WriteFailureException;
import tools.pixelcraft.io.RasterIo;

/**
 * Single-image entry point: loads an image, filters it and scores the result against the
 * original. Unlike batch processing, every failure is propagated to the caller.
 */
public class ImageFilteringService {
  private static final Logger logger = LoggerFactory.getLogger(ImageFilteringService.class);

  private final RasterIo rasterIo;
  private final SimilarityScorer similarityScorer;

  /**
   * Creates a new instance of the service.
   *
   * @param rasterIo Image loader and writer.
   * @param similarityScorer Scorer used to compare each result with its original.
   */
  public ImageFilteringService(RasterIo rasterIo, SimilarityScorer similarityScorer) {
    this.rasterIo = rasterIo;
    this.similarityScorer = similarityScorer;
  }

  /**
   * Loads and filters an image. The filter name is resolved before the image is read.
   *
   * @param source The image file.
   * @param filterName Case-insensitive filter name.
   * @param sensitivity Similarity sensitivity, positive.
   * @return The filtered image and its similarity to the loaded original.
   */
  public FilteredImage apply(Path source, String filterName, int sensitivity) {
    FilterKind filter = FilterKind.fromName(filterName);
    RasterBuffer original = rasterIo.load(source);

    return apply(original, filter, sensitivity);
  }

  /**
   * Filters a raster already in memory. The original raster is left untouched.
   *
   * @param original The raster to filter.
   * @param filter The filter to apply.
   * @param sensitivity Similarity sensitivity, positive.
   * @return The filtered image and its similarity to {@code original}.
   */
  public FilteredImage apply(RasterBuffer original, FilterKind filter, int sensitivity) {
    SimilarityScorer.requireValidSensitivity(sensitivity);
    RasterBuffer processed = filter.apply(original);
    int similarity = similarityScorer.score(original, processed, sensitivity);
    logger.info("Applied {} filter with sensitivity {}: similarity {}%", filter.getDisplayName(),
        sensitivity, similarity);

    return new FilteredImage(original, processed, filter, sensitivity, similarity);
  }

  /**
   * Saves the processed raster of a result.
   *
   * @param image The result to save.
   * @param destination The destination file.
   * @throws WriteFailureException if the image could not be written.
   */
  public void save(FilteredImage image, Path destination) {
    if (!rasterIo.save(image.processed(), destination)) {
      throw new WriteFailureException(destination);
    }
    logger.info("Saved processed image to {}", destination);
  }
}
