package tools.pixelcraft.domain.similarity;

import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.exceptions.InvalidInputException;
import tools.pixelcraft.exceptions.ShapeMismatchException;

/**
 * Scores how closely a candidate raster follows an original one, as the rounded percentage of
 * positions whose intensities differ by at most a tolerance.
 *
 * <p>
 * The tolerance is {@code round(255 / sensitivity)}, so a <em>higher</em> sensitivity gives a
 * <em>smaller</em> tolerance and a stricter comparison: sensitivity 1 accepts any pair, 255 only
 * pairs at most one level apart. All rounding is half to even.
 */
public class SimilarityScorer {
  public static final int MIN_SENSITIVITY = 1;

  /**
   * Computes the similarity score.
   *
   * @param original The reference raster.
   * @param candidate The raster to compare, typically a filtered copy of {@code original}.
   * @param sensitivity A positive integer, conventionally one of 1, 2, 4, 16, 32, 64, 128, 255.
   * @return A score in [0,100].
   * @throws InvalidInputException if either raster is empty or the sensitivity is not positive.
   * @throws ShapeMismatchException if the rasters differ in width or height.
   */
  public int score(RasterBuffer original, RasterBuffer candidate, int sensitivity) {
    original.requireNonEmpty();
    candidate.requireNonEmpty();
    if (!original.hasSameShapeAs(candidate)) {
      throw new ShapeMismatchException(original.getWidth(), original.getHeight(),
          candidate.getWidth(), candidate.getHeight());
    }

    int tolerance = toleranceFor(sensitivity);
    int total = original.getSampleCount();
    int matches = 0;
    for (int i = 0; i < total; i++) {
      if (Math.abs(original.getSample(i) - candidate.getSample(i)) <= tolerance) {
        matches++;
      }
    }

    return (int) Math.rint(matches * 100.0 / total);
  }

  /**
   * Higher sensitivities give smaller tolerances, so the score gets stricter as sensitivity grows.
   *
   * @param sensitivity A positive integer.
   * @return The largest per-sample difference still counted as a match.
   */
  public static int toleranceFor(int sensitivity) {
    requireValidSensitivity(sensitivity);

    return (int) Math.rint(255.0 / sensitivity);
  }

  /**
   * @param sensitivity The sensitivity to check.
   * @return The sensitivity, for chaining.
   * @throws InvalidInputException if it is not positive.
   */
  public static int requireValidSensitivity(int sensitivity) {
    if (sensitivity < MIN_SENSITIVITY) {
      throw new InvalidInputException("Sensitivity must be positive, got " + sensitivity);
    }

    return sensitivity;
  }
}
