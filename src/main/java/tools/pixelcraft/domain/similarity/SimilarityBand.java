package tools.pixelcraft.domain.similarity;

/**
 * Coarse reading of a similarity score, as shown next to the percentage.
 */
public enum SimilarityBand {
  LOW, MEDIUM, HIGH;

  static final int MEDIUM_FLOOR = 50;
  static final int HIGH_FLOOR = 80;

  public static SimilarityBand of(int score) {
    if (score < MEDIUM_FLOOR) {
      return LOW;
    }
    if (score < HIGH_FLOOR) {
      return MEDIUM;
    }

    return HIGH;
  }
}
