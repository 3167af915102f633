package tools.pixelcraft.domain.image;

import tools.pixelcraft.domain.similarity.SimilarityBand;

/**
 * Outcome of filtering one image interactively: the processed raster and how much it still
 * resembles the original.
 *
 * @param original The unfiltered raster.
 * @param processed The filtered raster.
 * @param filter The filter that was applied.
 * @param sensitivity The sensitivity the similarity was computed with.
 * @param similarity The similarity score, in [0,100].
 */
public record FilteredImage(RasterBuffer original, RasterBuffer processed, FilterKind filter,
    int sensitivity, int similarity) {
  public SimilarityBand similarityBand() {
    return SimilarityBand.of(similarity);
  }
}
