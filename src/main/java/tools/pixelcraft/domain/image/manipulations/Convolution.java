package tools.pixelcraft.domain.image.manipulations;

import tools.pixelcraft.domain.image.Kernel;
import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.image.RasterManipulation;
import tools.pixelcraft.utils.ImageUtil;

/**
 * Slides a {@link Kernel} over a raster and writes the weighted neighbourhood sum of every pixel.
 * Neighbours outside the raster are mirrored across the edge without repeating the edge pixel
 * ({@code gfedcb|abcdefgh|gfedcba}). Sums are rounded half to even and saturated to [0,255].
 */
public class Convolution implements RasterManipulation {
  private final Kernel kernel;

  public Convolution(Kernel kernel) {
    this.kernel = kernel;
  }

  @Override
  public RasterBuffer manipulate(RasterBuffer raster) {
    return ImageUtil.filter(raster.requireNonEmpty(), kernel);
  }
}
