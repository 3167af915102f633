package tools.pixelcraft.domain.image.manipulations;

import tools.pixelcraft.domain.image.Kernel;

/**
 * Discrete 4-neighbour Laplacian. Flat regions go to 0; negative responses are clipped, so only
 * the bright side of an edge survives.
 */
public class Laplacian extends Convolution {
  private static final double[][] LAPLACIAN_KERNEL = {
      {0, 1, 0},
      {1, -4, 1},
      {0, 1, 0}
  };

  public Laplacian() {
    super(Kernel.of(LAPLACIAN_KERNEL));
  }
}
