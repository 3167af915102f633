package tools.pixelcraft.domain.image.manipulations;

import tools.pixelcraft.domain.image.Kernel;

/**
 * Adds the 4-neighbour high-pass response back onto the original pixel.
 */
public class Sharpen extends Convolution {
  private static final double[][] SHARPEN_KERNEL = {
      {0, -1, 0},
      {-1, 5, -1},
      {0, -1, 0}
  };

  public Sharpen() {
    super(Kernel.of(SHARPEN_KERNEL));
  }
}
