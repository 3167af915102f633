package tools.pixelcraft.domain.image.manipulations;

import tools.pixelcraft.domain.image.Kernel;

/**
 * Box blur: every pixel becomes the mean of its 5x5 neighbourhood.
 */
public class AverageBlur extends Convolution {
  static final int KERNEL_SIZE = 5;

  public AverageBlur() {
    super(Kernel.box(KERNEL_SIZE));
  }
}
