package tools.pixelcraft.domain.image.manipulations;

public class Negative extends PointTransform {
  @Override
  protected int map(int sample) {
    return 255 - sample;
  }
}
