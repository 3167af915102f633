package tools.pixelcraft.domain.image.manipulations;

/**
 * Takes {@code log(1 + v)} of every sample, truncates it to an 8-bit integer and binarizes the
 * result against a threshold of 1.
 *
 * <p>
 * Since {@code log(1 + 255)} is about 5.5, the truncated logarithm only spans 0 to 5, and the
 * output is black for inputs 0 to 6 and white for 7 and above. This is the inherited behavior and
 * not a normalized log tone mapping.
 */
public class LogarithmThreshold extends PointTransform {
  static final int THRESHOLD = 1;

  @Override
  protected int map(int sample) {
    int logarithm = (int) Math.log1p(sample);

    return logarithm > THRESHOLD ? 255 : 0;
  }
}
