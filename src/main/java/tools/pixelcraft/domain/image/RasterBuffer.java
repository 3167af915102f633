package tools.pixelcraft.domain.image;

import java.util.Arrays;
import tools.pixelcraft.exceptions.InvalidInputException;

/**
 * Immutable single-channel raster of unsigned 8-bit intensities, stored row-major.
 *
 * <p>
 * The constructor accepts a zero-sized raster, since a decoder may legitimately produce one, but
 * every filter and the similarity scorer reject it through {@link #requireNonEmpty()}.
 */
public final class RasterBuffer {
  private final int width;
  private final int height;
  private final byte[] samples;

  /**
   * Creates a raster from raw unsigned bytes. The array is copied.
   *
   * @param width Width in pixels.
   * @param height Height in pixels.
   * @param samples Row-major samples, exactly {@code width * height} of them.
   * @throws InvalidInputException if a dimension is negative or the sample count disagrees with
   *         the dimensions.
   */
  public RasterBuffer(int width, int height, byte[] samples) {
    if (width < 0 || height < 0) {
      throw new InvalidInputException(
          String.format("Raster dimensions must not be negative, got %dx%d", width, height));
    }
    if (samples == null || (long) width * height != samples.length) {
      throw new InvalidInputException(String.format("A %dx%d raster needs %d samples, got %s",
          width, height, (long) width * height, samples == null ? "none" : samples.length));
    }

    this.width = width;
    this.height = height;
    this.samples = samples.clone();
  }

  /**
   * Creates a raster from integer samples, each of which must lie in [0,255].
   *
   * @param width Width in pixels.
   * @param height Height in pixels.
   * @param samples Row-major samples.
   * @return The new raster.
   */
  public static RasterBuffer fromSamples(int width, int height, int[] samples) {
    if (samples == null) {
      throw new InvalidInputException("Samples must not be null");
    }

    byte[] bytes = new byte[samples.length];
    for (int i = 0; i < samples.length; i++) {
      int sample = samples[i];
      if (sample < 0 || sample > 255) {
        throw new InvalidInputException(
            String.format("Sample %d at index %d is outside [0,255]", sample, i));
      }
      bytes[i] = (byte) sample;
    }

    return new RasterBuffer(width, height, bytes);
  }

  /**
   * Creates a uniform raster.
   *
   * @param width Width in pixels.
   * @param height Height in pixels.
   * @param value Intensity of every sample, in [0,255].
   * @return The new raster.
   */
  public static RasterBuffer filled(int width, int height, int value) {
    if (width < 0 || height < 0) {
      throw new InvalidInputException(
          String.format("Raster dimensions must not be negative, got %dx%d", width, height));
    }

    int[] samples = new int[width * height];
    Arrays.fill(samples, value);

    return fromSamples(width, height, samples);
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public int getSampleCount() {
    return samples.length;
  }

  public boolean isEmpty() {
    return samples.length == 0;
  }

  public int getSample(int index) {
    return samples[index] & 0xFF;
  }

  public int getSample(int x, int y) {
    return samples[y * width + x] & 0xFF;
  }

  /**
   * @return A copy of the row-major samples as unsigned values.
   */
  public int[] getSamples() {
    int[] copy = new int[samples.length];
    for (int i = 0; i < samples.length; i++) {
      copy[i] = samples[i] & 0xFF;
    }

    return copy;
  }

  /**
   * @return A copy of the raw row-major bytes.
   */
  public byte[] getBytes() {
    return samples.clone();
  }

  public boolean hasSameShapeAs(RasterBuffer other) {
    return width == other.width && height == other.height;
  }

  /**
   * Guards the entry of every filter and of the scorer.
   *
   * @return This raster, for chaining.
   * @throws InvalidInputException if the raster holds no samples.
   */
  public RasterBuffer requireNonEmpty() {
    if (isEmpty()) {
      throw new InvalidInputException(
          String.format("Raster is empty (%dx%d), nothing to process", width, height));
    }

    return this;
  }

  public double mean() {
    requireNonEmpty();
    long total = 0;
    for (byte sample : samples) {
      total += sample & 0xFF;
    }

    return (double) total / samples.length;
  }

  /**
   * @return The population variance of the samples.
   */
  public double variance() {
    double mean = mean();
    double sumOfSquares = 0;
    for (byte sample : samples) {
      double delta = (sample & 0xFF) - mean;
      sumOfSquares += delta * delta;
    }

    return sumOfSquares / samples.length;
  }

  public int distinctValues() {
    boolean[] seen = new boolean[256];
    int count = 0;
    for (byte sample : samples) {
      int value = sample & 0xFF;
      if (!seen[value]) {
        seen[value] = true;
        count++;
      }
    }

    return count;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RasterBuffer)) {
      return false;
    }

    RasterBuffer other = (RasterBuffer) obj;
    return width == other.width && height == other.height
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(samples);
  }

  @Override
  public String toString() {
    return "RasterBuffer[" + width + "x" + height + "]";
  }
}
