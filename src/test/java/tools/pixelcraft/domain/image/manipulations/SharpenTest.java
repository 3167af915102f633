package tools.pixelcraft.domain.image.manipulations;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.image.RasterFixtures;

class SharpenTest {
  private final Sharpen sharpen = new Sharpen();

  @Test
  void whenImageIsUniformThenItIsUnchanged() {
    var uniform = RasterBuffer.filled(10, 10, 128);

    assertEquals(uniform, sharpen.manipulate(uniform));
  }

  @Test
  void whenRowIsShortThenBorderValuesComeFromMirroredNeighbours() {
    var raster = RasterBuffer.fromSamples(3, 1, new int[] {10, 20, 30});

    assertArrayEquals(new int[] {0, 20, 50}, sharpen.manipulate(raster).getSamples());
  }

  @Test
  void whenEdgeIsSharpenedThenValuesSaturateInsteadOfWrapping() {
    var square = RasterFixtures.whiteSquare(10, 4, 6);

    var sharpened = sharpen.manipulate(square);

    // Inside corner of the square: 5 * 255 - 2 * 255 overflows
    assertEquals(255, sharpened.getSample(4, 4));
    // Black pixel next to the square: -255 clamps to 0
    assertEquals(0, sharpened.getSample(3, 4));
  }

  @Test
  void whenEdgeIsSharpenedThenContrastIsNotReduced() {
    var gradient = RasterFixtures.horizontalGradient(16, 4);

    var sharpened = sharpen.manipulate(gradient);

    assertTrue(sharpened.variance() >= gradient.variance() - 1e-9);
  }
}
