package tools.pixelcraft.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import tools.pixelcraft.exceptions.InvalidInputException;
import tools.pixelcraft.exceptions.UnknownFilterException;

class FilterKindTest {
  @ParameterizedTest
  @ValueSource(strings = {"laplacian", "LAPLACIAN", "Laplacian", "  laPlacian "})
  void whenNameDiffersInCaseOrWhitespaceThenFilterIsResolved(String name) {
    assertEquals(FilterKind.LAPLACIAN, FilterKind.fromName(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "blur", "negatives", "gaussian"})
  void whenNameIsUnknownThenThrow(String name) {
    assertThrows(UnknownFilterException.class, () -> FilterKind.fromName(name));
  }

  @Test
  void whenNameIsNullThenThrow() {
    assertThrows(UnknownFilterException.class, () -> FilterKind.fromName(null));
  }

  @ParameterizedTest
  @EnumSource(FilterKind.class)
  void whenFilteringThenDimensionsArePreserved(FilterKind kind) {
    var raster = RasterFixtures.noisy(37, 11, 42);

    var filtered = kind.apply(raster);

    assertEquals(37, filtered.getWidth());
    assertEquals(11, filtered.getHeight());
  }

  @ParameterizedTest
  @EnumSource(FilterKind.class)
  void whenFilteringThenInputIsLeftUntouched(FilterKind kind) {
    var raster = RasterFixtures.noisy(20, 20, 7);
    var copy = new RasterBuffer(20, 20, raster.getBytes());

    kind.apply(raster);
    kind.apply(raster);

    assertEquals(copy, raster);
  }

  @ParameterizedTest
  @EnumSource(FilterKind.class)
  void whenFilteringSinglePixelThenDimensionsArePreserved(FilterKind kind) {
    var filtered = kind.apply(RasterBuffer.filled(1, 1, 200));

    assertEquals(1, filtered.getSampleCount());
  }

  @ParameterizedTest
  @EnumSource(FilterKind.class)
  void whenRasterIsEmptyThenThrowInvalidInput(FilterKind kind) {
    assertThrows(InvalidInputException.class, () -> kind.apply(RasterFixtures.empty()));
  }
}
