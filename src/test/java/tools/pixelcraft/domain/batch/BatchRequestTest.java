package tools.pixelcraft.domain.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.pixelcraft.domain.image.FilterKind;
import tools.pixelcraft.exceptions.InvalidInputException;
import tools.pixelcraft.exceptions.UnknownFilterException;

class BatchRequestTest {
  private static final Path OUTPUT = Path.of("out");

  @Test
  void whenFilterNameIsGivenThenItIsResolvedIgnoringCase() {
    var request = BatchRequest.of(List.of(Path.of("a.png")), "sHaRpEn", 32, OUTPUT);

    assertEquals(FilterKind.SHARPEN, request.getFilter());
    assertEquals(32, request.getSensitivity());
    assertEquals(OUTPUT, request.getOutputDirectory());
    assertFalse(request.isCompareWithSource());
  }

  @Test
  void whenFilterNameIsUnknownThenRequestIsRejected() {
    assertThrows(UnknownFilterException.class,
        () -> BatchRequest.of(List.of(Path.of("a.png")), "emboss", 16, OUTPUT));
  }

  @Test
  void whenNoSourceIsGivenThenRequestIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> BatchRequest.of(List.of(), "average", 16, OUTPUT));
  }

  @Test
  void whenSensitivityIsNotPositiveThenRequestIsRejected() {
    assertThrows(InvalidInputException.class,
        () -> BatchRequest.of(List.of(Path.of("a.png")), "average", 0, OUTPUT));
  }

  @Test
  void whenOutputDirectoryIsMissingThenRequestIsRejected() {
    assertThrows(NullPointerException.class,
        () -> BatchRequest.builder().source(Path.of("a.png")).filter(FilterKind.AVERAGE).build());
  }

  @Test
  void whenSourceIsAddedTwiceThenItKeepsItsFirstPosition() {
    var request = BatchRequest.builder()
        .sources(List.of(Path.of("b.png"), Path.of("a.png"), Path.of("b.png")))
        .source(Path.of("c.png")).source(Path.of("a.png")).filter(FilterKind.NEGATIVE)
        .outputDirectory(OUTPUT).build();

    assertEquals(List.of(Path.of("b.png"), Path.of("a.png"), Path.of("c.png")),
        request.getSources());
  }

  @Test
  void whenNamingPolicyIsCustomThenRunItemsUseIt() {
    var request = BatchRequest.builder().source(Path.of("in", "photo.jpg"))
        .filter(FilterKind.LOGARITHM).outputDirectory(OUTPUT)
        .namingPolicy((source, directory, filter) -> directory.resolve("custom.png")).build();

    var run = new BatchRun(request);

    assertEquals(OUTPUT.resolve("custom.png"), run.getItems().get(0).getOutput());
  }
}
