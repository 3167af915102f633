package tools.pixelcraft;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.setting.PropertiesSettingRepository;
import tools.pixelcraft.domain.similarity.SimilarityScorer;
import tools.pixelcraft.exceptions.ImageDecodingException;
import tools.pixelcraft.exceptions.ImageNotFoundException;
import tools.pixelcraft.io.RasterIo;

@ExtendWith(MockitoExtension.class)
class PixelCraftApplicationTest {
  private static final RasterBuffer SOURCE = RasterBuffer.filled(5, 5, 90);

  @Mock
  private RasterIo mockRasterIo;
  @TempDir
  Path tempDir;

  private PixelCraftApplication application;

  @BeforeEach
  void setUp() {
    var settings = new PropertiesSettingRepository("/does-not-exist.properties");
    application = new PixelCraftApplication(settings, mockRasterIo, new SimilarityScorer());
  }

  @Test
  void whenImageOptionIsMissingThenUsageErrorIsReturned() {
    assertEquals(PixelCraftApplication.EXIT_USAGE, application.run());
  }

  @Test
  void whenOptionIsUnknownThenUsageErrorIsReturned() {
    assertEquals(PixelCraftApplication.EXIT_USAGE,
        application.run("--image", "a.png", "--recursive"));
    verifyNoInteractions(mockRasterIo);
  }

  @Test
  void whenSensitivityIsNotANumberThenUsageErrorIsReturned() {
    assertEquals(PixelCraftApplication.EXIT_USAGE,
        application.run("--image", "a.png", "--sensitivity", "high"));
  }

  @Test
  void whenFilterIsUnknownThenUsageErrorIsReturnedWithoutLoading() {
    int exitCode = application.run("--image", "a.png", "--filter", "emboss");

    assertEquals(PixelCraftApplication.EXIT_USAGE, exitCode);
    verifyNoInteractions(mockRasterIo);
  }

  @Test
  void whenSensitivityIsZeroThenUsageErrorIsReturned() {
    assertEquals(PixelCraftApplication.EXIT_USAGE,
        application.run("--image", "a.png", "--sensitivity", "0"));
  }

  @Test
  void whenSingleImageIsFilteredThenExitCodeIsOk() {
    Path image = Path.of("a.png");
    when(mockRasterIo.load(image)).thenReturn(SOURCE);

    assertEquals(PixelCraftApplication.EXIT_OK, application.run("--image", "a.png"));
  }

  @Test
  void whenSingleImageIsMissingThenFailureIsReturned() {
    Path image = Path.of("a.png");
    when(mockRasterIo.load(image)).thenThrow(new ImageNotFoundException(image));

    assertEquals(PixelCraftApplication.EXIT_FAILURES, application.run("--image", "a.png"));
  }

  @Test
  void whenSingleResultCannotBeSavedThenFailureIsReturned() {
    Path output = tempDir.resolve("result.png");
    when(mockRasterIo.load(Path.of("a.png"))).thenReturn(SOURCE);
    when(mockRasterIo.save(any(), any())).thenReturn(false);

    int exitCode = application.run("--image", "a.png", "--filter", "laplacian", "--output",
        output.toString());

    assertEquals(PixelCraftApplication.EXIT_FAILURES, exitCode);
  }

  @Test
  void whenBatchSucceedsThenEveryImageIsWrittenToTheOutputDirectory() throws IOException {
    Path input = imageDirectory("a.png", "b.jpg");
    Path output = tempDir.resolve("out");
    when(mockRasterIo.load(any())).thenReturn(SOURCE);
    when(mockRasterIo.save(any(), any())).thenReturn(true);

    int exitCode = application.run("--batch", "--image", input.toString(), "--filter", "negative",
        "--output", output.toString(), "--compare");

    assertEquals(PixelCraftApplication.EXIT_OK, exitCode);
    verify(mockRasterIo).save(any(), eq(output.resolve("a_Negative.png")));
    verify(mockRasterIo).save(any(), eq(output.resolve("b_Negative.jpg")));
  }

  @Test
  void whenBatchHasAFailedItemThenFailureIsReturned() throws IOException {
    Path input = imageDirectory("a.png", "b.png");
    when(mockRasterIo.load(input.resolve("a.png"))).thenReturn(SOURCE);
    when(mockRasterIo.load(input.resolve("b.png")))
        .thenThrow(new ImageDecodingException(input.resolve("b.png")));
    when(mockRasterIo.save(any(), any())).thenReturn(true);

    int exitCode = application.run("--batch", "--image", input.toString(), "--output",
        tempDir.resolve("out").toString());

    assertEquals(PixelCraftApplication.EXIT_FAILURES, exitCode);
  }

  @Test
  void whenBatchDirectoryHasNoImagesThenUsageErrorIsReturned() throws IOException {
    Path input = imageDirectory("notes.txt");

    int exitCode = application.run("--batch", "--image", input.toString());

    assertEquals(PixelCraftApplication.EXIT_USAGE, exitCode);
    verifyNoInteractions(mockRasterIo);
  }

  private Path imageDirectory(String... names) throws IOException {
    Path directory = Files.createDirectories(tempDir.resolve("in"));
    for (String name : names) {
      Files.createFile(directory.resolve(name));
    }

    return directory;
  }
}
