package tools.pixelcraft.domain.batch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns the path given to a batch launch into the list of images to process.
 */
public class ImageSourceEnumerator {
  public static final Set<String> IMAGE_EXTENSIONS =
      Set.of("jpg", "jpeg", "png", "bmp", "tif", "tiff");

  private ImageSourceEnumerator() {}

  /**
   * Lists the images designated by a path. A directory yields its raster files (not recursively),
   * sorted by file name. Any other path, existing or not, yields itself; a missing file then fails
   * as its own batch item.
   *
   * @param path A file or a directory.
   * @return The sources, in processing order.
   * @throws IOException If the directory cannot be listed.
   */
  public static List<Path> enumerate(Path path) throws IOException {
    if (!Files.isDirectory(path)) {
      return List.of(path);
    }

    try (Stream<Path> children = Files.list(path)) {
      return children.filter(Files::isRegularFile).filter(ImageSourceEnumerator::isImage)
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .collect(Collectors.toList());
    }
  }

  static boolean isImage(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');

    return dot > 0
        && IMAGE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
