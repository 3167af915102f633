package tools.pixelcraft.domain.batch;

import java.nio.file.Path;
import tools.pixelcraft.domain.image.FilterKind;

/**
 * Decides where the filtered copy of a source image is written.
 */
@FunctionalInterface
public interface OutputNamingPolicy {
  Path outputFor(Path source, Path outputDirectory, FilterKind filter);

  /**
   * The default policy: {@code photo.jpg} filtered with Sharpen becomes
   * {@code <outputDirectory>/photo_Sharpen.jpg}.
   *
   * @return The policy.
   */
  static OutputNamingPolicy suffixWithFilterName() {
    return (source, outputDirectory, filter) -> {
      String[] parts = splitExtension(source.getFileName().toString());
      return outputDirectory.resolve(parts[0] + "_" + filter.getDisplayName() + parts[1]);
    };
  }

  /**
   * Splits a file name at its last dot. A leading dot does not start an extension, so
   * {@code .profile} has none.
   *
   * @param fileName The file name, without directories.
   * @return The base name and the extension including its dot, which may be empty.
   */
  static String[] splitExtension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    int firstNonDot = 0;
    while (firstNonDot < fileName.length() && fileName.charAt(firstNonDot) == '.') {
      firstNonDot++;
    }
    if (dot < firstNonDot) {
      return new String[] {fileName, ""};
    }

    return new String[] {fileName.substring(0, dot), fileName.substring(dot)};
  }
}
