package tools.pixelcraft.exceptions;

import java.nio.file.Path;

/**
 * Thrown when a source file exists but cannot be decoded into a raster.
 */
public class ImageDecodingException extends PixelCraftException {
  private static final long serialVersionUID = 7722160980358925514L;

  public ImageDecodingException(Path path) {
    super("Unsupported or corrupt image: " + path);
  }

  public ImageDecodingException(Path path, Throwable cause) {
    super("Could not decode image " + path + ": " + cause.getMessage(), cause);
  }
}
