package tools.pixelcraft.exceptions;

import java.nio.file.Path;

public class WriteFailureException extends PixelCraftException {
  private static final long serialVersionUID = -4628797167716380123L;

  public WriteFailureException(Path path) {
    super("Failed to save processed image to " + path);
  }
}
