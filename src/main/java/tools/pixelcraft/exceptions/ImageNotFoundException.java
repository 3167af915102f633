package tools.pixelcraft.exceptions;

import java.nio.file.Path;

public class ImageNotFoundException extends PixelCraftException {
  private static final long serialVersionUID = -1380476271927702841L;

  public ImageNotFoundException(Path path) {
    super("Image file not found: " + path);
  }
}
