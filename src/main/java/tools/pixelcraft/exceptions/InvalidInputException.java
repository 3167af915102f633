package tools.pixelcraft.exceptions;

/**
 * Thrown when a raster buffer is empty or malformed, or when a scalar argument such as the
 * sensitivity is out of its domain.
 */
public class InvalidInputException extends PixelCraftException {
  private static final long serialVersionUID = -2315940762815547719L;

  public InvalidInputException(String message) {
    super(message);
  }
}
