package tools.pixelcraft.exceptions;

/**
 * Base class of every failure raised by the filtering, scoring and batch layers.
 */
public abstract class PixelCraftException extends RuntimeException {
  private static final long serialVersionUID = 6048165830142387715L;

  protected PixelCraftException(String message) {
    super(message);
  }

  protected PixelCraftException(String message, Throwable cause) {
    super(message, cause);
  }
}
