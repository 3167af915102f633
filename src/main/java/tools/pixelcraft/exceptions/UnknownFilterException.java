package tools.pixelcraft.exceptions;

/**
 * Thrown when a caller names a filter that does not exist. Raised before any image is touched.
 */
public class UnknownFilterException extends PixelCraftException {
  private static final long serialVersionUID = 2853006271348839254L;

  public UnknownFilterException(String filterName) {
    super("Unknown filter: " + filterName);
  }
}
