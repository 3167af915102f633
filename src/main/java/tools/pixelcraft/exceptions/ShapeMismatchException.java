package tools.pixelcraft.exceptions;

public class ShapeMismatchException extends PixelCraftException {
  private static final long serialVersionUID = 4101896413652207034L;

  /**
   * Creates a new exception describing the two disagreeing shapes.
   *
   * @param firstWidth Width of the first buffer.
   * @param firstHeight Height of the first buffer.
   * @param secondWidth Width of the second buffer.
   * @param secondHeight Height of the second buffer.
   */
  public ShapeMismatchException(int firstWidth, int firstHeight, int secondWidth,
      int secondHeight) {
    super(String.format("Cannot compare a %dx%d raster with a %dx%d raster", firstWidth,
        firstHeight, secondWidth, secondHeight));
  }
}
