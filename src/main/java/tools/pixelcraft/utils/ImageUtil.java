package tools.pixelcraft.utils;

import java.awt.Graphics;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import javax.imageio.ImageIO;
import nu.pattern.OpenCV;
import org.imgscalr.Scalr;
import org.imgscalr.Scalr.Method;
import org.imgscalr.Scalr.Mode;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;
import tools.pixelcraft.domain.image.Kernel;
import tools.pixelcraft.domain.image.RasterBuffer;

/**
 * Utility class bridging {@link BufferedImage}, OpenCV {@link Mat} and {@link RasterBuffer}.
 */
public class ImageUtil {
  private ImageUtil() {}

  /**
   * Creates a greyscale copy of an image. The original is untouched. An image that is already 8-bit
   * greyscale is returned as is.
   *
   * @param image The image to make a greyscale copy of.
   * @return A greyscale copy of the image
   */
  public static BufferedImage makeGreyscaleCopy(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
      return image;
    }

    BufferedImage greyscaleImage =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
    Graphics graphics = greyscaleImage.getGraphics();
    graphics.drawImage(image, 0, 0, null);
    graphics.dispose();

    return greyscaleImage;
  }

  /**
   * Scales an image to exact dimensions, ignoring its aspect ratio. An image that already has the
   * requested dimensions is returned as is.
   *
   * @param image The image to scale.
   * @param width The target width.
   * @param height The target height.
   * @return The scaled image.
   */
  public static BufferedImage scaleToExactSize(BufferedImage image, int width, int height) {
    if (image.getWidth() == width && image.getHeight() == height) {
      return image;
    }

    return Scalr.resize(image, Method.QUALITY, Mode.FIT_EXACT, width, height);
  }

  /**
   * Reads the samples of an image into a raster, converting it to greyscale first if needed.
   *
   * @param image The image to convert.
   * @return A raster with the same dimensions.
   */
  public static RasterBuffer toRaster(BufferedImage image) {
    BufferedImage greyscale = makeGreyscaleCopy(image);
    int width = greyscale.getWidth();
    int height = greyscale.getHeight();
    int[] samples = greyscale.getRaster().getSamples(0, 0, width, height, 0, (int[]) null);

    return RasterBuffer.fromSamples(width, height, samples);
  }

  /**
   * Creates an 8-bit greyscale image holding the samples of a raster.
   *
   * @param raster The raster to convert.
   * @return A new {@link BufferedImage#TYPE_BYTE_GRAY} image.
   */
  public static BufferedImage toBufferedImage(RasterBuffer raster) {
    BufferedImage image = new BufferedImage(raster.getWidth(), raster.getHeight(),
        BufferedImage.TYPE_BYTE_GRAY);
    image.getRaster().setSamples(0, 0, raster.getWidth(), raster.getHeight(), 0,
        raster.getSamples());

    return image;
  }

  /**
   * Correlates a raster with a kernel centered on each pixel. Borders are reflected without
   * repeating the edge pixel, and sums are rounded half to even then saturated to [0,255].
   *
   * @see {@link org.opencv.imgproc.Imgproc#filter2D Linear filter}
   * @param raster The raster to filter.
   * @param kernel The weights to apply.
   * @return A new raster with the same dimensions.
   */
  public static RasterBuffer filter(RasterBuffer raster, Kernel kernel) {
    OpenCV.loadLocally();

    Mat original = toMat(raster);
    Mat weights = toMat(kernel);
    Mat processed = new Mat(original.rows(), original.cols(), original.type());
    try {
      Imgproc.filter2D(original, processed, -1, weights, new Point(-1, -1), 0,
          Core.BORDER_REFLECT_101);

      return toRaster(processed);
    } finally {
      original.release();
      weights.release();
      processed.release();
    }
  }

  /**
   * Replaces every sample of a raster by its entry in a lookup table.
   *
   * @see {@link org.opencv.core.Core#LUT Lookup table transform}
   * @param raster The raster to transform.
   * @param table 256 output samples, indexed by input sample.
   * @return A new raster with the same dimensions.
   */
  public static RasterBuffer lookUp(RasterBuffer raster, byte[] table) {
    OpenCV.loadLocally();

    Mat original = toMat(raster);
    Mat lookupTable = new Mat(1, 256, CvType.CV_8UC1);
    lookupTable.put(0, 0, table);
    Mat processed = new Mat(original.rows(), original.cols(), original.type());
    try {
      Core.LUT(original, lookupTable, processed);

      return toRaster(processed);
    } finally {
      original.release();
      lookupTable.release();
      processed.release();
    }
  }

  /**
   * Copies a raster into a single channel 8-bit OpenCV {@link Mat}.
   *
   * @param raster The raster to convert.
   * @return A new {@code CV_8UC1} mat, one row per raster row.
   */
  public static Mat toMat(RasterBuffer raster) {
    Mat mat = new Mat(raster.getHeight(), raster.getWidth(), CvType.CV_8UC1);
    mat.put(0, 0, raster.getBytes());

    return mat;
  }

  /**
   * Copies a single channel 8-bit OpenCV {@link Mat} into a raster.
   *
   * @param mat A {@code CV_8UC1} mat.
   * @return A raster with the mat's dimensions.
   */
  public static RasterBuffer toRaster(Mat mat) {
    byte[] samples = new byte[(int) mat.total()];
    mat.get(0, 0, samples);

    return new RasterBuffer(mat.cols(), mat.rows(), samples);
  }

  private static Mat toMat(Kernel kernel) {
    int size = kernel.getSize();
    Mat mat = new Mat(size, size, CvType.CV_64FC1);
    for (int row = 0; row < size; row++) {
      for (int column = 0; column < size; column++) {
        mat.put(row, column, kernel.getWeight(row, column));
      }
    }

    return mat;
  }

  /**
   * Writes an image to disk, creating parent directories as needed. The format is taken from the
   * file extension.
   *
   * @param image The image to write.
   * @param path The path to write the image to.
   * @return {@code false} if no writer exists for the extension.
   * @throws IOException If the directories or the file could not be written.
   */
  public static boolean writeToDisk(BufferedImage image, Path path) throws IOException {
    Path absolutePath = path.toAbsolutePath();
    Files.createDirectories(absolutePath.getParent());
    File imageFile = absolutePath.toFile();

    return ImageIO.write(image, formatOf(absolutePath), imageFile);
  }

  /**
   * @param path A file path.
   * @return The lower-cased extension without its dot, or an empty string.
   */
  public static String formatOf(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');

    return dot <= 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
