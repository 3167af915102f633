package tools.pixelcraft.io;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.setting.Setting;
import tools.pixelcraft.domain.setting.SettingRepository;
import tools.pixelcraft.exceptions.ImageDecodingException;
import tools.pixelcraft.exceptions.ImageNotFoundException;
import tools.pixelcraft.utils.ImageUtil;

/**
 * {@link RasterIo} on top of {@link ImageIO}. Loaded images are resized to the canonical size
 * before being converted to greyscale.
 */
public class DiskRasterIo implements RasterIo {
  private static final Logger logger = LoggerFactory.getLogger(DiskRasterIo.class);
  public static final int DEFAULT_CANONICAL_SIZE = 450;

  private final int canonicalWidth;
  private final int canonicalHeight;

  /**
   * Creates an instance using the 450x450 canonical size.
   */
  public DiskRasterIo() {
    this(DEFAULT_CANONICAL_SIZE, DEFAULT_CANONICAL_SIZE);
  }

  /**
   * Creates an instance using the canonical size found in the settings.
   *
   * @param settings Settings repository.
   */
  public DiskRasterIo(SettingRepository settings) {
    this(settings.get(Setting.CANONICAL_WIDTH, DEFAULT_CANONICAL_SIZE),
        settings.get(Setting.CANONICAL_HEIGHT, DEFAULT_CANONICAL_SIZE));
  }

  public DiskRasterIo(int canonicalWidth, int canonicalHeight) {
    if (canonicalWidth <= 0 || canonicalHeight <= 0) {
      throw new IllegalArgumentException(String.format(
          "Canonical size must be positive, got %dx%d", canonicalWidth, canonicalHeight));
    }

    this.canonicalWidth = canonicalWidth;
    this.canonicalHeight = canonicalHeight;
  }

  @Override
  public RasterBuffer load(Path path) {
    if (!Files.exists(path)) {
      throw new ImageNotFoundException(path);
    }

    BufferedImage image;
    try {
      image = read(path);
    } catch (IOException | RuntimeException e) {
      throw new ImageDecodingException(path, e);
    }
    if (image == null) {
      throw new ImageDecodingException(path);
    }

    logger.debug("Read {} ({}x{})", path, image.getWidth(), image.getHeight());
    try {
      BufferedImage resized = ImageUtil.scaleToExactSize(image, canonicalWidth, canonicalHeight);

      return ImageUtil.toRaster(resized);
    } catch (RuntimeException e) {
      throw new ImageDecodingException(path, e);
    }
  }

  /**
   * @return The decoded image, or {@code null} if no reader understands the file.
   */
  BufferedImage read(Path path) throws IOException {
    return ImageIO.read(path.toFile());
  }

  @Override
  public boolean save(RasterBuffer raster, Path path) {
    try {
      boolean written = ImageUtil.writeToDisk(ImageUtil.toBufferedImage(raster), path);
      if (!written) {
        logger.warn("No image writer for format '{}' of {}", ImageUtil.formatOf(path), path);
      }
      return written;
    } catch (IOException e) {
      logger.error("There was an error writing {} to disk", path, e);
      return false;
    }
  }

  public int getCanonicalWidth() {
    return canonicalWidth;
  }

  public int getCanonicalHeight() {
    return canonicalHeight;
  }
}
