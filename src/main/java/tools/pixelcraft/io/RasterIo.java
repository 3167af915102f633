package tools.pixelcraft.io;

import java.nio.file.Path;
import tools.pixelcraft.domain.image.RasterBuffer;

/**
 * Codec boundary of the engine: decodes files into greyscale rasters and encodes them back.
 */
public interface RasterIo {
  /**
   * Loads an image as a greyscale raster at the canonical processing size.
   *
   * @param path The source file.
   * @return The decoded, resized raster.
   * @throws tools.pixelcraft.exceptions.ImageNotFoundException if the file does not exist.
   * @throws tools.pixelcraft.exceptions.ImageDecodingException if the file cannot be decoded.
   */
  RasterBuffer load(Path path);

  /**
   * Saves a raster, creating parent directories as needed.
   *
   * @param raster The raster to save.
   * @param path The destination, whose extension selects the format.
   * @return Whether the image was written.
   */
  boolean save(RasterBuffer raster, Path path);
}
