package tools.pixelcraft.domain.image;

/**
 * A pure transform from one raster to a new raster of the same width and height. Implementations
 * never modify their input.
 */
public interface RasterManipulation {
  RasterBuffer manipulate(RasterBuffer raster);
}
