package tools.pixelcraft.domain.image.manipulations;

import tools.pixelcraft.domain.image.RasterBuffer;
import tools.pixelcraft.domain.image.RasterManipulation;
import tools.pixelcraft.utils.ImageUtil;

/**
 * A manipulation where every output sample depends only on the input sample at the same position.
 * The mapping is tabulated once for the 256 possible inputs.
 */
public abstract class PointTransform implements RasterManipulation {
  private byte[] lookupTable;

  /**
   * @param sample An input intensity in [0,255].
   * @return The output intensity, in [0,255].
   */
  protected abstract int map(int sample);

  @Override
  public RasterBuffer manipulate(RasterBuffer raster) {
    return ImageUtil.lookUp(raster.requireNonEmpty(), getLookupTable());
  }

  private synchronized byte[] getLookupTable() {
    if (lookupTable == null) {
      byte[] table = new byte[256];
      for (int sample = 0; sample < 256; sample++) {
        table[sample] = (byte) map(sample);
      }
      lookupTable = table;
    }

    return lookupTable;
  }
}
