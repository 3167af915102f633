package tools.pixelcraft.domain.image;

import java.util.Locale;
import java.util.function.Supplier;
import tools.pixelcraft.domain.image.manipulations.AverageBlur;
import tools.pixelcraft.domain.image.manipulations.Laplacian;
import tools.pixelcraft.domain.image.manipulations.LogarithmThreshold;
import tools.pixelcraft.domain.image.manipulations.Negative;
import tools.pixelcraft.domain.image.manipulations.Sharpen;
import tools.pixelcraft.exceptions.UnknownFilterException;

/**
 * The closed set of filters the engine offers.
 */
public enum FilterKind {
  AVERAGE("Average", AverageBlur::new),
  SHARPEN("Sharpen", Sharpen::new),
  NEGATIVE("Negative", Negative::new),
  LAPLACIAN("Laplacian", Laplacian::new),
  LOGARITHM("Logarithm", LogarithmThreshold::new);

  private final String displayName;
  private final RasterManipulation manipulation;

  FilterKind(String displayName, Supplier<RasterManipulation> factory) {
    this.displayName = displayName;
    this.manipulation = factory.get();
  }

  /**
   * Resolves a filter from its name, ignoring case and surrounding whitespace.
   *
   * @param name A filter name such as {@code "sharpen"} or {@code "Laplacian"}.
   * @return The matching filter.
   * @throws UnknownFilterException if the name matches no filter.
   */
  public static FilterKind fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (FilterKind kind : values()) {
        if (kind.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
          return kind;
        }
      }
    }

    throw new UnknownFilterException(name);
  }

  public String getDisplayName() {
    return displayName;
  }

  public RasterBuffer apply(RasterBuffer raster) {
    return manipulation.manipulate(raster);
  }
}
