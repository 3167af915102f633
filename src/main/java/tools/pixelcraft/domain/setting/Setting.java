package tools.pixelcraft.domain.setting;

/**
 * Keys of the application settings, with the property name each one is read from.
 */
public enum Setting {
  DEFAULT_FILTER("pixelcraft.filters.default"),
  DEFAULT_SENSITIVITY("pixelcraft.filters.sensitivity"),
  CANONICAL_WIDTH("pixelcraft.processing.width"),
  CANONICAL_HEIGHT("pixelcraft.processing.height"),
  OUTPUT_PATH("pixelcraft.paths.output");

  private final String propertyName;

  Setting(String propertyName) {
    this.propertyName = propertyName;
  }

  public String getPropertyName() {
    return propertyName;
  }
}
