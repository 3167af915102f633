package tools.pixelcraft.domain.setting;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only settings loaded from a classpath properties file. JVM system properties with the same
 * names take precedence over the file.
 */
public class PropertiesSettingRepository implements SettingRepository {
  private static final Logger logger = LoggerFactory.getLogger(PropertiesSettingRepository.class);
  static final String DEFAULT_RESOURCE = "/pixelcraft.properties";

  private final Properties properties;

  /**
   * Creates a repository from the bundled {@code pixelcraft.properties}.
   */
  public PropertiesSettingRepository() {
    this(DEFAULT_RESOURCE);
  }

  /**
   * Creates a repository from a classpath resource.
   *
   * @param resourcePath Absolute resource path, starting with a slash. A missing resource leaves
   *        the repository empty, so every lookup falls back to its default.
   */
  public PropertiesSettingRepository(String resourcePath) {
    this.properties = new Properties();

    try (InputStream is = PropertiesSettingRepository.class.getResourceAsStream(resourcePath)) {
      if (is == null) {
        logger.info("No settings resource {}, using defaults", resourcePath);
      } else {
        properties.load(is);
        logger.debug("Settings loaded from {}", resourcePath);
      }
    } catch (IOException e) {
      logger.error("Could not read settings from {}, using defaults", resourcePath, e);
    }
  }

  @Override
  public String get(Setting setting) {
    String override = System.getProperty(setting.getPropertyName());
    if (override != null) {
      return override;
    }

    return properties.getProperty(setting.getPropertyName());
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T get(Setting setting, T defaultValue) {
    String value = get(setting);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    if (defaultValue == null) {
      return (T) value;
    }

    try {
      if (defaultValue instanceof Integer) {
        return (T) Integer.valueOf(value.trim());
      }
      if (defaultValue instanceof Boolean) {
        return (T) Boolean.valueOf(value.trim());
      }
      if (defaultValue instanceof Path) {
        return (T) Path.of(value.trim());
      }
      return (T) value.trim();
    } catch (RuntimeException e) {
      logger.warn("Invalid value '{}' for setting {}, using {}", value, setting, defaultValue);
      return defaultValue;
    }
  }
}
