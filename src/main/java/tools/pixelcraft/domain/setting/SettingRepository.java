package tools.pixelcraft.domain.setting;

/**
 * Typed access to the application settings.
 */
public interface SettingRepository {
  /**
   * Reads a setting, converting it to the type of the default value.
   *
   * @param <T> The setting type. {@link String}, {@link Integer}, {@link Boolean} and
   *        {@link java.nio.file.Path} are supported.
   * @param setting The setting to read.
   * @param defaultValue Returned when the setting is absent or cannot be converted.
   * @return The setting value.
   */
  <T> T get(Setting setting, T defaultValue);

  /**
   * Reads a setting as a raw string.
   *
   * @param setting The setting to read.
   * @return The value, or {@code null} if absent.
   */
  String get(Setting setting);
}
