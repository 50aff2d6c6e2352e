/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Runtime configuration loaded from {@code config/plugbar.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first start.
 *   <li>Emits a {@code plugbar.json5.example} snapshot next to the config.
 *   <li>Supports the {@code PLUGBAR_DEBUG} environment override for plugin debugging.
 *   <li>Parses menu, plugin, i18n and logging blocks.
 * </ul>
 */
public final class Config {

  static final String DEBUG_ENV = "PLUGBAR_DEBUG";

  private static final String TEMPLATE =
      """
      // Plugbar v1.0.0 configuration (JSON5 with comments)
      // Drop into config/plugbar.json5. Environment overrides: PLUGBAR_DEBUG.
      {
        menu: {
          // Re-run every plugin's availability check each time the Plugins menu opens
          checkAvailabilityOnOpen: true
        },
        plugins: {
          // When true, plugin failures propagate to the caller instead of an error dialog
          debug: false
        },
        core: {
          i18n: {
            defaultLocale: "en_US",
            enabledLocales: [ "en_US" ],
            fallbackLocale: "en_US"
          },
          log: {
            json: false,
            level: "INFO"
          }
        }
      }
      """;

  private final Menu menu;
  private final Plugins plugins;
  private final I18n i18n;
  private final Log log;

  private Config(Menu menu, Plugins plugins, I18n i18n, Log log) {
    this.menu = menu;
    this.plugins = plugins;
    this.i18n = i18n;
    this.log = log;
  }

  /**
   * Menu behaviour.
   *
   * @return menu settings
   */
  public Menu menu() {
    return menu;
  }

  /**
   * Plugin invocation settings.
   *
   * @return plugin settings
   */
  public Plugins plugins() {
    return plugins;
  }

  /**
   * Localization configuration.
   *
   * @return i18n settings
   */
  public I18n i18n() {
    return i18n;
  }

  /**
   * Logging configuration.
   *
   * @return logging configuration block
   */
  public Log log() {
    return log;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    Objects.requireNonNull(path, "path");
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("plugbar.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }

      return parse(Files.readString(path, StandardCharsets.UTF_8), System.getenv(DEBUG_ENV));
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /**
   * Returns the configuration described by the bundled template.
   *
   * @return default config
   */
  public static Config defaults() {
    return parse(TEMPLATE, System.getenv(DEBUG_ENV));
  }

  static Config parse(String raw, String debugOverride) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalStateException("config is not a JSON5 object: " + e.getMessage(), e);
    }

    Menu menu = parseMenu(optObject(root, "menu"));
    Plugins plugins = parsePlugins(optObject(root, "plugins"), debugOverride);
    JsonObject core = optObject(root, "core");
    I18n i18n = parseI18n(core != null ? optObject(core, "i18n") : null);
    Log log = parseLog(core != null ? optObject(core, "log") : null);

    Config config = new Config(menu, plugins, i18n, log);
    validate(config);
    return config;
  }

  /** Drops comments and trailing commas; quoted text is copied untouched. */
  private static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == '"' || c == '\'') {
        int end = skipString(raw, i);
        out.append(raw, i, end);
        i = end;
      } else if (raw.startsWith("//", i)) {
        int eol = raw.indexOf('\n', i);
        i = eol < 0 ? raw.length() : eol;
      } else if (raw.startsWith("/*", i)) {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? raw.length() : close + 2;
      } else if (c == ',' && closesNext(raw, i + 1)) {
        i++;
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }

  private static int skipString(String raw, int start) {
    char quote = raw.charAt(start);
    int i = start + 1;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        i++;
      }
    }
    return raw.length();
  }

  // whether only whitespace and comments separate this position from a closing bracket
  private static boolean closesNext(String raw, int from) {
    int i = from;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (raw.startsWith("//", i)) {
        int eol = raw.indexOf('\n', i);
        i = eol < 0 ? raw.length() : eol;
      } else if (raw.startsWith("/*", i)) {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? raw.length() : close + 2;
      } else {
        return c == '}' || c == ']';
      }
    }
    return false;
  }

  private static Menu parseMenu(JsonObject menu) {
    return new Menu(optBoolean(menu, "checkAvailabilityOnOpen", true));
  }

  private static Plugins parsePlugins(JsonObject plugins, String debugOverride) {
    boolean debug = optBoolean(plugins, "debug", false);
    if (debugOverride != null && !debugOverride.isBlank()) {
      String value = debugOverride.trim();
      if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
        throw new IllegalStateException(DEBUG_ENV + " must be true or false");
      }
      debug = Boolean.parseBoolean(value);
    }
    return new Plugins(debug);
  }

  private static I18n parseI18n(JsonObject i18n) {
    if (i18n == null) {
      return new I18n(
          Locale.forLanguageTag("en-US"), List.of("en_US"), Locale.forLanguageTag("en-US"));
    }
    String def = optString(i18n, "defaultLocale", "en_US");
    String fallback = optString(i18n, "fallbackLocale", def);
    List<String> enabled = new ArrayList<>();
    if (i18n.has("enabledLocales") && i18n.get("enabledLocales").isJsonArray()) {
      for (JsonElement el : i18n.get("enabledLocales").getAsJsonArray()) {
        enabled.add(el.getAsString());
      }
    } else {
      enabled.add(def);
    }
    if (enabled.isEmpty()) enabled.add(def);
    return new I18n(locale(def), List.copyOf(enabled), locale(fallback));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static Locale locale(String code) {
    Objects.requireNonNull(code, "locale");
    return Locale.forLanguageTag(code.replace('_', '-'));
  }

  private static void validate(Config cfg) {
    validateI18n(cfg.i18n());
    validateLog(cfg.log());
  }

  private static void validateI18n(I18n i18n) {
    for (String code : i18n.enabledLocales()) {
      if (code == null || !code.matches("[A-Za-z]{2,3}([_-][A-Za-z0-9]{2,8})*")) {
        throw new IllegalStateException("core.i18n.enabledLocales contains invalid code: " + code);
      }
    }
    if (i18n.defaultLocale().getLanguage().isEmpty()) {
      throw new IllegalStateException("core.i18n.defaultLocale is invalid");
    }
    if (i18n.fallbackLocale().getLanguage().isEmpty()) {
      throw new IllegalStateException("core.i18n.fallbackLocale is invalid");
    }
  }

  private static void validateLog(Log log) {
    String level = log.level();
    if (level == null || level.isBlank()) {
      throw new IllegalStateException("core.log.level must not be blank");
    }
    switch (level.trim().toUpperCase(Locale.ROOT)) {
      case "TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF", "ALL" -> {}
      default -> throw new IllegalStateException("core.log.level is invalid: " + level);
    }
  }

  /**
   * Menu behaviour.
   *
   * @param checkAvailabilityOnOpen whether opening the menu re-evaluates plugin availability
   */
  public record Menu(boolean checkAvailabilityOnOpen) {}

  /**
   * Plugin invocation settings.
   *
   * @param debug whether plugin failures propagate instead of being shown in a dialog
   */
  public record Plugins(boolean debug) {}

  /**
   * Localization configuration.
   *
   * @param defaultLocale locale used for menu and dialog text
   * @param enabledLocales locales bundled with the application
   * @param fallbackLocale locale used when a translation key is missing
   */
  public record I18n(Locale defaultLocale, List<String> enabledLocales, Locale fallbackLocale) {}

  /**
   * Logging configuration.
   *
   * @param json whether console output is one JSON object per line
   * @param level root log level
   */
  public record Log(boolean json, String level) {}
}
