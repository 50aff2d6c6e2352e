/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translation tables for menu and dialog text.
 *
 * <p>Loads {@code assets/plugbar/lang/<locale>.json} for each enabled locale. Lookups for a
 * locale that is not enabled use the default locale; keys missing from a table are looked up in
 * the fallback and then the default table. Before {@link #initialize(Config)} runs, the bundled
 * {@code en_us} table is used.
 */
public final class LocaleManager {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");
  private static final String LANG_PATH = "assets/plugbar/lang/";
  private static final String BUILTIN = "en_us";

  private static volatile Locale defaultLocale = Locale.forLanguageTag("en-US");
  private static volatile Locale fallbackLocale = Locale.forLanguageTag("en-US");
  private static volatile Map<String, LocaleBundle> localeBundles = Map.of();

  private LocaleManager() {}

  /**
   * Loads the locales enabled in the configuration.
   *
   * @param cfg runtime configuration containing i18n settings
   * @throws IllegalStateException if a locale file is missing or malformed, or the default or
   *     fallback locale is not enabled
   */
  public static synchronized void initialize(Config cfg) {
    Objects.requireNonNull(cfg, "cfg");
    Config.I18n i18n = Objects.requireNonNull(cfg.i18n(), "cfg.i18n");

    Map<String, LocaleBundle> bundles = new LinkedHashMap<>();
    ClassLoader loader = LocaleManager.class.getClassLoader();
    for (String rawCode : i18n.enabledLocales()) {
      String normalized = normalize(rawCode);
      Locale locale = Locale.forLanguageTag(rawCode.replace('_', '-'));
      bundles.put(normalized, new LocaleBundle(locale, loadTranslations(loader, normalized)));
    }

    String defaultCode = normalize(i18n.defaultLocale());
    if (!bundles.containsKey(defaultCode)) {
      throw new IllegalStateException(
          "Default locale %s is not enabled".formatted(i18n.defaultLocale().toLanguageTag()));
    }
    String fallbackCode = normalize(i18n.fallbackLocale());
    if (!bundles.containsKey(fallbackCode)) {
      throw new IllegalStateException(
          "Fallback locale %s is not enabled".formatted(i18n.fallbackLocale().toLanguageTag()));
    }

    localeBundles = Map.copyOf(bundles);
    defaultLocale = localeBundles.get(defaultCode).locale();
    fallbackLocale = localeBundles.get(fallbackCode).locale();

    LOG.info(
        "(plugbar) loaded {} locale(s); default={} fallback={}",
        localeBundles.size(),
        defaultLocale.toLanguageTag(),
        fallbackLocale.toLanguageTag());
  }

  /** Returns the configured default locale. */
  public static Locale defaultLocale() {
    return defaultLocale;
  }

  /** Resolves the provided locale to an enabled locale or the default. */
  public static Locale resolveOrDefault(Locale locale) {
    if (locale == null) {
      return defaultLocale;
    }
    LocaleBundle bundle = bundles().get(normalize(locale));
    return bundle != null ? bundle.locale() : defaultLocale;
  }

  /**
   * Resolves a translation for the key, consulting the fallback and default locales when the key
   * is absent. Unknown keys translate to themselves.
   */
  public static String translate(String key, Locale locale) {
    if (key == null || key.isBlank()) {
      return "";
    }
    Map<String, LocaleBundle> bundles = bundles();
    for (Locale candidate : new Locale[] {resolveOrDefault(locale), fallbackLocale, defaultLocale}) {
      LocaleBundle bundle = bundles.get(normalize(candidate));
      if (bundle != null && bundle.translations().containsKey(key)) {
        return bundle.translations().get(key);
      }
    }
    return key;
  }

  /** Translates the key in the default locale and formats it with the arguments. */
  public static String format(String key, Object... args) {
    return translate(key, defaultLocale).formatted(args);
  }

  static synchronized void resetForTests() {
    localeBundles = Map.of();
    defaultLocale = Locale.forLanguageTag("en-US");
    fallbackLocale = Locale.forLanguageTag("en-US");
  }

  private static Map<String, LocaleBundle> bundles() {
    Map<String, LocaleBundle> current = localeBundles;
    if (!current.isEmpty()) {
      return current;
    }
    synchronized (LocaleManager.class) {
      if (localeBundles.isEmpty()) {
        ClassLoader loader = LocaleManager.class.getClassLoader();
        localeBundles =
            Map.of(
                BUILTIN,
                new LocaleBundle(
                    Locale.forLanguageTag("en-US"), loadTranslations(loader, BUILTIN)));
      }
      return localeBundles;
    }
  }

  private static Map<String, String> loadTranslations(ClassLoader loader, String normalizedCode) {
    String resourcePath = LANG_PATH + normalizedCode + ".json";
    try (InputStream stream = loader.getResourceAsStream(resourcePath)) {
      if (stream == null) {
        throw new IllegalStateException("Missing translation file for locale: " + resourcePath);
      }
      try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
        JsonObject object = JsonParser.parseReader(reader).getAsJsonObject();
        Map<String, String> translations = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
          translations.put(entry.getKey(), entry.getValue().getAsString());
        }
        return Map.copyOf(translations);
      } catch (RuntimeException ex) {
        throw new IllegalStateException(
            "Failed to parse translation file for locale: " + resourcePath, ex);
      }
    } catch (IOException ex) {
      throw new IllegalStateException(
          "Failed to read translation file for locale: " + resourcePath, ex);
    }
  }

  private static String normalize(String code) {
    Objects.requireNonNull(code, "code");
    return code.replace('-', '_').toLowerCase(Locale.ROOT);
  }

  private static String normalize(Locale locale) {
    Objects.requireNonNull(locale, "locale");
    return normalize(locale.toLanguageTag());
  }

  private record LocaleBundle(Locale locale, Map<String, String> translations) {}
}
