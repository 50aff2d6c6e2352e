/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link LocaleManager}. */
class LocaleManagerTest {

  @AfterEach
  void tearDown() {
    LocaleManager.resetForTests();
  }

  @Test
  void builtinTableIsUsedBeforeInitialize() {
    assertEquals("Plugins", LocaleManager.format("plugbar.menu.label"));
    assertEquals(
        "Strain Plugin failed to complete.",
        LocaleManager.format("plugbar.run.error.failed", "Strain"));
  }

  @Test
  void defaultConfigLoadsRealBundle() {
    Config config = configWithLocales("[\"en_US\"]", "en_US", "en_US");

    assertDoesNotThrow(() -> LocaleManager.initialize(config));

    assertEquals("Reload Plugins", LocaleManager.translate("plugbar.menu.reload", locale("en-US")));
  }

  @Test
  void unknownLocaleFallsBackToDefault() {
    LocaleManager.initialize(configWithLocales("[\"en_US\"]", "en_US", "en_US"));

    Locale requested = locale("fr-FR");
    assertEquals(locale("en-US"), LocaleManager.resolveOrDefault(requested));
    assertEquals("Manage Plugins", LocaleManager.translate("plugbar.menu.manage", requested));
  }

  @Test
  void missingTranslationKeyFallsBackToConfiguredFallback() {
    LocaleManager.initialize(configWithLocales("[\"en_US\", \"zz_ZZ\"]", "en_US", "zz_ZZ"));

    String translated = LocaleManager.translate("plugbar.test.onlyFallback", locale("en-US"));
    assertEquals("Fallback translation", translated);
  }

  @Test
  void defaultLocaleDrivesFormatting() {
    LocaleManager.initialize(configWithLocales("[\"en_US\", \"zz_ZZ\"]", "zz_ZZ", "en_US"));

    assertEquals(locale("zz-ZZ"), LocaleManager.defaultLocale());
    assertEquals("Zz-Plugins", LocaleManager.format("plugbar.menu.label"));
    assertEquals("Manage Plugins", LocaleManager.format("plugbar.menu.manage"));
  }

  @Test
  void unknownKeyTranslatesToItself() {
    assertEquals("plugbar.no.such.key", LocaleManager.translate("plugbar.no.such.key", null));
  }

  @Test
  void missingLocaleFileFailsFast() {
    Config config = configWithLocales("[\"qq_QQ\"]", "qq_QQ", "qq_QQ");

    assertThrows(IllegalStateException.class, () -> LocaleManager.initialize(config));
  }

  @Test
  void fallbackMustBeEnabled() {
    Config config = configWithLocales("[\"en_US\"]", "en_US", "zz_ZZ");

    IllegalStateException error =
        assertThrows(IllegalStateException.class, () -> LocaleManager.initialize(config));
    assertEquals("Fallback locale zz-ZZ is not enabled", error.getMessage());
  }

  private static Config configWithLocales(String enabled, String defaultLocale, String fallback) {
    return Config.parse(
        "{ core: { i18n: { defaultLocale: \"%s\", enabledLocales: %s, fallbackLocale: \"%s\" } } }"
            .formatted(defaultLocale, enabled, fallback),
        null);
  }

  private static Locale locale(String tag) {
    return Locale.forLanguageTag(tag);
  }
}
