/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigTest {

  @Test
  void stripJson5_preservesQuotedCommasWhileRemovingTrailing() throws Exception {
    String raw =
        "{\n"
            + "  \"array\": [\n"
            + "    \",]\" // note\n"
            + "  ,\n"
            + "  ],\n"
            + "  \"object\": {\n"
            + "    \"value\": \"http://example.com/*x*/\",\n"
            + "  },\n"
            + "}\n";

    String cleaned = invokeStripJson5(raw);

    JsonObject parsed = JsonParser.parseString(cleaned).getAsJsonObject();
    JsonArray array = parsed.getAsJsonArray("array");
    assertEquals(1, array.size());
    assertEquals(",]", array.get(0).getAsString(), "quoted comma should remain untouched");
    JsonObject inner = parsed.getAsJsonObject("object");
    assertEquals(
        "http://example.com/*x*/",
        inner.get("value").getAsString(),
        "comment markers inside strings should remain untouched");
  }

  @Test
  void emptyObjectUsesDefaults() {
    Config config = Config.parse("{}", null);

    assertTrue(config.menu().checkAvailabilityOnOpen());
    assertFalse(config.plugins().debug());
    assertEquals(Locale.forLanguageTag("en-US"), config.i18n().defaultLocale());
    assertEquals(List.of("en_US"), config.i18n().enabledLocales());
    assertFalse(config.log().json());
    assertEquals("INFO", config.log().level());
  }

  @Test
  void parsesCommentedBlocks() {
    String raw =
        """
        // host settings
        {
          menu: { checkAvailabilityOnOpen: false, },
          plugins: { debug: true },
          /* logging */
          core: {
            i18n: { defaultLocale: "zz_ZZ", enabledLocales: ["en_US", "zz_ZZ",], fallbackLocale: "en_US" },
            log: { json: true, level: "debug" },
          },
        }
        """;

    Config config = Config.parse(raw, null);

    assertFalse(config.menu().checkAvailabilityOnOpen());
    assertTrue(config.plugins().debug());
    assertEquals(Locale.forLanguageTag("zz-ZZ"), config.i18n().defaultLocale());
    assertEquals(List.of("en_US", "zz_ZZ"), config.i18n().enabledLocales());
    assertEquals(Locale.forLanguageTag("en-US"), config.i18n().fallbackLocale());
    assertTrue(config.log().json());
    assertEquals("debug", config.log().level());
  }

  @Test
  void debugEnvironmentOverridesFile() {
    assertTrue(Config.parse("{ plugins: { debug: false } }", "TRUE").plugins().debug());
    assertFalse(Config.parse("{ plugins: { debug: true } }", "false").plugins().debug());
    assertTrue(Config.parse("{ plugins: { debug: true } }", " ").plugins().debug());

    IllegalStateException error =
        assertThrows(IllegalStateException.class, () -> Config.parse("{}", "yes"));
    assertEquals("PLUGBAR_DEBUG must be true or false", error.getMessage());
  }

  @Test
  void rejectsInvalidValues() {
    IllegalStateException level =
        assertThrows(
            IllegalStateException.class,
            () -> Config.parse("{ core: { log: { level: \"LOUD\" } } }", null));
    assertTrue(level.getMessage().startsWith("core.log.level"));

    IllegalStateException locale =
        assertThrows(
            IllegalStateException.class,
            () -> Config.parse("{ core: { i18n: { enabledLocales: [\"1x\"] } } }", null));
    assertTrue(locale.getMessage().startsWith("core.i18n.enabledLocales"));

    IllegalStateException notObject =
        assertThrows(IllegalStateException.class, () -> Config.parse("[1, 2]", null));
    assertTrue(notObject.getMessage().startsWith("config is not a JSON5 object"));
  }

  @Test
  void loadOrWriteDefaultWritesTemplateAndExample(@TempDir Path tempDir) throws IOException {
    Path path = tempDir.resolve("config").resolve("plugbar.json5");

    Config config = Config.loadOrWriteDefault(path);

    assertTrue(Files.exists(path));
    Path example = path.resolveSibling("plugbar.json5.example");
    assertEquals(Files.readString(path), Files.readString(example));
    assertTrue(config.menu().checkAvailabilityOnOpen());
    assertEquals("INFO", config.log().level());
  }

  @Test
  void loadOrWriteDefaultKeepsExistingFile(@TempDir Path tempDir) throws IOException {
    Path path = tempDir.resolve("plugbar.json5");
    Files.writeString(path, "{ menu: { checkAvailabilityOnOpen: false } }");

    Config config = Config.loadOrWriteDefault(path);

    assertFalse(config.menu().checkAvailabilityOnOpen());
    assertEquals("{ menu: { checkAvailabilityOnOpen: false } }", Files.readString(path));
    assertTrue(Files.exists(tempDir.resolve("plugbar.json5.example")));
  }

  private static String invokeStripJson5(String raw)
      throws NoSuchMethodException, InvocationTargetException, IllegalAccessException {
    Method method = Config.class.getDeclaredMethod("stripJson5", String.class);
    method.setAccessible(true);
    return (String) method.invoke(null, raw);
  }
}
