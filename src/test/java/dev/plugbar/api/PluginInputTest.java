/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PluginInputTest {

  @Test
  void argumentsAreCopiedAndMayContainNull() {
    List<Object> source = new ArrayList<>(Arrays.asList("frame", null));
    PluginInput input = new PluginInput("dataset", source);
    source.clear();

    assertEquals(2, input.arguments().size());
    assertNull(input.arguments().get(1));
    assertThrows(UnsupportedOperationException.class, () -> input.arguments().add("x"));
    assertTrue(new PluginInput(null, null).arguments().isEmpty());
  }

  @Test
  void typedDataAccess() {
    PluginInput input = new PluginInput(42, List.of());

    assertEquals(42, input.data(Integer.class).orElseThrow());
    assertTrue(input.data(Number.class).isPresent());
    assertTrue(input.data(String.class).isEmpty());
    assertTrue(new PluginInput(null, List.of()).data(Object.class).isEmpty());
  }
}
