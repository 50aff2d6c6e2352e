/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AbstractPluginTest {

  @Test
  void nameDefaultsToSimpleClassName() {
    Smoothing plugin = new Smoothing();

    assertEquals("Smoothing", plugin.name());
    assertEquals("Smooths contours", plugin.description());
    assertTrue(plugin.isAvailable(new PluginInput(null, List.of())).isAvailable());
  }

  @Test
  void statusListenersReceiveUpdatesUntilClosed() throws Exception {
    Smoothing plugin = new Smoothing();
    List<String> seen = new ArrayList<>();
    plugin.onStatus(
        status -> {
          throw new IllegalStateException("listener bug");
        });
    AutoCloseable subscription = plugin.onStatus(seen::add);

    plugin.setStatus("Smoothing 3/10");
    plugin.setStatus(null);
    subscription.close();
    plugin.setStatus("done");

    assertEquals(List.of("Smoothing 3/10", ""), seen);
    assertEquals("done", plugin.status());
  }

  @Test
  void unavailableCarriesReason() {
    Availability unavailable = Availability.unavailable("No dataset loaded");

    assertFalse(unavailable.isAvailable());
    assertEquals("No dataset loaded", unavailable.reason().orElseThrow());
    assertTrue(Availability.available().reason().isEmpty());
  }

  static final class Smoothing extends AbstractPlugin {
    Smoothing() {
      super("Smooths contours");
    }

    @Override
    public void run(PluginInput input) {}
  }
}
