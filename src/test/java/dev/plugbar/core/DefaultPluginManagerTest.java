/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.plugbar.api.AbstractPlugin;
import dev.plugbar.api.ImportResult;
import dev.plugbar.api.Plugin;
import dev.plugbar.api.PluginInput;
import dev.plugbar.testplugins.analysis.StrainPlugin;
import dev.plugbar.testplugins.analysis.TwistPlugin;
import dev.plugbar.testplugins.export.ExportPlugin;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultPluginManagerTest {

  @Test
  void refreshLoadsRegisteredPluginsInOrderOnce() {
    DefaultPluginManager manager = new DefaultPluginManager();
    List<String> added = new ArrayList<>();
    manager.onPluginAdded(event -> added.add(event.plugin().name()));
    manager.register(ExportPlugin.class);
    manager.register(StrainPlugin.class);

    assertTrue(manager.plugins().isEmpty(), "registering must not load");
    manager.refresh();
    manager.refresh();

    assertEquals(List.of("Export", "Strain"), added);
    assertEquals(List.of(ExportPlugin.class, StrainPlugin.class), manager.classes());
    assertEquals(List.of(ExportPlugin.class, StrainPlugin.class), manager.registered());
  }

  @Test
  void failingFactoriesAreSkipped() {
    DefaultPluginManager manager = new DefaultPluginManager();
    manager.register(NeedsArguments.class);
    manager.register(
        TwistPlugin.class,
        () -> {
          throw new IOException("missing calibration");
        });
    manager.register(StrainPlugin.class);

    manager.refresh();

    assertEquals(List.of(StrainPlugin.class), manager.classes());
  }

  @Test
  void removeMatchesByIdentity() {
    DefaultPluginManager manager = new DefaultPluginManager();
    manager.register(StrainPlugin.class);
    manager.refresh();
    List<Plugin> removed = new ArrayList<>();
    manager.onPluginRemoved(event -> removed.add(event.plugin()));

    manager.remove(new StrainPlugin());
    assertEquals(1, manager.plugins().size());
    assertTrue(removed.isEmpty());

    Plugin loaded = manager.plugins().get(0);
    manager.remove(loaded);
    manager.remove(loaded);

    assertTrue(manager.plugins().isEmpty());
    assertEquals(List.of(loaded), removed);
  }

  @Test
  void clearNotifiesEachPluginAndRefreshCreatesNewInstances() {
    DefaultPluginManager manager = new DefaultPluginManager();
    manager.register(StrainPlugin.class);
    manager.register(ExportPlugin.class);
    manager.refresh();
    Plugin strain = manager.plugins().get(0);
    List<String> removed = new ArrayList<>();
    manager.onPluginRemoved(event -> removed.add(event.plugin().name()));

    manager.clear();
    assertEquals(List.of("Strain", "Export"), removed);
    assertTrue(manager.classes().isEmpty());

    manager.refresh();
    assertEquals(2, manager.plugins().size());
    assertNotSame(strain, manager.plugins().get(0));
  }

  @Test
  void unregisterUnloadsPlugin() {
    DefaultPluginManager manager = new DefaultPluginManager();
    manager.register(StrainPlugin.class);
    manager.refresh();
    List<String> removed = new ArrayList<>();
    manager.onPluginRemoved(event -> removed.add(event.plugin().name()));

    manager.unregister(StrainPlugin.class);
    manager.refresh();

    assertEquals(List.of("Strain"), removed);
    assertTrue(manager.plugins().isEmpty());
    assertTrue(manager.registered().isEmpty());
  }

  @Test
  void failingListenerDoesNotStopOthers() throws Exception {
    DefaultPluginManager manager = new DefaultPluginManager();
    List<String> seen = new ArrayList<>();
    manager.onPluginAdded(
        event -> {
          throw new IllegalStateException("listener bug");
        });
    AutoCloseable subscription = manager.onPluginAdded(event -> seen.add(event.plugin().name()));
    manager.register(StrainPlugin.class);

    manager.refresh();
    assertEquals(List.of("Strain"), seen);

    subscription.close();
    manager.register(ExportPlugin.class);
    manager.refresh();
    assertEquals(List.of("Strain"), seen);
  }

  @Test
  void importDelegatesToImporter() {
    assertTrue(new DefaultPluginManager().importPlugin().isCancelled());
    assertTrue(new DefaultPluginManager(manager -> null).importPlugin().isCancelled());

    DefaultPluginManager installing =
        new DefaultPluginManager(
            manager -> {
              manager.register(ExportPlugin.class);
              return ImportResult.installed("Export");
            });
    ImportResult installed = installing.importPlugin();
    assertTrue(installed.isInstalled());
    assertEquals(List.of(ExportPlugin.class), installing.registered());

    ImportResult failed =
        new DefaultPluginManager(
                manager -> {
                  throw new IOException("archive unreadable");
                })
            .importPlugin();
    assertEquals(ImportResult.Status.FAILED, failed.status());
    assertTrue(failed.name().isEmpty());
    assertEquals("archive unreadable", failed.reason().orElseThrow());
  }

  @Test
  void dataIsSharedWithPlugins() {
    DefaultPluginManager manager = new DefaultPluginManager();
    Object data = new Object();

    manager.setData(data);

    assertSame(data, manager.data());
  }

  static final class NeedsArguments extends AbstractPlugin {
    NeedsArguments(String description) {
      super(description);
    }

    @Override
    public void run(PluginInput input) {}
  }
}
