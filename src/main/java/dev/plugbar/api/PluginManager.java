/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.List;
import java.util.function.Consumer;

/**
 * Registry of loaded plugins that the plugin menu mirrors. Implementations own discovery and
 * loading; the menu only reads the current state and reacts to notifications.
 *
 * <p>{@link #classes()} and {@link #plugins()} are aligned: element {@code i} of one describes
 * element {@code i} of the other. Notifications may be delivered on any thread.
 */
public interface PluginManager {
  /** Classes of the loaded plugins, in load order. */
  List<Class<? extends Plugin>> classes();

  /** Loaded plugin instances, in load order. */
  List<Plugin> plugins();

  /** Shared data handed to plugins as {@link PluginInput#data()}; may be {@code null}. */
  Object data();

  /**
   * Lets the user pick and install a plugin.
   *
   * @return install outcome; {@link ImportResult#cancelled()} when the user backed out
   */
  ImportResult importPlugin();

  /** Unloads every plugin, publishing a removal notification for each. */
  void clear();

  /** Loads every known plugin that is not currently loaded, publishing an addition for each. */
  void refresh();

  /**
   * Unloads a single plugin and publishes a removal notification. Unknown plugins are ignored.
   *
   * @param plugin plugin to unload
   */
  void remove(Plugin plugin);

  /**
   * Subscribes to plugin removals.
   *
   * @param handler removal consumer
   * @return handle that unsubscribes when closed
   */
  AutoCloseable onPluginRemoved(Consumer<PluginRemovedEvent> handler);

  /**
   * Subscribes to plugin additions.
   *
   * @param handler addition consumer
   * @return handle that unsubscribes when closed
   */
  AutoCloseable onPluginAdded(Consumer<PluginAddedEvent> handler);
}
