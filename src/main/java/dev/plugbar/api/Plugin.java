/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.function.Consumer;

/**
 * A unit of functionality that can be launched from the plugin menu. The menu calls {@link
 * #validate(PluginInput)} and {@link #run(PluginInput)} when the user clicks the plugin's item and
 * always follows up with {@link #cleanup()}, whether or not the run succeeded.
 *
 * <p>The menu places each plugin according to its package: every enclosing package annotated with
 * {@link MenuGroup} contributes one level of submenu.
 */
public interface Plugin {
  /**
   * Label shown on the plugin's menu item.
   *
   * @return human readable plugin name
   */
  String name();

  /**
   * Help text shown as the item's tooltip while the plugin is available.
   *
   * @return plugin description, never {@code null}
   */
  String description();

  /**
   * Reports whether the plugin can currently run. Called each time the plugin menu is opened, so
   * implementations should be quick and free of side effects.
   *
   * @param input current application data plus any extra callback arguments
   * @return availability, including a reason when unavailable
   */
  default Availability isAvailable(PluginInput input) {
    return Availability.available();
  }

  /**
   * Checks the input before {@link #run(PluginInput)}. Throwing aborts the run; the exception
   * message is shown to the user.
   *
   * @param input current application data plus any extra callback arguments
   * @throws Exception if the plugin cannot run against this input
   */
  default void validate(PluginInput input) throws Exception {}

  /**
   * Performs the plugin's work.
   *
   * @param input current application data plus any extra callback arguments
   * @throws Exception if the run fails; the menu reports the message to the user
   */
  void run(PluginInput input) throws Exception;

  /**
   * Releases anything acquired during {@link #run(PluginInput)}. Invoked after every click, even
   * when validation or the run failed.
   *
   * @throws Exception if cleanup fails; failures are logged and otherwise ignored
   */
  default void cleanup() throws Exception {}

  /**
   * Publishes a status message. The menu resets the status to an empty string after a failed run.
   *
   * @param status status text, empty to clear
   */
  default void setStatus(String status) {}

  /**
   * Registers a listener for status messages published through {@link #setStatus(String)}.
   *
   * @param listener status consumer
   * @return handle that unregisters the listener when closed
   */
  default AutoCloseable onStatus(Consumer<String> listener) {
    return () -> {};
  }
}
