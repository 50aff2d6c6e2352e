/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import java.awt.Component;
import java.util.List;

/** User-facing dialogs raised by the plugin menu. */
public interface Dialogs {
  /**
   * Shows an error message.
   *
   * @param owner component the dialog belongs to
   * @param title dialog title
   * @param lines message lines; empty strings render as blank lines
   */
  void error(Component owner, String title, List<String> lines);

  /**
   * Shows an informational message.
   *
   * @param owner component the dialog belongs to
   * @param title dialog title
   * @param message message text
   */
  void info(Component owner, String title, String message);

  /**
   * Opens the plugin management dialog for the menu's manager.
   *
   * @param menu plugin menu that requested the dialog
   */
  void manage(PluginMenu menu);
}
