/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import dev.plugbar.core.Config;
import java.util.Objects;

/**
 * Behaviour switches for a {@link PluginMenu}.
 *
 * @param debug let plugin failures propagate to the caller instead of showing an error dialog
 * @param checkAvailabilityOnOpen re-check plugin availability whenever the menu is opened
 * @param dialogs dialog presenter
 * @param groups namespace-to-submenu resolution
 */
public record MenuSettings(
    boolean debug, boolean checkAvailabilityOnOpen, Dialogs dialogs, MenuGroups groups) {

  public MenuSettings {
    Objects.requireNonNull(dialogs, "dialogs");
    Objects.requireNonNull(groups, "groups");
  }

  /** Swing dialogs, annotation based groups, availability checks on open, no debugging. */
  public static MenuSettings defaults() {
    return new MenuSettings(false, true, new SwingDialogs(), MenuGroups.fromPackageAnnotations());
  }

  /**
   * Builds settings from the runtime configuration.
   *
   * @param config loaded configuration
   */
  public static MenuSettings from(Config config) {
    Objects.requireNonNull(config, "config");
    return defaults()
        .withDebug(config.plugins().debug())
        .withCheckAvailabilityOnOpen(config.menu().checkAvailabilityOnOpen());
  }

  public MenuSettings withDebug(boolean debug) {
    return new MenuSettings(debug, checkAvailabilityOnOpen, dialogs, groups);
  }

  public MenuSettings withCheckAvailabilityOnOpen(boolean check) {
    return new MenuSettings(debug, check, dialogs, groups);
  }

  public MenuSettings withDialogs(Dialogs dialogs) {
    return new MenuSettings(debug, checkAvailabilityOnOpen, dialogs, groups);
  }

  public MenuSettings withGroups(MenuGroups groups) {
    return new MenuSettings(debug, checkAvailabilityOnOpen, dialogs, groups);
  }
}
