/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar;

import dev.plugbar.api.PluginManager;
import dev.plugbar.core.Config;
import dev.plugbar.core.LocaleManager;
import dev.plugbar.core.LoggingConfigurator;
import dev.plugbar.ui.MenuSettings;
import dev.plugbar.ui.PluginMenu;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plugbar entrypoint for host applications.
 *
 * <p>Install sequence:
 *
 * <ol>
 *   <li>Load config (writes default JSON5 if missing)
 *   <li>Apply the logging block to the SLF4J backend
 *   <li>Load translations for the enabled locales
 *   <li>Attach the plugin menu to the host's frame, menu bar or menu
 * </ol>
 */
public final class Plugbar {
  /** Application id, also the logger name. */
  public static final String APP_ID = "plugbar";

  /** Default configuration location, relative to the working directory. */
  public static final Path DEFAULT_CONFIG = Path.of("config", "plugbar.json5");

  private static final Logger LOG = LoggerFactory.getLogger(APP_ID);

  private Plugbar() {}

  /**
   * Installs the plugin menu using {@link #DEFAULT_CONFIG}.
   *
   * @param parent frame, menu bar or menu receiving the plugin menu
   * @param manager plugin registry to mirror
   * @return the installed menu
   */
  public static PluginMenu install(Object parent, PluginManager manager) {
    return install(parent, manager, DEFAULT_CONFIG);
  }

  /**
   * Loads the configuration and installs the plugin menu.
   *
   * @param parent frame, menu bar or menu receiving the plugin menu
   * @param manager plugin registry to mirror
   * @param configPath configuration file
   * @return the installed menu
   */
  public static PluginMenu install(Object parent, PluginManager manager, Path configPath) {
    Objects.requireNonNull(manager, "manager");
    Config config = configure(configPath);
    PluginMenu menu = PluginMenu.attach(manager, parent, MenuSettings.from(config));
    LOG.info("(plugbar) plugin menu installed with {} plugin(s)", menu.plugins().size());
    return menu;
  }

  /**
   * Loads the configuration and applies its logging and locale blocks.
   *
   * @param configPath configuration file
   * @return the loaded configuration
   */
  public static Config configure(Path configPath) {
    Objects.requireNonNull(configPath, "configPath");
    Config config = Config.loadOrWriteDefault(configPath);
    LoggingConfigurator.configure(config.log());
    LocaleManager.initialize(config);
    if (config.plugins().debug()) {
      LOG.info("(plugbar) plugin debugging enabled; plugin failures will propagate");
    }
    return config;
  }
}
