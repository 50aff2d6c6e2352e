/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import dev.plugbar.api.ImportResult;

/**
 * Host supplied import step for {@link DefaultPluginManager#importPlugin()}. A typical importer
 * asks the user for a plugin, registers its factory on the manager and reports the outcome.
 */
@FunctionalInterface
public interface PluginImporter {
  /** Importer for hosts that do not support installing plugins at runtime. */
  PluginImporter NONE = manager -> ImportResult.cancelled();

  /**
   * Imports a plugin into the manager.
   *
   * @param manager manager to register the imported plugin with
   * @return import outcome
   * @throws Exception if the import failed unexpectedly; reported as a failed import
   */
  ImportResult importPlugin(DefaultPluginManager manager) throws Exception;
}
