/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import dev.plugbar.api.Plugin;

/** Creates plugin instances for the {@link DefaultPluginManager}. */
@FunctionalInterface
public interface PluginFactory<T extends Plugin> {
  T create() throws Exception;
}
