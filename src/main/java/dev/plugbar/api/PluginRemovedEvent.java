/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

/**
 * Published after a plugin has been unloaded.
 *
 * @param plugin the plugin instance that was removed
 */
public record PluginRemovedEvent(Plugin plugin) {}
