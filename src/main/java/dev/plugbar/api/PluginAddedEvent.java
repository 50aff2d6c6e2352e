/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

/**
 * Published after a plugin has been loaded.
 *
 * @param plugin the plugin instance that was added
 */
public record PluginAddedEvent(Plugin plugin) {}
