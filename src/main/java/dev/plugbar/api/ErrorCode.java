/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

/** Error codes carried by {@link PluginMenuException}. */
public enum ErrorCode {
  /** Menu parent is not a frame, menu bar or menu. */
  INVALID_PARENT,

  /** Plugin index is outside the loaded plugin range. */
  INVALID_SUBSCRIPT,

  /** A plugin's validate or run step failed while debugging is enabled. */
  PLUGIN_FAILED
}
