/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.testplugins.export;

import dev.plugbar.testplugins.RecordingPlugin;

public class ExportPlugin extends RecordingPlugin {
  public ExportPlugin() {
    super("Export", "Writes results to disk");
  }
}
