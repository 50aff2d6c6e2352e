/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.testplugins.analysis.regional;

import dev.plugbar.testplugins.RecordingPlugin;

public class SegmentPlugin extends RecordingPlugin {
  public SegmentPlugin() {
    super("Segment", "Splits the myocardium into segments");
  }
}
