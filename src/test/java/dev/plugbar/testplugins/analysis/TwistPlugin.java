/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.testplugins.analysis;

import dev.plugbar.testplugins.RecordingPlugin;

public class TwistPlugin extends RecordingPlugin {
  public TwistPlugin() {
    super("Twist", "Computes ventricular twist");
  }
}
