/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.Objects;
import java.util.Optional;

/** Result of {@link Plugin#isAvailable(PluginInput)}. */
public final class Availability {
  private static final Availability AVAILABLE = new Availability(true, null);

  private final boolean available;
  private final String reason;

  private Availability(boolean available, String reason) {
    this.available = available;
    this.reason = reason;
  }

  /** Returns a result indicating that the plugin can run. */
  public static Availability available() {
    return AVAILABLE;
  }

  /**
   * Returns a result indicating that the plugin cannot run right now.
   *
   * @param reason human friendly explanation, shown as the disabled item's tooltip
   */
  public static Availability unavailable(String reason) {
    return new Availability(false, Objects.requireNonNull(reason, "reason"));
  }

  /** Whether the plugin can run. */
  public boolean isAvailable() {
    return available;
  }

  /** Explanation of why the plugin is unavailable. */
  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    return available ? "available" : "unavailable(" + reason + ")";
  }
}
