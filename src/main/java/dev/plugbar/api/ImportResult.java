/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.Objects;
import java.util.Optional;

/** Outcome of {@link PluginManager#importPlugin()}. */
public final class ImportResult {
  private static final ImportResult CANCELLED = new ImportResult(Status.CANCELLED, null, null);

  /** Import outcome. */
  public enum Status {
    INSTALLED,
    FAILED,
    CANCELLED
  }

  private final Status status;
  private final String name;
  private final String reason;

  private ImportResult(Status status, String name, String reason) {
    this.status = status;
    this.name = name;
    this.reason = reason;
  }

  /**
   * Returns a result for a successfully installed plugin.
   *
   * @param name installed plugin name, {@code null} when unknown
   */
  public static ImportResult installed(String name) {
    return new ImportResult(Status.INSTALLED, name, null);
  }

  /**
   * Returns a result for an installation that failed.
   *
   * @param name plugin name, {@code null} when unknown
   * @param reason failure description
   */
  public static ImportResult failed(String name, String reason) {
    return new ImportResult(Status.FAILED, name, Objects.requireNonNull(reason, "reason"));
  }

  /** Returns the result for an import the user cancelled. */
  public static ImportResult cancelled() {
    return CANCELLED;
  }

  public Status status() {
    return status;
  }

  public boolean isInstalled() {
    return status == Status.INSTALLED;
  }

  public boolean isCancelled() {
    return status == Status.CANCELLED;
  }

  /** Name of the imported plugin when the importer could determine it. */
  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  /** Failure description for {@link Status#FAILED} results. */
  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }
}
