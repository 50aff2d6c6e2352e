/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

/** Indicates that a plugin menu operation could not be completed. */
public final class PluginMenuException extends RuntimeException {
  private final ErrorCode errorCode;

  public PluginMenuException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public PluginMenuException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode errorCode() {
    return errorCode;
  }
}
