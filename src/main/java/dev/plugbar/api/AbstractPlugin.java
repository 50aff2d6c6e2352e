/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base class for plugins that keeps the status plumbing out of implementations. */
public abstract class AbstractPlugin implements Plugin {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");

  private final String name;
  private final String description;
  private final List<Consumer<String>> statusListeners = new CopyOnWriteArrayList<>();
  private volatile String status = "";

  /**
   * Creates a plugin named after its simple class name.
   *
   * @param description tooltip text shown while the plugin is available
   */
  protected AbstractPlugin(String description) {
    this(null, description);
  }

  /**
   * Creates a plugin with an explicit name.
   *
   * @param name menu label, or {@code null} to use the simple class name
   * @param description tooltip text shown while the plugin is available
   */
  protected AbstractPlugin(String name, String description) {
    this.name = name != null ? name : getClass().getSimpleName();
    this.description = Objects.requireNonNull(description, "description");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String description() {
    return description;
  }

  /** Last status published by this plugin. */
  public String status() {
    return status;
  }

  @Override
  public void setStatus(String status) {
    String next = status != null ? status : "";
    this.status = next;
    for (Consumer<String> listener : statusListeners) {
      try {
        listener.accept(next);
      } catch (RuntimeException e) {
        LOG.warn("(plugbar) status listener for {} failed: {}", name, e.getMessage(), e);
      }
    }
  }

  @Override
  public AutoCloseable onStatus(Consumer<String> listener) {
    Objects.requireNonNull(listener, "listener");
    statusListeners.add(listener);
    return () -> statusListeners.remove(listener);
  }

  @Override
  public String toString() {
    return name;
  }
}
