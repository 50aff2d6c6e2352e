/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Arguments passed to every plugin lifecycle call.
 *
 * @param data the plugin manager's shared data object, may be {@code null}
 * @param arguments extra arguments supplied by the caller of the menu callback
 */
public record PluginInput(Object data, List<Object> arguments) {

  public PluginInput {
    // arguments may contain nulls
    arguments =
        arguments == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(arguments));
  }

  /**
   * Returns the shared data when it is an instance of the requested type.
   *
   * @param type expected data type
   * @return typed data or empty when absent or of another type
   */
  public <T> Optional<T> data(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return type.isInstance(data) ? Optional.of(type.cast(data)) : Optional.empty();
  }
}
