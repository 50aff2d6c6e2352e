/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import dev.plugbar.api.MenuGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a plugin class to the chain of submenus it belongs in. Each enclosing package, outermost
 * first, that has a label contributes one submenu; unlabelled packages are skipped.
 */
public final class MenuGroups {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");

  /** Supplies the submenu label of a package, if it has one. */
  @FunctionalInterface
  public interface LabelSource {
    Optional<String> label(String packageName, ClassLoader loader);
  }

  /**
   * One submenu level.
   *
   * @param packageName package the submenu stands for; used as the submenu's component name
   * @param label submenu text
   */
  public record Group(String packageName, String label) {}

  private record Key(ClassLoader loader, String packageName) {}

  private final LabelSource source;
  private final Map<Key, Optional<String>> labels = new ConcurrentHashMap<>();

  private MenuGroups(LabelSource source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  /** Reads labels from {@link MenuGroup} annotations on {@code package-info} classes. */
  public static MenuGroups fromPackageAnnotations() {
    return new MenuGroups(MenuGroups::annotationLabel);
  }

  /**
   * Resolves labels through a host supplied source. Results are cached per class loader and
   * package.
   *
   * @param source label lookup
   */
  public static MenuGroups from(LabelSource source) {
    return new MenuGroups(source);
  }

  /**
   * Uses a fixed package-to-label table.
   *
   * @param labels submenu labels keyed by package name
   */
  public static MenuGroups fromLabels(Map<String, String> labels) {
    Map<String, String> copy = Map.copyOf(labels);
    return new MenuGroups((packageName, loader) -> Optional.ofNullable(copy.get(packageName)));
  }

  /**
   * Resolves the submenu chain for a plugin class.
   *
   * @param type plugin class
   * @return groups ordered from the outermost package inwards; empty for top-level items
   */
  public List<Group> groupsFor(Class<?> type) {
    Objects.requireNonNull(type, "type");
    return groupsFor(type.getPackageName(), type.getClassLoader());
  }

  List<Group> groupsFor(String packageName, ClassLoader loader) {
    if (packageName.isEmpty()) {
      return List.of();
    }
    List<Group> groups = new ArrayList<>();
    int from = 0;
    while (true) {
      int dot = packageName.indexOf('.', from);
      String prefix = dot < 0 ? packageName : packageName.substring(0, dot);
      label(prefix, loader).ifPresent(label -> groups.add(new Group(prefix, label)));
      if (dot < 0) {
        return List.copyOf(groups);
      }
      from = dot + 1;
    }
  }

  private Optional<String> label(String packageName, ClassLoader loader) {
    return labels.computeIfAbsent(
        new Key(loader, packageName), key -> source.label(key.packageName(), key.loader()));
  }

  static Optional<String> annotationLabel(String packageName, ClassLoader loader) {
    try {
      Class<?> info = Class.forName(packageName + ".package-info", false, loader);
      MenuGroup group = info.getAnnotation(MenuGroup.class);
      if (group == null || group.value().isBlank()) {
        return Optional.empty();
      }
      return Optional.of(group.value().trim());
    } catch (ClassNotFoundException e) {
      return Optional.empty();
    } catch (LinkageError e) {
      LOG.debug("(plugbar) unreadable package-info for {}: {}", packageName, e.getMessage());
      return Optional.empty();
    }
  }
}
