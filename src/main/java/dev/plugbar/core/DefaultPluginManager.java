/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import dev.plugbar.api.ImportResult;
import dev.plugbar.api.Plugin;
import dev.plugbar.api.PluginAddedEvent;
import dev.plugbar.api.PluginManager;
import dev.plugbar.api.PluginRemovedEvent;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link PluginManager} for hosts that register plugin factories in code.
 *
 * <p>Registering a factory does not load the plugin; {@link #refresh()} instantiates every
 * registered plugin that is not loaded. Notifications are delivered synchronously on the thread
 * that changed the registry, outside of the registry lock.
 */
public final class DefaultPluginManager implements PluginManager {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");

  private final Map<Class<? extends Plugin>, PluginFactory<?>> factories = new LinkedHashMap<>();
  private final Map<Class<? extends Plugin>, Plugin> loaded = new LinkedHashMap<>();
  private final List<Consumer<PluginRemovedEvent>> removedHandlers = new CopyOnWriteArrayList<>();
  private final List<Consumer<PluginAddedEvent>> addedHandlers = new CopyOnWriteArrayList<>();
  private final PluginImporter importer;
  private volatile Object data;

  /** Creates a manager without runtime import support. */
  public DefaultPluginManager() {
    this(PluginImporter.NONE);
  }

  /**
   * Creates a manager that delegates {@link #importPlugin()} to the importer.
   *
   * @param importer host import step
   */
  public DefaultPluginManager(PluginImporter importer) {
    this.importer = Objects.requireNonNull(importer, "importer");
  }

  /**
   * Registers a plugin class instantiated through its public no-arg constructor.
   *
   * @param type plugin class
   */
  public <T extends Plugin> void register(Class<T> type) {
    Objects.requireNonNull(type, "type");
    register(type, () -> type.getDeclaredConstructor().newInstance());
  }

  /**
   * Registers a plugin factory. Re-registering a class replaces its factory but leaves a loaded
   * instance untouched until the next {@link #clear()}.
   *
   * @param type plugin class
   * @param factory creates instances of the plugin
   */
  public synchronized <T extends Plugin> void register(Class<T> type, PluginFactory<T> factory) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(factory, "factory");
    factories.put(type, factory);
    LOG.debug("(plugbar) registered plugin {}", type.getName());
  }

  /**
   * Forgets a plugin class, unloading its instance when loaded.
   *
   * @param type plugin class
   */
  public void unregister(Class<? extends Plugin> type) {
    Plugin instance;
    synchronized (this) {
      factories.remove(type);
      instance = loaded.remove(type);
    }
    if (instance != null) {
      fireRemoved(instance);
    }
  }

  /** Registered plugin classes, loaded or not, in registration order. */
  public synchronized List<Class<? extends Plugin>> registered() {
    return List.copyOf(factories.keySet());
  }

  /**
   * Replaces the data handed to plugins.
   *
   * @param data shared data, may be {@code null}
   */
  public void setData(Object data) {
    this.data = data;
  }

  @Override
  public Object data() {
    return data;
  }

  @Override
  public synchronized List<Class<? extends Plugin>> classes() {
    List<Class<? extends Plugin>> classes = new ArrayList<>(loaded.size());
    for (Plugin plugin : loaded.values()) {
      classes.add(plugin.getClass());
    }
    return List.copyOf(classes);
  }

  @Override
  public synchronized List<Plugin> plugins() {
    return List.copyOf(loaded.values());
  }

  @Override
  public ImportResult importPlugin() {
    try {
      ImportResult result = importer.importPlugin(this);
      return result != null ? result : ImportResult.cancelled();
    } catch (Exception e) {
      LOG.warn("(plugbar) plugin import failed: {}", e.getMessage(), e);
      String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      return ImportResult.failed(null, reason);
    }
  }

  @Override
  public void clear() {
    List<Plugin> removed;
    synchronized (this) {
      removed = new ArrayList<>(loaded.values());
      loaded.clear();
    }
    for (Plugin plugin : removed) {
      fireRemoved(plugin);
    }
    LOG.debug("(plugbar) cleared {} plugin(s)", removed.size());
  }

  @Override
  public void refresh() {
    List<Plugin> created = new ArrayList<>();
    synchronized (this) {
      for (Map.Entry<Class<? extends Plugin>, PluginFactory<?>> entry : factories.entrySet()) {
        Class<? extends Plugin> type = entry.getKey();
        if (loaded.containsKey(type)) {
          continue;
        }
        try {
          Plugin plugin = Objects.requireNonNull(entry.getValue().create(), "factory result");
          loaded.put(type, plugin);
          created.add(plugin);
        } catch (Exception e) {
          LOG.warn("(plugbar) failed to load plugin {}: {}", type.getName(), e.getMessage(), e);
        }
      }
    }
    for (Plugin plugin : created) {
      fireAdded(plugin);
    }
    LOG.debug("(plugbar) loaded {} plugin(s)", created.size());
  }

  @Override
  public void remove(Plugin plugin) {
    if (plugin == null) {
      return;
    }
    boolean removed = false;
    synchronized (this) {
      Iterator<Plugin> it = loaded.values().iterator();
      while (it.hasNext()) {
        if (it.next() == plugin) {
          it.remove();
          removed = true;
          break;
        }
      }
    }
    if (removed) {
      fireRemoved(plugin);
    }
  }

  @Override
  public AutoCloseable onPluginRemoved(Consumer<PluginRemovedEvent> handler) {
    Objects.requireNonNull(handler, "handler");
    removedHandlers.add(handler);
    return () -> removedHandlers.remove(handler);
  }

  @Override
  public AutoCloseable onPluginAdded(Consumer<PluginAddedEvent> handler) {
    Objects.requireNonNull(handler, "handler");
    addedHandlers.add(handler);
    return () -> addedHandlers.remove(handler);
  }

  private void fireRemoved(Plugin plugin) {
    LOG.info("(plugbar) plugin '{}' removed", plugin.name());
    dispatch(removedHandlers, new PluginRemovedEvent(plugin));
  }

  private void fireAdded(Plugin plugin) {
    LOG.info("(plugbar) plugin '{}' loaded", plugin.name());
    dispatch(addedHandlers, new PluginAddedEvent(plugin));
  }

  private <T> void dispatch(List<Consumer<T>> handlers, T event) {
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (RuntimeException e) {
        LOG.warn("(plugbar) plugin listener failed on {}: {}", event, e.getMessage(), e);
      }
    }
  }
}
