/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import dev.plugbar.api.Availability;
import dev.plugbar.api.ErrorCode;
import dev.plugbar.api.ImportResult;
import dev.plugbar.api.Plugin;
import dev.plugbar.api.PluginInput;
import dev.plugbar.api.PluginManager;
import dev.plugbar.api.PluginMenuException;
import dev.plugbar.core.LocaleManager;
import java.awt.Component;
import java.awt.Container;
import java.awt.event.HierarchyEvent;
import java.awt.event.HierarchyListener;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import javax.swing.JFrame;
import javax.swing.JMenu;
import javax.swing.JMenuBar;
import javax.swing.JMenuItem;
import javax.swing.JPopupMenu;
import javax.swing.JRootPane;
import javax.swing.RootPaneContainer;
import javax.swing.SwingUtilities;
import javax.swing.event.MenuEvent;
import javax.swing.event.MenuListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Menu that mirrors the plugins of a {@link PluginManager}.
 *
 * <p>Plugin items are grouped into submenus by package (see {@link MenuGroups}); each item runs
 * its plugin through validate, run and cleanup when clicked. The menu always ends with {@code
 * Manage Plugins}, a separator and {@code Reload Plugins}. Opening the menu re-checks every
 * plugin's availability, disabling unavailable items and showing the reason as their tooltip.
 *
 * <p>The menu follows the manager: removals and additions published by the manager refresh the
 * menu on the event dispatch thread. All other methods must be called on the event dispatch
 * thread, like any other Swing component.
 */
public final class PluginMenu implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");

  /** Component name of the root menu. */
  public static final String ROOT_NAME = "plugins";

  /** Client property holding the reason a plugin item is disabled. */
  public static final String UNAVAILABLE_REASON = "plugbar.unavailableReason";

  private final JMenu menu;
  private final PluginManager manager;
  private final MenuSettings settings;
  private final Map<JMenuItem, Plugin> items = new LinkedHashMap<>();
  private final Map<JMenuItem, AutoCloseable> statusSubscriptions = new HashMap<>();
  private final Map<String, JMenu> groups = new LinkedHashMap<>();
  private final List<Consumer<String>> statusListeners = new CopyOnWriteArrayList<>();
  private final MenuListener openListener = new OpenListener();
  private final HierarchyListener destroyListener = this::onHierarchyChanged;
  private final AutoCloseable removedSubscription;
  private final AutoCloseable addedSubscription;
  private JMenuItem manageItem;
  private JPopupMenu.Separator reloadSeparator;
  private JMenuItem reloadItem;
  private volatile boolean loading;
  private volatile boolean disposed;

  /**
   * Creates a {@code Plugins} menu at the end of the menu bar.
   *
   * @param manager plugin registry to mirror
   * @param bar menu bar receiving the new menu
   * @param settings menu behaviour
   */
  public PluginMenu(PluginManager manager, JMenuBar bar, MenuSettings settings) {
    this(manager, appendTo(bar), settings);
  }

  /**
   * Uses an existing menu as the plugin menu. Its current entries are kept ahead of the plugin
   * items.
   *
   * @param manager plugin registry to mirror
   * @param menu menu to fill
   * @param settings menu behaviour
   */
  public PluginMenu(PluginManager manager, JMenu menu, MenuSettings settings) {
    this.manager = Objects.requireNonNull(manager, "manager");
    this.menu = Objects.requireNonNull(menu, "menu");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.removedSubscription = manager.onPluginRemoved(event -> onRegistryChanged());
    this.addedSubscription = manager.onPluginAdded(event -> onRegistryChanged());
    menu.addMenuListener(openListener);
    menu.addHierarchyListener(destroyListener);
    initialize();
  }

  /**
   * Creates a plugin menu inside a frame, menu bar or menu.
   *
   * @param manager plugin registry to mirror
   * @param parent a {@link JFrame} or other {@link RootPaneContainer} (its menu bar is created
   *     when missing), a {@link JMenuBar} or a {@link JMenu}
   * @param settings menu behaviour
   * @return the new plugin menu
   * @throws PluginMenuException with {@link ErrorCode#INVALID_PARENT} for any other parent
   */
  public static PluginMenu attach(PluginManager manager, Object parent, MenuSettings settings) {
    if (parent instanceof RootPaneContainer window) {
      return new PluginMenu(manager, menuBarOf(window), settings);
    }
    if (parent instanceof JMenuBar bar) {
      return new PluginMenu(manager, bar, settings);
    }
    if (parent instanceof JMenu menu) {
      return new PluginMenu(manager, menu, settings);
    }
    throw new PluginMenuException(
        ErrorCode.INVALID_PARENT, "Parent must be a frame, menu bar or menu");
  }

  static JMenuBar menuBarOf(RootPaneContainer window) {
    JRootPane rootPane = window.getRootPane();
    JMenuBar bar = rootPane.getJMenuBar();
    if (bar == null) {
      bar = new JMenuBar();
      rootPane.setJMenuBar(bar);
    }
    return bar;
  }

  private static JMenu appendTo(JMenuBar bar) {
    Objects.requireNonNull(bar, "bar");
    JMenu menu = new JMenu(LocaleManager.format("plugbar.menu.label"));
    bar.add(menu);
    return menu;
  }

  /** Root menu. */
  public JMenu menu() {
    return menu;
  }

  /** Plugin registry this menu mirrors. */
  public PluginManager manager() {
    return manager;
  }

  public MenuSettings settings() {
    return settings;
  }

  /** Plugin items currently in the menu, excluding the manage and reload entries. */
  public List<JMenuItem> menus() {
    return List.copyOf(items.keySet());
  }

  /** Classes of the loaded plugins. */
  public List<Class<? extends Plugin>> classes() {
    return manager.classes();
  }

  /** Loaded plugins. */
  public List<Plugin> plugins() {
    return manager.plugins();
  }

  /** Whether the menu is being rebuilt; the root menu is disabled meanwhile. */
  public boolean isLoading() {
    return loading;
  }

  public boolean isDisposed() {
    return disposed;
  }

  JMenuItem manageItem() {
    return manageItem;
  }

  JMenuItem reloadItem() {
    return reloadItem;
  }

  /**
   * Subscribes to status messages published by the menu's plugins.
   *
   * @param listener status consumer
   * @return handle that unsubscribes when closed
   */
  public AutoCloseable onStatus(Consumer<String> listener) {
    Objects.requireNonNull(listener, "listener");
    statusListeners.add(listener);
    return () -> statusListeners.remove(listener);
  }

  /**
   * Builds the menu: ensures the manage and reload entries exist, adds items for all loaded
   * plugins and moves the manage and reload entries to the end.
   */
  public void initialize() {
    menu.setName(ROOT_NAME);
    setLoading(true);
    try {
      if (manageItem == null || !isAttached(manageItem)) {
        manageItem =
            internalItem("plugbar.menu.manage", "plugbar.menu.manage.tooltip", this::manage);
      }
      if (reloadItem == null || !isAttached(reloadItem)) {
        reloadSeparator = new JPopupMenu.Separator();
        reloadItem =
            internalItem("plugbar.menu.reload", "plugbar.menu.reload.tooltip", this::reload);
      }
      refresh();
    } finally {
      setLoading(false);
    }
  }

  /**
   * Brings the menu in line with the manager: drops items of plugins that are no longer loaded,
   * adds items for newly loaded plugins and removes submenus left empty.
   */
  public void refresh() {
    for (JMenuItem item : new ArrayList<>(items.keySet())) {
      if (!isAttached(item)) {
        detach(item);
        forget(item);
      }
    }

    Set<Plugin> live = identitySet(manager.plugins());
    Set<String> classNames = new HashSet<>();
    for (Class<? extends Plugin> type : manager.classes()) {
      classNames.add(type.getName());
    }
    for (Map.Entry<JMenuItem, Plugin> entry : new ArrayList<>(items.entrySet())) {
      JMenuItem item = entry.getKey();
      if (!classNames.contains(item.getName()) || !live.contains(entry.getValue())) {
        detach(item);
        forget(item);
      }
    }

    Set<Plugin> shown = identitySet(items.values());
    List<Plugin> missing = new ArrayList<>();
    for (Plugin plugin : manager.plugins()) {
      if (!shown.contains(plugin)) {
        missing.add(plugin);
      }
    }
    if (!missing.isEmpty()) {
      appendMenuItems(missing);
    }

    pruneEmptyGroups();
    placeInternalItems();
  }

  /**
   * Adds an item for each plugin, creating the package submenus it belongs in.
   *
   * @param plugins plugins to add
   */
  void appendMenuItems(List<? extends Plugin> plugins) {
    for (Plugin plugin : plugins) {
      JMenu parent = menu;
      for (MenuGroups.Group group : settings.groups().groupsFor(plugin.getClass())) {
        JMenu submenu = groups.get(group.packageName());
        if (submenu == null || !isAttached(submenu)) {
          submenu = new JMenu(group.label());
          submenu.setName(group.packageName());
          parent.add(submenu);
          groups.put(group.packageName(), submenu);
        }
        parent = submenu;
      }

      JMenuItem item = new JMenuItem(plugin.name());
      item.setName(plugin.getClass().getName());
      item.setToolTipText(plugin.description());
      item.addActionListener(event -> invoke(plugin));
      parent.add(item);
      items.put(item, plugin);
      statusSubscriptions.put(item, plugin.onStatus(this::fireStatus));
    }
  }

  /**
   * Runs a plugin the way a click on its item does: validate, run, then always cleanup. Failures
   * are shown in an error dialog, or rethrown when debugging is enabled.
   *
   * @param plugin plugin to run
   * @param args extra arguments appended to the plugin input
   * @return whether validate and run completed
   * @throws PluginMenuException with {@link ErrorCode#PLUGIN_FAILED} for checked plugin failures
   *     while debugging; unchecked failures are rethrown as-is
   */
  public boolean invoke(Plugin plugin, Object... args) {
    Objects.requireNonNull(plugin, "plugin");
    PluginInput input = input(args);
    try {
      if (settings.debug()) {
        runPropagating(plugin, input);
        return true;
      }
      try {
        plugin.validate(input);
        plugin.run(input);
        return true;
      } catch (Exception e) {
        reportFailure(plugin, e);
        return false;
      }
    } finally {
      cleanup(plugin);
    }
  }

  private static void runPropagating(Plugin plugin, PluginInput input) {
    try {
      plugin.validate(input);
      plugin.run(input);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new PluginMenuException(
          ErrorCode.PLUGIN_FAILED, plugin.name() + " plugin failed: " + e.getMessage(), e);
    }
  }

  private void reportFailure(Plugin plugin, Exception failure) {
    LOG.warn("(plugbar) plugin '{}' failed: {}", plugin.name(), failure.getMessage(), failure);
    plugin.setStatus("");
    settings
        .dialogs()
        .error(
            menu,
            LocaleManager.format("plugbar.run.error.title"),
            List.of(
                LocaleManager.format("plugbar.run.error.failed", plugin.name()),
                "",
                LocaleManager.format("plugbar.run.error.detail", messageOf(failure))));
  }

  private static void cleanup(Plugin plugin) {
    try {
      plugin.cleanup();
    } catch (Exception e) {
      LOG.warn(
          "(plugbar) plugin cleanup for {} was unsuccessful: {}",
          plugin.getClass().getName(),
          e.getMessage(),
          e);
    }
  }

  /**
   * Enables the items of available plugins and disables the rest, using the plugin description or
   * the unavailability reason as tooltip. Skipped while the menu is loading.
   *
   * @param args extra arguments appended to the plugin input
   */
  public void checkAvailability(Object... args) {
    if (loading) {
      return;
    }
    PluginInput input = input(args);
    for (Plugin plugin : manager.plugins()) {
      Availability availability = availabilityOf(plugin, input);
      for (JMenuItem item : itemsNamed(plugin.getClass().getName())) {
        if (availability.isAvailable()) {
          item.setEnabled(true);
          item.putClientProperty(UNAVAILABLE_REASON, null);
          item.setToolTipText(plugin.description());
        } else {
          String reason = availability.reason().orElse("");
          item.setEnabled(false);
          item.putClientProperty(UNAVAILABLE_REASON, reason);
          item.setToolTipText(reason);
        }
      }
    }
  }

  private static Availability availabilityOf(Plugin plugin, PluginInput input) {
    try {
      Availability availability = plugin.isAvailable(input);
      return availability != null ? availability : Availability.available();
    } catch (RuntimeException e) {
      LOG.warn(
          "(plugbar) availability check for '{}' failed: {}", plugin.name(), e.getMessage(), e);
      return Availability.unavailable(messageOf(e));
    }
  }

  /**
   * Unloads and reloads every plugin through the manager, including plugins that were removed
   * individually, then rebuilds the menu.
   */
  public void reload() {
    setLoading(true);
    try {
      manager.clear();
      removePluginItems();
      removeInternalItems();
      manager.refresh();
      if (!disposed) {
        reset();
      }
    } finally {
      setLoading(false);
    }
  }

  /**
   * Removes plugins by position in {@link #plugins()}. The manager's removal notification then
   * drops their items.
   *
   * @param indices zero-based plugin indices
   * @throws PluginMenuException with {@link ErrorCode#INVALID_SUBSCRIPT} if any index is out of
   *     range; nothing is removed in that case
   */
  public void remove(int... indices) {
    List<Plugin> plugins = manager.plugins();
    List<Plugin> selected = new ArrayList<>(indices.length);
    for (int index : indices) {
      if (index < 0 || index >= plugins.size()) {
        String message =
            plugins.isEmpty()
                ? "No plugins are loaded"
                : "Index must be between 0 and " + (plugins.size() - 1);
        throw new PluginMenuException(ErrorCode.INVALID_SUBSCRIPT, message);
      }
      selected.add(plugins.get(index));
    }
    for (Plugin plugin : selected) {
      manager.remove(plugin);
    }
  }

  /**
   * Rebuilds the menu from the currently loaded plugins. Unlike {@link #reload()}, plugins that
   * were removed stay removed.
   */
  public void reset() {
    removePluginItems();
    initialize();
  }

  /**
   * Asks the manager to import a plugin and reports the outcome. A successful import reloads the
   * menu.
   *
   * @return import outcome
   */
  public ImportResult importPlugin() {
    ImportResult result;
    try {
      result = manager.importPlugin();
    } catch (RuntimeException e) {
      LOG.warn("(plugbar) plugin import failed: {}", e.getMessage(), e);
      result = ImportResult.failed(null, messageOf(e));
    }
    if (result == null || result.isCancelled()) {
      return ImportResult.cancelled();
    }

    String title = LocaleManager.format("plugbar.import.title");
    String name =
        result.name().orElseGet(() -> LocaleManager.format("plugbar.import.unknownName"));
    if (result.isInstalled()) {
      LOG.info("(plugbar) plugin '{}' imported", name);
      settings.dialogs().info(menu, title, LocaleManager.format("plugbar.import.installed", name));
      reload();
    } else {
      List<String> lines = new ArrayList<>();
      lines.add(LocaleManager.format("plugbar.import.failed", name));
      result
          .reason()
          .ifPresent(
              reason -> {
                lines.add("");
                lines.add(LocaleManager.format("plugbar.run.error.detail", reason));
              });
      settings.dialogs().error(menu, title, lines);
    }
    return result;
  }

  /** Opens the plugin management dialog. */
  public void manage() {
    settings.dialogs().manage(this);
  }

  /**
   * Unsubscribes from the manager and removes the root menu from its parent. Also runs when the
   * host removes the root menu. Further calls do nothing.
   */
  @Override
  public void close() {
    if (disposed) {
      return;
    }
    disposed = true;
    closeSubscription(removedSubscription);
    closeSubscription(addedSubscription);
    statusSubscriptions.values().forEach(PluginMenu::closeSubscription);
    statusSubscriptions.clear();
    menu.removeMenuListener(openListener);
    menu.removeHierarchyListener(destroyListener);

    Container parent = menu.getParent();
    if (parent != null) {
      parent.remove(menu);
      parent.revalidate();
      parent.repaint();
    }
    LOG.debug("(plugbar) plugin menu disposed");
  }

  private void onHierarchyChanged(HierarchyEvent event) {
    if ((event.getChangeFlags() & HierarchyEvent.PARENT_CHANGED) == 0
        || event.getChanged() != menu
        || menu.getParent() != null) {
      return;
    }
    LOG.debug("(plugbar) plugin menu removed by host; disposing");
    close();
  }

  private void onRegistryChanged() {
    if (disposed) {
      return;
    }
    Runnable task =
        () -> {
          if (!disposed && !loading) {
            refresh();
          }
        };
    if (SwingUtilities.isEventDispatchThread()) {
      task.run();
    } else {
      SwingUtilities.invokeLater(task);
    }
  }

  private void setLoading(boolean loading) {
    this.loading = loading;
    menu.setEnabled(!loading);
  }

  private JMenuItem internalItem(String labelKey, String tooltipKey, Runnable action) {
    JMenuItem item = new JMenuItem(LocaleManager.format(labelKey));
    item.setName(labelKey);
    item.setToolTipText(LocaleManager.format(tooltipKey));
    item.addActionListener(event -> action.run());
    return item;
  }

  private void placeInternalItems() {
    if (manageItem == null || reloadItem == null) {
      return;
    }
    menu.remove(manageItem);
    menu.remove(reloadSeparator);
    menu.remove(reloadItem);
    menu.add(manageItem);
    menu.add(reloadSeparator);
    menu.add(reloadItem);
  }

  private void removeInternalItems() {
    for (Component internal : new Component[] {manageItem, reloadSeparator, reloadItem}) {
      if (internal != null) {
        detach(internal);
      }
    }
    manageItem = null;
    reloadSeparator = null;
    reloadItem = null;
  }

  private void removePluginItems() {
    for (JMenuItem item : new ArrayList<>(items.keySet())) {
      detach(item);
      forget(item);
    }
    for (JMenu group : groups.values()) {
      detach(group);
    }
    groups.clear();
  }

  private void pruneEmptyGroups() {
    List<String> names = new ArrayList<>(groups.keySet());
    // nested packages have longer names than their ancestors, so children are pruned first
    names.sort(Comparator.comparingInt(String::length).reversed());
    for (String name : names) {
      JMenu group = groups.get(name);
      if (!isAttached(group) || group.getMenuComponentCount() == 0) {
        detach(group);
        groups.remove(name);
      }
    }
  }

  private List<JMenuItem> itemsNamed(String name) {
    List<JMenuItem> named = new ArrayList<>();
    for (JMenuItem item : items.keySet()) {
      if (name.equals(item.getName())) {
        named.add(item);
      }
    }
    return named;
  }

  private void forget(JMenuItem item) {
    items.remove(item);
    AutoCloseable subscription = statusSubscriptions.remove(item);
    if (subscription != null) {
      closeSubscription(subscription);
    }
  }

  private void fireStatus(String status) {
    for (Consumer<String> listener : statusListeners) {
      try {
        listener.accept(status);
      } catch (RuntimeException e) {
        LOG.warn("(plugbar) status listener failed: {}", e.getMessage(), e);
      }
    }
  }

  private PluginInput input(Object... args) {
    return new PluginInput(manager.data(), args != null ? Arrays.asList(args) : List.of());
  }

  // reachable from the root menu; a submenu's children hang off its popup, whose invoker is the
  // submenu itself
  private boolean isAttached(Component component) {
    Component current = component;
    while (current != null) {
      if (current == menu) {
        return true;
      }
      Container parent = current.getParent();
      current = parent instanceof JPopupMenu popup ? popup.getInvoker() : parent;
    }
    return false;
  }

  private static void detach(Component component) {
    Container parent = component.getParent();
    if (parent != null) {
      parent.remove(component);
    }
  }

  private static <T> Set<T> identitySet(Iterable<? extends T> values) {
    Set<T> set = Collections.newSetFromMap(new IdentityHashMap<>());
    for (T value : values) {
      set.add(value);
    }
    return set;
  }

  private static String messageOf(Throwable failure) {
    return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
  }

  private static void closeSubscription(AutoCloseable subscription) {
    try {
      subscription.close();
    } catch (Exception e) {
      LOG.debug("(plugbar) failed to unsubscribe: {}", e.getMessage(), e);
    }
  }

  private final class OpenListener implements MenuListener {
    @Override
    public void menuSelected(MenuEvent event) {
      if (settings.checkAvailabilityOnOpen()) {
        checkAvailability();
      }
    }

    @Override
    public void menuDeselected(MenuEvent event) {}

    @Override
    public void menuCanceled(MenuEvent event) {}
  }
}
