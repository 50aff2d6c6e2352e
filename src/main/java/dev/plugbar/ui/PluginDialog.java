/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import dev.plugbar.api.Plugin;
import dev.plugbar.api.PluginManager;
import dev.plugbar.core.LocaleManager;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.FlowLayout;
import java.awt.Window;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.util.ArrayList;
import java.util.List;
import javax.swing.BorderFactory;
import javax.swing.DefaultListCellRenderer;
import javax.swing.DefaultListModel;
import javax.swing.JButton;
import javax.swing.JDialog;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JScrollPane;
import javax.swing.ListSelectionModel;
import javax.swing.SwingUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Modal list of loaded plugins with import and remove actions. */
final class PluginDialog extends JDialog {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");

  private final PluginMenu pluginMenu;
  private final DefaultListModel<Plugin> model = new DefaultListModel<>();
  private final JList<Plugin> list = new JList<>(model);
  private final JButton removeButton;
  private final List<AutoCloseable> subscriptions = new ArrayList<>();

  PluginDialog(Window owner, PluginMenu pluginMenu) {
    super(owner, LocaleManager.format("plugbar.dialog.title"), ModalityType.APPLICATION_MODAL);
    this.pluginMenu = pluginMenu;
    setDefaultCloseOperation(DISPOSE_ON_CLOSE);

    list.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
    list.setCellRenderer(new PluginRenderer());
    list.addListSelectionListener(event -> updateButtons());

    JButton importButton = new JButton(LocaleManager.format("plugbar.dialog.import"));
    importButton.addActionListener(event -> pluginMenu.importPlugin());
    removeButton = new JButton(LocaleManager.format("plugbar.dialog.remove"));
    removeButton.addActionListener(event -> removeSelected());
    JButton closeButton = new JButton(LocaleManager.format("plugbar.dialog.close"));
    closeButton.addActionListener(event -> dispose());

    JPanel buttons = new JPanel(new FlowLayout(FlowLayout.RIGHT));
    buttons.add(importButton);
    buttons.add(removeButton);
    buttons.add(closeButton);

    JScrollPane scroll = new JScrollPane(list);
    scroll.setPreferredSize(new Dimension(420, 260));
    JPanel content = new JPanel(new BorderLayout(0, 8));
    content.setBorder(BorderFactory.createEmptyBorder(10, 10, 10, 10));
    content.add(scroll, BorderLayout.CENTER);
    content.add(buttons, BorderLayout.SOUTH);
    setContentPane(content);
    getRootPane().setDefaultButton(closeButton);

    PluginManager manager = pluginMenu.manager();
    subscriptions.add(manager.onPluginAdded(event -> reloadList()));
    subscriptions.add(manager.onPluginRemoved(event -> reloadList()));
    addWindowListener(
        new WindowAdapter() {
          @Override
          public void windowClosed(WindowEvent e) {
            unsubscribe();
          }
        });

    reloadList();
    pack();
  }

  private void removeSelected() {
    List<Plugin> plugins = pluginMenu.plugins();
    List<Integer> indices = new ArrayList<>();
    for (Plugin selected : list.getSelectedValuesList()) {
      for (int i = 0; i < plugins.size(); i++) {
        if (plugins.get(i) == selected) {
          indices.add(i);
        }
      }
    }
    if (!indices.isEmpty()) {
      pluginMenu.remove(indices.stream().mapToInt(Integer::intValue).toArray());
    }
  }

  private void reloadList() {
    Runnable task =
        () -> {
          model.clear();
          for (Plugin plugin : pluginMenu.plugins()) {
            model.addElement(plugin);
          }
          updateButtons();
        };
    if (SwingUtilities.isEventDispatchThread()) {
      task.run();
    } else {
      SwingUtilities.invokeLater(task);
    }
  }

  private void updateButtons() {
    removeButton.setEnabled(!list.isSelectionEmpty());
    list.setToolTipText(model.isEmpty() ? LocaleManager.format("plugbar.dialog.empty") : null);
  }

  private void unsubscribe() {
    for (AutoCloseable subscription : subscriptions) {
      try {
        subscription.close();
      } catch (Exception e) {
        LOG.debug("(plugbar) failed to unsubscribe plugin dialog: {}", e.getMessage(), e);
      }
    }
    subscriptions.clear();
  }

  private static final class PluginRenderer extends DefaultListCellRenderer {
    @Override
    public Component getListCellRendererComponent(
        JList<?> list, Object value, int index, boolean isSelected, boolean cellHasFocus) {
      Component component =
          super.getListCellRendererComponent(list, value, index, isSelected, cellHasFocus);
      if (value instanceof Plugin plugin) {
        setText(plugin.name() + " - " + plugin.description());
        setToolTipText(plugin.getClass().getName());
      }
      return component;
    }
  }
}
