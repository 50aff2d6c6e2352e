/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import java.awt.Component;
import java.awt.Window;
import java.util.List;
import javax.swing.JOptionPane;
import javax.swing.SwingUtilities;

/** {@link Dialogs} backed by {@link JOptionPane} and {@link PluginDialog}. */
public final class SwingDialogs implements Dialogs {

  @Override
  public void error(Component owner, String title, List<String> lines) {
    JOptionPane.showMessageDialog(
        windowOf(owner), String.join("\n", lines), title, JOptionPane.ERROR_MESSAGE);
  }

  @Override
  public void info(Component owner, String title, String message) {
    JOptionPane.showMessageDialog(windowOf(owner), message, title, JOptionPane.INFORMATION_MESSAGE);
  }

  @Override
  public void manage(PluginMenu menu) {
    PluginDialog dialog = new PluginDialog(windowOf(menu.menu()), menu);
    dialog.setLocationRelativeTo(dialog.getOwner());
    dialog.setVisible(true);
  }

  private static Window windowOf(Component owner) {
    return owner != null ? SwingUtilities.getWindowAncestor(owner) : null;
  }
}
