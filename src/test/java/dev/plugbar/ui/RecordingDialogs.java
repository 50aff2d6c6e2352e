/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.ui;

import java.awt.Component;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Dialogs that record what would have been shown. */
final class RecordingDialogs implements Dialogs {
  record Shown(String title, List<String> lines) {}

  final List<Shown> errors = new CopyOnWriteArrayList<>();
  final List<Shown> infos = new CopyOnWriteArrayList<>();
  final List<PluginMenu> managed = new CopyOnWriteArrayList<>();

  @Override
  public void error(Component owner, String title, List<String> lines) {
    errors.add(new Shown(title, List.copyOf(lines)));
  }

  @Override
  public void info(Component owner, String title, String message) {
    infos.add(new Shown(title, List.of(message)));
  }

  @Override
  public void manage(PluginMenu menu) {
    managed.add(menu);
  }
}
