/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code core.log} block to whichever SLF4J backend the host application ships.
 * Logback is optional, so it is reached reflectively.
 */
public final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("plugbar");
  private static final String LOGBACK_CLASS = "dev.plugbar.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * Configures the active logging backend.
   *
   * @param logCfg logging block, ignored when {@code null}
   */
  public static void configure(Config.Log logCfg) {
    if (logCfg == null) {
      return;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      configure.invoke(null, logCfg);
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(plugbar) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(plugbar) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(plugbar) failed to configure logging: {}", e.getMessage(), e);
    }
  }
}
