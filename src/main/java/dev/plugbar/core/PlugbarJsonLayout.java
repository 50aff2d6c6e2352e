/* Plugbar © 2025 Plugbar Devs — MIT */
package dev.plugbar.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/** Console layout writing one JSON object per log event. */
final class PlugbarJsonLayout extends LayoutBase<ILoggingEvent> {
  private static final DateTimeFormatter ISO_INSTANT =
      DateTimeFormatter.ISO_INSTANT.withZone(ZoneOffset.UTC);
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty("ts", ISO_INSTANT.format(Instant.ofEpochMilli(event.getTimeStamp())));
    json.addProperty("level", event.getLevel().toString());
    json.addProperty("logger", event.getLoggerName());
    json.addProperty("thread", event.getThreadName());
    json.addProperty("message", event.getFormattedMessage());

    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      JsonObject fields = new JsonObject();
      mdc.forEach(fields::addProperty);
      json.add("mdc", fields);
    }

    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      json.addProperty("stack", ThrowableProxyUtil.asString(throwable));
    }
    return GSON.toJson(json) + System.lineSeparator();
  }
}
