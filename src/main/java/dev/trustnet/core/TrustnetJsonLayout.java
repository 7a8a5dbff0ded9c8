/* Trustnet © 2025 Trustnet Devs — MIT */
package dev.trustnet.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.Map;

/** One JSON object per log line: ts, level, logger, thread, message, optional mdc and stack. */
final class TrustnetJsonLayout extends LayoutBase<ILoggingEvent> {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty("ts", Instant.ofEpochMilli(event.getTimeStamp()).toString());
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
