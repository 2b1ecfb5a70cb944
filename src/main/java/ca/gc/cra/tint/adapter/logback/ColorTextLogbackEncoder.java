package ca.gc.cra.tint.adapter.logback;

import ca.gc.cra.tint.application.port.FieldEncoder;
import ca.gc.cra.tint.application.port.LogMarshaler;
import ca.gc.cra.tint.application.port.MarshalException;
import ca.gc.cra.tint.config.EncoderConfig;
import ca.gc.cra.tint.domain.Level;
import ca.gc.cra.tint.infrastructure.buffer.BufferPools;
import ca.gc.cra.tint.infrastructure.encoder.ColorTextEncoder;
import ca.gc.cra.tint.infrastructure.encoder.TextOption;
import ca.gc.cra.tint.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tint.infrastructure.sink.ByteArraySink;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.encoder.EncoderBase;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.event.KeyValuePair;

/**
 * <strong>What:</strong> Logback encoder rendering events as colored {@code key=value} text lines.
 * <p><strong>Why:</strong> Gives Logback console appenders the same terminal-friendly output as direct
 * {@link ColorTextEncoder} users.</p>
 * <p><strong>Role:</strong> Host-framework adapter; options are compiled once at {@link #start()} and each event
 * works on a copy of that template encoder, reporting logger, thread, MDC, key/value pairs, and throwable as
 * fields before rendering one line.</p>
 * <p><strong>Configuration:</strong> {@code timeFormat}, {@code noTime}, {@code timeZone}, {@code configFile}
 * (YAML with an {@code encoder} section), {@code includeLogger}, {@code includeThread}, and {@code metrics}.
 * Explicit properties override the file.</p>
 * <p><strong>Observability:</strong> Configuration and encoding failures go to Logback's status manager.</p>
 *
 * <pre>{@code
 * <appender name="CONSOLE" class="ch.qos.logback.core.ConsoleAppender">
 *   <encoder class="ca.gc.cra.tint.adapter.logback.ColorTextLogbackEncoder">
 *     <timeFormat>HH:mm:ss.SSS</timeFormat>
 *   </encoder>
 * </appender>
 * }</pre>
 *
 * @since 0.1.0
 */
public class ColorTextLogbackEncoder extends EncoderBase<ILoggingEvent> {
  private static final byte[] EMPTY = new byte[0];

  private String timeFormat;
  private String timeZone;
  private String noTime;
  private String configFile;
  private boolean includeLogger = true;
  private boolean includeThread;
  private boolean metrics;

  // Configured but never written to; each event works on a copy.
  private ColorTextEncoder template;
  private OpenTelemetryMetricsAdapter metricsAdapter;

  public void setTimeFormat(String timeFormat) {
    this.timeFormat = timeFormat;
  }

  public void setTimeZone(String timeZone) {
    this.timeZone = timeZone;
  }

  public void setNoTime(String noTime) {
    this.noTime = noTime;
  }

  public void setConfigFile(String configFile) {
    this.configFile = configFile;
  }

  public void setIncludeLogger(boolean includeLogger) {
    this.includeLogger = includeLogger;
  }

  public void setIncludeThread(boolean includeThread) {
    this.includeThread = includeThread;
  }

  public void setMetrics(boolean metrics) {
    this.metrics = metrics;
  }

  @Override
  public void start() {
    Map<String, String> overrides = new LinkedHashMap<>();
    putIfSet(overrides, "timeFormat", timeFormat);
    putIfSet(overrides, "timeZone", timeZone);
    putIfSet(overrides, "noTime", noTime);
    EncoderConfig config;
    try {
      config = EncoderConfig.load(configFile == null ? null : Path.of(configFile), overrides);
    } catch (IOException | IllegalArgumentException ex) {
      addError("Invalid colored text encoder configuration", ex);
      return;
    }
    List<TextOption> resolved = new ArrayList<>(config.toOptions());
    if (metrics) {
      metricsAdapter = new OpenTelemetryMetricsAdapter();
      metricsAdapter.registerPoolGauges("encoder", BufferPools.encoderBuffers());
      resolved.add(TextOption.metrics(metricsAdapter));
    }
    template = ColorTextEncoder.create(resolved);
    addInfo("Colored text encoder using " + resolved);
    super.start();
  }

  @Override
  public void stop() {
    if (template != null) {
      template.close();
      template = null;
    }
    if (metricsAdapter != null) {
      metricsAdapter.close();
      metricsAdapter = null;
    }
    super.stop();
  }

  @Override
  public byte[] headerBytes() {
    return null;
  }

  @Override
  public byte[] encode(ILoggingEvent event) {
    ColorTextEncoder configured = template;
    if (configured == null) {
      addError("Encoder used before start()");
      return EMPTY;
    }
    try (ColorTextEncoder encoder = configured.copy()) {
      if (includeLogger) {
        encoder.addString("logger", event.getLoggerName());
      }
      if (includeThread) {
        encoder.addString("thread", event.getThreadName());
      }
      Map<String, String> mdc = event.getMDCPropertyMap();
      if (mdc != null && !mdc.isEmpty()) {
        for (Map.Entry<String, String> entry : new TreeMap<>(mdc).entrySet()) {
          encoder.addString(entry.getKey(), entry.getValue());
        }
      }
      List<KeyValuePair> pairs = event.getKeyValuePairs();
      if (pairs != null) {
        for (KeyValuePair pair : pairs) {
          addValue(encoder, pair.key, pair.value);
        }
      }
      IThrowableProxy throwable = event.getThrowableProxy();
      if (throwable != null) {
        encoder.addObject("error", describe(throwable));
      }

      ByteArraySink sink = new ByteArraySink();
      encoder.writeEntry(sink, event.getFormattedMessage(), toLevel(event.getLevel()),
          Instant.ofEpochMilli(event.getTimeStamp()));
      return sink.toByteArray();
    } catch (IOException | RuntimeException ex) {
      addError("Failed to encode event from logger " + event.getLoggerName(), ex);
      return EMPTY;
    }
  }

  @Override
  public byte[] footerBytes() {
    return null;
  }

  /**
   * Maps Logback levels onto encoder levels; TRACE folds into DEBUG.
   */
  static Level toLevel(ch.qos.logback.classic.Level level) {
    if (level == null) {
      return Level.INFO;
    }
    return switch (level.toInt()) {
      case ch.qos.logback.classic.Level.TRACE_INT, ch.qos.logback.classic.Level.DEBUG_INT -> Level.DEBUG;
      case ch.qos.logback.classic.Level.INFO_INT -> Level.INFO;
      case ch.qos.logback.classic.Level.WARN_INT -> Level.WARN;
      case ch.qos.logback.classic.Level.ERROR_INT -> Level.ERROR;
      default -> Level.of(level.toInt());
    };
  }

  private void addValue(FieldEncoder encoder, String key, Object value) {
    if (value instanceof Boolean b) {
      encoder.addBoolean(key, b);
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      encoder.addInt(key, ((Number) value).intValue());
    } else if (value instanceof Long l) {
      encoder.addLong(key, l);
    } else if (value instanceof Float f) {
      encoder.addFloat(key, f);
    } else if (value instanceof Double d) {
      encoder.addDouble(key, d);
    } else if (value instanceof CharSequence text) {
      encoder.addString(key, text.toString());
    } else if (value instanceof LogMarshaler marshaler) {
      try {
        encoder.addMarshaler(key, marshaler);
      } catch (MarshalException ex) {
        addError("Field '" + key + "' failed to marshal", ex);
      }
    } else {
      encoder.addObject(key, value);
    }
  }

  private static String describe(IThrowableProxy throwable) {
    String message = throwable.getMessage();
    return message == null ? throwable.getClassName() : throwable.getClassName() + ": " + message;
  }

  private static void putIfSet(Map<String, String> target, String key, String value) {
    if (value != null) {
      target.put(key, value);
    }
  }
}
