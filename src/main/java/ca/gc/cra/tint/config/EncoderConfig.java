package ca.gc.cra.tint.config;

import ca.gc.cra.tint.infrastructure.encoder.ColorTextEncoder;
import ca.gc.cra.tint.infrastructure.encoder.TextOption;
import ca.gc.cra.tint.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable encoder configuration resolved from defaults, YAML, and explicit overrides.
 * <p><strong>Why:</strong> Lets operators change the timestamp layout or zone without code changes.</p>
 * <p><strong>Role:</strong> Configuration record converted into {@link TextOption}s at encoder construction.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param timeFormat {@link DateTimeFormatter} pattern; empty omits timestamps
 * @param timeZone zone used to render entry instants
 * @since 0.1.0
 */
public record EncoderConfig(String timeFormat, ZoneId timeZone) {
  private static final Logger log = LoggerFactory.getLogger(EncoderConfig.class);

  static final String KEY_TIME_FORMAT = "timeFormat";
  static final String KEY_TIME_ZONE = "timeZone";
  static final String KEY_NO_TIME = "noTime";
  private static final Set<String> KNOWN_KEYS = Set.of(KEY_TIME_FORMAT, KEY_TIME_ZONE, KEY_NO_TIME);

  /**
   * Validates configuration values.
   *
   * @throws IllegalArgumentException if the pattern is invalid or contains control characters
   */
  public EncoderConfig {
    timeFormat = Strings.requireNoControl(KEY_TIME_FORMAT, timeFormat);
    if (!timeFormat.isEmpty()) {
      try {
        DateTimeFormatter.ofPattern(timeFormat);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("timeFormat is not a valid pattern: " + timeFormat, ex);
      }
    }
    timeZone = Objects.requireNonNull(timeZone, KEY_TIME_ZONE);
  }

  /**
   * Provides default configuration: RFC 3339 timestamps in the system zone.
   *
   * @return default configuration record
   */
  public static EncoderConfig defaults() {
    return new EncoderConfig(ColorTextEncoder.DEFAULT_TIME_FORMAT, ZoneId.systemDefault());
  }

  /**
   * Builds a configuration from flat key/value settings, falling back to {@link #defaults()} per key.
   * <p>Recognized keys: {@code timeFormat}, {@code timeZone}, {@code noTime}. {@code noTime=true} wins over
   * {@code timeFormat}.
   *
   * @param settings flat settings; unknown keys are logged and ignored
   * @return validated configuration
   * @throws IllegalArgumentException if a value is invalid
   */
  public static EncoderConfig fromMap(Map<String, String> settings) {
    Map<String, String> source = settings == null ? Map.of() : settings;
    for (String key : source.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        log.warn("Ignoring unknown encoder setting '{}'", key);
      }
    }
    EncoderConfig defaults = defaults();
    String timeFormat = source.getOrDefault(KEY_TIME_FORMAT, defaults.timeFormat());
    if (Strings.parseFlag(KEY_NO_TIME, source.get(KEY_NO_TIME), false)) {
      timeFormat = "";
    }
    ZoneId zone = defaults.timeZone();
    String rawZone = source.get(KEY_TIME_ZONE);
    if (rawZone != null && !rawZone.isBlank()) {
      String zoneId = Strings.requireNonBlank(KEY_TIME_ZONE, rawZone);
      try {
        zone = ZoneId.of(zoneId);
      } catch (DateTimeException ex) {
        throw new IllegalArgumentException("timeZone is not a valid zone id: " + zoneId, ex);
      }
    }
    return new EncoderConfig(timeFormat == null ? "" : timeFormat, zone);
  }

  /**
   * Loads the {@code encoder} section of a YAML file and applies {@code overrides} on top of it.
   *
   * @param path YAML file; may be {@code null} or missing to use defaults
   * @param overrides settings taking precedence over the file; may be empty
   * @return validated configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the file or a value is invalid
   */
  public static EncoderConfig load(Path path, Map<String, String> overrides) throws IOException {
    Map<String, String> merged = new LinkedHashMap<>();
    if (path != null) {
      YamlConfigLoader.load(path).ifPresent(merged::putAll);
    }
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return fromMap(merged);
  }

  /**
   * Reports whether rendered lines carry a timestamp.
   */
  public boolean includesTime() {
    return !timeFormat.isEmpty();
  }

  /**
   * Converts this configuration into encoder options.
   *
   * @return options applying the time layout and zone
   */
  public List<TextOption> toOptions() {
    return List.of(TextOption.timeFormat(timeFormat), TextOption.timeZone(timeZone));
  }
}
