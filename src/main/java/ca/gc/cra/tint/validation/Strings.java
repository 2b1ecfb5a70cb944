package ca.gc.cra.tint.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings read from encoder configuration.
 * <p><strong>Why:</strong> A control character in a time pattern or zone id would be copied into every rendered
 * line, so configuration rejects them up front.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String trimmed = requireNoControl(name, value).trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a candidate string is non-null and control-character free; empty values are allowed.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return {@code value} unchanged
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value contains ISO control characters
   */
  public static String requireNoControl(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return raw;
  }

  /**
   * Parses a boolean flag, accepting {@code true/false}, {@code yes/no}, and {@code on/off}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; {@code null} or blank yields {@code defaultValue}
   * @param defaultValue value used when {@code value} is absent
   * @return parsed flag
   * @throws IllegalArgumentException if the value is not a recognized flag
   */
  public static boolean parseFlag(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(message(name, "must be true or false (was " + value + ')'));
    };
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
