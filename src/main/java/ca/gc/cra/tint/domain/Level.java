package ca.gc.cra.tint.domain;


/**
 * <strong>What:</strong> Severity of a log entry, ordered from {@link #DEBUG} to {@link #FATAL}.
 * <p><strong>Why:</strong> Host frameworks may hand the encoder severities outside the well-known set, so a level
 * is a numeric value with named constants rather than a closed enum.</p>
 * <p><strong>Role:</strong> Domain value passed to {@code Encoder#writeEntry} and mapped from the host's levels.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 * <p><strong>Performance:</strong> {@link #of(int)} returns the shared constant for known values.</p>
 * <p><strong>Observability:</strong> Unknown values render as their decimal number in the rendered line.</p>
 *
 * @param value numeric severity; larger is more severe
 * @since 0.1.0
 */
public record Level(int value) implements Comparable<Level> {
  /** Verbose diagnostics. */
  public static final Level DEBUG = new Level(-1);
  /** Routine operational messages. */
  public static final Level INFO = new Level(0);
  /** Unexpected but recoverable conditions. */
  public static final Level WARN = new Level(1);
  /** Failed operations. */
  public static final Level ERROR = new Level(2);
  /** Logged right before the caller panics. */
  public static final Level PANIC = new Level(3);
  /** Logged right before the process exits. */
  public static final Level FATAL = new Level(4);

  private static final Level[] KNOWN = {DEBUG, INFO, WARN, ERROR, PANIC, FATAL};

  /**
   * Resolves a level from its numeric value, reusing the named constant when one exists.
   *
   * @param value numeric severity
   * @return matching constant or a new level carrying the raw value
   */
  public static Level of(int value) {
    for (Level level : KNOWN) {
      if (level.value == value) {
        return level;
      }
    }
    return new Level(value);
  }

  /**
   * Reports whether this level is one of the named constants.
   *
   * @return {@code true} for {@code DEBUG} through {@code FATAL}
   */
  public boolean isKnown() {
    return value >= DEBUG.value && value <= FATAL.value;
  }

  /**
   * Reports whether this level is at least as severe as {@code other}.
   *
   * @param other level to compare against; must not be {@code null}
   * @return {@code true} when {@code value >= other.value}
   */
  public boolean isAtLeast(Level other) {
    return value >= other.value;
  }

  @Override
  public int compareTo(Level other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return switch (value) {
      case -1 -> "DEBUG";
      case 0 -> "INFO";
      case 1 -> "WARN";
      case 2 -> "ERROR";
      case 3 -> "PANIC";
      case 4 -> "FATAL";
      default -> "Level(" + value + ")";
    };
  }
}
