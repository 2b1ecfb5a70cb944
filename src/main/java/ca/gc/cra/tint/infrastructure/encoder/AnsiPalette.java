package ca.gc.cra.tint.infrastructure.encoder;

import ca.gc.cra.tint.domain.Level;
import ca.gc.cra.tint.infrastructure.buffer.GrowableBuffer;
import java.nio.charset.StandardCharsets;

/**
 * ANSI escape sequences for field keys and level tags.
 * <p>Keys get one of the seven non-black foreground colors, chosen from the sum of their UTF-8 bytes so the same
 * key is always painted the same way.
 */
final class AnsiPalette {
  static final int PALETTE_SIZE = 7;

  private static final byte[] RESET = ascii("\u001b[0m");
  private static final byte[][] KEY_COLORS = new byte[PALETTE_SIZE + 1][];

  private static final byte[] DEBUG_TAG = ascii("\u001b[32;1m[DEBG]\u001b[0m");
  private static final byte[] INFO_TAG = ascii("\u001b[34;1m[INFO]\u001b[0m");
  private static final byte[] WARN_TAG = ascii("\u001b[33;1m[WARN]\u001b[0m");
  private static final byte[] ERROR_TAG = ascii("\u001b[31;1m[ERRO]\u001b[0m");
  private static final byte[] PANIC_TAG = ascii("\u001b[31;1m[PANC]\u001b[0m");
  private static final byte[] FATAL_TAG = ascii("\u001b[31;1m[FATA]\u001b[0m");

  static {
    for (int color = 1; color <= PALETTE_SIZE; color++) {
      KEY_COLORS[color] = ascii("\u001b[3" + color + ";1m");
    }
  }

  private AnsiPalette() {}

  /**
   * Returns the palette color in {@code [1,7]} for a key's UTF-8 bytes.
   */
  static int colorIndex(byte[] keyBytes) {
    long sum = 0;
    for (byte b : keyBytes) {
      sum += b & 0xFF;
    }
    return (int) (sum % PALETTE_SIZE) + 1;
  }

  static int colorIndex(String key) {
    return colorIndex(key.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Appends {@code key} wrapped in its foreground color and a reset sequence.
   */
  static void appendKey(GrowableBuffer buffer, String key) {
    byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
    buffer.write(KEY_COLORS[colorIndex(keyBytes)]);
    buffer.write(keyBytes);
    buffer.write(RESET);
  }

  /**
   * Appends the colored tag for known levels, or the bare decimal value otherwise.
   */
  static void appendLevel(GrowableBuffer buffer, Level level) {
    byte[] tag = switch (level.value()) {
      case -1 -> DEBUG_TAG;
      case 0 -> INFO_TAG;
      case 1 -> WARN_TAG;
      case 2 -> ERROR_TAG;
      case 3 -> PANIC_TAG;
      case 4 -> FATAL_TAG;
      default -> null;
    };
    if (tag == null) {
      buffer.writeUtf8(Integer.toString(level.value()));
    } else {
      buffer.write(tag);
    }
  }

  private static byte[] ascii(String value) {
    return value.getBytes(StandardCharsets.US_ASCII);
  }
}
