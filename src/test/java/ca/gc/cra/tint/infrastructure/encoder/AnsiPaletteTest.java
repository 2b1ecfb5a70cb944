package ca.gc.cra.tint.infrastructure.encoder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tint.domain.Level;
import ca.gc.cra.tint.infrastructure.buffer.GrowableBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AnsiPaletteTest {

  @Test
  void colorIndexIsByteSumModuloSevenPlusOne() {
    Random random = new Random(7);
    for (int i = 0; i < 1_000; i++) {
      byte[] key = new byte[random.nextInt(24)];
      random.nextBytes(key);
      long sum = 0;
      for (byte b : key) {
        sum += Byte.toUnsignedInt(b);
      }
      int color = AnsiPalette.colorIndex(key);
      assertEquals(sum % 7 + 1, color);
      assertTrue(color >= 1 && color <= 7);
      assertEquals(color, AnsiPalette.colorIndex(key.clone()), "color must be stable for equal keys");
    }
  }

  @Test
  void knownKeysMapToExpectedColors() {
    assertEquals(7, AnsiPalette.colorIndex("user"));  // 447 % 7 == 6
    assertEquals(1, AnsiPalette.colorIndex(""));
    assertEquals(AnsiPalette.colorIndex("é".getBytes(StandardCharsets.UTF_8)), AnsiPalette.colorIndex("é"));
  }

  @Test
  void appendKeyWrapsKeyInColorAndReset() {
    GrowableBuffer buffer = new GrowableBuffer();
    AnsiPalette.appendKey(buffer, "user");
    assertEquals("\u001b[37;1muser\u001b[0m", buffer.toUtf8String());
  }

  @Test
  void levelTagsUseFixedColors() {
    assertEquals("\u001b[32;1m[DEBG]\u001b[0m", tag(Level.DEBUG));
    assertEquals("\u001b[34;1m[INFO]\u001b[0m", tag(Level.INFO));
    assertEquals("\u001b[33;1m[WARN]\u001b[0m", tag(Level.WARN));
    assertEquals("\u001b[31;1m[ERRO]\u001b[0m", tag(Level.ERROR));
    assertEquals("\u001b[31;1m[PANC]\u001b[0m", tag(Level.PANIC));
    assertEquals("\u001b[31;1m[FATA]\u001b[0m", tag(Level.FATAL));
  }

  @Test
  void unknownLevelsRenderAsBareNumbers() {
    assertEquals("12", tag(Level.of(12)));
    assertEquals("-5", tag(Level.of(-5)));
  }

  private static String tag(Level level) {
    GrowableBuffer buffer = new GrowableBuffer();
    AnsiPalette.appendLevel(buffer, level);
    return buffer.toUtf8String();
  }
}
