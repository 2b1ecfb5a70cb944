package ca.gc.cra.tint.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LevelTest {

  @Test
  void ofReusesNamedConstants() {
    assertSame(Level.DEBUG, Level.of(-1));
    assertSame(Level.FATAL, Level.of(4));
  }

  @Test
  void ofKeepsRawValuesOutsideTheKnownRange() {
    Level custom = Level.of(42);
    assertEquals(42, custom.value());
    assertFalse(custom.isKnown());
    assertEquals("Level(42)", custom.toString());
  }

  @Test
  void levelsAreOrderedBySeverity() {
    assertTrue(Level.DEBUG.compareTo(Level.INFO) < 0);
    assertTrue(Level.ERROR.isAtLeast(Level.WARN));
    assertFalse(Level.INFO.isAtLeast(Level.PANIC));
    assertTrue(Level.FATAL.compareTo(Level.PANIC) > 0);
  }
}
