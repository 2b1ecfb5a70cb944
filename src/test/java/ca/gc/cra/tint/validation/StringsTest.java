package ca.gc.cra.tint.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsInput() {
    assertEquals("UTC", Strings.requireNonBlank("timeZone", "  UTC "));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("timeZone", "   "));
    assertEquals("timeZone must not be blank", ex.getMessage());
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("timeZone", null));
  }

  @Test
  void requireNoControlAllowsEmptyButNotControlCharacters() {
    assertEquals("", Strings.requireNoControl("timeFormat", ""));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNoControl(null, "HH\u001bmm"));
    assertEquals("value must not contain control characters", ex.getMessage());
  }

  @Test
  void parseFlagAcceptsCommonSpellings() {
    assertTrue(Strings.parseFlag("noTime", "YES", false));
    assertTrue(Strings.parseFlag("noTime", " on ", false));
    assertFalse(Strings.parseFlag("noTime", "off", true));
    assertTrue(Strings.parseFlag("noTime", null, true));
    assertFalse(Strings.parseFlag("noTime", "", false));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseFlag("noTime", "2", false));
  }
}
