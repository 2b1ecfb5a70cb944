package ca.gc.cra.tint.infrastructure.encoder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tint.application.port.MarshalException;
import ca.gc.cra.tint.infrastructure.buffer.BufferPool;
import ca.gc.cra.tint.testutil.Ansi;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColorTextEncoderFieldsTest {
  private BufferPool pool;
  private ColorTextEncoder encoder;

  @BeforeEach
  void setUp() {
    pool = new BufferPool(4096, 4, 64 * 1024);
    encoder = ColorTextEncoder.create(TextOption.bufferPool(pool), TextOption.noTime());
  }

  @AfterEach
  void tearDown() {
    encoder.close();
  }

  @Test
  void firstFieldHasNoLeadingSpace() {
    encoder.addString("user", "alice");
    assertEquals(Ansi.key(7, "user") + "=alice", text());
  }

  @Test
  void laterFieldsAreSpaceSeparated() {
    encoder.addString("user", "alice");
    encoder.addInt("attempts", 3);
    encoder.addBoolean("locked", false);
    assertEquals("user=alice attempts=3 locked=false", plain());
  }

  @Test
  void rendersIntegersInDecimal() {
    encoder.addLong("a", -42L);
    encoder.addUnsignedInt("b", -1);
    encoder.addUnsignedLong("c", -1L);
    assertEquals("a=-42 b=4294967295 c=18446744073709551615", plain());
  }

  @Test
  void rendersUintptrAsLowercaseHex() {
    encoder.addUintptr("p", 0xDEADBEEFL);
    encoder.addUintptr("q", 0L);
    encoder.addUintptr("r", -1L);
    assertEquals("p=0xdeadbeef q=0x0 r=0xffffffffffffffff", plain());
  }

  @Test
  void rendersFloatsWithoutExponentOrTrailingZeros() {
    encoder.addDouble("a", 1.5d);
    encoder.addDouble("b", 3.0d);
    encoder.addDouble("c", 1e21d);
    encoder.addDouble("d", 1e-7d);
    encoder.addFloat("e", 0.1f);
    encoder.addDouble("f", -0.0d);
    assertEquals("a=1.5 b=3 c=1000000000000000000000 d=0.0000001 e=0.1 f=-0", plain());
  }

  @Test
  void floatsUseShortestDigitsThatRoundTrip() {
    assertEquals("100000000000000000000000", ColorTextEncoder.formatDouble(1e23d));
    assertEquals("200000000000000000000000", ColorTextEncoder.formatDouble(2e23d));
    assertEquals(new BigDecimal("5E-324").toPlainString(), ColorTextEncoder.formatDouble(Double.MIN_VALUE));
    assertEquals(new BigDecimal("1E-45").toPlainString(), ColorTextEncoder.formatFloat(Float.MIN_VALUE));
    assertEquals("0.30000000000000004", ColorTextEncoder.formatDouble(0.1d + 0.2d));
    assertEquals("16777216", ColorTextEncoder.formatFloat(16777216f));
  }

  @Test
  void nonFiniteFloatsUseJavaNames() {
    encoder.addDouble("a", Double.NaN);
    encoder.addDouble("b", Double.NEGATIVE_INFINITY);
    encoder.addFloat("c", Float.POSITIVE_INFINITY);
    assertEquals("a=NaN b=-Infinity c=Infinity", plain());
  }

  @Test
  void numericRenderingsParseBackToTheSameValue() {
    long[] longs = {0L, 1L, -1L, Long.MIN_VALUE, Long.MAX_VALUE, 1234567890123L};
    for (long value : longs) {
      assertEquals(value, Long.parseLong(render(e -> e.addLong("v", value))));
      assertEquals(value, Long.parseUnsignedLong(render(e -> e.addUnsignedLong("v", value))));
      assertEquals(value, Long.parseUnsignedLong(render(e -> e.addUintptr("v", value)).substring(2), 16));
    }
    double[] doubles = {Math.PI, -Math.E, 1e-300, 6.02214076e23, Double.MIN_VALUE, Double.MAX_VALUE, 0.1 + 0.2};
    for (double value : doubles) {
      assertEquals(value, Double.parseDouble(render(e -> e.addDouble("v", value))));
    }
    float[] floats = {0.1f, -3.25f, Float.MIN_VALUE, Float.MAX_VALUE};
    for (float value : floats) {
      assertEquals(value, Float.parseFloat(render(e -> e.addFloat("v", value))));
    }
  }

  @Test
  void objectsUseTheirStringForm() {
    encoder.addObject("list", List.of(1, 2));
    encoder.addObject("missing", null);
    encoder.addString("nothing", null);
    assertEquals("list=[1, 2] missing=null nothing=null", plain());
  }

  @Test
  void nestedObjectsAreBracedWithoutLeadingSpace() throws MarshalException {
    encoder.addMarshaler("req", e -> {
      e.addString("method", "GET");
      e.addInt("status", 200);
    });
    encoder.addString("after", "x");
    assertEquals("req={method=GET status=200} after=x", plain());
  }

  @Test
  void emptyNestedObjectStillSeparatesNextField() throws MarshalException {
    encoder.addMarshaler("req", e -> { });
    assertFalse(encoder.firstNested());
    encoder.addInt("x", 1);
    assertEquals("req={} x=1", plain());
  }

  @Test
  void nestedObjectsCanNest() throws MarshalException {
    encoder.addInt("n", 0);
    encoder.addMarshaler("outer", e -> {
      e.addMarshaler("inner", inner -> inner.addInt("x", 1));
      e.addInt("y", 2);
    });
    assertEquals("n=0 outer={inner={x=1} y=2}", plain());
  }

  @Test
  void marshalFailureClosesFrameAndPropagatesSameException() {
    MarshalException boom = new MarshalException("boom");
    MarshalException thrown = assertThrows(MarshalException.class, () -> encoder.addMarshaler("obj", e -> {
      e.addString("a", "1");
      throw boom;
    }));
    assertSame(boom, thrown);
    assertEquals("obj={a=1}", plain());
    assertFalse(encoder.firstNested());
  }

  @Test
  void uncheckedMarshalFailureAlsoClosesFrame() {
    assertThrows(IllegalStateException.class, () -> encoder.addMarshaler("obj", e -> {
      throw new IllegalStateException("broken");
    }));
    encoder.addInt("next", 1);
    assertEquals("obj={} next=1", plain());
  }

  @Test
  void keyColorDependsOnlyOnKeyBytes() {
    encoder.addString("ключ", "v");
    int color = AnsiPalette.colorIndex("ключ");
    assertEquals(Ansi.key(color, "ключ") + "=v", text());
  }

  @Test
  void copyStartsWithSameFieldsAndDivergesAfterwards() {
    encoder.addString("user", "alice");
    try (ColorTextEncoder clone = encoder.copy()) {
      assertEquals(text(), clone.fields().toUtf8String());
      clone.addInt("extra", 1);
      encoder.addInt("other", 2);
      assertEquals("user=alice extra=1", Ansi.strip(clone.fields().toUtf8String()));
      assertEquals("user=alice other=2", plain());
    }
  }

  @Test
  void copySurvivesClosingTheOriginal() {
    encoder.addString("k", "v");
    ColorTextEncoder clone = encoder.copy();
    encoder.close();
    assertEquals("k=v", Ansi.strip(clone.fields().toUtf8String()));
    clone.close();
  }

  @Test
  void copyInsideNestedFrameKeepsFrameState() throws MarshalException {
    ColorTextEncoder[] inner = new ColorTextEncoder[1];
    encoder.addMarshaler("obj", e -> inner[0] = ((ColorTextEncoder) e).copy());
    try (ColorTextEncoder clone = inner[0]) {
      assertTrue(clone.firstNested());
      clone.addInt("x", 1);
      assertEquals("obj={x=1", Ansi.strip(clone.fields().toUtf8String()));
    }
  }

  @Test
  void closeReturnsBufferAndIsIdempotent() {
    encoder.close();
    assertEquals(1, pool.idleCount());
    encoder.close();
    assertEquals(1, pool.idleCount());
  }

  @Test
  void useAfterCloseFails() {
    encoder.close();
    assertThrows(IllegalStateException.class, () -> encoder.addInt("x", 1));
    assertThrows(IllegalStateException.class, () -> encoder.copy());
  }

  private String text() {
    return encoder.fields().toUtf8String();
  }

  private String plain() {
    return Ansi.strip(text());
  }

  private String render(Consumer<ColorTextEncoder> field) {
    try (ColorTextEncoder single = ColorTextEncoder.create(TextOption.bufferPool(pool))) {
      field.accept(single);
      return Ansi.strip(single.fields().toUtf8String()).substring("v=".length());
    }
  }
}
