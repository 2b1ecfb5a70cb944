package ca.gc.cra.tint.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ByteArraySinkTest {

  @Test
  void emptyBeforeFirstWrite() {
    ByteArraySink sink = new ByteArraySink();
    assertEquals(0, sink.toByteArray().length);
    assertEquals("", sink.toString());
  }

  @Test
  void keepsCopyOfLastWrite() {
    ByteArraySink sink = new ByteArraySink();
    byte[] source = "first second".getBytes(StandardCharsets.UTF_8);
    assertEquals(5, sink.write(source, 0, 5));
    source[0] = 'F';
    assertEquals("first", sink.toString());

    sink.write(source, 6, 6);
    assertArrayEquals("second".getBytes(StandardCharsets.UTF_8), sink.toByteArray());
  }
}
