package ca.gc.cra.tint.infrastructure.buffer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Append-only byte buffer backed by a single array that doubles when full.
 * <p>Content is only ever discarded as a whole via {@link #clear()}, which keeps the capacity so pooled
 * buffers stop allocating once they have grown to the size of a typical log line.
 */
public final class GrowableBuffer {
  private static final int DEFAULT_CAPACITY = 4096;
  private static final int MAX_CAPACITY = 32 * 1024 * 1024; // 32 MiB safety guard

  private byte[] data;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
    writeIndex = 0;
  }

  /**
   * Appends a single byte into the buffer.
   */
  public void writeByte(byte value) {
    ensureWritable(1);
    data[writeIndex++] = value;
  }

  /**
   * Appends the low byte of an ASCII character.
   */
  public void writeAscii(char value) {
    writeByte((byte) value);
  }

  /**
   * Appends the provided bytes into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    write(src, 0, src.length);
  }

  /**
   * Appends a region of the provided array into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   * @param offset starting offset within {@code src}
   * @param length number of bytes to append
   */
  public void write(byte[] src, int offset, int length) {
    Objects.requireNonNull(src, "src");
    if (length <= 0) {
      return;
    }
    if (offset < 0 || offset + length > src.length) {
      throw new IndexOutOfBoundsException("invalid offset/length");
    }
    ensureWritable(length);
    System.arraycopy(src, offset, data, writeIndex, length);
    writeIndex += length;
  }

  /**
   * Appends the readable content of another buffer.
   *
   * @param other source buffer; must not be {@code null} and is left unchanged
   */
  public void write(GrowableBuffer other) {
    Objects.requireNonNull(other, "other");
    write(other.data, 0, other.writeIndex);
  }

  /**
   * Appends the UTF-8 encoding of {@code value}.
   * <p>ASCII text is copied char by char; the remainder after the first non-ASCII char goes through the
   * JDK encoder.
   *
   * @param value text to append; must not be {@code null}
   */
  public void writeUtf8(String value) {
    Objects.requireNonNull(value, "value");
    int length = value.length();
    ensureWritable(length);
    for (int i = 0; i < length; i++) {
      char c = value.charAt(i);
      if (c >= 0x80) {
        write(value.substring(i).getBytes(StandardCharsets.UTF_8));
        return;
      }
      data[writeIndex++] = (byte) c;
    }
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex;
  }

  /**
   * Reports whether nothing has been written since the last {@link #clear()}.
   */
  public boolean isEmpty() {
    return writeIndex == 0;
  }

  /**
   * Returns the size of the backing array.
   */
  public int capacity() {
    return data.length;
  }

  /**
   * Provides the backing array for zero-copy writes; only the first {@link #readableBytes()} bytes are valid.
   */
  public byte[] array() {
    return data;
  }

  /**
   * Returns the byte at {@code index}.
   *
   * @throws IndexOutOfBoundsException when {@code index} is outside the readable region
   */
  public byte getByte(int index) {
    Objects.checkIndex(index, writeIndex);
    return data[index];
  }

  /**
   * Copies all readable bytes into a freshly allocated array without consuming them.
   */
  public byte[] toByteArray() {
    byte[] out = new byte[writeIndex];
    System.arraycopy(data, 0, out, 0, writeIndex);
    return out;
  }

  /**
   * Decodes the readable bytes as UTF-8.
   */
  public String toUtf8String() {
    return new String(data, 0, writeIndex, StandardCharsets.UTF_8);
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   */
  public void ensureWritable(int minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    int writable = data.length - writeIndex;
    if (writable >= minWritableBytes) {
      return;
    }
    int required = writeIndex + minWritableBytes;
    int newCapacity = data.length;
    while (newCapacity < required && newCapacity < MAX_CAPACITY) {
      newCapacity <<= 1;
    }
    if (newCapacity < required) {
      newCapacity = required;
    }
    if (newCapacity > MAX_CAPACITY) {
      throw new IllegalStateException("buffer would exceed max capacity: " + newCapacity);
    }
    byte[] next = new byte[newCapacity];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    writeIndex = 0;
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
