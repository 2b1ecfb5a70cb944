package ca.gc.cra.tint.infrastructure.buffer;

import ca.gc.cra.tint.application.port.MetricsPort;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of reusable {@link GrowableBuffer}s so encoding a log entry does not allocate its working memory.
 * <p>The pool keeps no record of borrowed buffers. Releasing a buffer twice, or using it after release, is a
 * caller error the pool cannot detect; forgetting to release only costs a fresh allocation later.
 */
public final class BufferPool {
  private static final Logger log = LoggerFactory.getLogger(BufferPool.class);

  private final int initialCapacity;
  private final int maxPoolSize;
  private final int maxRetainedCapacity;
  private final MetricsPort metrics;
  private final ArrayDeque<GrowableBuffer> pool;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong allocated = new AtomicLong();
  private final AtomicLong reused = new AtomicLong();

  /**
   * Creates a buffer pool that reports no metrics.
   *
   * @param initialCapacity starting capacity of newly allocated buffers in bytes
   * @param maxPoolSize maximum number of idle buffers kept in the pool
   * @param maxRetainedCapacity buffers that grew beyond this many bytes are dropped on release
   */
  public BufferPool(int initialCapacity, int maxPoolSize, int maxRetainedCapacity) {
    this(initialCapacity, maxPoolSize, maxRetainedCapacity, MetricsPort.NO_OP);
  }

  /**
   * Creates a buffer pool with the desired buffer sizing, cache bound, and metrics sink.
   *
   * @param initialCapacity starting capacity of newly allocated buffers in bytes
   * @param maxPoolSize maximum number of idle buffers kept in the pool
   * @param maxRetainedCapacity buffers that grew beyond this many bytes are dropped on release
   * @param metrics receives {@code tint.pool.*} counters; must not be {@code null}
   */
  public BufferPool(int initialCapacity, int maxPoolSize, int maxRetainedCapacity, MetricsPort metrics) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be positive");
    }
    if (maxRetainedCapacity < initialCapacity) {
      throw new IllegalArgumentException("maxRetainedCapacity must be >= initialCapacity");
    }
    this.initialCapacity = initialCapacity;
    this.maxPoolSize = maxPoolSize;
    this.maxRetainedCapacity = maxRetainedCapacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pool = new ArrayDeque<>(maxPoolSize);
  }

  /**
   * Borrows an empty buffer, recycling an idle one when available.
   *
   * @return empty buffer owned by the caller until {@link #release(GrowableBuffer)}
   */
  public GrowableBuffer acquire() {
    GrowableBuffer buffer;
    lock.lock();
    try {
      buffer = pool.pollFirst();
    } finally {
      lock.unlock();
    }
    if (buffer == null) {
      allocated.incrementAndGet();
      metrics.increment("tint.pool.allocated");
      return new GrowableBuffer(initialCapacity);
    }
    reused.incrementAndGet();
    metrics.increment("tint.pool.reused");
    buffer.clear();
    return buffer;
  }

  /**
   * Returns a buffer for future reuse. The caller must not touch it afterwards.
   *
   * @param buffer buffer obtained from {@link #acquire()}; {@code null} is ignored
   */
  public void release(GrowableBuffer buffer) {
    if (buffer == null) {
      return;
    }
    if (buffer.capacity() > maxRetainedCapacity) {
      metrics.increment("tint.pool.discarded");
      if (log.isDebugEnabled()) {
        log.debug("Dropping pooled buffer of {} bytes (retain limit {})", buffer.capacity(), maxRetainedCapacity);
      }
      return;
    }
    boolean retained;
    lock.lock();
    try {
      retained = pool.size() < maxPoolSize;
      if (retained) {
        pool.addFirst(buffer);
      }
    } finally {
      lock.unlock();
    }
    metrics.increment(retained ? "tint.pool.released" : "tint.pool.discarded");
  }

  /**
   * Drops every idle buffer and resets the reuse counters.
   */
  public void clear() {
    lock.lock();
    try {
      pool.clear();
    } finally {
      lock.unlock();
    }
    allocated.set(0);
    reused.set(0);
  }

  /**
   * Returns how many buffers {@link #acquire()} had to allocate.
   */
  public long allocatedCount() {
    return allocated.get();
  }

  /**
   * Returns how many {@link #acquire()} calls were served from idle buffers.
   */
  public long reusedCount() {
    return reused.get();
  }

  /**
   * Returns the number of idle buffers currently held.
   */
  public int idleCount() {
    lock.lock();
    try {
      return pool.size();
    } finally {
      lock.unlock();
    }
  }
}
