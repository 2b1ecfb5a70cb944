/**
 * Buffer pooling utilities backing the encoder's field and line assembly.
 * <p><strong>Role:</strong> Infrastructure providing reusable byte buffers to encoders.</p>
 * <p><strong>Concurrency:</strong> Pools use a lock around an idle deque; buffers themselves are single-owner.</p>
 * <p><strong>Performance:</strong> Avoids per-entry allocations by recycling buffers that keep their grown capacity.</p>
 * <p><strong>Metrics:</strong> Emits {@code tint.pool.*} counters for allocation, reuse, release, and discards.</p>
 * <p><strong>Security:</strong> Recycled buffers still hold previous entries' bytes beyond the write index; never
 * expose {@link ca.gc.cra.tint.infrastructure.buffer.GrowableBuffer#array()} past the readable length.</p>
 */
package ca.gc.cra.tint.infrastructure.buffer;
