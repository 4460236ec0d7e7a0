/*
 * Copyright (c) 2025 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.probe;

import static com.github.mizosoft.probe.internal.Validate.requireState;
import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.probe.internal.Utils;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A body that can be read more than once. The bytes read from the upstream {@code InputStream}
 * are mirrored into memory, so the body can be {@link #rewind() rewound} and read again, or {@link
 * #snapshot() snapshotted} into an independent stream. Once the upstream is fully read, it is
 * closed and its release callback is run, never to be touched again.
 *
 * <p>The first {@code IOException} thrown by the upstream, either when reading or closing, is
 * remembered and rethrown by all later calls to {@link #read(byte[], int, int)}, {@link #rewind()},
 * {@link #snapshot()} and {@link #close()}.
 *
 * <p>Each stream returned by {@link #inputStream()} is bound to the current read pass. Once the
 * body is rewound or discarded, reading from a stream of an earlier pass fails with an {@code
 * IOException} and leaves the read position untouched, so a body can be re-sent while an abandoned
 * send is still reading from it. Calls are serialized with a lock, but a single read pass is meant
 * to be consumed by one reader.
 */
public final class BodyReplay implements Closeable {
  private static final int INITIAL_BUFFER_SIZE = 512;

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private @Nullable InputStream upstream;

  @GuardedBy("lock")
  private @Nullable Runnable releaseCallback;

  @GuardedBy("lock")
  private byte[] buffer = new byte[0];

  @GuardedBy("lock")
  private int size;

  /** Position of the next byte to serve from the buffer. */
  @GuardedBy("lock")
  private int cursor;

  /** Whether the upstream was read to its end, or can't be read anymore. */
  @GuardedBy("lock")
  private boolean drained;

  /** Incremented on every rewind or discard, invalidating streams of earlier read passes. */
  @GuardedBy("lock")
  private int pass;

  @GuardedBy("lock")
  private boolean cachingDisabled;

  @GuardedBy("lock")
  private @MonotonicNonNull IOException error;

  private BodyReplay(InputStream upstream, @Nullable Runnable releaseCallback) {
    this.upstream = requireNonNull(upstream);
    this.releaseCallback = releaseCallback;
  }

  /**
   * Reads up to {@code len} bytes into the given array. Before the upstream is drained, bytes come
   * from the upstream and are cached as they're read. Afterwards, bytes come from the cache.
   */
  public int read(byte[] b, int off, int len) throws IOException {
    checkFromIndexSize(off, len, b.length);
    lock.lock();
    try {
      return readLocked(b, off, len);
    } finally {
      lock.unlock();
    }
  }

  private int read(int expectedPass, byte[] b, int off, int len) throws IOException {
    checkFromIndexSize(off, len, b.length);
    lock.lock();
    try {
      if (pass != expectedPass) {
        throw new IOException("body has been rewound or discarded since this stream was opened");
      }
      return readLocked(b, off, len);
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private int readLocked(byte[] b, int off, int len) throws IOException {
    if (error != null) {
      throw error;
    }
    if (len == 0) {
      return 0;
    }
    return drained ? readCached(b, off, len) : readUpstream(b, off, len);
  }

  /** Reads a single byte, or returns {@code -1} if there's nothing left to read. */
  public int read() throws IOException {
    var b = new byte[1];
    int read = read(b, 0, 1);
    return read > 0 ? b[0] & 0xff : -1;
  }

  @GuardedBy("lock")
  private int readCached(byte[] b, int off, int len) {
    int available = size - cursor;
    if (available <= 0) {
      return -1;
    }

    int read = Math.min(available, len);
    System.arraycopy(buffer, cursor, b, off, read);
    cursor += read;
    return read;
  }

  @GuardedBy("lock")
  private int readUpstream(byte[] b, int off, int len) throws IOException {
    var in = requireNonNull(upstream);
    int read;
    try {
      read = in.read(b, off, len);
    } catch (IOException e) {
      fail(e);
      throw e;
    }

    if (read < 0) {
      release();
      if (error != null) {
        throw error;
      }
      return -1;
    }

    if (!cachingDisabled) {
      append(b, off, read);
      cursor = size;
    }
    return read;
  }

  /**
   * Makes the next read start from the first byte of the body. If the upstream isn't yet fully
   * read, the rest of it is read into memory first.
   *
   * @throws IllegalStateException if caching is disabled
   */
  public void rewind() throws IOException {
    lock.lock();
    try {
      ensureReplayable("rewind");
      drain();
      cursor = 0;
      pass++;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a stream over the whole body, independent of this instance's read position. If the
   * upstream isn't yet fully read, the rest of it is read into memory first.
   *
   * @throws IllegalStateException if caching is disabled
   */
  public InputStream snapshot() throws IOException {
    lock.lock();
    try {
      ensureReplayable("get a snapshot");
      drain();
      return new ByteArrayInputStream(buffer, 0, size);
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void ensureReplayable(String operation) throws IOException {
    if (error != null) {
      throw error;
    }
    requireState(!cachingDisabled, "body caching is disabled, can't %s", operation);
  }

  /**
   * Stops caching the body and drops the bytes that have already been read. Subsequent calls to
   * {@link #rewind()} and {@link #snapshot()} fail.
   */
  public void disableCaching() {
    lock.lock();
    try {
      disableCachingLocked();
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void disableCachingLocked() {
    cachingDisabled = true;
    buffer = Arrays.copyOfRange(buffer, Math.min(cursor, size), size);
    size = buffer.length;
    cursor = 0;
  }

  /**
   * Closes the upstream and runs the release callback without reading what's left of the body,
   * and drops the cached bytes. Streams of the current read pass fail afterwards, as do later
   * calls to {@link #rewind()} and {@link #snapshot()}. Unlike {@link #close()}, this method never
   * rethrows an earlier error.
   */
  public void discard() {
    lock.lock();
    try {
      disableCachingLocked();
      buffer = new byte[0];
      size = 0;
      pass++;
      release();
    } finally {
      lock.unlock();
    }
  }

  /** Returns whether the upstream has been fully read and released. */
  public boolean isDrained() {
    lock.lock();
    try {
      return drained;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a forward-only stream that reads from this instance as part of the current read pass.
   * Closing the returned stream has no effect on this instance.
   */
  public InputStream inputStream() {
    lock.lock();
    try {
      return new ReplayInputStream(pass);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads what's left of the upstream into memory, so the body can still be rewound, then closes
   * the upstream and runs the release callback if not already done. Calling this method more than
   * once has no further effect, except rethrowing the first error if one has occurred.
   */
  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (error == null && !cachingDisabled) {
        tryDrain();
      }
      release();
      if (error != null) {
        throw error;
      }
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void drain() throws IOException {
    tryDrain();
    if (error != null) {
      throw error;
    }
  }

  /** Reads the rest of the upstream into memory, remembering the error if one occurs. */
  @GuardedBy("lock")
  private void tryDrain() {
    if (drained) {
      return;
    }

    var in = requireNonNull(upstream);
    try {
      var remaining = in.readAllBytes();
      append(remaining, 0, remaining.length);
      release();
    } catch (IOException e) {
      fail(e);
    }
  }

  @GuardedBy("lock")
  private void append(byte[] b, int off, int len) {
    if (size + len > buffer.length) {
      int newCapacity = Math.max(size + len, Math.max(INITIAL_BUFFER_SIZE, 2 * size));
      buffer = Arrays.copyOf(buffer, newCapacity);
    }
    System.arraycopy(b, off, buffer, size, len);
    size += len;
  }

  @GuardedBy("lock")
  private void fail(IOException e) {
    if (error == null) {
      error = e;
    }
    release();
  }

  /** Closes the upstream and runs the release callback, once. */
  @GuardedBy("lock")
  private void release() {
    drained = true;
    var in = upstream;
    if (in == null) {
      return;
    }

    upstream = null;
    try {
      in.close();
    } catch (IOException e) {
      if (error == null) {
        error = e;
      }
    } finally {
      var callback = releaseCallback;
      releaseCallback = null;
      if (callback != null) {
        callback.run();
      }
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return Utils.toStringIdentityPrefix(this)
          + "[cached="
          + size
          + ", drained="
          + drained
          + ", cachingDisabled="
          + cachingDisabled
          + "]";
    } finally {
      lock.unlock();
    }
  }

  /** Returns a {@code BodyReplay} over the given upstream. */
  public static BodyReplay of(InputStream upstream) {
    return new BodyReplay(upstream, null);
  }

  /**
   * Returns a {@code BodyReplay} over the given upstream, running the given callback right after
   * the upstream is closed.
   */
  public static BodyReplay of(InputStream upstream, Runnable releaseCallback) {
    return new BodyReplay(upstream, requireNonNull(releaseCallback));
  }

  private final class ReplayInputStream extends InputStream {
    private final int pass;

    ReplayInputStream(int pass) {
      this.pass = pass;
    }

    @Override
    public int read() throws IOException {
      var b = new byte[1];
      int read = read(b, 0, 1);
      return read > 0 ? b[0] & 0xff : -1;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return BodyReplay.this.read(pass, b, off, len);
    }
  }
}
