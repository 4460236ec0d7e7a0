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

import static com.github.mizosoft.probe.internal.Utils.requirePositiveDuration;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.probe.internal.Utils;
import com.github.mizosoft.probe.internal.concurrent.Delayer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A signal that tells running operations to stop. A token is owned by whoever holds its {@link
 * Source}, and can be observed by polling {@link #isCancelled()} or by {@link #register(Consumer)
 * registering} a callback. Once cancelled, a token stays cancelled.
 */
public final class CancellationToken {
  private static final CancellationToken NEVER = new CancellationToken();

  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final Set<CallbackRegistration> registrations = new LinkedHashSet<>();

  private volatile @Nullable Throwable cause;

  private CancellationToken() {}

  /** Returns whether this token has been cancelled. */
  public boolean isCancelled() {
    return cause != null;
  }

  /** Returns the cause this token has been cancelled with, if cancelled. */
  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause);
  }

  /**
   * Registers the given callback to be invoked with the cancellation cause when this token is
   * cancelled. If the token is already cancelled, the callback is invoked immediately on the
   * calling thread. Closing the returned registration detaches the callback.
   */
  public Registration register(Consumer<? super Throwable> callback) {
    requireNonNull(callback);
    if (this == NEVER) {
      return EmptyRegistration.INSTANCE;
    }

    Throwable currentCause;
    lock.lock();
    try {
      currentCause = cause;
      if (currentCause == null) {
        var registration = new CallbackRegistration(callback);
        registrations.add(registration);
        return registration;
      }
    } finally {
      lock.unlock();
    }
    callback.accept(currentCause);
    return EmptyRegistration.INSTANCE;
  }

  private boolean cancel(Throwable cause) {
    requireNonNull(cause);
    if (this == NEVER) {
      return false;
    }

    ArrayList<CallbackRegistration> callbacks;
    lock.lock();
    try {
      if (this.cause != null) {
        return false;
      }
      this.cause = cause;
      callbacks = new ArrayList<>(registrations);
      registrations.clear();
    } finally {
      lock.unlock();
    }

    RuntimeException callbackException = null;
    for (var registration : callbacks) {
      try {
        registration.callback.accept(cause);
      } catch (RuntimeException e) {
        if (callbackException == null) {
          callbackException = e;
        } else {
          callbackException.addSuppressed(e);
        }
      }
    }
    if (callbackException != null) {
      throw callbackException;
    }
    return true;
  }

  private void unregister(CallbackRegistration registration) {
    lock.lock();
    try {
      registrations.remove(registration);
    } finally {
      lock.unlock();
    }
  }

  int registrationCount() {
    lock.lock();
    try {
      return registrations.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[cancelled=" + isCancelled() + "]";
  }

  /** Returns a token that is never cancelled. */
  public static CancellationToken never() {
    return NEVER;
  }

  /** Returns a new source controlling a fresh token. */
  public static Source newSource() {
    return new Source(new CancellationToken());
  }

  /**
   * Returns a new source controlling a fresh token that is also cancelled, with the same cause,
   * when the given parent token is cancelled.
   */
  public static Source newSource(CancellationToken parent) {
    var source = newSource();
    if (parent != NEVER) {
      var registration = parent.register(source.token::cancel);
      source.token.register(__ -> registration.close());
    }
    return source;
  }

  /** A handle for a callback registered with {@link #register(Consumer)}. */
  public interface Registration extends AutoCloseable {

    /** Detaches the callback. Has no effect if the callback has already been invoked. */
    @Override
    void close();
  }

  /** The owner side of a {@code CancellationToken}. */
  public static final class Source {
    private final CancellationToken token;

    private Source(CancellationToken token) {
      this.token = token;
    }

    /** Returns the token controlled by this source. */
    public CancellationToken token() {
      return token;
    }

    /**
     * Cancels the token with a {@code CancellationException}. Returns {@code true} if this call
     * cancelled the token.
     */
    @CanIgnoreReturnValue
    public boolean cancel() {
      return token.cancel(new CancellationException("cancelled"));
    }

    /** Cancels the token with the given cause. Returns {@code true} if this call cancelled it. */
    @CanIgnoreReturnValue
    public boolean cancel(Throwable cause) {
      return token.cancel(cause);
    }

    /** Arranges for the token to be cancelled after the given delay. */
    @CanIgnoreReturnValue
    public Source cancelAfter(Duration delay) {
      return cancelAfter(delay, Delayer.defaultDelayer());
    }

    @CanIgnoreReturnValue
    Source cancelAfter(Duration delay, Delayer delayer) {
      requirePositiveDuration(delay);
      var timer =
          delayer.delay(
              () -> token.cancel(new CancellationException("cancelled after " + delay)),
              delay,
              Runnable::run);
      token.register(__ -> timer.cancel(false));
      return this;
    }

    @Override
    public String toString() {
      return Utils.toStringIdentityPrefix(this) + "[token=" + token + "]";
    }
  }

  private final class CallbackRegistration implements Registration {
    final Consumer<? super Throwable> callback;

    CallbackRegistration(Consumer<? super Throwable> callback) {
      this.callback = callback;
    }

    @Override
    public void close() {
      unregister(this);
    }
  }

  private enum EmptyRegistration implements Registration {
    INSTANCE;

    @Override
    public void close() {}
  }
}
