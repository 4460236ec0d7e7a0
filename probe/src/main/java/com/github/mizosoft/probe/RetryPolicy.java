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
import static com.github.mizosoft.probe.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.time.Duration;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Specifies how a {@link RetryExecutor} retries a request. A policy is immutable, and is created
 * with a {@link Builder}.
 */
public final class RetryPolicy {
  static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(50);
  static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);

  private static final RetryPolicy DEFAULT = newBuilder().build();

  private final int maxAttempts;
  private final RetryCondition condition;
  private final BackoffStrategy backoff;
  private final @Nullable Duration attemptTimeout;
  private final @Nullable Duration timeout;

  private RetryPolicy(Builder builder) {
    this.maxAttempts = Math.max(1, builder.maxAttempts);
    this.condition = builder.condition;
    this.backoff = builder.backoff;
    this.attemptTimeout = builder.attemptTimeout;
    this.timeout = builder.timeout;
  }

  /** Returns the maximum number of attempts, which is at least one. */
  public int maxAttempts() {
    return maxAttempts;
  }

  public RetryCondition condition() {
    return condition;
  }

  public BackoffStrategy backoff() {
    return backoff;
  }

  /** Returns the timeout of each attempt, if any. */
  public Optional<Duration> attemptTimeout() {
    return Optional.ofNullable(attemptTimeout);
  }

  /** Returns the timeout of the whole retry process, if any. */
  public Optional<Duration> timeout() {
    return Optional.ofNullable(timeout);
  }

  /** Returns a builder initialized with this policy's values. */
  public Builder toBuilder() {
    var builder = new Builder().maxAttempts(maxAttempts).condition(condition).backoff(backoff);
    if (attemptTimeout != null) {
      builder.attemptTimeout(attemptTimeout);
    }
    if (timeout != null) {
      builder.timeout(timeout);
    }
    return builder;
  }

  @Override
  public String toString() {
    return "RetryPolicy[maxAttempts="
        + maxAttempts
        + ", condition="
        + condition
        + ", attemptTimeout="
        + attemptTimeout
        + ", timeout="
        + timeout
        + "]";
  }

  /**
   * Returns the default policy, which makes a single attempt. When more attempts are allowed,
   * timeouts and server errors are retried with an exponential backoff from 50 milliseconds to 5
   * seconds.
   */
  public static RetryPolicy defaultPolicy() {
    return DEFAULT;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code RetryPolicy} instances. */
  public static final class Builder {
    private int maxAttempts = 1;
    private RetryCondition condition = RetryCondition.timeoutsAndServerErrors();
    private BackoffStrategy backoff =
        BackoffStrategy.exponential(DEFAULT_MIN_DELAY, DEFAULT_MAX_DELAY);
    private @Nullable Duration attemptTimeout;
    private @Nullable Duration timeout;

    Builder() {}

    /**
     * Sets the maximum number of attempts, including the first one. Both {@code 0} and {@code 1}
     * mean the request is sent exactly once.
     */
    @CanIgnoreReturnValue
    public Builder maxAttempts(int maxAttempts) {
      requireArgument(maxAttempts >= 0, "negative maxAttempts: %d", maxAttempts);
      this.maxAttempts = maxAttempts;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder condition(RetryCondition condition) {
      this.condition = requireNonNull(condition);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder backoff(BackoffStrategy backoff) {
      this.backoff = requireNonNull(backoff);
      return this;
    }

    /** Sets the timeout of each attempt. An attempt exceeding it fails, and may be retried. */
    @CanIgnoreReturnValue
    public Builder attemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = requirePositiveDuration(attemptTimeout);
      return this;
    }

    /**
     * Sets the timeout of the whole retry process, measured from the start of the first attempt.
     * Reaching it stops retrying with a {@link DeadlineExceededException}.
     */
    @CanIgnoreReturnValue
    public Builder timeout(Duration timeout) {
      this.timeout = requirePositiveDuration(timeout);
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
