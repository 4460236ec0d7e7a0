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

import com.github.mizosoft.probe.internal.util.Compare;
import java.time.Duration;

/**
 * A strategy for computing how long to wait before retrying a request. {@link ProbeRequest}
 * requests use {@link #exponential(Duration, Duration)} between the delays given to {@link
 * ProbeRequest#withRetryDelay(Duration, Duration)}, or {@link #none()} if the minimum delay is
 * zero.
 */
@FunctionalInterface
public interface BackoffStrategy {

  /**
   * Returns how long to wait before the next attempt, given the context of the attempt that has
   * just completed.
   */
  Duration backoff(RetryExecutor.Context<?> context);

  /** Returns a {@code BackoffStrategy} that applies no delays. */
  static BackoffStrategy none() {
    return __ -> Duration.ZERO;
  }

  /** Returns a {@code BackoffStrategy} that waits for the same delay before every retry. */
  static BackoffStrategy fixed(Duration delay) {
    requirePositiveDuration(delay);
    return __ -> delay;
  }

  /**
   * Returns a {@code BackoffStrategy} whose delay doubles with every retry, starting at {@code
   * base} and never exceeding {@code cap}.
   */
  static BackoffStrategy exponential(Duration base, Duration cap) {
    requirePositiveDuration(base);
    requirePositiveDuration(cap);
    requireArgument(
        base.compareTo(cap) <= 0,
        "Base delay (%s) must be less than or equal to cap delay (%s)",
        base,
        cap);
    return context -> {
      var delay = base;
      for (int i = 0; i < context.retryCount() && delay.compareTo(cap) < 0; i++) {
        delay = delay.multipliedBy(2);
      }
      return Compare.min(delay, cap);
    };
  }
}
