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

import java.net.http.HttpTimeoutException;

/**
 * Decides whether the outcome of an attempt is worth retrying. Deadline expiry and cancellation
 * are never passed to a condition, as they stop the retry loop on their own.
 */
@FunctionalInterface
public interface RetryCondition {

  /** Returns whether the attempt described by the given context should be retried. */
  boolean shouldRetry(RetryExecutor.Context<?> context);

  /** Returns a condition that never retries. */
  static RetryCondition never() {
    return Preset.NEVER;
  }

  /**
   * Returns a condition that retries attempts failing with an {@link HttpTimeoutException},
   * including attempts that exceed their own timeout.
   */
  static RetryCondition timeoutsOnly() {
    return Preset.TIMEOUTS_ONLY;
  }

  /** Returns a condition that retries timeouts and responses with a 5xx status code. */
  static RetryCondition timeoutsAndServerErrors() {
    return Preset.TIMEOUTS_AND_SERVER_ERRORS;
  }

  /** Returns a condition that retries any exception and responses with a 4xx or 5xx status code. */
  static RetryCondition allErrors() {
    return Preset.ALL_ERRORS;
  }

  private static boolean isTimeout(RetryExecutor.Context<?> context) {
    return context.exception().filter(HttpTimeoutException.class::isInstance).isPresent();
  }

  private static boolean hasStatus(RetryExecutor.Context<?> context, int min, int max) {
    return context
        .response()
        .filter(response -> response.statusCode() >= min && response.statusCode() <= max)
        .isPresent();
  }

  /** The presets, as named conditions. */
  enum Preset implements RetryCondition {
    NEVER {
      @Override
      public boolean shouldRetry(RetryExecutor.Context<?> context) {
        return false;
      }
    },

    TIMEOUTS_ONLY {
      @Override
      public boolean shouldRetry(RetryExecutor.Context<?> context) {
        return isTimeout(context);
      }
    },

    TIMEOUTS_AND_SERVER_ERRORS {
      @Override
      public boolean shouldRetry(RetryExecutor.Context<?> context) {
        return isTimeout(context) || hasStatus(context, 500, 599);
      }
    },

    ALL_ERRORS {
      @Override
      public boolean shouldRetry(RetryExecutor.Context<?> context) {
        return context.exception().isPresent() || hasStatus(context, 400, 599);
      }
    }
  }
}
