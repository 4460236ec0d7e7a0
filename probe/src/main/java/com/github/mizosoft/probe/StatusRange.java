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

import java.util.Locale;
import java.util.Optional;

/** A class of HTTP status codes, as defined by the first digit of the code. */
public enum StatusRange {
  /** Informational responses, {@code 1xx}. */
  INFORMATIONAL(100),

  /** Successful responses, {@code 2xx}. */
  SUCCESSFUL(200),

  /** Redirection responses, {@code 3xx}. */
  REDIRECTION(300),

  /** Client error responses, {@code 4xx}. */
  CLIENT_ERROR(400),

  /** Server error responses, {@code 5xx}. */
  SERVER_ERROR(500);

  private final int min;

  StatusRange(int min) {
    this.min = min;
  }

  /** Returns whether the given status code belongs to this range. */
  public boolean includes(int statusCode) {
    return statusCode >= min && statusCode < min + 100;
  }

  @Override
  public String toString() {
    return (min / 100) + "xx " + name().toLowerCase(Locale.ROOT).replace('_', ' ');
  }

  /** Returns the range the given status code belongs to, if it's a valid status code. */
  public static Optional<StatusRange> of(int statusCode) {
    for (var range : values()) {
      if (range.includes(statusCode)) {
        return Optional.of(range);
      }
    }
    return Optional.empty();
  }
}
