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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An inclusive range of allowed values, used as the expected value of range assertions. */
public final class AssertionRange {
  private final Object min;
  private final Object max;

  private AssertionRange(Object min, Object max) {
    this.min = requireNonNull(min);
    this.max = requireNonNull(max);
  }

  public Object min() {
    return min;
  }

  public Object max() {
    return max;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof AssertionRange)) {
      return false;
    }
    var other = (AssertionRange) obj;
    return min.equals(other.min) && max.equals(other.max);
  }

  @Override
  public int hashCode() {
    return Objects.hash(min, max);
  }

  @Override
  public String toString() {
    return "[" + min + "; " + max + "]";
  }

  public static AssertionRange of(Object min, Object max) {
    return new AssertionRange(min, max);
  }
}
