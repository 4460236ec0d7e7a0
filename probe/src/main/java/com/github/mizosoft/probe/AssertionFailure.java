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

import static com.github.mizosoft.probe.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Detailed information about a failed assertion.
 *
 * <p>{@link #type()} and {@link #errors()} are present for all failures. The {@link #actual()},
 * {@link #expected()}, {@link #reference()} and {@link #delta()} values are only present for
 * certain assertion types.
 *
 * <p>{@code actual} holds the value being examined. The meaning of {@code expected} depends on the
 * assertion type: it may be the value {@code actual} was compared to, the range it should belong
 * to, the pattern it should match, and so on. If {@code reference} is present, it holds the value
 * the check originated from. For instance, when checking that array {@code A} contains all
 * elements of array {@code B}, a failure for missing element {@code E} has {@code A} as actual,
 * {@code E} as expected and {@code B} as reference. If {@code delta} is present, it holds the
 * maximum allowed difference between {@code actual} and {@code expected}.
 *
 * <p>The severity of a failure is stamped by the {@link Chain} it is reported to.
 */
public final class AssertionFailure {
  private final AssertionType type;
  private final AssertionSeverity severity;
  private final List<Throwable> errors;
  private final @Nullable AssertionValue actual;
  private final @Nullable AssertionValue expected;
  private final @Nullable AssertionValue reference;
  private final @Nullable AssertionValue delta;

  private AssertionFailure(Builder builder) {
    this(
        builder.type,
        AssertionSeverity.FATAL,
        List.copyOf(builder.errors),
        builder.actual,
        builder.expected,
        builder.reference,
        builder.delta);
  }

  private AssertionFailure(
      AssertionType type,
      AssertionSeverity severity,
      List<Throwable> errors,
      @Nullable AssertionValue actual,
      @Nullable AssertionValue expected,
      @Nullable AssertionValue reference,
      @Nullable AssertionValue delta) {
    requireArgument(!errors.isEmpty(), "a failure must have at least one error");
    this.type = type;
    this.severity = severity;
    this.errors = errors;
    this.actual = actual;
    this.expected = expected;
    this.reference = reference;
    this.delta = delta;
  }

  public AssertionType type() {
    return type;
  }

  public AssertionSeverity severity() {
    return severity;
  }

  public boolean isFatal() {
    return severity == AssertionSeverity.FATAL;
  }

  /** Returns the errors describing this failure. The list is never empty. */
  public List<Throwable> errors() {
    return errors;
  }

  public Optional<AssertionValue> actual() {
    return Optional.ofNullable(actual);
  }

  public Optional<AssertionValue> expected() {
    return Optional.ofNullable(expected);
  }

  public Optional<AssertionValue> reference() {
    return Optional.ofNullable(reference);
  }

  public Optional<AssertionValue> delta() {
    return Optional.ofNullable(delta);
  }

  /** Returns a copy of this failure with the given severity. */
  public AssertionFailure withSeverity(AssertionSeverity severity) {
    requireNonNull(severity);
    return severity == this.severity
        ? this
        : new AssertionFailure(type, severity, errors, actual, expected, reference, delta);
  }

  @Override
  public String toString() {
    var sb = new StringBuilder("AssertionFailure[type=").append(type);
    sb.append(", severity=").append(severity);
    sb.append(", errors=").append(errors);
    if (actual != null) {
      sb.append(", actual=").append(actual);
    }
    if (expected != null) {
      sb.append(", expected=").append(expected);
    }
    if (reference != null) {
      sb.append(", reference=").append(reference);
    }
    if (delta != null) {
      sb.append(", delta=").append(delta);
    }
    return sb.append(']').toString();
  }

  /** Returns a new builder of failures with the given type. */
  public static Builder newBuilder(AssertionType type) {
    return new Builder(type);
  }

  /** A builder of {@code AssertionFailure} instances. */
  public static final class Builder {
    private final AssertionType type;
    private final List<Throwable> errors = new ArrayList<>();
    private @Nullable AssertionValue actual;
    private @Nullable AssertionValue expected;
    private @Nullable AssertionValue reference;
    private @Nullable AssertionValue delta;

    Builder(AssertionType type) {
      this.type = requireNonNull(type);
    }

    /** Adds an error with the given message. */
    @CanIgnoreReturnValue
    public Builder error(String message) {
      errors.add(new ErrorMessage(requireNonNull(message)));
      return this;
    }

    /** Adds the given error. */
    @CanIgnoreReturnValue
    public Builder error(Throwable error) {
      errors.add(requireNonNull(error, "null error"));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder actual(@Nullable Object value) {
      this.actual = AssertionValue.of(value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder expected(@Nullable Object value) {
      this.expected = AssertionValue.of(value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder reference(@Nullable Object value) {
      this.reference = AssertionValue.of(value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder delta(@Nullable Object value) {
      this.delta = AssertionValue.of(value);
      return this;
    }

    /**
     * Builds a new failure.
     *
     * @throws IllegalArgumentException if no errors were added
     */
    public AssertionFailure build() {
      return new AssertionFailure(this);
    }
  }

  /** A message-only error. */
  static final class ErrorMessage extends Exception {
    private static final long serialVersionUID = 1L;

    ErrorMessage(String message) {
      super(message, null, false, false);
    }

    @Override
    public String toString() {
      return getMessage();
    }
  }
}
